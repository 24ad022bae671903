package com.example.sandstormtracker.a2s;

import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.LiveSnapshot;
import com.example.sandstormtracker.model.ServerDetails;
import com.example.sandstormtracker.model.SnapshotPlayer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * UDP Source query client. One {@link #query} performs an info and a player query, answering
 * challenges as needed, and retries failed attempts with exponential backoff.
 */
@Slf4j
public class A2SClient {

    private static final int MAX_PACKET = 1400;

    private final TrackerConfig.Query config;
    private final Clock clock;

    public A2SClient(TrackerConfig.Query config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Never throws for protocol or network failures; those produce an unreachable snapshot.
     */
    public LiveSnapshot query(String serverId, String address) {
        InetSocketAddress target;
        try {
            target = parseAddress(address);
        } catch (IllegalArgumentException e) {
            log.error("[{}] Invalid query address '{}': {}", serverId, address, e.getMessage());
            return LiveSnapshot.unreachable(serverId, clock.instant(), e.getMessage());
        }

        A2SException lastFailure = null;
        for (int attempt = 0; attempt <= config.getMaxRetries(); attempt++) {
            if (attempt > 0) {
                long backoff = config.getInitialBackoffMs() << (attempt - 1);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return LiveSnapshot.unreachable(serverId, clock.instant(), "query interrupted");
                }
            }
            try {
                return queryOnce(serverId, target);
            } catch (A2SException e) {
                lastFailure = e;
                log.debug("[{}] Query attempt {} to {} failed: {}", serverId, attempt + 1, address, e.getMessage());
            }
        }

        String failure = lastFailure != null ? lastFailure.getMessage() : "unknown";
        log.warn("[{}] Server {} unreachable after {} attempts: {}",
                serverId, address, config.getMaxRetries() + 1, failure);
        return LiveSnapshot.unreachable(serverId, clock.instant(), failure);
    }

    LiveSnapshot queryOnce(String serverId, InetSocketAddress target) throws A2SException {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.setSoTimeout(config.getTimeoutMs());
            socket.connect(target);
            FragmentAssembler assembler = new FragmentAssembler(clock, Duration.ofMillis(config.getFragmentTimeoutMs()));

            ServerDetails details = queryInfo(socket, assembler);
            List<SnapshotPlayer> players = queryPlayers(socket, assembler);
            return LiveSnapshot.of(serverId, clock.instant(), details, players);
        } catch (IOException e) {
            throw new A2SException("I/O error talking to " + target + ": " + e.getMessage(), e);
        }
    }

    private ServerDetails queryInfo(DatagramSocket socket, FragmentAssembler assembler)
            throws IOException, A2SException {
        send(socket, A2SCodec.infoRequest(null));
        byte[] response = receive(socket, assembler);
        if (A2SCodec.responseType(response) == A2SCodec.S2A_CHALLENGE) {
            send(socket, A2SCodec.infoRequest(A2SCodec.decodeChallenge(response)));
            response = receive(socket, assembler);
        }
        return A2SCodec.decodeInfo(response);
    }

    private List<SnapshotPlayer> queryPlayers(DatagramSocket socket, FragmentAssembler assembler)
            throws IOException, A2SException {
        send(socket, A2SCodec.playerRequest(A2SCodec.NO_CHALLENGE));
        byte[] response = receive(socket, assembler);
        if (A2SCodec.responseType(response) == A2SCodec.S2A_CHALLENGE) {
            send(socket, A2SCodec.playerRequest(A2SCodec.decodeChallenge(response)));
            response = receive(socket, assembler);
        }
        return A2SCodec.decodePlayers(response);
    }

    private void send(DatagramSocket socket, byte[] request) throws IOException {
        socket.send(new DatagramPacket(request, request.length));
    }

    /**
     * Receives one complete response, collecting split fragments as needed.
     */
    private byte[] receive(DatagramSocket socket, FragmentAssembler assembler) throws IOException, A2SException {
        byte[] buffer = new byte[MAX_PACKET];
        while (true) {
            DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
            try {
                socket.receive(packet);
            } catch (SocketTimeoutException e) {
                throw new A2STimeoutException("No response within " + config.getTimeoutMs() + " ms", e);
            }
            byte[] data = Arrays.copyOf(packet.getData(), packet.getLength());
            if (!A2SCodec.isSplit(data)) {
                return data;
            }
            Optional<byte[]> complete = assembler.offer(A2SCodec.parseFragment(data));
            if (complete.isPresent()) {
                return complete.get();
            }
        }
    }

    static InetSocketAddress parseAddress(String address) {
        if (address == null) {
            throw new IllegalArgumentException("no address");
        }
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("expected host:port");
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad port in " + address, e);
        }
        return new InetSocketAddress(address.substring(0, colon), port);
    }
}
