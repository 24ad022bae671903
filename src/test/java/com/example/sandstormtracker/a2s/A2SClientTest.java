package com.example.sandstormtracker.a2s;

import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.LiveSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests A2SClient against a fake query server on the loopback interface.
 */
class A2SClientTest {

    private static final int CHALLENGE = 0x5A5A1234;

    private TrackerConfig.Query config;
    private DatagramSocket server;
    private Thread serverThread;

    @BeforeEach
    void setUp() throws SocketException {
        config = new TrackerConfig.Query();
        config.setTimeoutMs(300);
        config.setMaxRetries(2);
        config.setInitialBackoffMs(10);
        server = new DatagramSocket(0, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        server.close();
        if (serverThread != null) {
            serverThread.join(2_000);
        }
    }

    private String address() {
        return "127.0.0.1:" + server.getLocalPort();
    }

    @Test
    void testChallengeFlowWithSplitPlayerResponse() {
        List<byte[]> requests = Collections.synchronizedList(new ArrayList<>());
        serverThread = new Thread(() -> serveChallengeFlow(requests), "fake-a2s");
        serverThread.start();

        A2SClient client = new A2SClient(config, Clock.systemUTC());
        LiveSnapshot snapshot = client.query("srv", address());

        assertTrue(snapshot.isReachable(), snapshot.getFailure());
        assertEquals("Ministry", snapshot.getDetails().getMap());
        assertEquals(2, snapshot.getPlayers().size());
        assertEquals("Alice", snapshot.getPlayers().get(0).getName());
        assertEquals("Bob", snapshot.getPlayers().get(1).getName());

        assertEquals(4, requests.size());
        assertArrayEquals(A2SCodec.infoRequest(null), requests.get(0));
        assertArrayEquals(A2SCodec.infoRequest(CHALLENGE), requests.get(1));
        assertArrayEquals(A2SCodec.playerRequest(A2SCodec.NO_CHALLENGE), requests.get(2));
        assertArrayEquals(A2SCodec.playerRequest(CHALLENGE), requests.get(3));
    }

    @Test
    void testSilentServerIsUnreachableAfterAllAttempts() throws IOException {
        A2SClient client = new A2SClient(config, Clock.systemUTC());

        LiveSnapshot snapshot = client.query("srv", address());

        assertFalse(snapshot.isReachable());
        assertNotNull(snapshot.getFailure());
        assertNull(snapshot.getDetails());
        assertTrue(snapshot.getPlayers().isEmpty());
        assertEquals(config.getMaxRetries() + 1, drainRequests());
    }

    @Test
    void testInvalidAddressIsUnreachableWithoutSending() {
        A2SClient client = new A2SClient(config, Clock.systemUTC());

        LiveSnapshot snapshot = client.query("srv", "no-port-here");

        assertFalse(snapshot.isReachable());
        assertEquals("srv", snapshot.getServerId());
    }

    @Test
    void testParseAddress() {
        InetSocketAddress address = A2SClient.parseAddress("10.0.0.5:27131");

        assertEquals("10.0.0.5", address.getHostString());
        assertEquals(27131, address.getPort());
        assertThrows(IllegalArgumentException.class, () -> A2SClient.parseAddress("10.0.0.5:"));
        assertThrows(IllegalArgumentException.class, () -> A2SClient.parseAddress("10.0.0.5:abc"));
        assertThrows(IllegalArgumentException.class, () -> A2SClient.parseAddress(null));
    }

    private int drainRequests() throws IOException {
        server.setSoTimeout(200);
        int count = 0;
        byte[] buffer = new byte[1400];
        while (true) {
            try {
                server.receive(new DatagramPacket(buffer, buffer.length));
                count++;
            } catch (SocketTimeoutException e) {
                return count;
            }
        }
    }

    private void serveChallengeFlow(List<byte[]> requests) {
        byte[] players = A2SPackets.single(A2SCodec.S2A_PLAYER)
                .int8(2)
                .player("Alice", 10, 120.0f)
                .player("Bob", 3, 60.0f)
                .build();
        int half = players.length / 2;
        byte[] buffer = new byte[1400];
        try {
            for (int i = 0; i < 4; i++) {
                DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
                server.receive(packet);
                byte[] request = Arrays.copyOf(packet.getData(), packet.getLength());
                requests.add(request);
                switch (i) {
                    case 0:
                    case 2:
                        reply(packet, A2SPackets.challenge(CHALLENGE));
                        break;
                    case 1:
                        reply(packet, A2SPackets.info("Test Server", "Ministry", 2, 28));
                        break;
                    default:
                        reply(packet, A2SPackets.fragment(77, 2, 1, Arrays.copyOfRange(players, half, players.length)));
                        reply(packet, A2SPackets.fragment(77, 2, 0, Arrays.copyOfRange(players, 0, half)));
                        break;
                }
            }
        } catch (IOException e) {
            // socket closed by tearDown
        }
    }

    private void reply(DatagramPacket request, byte[] response) throws IOException {
        server.send(new DatagramPacket(response, response.length, request.getSocketAddress()));
    }
}
