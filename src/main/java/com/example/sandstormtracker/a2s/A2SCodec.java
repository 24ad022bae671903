package com.example.sandstormtracker.a2s;

import com.example.sandstormtracker.model.ServerDetails;
import com.example.sandstormtracker.model.SnapshotPlayer;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encoding and decoding of Source query packets. All integers are little endian.
 */
public final class A2SCodec {

    public static final int SINGLE_PACKET = 0xFFFFFFFF;
    public static final int SPLIT_PACKET = 0xFFFFFFFE;

    public static final byte A2S_INFO = 0x54;
    public static final byte A2S_PLAYER = 0x55;

    public static final byte S2A_CHALLENGE = 0x41;
    public static final byte S2A_INFO = 0x49;
    public static final byte S2A_PLAYER = 0x44;

    public static final int NO_CHALLENGE = -1;

    private static final byte[] INFO_PAYLOAD = "Source Engine Query\0".getBytes(StandardCharsets.US_ASCII);

    private A2SCodec() {
    }

    // ==================== Requests ====================

    /**
     * A2S_INFO request, with the challenge appended when the server demanded one.
     */
    public static byte[] infoRequest(Integer challenge) {
        ByteBuffer buffer = le(ByteBuffer.allocate(5 + INFO_PAYLOAD.length + (challenge != null ? 4 : 0)));
        buffer.putInt(SINGLE_PACKET);
        buffer.put(A2S_INFO);
        buffer.put(INFO_PAYLOAD);
        if (challenge != null) {
            buffer.putInt(challenge);
        }
        return buffer.array();
    }

    /**
     * A2S_PLAYER request. Use {@link #NO_CHALLENGE} to ask for a challenge.
     */
    public static byte[] playerRequest(int challenge) {
        ByteBuffer buffer = le(ByteBuffer.allocate(9));
        buffer.putInt(SINGLE_PACKET);
        buffer.put(A2S_PLAYER);
        buffer.putInt(challenge);
        return buffer.array();
    }

    // ==================== Packet framing ====================

    public static boolean isSplit(byte[] packet) {
        return packet.length >= 4 && le(ByteBuffer.wrap(packet)).getInt() == SPLIT_PACKET;
    }

    /**
     * Split header: int32 -2, int32 request id, byte total, byte number, int16 max packet size.
     */
    public static A2SFragment parseFragment(byte[] packet) throws A2SMalformedResponseException {
        try {
            ByteBuffer buffer = le(ByteBuffer.wrap(packet));
            if (buffer.getInt() != SPLIT_PACKET) {
                throw new A2SMalformedResponseException("Not a split packet");
            }
            int requestId = buffer.getInt();
            if ((requestId & 0x80000000) != 0) {
                throw new A2SMalformedResponseException("Compressed split responses are not supported");
            }
            int total = buffer.get() & 0xFF;
            int number = buffer.get() & 0xFF;
            buffer.getShort();
            if (total == 0 || number >= total) {
                throw new A2SMalformedResponseException(
                        String.format("Bad fragment numbering %d/%d", number, total));
            }
            byte[] payload = Arrays.copyOfRange(packet, buffer.position(), packet.length);
            return new A2SFragment(requestId, total, number, payload);
        } catch (BufferUnderflowException e) {
            throw new A2SMalformedResponseException("Truncated split header", e);
        }
    }

    /**
     * Response type byte of a complete (single or reassembled) response.
     */
    public static byte responseType(byte[] response) throws A2SMalformedResponseException {
        if (response.length < 5) {
            throw new A2SMalformedResponseException("Response too short: " + response.length + " bytes");
        }
        if (le(ByteBuffer.wrap(response)).getInt() != SINGLE_PACKET) {
            throw new A2SMalformedResponseException("Missing single-packet header");
        }
        return response[4];
    }

    // ==================== Responses ====================

    public static int decodeChallenge(byte[] response) throws A2SMalformedResponseException {
        ByteBuffer buffer = body(response, S2A_CHALLENGE);
        try {
            return buffer.getInt();
        } catch (BufferUnderflowException e) {
            throw new A2SMalformedResponseException("Truncated challenge", e);
        }
    }

    public static ServerDetails decodeInfo(byte[] response) throws A2SMalformedResponseException {
        ByteBuffer buffer = body(response, S2A_INFO);
        try {
            ServerDetails details = new ServerDetails();
            details.setProtocol(buffer.get() & 0xFF);
            details.setName(readString(buffer));
            details.setMap(readString(buffer));
            details.setFolder(readString(buffer));
            details.setGame(readString(buffer));
            details.setAppId(buffer.getShort() & 0xFFFF);
            details.setPlayers(buffer.get() & 0xFF);
            details.setMaxPlayers(buffer.get() & 0xFF);
            details.setBots(buffer.get() & 0xFF);
            // server type, environment, visibility, VAC
            buffer.position(buffer.position() + 4);
            details.setVersion(readString(buffer));
            // Extra data flag fields are not used.
            return details;
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new A2SMalformedResponseException("Truncated info response", e);
        }
    }

    /**
     * Reads players until the buffer is exhausted. The count byte is not trusted; some servers
     * report 0 while listing players.
     */
    public static List<SnapshotPlayer> decodePlayers(byte[] response) throws A2SMalformedResponseException {
        ByteBuffer buffer = body(response, S2A_PLAYER);
        List<SnapshotPlayer> players = new ArrayList<>();
        try {
            buffer.get();
            while (buffer.hasRemaining()) {
                buffer.get();
                String name = readString(buffer);
                int score = buffer.getInt();
                float duration = buffer.getFloat();
                players.add(new SnapshotPlayer(name, score, duration));
            }
        } catch (BufferUnderflowException e) {
            throw new A2SMalformedResponseException("Truncated player entry after " + players.size() + " players", e);
        }
        return players;
    }

    private static ByteBuffer body(byte[] response, byte expectedType) throws A2SMalformedResponseException {
        byte type = responseType(response);
        if (type != expectedType) {
            throw new A2SMalformedResponseException(
                    String.format("Unexpected response type 0x%02x, expected 0x%02x", type, expectedType));
        }
        ByteBuffer buffer = le(ByteBuffer.wrap(response));
        buffer.position(5);
        return buffer;
    }

    private static String readString(ByteBuffer buffer) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (true) {
            byte b = buffer.get();
            if (b == 0) {
                break;
            }
            out.write(b);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private static ByteBuffer le(ByteBuffer buffer) {
        return buffer.order(ByteOrder.LITTLE_ENDIAN);
    }
}
