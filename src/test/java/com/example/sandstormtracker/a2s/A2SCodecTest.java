package com.example.sandstormtracker.a2s;

import com.example.sandstormtracker.model.ServerDetails;
import com.example.sandstormtracker.model.SnapshotPlayer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for A2SCodec.
 */
class A2SCodecTest {

    @Test
    void testInfoRequestWithoutChallenge() {
        byte[] request = A2SCodec.infoRequest(null);

        assertEquals(25, request.length);
        assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x54},
                Arrays.copyOf(request, 5));
        assertEquals("Source Engine Query\0",
                new String(request, 5, 20, StandardCharsets.US_ASCII));
    }

    @Test
    void testInfoRequestAppendsChallengeLittleEndian() {
        byte[] request = A2SCodec.infoRequest(0x11223344);

        assertEquals(29, request.length);
        assertArrayEquals(new byte[]{0x44, 0x33, 0x22, 0x11}, Arrays.copyOfRange(request, 25, 29));
    }

    @Test
    void testPlayerRequestAsksForChallenge() {
        assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x55,
                        (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF},
                A2SCodec.playerRequest(A2SCodec.NO_CHALLENGE));
    }

    @Test
    void testDecodeChallenge() throws A2SException {
        byte[] response = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x41, 0x44, 0x33, 0x22, 0x11};

        assertEquals(A2SCodec.S2A_CHALLENGE, A2SCodec.responseType(response));
        assertEquals(0x11223344, A2SCodec.decodeChallenge(response));
    }

    @Test
    void testDecodeInfo() throws A2SException {
        ServerDetails details = A2SCodec.decodeInfo(A2SPackets.info("My Server", "Ministry", 5, 28));

        assertEquals(17, details.getProtocol());
        assertEquals("My Server", details.getName());
        assertEquals("Ministry", details.getMap());
        assertEquals(5, details.getPlayers());
        assertEquals(28, details.getMaxPlayers());
        assertEquals("1.0.0.0", details.getVersion());
    }

    @Test
    void testDecodePlayersIgnoresCount() throws A2SException {
        byte[] response = A2SPackets.single(A2SCodec.S2A_PLAYER)
                .int8(0)
                .player("Alice", 12, 301.5f)
                .player("Bob", 0, 4.0f)
                .build();

        List<SnapshotPlayer> players = A2SCodec.decodePlayers(response);

        assertEquals(2, players.size());
        assertEquals("Alice", players.get(0).getName());
        assertEquals(12, players.get(0).getScore());
        assertEquals(301.5f, players.get(0).getDurationSeconds());
        assertEquals("Bob", players.get(1).getName());
    }

    @Test
    void testDecodeEmptyPlayerList() throws A2SException {
        byte[] response = A2SPackets.single(A2SCodec.S2A_PLAYER).int8(0).build();

        assertTrue(A2SCodec.decodePlayers(response).isEmpty());
    }

    @Test
    void testTruncatedPlayerEntryIsMalformed() {
        byte[] response = A2SPackets.single(A2SCodec.S2A_PLAYER)
                .int8(1)
                .int8(0)
                .string("Alice")
                .int32(3)
                .build();

        assertThrows(A2SMalformedResponseException.class, () -> A2SCodec.decodePlayers(response));
    }

    @Test
    void testShortOrMisframedResponsesAreMalformed() {
        assertThrows(A2SMalformedResponseException.class, () -> A2SCodec.responseType(new byte[]{1, 2}));
        assertThrows(A2SMalformedResponseException.class,
                () -> A2SCodec.responseType(new byte[]{0, 0, 0, 0, 0x49}));
        assertThrows(A2SMalformedResponseException.class,
                () -> A2SCodec.decodeInfo(A2SPackets.challenge(7)));
    }

    @Test
    void testTruncatedInfoIsMalformed() {
        byte[] full = A2SPackets.info("My Server", "Ministry", 5, 28);
        byte[] truncated = Arrays.copyOf(full, 20);

        assertThrows(A2SMalformedResponseException.class, () -> A2SCodec.decodeInfo(truncated));
    }

    @Test
    void testParseFragment() throws A2SException {
        byte[] packet = A2SPackets.fragment(42, 3, 1, new byte[]{9, 8, 7});

        assertTrue(A2SCodec.isSplit(packet));
        A2SFragment fragment = A2SCodec.parseFragment(packet);
        assertEquals(42, fragment.getRequestId());
        assertEquals(3, fragment.getTotal());
        assertEquals(1, fragment.getNumber());
        assertArrayEquals(new byte[]{9, 8, 7}, fragment.getPayload());
    }

    @Test
    void testRejectsBadFragments() {
        assertThrows(A2SMalformedResponseException.class,
                () -> A2SCodec.parseFragment(A2SPackets.fragment(0x80000001, 2, 0, new byte[]{1})));
        assertThrows(A2SMalformedResponseException.class,
                () -> A2SCodec.parseFragment(A2SPackets.fragment(1, 2, 2, new byte[]{1})));
        assertThrows(A2SMalformedResponseException.class,
                () -> A2SCodec.parseFragment(A2SPackets.fragment(1, 0, 0, new byte[]{1})));
        assertThrows(A2SMalformedResponseException.class,
                () -> A2SCodec.parseFragment(new byte[]{(byte) 0xFE, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 1}));
    }
}
