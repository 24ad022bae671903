package com.example.sandstormtracker.a2s;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Buffers split-response fragments per request id until the set is complete.
 * Sets that stay incomplete longer than the fragment timeout are discarded.
 */
@Slf4j
public class FragmentAssembler {

    private final Clock clock;
    private final Duration timeout;
    private final Map<Integer, PendingSet> pending = new HashMap<>();

    public FragmentAssembler(Clock clock, Duration timeout) {
        this.clock = clock;
        this.timeout = timeout;
    }

    /**
     * @return the reassembled response once the last missing fragment arrives
     */
    public Optional<byte[]> offer(A2SFragment fragment) throws A2SMalformedResponseException {
        purgeExpired();

        PendingSet set = pending.computeIfAbsent(fragment.getRequestId(),
                id -> new PendingSet(fragment.getTotal(), clock.instant()));
        if (set.parts.length != fragment.getTotal()) {
            pending.remove(fragment.getRequestId());
            throw new A2SMalformedResponseException(String.format(
                    "Fragment count changed for request %d: %d then %d",
                    fragment.getRequestId(), set.parts.length, fragment.getTotal()));
        }
        if (set.parts[fragment.getNumber()] == null) {
            set.parts[fragment.getNumber()] = fragment.getPayload();
            set.received++;
        }
        if (set.received < set.parts.length) {
            return Optional.empty();
        }

        pending.remove(fragment.getRequestId());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : set.parts) {
            out.write(part, 0, part.length);
        }
        return Optional.of(out.toByteArray());
    }

    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(timeout);
        Iterator<Map.Entry<Integer, PendingSet>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, PendingSet> entry = it.next();
            if (entry.getValue().firstSeen.isBefore(cutoff)) {
                log.debug("Discarding incomplete fragment set {} ({}/{} received)",
                        entry.getKey(), entry.getValue().received, entry.getValue().parts.length);
                it.remove();
            }
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    private static class PendingSet {
        private final byte[][] parts;
        private final Instant firstSeen;
        private int received;

        PendingSet(int total, Instant firstSeen) {
            this.parts = new byte[total][];
            this.firstSeen = firstSeen;
        }
    }
}
