package com.example.sandstormtracker.a2s;

import com.example.sandstormtracker.model.LiveSnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Queries one server at a fixed rate. A tick that finds the previous query still running is skipped.
 */
@Slf4j
public class A2SPoller {

    private final String serverId;
    private final String address;
    private final A2SClient client;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService queryExecutor;
    private final Consumer<LiveSnapshot> sink;
    private final long intervalMs;

    private final AtomicBoolean busy = new AtomicBoolean(false);
    private volatile boolean running;
    private ScheduledFuture<?> tickTask;
    private volatile Future<?> inFlight;

    @Getter
    private final AtomicLong skippedTicks = new AtomicLong();
    @Getter
    private final AtomicLong completedQueries = new AtomicLong();
    @Getter
    private volatile LiveSnapshot lastSnapshot;

    public A2SPoller(String serverId, String address, A2SClient client,
                     ScheduledExecutorService scheduler, ExecutorService queryExecutor,
                     Consumer<LiveSnapshot> sink, long intervalMs) {
        this.serverId = serverId;
        this.address = address;
        this.client = client;
        this.scheduler = scheduler;
        this.queryExecutor = queryExecutor;
        this.sink = sink;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        tickTask = scheduler.scheduleAtFixedRate(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[{}] Polling {} every {} ms", serverId, address, intervalMs);
    }

    /**
     * Stops ticking and abandons any query in flight; its result is never delivered.
     */
    public synchronized void stop() {
        running = false;
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        Future<?> current = inFlight;
        if (current != null && current.cancel(true)) {
            // a query cancelled before it ran never reaches its finally block
            busy.set(false);
        }
        log.info("[{}] Poller stopped", serverId);
    }

    void tick() {
        if (!running) {
            return;
        }
        if (!busy.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            log.debug("[{}] Previous query still running, skipping tick", serverId);
            return;
        }
        try {
            inFlight = queryExecutor.submit(this::runQuery);
        } catch (RejectedExecutionException e) {
            busy.set(false);
            log.warn("[{}] Query executor rejected poll: {}", serverId, e.getMessage());
        }
    }

    private void runQuery() {
        try {
            LiveSnapshot snapshot = client.query(serverId, address);
            completedQueries.incrementAndGet();
            if (!running) {
                return;
            }
            lastSnapshot = snapshot;
            sink.accept(snapshot);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error during query: {}", serverId, e.getMessage(), e);
        } finally {
            busy.set(false);
        }
    }

    public boolean isBusy() {
        return busy.get();
    }
}
