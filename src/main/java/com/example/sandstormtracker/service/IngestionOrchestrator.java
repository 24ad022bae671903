package com.example.sandstormtracker.service;

import com.example.sandstormtracker.a2s.A2SClient;
import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.ServerStatus;
import com.example.sandstormtracker.model.ServerTarget;
import com.example.sandstormtracker.model.TrackerMessage;
import com.example.sandstormtracker.parser.EventParser;
import com.example.sandstormtracker.persistence.StatsStore;
import com.example.sandstormtracker.persistence.TrackerPersistenceService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns one {@link ServerPipeline} per enabled server and their lifecycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionOrchestrator {

    private final TrackerConfig config;
    private final EventParser parser;
    private final StatsAggregator aggregator;
    private final StatsStore store;
    private final TrackerPersistenceService persistence;
    private final TrackerEventLog eventLog;
    private final Clock clock;

    private final Map<String, ServerPipeline> pipelines = new LinkedHashMap<>();
    private ScheduledExecutorService scheduler;
    private ExecutorService queryExecutor;

    @PostConstruct
    public void init() {
        List<ServerTarget> targets = new ArrayList<>();
        for (TrackerConfig.ServerEntry entry : config.getServers()) {
            targets.add(new ServerTarget(entry.getName(), entry.getLogPath(), entry.isEnabled(),
                    entry.getQueryAddress()));
        }

        int threads = Math.max(2, targets.size() * 2);
        scheduler = Executors.newScheduledThreadPool(threads);
        queryExecutor = Executors.newCachedThreadPool();
        A2SClient queryClient = new A2SClient(config.getQuery(), clock);

        for (ServerTarget target : targets) {
            if (!target.isEnabled()) {
                log.info("Server {} is disabled, not registering", target.getName());
                continue;
            }
            if (pipelines.containsKey(target.getName())) {
                log.warn("Duplicate server name {}, ignoring {}", target.getName(), target);
                continue;
            }
            pipelines.put(target.getName(), createPipeline(target, queryClient));
        }
        log.info("Registered {} server pipeline(s): {}", pipelines.size(), pipelines.keySet());

        if (config.isAutostart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ingestion");
        stop();
        scheduler.shutdown();
        queryExecutor.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }

    private ServerPipeline createPipeline(ServerTarget target, A2SClient queryClient) {
        String serverId = target.getName();
        BlockingQueue<TrackerMessage> queue = new ArrayBlockingQueue<>(config.getTailer().getQueueCapacity());
        IdentityResolver identities = new IdentityResolver(serverId, config.getMatching(), eventLog);
        MatchTracker tracker = new MatchTracker(serverId, queue, identities, aggregator, store, persistence,
                eventLog, config.getAggregation(), clock);
        return new ServerPipeline(target, config, queue, tracker, queryClient, parser, persistence, eventLog,
                scheduler, queryExecutor, clock);
    }

    // ==================== Lifecycle ====================

    public void start() {
        for (ServerPipeline pipeline : snapshot()) {
            startQuietly(pipeline);
        }
    }

    public void stop() {
        for (ServerPipeline pipeline : snapshot()) {
            try {
                pipeline.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop pipeline {}: {}", pipeline.getTarget().getName(), e.getMessage(), e);
            }
        }
    }

    /**
     * @throws IllegalArgumentException for an unknown or disabled server
     */
    public void start(String serverId) {
        lookup(serverId).start();
    }

    /**
     * @throws IllegalArgumentException for an unknown or disabled server
     */
    public void stop(String serverId) {
        lookup(serverId).stop();
    }

    public List<ServerStatus> getStatus() {
        List<ServerStatus> statuses = new ArrayList<>();
        for (ServerPipeline pipeline : snapshot()) {
            statuses.add(pipeline.getStatus());
        }
        return statuses;
    }

    public ServerStatus getStatus(String serverId) {
        return lookup(serverId).getStatus();
    }

    private void startQuietly(ServerPipeline pipeline) {
        try {
            pipeline.start();
        } catch (RuntimeException e) {
            // One server failing to start must not keep the others down.
            log.error("Failed to start pipeline {}: {}", pipeline.getTarget().getName(), e.getMessage(), e);
        }
    }

    private ServerPipeline lookup(String serverId) {
        ServerPipeline pipeline;
        synchronized (pipelines) {
            pipeline = pipelines.get(serverId);
        }
        if (pipeline == null) {
            throw new IllegalArgumentException("Unknown server: " + serverId);
        }
        return pipeline;
    }

    private Collection<ServerPipeline> snapshot() {
        synchronized (pipelines) {
            return new ArrayList<>(pipelines.values());
        }
    }
}
