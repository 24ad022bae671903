package com.example.sandstormtracker.service;

import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.ServerStatus;
import com.example.sandstormtracker.parser.EventParser;
import com.example.sandstormtracker.persistence.InMemoryStatsStore;
import com.example.sandstormtracker.persistence.TrackerPersistenceService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class IngestionOrchestratorTest {

    @TempDir
    Path dir;

    @Mock
    private TrackerPersistenceService persistence;

    private TrackerConfig config;
    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        config = new TrackerConfig();
        config.setAutostart(false);
        config.getTailer().setPollIntervalMs(20);
        config.getServers().add(entry("alpha", true));
        config.getServers().add(entry("bravo", false));
        config.getServers().add(entry("alpha", true));

        Clock clock = Clock.systemUTC();
        InMemoryStatsStore store = new InMemoryStatsStore();
        orchestrator = new IngestionOrchestrator(config, EventParser.withDefaultMatchers(),
                new StatsAggregator(store, TransactionOperations.withoutTransaction(), config),
                store, persistence, new TrackerEventLog(clock), clock);
        orchestrator.init();
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private TrackerConfig.ServerEntry entry(String name, boolean enabled) {
        TrackerConfig.ServerEntry entry = new TrackerConfig.ServerEntry();
        entry.setName(name);
        entry.setLogPath(dir.resolve(name + ".log").toString());
        entry.setEnabled(enabled);
        return entry;
    }

    @Test
    void testOnlyEnabledUniqueServersAreRegistered() {
        List<ServerStatus> statuses = orchestrator.getStatus();

        assertEquals(1, statuses.size());
        assertEquals("alpha", statuses.get(0).getServerId());
        assertFalse(statuses.get(0).isRunning());
        assertFalse(statuses.get(0).isQueryEnabled());
    }

    @Test
    void testStartAndStopSingleServer() {
        orchestrator.start("alpha");
        assertTrue(orchestrator.getStatus("alpha").isRunning());

        orchestrator.stop("alpha");
        assertFalse(orchestrator.getStatus("alpha").isRunning());
    }

    @Test
    void testUnknownOrDisabledServerIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.start("charlie"));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.stop("bravo"));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.getStatus("bravo"));
    }
}
