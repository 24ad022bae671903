package com.example.sandstormtracker.controller;

import com.example.sandstormtracker.model.ServerStatus;
import com.example.sandstormtracker.model.TrackerEvent;
import com.example.sandstormtracker.service.IngestionOrchestrator;
import com.example.sandstormtracker.service.StatsAggregator;
import com.example.sandstormtracker.service.TrackerEventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: pipeline status, recent tracker events, per-server start and stop.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class StatusController {

    private final IngestionOrchestrator orchestrator;
    private final TrackerEventLog eventLog;
    private final StatsAggregator aggregator;

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("servers", orchestrator.getStatus());
        status.put("batchesApplied", aggregator.getBatchesApplied());
        status.put("duplicateBatchesSkipped", aggregator.getDuplicatesSkipped());
        status.put("transactionRetries", aggregator.getRetries());
        return status;
    }

    @GetMapping("/status/{serverId}")
    public ResponseEntity<ServerStatus> getServerStatus(@PathVariable String serverId) {
        try {
            return ResponseEntity.ok(orchestrator.getStatus(serverId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Recent tracker events, optionally for one server only.
     */
    @GetMapping("/events")
    public List<TrackerEvent> getEvents(@RequestParam(required = false) String serverId) {
        return serverId == null ? eventLog.getEvents() : eventLog.getEvents(serverId);
    }

    @PostMapping("/servers/{serverId}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String serverId) {
        return lifecycle(serverId, true);
    }

    @PostMapping("/servers/{serverId}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String serverId) {
        return lifecycle(serverId, false);
    }

    private ResponseEntity<Map<String, Object>> lifecycle(String serverId, boolean start) {
        Map<String, Object> response = new HashMap<>();
        response.put("serverId", serverId);
        try {
            if (start) {
                orchestrator.start(serverId);
            } else {
                orchestrator.stop(serverId);
            }
            response.put("success", true);
            response.put("running", start);
            log.info("Pipeline {} {} via API", serverId, start ? "started" : "stopped");
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.status(404).body(response);
        } catch (Exception e) {
            log.error("Failed to {} pipeline {}", start ? "start" : "stop", serverId, e);
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }
}
