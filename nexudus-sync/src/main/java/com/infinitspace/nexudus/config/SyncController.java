package com.infinitspace.nexudus.config;

import com.infinitspace.nexudus.model.SyncLayer;
import com.infinitspace.nexudus.service.NexudusSyncService;
import com.infinitspace.nexudus.service.SyncRunQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@RestController
@Slf4j
@RequiredArgsConstructor
public class SyncController {

    static final String TRIGGER_MANUAL = "manual";

    private final NexudusSyncService syncService;
    private final SyncRunQueryService runQueryService;

    // ── Sync triggers ─────────────────────────────────────────────────────────

    @PostMapping("/sync/bronze")
    public ResponseEntity<Map<String, String>> triggerBronze() {
        return trigger(SyncLayer.BRONZE, syncService::runBronzeSync);
    }

    @PostMapping("/sync/silver")
    public ResponseEntity<Map<String, String>> triggerSilver() {
        return trigger(SyncLayer.SILVER, syncService::runSilverSync);
    }

    @GetMapping("/sync/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "nexudus-sync",
                "version", "1.0.0",
                "bronzeRunning", syncService.isRunning(SyncLayer.BRONZE),
                "silverRunning", syncService.isRunning(SyncLayer.SILVER),
                "openRuns", runQueryService.countRunning()
        ));
    }

    // ── Run inspection ────────────────────────────────────────────────────────

    /**
     * GET /sync/runs?limit=50
     */
    @GetMapping("/sync/runs")
    public ResponseEntity<?> runs(@RequestParam(defaultValue = "50") int limit) {
        try {
            List<Map<String, Object>> result = runQueryService.recentRuns(limit);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Run query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/sync/runs/{runId}/errors")
    public ResponseEntity<?> errors(@PathVariable String runId) {
        try {
            return ResponseEntity.ok(runQueryService.errorsForRun(runId));
        } catch (Exception e) {
            log.error("Error query failed for run {}: {}", runId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private ResponseEntity<Map<String, String>> trigger(SyncLayer layer, Consumer<String> sync) {
        if (syncService.isRunning(layer)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "already running", "layer", layer.dbValue()));
        }
        new Thread(() -> {
            try {
                sync.accept(TRIGGER_MANUAL);
            } catch (Exception e) {
                log.error("Manual {} sync failed: {}", layer.dbValue(), e.getMessage(), e);
            }
        }, "manual-sync-" + layer.dbValue()).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "layer", layer.dbValue()));
    }
}
