package com.infinitspace.nexudus.scheduler;

import com.infinitspace.nexudus.config.NexudusSyncProperties;
import com.infinitspace.nexudus.service.NexudusSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled and on-startup syncs.
 *
 * Default schedule: bronze daily at 02:00 UTC, silver at 02:30 UTC once bronze has
 * had time to land. Override with NEXUDUS_BRONZE_CRON / NEXUDUS_SILVER_CRON.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncScheduler {

    private final NexudusSyncService syncService;
    private final NexudusSyncProperties properties;

    /**
     * With RUN_ON_STARTUP=true, runs bronze then silver once the application is up.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        NexudusSyncProperties.Scheduling scheduling = properties.getScheduling();
        if (!scheduling.isRunOnStartup()) {
            log.info("Nexudus sync ready. Bronze: {}, silver: {}",
                    scheduling.getBronzeCron(), scheduling.getSilverCron());
            return;
        }
        log.info("RUN_ON_STARTUP=true, running bronze and silver sync");
        runSafely("startup bronze", () -> syncService.runBronzeSync("startup"));
        runSafely("startup silver", () -> syncService.runSilverSync("startup"));
    }

    @Scheduled(cron = "${nexudus.scheduling.bronze-cron:0 0 2 * * *}", zone = "UTC")
    public void scheduledBronze() {
        log.info("Scheduled bronze sync triggered");
        runSafely("scheduled bronze", () -> syncService.runBronzeSync("cron"));
    }

    @Scheduled(cron = "${nexudus.scheduling.silver-cron:0 30 2 * * *}", zone = "UTC")
    public void scheduledSilver() {
        log.info("Scheduled silver sync triggered");
        runSafely("scheduled silver", () -> syncService.runSilverSync("cron"));
    }

    private void runSafely(String label, Runnable sync) {
        try {
            sync.run();
        } catch (Exception e) {
            log.error("{} sync failed: {}", label, e.getMessage(), e);
        }
    }
}
