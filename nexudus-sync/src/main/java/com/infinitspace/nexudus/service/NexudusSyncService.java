package com.infinitspace.nexudus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.config.NexudusSyncProperties;
import com.infinitspace.nexudus.exception.NexudusAuthException;
import com.infinitspace.nexudus.model.FetchResult;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.ResourceFetchPlan;
import com.infinitspace.nexudus.model.ResourceTarget;
import com.infinitspace.nexudus.model.RoutingContext;
import com.infinitspace.nexudus.model.SilverResult;
import com.infinitspace.nexudus.model.SyncLayer;
import com.infinitspace.nexudus.model.SyncReport;
import com.infinitspace.nexudus.output.BronzeWriter;
import com.infinitspace.nexudus.output.SnapshotWriter;
import com.infinitspace.nexudus.output.silver.AbstractSilverWriter;
import com.infinitspace.nexudus.output.silver.ContractSilverWriter;
import com.infinitspace.nexudus.output.silver.ExtraServiceSilverWriter;
import com.infinitspace.nexudus.output.silver.LocationSilverWriter;
import com.infinitspace.nexudus.output.silver.ProductSilverWriter;
import com.infinitspace.nexudus.output.silver.ResourceSilverWriter;
import com.infinitspace.nexudus.run.RunTracker;
import com.infinitspace.nexudus.run.SyncRunService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Runs the two sync phases.
 *
 * Bronze: locations, products, contracts, resources, extra services, each pulled
 * from Nexudus and appended to bronze under one invocation id. Resources are not
 * listed; their ids are discovered from the products pulled in the same run.
 *
 * Silver: each silver table re-derived from the latest bronze rows.
 *
 * Every entity step is tracked on its own, and a failing step does not stop its
 * siblings. Missing or rejected credentials stop the whole phase.
 */
@Service
@Slf4j
public class NexudusSyncService {

    private static final String RESOURCE_PATH = NexudusEntity.RESOURCES.path() + "/";

    private final NexudusApiClient apiClient;
    private final CredentialProvider credentials;
    private final BronzeWriter bronzeWriter;
    private final SnapshotWriter snapshotWriter;
    private final SyncRunService runService;
    private final List<AbstractSilverWriter<?>> silverWriters;
    private final NexudusSyncProperties properties;
    private final Executor resourceFetchExecutor;
    private final Clock clock;

    private final AtomicBoolean bronzeRunning = new AtomicBoolean(false);
    private final AtomicBoolean silverRunning = new AtomicBoolean(false);

    public NexudusSyncService(NexudusApiClient apiClient,
                              CredentialProvider credentials,
                              BronzeWriter bronzeWriter,
                              SnapshotWriter snapshotWriter,
                              SyncRunService runService,
                              LocationSilverWriter locationWriter,
                              ProductSilverWriter productWriter,
                              ResourceSilverWriter resourceWriter,
                              ContractSilverWriter contractWriter,
                              ExtraServiceSilverWriter extraServiceWriter,
                              NexudusSyncProperties properties,
                              @Qualifier("resourceFetchExecutor") Executor resourceFetchExecutor,
                              Clock clock) {
        this.apiClient = apiClient;
        this.credentials = credentials;
        this.bronzeWriter = bronzeWriter;
        this.snapshotWriter = snapshotWriter;
        this.runService = runService;
        this.silverWriters = List.of(locationWriter, productWriter, resourceWriter, contractWriter, extraServiceWriter);
        this.properties = properties;
        this.resourceFetchExecutor = resourceFetchExecutor;
        this.clock = clock;
    }

    // ── Bronze ───────────────────────────────────────────────────────────────

    /**
     * @throws NexudusAuthException if no valid token can be obtained
     * @throws IllegalStateException if a bronze sync is already running
     */
    public SyncReport runBronzeSync(String triggeredBy) {
        if (!bronzeRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("A bronze sync is already running");
        }
        try {
            String invocationId = UUID.randomUUID().toString();
            SyncReport report = new SyncReport(invocationId, SyncLayer.BRONZE, LocalDateTime.now(clock));
            log.info("[{}] Bronze sync started (triggered by {})", invocationId, triggeredBy);

            credentials.getToken();

            runStep(report, NexudusEntity.LOCATIONS, SyncLayer.BRONZE, triggeredBy, invocationId,
                    run -> pullListing(NexudusEntity.LOCATIONS, invocationId, run));

            ResourceFetchPlan plan = runStep(report, NexudusEntity.PRODUCTS, SyncLayer.BRONZE, triggeredBy,
                    invocationId, run -> ResourceFetchPlan.fromProducts(
                            pullListing(NexudusEntity.PRODUCTS, invocationId, run)));

            runStep(report, NexudusEntity.CONTRACTS, SyncLayer.BRONZE, triggeredBy, invocationId,
                    run -> pullListing(NexudusEntity.CONTRACTS, invocationId, run));

            if (plan == null) {
                log.warn("[{}] Skipping resources: products step failed", invocationId);
                report.skipped(NexudusEntity.RESOURCES.entityName(), "products step failed");
            } else if (plan.isEmpty()) {
                log.info("[{}] No resources referenced by products, nothing to fetch", invocationId);
                report.skipped(NexudusEntity.RESOURCES.entityName(), "no resources referenced");
            } else {
                runStep(report, NexudusEntity.RESOURCES, SyncLayer.BRONZE, triggeredBy, invocationId,
                        run -> pullResources(plan, invocationId, run));
            }

            runStep(report, NexudusEntity.EXTRA_SERVICES, SyncLayer.BRONZE, triggeredBy, invocationId,
                    run -> pullListing(NexudusEntity.EXTRA_SERVICES, invocationId, run));

            return finish(report);
        } finally {
            bronzeRunning.set(false);
        }
    }

    private List<JsonNode> pullListing(NexudusEntity entity, String invocationId, RunTracker run) {
        List<JsonNode> records = apiClient.fetchAllRecords(entity.path());
        run.setRowsRead(records.size());
        archive(entity, invocationId, records);
        run.setRowsWritten(bronzeWriter.write(entity, invocationId, records));
        return records;
    }

    /**
     * Fetches every planned resource concurrently (bounded by the client's bulkhead),
     * then writes the successes per location. A failed fetch is counted as skipped;
     * a resource that no longer exists (404) is simply absent.
     */
    private int pullResources(ResourceFetchPlan plan, String invocationId, RunTracker run) {
        List<ResourceTarget> targets = plan.targets();
        log.info("[{}] Fetching {} resources across {} locations",
                invocationId, targets.size(), plan.resourceIdsByLocation().size());

        List<CompletableFuture<FetchResult<ResourceTarget, JsonNode>>> futures = new ArrayList<>(targets.size());
        for (ResourceTarget target : targets) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> apiClient.fetchOne(RESOURCE_PATH + target.resourceId()).orElse(null),
                            resourceFetchExecutor)
                    .handle((record, error) -> error == null
                            ? FetchResult.<ResourceTarget, JsonNode>success(target, record)
                            : FetchResult.<ResourceTarget, JsonNode>failure(target, unwrap(error))));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<Long, List<JsonNode>> byLocation = new LinkedHashMap<>();
        int skipped = 0;
        for (CompletableFuture<FetchResult<ResourceTarget, JsonNode>> future : futures) {
            FetchResult<ResourceTarget, JsonNode> result = future.join();
            ResourceTarget target = result.key();
            if (!result.isSuccess()) {
                if (result.error() instanceof NexudusAuthException) {
                    throw (NexudusAuthException) result.error();
                }
                skipped++;
                log.warn("[{}] Resource {} (location {}) failed: {}",
                        invocationId, target.resourceId(), target.locationId(), result.error().getMessage());
                run.logError(String.valueOf(target.resourceId()), asException(result.error()), null);
            } else if (result.value() == null) {
                log.debug("[{}] Resource {} (location {}) no longer exists", invocationId,
                        target.resourceId(), target.locationId());
            } else {
                byLocation.computeIfAbsent(target.locationId(), k -> new ArrayList<>()).add(result.value());
            }
        }

        run.setRowsRead(targets.size());
        run.setRowsSkipped(skipped);

        if (properties.getSnapshot().isEnabled()) {
            List<Map<String, Object>> snapshot = new ArrayList<>();
            byLocation.forEach((locationId, records) -> records.forEach(record -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("location_id", locationId);
                entry.put("record", record);
                snapshot.add(entry);
            }));
            snapshotWriter.write(NexudusEntity.RESOURCES.entityName(), invocationId, snapshot);
        }

        int written = 0;
        for (Map.Entry<Long, List<JsonNode>> entry : byLocation.entrySet()) {
            written += bronzeWriter.write(NexudusEntity.RESOURCES, invocationId, entry.getValue(),
                    RoutingContext.forLocation(entry.getKey()));
        }
        run.setRowsWritten(written);
        return written;
    }

    private void archive(NexudusEntity entity, String invocationId, List<JsonNode> records) {
        if (properties.getSnapshot().isEnabled()) {
            snapshotWriter.write(entity.entityName(), invocationId, records);
        }
    }

    // ── Silver ───────────────────────────────────────────────────────────────

    /**
     * @throws IllegalStateException if a silver sync is already running
     */
    public SyncReport runSilverSync(String triggeredBy) {
        if (!silverRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("A silver sync is already running");
        }
        try {
            String invocationId = UUID.randomUUID().toString();
            SyncReport report = new SyncReport(invocationId, SyncLayer.SILVER, LocalDateTime.now(clock));
            log.info("[{}] Silver sync started (triggered by {})", invocationId, triggeredBy);

            for (AbstractSilverWriter<?> writer : silverWriters) {
                runStep(report, writer.entity(), SyncLayer.SILVER, triggeredBy, invocationId, run -> {
                    SilverResult result = writer.write(invocationId, run);
                    run.setRowsRead(result.read());
                    run.setRowsWritten(result.written() + result.satellites());
                    run.setRowsSkipped(result.skipped());
                    return result;
                });
            }

            return finish(report);
        } finally {
            silverRunning.set(false);
        }
    }

    public boolean isRunning(SyncLayer layer) {
        return layer == SyncLayer.BRONZE ? bronzeRunning.get() : silverRunning.get();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Runs one tracked entity step. A failure is recorded in the report and
     * swallowed here (its run record already says "failed"), except for
     * credential failures, which end the phase.
     *
     * @return the step's result, or null if it failed
     */
    private <T> T runStep(SyncReport report, NexudusEntity entity, SyncLayer layer, String triggeredBy,
                          String invocationId, Function<RunTracker, T> work) {
        AtomicReference<RunTracker> tracker = new AtomicReference<>();
        try {
            T result = runService.track(entity, layer, triggeredBy, invocationId, run -> {
                tracker.set(run);
                return work.apply(run);
            });
            RunTracker run = tracker.get();
            report.succeeded(entity.entityName(), run.getRowsRead(), run.getRowsWritten(), run.getRowsSkipped());
            return result;
        } catch (NexudusAuthException e) {
            log.error("[{}] {} {} aborted: authentication failed", invocationId, layer.dbValue(),
                    entity.entityName(), e);
            report.failed(entity.entityName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[{}] {} {} failed: {}", invocationId, layer.dbValue(), entity.entityName(),
                    e.getMessage(), e);
            report.failed(entity.entityName(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return null;
        }
    }

    private SyncReport finish(SyncReport report) {
        report.finish(LocalDateTime.now(clock));
        log.info("[{}] {} sync finished: {}", report.getInvocationId(), report.getLayer().dbValue(),
                report.getEntities());
        return report;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static Exception asException(Throwable error) {
        return error instanceof Exception ? (Exception) error : new RuntimeException(error);
    }
}
