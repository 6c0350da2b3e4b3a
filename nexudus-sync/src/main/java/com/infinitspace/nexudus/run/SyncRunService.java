package com.infinitspace.nexudus.run;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.RunStatus;
import com.infinitspace.nexudus.model.SyncLayer;
import com.infinitspace.nexudus.model.SyncRun;
import com.infinitspace.nexudus.output.SqlClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Bookkeeping for sync steps in meta.sync_runs.
 *
 * A step is opened as "running" before any work starts and is always closed as
 * "success" or "failed", so a row left in "running" means the process died.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncRunService {

    static final int MAX_ERROR_LENGTH = 4000;

    private static final String INSERT_RUN_SQL = """
            INSERT INTO meta.sync_runs
                (id, source_name, entity, layer, status, started_at, triggered_by, metadata)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String FINISH_RUN_SQL = """
            UPDATE meta.sync_runs
               SET status = ?, finished_at = ?, rows_read = ?, rows_written = ?,
                   rows_skipped = ?, error_message = ?
             WHERE id = ?
            """;

    private final SqlClient sqlClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Runs {@code work} inside a tracked scope. The run record is closed on every
     * path; a failure of the work is rethrown after the record says "failed".
     */
    public <T> T track(NexudusEntity entity, SyncLayer layer, String triggeredBy,
                       String invocationId, Function<RunTracker, T> work) {
        RunTracker tracker = begin(entity, layer, triggeredBy, invocationId);
        T result;
        try {
            result = work.apply(tracker);
        } catch (RuntimeException | Error e) {
            try {
                end(tracker, RunStatus.FAILED, e);
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        end(tracker, RunStatus.SUCCESS, null);
        return result;
    }

    public RunTracker begin(NexudusEntity entity, SyncLayer layer, String triggeredBy, String invocationId) {
        SyncRun run = SyncRun.builder()
                .runId(UUID.randomUUID().toString())
                .sourceName(NexudusEntity.SOURCE_NAME)
                .entity(entity.entityName())
                .layer(layer)
                .status(RunStatus.RUNNING)
                .startedAt(LocalDateTime.now(clock))
                .triggeredBy(triggeredBy)
                .metadata(metadata(invocationId))
                .build();

        sqlClient.executeNonQuery(INSERT_RUN_SQL,
                run.getRunId(), run.getSourceName(), run.getEntity(), layer.dbValue(),
                RunStatus.RUNNING.dbValue(), run.getStartedAt(), triggeredBy, run.getMetadata());

        log.info("[{}] {} {} started (run {})", invocationId, layer.dbValue(), run.getEntity(), run.getRunId());
        return new RunTracker(run, sqlClient);
    }

    public void end(RunTracker tracker, RunStatus status, Throwable error) {
        SyncRun run = tracker.snapshot();
        run.setStatus(status);
        run.setFinishedAt(LocalDateTime.now(clock));
        run.setErrorMessage(error == null ? null : describe(error));

        sqlClient.executeNonQuery(FINISH_RUN_SQL,
                status.dbValue(), run.getFinishedAt(), run.getRowsRead(), run.getRowsWritten(),
                run.getRowsSkipped(), run.getErrorMessage(), run.getRunId());

        long seconds = Duration.between(run.getStartedAt(), run.getFinishedAt()).toSeconds();
        if (status == RunStatus.FAILED) {
            log.error("{} {} failed after {}s (run {}): {}",
                    run.getLayer().dbValue(), run.getEntity(), seconds, run.getRunId(), run.getErrorMessage());
        } else {
            log.info("{} {} {} in {}s: read={} written={} skipped={}",
                    run.getLayer().dbValue(), run.getEntity(), status.dbValue(), seconds,
                    run.getRowsRead(), run.getRowsWritten(), run.getRowsSkipped());
        }
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    private String metadata(String invocationId) {
        try {
            return objectMapper.writeValueAsString(Map.of("invocation_id", invocationId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise run metadata", e);
        }
    }
}
