package com.infinitspace.nexudus.run;

import com.infinitspace.nexudus.model.SyncRun;
import com.infinitspace.nexudus.output.SqlClient;
import lombok.extern.slf4j.Slf4j;

/**
 * Handle on one open meta.sync_runs row. Work inside a tracked step reports its
 * counters here and records per-item failures with {@link #logError}.
 */
@Slf4j
public class RunTracker {

    static final String INSERT_ERROR_SQL = """
            INSERT INTO meta.sync_errors (sync_run_id, source_id, entity, error_message, raw_payload)
            VALUES (?, ?, ?, ?, ?)
            """;

    private final SyncRun run;
    private final SqlClient sqlClient;

    RunTracker(SyncRun run, SqlClient sqlClient) {
        this.run = run;
        this.sqlClient = sqlClient;
    }

    public String getRunId() {
        return run.getRunId();
    }

    public String getEntity() {
        return run.getEntity();
    }

    public void setRowsRead(int rowsRead) {
        run.setRowsRead(rowsRead);
    }

    public void setRowsWritten(int rowsWritten) {
        run.setRowsWritten(rowsWritten);
    }

    public void setRowsSkipped(int rowsSkipped) {
        run.setRowsSkipped(rowsSkipped);
    }

    public int getRowsRead() {
        return run.getRowsRead();
    }

    public int getRowsWritten() {
        return run.getRowsWritten();
    }

    public int getRowsSkipped() {
        return run.getRowsSkipped();
    }

    /**
     * Records one item-level failure against this run. Best effort: a failure to
     * write the error row is logged and does not interrupt the step.
     */
    public void logError(String sourceId, Exception error, String rawPayload) {
        try {
            sqlClient.executeNonQuery(INSERT_ERROR_SQL,
                    run.getRunId(), sourceId, run.getEntity(), SyncRunService.describe(error), rawPayload);
        } catch (RuntimeException e) {
            log.warn("Could not record sync error for {} {} in run {}: {}",
                    run.getEntity(), sourceId, run.getRunId(), e.getMessage());
        }
    }

    SyncRun snapshot() {
        return run;
    }
}
