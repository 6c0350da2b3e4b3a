package com.infinitspace.nexudus.service;

import com.infinitspace.nexudus.output.SqlClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Read side of meta.sync_runs and meta.sync_errors for the HTTP surface.
 */
@Service
@RequiredArgsConstructor
public class SyncRunQueryService {

    static final int MAX_LIMIT = 500;

    private final SqlClient sqlClient;

    /** Most recent runs first. */
    public List<Map<String, Object>> recentRuns(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return sqlClient.executeQuery("""
                SELECT id, source_name, entity, layer, status, started_at, finished_at,
                       rows_read, rows_written, rows_skipped, error_message, triggered_by, metadata
                  FROM meta.sync_runs
                 ORDER BY started_at DESC
                 OFFSET 0 ROWS FETCH NEXT ? ROWS ONLY
                """, limit);
    }

    public List<Map<String, Object>> errorsForRun(String runId) {
        return sqlClient.executeQuery("""
                SELECT id, sync_run_id, source_id, entity, error_message, raw_payload, created_at
                  FROM meta.sync_errors
                 WHERE sync_run_id = ?
                 ORDER BY id
                """, runId);
    }

    /** Runs still marked running; after a crash these never close. */
    public int countRunning() {
        Integer count = sqlClient.executeScalar(
                "SELECT COUNT(*) FROM meta.sync_runs WHERE status = 'running'", Integer.class);
        return count == null ? 0 : count;
    }
}
