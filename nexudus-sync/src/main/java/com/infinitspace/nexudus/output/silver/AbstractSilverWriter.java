package com.infinitspace.nexudus.output.silver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.model.BronzeRow;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.SilverResult;
import com.infinitspace.nexudus.output.SqlClient;
import com.infinitspace.nexudus.run.RunTracker;
import com.infinitspace.nexudus.transform.EntityTransformer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives one silver table from the latest bronze row per source id. Bronze rows
 * without a source id are each taken on their own and end up as record errors.
 *
 * A record that cannot be parsed or transformed is counted, logged against the
 * run and skipped. A failed upsert is not: it aborts the step.
 *
 * @param <R> silver row type
 */
@Slf4j
public abstract class AbstractSilverWriter<R> {

    private static final String LATEST_BRONZE_SQL = """
            SELECT id, source_id, raw_json
              FROM (SELECT b.id, b.source_id, b.raw_json,
                           ROW_NUMBER() OVER (PARTITION BY COALESCE(b.source_id, -b.id)
                                              ORDER BY b.synced_at DESC, b.id DESC) AS rn
                      FROM %s b) latest
             WHERE latest.rn = 1
             ORDER BY source_id
            """;

    protected final SqlClient sqlClient;
    protected final ObjectMapper objectMapper;

    protected AbstractSilverWriter(SqlClient sqlClient, ObjectMapper objectMapper) {
        this.sqlClient = sqlClient;
        this.objectMapper = objectMapper;
    }

    public abstract NexudusEntity entity();

    protected abstract EntityTransformer<R> transformer();

    protected abstract void upsert(R row);

    /** Business filter applied after a successful transform. */
    protected boolean skip(R row) {
        return false;
    }

    /** Rows derived alongside the main row (e.g. opening hours). @return rows written */
    protected int writeSatellites(JsonNode raw, RunTracker run) {
        return 0;
    }

    public SilverResult write(String syncRunId, RunTracker run) {
        List<BronzeRow> bronzeRows = latestBronzeRows();
        log.info("Silver {}: {} latest bronze rows", entity().entityName(), bronzeRows.size());

        int written = 0;
        int excluded = 0;
        int errors = 0;
        int satellites = 0;

        for (BronzeRow bronze : bronzeRows) {
            JsonNode raw;
            Optional<R> row;
            try {
                raw = objectMapper.readTree(bronze.rawJson());
                row = transformer().transform(raw, bronze.id(), syncRunId);
            } catch (Exception e) {
                errors++;
                log.warn("Silver {}: could not transform source_id={} (bronze id {}): {}",
                        entity().entityName(), bronze.sourceId(), bronze.id(), e.getMessage());
                run.logError(bronze.sourceId() == null ? null : String.valueOf(bronze.sourceId()), e,
                        bronze.rawJson());
                continue;
            }

            if (row.isEmpty() || skip(row.get())) {
                excluded++;
                continue;
            }

            upsert(row.get());
            written++;
            satellites += writeSatellites(raw, run);
        }

        log.info("Silver {}: read={} written={} excluded={} errors={} satellites={}",
                entity().entityName(), bronzeRows.size(), written, excluded, errors, satellites);
        return new SilverResult(bronzeRows.size(), written, excluded, errors, satellites);
    }

    List<BronzeRow> latestBronzeRows() {
        List<Map<String, Object>> rows = sqlClient.executeQuery(
                String.format(LATEST_BRONZE_SQL, entity().bronzeTable()));
        List<BronzeRow> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object sourceId = row.get("source_id");
            result.add(new BronzeRow(
                    ((Number) row.get("id")).longValue(),
                    sourceId == null ? null : ((Number) sourceId).longValue(),
                    (String) row.get("raw_json")));
        }
        return result;
    }
}
