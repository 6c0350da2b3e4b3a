package com.infinitspace.nexudus.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.config.NexudusSyncProperties;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends raw Nexudus records to their bronze table, one row per record per run.
 *
 * Bronze is history: nothing is updated or de-duplicated here. Silver picks the
 * latest row per source id. A record without a usable id is still kept, with a
 * null source_id; silver reports it as a record error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BronzeWriter {

    private final SqlClient sqlClient;
    private final ObjectMapper objectMapper;
    private final NexudusSyncProperties properties;
    private final Clock clock;

    /**
     * @return number of rows appended
     */
    public int write(NexudusEntity entity, String syncRunId, List<JsonNode> records, RoutingContext context) {
        if (records.isEmpty()) return 0;

        String sql = insertSql(entity);
        LocalDateTime syncedAt = LocalDateTime.now(clock);
        int batchSize = properties.getBronze().getBatchSize();
        int total = records.size();
        int withoutId = 0;

        for (int i = 0; i < total; i += batchSize) {
            List<JsonNode> batch = records.subList(i, Math.min(i + batchSize, total));
            List<Object[]> params = new ArrayList<>(batch.size());
            for (JsonNode record : batch) {
                Object[] row = rowParams(entity, syncRunId, record, context, syncedAt);
                if (row[1] == null) withoutId++;
                params.add(row);
            }
            sqlClient.executeBatch(sql, params);
        }

        if (withoutId > 0) {
            log.warn("{} of {} {} records have no natural id, stored with a null source_id",
                    withoutId, total, entity.entityName());
        }
        log.info("Appended {} {} records to {}", total, entity.entityName(), entity.bronzeTable());
        return total;
    }

    public int write(NexudusEntity entity, String syncRunId, List<JsonNode> records) {
        return write(entity, syncRunId, records, RoutingContext.none());
    }

    private Object[] rowParams(NexudusEntity entity, String syncRunId, JsonNode record,
                               RoutingContext context, LocalDateTime syncedAt) {
        Object[] routing = entity.routingValues(record, context);
        Object[] params = new Object[4 + routing.length];
        int p = 0;
        params[p++] = syncRunId;
        params[p++] = entity.naturalIdOrNull(record);
        for (Object value : routing) {
            params[p++] = value;
        }
        params[p++] = toJson(record);
        params[p] = syncedAt;
        return params;
    }

    private String insertSql(NexudusEntity entity) {
        List<String> columns = new ArrayList<>();
        columns.add("sync_run_id");
        columns.add("source_id");
        columns.addAll(entity.routingColumns());
        columns.add("raw_json");
        columns.add("synced_at");
        String placeholders = String.join(", ", columns.stream().map(c -> "?").toList());
        return "INSERT INTO " + entity.bronzeTable()
                + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
    }

    private String toJson(JsonNode record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise raw record", e);
        }
    }
}
