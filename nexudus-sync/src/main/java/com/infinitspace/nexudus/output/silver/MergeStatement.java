package com.infinitspace.nexudus.output.silver;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Parameterised MERGE (upsert) on a natural key. Runs unchanged on SQL Server and H2.
 *
 * Parameters bind as: key values, update values, key values, insert values.
 * {@link #bind} produces that order from one set of key and column values.
 * Matched rows also get {@code last_synced_at} refreshed.
 */
public final class MergeStatement {

    public record KeyColumn(String name, String sqlType) {}

    private final List<KeyColumn> keyColumns;
    private final List<String> columns;
    private final String sql;

    private MergeStatement(String table, List<KeyColumn> keyColumns, List<String> columns) {
        this.keyColumns = List.copyOf(keyColumns);
        this.columns = List.copyOf(columns);
        this.sql = buildSql(table);
    }

    public static MergeStatement onSourceId(String table, List<String> columns) {
        return new MergeStatement(table, List.of(new KeyColumn("source_id", "BIGINT")), columns);
    }

    public static MergeStatement on(String table, List<KeyColumn> keyColumns, List<String> columns) {
        return new MergeStatement(table, keyColumns, columns);
    }

    public String sql() {
        return sql;
    }

    public Object[] bind(Object[] keyValues, Object[] values) {
        if (keyValues.length != keyColumns.size() || values.length != columns.size()) {
            throw new IllegalArgumentException("Expected " + keyColumns.size() + " key and "
                    + columns.size() + " column values, got " + keyValues.length + " and " + values.length);
        }
        Object[] params = new Object[2 * keyValues.length + 2 * values.length];
        int p = 0;
        for (Object k : keyValues) params[p++] = k;
        for (Object v : values) params[p++] = v;
        for (Object k : keyValues) params[p++] = k;
        for (Object v : values) params[p++] = v;
        return params;
    }

    private String buildSql(String table) {
        String source = keyColumns.stream()
                .map(k -> "CAST(? AS " + k.sqlType() + ") AS " + k.name())
                .collect(Collectors.joining(", "));
        String on = keyColumns.stream()
                .map(k -> "target." + k.name() + " = source." + k.name())
                .collect(Collectors.joining(" AND "));
        String updates = columns.stream()
                .map(c -> c + " = ?")
                .collect(Collectors.joining(", "));
        String insertColumns = keyColumns.stream().map(KeyColumn::name)
                .collect(Collectors.joining(", ")) + ", " + String.join(", ", columns);
        String insertValues = "?, ".repeat(keyColumns.size() + columns.size());
        insertValues = insertValues.substring(0, insertValues.length() - 2);

        return "MERGE INTO " + table + " AS target"
                + " USING (SELECT " + source + ") AS source"
                + " ON " + on
                + " WHEN MATCHED THEN UPDATE SET " + updates + ", last_synced_at = CURRENT_TIMESTAMP"
                + " WHEN NOT MATCHED THEN INSERT (" + insertColumns + ") VALUES (" + insertValues + ");";
    }
}
