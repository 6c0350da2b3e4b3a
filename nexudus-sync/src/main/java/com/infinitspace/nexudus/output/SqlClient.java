package com.infinitspace.nexudus.output;

import java.util.List;
import java.util.Map;

/**
 * Thin parameterised access to the relational store. Placeholders are {@code ?}.
 */
public interface SqlClient {

    List<Map<String, Object>> executeQuery(String sql, Object... params);

    /** @return affected row count */
    int executeNonQuery(String sql, Object... params);

    /** First column of the first row, or null when there is no row. */
    <T> T executeScalar(String sql, Class<T> type, Object... params);

    /** Runs one statement per parameter row as a JDBC batch. */
    int[] executeBatch(String sql, List<Object[]> batchParams);
}
