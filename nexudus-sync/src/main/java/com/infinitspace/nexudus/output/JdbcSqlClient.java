package com.infinitspace.nexudus.output;

import com.infinitspace.nexudus.config.NexudusSyncProperties;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link SqlClient} over Spring's JdbcTemplate.
 *
 * Connection acquisition is retried a few times with a fixed delay (serverless
 * SQL databases refuse logins while resuming). Any other store error is thrown
 * straight through.
 */
@Component
@Slf4j
public class JdbcSqlClient implements SqlClient {

    private final JdbcTemplate jdbcTemplate;
    private final Retry loginRetry;

    public JdbcSqlClient(JdbcTemplate jdbcTemplate, NexudusSyncProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        NexudusSyncProperties.Store store = properties.getStore();
        this.loginRetry = Retry.of("sqlLogin", RetryConfig.custom()
                .maxAttempts(store.getLoginRetryAttempts())
                .waitDuration(store.getLoginRetryDelay())
                .retryExceptions(CannotGetJdbcConnectionException.class)
                .build());
        loginRetry.getEventPublisher().onRetry(event ->
                log.warn("SQL login failed (attempt {}), retrying in {}s: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toSeconds(),
                        event.getLastThrowable().getMessage()));
    }

    @Override
    public List<Map<String, Object>> executeQuery(String sql, Object... params) {
        return withLoginRetry(() -> jdbcTemplate.queryForList(sql, params));
    }

    @Override
    public int executeNonQuery(String sql, Object... params) {
        return withLoginRetry(() -> jdbcTemplate.update(sql, params));
    }

    @Override
    public <T> T executeScalar(String sql, Class<T> type, Object... params) {
        return withLoginRetry(() -> {
            try {
                return jdbcTemplate.queryForObject(sql, type, params);
            } catch (EmptyResultDataAccessException e) {
                return null;
            }
        });
    }

    @Override
    public int[] executeBatch(String sql, List<Object[]> batchParams) {
        if (batchParams.isEmpty()) return new int[0];
        return withLoginRetry(() -> jdbcTemplate.batchUpdate(sql, batchParams));
    }

    private <T> T withLoginRetry(Supplier<T> call) {
        return loginRetry.executeSupplier(call);
    }
}
