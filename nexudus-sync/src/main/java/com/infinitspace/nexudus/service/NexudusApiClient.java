package com.infinitspace.nexudus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.config.NexudusSyncProperties;
import com.infinitspace.nexudus.exception.NexudusAuthException;
import com.infinitspace.nexudus.exception.PermanentUpstreamException;
import com.infinitspace.nexudus.exception.TransientUpstreamException;
import com.infinitspace.nexudus.exception.UpstreamException;
import com.infinitspace.nexudus.model.UpstreamPage;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Client over the Nexudus REST API. Returns raw records; no mapping happens here.
 *
 * Nexudus rate limits are per account, so every request in the process passes
 * through one bulkhead (default 3 in flight) whatever the caller's concurrency.
 * Throttling, gateway errors and network failures are retried with exponential
 * backoff; a 429's Retry-After takes precedence over the backoff schedule.
 */
@Service
@Slf4j
public class NexudusApiClient {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final RestTemplate restTemplate;
    private final CredentialProvider credentials;
    private final NexudusSyncProperties.Api api;
    private final Retry retry;
    private final Bulkhead bulkhead;

    public NexudusApiClient(RestTemplate restTemplate, CredentialProvider credentials,
                            NexudusSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.credentials = credentials;
        this.api = properties.getApi();

        NexudusSyncProperties.Api.Retry retryProps = api.getRetry();
        this.retry = Retry.of("nexudusApi", RetryConfig.custom()
                .maxAttempts(retryProps.getMaxAttempts())
                .retryOnException(e -> e instanceof UpstreamException && ((UpstreamException) e).isRetryable())
                .intervalBiFunction(backoff(retryProps))
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Nexudus call failed (attempt {}/{}), retrying in {}ms: {}",
                        event.getNumberOfRetryAttempts(), retryProps.getMaxAttempts(),
                        event.getWaitInterval().toMillis(), event.getLastThrowable().getMessage()));

        this.bulkhead = Bulkhead.of("nexudusApi", BulkheadConfig.custom()
                .maxConcurrentCalls(api.getMaxConcurrentRequests())
                .maxWaitDuration(Duration.ofMinutes(30))
                .build());
    }

    /**
     * Fetch one page of a listing endpoint. A bare array body is treated as a
     * single, final page.
     */
    public UpstreamPage fetchPage(String path, Map<String, ?> params) {
        URI uri = uri(path, params);
        JsonNode body = call(uri);

        if (body == null || body.isNull()) {
            return new UpstreamPage(List.of(), false);
        }
        if (body.isArray()) {
            return new UpstreamPage(toList(body), false);
        }
        JsonNode records = body.path("Records");
        boolean hasNext = body.path("HasNextPage").asBoolean(false);
        return new UpstreamPage(records.isArray() ? toList(records) : List.of(), hasNext);
    }

    /**
     * Every page of a listing endpoint, fetched lazily. Each iteration starts again
     * from page 1. Stops on an empty page or when HasNextPage is false, whichever
     * comes first.
     */
    public Iterable<List<JsonNode>> fetchAll(String path, Map<String, ?> extraParams) {
        return () -> new PageIterator(path, extraParams);
    }

    public Iterable<List<JsonNode>> fetchAll(String path) {
        return fetchAll(path, Map.of());
    }

    /** All records of a listing endpoint, pages concatenated. */
    public List<JsonNode> fetchAllRecords(String path) {
        List<JsonNode> all = new ArrayList<>();
        for (List<JsonNode> page : fetchAll(path)) {
            all.addAll(page);
        }
        log.info("Fetched {} records from {}", all.size(), path);
        return all;
    }

    /**
     * A single record by path, e.g. "spaces/resources/123".
     *
     * @return empty on 404
     */
    public Optional<JsonNode> fetchOne(String path) {
        try {
            return Optional.ofNullable(call(uri(path, Map.of())));
        } catch (PermanentUpstreamException e) {
            if (e.getStatus() == HttpStatus.NOT_FOUND.value()) {
                log.debug("Not found (404): {}", path);
                return Optional.empty();
            }
            throw e;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode call(URI uri) {
        Supplier<JsonNode> guarded = Bulkhead.decorateSupplier(bulkhead, () -> exchangeWithAuth(uri));
        return retry.executeSupplier(guarded);
    }

    private JsonNode exchangeWithAuth(URI uri) {
        try {
            return exchange(uri, credentials.getToken());
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() != HttpStatus.UNAUTHORIZED.value()) {
                throw classify(uri, e);
            }
        } catch (ResourceAccessException e) {
            throw new TransientUpstreamException("Network error calling " + uri + ": " + e.getMessage(), 0, e);
        }

        log.info("Nexudus answered 401, refreshing token");
        credentials.invalidate();
        try {
            return exchange(uri, credentials.getToken());
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                throw new NexudusAuthException("Nexudus rejected a freshly issued token for " + uri, e);
            }
            throw classify(uri, e);
        } catch (ResourceAccessException e) {
            throw new TransientUpstreamException("Network error calling " + uri + ": " + e.getMessage(), 0, e);
        }
    }

    private JsonNode exchange(URI uri, String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        log.debug("GET {}", uri);
        ResponseEntity<JsonNode> response =
                restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
        return response.getBody();
    }

    private UpstreamException classify(URI uri, RestClientResponseException e) {
        int status = e.getStatusCode().value();
        String message = "Nexudus returned " + status + " for " + uri;
        if (!TRANSIENT_STATUSES.contains(status)) {
            return new PermanentUpstreamException(message, status, e);
        }
        Duration retryAfter = null;
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            retryAfter = parseRetryAfter(e.getResponseHeaders());
        }
        return new TransientUpstreamException(message, status, retryAfter, e);
    }

    private Duration parseRetryAfter(HttpHeaders headers) {
        String value = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value != null) {
            try {
                return Duration.ofSeconds(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                log.debug("Unparseable Retry-After '{}', using default", value);
            }
        }
        return api.getRetry().getDefaultRetryAfter();
    }

    // Retry-After when the server sent one, else initial * 2^(n-1) capped at max.
    private static IntervalBiFunction<Object> backoff(NexudusSyncProperties.Api.Retry props) {
        return (attempt, result) -> {
            if (result.isLeft() && result.getLeft() instanceof TransientUpstreamException) {
                Optional<Duration> retryAfter = ((TransientUpstreamException) result.getLeft()).getRetryAfter();
                if (retryAfter.isPresent()) {
                    return retryAfter.get().toMillis();
                }
            }
            long initial = props.getInitialBackoff().toMillis();
            long max = props.getMaxBackoff().toMillis();
            int shift = Math.min(Math.max(attempt - 1, 0), 30);
            return Math.min(initial * (1L << shift), max);
        };
    }

    private URI uri(String path, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(api.getBaseUrl() + "/" + path);
        params.forEach(builder::queryParam);
        return builder.encode().build().toUri();
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> list = new ArrayList<>(array.size());
        array.forEach(list::add);
        return list;
    }

    private class PageIterator implements Iterator<List<JsonNode>> {

        private final String path;
        private final Map<String, ?> extraParams;
        private int page = 1;
        private boolean done;
        private List<JsonNode> next;

        PageIterator(String path, Map<String, ?> extraParams) {
            this.path = path;
            this.extraParams = extraParams;
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (done) return false;

            Map<String, Object> params = new LinkedHashMap<>();
            params.put("page", page);
            params.put("size", api.getPageSize());
            params.putAll(extraParams);

            UpstreamPage result = fetchPage(path, params);
            log.debug("{} page {}: {} records, hasNext={}", path, page, result.records().size(), result.hasNextPage());
            page++;

            if (result.isEmpty()) {
                done = true;
                return false;
            }
            if (!result.hasNextPage()) {
                done = true;
            }
            next = result.records();
            return true;
        }

        @Override
        public List<JsonNode> next() {
            if (!hasNext()) throw new NoSuchElementException();
            List<JsonNode> current = next;
            next = null;
            return current;
        }
    }
}
