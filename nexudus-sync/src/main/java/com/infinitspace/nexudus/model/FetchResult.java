package com.infinitspace.nexudus.model;

/**
 * Outcome of one item in a concurrent fan-out: either a value (possibly null for a
 * 404) or the failure, never both. Failures are carried, not thrown.
 */
public record FetchResult<K, V>(K key, V value, Throwable error) {

    public static <K, V> FetchResult<K, V> success(K key, V value) {
        return new FetchResult<>(key, value, null);
    }

    public static <K, V> FetchResult<K, V> failure(K key, Throwable error) {
        return new FetchResult<>(key, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
