package com.infinitspace.nexudus.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page of a Nexudus listing endpoint: {@code {Records: [...], HasNextPage: bool}}.
 */
public record UpstreamPage(List<JsonNode> records, boolean hasNextPage) {

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
