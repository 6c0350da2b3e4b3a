package com.infinitspace.nexudus.transform;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Pure mapping from one raw Nexudus record to one typed silver row.
 *
 * @param <R> silver row type
 */
public interface EntityTransformer<R> {

    /**
     * @param raw        record as captured in bronze
     * @param bronzeId   id of the bronze row it came from
     * @param syncRunId  run that is deriving silver
     * @return the row, or empty if the record is deliberately excluded
     * @throws IllegalArgumentException if the record lacks a required field
     */
    Optional<R> transform(JsonNode raw, long bronzeId, String syncRunId);
}
