package com.infinitspace.nexudus.model;

/**
 * Latest bronze capture for one natural id, as read back by the silver writers.
 */
public record BronzeRow(long id, Long sourceId, String rawJson) {}
