package com.infinitspace.nexudus.model;

public record ResourceTarget(long locationId, long resourceId) {}
