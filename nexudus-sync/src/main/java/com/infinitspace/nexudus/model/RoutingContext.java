package com.infinitspace.nexudus.model;

/**
 * Routing keys supplied by the caller when the payload itself does not carry them
 * (contracts know nothing of their product; resources are fetched per location).
 */
public record RoutingContext(Long productId, Long locationId) {

    private static final RoutingContext NONE = new RoutingContext(null, null);

    public static RoutingContext none() {
        return NONE;
    }

    public static RoutingContext forLocation(Long locationId) {
        return new RoutingContext(null, locationId);
    }
}
