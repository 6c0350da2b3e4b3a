package com.infinitspace.nexudus.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.transform.PayloadValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resource ids discovered from products, grouped by the product's location.
 *
 * Each product references zero or one resource. The same resource may appear
 * under several products; it is fetched once per location.
 */
public final class ResourceFetchPlan {

    private final Map<Long, Set<Long>> resourceIdsByLocation;

    private ResourceFetchPlan(Map<Long, Set<Long>> resourceIdsByLocation) {
        this.resourceIdsByLocation = resourceIdsByLocation;
    }

    public static ResourceFetchPlan fromProducts(List<JsonNode> products) {
        Map<Long, Set<Long>> byLocation = new LinkedHashMap<>();
        for (JsonNode product : products) {
            Long resourceId = PayloadValues.toLong(product.get("ResourceId"));
            Long locationId = PayloadValues.toLong(product.get("FloorPlanBusinessId"));
            // 0 is Nexudus for "not linked"
            if (resourceId == null || resourceId == 0 || locationId == null || locationId == 0) {
                continue;
            }
            byLocation.computeIfAbsent(locationId, k -> new LinkedHashSet<>()).add(resourceId);
        }
        return new ResourceFetchPlan(byLocation);
    }

    public Map<Long, Set<Long>> resourceIdsByLocation() {
        return Collections.unmodifiableMap(resourceIdsByLocation);
    }

    public List<ResourceTarget> targets() {
        List<ResourceTarget> targets = new ArrayList<>();
        resourceIdsByLocation.forEach((locationId, ids) ->
                ids.forEach(resourceId -> targets.add(new ResourceTarget(locationId, resourceId))));
        return targets;
    }

    public int size() {
        return resourceIdsByLocation.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
