package com.infinitspace.nexudus.transform;

import java.util.Set;

/**
 * Nexudus businesses that are not physical locations. They never reach silver,
 * and neither does anything that belongs to them.
 */
public final class ExcludedLocations {

    public static final Set<Long> SOURCE_IDS = Set.of(
            1376491116L,    // root business account
            1376491117L     // demo location
    );

    private ExcludedLocations() {}

    public static boolean contains(Long sourceId) {
        return sourceId != null && SOURCE_IDS.contains(sourceId);
    }
}
