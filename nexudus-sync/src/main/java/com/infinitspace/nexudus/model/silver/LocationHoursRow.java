package com.infinitspace.nexudus.model.silver;

import lombok.Builder;
import lombok.Data;

/**
 * Opening hours for one location on one weekday (silver.nexudus_location_hours).
 * Times are minutes since midnight, as Nexudus sends them (540 = 09:00).
 */
@Data
@Builder
public class LocationHoursRow {

    private long locationSourceId;
    /** 1 = Monday ... 7 = Sunday */
    private int dayOfWeek;
    private String dayName;
    private int isClosed;
    private Integer openTime;
    private Integer closeTime;
}
