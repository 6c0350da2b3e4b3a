package com.infinitspace.nexudus.model.silver;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Typed row for silver.nexudus_products (Nexudus FloorPlanDesks, every item type).
 *
 * The resource and amenity columns only apply to item types 4 (Other) and
 * 5 (Meeting Room); they are null for offices and desks.
 */
@Data
@Builder
public class ProductRow {

    // ── Source ──────────────────────────────────────────────────────────────
    private long sourceId;
    private long bronzeId;
    private String syncRunId;

    // ── Classification ──────────────────────────────────────────────────────
    private Integer itemType;
    private String productTypeLabel;

    // ── Location ────────────────────────────────────────────────────────────
    private Long locationSourceId;
    private String locationName;
    private Long floorPlanId;
    private String floorPlanName;

    // ── Identity ────────────────────────────────────────────────────────────
    private String name;
    private String areaCode;

    // ── Pricing ─────────────────────────────────────────────────────────────
    private BigDecimal price;
    private String currencyCode;

    // ── Availability ────────────────────────────────────────────────────────
    private int isAvailable;
    private LocalDateTime availableFrom;
    private LocalDateTime availableTo;

    // ── Current occupant ────────────────────────────────────────────────────
    private Long coworkerId;
    private String coworkerName;
    private String coworkerCompany;
    private String coworkerEmail;
    private String contractIdsRaw;

    // ── Physical ────────────────────────────────────────────────────────────
    private BigDecimal sizeSqm;
    /** From CustomFields "Nexudus.FloorPlan.Size"; only private offices carry it */
    private BigDecimal customSizeSqm;
    private Integer capacity;
    private Integer sizeIsLinkedToArea;

    // ── Resource (types 4+5) ────────────────────────────────────────────────
    private Long resourceId;
    private String resourceName;
    private String resourceTypeName;
    private Integer resourceAllocation;
    private String resourceShifts;

    // ── Amenities (types 4+5) ───────────────────────────────────────────────
    private Integer amenityAirConditioning;
    private Integer amenityHeating;
    private Integer amenityInternet;
    private Integer amenityLargeDisplay;
    private Integer amenityNaturalLight;
    private Integer amenityWhiteboard;
    private Integer amenitySoundproof;
    private Integer amenityQuietZone;
    private Integer amenityTeaCoffee;
    private Integer amenitySecurityLock;
    private Integer amenityCctv;
    private Integer amenityCatering;
    private Integer amenityConferencePhone;
    private Integer amenityProjector;
    private Integer amenityStandingDesk;
    private Integer amenityDrinks;
    private Integer amenityPrivacyScreen;
    private Integer amenityVoiceRecorder;
    private Integer amenityStandardPhone;
    private Integer amenityWirelessCharger;

    // ── Timestamps ──────────────────────────────────────────────────────────
    private LocalDateTime createdOn;
    private LocalDateTime updatedOn;
}
