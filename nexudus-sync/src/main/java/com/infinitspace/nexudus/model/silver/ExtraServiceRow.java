package com.infinitspace.nexudus.model.silver;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Typed row for silver.nexudus_extra_services (day passes, meeting room rates).
 */
@Data
@Builder
public class ExtraServiceRow {

    // ── Source ──────────────────────────────────────────────────────────────
    private long sourceId;
    private String uniqueId;
    private long bronzeId;
    private String syncRunId;

    private long locationSourceId;

    // ── Identity ────────────────────────────────────────────────────────────
    private String name;
    private String description;

    // ── Pricing ─────────────────────────────────────────────────────────────
    private BigDecimal price;
    private String currencyCode;
    private Integer chargePeriod;
    private BigDecimal creditPrice;
    private BigDecimal fixedCostPrice;
    private Integer fixedCostLengthMinutes;
    private BigDecimal maximumPrice;
    private Integer minLengthMinutes;
    private Integer maxLengthMinutes;

    // ── Flags (never null for extra services) ───────────────────────────────
    private int isDefaultPrice;
    private int isPrintingCredit;
    private int onlyForContacts;
    private int onlyForMembers;
    private int applyChargeToVisitors;
    private int usePerNightPricing;

    private Integer lastMinuteAdjustmentType;

    // ── Availability window ─────────────────────────────────────────────────
    private LocalDateTime applyFrom;
    private LocalDateTime applyTo;

    /** Soft link to silver.nexudus_products.resource_type_name */
    private String resourceTypeNames;

    // ── Financial ───────────────────────────────────────────────────────────
    private Integer taxRateId;
    private Integer reducedTaxRateId;
    private Integer exemptTaxRateId;
    private Integer financialAccountId;

    private String updatedBy;

    private LocalDateTime createdOn;
    private LocalDateTime updatedOn;
}
