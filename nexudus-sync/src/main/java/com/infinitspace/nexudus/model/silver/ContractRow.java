package com.infinitspace.nexudus.model.silver;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Typed row for silver.nexudus_contracts (Nexudus CoworkerContracts).
 */
@Data
@Builder
public class ContractRow {

    // ── Source ──────────────────────────────────────────────────────────────
    private long sourceId;
    private String uniqueId;
    private long bronzeId;
    private String syncRunId;

    // ── Status ──────────────────────────────────────────────────────────────
    private int active;
    private int cancelled;
    private int mainContract;
    private int inPausedPeriod;

    // ── Coworker ────────────────────────────────────────────────────────────
    private Long coworkerId;
    private String coworkerName;
    private String coworkerEmail;
    private String coworkerCompany;
    private String coworkerBillingName;
    private Integer coworkerType;
    private Integer coworkerActive;

    // ── Issuing location ────────────────────────────────────────────────────
    /** IssuedById, which is the location's source id */
    private Long locationSourceId;
    private String locationName;

    // ── Tariff ──────────────────────────────────────────────────────────────
    private Long tariffId;
    private String tariffName;
    private BigDecimal tariffPrice;
    private String currencyCode;
    private Long nextTariffId;
    private String nextTariffName;

    // ── Linked products (comma separated, as Nexudus sends them) ────────────
    private String floorPlanDeskIds;
    private String floorPlanDeskNames;

    // ── Pricing ─────────────────────────────────────────────────────────────
    private BigDecimal price;
    private BigDecimal priceWithProducts;
    private BigDecimal unitPrice;
    private Integer quantity;
    private Integer billingDay;

    // ── Billing flags ───────────────────────────────────────────────────────
    private Integer applyProRating;
    private Integer proRateCancellation;
    private Integer includeSignupFee;
    private Integer cancellationLimitDays;

    // ── Key dates ───────────────────────────────────────────────────────────
    private LocalDateTime startDate;
    private LocalDateTime contractTerm;
    private LocalDateTime renewalDate;
    private LocalDateTime cancellationDate;
    private LocalDateTime invoicedPeriod;

    private Integer termDurationMonths;

    // ── Audit ───────────────────────────────────────────────────────────────
    private String notes;
    private String updatedBy;

    // ── Timestamps ──────────────────────────────────────────────────────────
    private LocalDateTime createdOn;
    private LocalDateTime updatedOn;
}
