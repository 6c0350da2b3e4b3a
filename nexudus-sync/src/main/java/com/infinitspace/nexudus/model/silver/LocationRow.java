package com.infinitspace.nexudus.model.silver;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Typed row for silver.nexudus_locations. One row per Nexudus business.
 */
@Data
@Builder
public class LocationRow {

    // ── Source ──────────────────────────────────────────────────────────────
    private long sourceId;
    private long bronzeId;
    private String syncRunId;

    // ── Identity ────────────────────────────────────────────────────────────
    private String nexudusUuid;
    /** Never null: falls back to ToStringText, then "Unknown" */
    private String name;
    /** Subdomain slug, e.g. "beyond" */
    private String webAddress;

    // ── Location ────────────────────────────────────────────────────────────
    private String address;
    private String postalCode;
    private String city;
    private String state;
    private String countryName;
    private Integer countryId;
    private Double latitude;
    private Double longitude;

    // ── Contact ─────────────────────────────────────────────────────────────
    private String phone;
    private String email;
    private String webContact;

    // ── Financial ───────────────────────────────────────────────────────────
    private String currencyCode;

    // ── Content (HTML stripped) ─────────────────────────────────────────────
    private String description;
    private String shortIntro;

    // ── Timestamps ──────────────────────────────────────────────────────────
    private LocalDateTime createdOn;
    private LocalDateTime updatedOn;
}
