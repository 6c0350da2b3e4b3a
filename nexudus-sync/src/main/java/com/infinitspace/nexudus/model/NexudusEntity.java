package com.infinitspace.nexudus.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.transform.PayloadValues;

import java.util.List;
import java.util.function.BiFunction;

/**
 * The Nexudus entities we replicate, with their listing endpoint, bronze table and
 * the denormalised routing columns extracted at bronze write time.
 */
public enum NexudusEntity {

    LOCATIONS("locations", "sys/businesses",
            "bronze.nexudus_locations", "silver.nexudus_locations",
            List.of(),
            (raw, ctx) -> new Object[0]),

    PRODUCTS("products", "sys/floorplandesks",
            "bronze.nexudus_products", "silver.nexudus_products",
            List.of("location_id", "item_type"),
            (raw, ctx) -> new Object[]{
                    PayloadValues.toLong(raw.get("FloorPlanBusinessId")),
                    PayloadValues.toInt(raw.get("ItemType"))}),

    CONTRACTS("contracts", "billing/coworkercontracts",
            "bronze.nexudus_contracts", "silver.nexudus_contracts",
            List.of("product_id", "location_id"),
            (raw, ctx) -> new Object[]{ctx.productId(), ctx.locationId()}),

    RESOURCES("resources", "spaces/resources",
            "bronze.nexudus_resources", "silver.nexudus_resources",
            List.of("location_id"),
            (raw, ctx) -> new Object[]{ctx.locationId()}),

    EXTRA_SERVICES("extra_services", "billing/extraservices",
            "bronze.nexudus_extra_services", "silver.nexudus_extra_services",
            List.of("location_id"),
            (raw, ctx) -> new Object[]{PayloadValues.toLong(raw.get("BusinessId"))});

    public static final String SOURCE_NAME = "nexudus";

    private final String entityName;
    private final String path;
    private final String bronzeTable;
    private final String silverTable;
    private final List<String> routingColumns;
    private final BiFunction<JsonNode, RoutingContext, Object[]> routingExtractor;

    NexudusEntity(String entityName, String path, String bronzeTable, String silverTable,
                  List<String> routingColumns,
                  BiFunction<JsonNode, RoutingContext, Object[]> routingExtractor) {
        this.entityName = entityName;
        this.path = path;
        this.bronzeTable = bronzeTable;
        this.silverTable = silverTable;
        this.routingColumns = routingColumns;
        this.routingExtractor = routingExtractor;
    }

    public String entityName() { return entityName; }

    public String path() { return path; }

    public String bronzeTable() { return bronzeTable; }

    public String silverTable() { return silverTable; }

    public List<String> routingColumns() { return routingColumns; }

    public Object[] routingValues(JsonNode raw, RoutingContext context) {
        return routingExtractor.apply(raw, context == null ? RoutingContext.none() : context);
    }

    /**
     * Natural id of a raw record. Contracts come back with either "Id" or "id".
     *
     * @throws IllegalArgumentException if the payload has no usable id
     */
    public long naturalId(JsonNode raw) {
        Long value = naturalIdOrNull(raw);
        if (value == null) {
            throw new IllegalArgumentException(entityName + " record has no natural id");
        }
        return value;
    }

    /** Same as {@link #naturalId(JsonNode)}, but null when the payload carries no usable id. */
    public Long naturalIdOrNull(JsonNode raw) {
        JsonNode id = raw.get("Id");
        if (this == CONTRACTS && PayloadValues.isAbsent(id)) {
            id = raw.get("id");
        }
        return PayloadValues.toLong(id);
    }
}
