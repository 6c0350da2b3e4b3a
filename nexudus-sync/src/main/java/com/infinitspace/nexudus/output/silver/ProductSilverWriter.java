package com.infinitspace.nexudus.output.silver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.silver.ProductRow;
import com.infinitspace.nexudus.output.SqlClient;
import com.infinitspace.nexudus.transform.EntityTransformer;
import com.infinitspace.nexudus.transform.ExcludedLocations;
import com.infinitspace.nexudus.transform.ProductTransformer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * silver.nexudus_products. Products that belong to a non-physical location are dropped.
 */
@Component
public class ProductSilverWriter extends AbstractSilverWriter<ProductRow> {

    private static final MergeStatement MERGE = MergeStatement.onSourceId(
            "silver.nexudus_products",
            List.of("bronze_id", "sync_run_id", "item_type", "product_type_label",
                    "location_source_id", "location_name", "floor_plan_id", "floor_plan_name",
                    "name", "area_code", "price", "currency_code",
                    "is_available", "available_from", "available_to",
                    "coworker_id", "coworker_name", "coworker_company", "coworker_email", "contract_ids_raw",
                    "size_sqm", "custom_size_sqm", "capacity", "size_is_linked_to_area",
                    "resource_id", "resource_name", "resource_type_name", "resource_allocation", "resource_shifts",
                    "amenity_air_conditioning", "amenity_heating", "amenity_internet", "amenity_large_display",
                    "amenity_natural_light", "amenity_whiteboard", "amenity_soundproof", "amenity_quiet_zone",
                    "amenity_tea_coffee", "amenity_security_lock", "amenity_cctv", "amenity_catering",
                    "amenity_conference_phone", "amenity_projector", "amenity_standing_desk", "amenity_drinks",
                    "amenity_privacy_screen", "amenity_voice_recorder", "amenity_standard_phone",
                    "amenity_wireless_charger",
                    "created_on", "updated_on"));

    private final ProductTransformer transformer;

    public ProductSilverWriter(SqlClient sqlClient, ObjectMapper objectMapper, ProductTransformer transformer) {
        super(sqlClient, objectMapper);
        this.transformer = transformer;
    }

    @Override
    public NexudusEntity entity() {
        return NexudusEntity.PRODUCTS;
    }

    @Override
    protected EntityTransformer<ProductRow> transformer() {
        return transformer;
    }

    @Override
    protected boolean skip(ProductRow row) {
        return ExcludedLocations.contains(row.getLocationSourceId());
    }

    @Override
    protected void upsert(ProductRow r) {
        sqlClient.executeNonQuery(MERGE.sql(), MERGE.bind(
                new Object[]{r.getSourceId()},
                new Object[]{r.getBronzeId(), r.getSyncRunId(), r.getItemType(), r.getProductTypeLabel(),
                        r.getLocationSourceId(), r.getLocationName(), r.getFloorPlanId(), r.getFloorPlanName(),
                        r.getName(), r.getAreaCode(), r.getPrice(), r.getCurrencyCode(),
                        r.getIsAvailable(), r.getAvailableFrom(), r.getAvailableTo(),
                        r.getCoworkerId(), r.getCoworkerName(), r.getCoworkerCompany(), r.getCoworkerEmail(),
                        r.getContractIdsRaw(),
                        r.getSizeSqm(), r.getCustomSizeSqm(), r.getCapacity(), r.getSizeIsLinkedToArea(),
                        r.getResourceId(), r.getResourceName(), r.getResourceTypeName(), r.getResourceAllocation(),
                        r.getResourceShifts(),
                        r.getAmenityAirConditioning(), r.getAmenityHeating(), r.getAmenityInternet(),
                        r.getAmenityLargeDisplay(), r.getAmenityNaturalLight(), r.getAmenityWhiteboard(),
                        r.getAmenitySoundproof(), r.getAmenityQuietZone(), r.getAmenityTeaCoffee(),
                        r.getAmenitySecurityLock(), r.getAmenityCctv(), r.getAmenityCatering(),
                        r.getAmenityConferencePhone(), r.getAmenityProjector(), r.getAmenityStandingDesk(),
                        r.getAmenityDrinks(), r.getAmenityPrivacyScreen(), r.getAmenityVoiceRecorder(),
                        r.getAmenityStandardPhone(), r.getAmenityWirelessCharger(),
                        r.getCreatedOn(), r.getUpdatedOn()}));
    }
}
