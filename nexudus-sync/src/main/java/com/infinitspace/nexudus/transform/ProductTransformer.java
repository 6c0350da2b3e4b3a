package com.infinitspace.nexudus.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.model.silver.ProductRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static com.infinitspace.nexudus.transform.PayloadValues.*;

/**
 * Maps a Nexudus FloorPlanDesk of any item type to a silver product row.
 *
 * Bookable rooms (types 4 and 5) also carry their linked resource and its
 * amenities; for every other type those columns stay null.
 */
@Component
public class ProductTransformer implements EntityTransformer<ProductRow> {

    static final Map<Integer, String> ITEM_TYPE_LABELS = Map.of(
            1, "Private Office",
            2, "Dedicated Desk",
            3, "Hot Desk",
            4, "Other",
            5, "Meeting Room"
    );

    private static final String CUSTOM_SIZE_FIELD = "Nexudus.FloorPlan.Size";

    @Override
    public Optional<ProductRow> transform(JsonNode raw, long bronzeId, String syncRunId) {
        long sourceId = requireLong(raw, "Id");
        Integer itemType = toInt(raw.get("ItemType"));
        boolean room = itemType != null && (itemType == 4 || itemType == 5);

        String name = firstText(raw.get("Name"), raw.get("ToStringText"));

        ProductRow.ProductRowBuilder row = ProductRow.builder()
                .sourceId(sourceId)
                .bronzeId(bronzeId)
                .syncRunId(syncRunId)
                .itemType(itemType)
                .productTypeLabel(ITEM_TYPE_LABELS.getOrDefault(itemType, "Unknown"))
                .locationSourceId(toLong(raw.get("FloorPlanBusinessId")))
                .locationName(str(raw.get("FloorPlanBusinessName")))
                .floorPlanId(toLong(raw.get("FloorPlanId")))
                .floorPlanName(str(raw.get("FloorPlanName")))
                .name(name != null ? name : "Unknown")
                .areaCode(str(raw.get("Area")))
                .price(decimal(raw.get("Price")))
                .currencyCode(str(raw.get("FloorPlanBusinessCurrencyCode")))
                .isAvailable(bitOrZero(raw.get("Available")))
                .availableFrom(dateTime(raw.get("AvailableFromTime")))
                .availableTo(dateTime(raw.get("AvailableToTime")))
                .coworkerId(toLong(raw.get("CoworkerId")))
                .coworkerName(str(raw.get("CoworkerFullName")))
                .coworkerCompany(firstText(raw.get("CoworkerTeamNames"), raw.get("CoworkerCompanyName")))
                .coworkerEmail(str(raw.get("CoworkerEmail")))
                .contractIdsRaw(str(raw.get("CoworkerContractIds")))
                .sizeSqm(decimal(raw.get("Size")))
                .customSizeSqm(customSize(raw))
                .capacity(toInt(raw.get("Capacity")))
                .sizeIsLinkedToArea(bit(raw.get("SizeIsLinkedToArea")))
                .createdOn(dateTime(raw.get("CreatedOn")))
                .updatedOn(dateTime(raw.get("UpdatedOn")));

        if (room) {
            row.resourceId(toLong(raw.get("ResourceId")))
                    .resourceName(str(raw.get("ResourceName")))
                    .resourceTypeName(str(raw.get("ResourceResourceTypeName")))
                    .resourceAllocation(toInt(raw.get("ResourceAllocation")))
                    .resourceShifts(str(raw.get("ResourceShifts")))
                    .amenityAirConditioning(bit(raw.get("ResourceAirConditioning")))
                    .amenityHeating(bit(raw.get("ResourceHeating")))
                    .amenityInternet(bit(raw.get("ResourceInternet")))
                    .amenityLargeDisplay(bit(raw.get("ResourceLargeDisplay")))
                    .amenityNaturalLight(bit(raw.get("ResourceNaturalLight")))
                    .amenityWhiteboard(bit(raw.get("ResourceWhiteBoard")))
                    .amenitySoundproof(bit(raw.get("ResourceSoundproof")))
                    .amenityQuietZone(bit(raw.get("ResourceQuietZone")))
                    .amenityTeaCoffee(bit(raw.get("ResourceTeaAndCoffee")))
                    .amenitySecurityLock(bit(raw.get("ResourceSecurityLock")))
                    .amenityCctv(bit(raw.get("ResourceCCTV")))
                    .amenityCatering(bit(raw.get("ResourceCatering")))
                    .amenityConferencePhone(bit(raw.get("ResourceConferencePhone")))
                    .amenityProjector(bit(raw.get("ResourceProjector")))
                    .amenityStandingDesk(bit(raw.get("ResourceStandingDesk")))
                    .amenityDrinks(bit(raw.get("ResourceDrinks")))
                    .amenityPrivacyScreen(bit(raw.get("ResourcePrivacyScreen")))
                    .amenityVoiceRecorder(bit(raw.get("ResourceVoiceRecorder")))
                    .amenityStandardPhone(bit(raw.get("ResourceStandardPhone")))
                    .amenityWirelessCharger(bit(raw.get("ResourceWirelessCharger")));
        }

        return Optional.of(row.build());
    }

    // Only private offices carry this, under CustomFields.Data[].
    private BigDecimal customSize(JsonNode raw) {
        JsonNode custom = raw.get("CustomFields");
        if (custom == null || !custom.isObject()) return null;
        JsonNode data = custom.get("Data");
        if (data == null || !data.isArray()) return null;
        for (JsonNode field : data) {
            if (CUSTOM_SIZE_FIELD.equals(str(field.get("Name")))) {
                return decimal(field.get("Value"));
            }
        }
        return null;
    }
}
