package com.infinitspace.nexudus.transform;

import com.infinitspace.nexudus.model.silver.ProductRow;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.infinitspace.nexudus.support.Payloads.json;
import static org.assertj.core.api.Assertions.assertThat;

class ProductTransformerTest {

    private final ProductTransformer transformer = new ProductTransformer();

    @Test
    void transform_PrivateOffice_ReadsCustomSizeAndLeavesRoomFieldsNull() {
        // Arrange
        var raw = json("""
                {
                  "Id": 501, "ItemType": 1, "Name": "Office 12",
                  "FloorPlanBusinessId": 1001, "FloorPlanBusinessName": "Belfast Central",
                  "FloorPlanBusinessCurrencyCode": "GBP",
                  "Price": 1450.00, "Available": false, "Area": "",
                  "CoworkerTeamNames": null, "CoworkerCompanyName": "Acme Ltd",
                  "Capacity": "6",
                  "ResourceId": 77, "ResourceAirConditioning": true,
                  "CustomFields": {"Data": [
                    {"Name": "Other", "Value": "x"},
                    {"Name": "Nexudus.FloorPlan.Size", "Value": "23.5"}
                  ]}
                }
                """);

        // Act
        ProductRow row = transformer.transform(raw, 3L, "run-1").orElseThrow();

        // Assert
        assertThat(row.getProductTypeLabel()).isEqualTo("Private Office");
        assertThat(row.getLocationSourceId()).isEqualTo(1001L);
        assertThat(row.getPrice()).isEqualByComparingTo(new BigDecimal("1450"));
        assertThat(row.getIsAvailable()).isZero();
        assertThat(row.getAreaCode()).isNull();
        assertThat(row.getCoworkerCompany()).isEqualTo("Acme Ltd");
        assertThat(row.getCapacity()).isEqualTo(6);
        assertThat(row.getCustomSizeSqm()).isEqualByComparingTo(new BigDecimal("23.5"));
        assertThat(row.getResourceId()).isNull();
        assertThat(row.getAmenityAirConditioning()).isNull();
    }

    @Test
    void transform_MeetingRoom_CarriesResourceAndAmenities() {
        // Arrange
        var raw = json("""
                {
                  "Id": 502, "ItemType": 5, "ToStringText": "Boardroom",
                  "ResourceId": 88, "ResourceName": "Boardroom", "ResourceResourceTypeName": "Meeting room",
                  "ResourceAllocation": 10, "ResourceShifts": "",
                  "ResourceAirConditioning": true, "ResourceProjector": false, "ResourceCCTV": 1,
                  "CoworkerTeamNames": "Team A", "CoworkerCompanyName": "Acme Ltd"
                }
                """);

        // Act
        ProductRow row = transformer.transform(raw, 4L, "run-1").orElseThrow();

        // Assert
        assertThat(row.getName()).isEqualTo("Boardroom");
        assertThat(row.getProductTypeLabel()).isEqualTo("Meeting Room");
        assertThat(row.getResourceId()).isEqualTo(88L);
        assertThat(row.getResourceTypeName()).isEqualTo("Meeting room");
        assertThat(row.getResourceAllocation()).isEqualTo(10);
        assertThat(row.getResourceShifts()).isNull();
        assertThat(row.getAmenityAirConditioning()).isEqualTo(1);
        assertThat(row.getAmenityProjector()).isEqualTo(0);
        assertThat(row.getAmenityCctv()).isEqualTo(1);
        assertThat(row.getAmenityWhiteboard()).isNull();
        assertThat(row.getCoworkerCompany()).isEqualTo("Team A");
        assertThat(row.getCustomSizeSqm()).isNull();
    }

    @Test
    void transform_UnknownItemTypeAndNoName() {
        ProductRow row = transformer.transform(json("{\"Id\": 9, \"ItemType\": 42}"), 1L, "r").orElseThrow();

        assertThat(row.getProductTypeLabel()).isEqualTo("Unknown");
        assertThat(row.getName()).isEqualTo("Unknown");
    }
}
