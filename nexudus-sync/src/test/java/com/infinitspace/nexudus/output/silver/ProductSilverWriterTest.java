package com.infinitspace.nexudus.output.silver;

import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.SilverResult;
import com.infinitspace.nexudus.support.SilverFixture;
import com.infinitspace.nexudus.transform.ProductTransformer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProductSilverWriterTest {

    private static final LocalDateTime SYNCED = LocalDateTime.of(2026, 3, 1, 2, 0);

    private SilverFixture fixture;
    private ProductSilverWriter writer;

    @BeforeEach
    void setUp() {
        fixture = new SilverFixture();
        writer = new ProductSilverWriter(fixture.sqlClient(), SilverFixture.MAPPER, new ProductTransformer());
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void write_DropsProductsOfNonPhysicalLocations() {
        // Arrange
        fixture.insertBronze(NexudusEntity.PRODUCTS, 501,
                "{\"Id\": 501, \"ItemType\": 1, \"Name\": \"Office 1\", \"FloorPlanBusinessId\": 1001}", SYNCED);
        fixture.insertBronze(NexudusEntity.PRODUCTS, 502,
                "{\"Id\": 502, \"ItemType\": 3, \"Name\": \"Demo desk\", \"FloorPlanBusinessId\": 1376491117}", SYNCED);

        // Act
        SilverResult result = writer.write("inv-1", fixture.openRun(NexudusEntity.PRODUCTS));

        // Assert
        assertThat(result.written()).isEqualTo(1);
        assertThat(result.excluded()).isEqualTo(1);
        assertThat(result.errors()).isZero();
        assertThat(fixture.rows("SELECT source_id FROM silver.nexudus_products").get(0).get("source_id"))
                .isEqualTo(501L);
    }

    @Test
    void write_MeetingRoomColumnsLand() {
        fixture.insertBronze(NexudusEntity.PRODUCTS, 503, """
                {"Id": 503, "ItemType": 5, "Name": "Boardroom", "FloorPlanBusinessId": 1001,
                 "Price": 45.5, "ResourceId": 88, "ResourceProjector": true, "Available": true}
                """, SYNCED);

        writer.write("inv-1", fixture.openRun(NexudusEntity.PRODUCTS));

        Map<String, Object> row = fixture.rows("SELECT * FROM silver.nexudus_products").get(0);
        assertThat(row.get("product_type_label")).isEqualTo("Meeting Room");
        assertThat(row.get("resource_id")).isEqualTo(88L);
        assertThat(((Number) row.get("amenity_projector")).intValue()).isEqualTo(1);
        assertThat(row.get("amenity_heating")).isNull();
        assertThat(((Number) row.get("is_available")).intValue()).isEqualTo(1);
        assertThat((BigDecimal) row.get("price")).isEqualByComparingTo("45.5");
    }

    @Test
    void write_UpsertRejectedByStore_FailsTheStep() {
        // currency_code is VARCHAR(10); the store refuses the row
        fixture.insertBronze(NexudusEntity.PRODUCTS, 504, """
                {"Id": 504, "ItemType": 1, "Name": "Office", "FloorPlanBusinessCurrencyCode": "NOT-A-CURRENCY-CODE"}
                """, SYNCED);

        assertThatThrownBy(() -> writer.write("inv-1", fixture.openRun(NexudusEntity.PRODUCTS)))
                .isInstanceOf(DataAccessException.class);
    }
}
