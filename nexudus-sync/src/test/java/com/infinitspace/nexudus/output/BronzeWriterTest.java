package com.infinitspace.nexudus.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.config.NexudusSyncProperties;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.RoutingContext;
import com.infinitspace.nexudus.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.infinitspace.nexudus.support.Payloads.json;
import static org.assertj.core.api.Assertions.assertThat;

class BronzeWriterTest {

    private EmbeddedDatabase database;
    private SqlClient sqlClient;
    private NexudusSyncProperties properties;
    private BronzeWriter writer;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        sqlClient = TestDatabase.sqlClient(database);
        properties = new NexudusSyncProperties();
        writer = new BronzeWriter(sqlClient, new ObjectMapper(), properties,
                Clock.fixed(Instant.parse("2026-03-01T02:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void write_StoresRecordVerbatimWithRoutingKeys() {
        // Arrange
        JsonNode product = json("""
                {"Id": 501, "FloorPlanBusinessId": 1001, "ItemType": 1, "Name": "Office 12", "Extra": [1, 2]}
                """);

        // Act
        int written = writer.write(NexudusEntity.PRODUCTS, "inv-1", List.of(product));

        // Assert
        assertThat(written).isEqualTo(1);
        Map<String, Object> row = sqlClient.executeQuery("SELECT * FROM bronze.nexudus_products").get(0);
        assertThat(row.get("sync_run_id")).isEqualTo("inv-1");
        assertThat(row.get("source_id")).isEqualTo(501L);
        assertThat(row.get("location_id")).isEqualTo(1001L);
        assertThat(row.get("item_type")).isEqualTo(1);
        assertThat(json((String) row.get("raw_json")).equals(product)).isTrue();
        assertThat(((Timestamp) row.get("synced_at")).toLocalDateTime())
                .isEqualTo(LocalDateTime.of(2026, 3, 1, 2, 0));
    }

    @Test
    void write_SameRecordTwice_AppendsTwoRows() {
        JsonNode location = json("{\"Id\": 1001, \"Name\": \"Belfast\"}");

        writer.write(NexudusEntity.LOCATIONS, "inv-1", List.of(location));
        writer.write(NexudusEntity.LOCATIONS, "inv-2", List.of(location));

        assertThat(sqlClient.executeScalar(
                "SELECT COUNT(*) FROM bronze.nexudus_locations WHERE source_id = 1001", Integer.class))
                .isEqualTo(2);
    }

    @Test
    void write_ResourcesTakeLocationFromContext() {
        writer.write(NexudusEntity.RESOURCES, "inv-1", List.of(json("{\"Id\": 88}")),
                RoutingContext.forLocation(1001L));

        Map<String, Object> row = sqlClient.executeQuery("SELECT * FROM bronze.nexudus_resources").get(0);
        assertThat(row.get("location_id")).isEqualTo(1001L);
    }

    @Test
    void write_MoreRecordsThanBatchSize_WritesAll() {
        properties.getBronze().setBatchSize(2);
        List<JsonNode> services = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            services.add(json("{\"Id\": " + i + ", \"BusinessId\": 1001}"));
        }

        int written = writer.write(NexudusEntity.EXTRA_SERVICES, "inv-1", services);

        assertThat(written).isEqualTo(5);
        assertThat(sqlClient.executeScalar("SELECT COUNT(*) FROM bronze.nexudus_extra_services", Integer.class))
                .isEqualTo(5);
    }

    @Test
    void write_EmptyList_WritesNothing() {
        assertThat(writer.write(NexudusEntity.CONTRACTS, "inv-1", List.of())).isZero();
    }

    @Test
    void write_RecordWithoutId_KeptWithNullSourceId() {
        // Arrange
        List<JsonNode> records = List.of(
                json("{\"Id\": 1, \"Name\": \"Belfast\"}"),
                json("{\"Name\": \"Lost its id\"}"),
                json("{\"Id\": 3, \"Name\": \"Derry\"}"));

        // Act
        int written = writer.write(NexudusEntity.LOCATIONS, "inv-1", records);

        // Assert
        assertThat(written).isEqualTo(3);
        List<Map<String, Object>> rows = sqlClient.executeQuery(
                "SELECT source_id, raw_json FROM bronze.nexudus_locations ORDER BY id");
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).get("source_id")).isEqualTo(1L);
        assertThat(rows.get(1).get("source_id")).isNull();
        assertThat(json((String) rows.get(1).get("raw_json")).equals(records.get(1))).isTrue();
        assertThat(rows.get(2).get("source_id")).isEqualTo(3L);
    }
}
