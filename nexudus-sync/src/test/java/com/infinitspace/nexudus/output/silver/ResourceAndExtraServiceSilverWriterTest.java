package com.infinitspace.nexudus.output.silver;

import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.SilverResult;
import com.infinitspace.nexudus.support.SilverFixture;
import com.infinitspace.nexudus.transform.ExtraServiceTransformer;
import com.infinitspace.nexudus.transform.ResourceTransformer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceAndExtraServiceSilverWriterTest {

    private static final LocalDateTime SYNCED = LocalDateTime.of(2026, 3, 1, 2, 0);

    private SilverFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SilverFixture();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void resources_DefaultsMissingFlagsToZero() {
        ResourceSilverWriter writer = new ResourceSilverWriter(
                fixture.sqlClient(), SilverFixture.MAPPER, new ResourceTransformer());
        fixture.insertBronze(NexudusEntity.RESOURCES, 88, """
                {"Id": 88, "BusinessId": 1001, "Name": "Boardroom", "ResourceTypeName": "Meeting room",
                 "Visible": true, "Capacity": 12}
                """, SYNCED);

        SilverResult result = writer.write("inv-1", fixture.openRun(NexudusEntity.RESOURCES));

        assertThat(result.written()).isEqualTo(1);
        Map<String, Object> row = fixture.rows("SELECT * FROM silver.nexudus_resources").get(0);
        assertThat(row.get("resource_type_name")).isEqualTo("Meeting room");
        assertThat(((Number) row.get("visible")).intValue()).isEqualTo(1);
        assertThat(((Number) row.get("online")).intValue()).isZero();
        assertThat(row.get("capacity")).isEqualTo(12);
    }

    @Test
    void extraServices_MissingBusinessId_IsARecordError() {
        ExtraServiceSilverWriter writer = new ExtraServiceSilverWriter(
                fixture.sqlClient(), SilverFixture.MAPPER, new ExtraServiceTransformer());
        fixture.insertBronze(NexudusEntity.EXTRA_SERVICES, 70, "{\"Id\": 70, \"BusinessId\": 1001, \"Name\": \"Day pass\"}", SYNCED);
        fixture.insertBronze(NexudusEntity.EXTRA_SERVICES, 71, "{\"Id\": 71, \"Name\": \"Orphan\"}", SYNCED);

        SilverResult result = writer.write("inv-1", fixture.openRun(NexudusEntity.EXTRA_SERVICES));

        assertThat(result.written()).isEqualTo(1);
        assertThat(result.errors()).isEqualTo(1);
        assertThat(fixture.rows("SELECT entity FROM meta.sync_errors").get(0).get("entity"))
                .isEqualTo("extra_services");
    }

    @Test
    void resources_MissingId_IsARecordErrorNotAnExclusion() {
        ResourceSilverWriter writer = new ResourceSilverWriter(
                fixture.sqlClient(), SilverFixture.MAPPER, new ResourceTransformer());
        fixture.insertBronze(NexudusEntity.RESOURCES, 88, "{\"Id\": 88, \"Name\": \"Boardroom\"}", SYNCED);
        fixture.insertBronzeWithoutId(NexudusEntity.RESOURCES, "{\"Name\": \"Unlinked\"}", SYNCED);

        SilverResult result = writer.write("inv-1", fixture.openRun(NexudusEntity.RESOURCES));

        assertThat(result.written()).isEqualTo(1);
        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.excluded()).isZero();
        assertThat(fixture.rows("SELECT error_message FROM meta.sync_errors").get(0).get("error_message"))
                .isEqualTo("Missing required field Id");
    }
}
