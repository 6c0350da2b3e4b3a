package com.infinitspace.nexudus.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.config.NexudusSyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.infinitspace.nexudus.support.Payloads.json;
import static org.assertj.core.api.Assertions.assertThat;

class FileSnapshotWriterTest {

    @TempDir
    Path outputDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FileSnapshotWriter writer;

    @BeforeEach
    void setUp() {
        NexudusSyncProperties properties = new NexudusSyncProperties();
        properties.getSnapshot().setOutputDir(outputDir.toString());
        writer = new FileSnapshotWriter(properties, objectMapper,
                Clock.fixed(Instant.parse("2026-03-07T02:15:00Z"), ZoneOffset.UTC));
    }

    @Test
    void write_PartitionsByEntityAndDate() throws IOException {
        // Act
        Path file = writer.write("locations", "inv-1", List.of(json("{\"Id\": 1}"), json("{\"Id\": 2}")));

        // Assert
        assertThat(file).isEqualTo(outputDir.resolve("nexudus/locations/2026/03/07/inv-1.json"));
        JsonNode envelope = objectMapper.readTree(file.toFile());
        assertThat(envelope.get("source").asText()).isEqualTo("nexudus");
        assertThat(envelope.get("entity").asText()).isEqualTo("locations");
        assertThat(envelope.get("run_id").asText()).isEqualTo("inv-1");
        assertThat(envelope.get("snapshot_at_utc").asText()).startsWith("2026-03-07T02:15");
        assertThat(envelope.get("row_count").asInt()).isEqualTo(2);
        assertThat(envelope.get("records").size()).isEqualTo(2);
    }

    @Test
    void write_SameRunTwice_Overwrites() throws IOException {
        writer.write("products", "inv-1", List.of(json("{\"Id\": 1}")));
        Path file = writer.write("products", "inv-1", List.of());

        assertThat(objectMapper.readTree(file.toFile()).get("row_count").asInt()).isZero();
    }
}
