package com.infinitspace.nexudus.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.config.NexudusSyncProperties;
import com.infinitspace.nexudus.model.NexudusEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes snapshot envelopes as JSON files under
 * {outputDir}/nexudus/{entity}/{yyyy}/{MM}/{dd}/{runId}.json.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FileSnapshotWriter implements SnapshotWriter {

    private static final DateTimeFormatter DAY_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final NexudusSyncProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Path write(String entity, String runId, List<?> records) {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);

        Path file = Paths.get(properties.getSnapshot().getOutputDir(), NexudusEntity.SOURCE_NAME, entity)
                .resolve(now.format(DAY_PATH))
                .resolve(runId + ".json");

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("source", NexudusEntity.SOURCE_NAME);
        envelope.put("entity", entity);
        envelope.put("run_id", runId);
        envelope.put("snapshot_at_utc", now.toString());
        envelope.put("row_count", records.size());
        envelope.put("records", records);

        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), envelope);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot " + file, e);
        }

        log.info("Snapshot written: {} ({} records)", file, records.size());
        return file;
    }
}
