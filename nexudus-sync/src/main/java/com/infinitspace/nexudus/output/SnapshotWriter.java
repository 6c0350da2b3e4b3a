package com.infinitspace.nexudus.output;

import java.nio.file.Path;
import java.util.List;

/**
 * Durable archive of each raw pull, written before the bronze append.
 */
public interface SnapshotWriter {

    /**
     * Writes (or overwrites) the snapshot for one entity in one run.
     *
     * @return where the snapshot landed
     */
    Path write(String entity, String runId, List<?> records);
}
