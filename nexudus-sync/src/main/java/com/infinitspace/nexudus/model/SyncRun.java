package com.infinitspace.nexudus.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One tracked execution of a sync step for one entity and one layer.
 * Stored in meta.sync_runs; never deleted.
 */
@Data
@Builder
public class SyncRun {

    private String runId;           // UUID, keys meta.sync_errors
    private String sourceName;      // "nexudus"
    private String entity;
    private SyncLayer layer;
    private RunStatus status;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private int rowsRead;
    private int rowsWritten;
    private int rowsSkipped;
    private String errorMessage;    // null on success
    private String triggeredBy;     // cron | manual | startup
    private String metadata;        // invocation run id shared by all steps of one phase
}
