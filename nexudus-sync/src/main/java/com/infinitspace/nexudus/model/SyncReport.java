package com.infinitspace.nexudus.model;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Per-entity outcomes of one bronze or silver phase.
 */
@Getter
public class SyncReport {

    public enum Outcome { SUCCESS, FAILED, SKIPPED }

    public record EntityOutcome(String entity, Outcome outcome, int rowsRead, int rowsWritten,
                                int rowsSkipped, String errorMessage) {}

    private final String invocationId;
    private final SyncLayer layer;
    private final LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private final List<EntityOutcome> entities = new ArrayList<>();

    public SyncReport(String invocationId, SyncLayer layer, LocalDateTime startedAt) {
        this.invocationId = invocationId;
        this.layer = layer;
        this.startedAt = startedAt;
    }

    public void succeeded(String entity, int rowsRead, int rowsWritten, int rowsSkipped) {
        entities.add(new EntityOutcome(entity, Outcome.SUCCESS, rowsRead, rowsWritten, rowsSkipped, null));
    }

    public void failed(String entity, String errorMessage) {
        entities.add(new EntityOutcome(entity, Outcome.FAILED, 0, 0, 0, errorMessage));
    }

    public void skipped(String entity, String reason) {
        entities.add(new EntityOutcome(entity, Outcome.SKIPPED, 0, 0, 0, reason));
    }

    public void finish(LocalDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    public List<EntityOutcome> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    public Optional<EntityOutcome> outcomeOf(String entity) {
        return entities.stream().filter(e -> e.entity().equals(entity)).findFirst();
    }

    public boolean hasFailures() {
        return entities.stream().anyMatch(e -> e.outcome() == Outcome.FAILED);
    }
}
