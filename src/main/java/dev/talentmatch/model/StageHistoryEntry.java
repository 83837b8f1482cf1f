package dev.talentmatch.model;

import java.time.Instant;

/**
 * Append-only record of one stage change. {@code fromStage} is null for the
 * entry written when the application is created.
 */
public record StageHistoryEntry(
        String id,
        String applicationId,
        PipelineStage fromStage,
        PipelineStage toStage,
        String changedBy,
        boolean automated,
        Instant changedAt,
        String notes) {
}
