package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A candidate's application to one company job variant.
 *
 * <p>Instances are immutable; every change produces a copy with
 * {@code version} incremented, which storage uses as the optimistic lock.
 */
@Value
@Builder(toBuilder = true)
public class Application {

    String id;
    String candidateId;
    String companyJobVariantId;
    PipelineStage status;
    Integer fitScore;
    List<StageHistoryEntry> stageHistory;
    long version;
    Instant appliedAt;
    Instant lastUpdated;
}
