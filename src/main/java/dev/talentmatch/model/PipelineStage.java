package dev.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hiring stages. The happy path is declared in order, {@link #REJECTED} last.
 */
public enum PipelineStage {
    @JsonProperty("applied")
    APPLIED,
    @JsonProperty("screening")
    SCREENING,
    @JsonProperty("shortlisted")
    SHORTLISTED,
    @JsonProperty("interview_scheduled")
    INTERVIEW_SCHEDULED,
    @JsonProperty("interview_completed")
    INTERVIEW_COMPLETED,
    @JsonProperty("offer_extended")
    OFFER_EXTENDED,
    @JsonProperty("offer_accepted")
    OFFER_ACCEPTED,
    @JsonProperty("hired")
    HIRED,
    @JsonProperty("rejected")
    REJECTED;

    public boolean isTerminal() {
        return this == HIRED || this == REJECTED;
    }

    /**
     * The next stage on the happy path, or {@code null} for terminal stages.
     */
    public PipelineStage next() {
        if (isTerminal()) {
            return null;
        }
        return values()[ordinal() + 1];
    }
}
