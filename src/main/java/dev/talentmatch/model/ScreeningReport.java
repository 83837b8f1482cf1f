package dev.talentmatch.model;

import java.util.List;

/**
 * Result of a screening run, shortlisted applications ordered by fit score.
 */
public record ScreeningReport(
        JdVersion publishedVersion,
        int candidatesScreened,
        List<RankedCandidate> shortlist) {

    public static ScreeningReport empty() {
        return new ScreeningReport(null, 0, List.of());
    }

    public record RankedCandidate(
            String candidateId,
            String applicationId,
            MatchExplanation explanation) {
    }
}
