package dev.talentmatch.matcher;

import java.util.List;

/**
 * Match degree in [0,1] with the profile entries that support it.
 */
public record MatchOutcome(double degree, List<String> evidence) {

    private static final MatchOutcome NONE = new MatchOutcome(0.0, List.of());

    public MatchOutcome {
        degree = Math.max(0.0, Math.min(1.0, degree));
        evidence = List.copyOf(evidence);
    }

    public static MatchOutcome none() {
        return NONE;
    }

    public static MatchOutcome full(List<String> evidence) {
        return new MatchOutcome(1.0, evidence);
    }

    public boolean isMatch() {
        return degree > 0.0;
    }
}
