package dev.talentmatch.model;

import java.util.List;

/**
 * Outcome of matching one requirement against a candidate profile.
 *
 * @param matchDegree degree in [0,1]
 * @param matched     whether the degree reached the configured match threshold
 * @param evidence    up to three profile entries supporting the match
 */
public record RequirementMatch(
        RequirementItem requirement,
        double matchDegree,
        boolean matched,
        List<String> evidence,
        String explanation) {
}
