package dev.talentmatch.model;

import java.util.List;

/**
 * Explainable fit score of a candidate against a resolved job spec.
 *
 * @param candidateId      id of the scored profile; stored explanations are keyed by application
 * @param gated            true when a weak must-have capped the overall score
 * @param detailedAnalysis one entry per requirement, in spec order
 */
public record MatchExplanation(
        String candidateId,
        int overallScore,
        int mustHaveScore,
        int shouldHaveScore,
        int niceToHaveScore,
        boolean gated,
        List<String> strengths,
        List<String> gaps,
        List<String> recommendations,
        List<RequirementMatch> detailedAnalysis) {
}
