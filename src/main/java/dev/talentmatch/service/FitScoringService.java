package dev.talentmatch.service;

import dev.talentmatch.config.RequirementsConfig;
import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.exception.ResourceNotFoundException;
import dev.talentmatch.matcher.MatchOutcome;
import dev.talentmatch.matcher.RequirementMatcher;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.MatchExplanation;
import dev.talentmatch.model.RequirementCategory;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.RequirementMatch;
import dev.talentmatch.model.RequirementType;
import dev.talentmatch.model.ResolvedJobSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a candidate profile against a resolved job spec.
 *
 * <p>Each category score is the weight-averaged match degree of its
 * requirements, scaled to 0-100; an empty category scores 100. The overall
 * score blends the three categories and is capped when any must-have
 * requirement is barely met.
 */
@Slf4j
@Service
public class FitScoringService {

    private static final CandidateProfile EMPTY_PROFILE = CandidateProfile.builder().build();

    private final ScoringConfig scoringConfig;
    private final RequirementsConfig requirementsConfig;
    private final Map<RequirementType, RequirementMatcher> matchers = new EnumMap<>(RequirementType.class);

    public FitScoringService(ScoringConfig scoringConfig, RequirementsConfig requirementsConfig,
                             List<RequirementMatcher> matchers) {
        this.scoringConfig = scoringConfig;
        this.requirementsConfig = requirementsConfig;
        for (RequirementMatcher matcher : matchers) {
            RequirementMatcher previous = this.matchers.put(matcher.getType(), matcher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate matcher for " + matcher.getType() + ": "
                        + previous.getClass().getSimpleName() + ", " + matcher.getClass().getSimpleName());
            }
        }
    }

    /**
     * Score one candidate.
     *
     * @param profile normalized candidate profile; {@code null} scores as an empty profile
     * @param spec    resolved job spec
     * @throws ResourceNotFoundException if the spec is missing
     */
    public MatchExplanation score(CandidateProfile profile, ResolvedJobSpec spec) {
        if (spec == null) {
            throw new ResourceNotFoundException("ResolvedJobSpec");
        }
        CandidateProfile candidate = profile != null ? profile : EMPTY_PROFILE;

        List<RequirementMatch> analysis = new ArrayList<>();
        for (RequirementItem requirement : spec.getRequirements()) {
            analysis.add(analyze(requirement, candidate));
        }

        double must = categoryScore(analysis, RequirementCategory.MUST);
        double should = categoryScore(analysis, RequirementCategory.SHOULD);
        double nice = categoryScore(analysis, RequirementCategory.NICE);

        double overall = must * scoringConfig.getMustWeight()
                + should * scoringConfig.getShouldWeight()
                + nice * scoringConfig.getNiceWeight();

        boolean gated = analysis.stream()
                .anyMatch(m -> m.requirement().getCategory() == RequirementCategory.MUST
                        && m.matchDegree() < scoringConfig.getGateThreshold());
        if (gated) {
            overall = Math.min(overall, scoringConfig.getGateCap());
        }

        List<RequirementMatch> gapMatches = gaps(analysis);

        MatchExplanation explanation = new MatchExplanation(
                candidate.getCandidateId(),
                toScore(overall),
                toScore(must),
                toScore(should),
                toScore(nice),
                gated,
                strengths(analysis),
                gapMatches.stream().map(this::gapText).toList(),
                gapMatches.stream()
                        .limit(scoringConfig.getMaxRecommendations())
                        .map(this::recommendationText)
                        .toList(),
                List.copyOf(analysis));

        log.debug("Candidate {} scored {} for '{}' (must {}, should {}, nice {}, gated {})",
                candidate.getCandidateId(), explanation.overallScore(), spec.getTitle(),
                explanation.mustHaveScore(), explanation.shouldHaveScore(),
                explanation.niceToHaveScore(), gated);
        return explanation;
    }

    /**
     * Score every profile and keep those at or above the minimum fit score,
     * best first, at most {@code scoring.max-results} of them.
     */
    public List<MatchExplanation> rank(List<CandidateProfile> profiles, ResolvedJobSpec spec) {
        return shortlist(profiles.stream()
                .map(profile -> score(profile, spec))
                .toList());
    }

    /**
     * Explanations at or above the minimum fit score, best first, ties in
     * input order.
     */
    public List<MatchExplanation> shortlist(List<MatchExplanation> explanations) {
        return explanations.stream()
                .filter(e -> e.overallScore() >= scoringConfig.getMinFitScore())
                .sorted(Comparator.comparingInt(MatchExplanation::overallScore).reversed())
                .limit(scoringConfig.getMaxResults())
                .toList();
    }

    private RequirementMatch analyze(RequirementItem requirement, CandidateProfile candidate) {
        RequirementType type = requirement.getType() != null ? requirement.getType() : RequirementType.OTHER;
        RequirementMatcher matcher = matchers.get(type);
        MatchOutcome outcome = matcher != null ? matcher.match(requirement, candidate) : MatchOutcome.none();

        boolean matched = outcome.degree() >= scoringConfig.getMatchedThreshold();
        return new RequirementMatch(requirement, outcome.degree(), matched, outcome.evidence(),
                explain(requirement, matched, outcome));
    }

    private double categoryScore(List<RequirementMatch> analysis, RequirementCategory category) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (RequirementMatch match : analysis) {
            if (match.requirement().getCategory() != category) {
                continue;
            }
            int weight = weightOf(match.requirement());
            weighted += weight * match.matchDegree();
            totalWeight += weight;
        }
        return totalWeight == 0.0 ? 100.0 : 100.0 * weighted / totalWeight;
    }

    private List<String> strengths(List<RequirementMatch> analysis) {
        return analysis.stream()
                .filter(m -> isMustOrShould(m.requirement()))
                .filter(m -> m.matchDegree() >= scoringConfig.getStrengthThreshold())
                .sorted(Comparator.comparingInt((RequirementMatch m) -> weightOf(m.requirement())).reversed())
                .limit(scoringConfig.getMaxStrengths())
                .map(m -> "Strong in " + m.requirement().getDescription())
                .toList();
    }

    /**
     * Must and should gaps first, then nice-to-have absences, each by weight.
     */
    private List<RequirementMatch> gaps(List<RequirementMatch> analysis) {
        Comparator<RequirementMatch> byWeight =
                Comparator.comparingInt((RequirementMatch m) -> weightOf(m.requirement())).reversed();

        List<RequirementMatch> below = analysis.stream()
                .filter(m -> m.requirement().getCategory() != null)
                .filter(m -> m.matchDegree() < scoringConfig.getGapThreshold())
                .toList();

        List<RequirementMatch> ordered = new ArrayList<>();
        below.stream().filter(m -> isMustOrShould(m.requirement())).sorted(byWeight).forEach(ordered::add);
        below.stream().filter(m -> m.requirement().getCategory() == RequirementCategory.NICE)
                .sorted(byWeight).forEach(ordered::add);

        return ordered.size() > scoringConfig.getMaxGaps()
                ? ordered.subList(0, scoringConfig.getMaxGaps())
                : ordered;
    }

    private String gapText(RequirementMatch match) {
        return "Missing " + match.requirement().getCategory().label() + ": " + match.requirement().getDescription();
    }

    private String recommendationText(RequirementMatch match) {
        String description = match.requirement().getDescription();
        return switch (match.requirement().getCategory()) {
            case MUST -> "Consider training or certification in " + description;
            case SHOULD -> "Consider highlighting experience with " + description;
            case NICE -> "Could strengthen " + description + " skills";
        };
    }

    private String explain(RequirementItem requirement, boolean matched, MatchOutcome outcome) {
        long percent = Math.round(outcome.degree() * 100);
        if (matched) {
            return "Strong match (" + percent + "% confidence) for \"" + requirement.getDescription() + "\"."
                    + (outcome.evidence().isEmpty() ? "" : " Evidence: " + String.join(", ", outcome.evidence()) + ".");
        }
        return "Partial match (" + percent + "% confidence) for \"" + requirement.getDescription() + "\". "
                + (outcome.evidence().isEmpty()
                ? "No direct evidence found in candidate profile."
                : "Some relevant experience found: " + String.join(", ", outcome.evidence()) + ".");
    }

    private int weightOf(RequirementItem requirement) {
        return requirement.getWeight() != null ? requirement.getWeight() : requirementsConfig.getDefaultWeight();
    }

    private static boolean isMustOrShould(RequirementItem requirement) {
        return requirement.getCategory() == RequirementCategory.MUST
                || requirement.getCategory() == RequirementCategory.SHOULD;
    }

    private static int toScore(double value) {
        return (int) Math.max(0, Math.min(100, Math.round(value)));
    }
}
