package dev.talentmatch.matcher.impl;

import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.matcher.MatchOutcome;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.RequirementType;
import dev.talentmatch.model.Skill;
import dev.talentmatch.model.WorkExperience;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Skill requirements, graded by proficiency.
 *
 * <p>An exact name match beats any partial one. A proficiency at or above the
 * strong threshold (or no proficiency at all) is a full match; weaker ones
 * scale between the weak floor and ceiling. Partial matches never exceed the
 * ceiling. A skill only named among work-experience technologies gets the
 * technology-only degree.
 */
@Component
public class SkillRequirementMatcher extends AbstractRequirementMatcher {

    public SkillRequirementMatcher(ScoringConfig scoringConfig) {
        super(scoringConfig);
    }

    @Override
    public RequirementType getType() {
        return RequirementType.SKILL;
    }

    @Override
    public MatchOutcome match(RequirementItem requirement, CandidateProfile profile) {
        List<String> terms = terms(requirement);

        double bestExact = 0.0;
        double bestPartial = 0.0;
        Skill exactSkill = null;
        Skill partialSkill = null;

        for (Skill skill : profile.getSkills()) {
            TermMatch match = bestMatch(terms, skill.getName());
            double degree = proficiencyDegree(skill.getProficiency());
            if (match == TermMatch.EXACT && degree > bestExact) {
                bestExact = degree;
                exactSkill = skill;
            } else if (match == TermMatch.PARTIAL) {
                double capped = Math.min(degree, scoringConfig.getWeakMatchCeiling());
                if (capped > bestPartial) {
                    bestPartial = capped;
                    partialSkill = skill;
                }
            }
        }

        if (exactSkill != null) {
            return new MatchOutcome(bestExact, List.of(describe(exactSkill)));
        }
        if (partialSkill != null) {
            return new MatchOutcome(bestPartial, List.of(describe(partialSkill)));
        }
        return matchTechnologies(terms, profile);
    }

    /**
     * Degree for an exactly matching skill at the given proficiency (0-10).
     */
    double proficiencyDegree(Double proficiency) {
        double strong = scoringConfig.getStrongProficiency();
        if (proficiency == null || proficiency >= strong) {
            return 1.0;
        }
        double floor = scoringConfig.getWeakMatchFloor();
        double ceiling = scoringConfig.getWeakMatchCeiling();
        double p = Math.max(0.0, proficiency);
        return floor + (ceiling - floor) * (p / strong);
    }

    private MatchOutcome matchTechnologies(List<String> terms, CandidateProfile profile) {
        List<String> evidence = new ArrayList<>();
        for (WorkExperience job : profile.getExperience()) {
            for (String technology : technologiesOf(job)) {
                if (bestMatch(terms, technology) == TermMatch.EXACT) {
                    evidence.add("Used " + technology + " as " + roleOf(job));
                    break;
                }
            }
        }
        if (evidence.isEmpty()) {
            return MatchOutcome.none();
        }
        return new MatchOutcome(scoringConfig.getTechnologyOnlyDegree(), limitEvidence(evidence));
    }

    private String describe(Skill skill) {
        StringBuilder text = new StringBuilder("Skill: ").append(skill.getName());
        List<String> details = new ArrayList<>();
        if (skill.getProficiency() != null) {
            details.add("proficiency " + formatNumber(skill.getProficiency()));
        }
        if (skill.getYearsOfExperience() != null) {
            details.add(formatNumber(skill.getYearsOfExperience()) + " years");
        }
        if (!details.isEmpty()) {
            text.append(" (").append(String.join(", ", details)).append(')');
        }
        return text.toString();
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
