package dev.talentmatch.matcher.impl;

import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.matcher.MatchOutcome;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.RequirementType;
import dev.talentmatch.model.WorkExperience;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Experience requirements. A description naming a number of years
 * ("5+ years of backend development") is a threshold on total experience;
 * otherwise positions and technologies are searched.
 */
@Component
public class ExperienceRequirementMatcher extends AbstractRequirementMatcher {

    private static final Pattern YEARS = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*\\+?\\s*(?:years?|yrs?)\\b", Pattern.CASE_INSENSITIVE);

    public ExperienceRequirementMatcher(ScoringConfig scoringConfig) {
        super(scoringConfig);
    }

    @Override
    public RequirementType getType() {
        return RequirementType.EXPERIENCE;
    }

    @Override
    public MatchOutcome match(RequirementItem requirement, CandidateProfile profile) {
        Optional<Double> threshold = yearsThreshold(requirement.getDescription());
        if (threshold.isPresent()) {
            Double total = profile.getTotalExperience();
            if (total != null && total >= threshold.get()) {
                return MatchOutcome.full(List.of("Total experience: " + total + " years"));
            }
            return MatchOutcome.none();
        }

        List<String> terms = terms(requirement);
        List<String> evidence = new ArrayList<>();
        for (WorkExperience job : profile.getExperience()) {
            boolean positionMatch = anyMatch(terms, job.getPosition());
            boolean technologyMatch = technologiesOf(job).stream().anyMatch(t -> anyMatch(terms, t));
            if (positionMatch || technologyMatch) {
                evidence.add("Experience: " + roleOf(job));
            }
        }
        return evidence.isEmpty() ? MatchOutcome.none() : MatchOutcome.full(limitEvidence(evidence));
    }

    static Optional<Double> yearsThreshold(String description) {
        if (description == null) {
            return Optional.empty();
        }
        Matcher matcher = YEARS.matcher(description);
        return matcher.find() ? Optional.of(Double.parseDouble(matcher.group(1))) : Optional.empty();
    }
}
