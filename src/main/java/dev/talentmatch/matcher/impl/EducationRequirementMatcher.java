package dev.talentmatch.matcher.impl;

import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.matcher.MatchOutcome;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.Education;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.RequirementType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class EducationRequirementMatcher extends AbstractRequirementMatcher {

    public EducationRequirementMatcher(ScoringConfig scoringConfig) {
        super(scoringConfig);
    }

    @Override
    public RequirementType getType() {
        return RequirementType.EDUCATION;
    }

    @Override
    public MatchOutcome match(RequirementItem requirement, CandidateProfile profile) {
        List<String> terms = terms(requirement);
        List<String> evidence = new ArrayList<>();
        for (Education education : profile.getEducation()) {
            String combined = describe(education);
            if (anyMatch(terms, education.getDegree())
                    || anyMatch(terms, education.getFieldOfStudy())
                    || anyMatch(terms, combined)) {
                evidence.add("Education: " + combined);
            }
        }
        return evidence.isEmpty() ? MatchOutcome.none() : MatchOutcome.full(limitEvidence(evidence));
    }

    private static String describe(Education education) {
        if (education.getDegree() == null) {
            return education.getFieldOfStudy() != null ? education.getFieldOfStudy() : "";
        }
        return education.getDegree()
                + (education.getFieldOfStudy() != null ? " in " + education.getFieldOfStudy() : "");
    }
}
