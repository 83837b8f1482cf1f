package dev.talentmatch.matcher.impl;

import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.matcher.MatchOutcome;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.Certification;
import dev.talentmatch.model.Education;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.RequirementType;
import dev.talentmatch.model.Skill;
import dev.talentmatch.model.WorkExperience;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Free-form requirements, searched across every profile section.
 */
@Component
public class OtherRequirementMatcher extends AbstractRequirementMatcher {

    public OtherRequirementMatcher(ScoringConfig scoringConfig) {
        super(scoringConfig);
    }

    @Override
    public RequirementType getType() {
        return RequirementType.OTHER;
    }

    @Override
    public MatchOutcome match(RequirementItem requirement, CandidateProfile profile) {
        List<String> terms = terms(requirement);
        List<String> evidence = new ArrayList<>();

        for (Skill skill : profile.getSkills()) {
            if (anyMatch(terms, skill.getName())) {
                evidence.add("Skill: " + skill.getName());
            }
        }
        for (WorkExperience job : profile.getExperience()) {
            if (anyMatch(terms, job.getPosition())) {
                evidence.add("Experience: " + roleOf(job));
            }
        }
        for (Education education : profile.getEducation()) {
            if (anyMatch(terms, education.getDegree()) || anyMatch(terms, education.getFieldOfStudy())) {
                evidence.add("Education: " + education.getDegree());
            }
        }
        for (Certification certification : profile.getCertifications()) {
            if (anyMatch(terms, certification.getName())) {
                evidence.add("Certification: " + certification.getName());
            }
        }
        return evidence.isEmpty() ? MatchOutcome.none() : MatchOutcome.full(limitEvidence(evidence));
    }
}
