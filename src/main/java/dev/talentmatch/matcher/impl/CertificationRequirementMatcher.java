package dev.talentmatch.matcher.impl;

import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.matcher.MatchOutcome;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.Certification;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.RequirementType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CertificationRequirementMatcher extends AbstractRequirementMatcher {

    public CertificationRequirementMatcher(ScoringConfig scoringConfig) {
        super(scoringConfig);
    }

    @Override
    public RequirementType getType() {
        return RequirementType.CERTIFICATION;
    }

    @Override
    public MatchOutcome match(RequirementItem requirement, CandidateProfile profile) {
        List<String> terms = terms(requirement);
        List<String> evidence = new ArrayList<>();
        for (Certification certification : profile.getCertifications()) {
            if (anyMatch(terms, certification.getName())) {
                evidence.add("Certification: " + certification.getName()
                        + (certification.getIssuer() != null ? " (" + certification.getIssuer() + ")" : ""));
            }
        }
        return evidence.isEmpty() ? MatchOutcome.none() : MatchOutcome.full(limitEvidence(evidence));
    }
}
