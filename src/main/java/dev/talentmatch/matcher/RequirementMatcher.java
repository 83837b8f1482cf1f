package dev.talentmatch.matcher;

import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.RequirementType;

/**
 * Matches requirements of one type against a candidate profile.
 * Each requirement type has exactly one implementation.
 */
public interface RequirementMatcher {

    /**
     * The requirement type this matcher handles.
     */
    RequirementType getType();

    /**
     * Degree to which the profile satisfies the requirement. Absent profile
     * data is a non-match, never an error.
     */
    MatchOutcome match(RequirementItem requirement, CandidateProfile profile);
}
