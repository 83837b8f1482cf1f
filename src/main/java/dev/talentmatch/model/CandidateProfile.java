package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized scoring input. Collections are never null and hold no null
 * entries.
 */
@Value
public class CandidateProfile {

    String candidateId;
    List<Skill> skills;
    List<WorkExperience> experience;
    List<Education> education;
    List<Certification> certifications;
    Double totalExperience;

    @Builder
    public CandidateProfile(String candidateId, List<Skill> skills, List<WorkExperience> experience,
                            List<Education> education, List<Certification> certifications,
                            Double totalExperience) {
        this.candidateId = candidateId;
        this.skills = ModelLists.present(skills);
        this.experience = ModelLists.present(experience);
        this.education = ModelLists.present(education);
        this.certifications = ModelLists.present(certifications);
        this.totalExperience = totalExperience;
    }
}
