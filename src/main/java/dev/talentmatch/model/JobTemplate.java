package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A leveled job definition that always belongs to one {@link JobFamily}.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class JobTemplate {

    String id;
    String jobFamilyId;
    String name;
    JobLevel level;
    ExperienceRange experienceRange;
    SalaryRange salaryRange;

    @Builder.Default
    List<RequirementItem> ownRequirements = List.of();
}
