package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Fully merged, publish-ready job specification. Requirements hold at most one
 * entry per normalized description.
 */
@Value
@Builder
public class ResolvedJobSpec {

    String companyJobVariantId;
    String title;
    String description;
    String familyName;
    JobLevel level;
    ExperienceRange experienceRange;
    List<RequirementItem> requirements;
    CompanyProfile company;
    SalaryRange salaryRange;
    List<String> benefits;
    WorkArrangement workArrangement;
    String location;

    public List<RequirementItem> requirementsIn(RequirementCategory category) {
        return requirements.stream()
                .filter(r -> r.getCategory() == category)
                .toList();
    }
}
