package dev.talentmatch.validation;

import dev.talentmatch.config.RequirementsConfig;
import dev.talentmatch.model.CompanyJobVariant;
import dev.talentmatch.model.CompanyProfile;
import dev.talentmatch.model.ExperienceRange;
import dev.talentmatch.model.JobFamily;
import dev.talentmatch.model.JobTemplate;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.SalaryRange;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validation functions for the job-side entities. Each returns the entity with
 * requirement defaults applied together with every violation found.
 */
@Component
@RequiredArgsConstructor
public class EntityValidator {

    private final RequirementsConfig requirementsConfig;

    /**
     * Validates a complete requirement, defaulting an absent weight.
     */
    public ValidationResult<RequirementItem> validateRequirement(RequirementItem item) {
        if (item == null) {
            return new ValidationResult<>(null, List.of("requirement is null"));
        }
        List<String> errors = new ArrayList<>();
        checkDescription(item, errors);
        if (item.getType() == null) {
            errors.add("type is required for '" + item.getDescription() + "'");
        }
        if (item.getCategory() == null) {
            errors.add("category is required for '" + item.getDescription() + "'");
        }
        int weight = item.getWeight() != null ? item.getWeight() : requirementsConfig.getDefaultWeight();
        checkWeight(item.getDescription(), weight, errors);

        RequirementItem normalized = item.toBuilder()
                .weight(weight)
                .alternatives(cleanAlternatives(item))
                .build();
        return new ValidationResult<>(normalized, errors);
    }

    /**
     * Validates a partial override. Absent fields are kept absent.
     */
    public ValidationResult<RequirementItem> validateOverride(RequirementItem item) {
        if (item == null) {
            return new ValidationResult<>(null, List.of("requirement is null"));
        }
        List<String> errors = new ArrayList<>();
        checkDescription(item, errors);
        if (item.getWeight() != null) {
            checkWeight(item.getDescription(), item.getWeight(), errors);
        }
        RequirementItem normalized = item.getAlternatives() == null
                ? item
                : item.toBuilder().alternatives(cleanAlternatives(item)).build();
        return new ValidationResult<>(normalized, errors);
    }

    public ValidationResult<JobFamily> validateFamily(JobFamily family) {
        List<String> errors = new ArrayList<>();
        if (isBlank(family.getName())) {
            errors.add("family name is required");
        }
        List<RequirementItem> base = validateAll("baseRequirements", family.getBaseRequirements(), errors);
        return new ValidationResult<>(family.toBuilder().baseRequirements(base).build(), errors);
    }

    public ValidationResult<JobTemplate> validateTemplate(JobTemplate template, JobFamily family) {
        List<String> errors = new ArrayList<>();
        if (isBlank(template.getName())) {
            errors.add("template name is required");
        }
        if (template.getJobFamilyId() != null && family.getId() != null
                && !template.getJobFamilyId().equals(family.getId())) {
            errors.add("template " + template.getId() + " belongs to family " + template.getJobFamilyId()
                    + ", not " + family.getId());
        }
        checkExperienceRange(template.getExperienceRange(), errors);
        checkSalaryRange(template.getSalaryRange(), errors);
        List<RequirementItem> own = validateAll("ownRequirements", template.getOwnRequirements(), errors);
        return new ValidationResult<>(template.toBuilder().ownRequirements(own).build(), errors);
    }

    public ValidationResult<CompanyProfile> validateCompany(CompanyProfile company) {
        List<String> errors = new ArrayList<>();
        if (isBlank(company.getName())) {
            errors.add("company name is required");
        }
        return new ValidationResult<>(company, errors);
    }

    public ValidationResult<CompanyJobVariant> validateVariant(CompanyJobVariant variant,
                                                               JobTemplate template,
                                                               CompanyProfile company) {
        List<String> errors = new ArrayList<>();
        if (variant.getJobTemplateId() != null && template.getId() != null
                && !variant.getJobTemplateId().equals(template.getId())) {
            errors.add("variant " + variant.getId() + " customizes template " + variant.getJobTemplateId()
                    + ", not " + template.getId());
        }
        if (variant.getCompanyProfileId() != null && company.getId() != null
                && !variant.getCompanyProfileId().equals(company.getId())) {
            errors.add("variant " + variant.getId() + " belongs to company " + variant.getCompanyProfileId()
                    + ", not " + company.getId());
        }
        List<RequirementItem> additional = validateAll("additionalRequirements",
                variant.getAdditionalRequirements(), errors);

        List<RequirementItem> modified = new ArrayList<>();
        List<RequirementItem> overrides = nullToEmpty(variant.getModifiedRequirements());
        for (int i = 0; i < overrides.size(); i++) {
            ValidationResult<RequirementItem> result = validateOverride(overrides.get(i));
            prefixErrors("modifiedRequirements[" + i + "]", result, errors);
            modified.add(result.value());
        }

        CompanyJobVariant normalized = variant.toBuilder()
                .additionalRequirements(additional)
                .modifiedRequirements(modified)
                .build();
        return new ValidationResult<>(normalized, errors);
    }

    private List<RequirementItem> validateAll(String field, List<RequirementItem> items, List<String> errors) {
        List<RequirementItem> validated = new ArrayList<>();
        List<RequirementItem> source = nullToEmpty(items);
        for (int i = 0; i < source.size(); i++) {
            ValidationResult<RequirementItem> result = validateRequirement(source.get(i));
            prefixErrors(field + "[" + i + "]", result, errors);
            validated.add(result.value());
        }
        return List.copyOf(validated.stream().filter(Objects::nonNull).toList());
    }

    private void prefixErrors(String prefix, ValidationResult<?> result, List<String> errors) {
        result.errors().forEach(e -> errors.add(prefix + ": " + e));
    }

    private void checkDescription(RequirementItem item, List<String> errors) {
        if (isBlank(item.getDescription())) {
            errors.add("description must not be empty");
        }
    }

    private void checkWeight(String description, int weight, List<String> errors) {
        int min = requirementsConfig.getMinWeight();
        int max = requirementsConfig.getMaxWeight();
        if (weight < min || weight > max) {
            errors.add("weight " + weight + " of '" + description + "' outside [" + min + "," + max + "]");
        }
    }

    private void checkExperienceRange(ExperienceRange range, List<String> errors) {
        if (range == null) {
            return;
        }
        if (range.min() < 0 || range.max() < 0) {
            errors.add("experience range must not be negative");
        } else if (range.min() > range.max()) {
            errors.add("experience range min " + range.min() + " exceeds max " + range.max());
        }
    }

    private void checkSalaryRange(SalaryRange range, List<String> errors) {
        if (range == null || range.min() == null || range.max() == null) {
            return;
        }
        if (range.min().compareTo(BigDecimal.ZERO) < 0) {
            errors.add("salary range must not be negative");
        } else if (range.min().compareTo(range.max()) > 0) {
            errors.add("salary range min " + range.min() + " exceeds max " + range.max());
        }
    }

    /**
     * Trims alternatives and drops blanks and case-insensitive duplicates,
     * keeping first-seen order.
     */
    private List<String> cleanAlternatives(RequirementItem item) {
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String alternative : item.alternativesOrEmpty()) {
            if (isBlank(alternative)) {
                continue;
            }
            byKey.putIfAbsent(RequirementItem.normalizeKey(alternative), alternative.trim());
        }
        return List.copyOf(byKey.values());
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
