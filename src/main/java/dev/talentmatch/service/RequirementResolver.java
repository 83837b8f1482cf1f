package dev.talentmatch.service;

import dev.talentmatch.exception.ResourceNotFoundException;
import dev.talentmatch.model.CompanyJobVariant;
import dev.talentmatch.model.CompanyProfile;
import dev.talentmatch.model.JobFamily;
import dev.talentmatch.model.JobTemplate;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.ResolvedJobSpec;
import dev.talentmatch.validation.EntityValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges a job family, one of its templates and a company variant into a
 * single {@link ResolvedJobSpec}.
 *
 * <p>Precedence, highest first: company-modified, company-additional (new
 * descriptions only), template, family. Requirements are matched on their
 * normalized description.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequirementResolver {

    private final EntityValidator validator;

    /**
     * Resolve the concrete job specification for a company variant.
     *
     * @throws ResourceNotFoundException if any input is missing
     * @throws dev.talentmatch.exception.ValidationException if any input is malformed
     */
    public ResolvedJobSpec resolve(JobFamily family, JobTemplate template,
                                   CompanyProfile company, CompanyJobVariant variant) {
        requirePresent(family, "JobFamily");
        requirePresent(template, "JobTemplate");
        requirePresent(company, "CompanyProfile");
        requirePresent(variant, "CompanyJobVariant");

        JobFamily validFamily = validator.validateFamily(family).orElseThrow("job family " + family.getId());
        JobTemplate validTemplate = validator.validateTemplate(template, family)
                .orElseThrow("job template " + template.getId());
        CompanyProfile validCompany = validator.validateCompany(company).orElseThrow("company " + company.getId());
        CompanyJobVariant validVariant = validator.validateVariant(variant, template, company)
                .orElseThrow("company job variant " + variant.getId());

        Map<String, RequirementItem> working = new LinkedHashMap<>();

        // 1. Family seed, template overlay
        validFamily.getBaseRequirements().forEach(r -> working.putIfAbsent(r.key(), r));
        validTemplate.getOwnRequirements().forEach(r -> working.put(r.key(), r));

        // 2. Company overrides replace in place, or append when nothing matches
        for (RequirementItem modified : validVariant.getModifiedRequirements()) {
            RequirementItem existing = working.get(modified.key());
            if (existing != null) {
                working.put(modified.key(), overlay(existing, modified));
            } else {
                working.put(modified.key(), validator.validateRequirement(modified)
                        .orElseThrow("modified requirement '" + modified.getDescription() + "'"));
            }
        }

        // 3. Company additions only when new
        validVariant.getAdditionalRequirements().forEach(r -> working.putIfAbsent(r.key(), r));

        String title = hasText(validVariant.getCustomTitle())
                ? validVariant.getCustomTitle()
                : validTemplate.getName();
        String description = hasText(validVariant.getCustomDescription())
                ? validVariant.getCustomDescription()
                : generatedDescription(title, validFamily, validTemplate, validCompany);

        ResolvedJobSpec spec = ResolvedJobSpec.builder()
                .companyJobVariantId(validVariant.getId())
                .title(title)
                .description(description)
                .familyName(validFamily.getName())
                .level(validTemplate.getLevel())
                .experienceRange(validTemplate.getExperienceRange())
                .requirements(List.copyOf(working.values()))
                .company(validCompany)
                .salaryRange(validTemplate.getSalaryRange())
                .benefits(validCompany.getBenefits() != null ? List.copyOf(validCompany.getBenefits()) : List.of())
                .workArrangement(validCompany.getWorkArrangement())
                .location(validCompany.getLocation())
                .build();

        log.debug("Resolved '{}' for variant {} with {} requirements",
                title, validVariant.getId(), spec.getRequirements().size());
        return spec;
    }

    /**
     * Apply the fields an override carries on top of the requirement it
     * replaces.
     */
    private RequirementItem overlay(RequirementItem existing, RequirementItem modified) {
        return existing.toBuilder()
                .id(modified.getId() != null ? modified.getId() : existing.getId())
                .description(modified.getDescription().trim())
                .type(modified.getType() != null ? modified.getType() : existing.getType())
                .category(modified.getCategory() != null ? modified.getCategory() : existing.getCategory())
                .weight(modified.getWeight() != null ? modified.getWeight() : existing.getWeight())
                .alternatives(modified.getAlternatives() != null ? modified.getAlternatives() : existing.getAlternatives())
                .build();
    }

    private String generatedDescription(String title, JobFamily family, JobTemplate template, CompanyProfile company) {
        StringBuilder context = new StringBuilder();
        if (template.getLevel() != null) {
            context.append(template.getLevel().displayName()).append(' ');
        }
        context.append(family.getName());
        return title + " (" + context + ") position at " + company.getName();
    }

    private static void requirePresent(Object value, String resource) {
        if (value == null) {
            throw new ResourceNotFoundException(resource);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
