package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A company's customization of a {@link JobTemplate}.
 *
 * <p>{@code modifiedRequirements} override the family or template requirement
 * with the same normalized description; {@code additionalRequirements} add new
 * ones.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class CompanyJobVariant {

    String id;
    String jobTemplateId;
    String companyProfileId;
    String customTitle;
    String customDescription;

    @Builder.Default
    List<RequirementItem> additionalRequirements = List.of();

    @Builder.Default
    List<RequirementItem> modifiedRequirements = List.of();

    boolean active;
    Instant publishedAt;
}
