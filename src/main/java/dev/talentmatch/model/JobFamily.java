package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder(toBuilder = true)
public class JobFamily {

    String id;
    String name;
    String description;

    @Builder.Default
    List<String> skillCategories = List.of();

    @Builder.Default
    List<RequirementItem> baseRequirements = List.of();
}
