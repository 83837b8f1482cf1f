package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder
public class WorkExperience {

    String company;
    String position;
    String description;
    boolean current;

    @Builder.Default
    List<String> technologies = List.of();
}
