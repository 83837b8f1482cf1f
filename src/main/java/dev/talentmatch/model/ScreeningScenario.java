package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Input of a screening run: one fully assembled job and the candidates to
 * screen against it.
 */
@Value
@Jacksonized
@Builder
public class ScreeningScenario {

    JobFamily family;
    JobTemplate template;
    CompanyProfile company;
    CompanyJobVariant variant;
    String publishedBy;

    @Builder.Default
    List<ScenarioCandidate> candidates = List.of();

    public boolean isEmpty() {
        return variant == null;
    }

    @Value
    @Jacksonized
    @Builder
    public static class ScenarioCandidate {
        String id;
        String name;
        ParsedResumeData resume;
    }
}
