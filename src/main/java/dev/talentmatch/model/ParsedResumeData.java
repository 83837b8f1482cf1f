package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured resume content produced by the external resume parser. Every
 * field may be absent.
 */
@Value
@Jacksonized
@Builder
public class ParsedResumeData {

    List<Skill> skills;
    List<WorkExperience> experience;
    List<Education> education;
    List<Certification> certifications;
    Double totalExperience;
    String summary;
    Double confidence;
}
