package dev.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kind of evidence a requirement asks for.
 */
public enum RequirementType {
    @JsonProperty("skill")
    SKILL,
    @JsonProperty("experience")
    EXPERIENCE,
    @JsonProperty("education")
    EDUCATION,
    @JsonProperty("certification")
    CERTIFICATION,
    @JsonProperty("other")
    OTHER
}
