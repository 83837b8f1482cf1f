package dev.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CompanySize {
    @JsonProperty("startup")
    STARTUP,
    @JsonProperty("small")
    SMALL,
    @JsonProperty("medium")
    MEDIUM,
    @JsonProperty("large")
    LARGE,
    @JsonProperty("enterprise")
    ENTERPRISE
}
