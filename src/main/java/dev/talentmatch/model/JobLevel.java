package dev.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JobLevel {
    @JsonProperty("junior")
    JUNIOR("Junior"),
    @JsonProperty("mid")
    MID("Mid-level"),
    @JsonProperty("senior")
    SENIOR("Senior"),
    @JsonProperty("lead")
    LEAD("Lead"),
    @JsonProperty("principal")
    PRINCIPAL("Principal");

    private final String displayName;

    JobLevel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
