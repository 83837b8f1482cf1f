package dev.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum WorkArrangement {
    @JsonProperty("remote")
    REMOTE("Remote"),
    @JsonProperty("hybrid")
    HYBRID("Hybrid"),
    @JsonProperty("onsite")
    ONSITE("On-site");

    private final String displayName;

    WorkArrangement(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
