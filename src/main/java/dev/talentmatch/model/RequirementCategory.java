package dev.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Priority tier of a requirement. Declaration order is the reporting order.
 */
public enum RequirementCategory {
    @JsonProperty("must")
    MUST("must-have"),
    @JsonProperty("should")
    SHOULD("should-have"),
    @JsonProperty("nice")
    NICE("nice-to-have");

    private final String label;

    RequirementCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
