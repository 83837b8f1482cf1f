package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A skill as extracted from a resume. Proficiency is on a 0-10 scale.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class Skill {

    String name;
    String category;
    Double proficiency;
    Double yearsOfExperience;

    public static Skill of(String name, double proficiency) {
        return Skill.builder().name(name).proficiency(proficiency).build();
    }
}
