package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Locale;

/**
 * A single weighted job requirement.
 *
 * <p>At entry {@code type}, {@code category}, {@code weight} and
 * {@code alternatives} may be absent. Once validated they are explicit, except
 * on company overrides where an absent field keeps the overridden value.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class RequirementItem {

    String id;
    RequirementType type;
    RequirementCategory category;
    String description;
    Integer weight;
    List<String> alternatives;

    /**
     * Merge key: trimmed, whitespace-collapsed, lower-cased description.
     */
    public String key() {
        return normalizeKey(description);
    }

    public List<String> alternativesOrEmpty() {
        return alternatives != null ? alternatives : List.of();
    }

    public static String normalizeKey(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
