package dev.talentmatch.matcher.impl;

import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.matcher.RequirementMatcher;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.WorkExperience;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Term handling shared by the matchers: a requirement is looked up by its
 * description and each of its alternatives.
 */
public abstract class AbstractRequirementMatcher implements RequirementMatcher {

    protected static final int MAX_EVIDENCE = 3;

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    protected final ScoringConfig scoringConfig;

    protected AbstractRequirementMatcher(ScoringConfig scoringConfig) {
        this.scoringConfig = scoringConfig;
    }

    /**
     * How a requirement term relates to a value found in the profile.
     */
    protected enum TermMatch {
        EXACT, PARTIAL, NONE
    }

    /**
     * Description first, then alternatives; blanks removed.
     */
    protected List<String> terms(RequirementItem requirement) {
        List<String> terms = new ArrayList<>();
        if (requirement.getDescription() != null && !requirement.getDescription().isBlank()) {
            terms.add(requirement.getDescription().trim());
        }
        for (String alternative : requirement.alternativesOrEmpty()) {
            if (alternative != null && !alternative.isBlank()) {
                terms.add(alternative.trim());
            }
        }
        return terms;
    }

    /**
     * Exact is a case-insensitive equality. Partial is a whole-word
     * containment in either direction, allowed only when one side has more
     * than one word.
     */
    protected TermMatch compare(String term, String value) {
        if (term == null || value == null || value.isBlank()) {
            return TermMatch.NONE;
        }
        String t = RequirementItem.normalizeKey(term);
        String v = RequirementItem.normalizeKey(value);
        if (t.equals(v)) {
            return TermMatch.EXACT;
        }
        if (!isMultiWord(t) && !isMultiWord(v)) {
            return TermMatch.NONE;
        }
        if (containsWord(t, v) || containsWord(v, t)) {
            return TermMatch.PARTIAL;
        }
        return TermMatch.NONE;
    }

    /**
     * Best relation of any requirement term to the value.
     */
    protected TermMatch bestMatch(List<String> terms, String value) {
        TermMatch best = TermMatch.NONE;
        for (String term : terms) {
            TermMatch match = compare(term, value);
            if (match == TermMatch.EXACT) {
                return match;
            }
            if (match == TermMatch.PARTIAL) {
                best = match;
            }
        }
        return best;
    }

    protected boolean anyMatch(List<String> terms, String value) {
        return bestMatch(terms, value) != TermMatch.NONE;
    }

    /**
     * Whole-word containment that also works for terms such as "C++" or ".NET".
     */
    protected boolean containsWord(String text, String word) {
        if (text == null || word == null || word.isBlank()) {
            return false;
        }
        String regex = "(?<![\\w])" + Pattern.quote(word.toLowerCase()) + "(?![\\w])";
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex, k -> Pattern.compile(k, Pattern.CASE_INSENSITIVE));
        return pattern.matcher(text).find();
    }

    protected static List<String> technologiesOf(WorkExperience job) {
        return job.getTechnologies() != null ? job.getTechnologies() : List.of();
    }

    /**
     * "position at company", skipping whichever part is missing.
     */
    protected static String roleOf(WorkExperience job) {
        String position = job.getPosition() != null ? job.getPosition() : "role";
        return job.getCompany() != null ? position + " at " + job.getCompany() : position;
    }

    protected static List<String> limitEvidence(List<String> evidence) {
        return evidence.size() > MAX_EVIDENCE ? evidence.subList(0, MAX_EVIDENCE) : evidence;
    }

    private static boolean isMultiWord(String text) {
        return text.indexOf(' ') >= 0;
    }
}
