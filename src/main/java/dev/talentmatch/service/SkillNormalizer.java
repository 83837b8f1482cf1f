package dev.talentmatch.service;

import dev.talentmatch.config.SkillsConfig;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.ParsedResumeData;
import dev.talentmatch.model.Skill;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Canonicalizes and deduplicates resume skills.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkillNormalizer {

    private final SkillsConfig skillsConfig;

    /**
     * Deduplicate skills case-insensitively on their trimmed name.
     *
     * <p>On collision the entry with the higher proficiency wins (ties keep the
     * first seen) and years of experience merge by max. Entries without a name
     * are dropped. Output keeps first-seen order.
     *
     * @param skills raw skills, may be null
     * @return normalized skills
     */
    public List<Skill> normalize(List<Skill> skills) {
        if (skills == null || skills.isEmpty()) {
            return List.of();
        }

        Map<String, String> aliases = aliasIndex();
        Map<String, Skill> byName = new LinkedHashMap<>();

        for (Skill raw : skills) {
            if (raw == null || raw.getName() == null || raw.getName().isBlank()) {
                continue;
            }
            String name = raw.getName().trim();
            String key = name.toLowerCase(Locale.ROOT);
            String canonical = aliases.get(key);
            if (canonical != null) {
                name = canonical;
                key = canonical.toLowerCase(Locale.ROOT);
            }
            Skill candidate = raw.toBuilder().name(name).build();
            byName.merge(key, candidate, this::mergeSkills);
        }

        log.debug("Normalized {} skills into {}", skills.size(), byName.size());
        return List.copyOf(byName.values());
    }

    /**
     * Build the scoring input for a candidate. Absent resume sections become
     * empty lists.
     */
    public CandidateProfile normalizeProfile(String candidateId, ParsedResumeData resume) {
        if (resume == null) {
            return CandidateProfile.builder().candidateId(candidateId).build();
        }
        return CandidateProfile.builder()
                .candidateId(candidateId)
                .skills(normalize(resume.getSkills()))
                .experience(withoutNulls(resume.getExperience()))
                .education(withoutNulls(resume.getEducation()))
                .certifications(withoutNulls(resume.getCertifications()))
                .totalExperience(resume.getTotalExperience())
                .build();
    }

    private Skill mergeSkills(Skill existing, Skill incoming) {
        Skill winner = outranks(incoming, existing) ? incoming : existing;
        Skill loser = winner == incoming ? existing : incoming;
        return winner.toBuilder()
                .category(winner.getCategory() != null ? winner.getCategory() : loser.getCategory())
                .yearsOfExperience(maxOf(existing.getYearsOfExperience(), incoming.getYearsOfExperience()))
                .build();
    }

    private boolean outranks(Skill incoming, Skill existing) {
        if (incoming.getProficiency() == null) {
            return false;
        }
        return existing.getProficiency() == null || incoming.getProficiency() > existing.getProficiency();
    }

    private Map<String, String> aliasIndex() {
        Map<String, String> index = new HashMap<>();
        skillsConfig.getAliases().forEach((canonical, variations) -> {
            index.put(canonical.toLowerCase(Locale.ROOT), canonical);
            if (variations != null) {
                variations.forEach(v -> index.put(v.trim().toLowerCase(Locale.ROOT), canonical));
            }
        });
        return index;
    }

    private static Double maxOf(Double a, Double b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return Math.max(a, b);
    }

    private static <T> List<T> withoutNulls(List<T> items) {
        if (items == null) {
            return List.of();
        }
        List<T> result = new ArrayList<>(items);
        result.removeIf(Objects::isNull);
        return List.copyOf(result);
    }
}
