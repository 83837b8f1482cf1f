package dev.talentmatch.matcher.impl;

import dev.talentmatch.TestData;
import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.matcher.MatchOutcome;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.RequirementCategory;
import dev.talentmatch.model.RequirementType;
import dev.talentmatch.model.WorkExperience;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExperienceRequirementMatcherTest {

    private ExperienceRequirementMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new ExperienceRequirementMatcher(new ScoringConfig());
    }

    @ParameterizedTest
    @CsvSource({
            "'5+ years of backend development', 5.0",
            "'At least 3 years with Java', 3.0",
            "'2.5 yrs in consulting', 2.5"
    })
    @DisplayName("Should extract a years threshold")
    void shouldExtractThreshold(String description, double expected) {
        assertThat(ExperienceRequirementMatcher.yearsThreshold(description)).contains(expected);
    }

    @Test
    @DisplayName("Should compare total experience with the threshold")
    void shouldCompareTotalExperience() {
        var requirement = TestData.requirement(RequirementType.EXPERIENCE, RequirementCategory.MUST,
                "5+ years of software development", 8);

        MatchOutcome senior = matcher.match(requirement, CandidateProfile.builder().totalExperience(6.0).build());
        MatchOutcome junior = matcher.match(requirement, CandidateProfile.builder().totalExperience(2.0).build());
        MatchOutcome unknown = matcher.match(requirement, CandidateProfile.builder().build());

        assertThat(senior.degree()).isEqualTo(1.0);
        assertThat(senior.evidence()).containsExactly("Total experience: 6.0 years");
        assertThat(junior.degree()).isZero();
        assertThat(unknown.degree()).isZero();
    }

    @Test
    @DisplayName("Should match positions when no threshold is given")
    void shouldMatchPosition() {
        var requirement = TestData.requirement(RequirementType.EXPERIENCE, RequirementCategory.SHOULD,
                "Team Lead", 5);
        CandidateProfile profile = CandidateProfile.builder()
                .experience(List.of(WorkExperience.builder().company("Acme").position("Team Lead").build()))
                .build();

        MatchOutcome outcome = matcher.match(requirement, profile);

        assertThat(outcome.degree()).isEqualTo(1.0);
        assertThat(outcome.evidence()).containsExactly("Experience: Team Lead at Acme");
    }
}
