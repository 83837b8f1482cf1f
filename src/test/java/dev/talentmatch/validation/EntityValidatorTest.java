package dev.talentmatch.validation;

import dev.talentmatch.TestData;
import dev.talentmatch.config.RequirementsConfig;
import dev.talentmatch.exception.ValidationException;
import dev.talentmatch.model.CompanyJobVariant;
import dev.talentmatch.model.ExperienceRange;
import dev.talentmatch.model.JobFamily;
import dev.talentmatch.model.JobTemplate;
import dev.talentmatch.model.RequirementCategory;
import dev.talentmatch.model.RequirementItem;
import dev.talentmatch.model.RequirementType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityValidatorTest {

    private EntityValidator validator;

    @BeforeEach
    void setUp() {
        validator = new EntityValidator(new RequirementsConfig());
    }

    @Nested
    @DisplayName("Requirement validation")
    class RequirementTests {

        @Test
        @DisplayName("Should default an absent weight to 5")
        void shouldDefaultWeight() {
            RequirementItem item = TestData.requirement(RequirementType.SKILL, RequirementCategory.MUST, "Go", null);

            ValidationResult<RequirementItem> result = validator.validateRequirement(item);

            assertThat(result.isValid()).isTrue();
            assertThat(result.value().getWeight()).isEqualTo(5);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 11, 100})
        @DisplayName("Should reject weights outside 1..10")
        void shouldRejectWeightOutOfRange(int weight) {
            RequirementItem item = TestData.skill(RequirementCategory.MUST, "Go", weight);

            ValidationResult<RequirementItem> result = validator.validateRequirement(item);

            assertThat(result.isValid()).isFalse();
            assertThat(result.errors()).singleElement().asString().contains("outside [1,10]");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Should reject a blank description")
        void shouldRejectBlankDescription(String description) {
            RequirementItem item = TestData.skill(RequirementCategory.MUST, description, 5);

            assertThat(validator.validateRequirement(item).errors())
                    .contains("description must not be empty");
        }

        @Test
        @DisplayName("Should require type and category")
        void shouldRequireTypeAndCategory() {
            RequirementItem item = RequirementItem.builder().description("Go").weight(5).build();

            assertThat(validator.validateRequirement(item).errors()).hasSize(2);
        }

        @Test
        @DisplayName("Should trim alternatives and drop blanks and duplicates")
        void shouldCleanAlternatives() {
            RequirementItem item = TestData.skill(RequirementCategory.MUST, "JavaScript", 5).toBuilder()
                    .alternatives(Arrays.asList(" JS ", "js", "", null, "ECMAScript"))
                    .build();

            ValidationResult<RequirementItem> result = validator.validateRequirement(item);

            assertThat(result.value().getAlternatives()).containsExactly("JS", "ECMAScript");
        }

        @Test
        @DisplayName("Should accept a partial override without type or category")
        void shouldAcceptPartialOverride() {
            RequirementItem override = RequirementItem.builder().description("React").weight(10).build();

            ValidationResult<RequirementItem> result = validator.validateOverride(override);

            assertThat(result.isValid()).isTrue();
            assertThat(result.value().getType()).isNull();
        }
    }

    @Nested
    @DisplayName("Entity validation")
    class EntityTests {

        @Test
        @DisplayName("Should prefix requirement errors with their position")
        void shouldPrefixErrors() {
            JobFamily family = TestData.softwareEngineer().toBuilder()
                    .baseRequirements(List.of(
                            TestData.skill(RequirementCategory.MUST, "Go", 5),
                            TestData.skill(RequirementCategory.MUST, "Rust", 42)))
                    .build();

            ValidationResult<JobFamily> result = validator.validateFamily(family);

            assertThat(result.errors()).singleElement().asString().startsWith("baseRequirements[1]: ");
        }

        @Test
        @DisplayName("Should reject an inverted experience range")
        void shouldRejectInvertedExperienceRange() {
            JobTemplate template = TestData.frontendEngineer().toBuilder()
                    .experienceRange(new ExperienceRange(5, 2))
                    .build();

            assertThat(validator.validateTemplate(template, TestData.softwareEngineer()).errors())
                    .containsExactly("experience range min 5 exceeds max 2");
        }

        @Test
        @DisplayName("Should reject a template that belongs to another family")
        void shouldRejectForeignTemplate() {
            JobTemplate template = TestData.frontendEngineer().toBuilder().jobFamilyId("fam-other").build();

            assertThat(validator.validateTemplate(template, TestData.softwareEngineer()).isValid()).isFalse();
        }

        @Test
        @DisplayName("Should reject a variant for another company")
        void shouldRejectForeignVariant() {
            CompanyJobVariant variant = TestData.techStartVariant().toBuilder().companyProfileId("co-other").build();

            ValidationResult<CompanyJobVariant> result =
                    validator.validateVariant(variant, TestData.frontendEngineer(), TestData.techStart());

            assertThat(result.errors()).singleElement().asString().contains("belongs to company co-other");
        }

        @Test
        @DisplayName("Should throw with every violation when asked")
        void shouldThrowWithViolations() {
            JobFamily family = JobFamily.builder()
                    .name(" ")
                    .baseRequirements(List.of(TestData.skill(RequirementCategory.MUST, "", 0)))
                    .build();

            ValidationResult<JobFamily> result = validator.validateFamily(family);

            assertThatThrownBy(() -> result.orElseThrow("job family"))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getViolations()).hasSize(3))
                    .satisfies(e -> assertThat(((ValidationException) e).getCode())
                            .isEqualTo(ValidationException.VALIDATION_ERROR));
        }
    }
}
