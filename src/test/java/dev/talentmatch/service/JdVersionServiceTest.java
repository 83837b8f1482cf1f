package dev.talentmatch.service;

import dev.talentmatch.TestData;
import dev.talentmatch.config.RequirementsConfig;
import dev.talentmatch.exception.ResourceNotFoundException;
import dev.talentmatch.exception.ValidationException;
import dev.talentmatch.metrics.RecruitingMetrics;
import dev.talentmatch.model.CompanyJobVariant;
import dev.talentmatch.model.CompanyProfile;
import dev.talentmatch.model.JdVersion;
import dev.talentmatch.model.PublishResult;
import dev.talentmatch.model.ResolvedJobSpec;
import dev.talentmatch.repository.impl.InMemoryJdVersionRepository;
import dev.talentmatch.validation.EntityValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.JdkIdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdVersionServiceTest {

    private static final Instant FIRST_PUBLISH = Instant.parse("2026-03-02T10:15:30Z");

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private JdVersionService jdVersionService;
    private ResolvedJobSpec spec;

    private static final class MutableClock extends Clock {
        private Instant now = FIRST_PUBLISH;

        @Override
        public java.time.ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new SimpleMeterRegistry();
        jdVersionService = new JdVersionService(new InMemoryJdVersionRepository(), new JobDescriptionRenderer(),
                new RecruitingMetrics(registry), clock, new JdkIdGenerator());
        spec = new RequirementResolver(new EntityValidator(new RequirementsConfig())).resolve(
                TestData.softwareEngineer(), TestData.frontendEngineer(),
                TestData.techStart(), TestData.techStartVariant());
    }

    @Test
    @DisplayName("Should number versions 1, 2, 3 and stamp publishedAt only once")
    void shouldNumberVersions() {
        CompanyJobVariant variant = TestData.techStartVariant();

        PublishResult first = jdVersionService.publish(variant, spec, "v1 content", "alice");
        clock.now = FIRST_PUBLISH.plusSeconds(3600);
        PublishResult second = jdVersionService.publish(first.variant(), spec, "v2 content", "alice");
        PublishResult third = jdVersionService.publish(second.variant(), spec, "v3 content", "bob");

        assertThat(first.version().getVersion()).isEqualTo(1);
        assertThat(second.version().getVersion()).isEqualTo(2);
        assertThat(third.version().getVersion()).isEqualTo(3);
        assertThat(first.variant().isActive()).isTrue();
        assertThat(first.variant().getPublishedAt()).isEqualTo(FIRST_PUBLISH);
        assertThat(third.variant().getPublishedAt()).isEqualTo(FIRST_PUBLISH);
        assertThat(second.version().getCreatedAt()).isEqualTo(FIRST_PUBLISH.plusSeconds(3600));
        assertThat(registry.counter("talent_match_jd_versions_published_total").count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should keep earlier versions unchanged")
    void shouldKeepHistory() {
        CompanyJobVariant variant = TestData.techStartVariant();
        JdVersion first = jdVersionService.publish(variant, spec, "original", "alice").version();
        jdVersionService.publish(variant, spec, "revised", "alice");

        assertThat(jdVersionService.findByVariant(variant.getId()))
                .extracting(JdVersion::getVersion, JdVersion::getPublishedContent)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple(2, "revised"),
                        org.assertj.core.groups.Tuple.tuple(1, "original"));
        assertThat(jdVersionService.findByVariant(variant.getId()).get(1)).isEqualTo(first);
        assertThat(jdVersionService.findLatest(variant.getId()).getPublishedContent()).isEqualTo("revised");
    }

    @Test
    @DisplayName("Should render content when none is given")
    void shouldRenderContent() {
        JdVersion version = jdVersionService.publish(TestData.techStartVariant(), spec, "system").version();

        assertThat(version.getPublishedContent()).startsWith("# Frontend Engineer");
        assertThat(version.getResolvedSpec()).isEqualTo(spec);
        assertThat(version.getCreatedBy()).isEqualTo("system");
    }

    @Test
    @DisplayName("Should refuse a spec resolved for another variant")
    void shouldRefuseForeignSpec() {
        CompanyJobVariant other = TestData.techStartVariant().toBuilder().id("var-other").build();

        assertThatThrownBy(() -> jdVersionService.publish(other, spec, "content", "alice"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Should refuse blank content")
    void shouldRefuseBlankContent() {
        assertThatThrownBy(() -> jdVersionService.publish(TestData.techStartVariant(), spec, " ", "alice"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Published content is required");
    }

    @Test
    @DisplayName("Should fail to find the latest version of an unpublished variant")
    void shouldFailOnUnpublished() {
        assertThat(jdVersionService.findByVariant("var-none")).isEmpty();
        assertThatThrownBy(() -> jdVersionService.findLatest("var-none"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Should keep the published snapshot when the company lists change afterwards")
    void shouldFreezeCompanyLists() {
        List<String> culture = new ArrayList<>(List.of("Ship fast"));
        List<String> benefits = new ArrayList<>(List.of("Equity"));
        CompanyProfile company = TestData.techStart().toBuilder().culture(culture).benefits(benefits).build();
        ResolvedJobSpec resolved = new RequirementResolver(new EntityValidator(new RequirementsConfig())).resolve(
                TestData.softwareEngineer(), TestData.frontendEngineer(), company, TestData.techStartVariant());
        JdVersion version = jdVersionService.publish(TestData.techStartVariant(), resolved, "alice").version();

        culture.add("Move slowly");
        benefits.clear();

        assertThat(version.getResolvedSpec().getCompany().getCulture()).containsExactly("Ship fast");
        assertThat(version.getResolvedSpec().getCompany().getBenefits()).containsExactly("Equity");
        assertThat(version.getResolvedSpec().getBenefits()).containsExactly("Equity");
    }

    @Test
    @DisplayName("Should regenerate an old version into a new one from its frozen spec")
    void shouldRegenerate() {
        CompanyJobVariant variant = TestData.techStartVariant();
        JdVersion first = jdVersionService.publish(variant, spec, "hand-written", "alice").version();
        jdVersionService.publish(variant, spec, "second draft", "alice");
        clock.now = FIRST_PUBLISH.plusSeconds(60);

        JdVersion regenerated = jdVersionService.regenerate(variant.getId(), 1, "bob");

        assertThat(regenerated.getVersion()).isEqualTo(3);
        assertThat(regenerated.getResolvedSpec()).isEqualTo(first.getResolvedSpec());
        assertThat(regenerated.getPublishedContent()).startsWith("# Frontend Engineer");
        assertThat(regenerated.getCreatedBy()).isEqualTo("bob");
        assertThat(regenerated.getCreatedAt()).isEqualTo(FIRST_PUBLISH.plusSeconds(60));
        assertThat(jdVersionService.findByVariant(variant.getId()).get(2).getPublishedContent())
                .isEqualTo("hand-written");
        assertThat(registry.counter("talent_match_jd_versions_published_total").count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should fail to regenerate a version that does not exist")
    void shouldFailToRegenerateMissingVersion() {
        jdVersionService.publish(TestData.techStartVariant(), spec, "content", "alice");

        assertThatThrownBy(() -> jdVersionService.regenerate(TestData.VARIANT_ID, 7, "bob"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Should unpublish without creating a version or clearing publishedAt")
    void shouldUnpublish() {
        CompanyJobVariant published = jdVersionService.publish(TestData.techStartVariant(), spec, "content", "alice")
                .variant();

        CompanyJobVariant unpublished = jdVersionService.unpublish(published);

        assertThat(unpublished.isActive()).isFalse();
        assertThat(unpublished.getPublishedAt()).isEqualTo(FIRST_PUBLISH);
        assertThat(jdVersionService.findByVariant(published.getId())).hasSize(1);
        assertThatThrownBy(() -> jdVersionService.unpublish(null))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
