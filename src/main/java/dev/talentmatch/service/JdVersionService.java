package dev.talentmatch.service;

import dev.talentmatch.exception.ResourceNotFoundException;
import dev.talentmatch.exception.ValidationException;
import dev.talentmatch.metrics.RecruitingMetrics;
import dev.talentmatch.model.CompanyJobVariant;
import dev.talentmatch.model.JdVersion;
import dev.talentmatch.model.PublishResult;
import dev.talentmatch.model.ResolvedJobSpec;
import dev.talentmatch.repository.JdVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Publishes immutable job description versions, numbered per variant from 1.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JdVersionService {

    private final JdVersionRepository jdVersionRepository;
    private final JobDescriptionRenderer renderer;
    private final RecruitingMetrics metrics;
    private final Clock clock;
    private final IdGenerator idGenerator;

    /**
     * Publish with content rendered from the resolved spec.
     */
    public PublishResult publish(CompanyJobVariant variant, ResolvedJobSpec resolvedSpec, String createdBy) {
        if (resolvedSpec == null) {
            throw new ResourceNotFoundException("ResolvedJobSpec");
        }
        return publish(variant, resolvedSpec, renderer.render(resolvedSpec), createdBy);
    }

    /**
     * Snapshot the resolved spec as the next version of the variant.
     *
     * <p>The returned variant is active; its {@code publishedAt} is stamped on
     * the first publish and kept afterwards.
     *
     * @throws ResourceNotFoundException if the variant or spec is missing
     * @throws ValidationException       if the spec belongs to another variant or the content is blank
     */
    public PublishResult publish(CompanyJobVariant variant, ResolvedJobSpec resolvedSpec,
                                 String publishedContent, String createdBy) {
        if (variant == null) {
            throw new ResourceNotFoundException("CompanyJobVariant");
        }
        if (resolvedSpec == null) {
            throw new ResourceNotFoundException("ResolvedJobSpec");
        }
        if (resolvedSpec.getCompanyJobVariantId() != null
                && !resolvedSpec.getCompanyJobVariantId().equals(variant.getId())) {
            throw new ValidationException("Resolved spec belongs to variant " + resolvedSpec.getCompanyJobVariantId()
                    + ", not " + variant.getId());
        }
        if (publishedContent == null || publishedContent.isBlank()) {
            throw new ValidationException("Published content is required");
        }

        Instant now = clock.instant();
        JdVersion version = jdVersionRepository.append(variant.getId(), number -> JdVersion.builder()
                .id(idGenerator.generateId().toString())
                .companyJobVariantId(variant.getId())
                .version(number)
                .resolvedSpec(resolvedSpec)
                .publishedContent(publishedContent)
                .createdBy(createdBy)
                .createdAt(now)
                .build());

        CompanyJobVariant published = variant.toBuilder()
                .active(true)
                .publishedAt(variant.getPublishedAt() != null ? variant.getPublishedAt() : now)
                .build();

        metrics.recordJdVersionPublished();
        log.info("Published version {} of variant {} ('{}')",
                version.getVersion(), variant.getId(), resolvedSpec.getTitle());
        return new PublishResult(version, published);
    }

    /**
     * Render the frozen spec of an existing version again and store the
     * result as the next version. The source version is left untouched.
     *
     * @throws ResourceNotFoundException if the version does not exist
     */
    public JdVersion regenerate(String companyJobVariantId, int version, String createdBy) {
        JdVersion source = jdVersionRepository.findVersion(companyJobVariantId, version)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "JdVersion " + version + " of variant", companyJobVariantId));

        String content = renderer.render(source.getResolvedSpec());
        Instant now = clock.instant();
        JdVersion regenerated = jdVersionRepository.append(companyJobVariantId, number -> JdVersion.builder()
                .id(idGenerator.generateId().toString())
                .companyJobVariantId(companyJobVariantId)
                .version(number)
                .resolvedSpec(source.getResolvedSpec())
                .publishedContent(content)
                .createdBy(createdBy)
                .createdAt(now)
                .build());

        metrics.recordJdVersionPublished();
        log.info("Regenerated version {} of variant {} as version {}",
                version, companyJobVariantId, regenerated.getVersion());
        return regenerated;
    }

    /**
     * Take a variant off the board. No version is created and
     * {@code publishedAt} is kept.
     *
     * @throws ResourceNotFoundException if the variant is missing
     */
    public CompanyJobVariant unpublish(CompanyJobVariant variant) {
        if (variant == null) {
            throw new ResourceNotFoundException("CompanyJobVariant");
        }
        log.info("Unpublished variant {}", variant.getId());
        return variant.toBuilder().active(false).build();
    }

    /**
     * All versions of a variant, newest first.
     */
    public List<JdVersion> findByVariant(String companyJobVariantId) {
        return jdVersionRepository.findByVariant(companyJobVariantId);
    }

    /**
     * @throws ResourceNotFoundException if the variant was never published
     */
    public JdVersion findLatest(String companyJobVariantId) {
        return jdVersionRepository.findLatest(companyJobVariantId)
                .orElseThrow(() -> new ResourceNotFoundException("JdVersion for variant", companyJobVariantId));
    }
}
