package dev.talentmatch.service;

import dev.talentmatch.exception.ConflictException;
import dev.talentmatch.exception.ResourceNotFoundException;
import dev.talentmatch.exception.ValidationException;
import dev.talentmatch.metrics.RecruitingMetrics;
import dev.talentmatch.model.Application;
import dev.talentmatch.model.MatchExplanation;
import dev.talentmatch.model.PipelineStage;
import dev.talentmatch.model.StageTransition;
import dev.talentmatch.repository.ApplicationRepository;
import dev.talentmatch.repository.MatchExplanationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application lifecycle: creation, stage changes and fit score recording.
 *
 * <p>Every write goes through a version compare-and-set, so a caller working
 * from an outdated copy gets a retryable conflict instead of a lost update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationService {

    private final ApplicationRepository applicationRepository;
    private final MatchExplanationRepository matchExplanationRepository;
    private final PipelineStateMachine stateMachine;
    private final RecruitingMetrics metrics;
    private final Clock clock;

    /**
     * Create an application in the applied stage.
     *
     * @throws ConflictException   if the candidate already applied to this variant
     * @throws ValidationException if an id is missing
     */
    public Application create(String candidateId, String companyJobVariantId, String createdBy) {
        requireText(candidateId, "candidateId");
        requireText(companyJobVariantId, "companyJobVariantId");

        Application application = stateMachine.initial(candidateId, companyJobVariantId, createdBy);
        try {
            applicationRepository.insert(application);
        } catch (ConflictException e) {
            metrics.recordConflict(e.getCode());
            throw e;
        }

        metrics.recordApplicationCreated();
        log.info("Created application {} for candidate {} on variant {}",
                application.getId(), candidateId, companyJobVariantId);
        return application;
    }

    /**
     * Move an application to another stage, based on its current stored state.
     */
    public Application transitionStage(String applicationId, StageTransition transition) {
        Application current = findById(applicationId);
        return transitionStage(current, transition);
    }

    /**
     * Move an application to another stage, failing if it changed since the
     * caller read {@code expectedVersion}.
     *
     * @throws ConflictException if the application is finalized or was modified concurrently
     */
    public Application transitionStage(String applicationId, long expectedVersion, StageTransition transition) {
        Application current = findById(applicationId);
        if (current.getVersion() != expectedVersion) {
            throw conflict(ConflictException.stale(applicationId, expectedVersion));
        }
        return transitionStage(current, transition);
    }

    /**
     * Store a scoring run's explanation, replacing the previous one, and copy
     * its overall score onto the application.
     */
    public Application recordMatch(String applicationId, MatchExplanation explanation) {
        if (explanation == null) {
            throw new ResourceNotFoundException("MatchExplanation");
        }
        int score = explanation.overallScore();
        if (score < 0 || score > 100) {
            throw new ValidationException("fitScore must be between 0 and 100, was " + score);
        }

        Application current = findById(applicationId);
        Application updated = current.toBuilder()
                .fitScore(score)
                .version(current.getVersion() + 1)
                .lastUpdated(clock.instant())
                .build();
        save(updated, current.getVersion());
        matchExplanationRepository.save(applicationId, explanation);

        log.debug("Recorded fit score {} for application {}", score, applicationId);
        return updated;
    }

    /**
     * @throws ResourceNotFoundException if no application has this id
     */
    public Application findById(String applicationId) {
        return applicationRepository.findById(applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
    }

    public Optional<MatchExplanation> findMatch(String applicationId) {
        return matchExplanationRepository.findByApplicationId(applicationId);
    }

    public List<Application> findByVariant(String companyJobVariantId) {
        return applicationRepository.findByVariant(companyJobVariantId);
    }

    /**
     * Number of applications in each stage, zero included.
     */
    public Map<PipelineStage, Long> countByStage() {
        Map<PipelineStage, Long> counts = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            counts.put(stage, applicationRepository.countByStatus(stage));
        }
        return counts;
    }

    private Application transitionStage(Application current, StageTransition transition) {
        if (transition == null) {
            throw new ValidationException("Stage transition is required", ValidationException.INVALID_STAGE_TRANSITION);
        }

        Application next;
        try {
            next = stateMachine.apply(current, transition);
        } catch (ConflictException e) {
            throw conflict(e);
        }
        save(next, current.getVersion());

        metrics.recordTransition(next.getStatus());
        log.info("Application {} moved {} -> {}{}", current.getId(), current.getStatus(), next.getStatus(),
                transition.automated() ? " (automated)" : " by " + transition.changedBy());
        return next;
    }

    private void save(Application updated, long expectedVersion) {
        if (!applicationRepository.compareAndSave(updated, expectedVersion)) {
            log.warn("Stale write rejected for application {} at version {}", updated.getId(), expectedVersion);
            throw conflict(ConflictException.stale(updated.getId(), expectedVersion));
        }
    }

    private ConflictException conflict(ConflictException e) {
        metrics.recordConflict(e.getCode());
        return e;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
