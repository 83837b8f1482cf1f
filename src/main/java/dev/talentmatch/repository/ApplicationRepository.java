package dev.talentmatch.repository;

import dev.talentmatch.model.Application;
import dev.talentmatch.model.PipelineStage;

import java.util.List;
import java.util.Optional;

/**
 * Storage of applications with optimistic locking on {@link Application#getVersion()}.
 */
public interface ApplicationRepository {

    /**
     * Store a new application.
     *
     * @throws dev.talentmatch.exception.ConflictException if the candidate already
     *         applied to the same job variant
     */
    Application insert(Application application);

    /**
     * Replace the stored application only if its version still equals
     * {@code expectedVersion}.
     *
     * @return false when another write got there first
     */
    boolean compareAndSave(Application updated, long expectedVersion);

    Optional<Application> findById(String id);

    Optional<Application> findByCandidateAndVariant(String candidateId, String companyJobVariantId);

    /**
     * Find applications to one job variant, oldest first.
     */
    List<Application> findByVariant(String companyJobVariantId);

    List<Application> findAll();

    long countByStatus(PipelineStage status);
}
