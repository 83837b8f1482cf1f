package dev.talentmatch.repository;

import dev.talentmatch.model.MatchExplanation;

import java.util.Optional;

/**
 * Latest match explanation per application. Saving replaces the previous one.
 */
public interface MatchExplanationRepository {

    void save(String applicationId, MatchExplanation explanation);

    Optional<MatchExplanation> findByApplicationId(String applicationId);
}
