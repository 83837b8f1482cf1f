package dev.talentmatch.repository.impl;

import dev.talentmatch.model.MatchExplanation;
import dev.talentmatch.repository.MatchExplanationRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryMatchExplanationRepository implements MatchExplanationRepository {

    private final Map<String, MatchExplanation> explanations = new ConcurrentHashMap<>();

    @Override
    public void save(String applicationId, MatchExplanation explanation) {
        explanations.put(applicationId, explanation);
    }

    @Override
    public Optional<MatchExplanation> findByApplicationId(String applicationId) {
        return Optional.ofNullable(applicationId).map(explanations::get);
    }
}
