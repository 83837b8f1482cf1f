package dev.talentmatch.repository.impl;

import dev.talentmatch.exception.ConflictException;
import dev.talentmatch.model.Application;
import dev.talentmatch.model.PipelineStage;
import dev.talentmatch.repository.ApplicationRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Repository
public class InMemoryApplicationRepository implements ApplicationRepository {

    private final Map<String, Application> applications = new ConcurrentHashMap<>();

    // candidateId + variantId -> application id
    private final Map<String, String> byCandidateAndVariant = new ConcurrentHashMap<>();

    @Override
    public Application insert(Application application) {
        String pairKey = pairKey(application.getCandidateId(), application.getCompanyJobVariantId());
        if (byCandidateAndVariant.putIfAbsent(pairKey, application.getId()) != null) {
            throw ConflictException.applicationExists(
                    application.getCandidateId(), application.getCompanyJobVariantId());
        }
        applications.put(application.getId(), application);
        return application;
    }

    @Override
    public boolean compareAndSave(Application updated, long expectedVersion) {
        AtomicBoolean saved = new AtomicBoolean(false);
        applications.computeIfPresent(updated.getId(), (id, current) -> {
            if (current.getVersion() != expectedVersion) {
                return current;
            }
            saved.set(true);
            return updated;
        });
        return saved.get();
    }

    @Override
    public Optional<Application> findById(String id) {
        return Optional.ofNullable(id).map(applications::get);
    }

    @Override
    public Optional<Application> findByCandidateAndVariant(String candidateId, String companyJobVariantId) {
        return Optional.ofNullable(byCandidateAndVariant.get(pairKey(candidateId, companyJobVariantId)))
                .map(applications::get);
    }

    @Override
    public List<Application> findByVariant(String companyJobVariantId) {
        return applications.values().stream()
                .filter(a -> a.getCompanyJobVariantId().equals(companyJobVariantId))
                .sorted(Comparator.comparing(Application::getAppliedAt))
                .toList();
    }

    @Override
    public List<Application> findAll() {
        return List.copyOf(applications.values());
    }

    @Override
    public long countByStatus(PipelineStage status) {
        return applications.values().stream()
                .filter(a -> a.getStatus() == status)
                .count();
    }

    private static String pairKey(String candidateId, String companyJobVariantId) {
        return candidateId + '\u0000' + companyJobVariantId;
    }
}
