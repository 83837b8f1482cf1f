package dev.talentmatch.repository.impl;

import dev.talentmatch.model.JdVersion;
import dev.talentmatch.repository.JdVersionRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;

@Repository
public class InMemoryJdVersionRepository implements JdVersionRepository {

    private final Map<String, List<JdVersion>> versionsByVariant = new ConcurrentHashMap<>();

    @Override
    public JdVersion append(String companyJobVariantId, IntFunction<JdVersion> factory) {
        AtomicReference<JdVersion> created = new AtomicReference<>();
        // compute holds the bin lock, so numbering is serialized per variant
        versionsByVariant.compute(companyJobVariantId, (id, existing) -> {
            List<JdVersion> versions = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
            int next = versions.stream().mapToInt(JdVersion::getVersion).max().orElse(0) + 1;
            JdVersion version = factory.apply(next);
            if (version.getVersion() != next) {
                throw new IllegalStateException("Version factory returned " + version.getVersion()
                        + " instead of " + next);
            }
            versions.add(version);
            created.set(version);
            return List.copyOf(versions);
        });
        return created.get();
    }

    @Override
    public List<JdVersion> findByVariant(String companyJobVariantId) {
        return versionsByVariant.getOrDefault(companyJobVariantId, List.of()).stream()
                .sorted(Comparator.comparingInt(JdVersion::getVersion).reversed())
                .toList();
    }

    @Override
    public Optional<JdVersion> findLatest(String companyJobVariantId) {
        return versionsByVariant.getOrDefault(companyJobVariantId, List.of()).stream()
                .max(Comparator.comparingInt(JdVersion::getVersion));
    }

    @Override
    public Optional<JdVersion> findVersion(String companyJobVariantId, int version) {
        return versionsByVariant.getOrDefault(companyJobVariantId, List.of()).stream()
                .filter(v -> v.getVersion() == version)
                .findFirst();
    }
}
