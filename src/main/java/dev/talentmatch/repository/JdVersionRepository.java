package dev.talentmatch.repository;

import dev.talentmatch.model.JdVersion;

import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Append-only storage of published job description versions.
 */
public interface JdVersionRepository {

    /**
     * Atomically number and store the next version of a variant.
     *
     * @param factory builds the record for the allocated version number,
     *                which is one more than the highest stored so far
     */
    JdVersion append(String companyJobVariantId, IntFunction<JdVersion> factory);

    /**
     * All versions of a variant, newest first.
     */
    List<JdVersion> findByVariant(String companyJobVariantId);

    Optional<JdVersion> findLatest(String companyJobVariantId);

    Optional<JdVersion> findVersion(String companyJobVariantId, int version);
}
