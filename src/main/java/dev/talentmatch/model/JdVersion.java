package dev.talentmatch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable published snapshot of a variant's resolved specification.
 */
@Value
@Builder
public class JdVersion {

    String id;
    String companyJobVariantId;
    int version;
    ResolvedJobSpec resolvedSpec;
    String publishedContent;
    String createdBy;
    Instant createdAt;
}
