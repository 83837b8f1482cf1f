package dev.talentmatch.model;

/**
 * New JD version together with the variant as updated by the publish.
 */
public record PublishResult(JdVersion version, CompanyJobVariant variant) {
}
