package dev.talentmatch.exception;

public class ConflictException extends RecruitingException {

    public static final String APPLICATION_EXISTS = "APPLICATION_EXISTS";
    public static final String APPLICATION_FINALIZED = "APPLICATION_FINALIZED";
    public static final String STALE_APPLICATION_STATE = "STALE_APPLICATION_STATE";

    public ConflictException(String message, String code) {
        super(message, code);
    }

    public static ConflictException applicationExists(String candidateId, String variantId) {
        return new ConflictException("Application already exists for candidate " + candidateId
                + " and job variant " + variantId, APPLICATION_EXISTS);
    }

    public static ConflictException finalized(String applicationId) {
        return new ConflictException("Application " + applicationId + " already finalized",
                APPLICATION_FINALIZED);
    }

    public static ConflictException stale(String applicationId, long expectedVersion) {
        return new ConflictException("Application " + applicationId + " changed since version "
                + expectedVersion + "; re-fetch and retry", STALE_APPLICATION_STATE);
    }

    @Override
    public boolean isRetryable() {
        return STALE_APPLICATION_STATE.equals(getCode());
    }
}
