package dev.talentmatch.exception;

import lombok.Getter;

/**
 * Base of the domain error taxonomy. {@code code} is stable and meant for the
 * caller to map onto its own transport.
 */
@Getter
public abstract class RecruitingException extends RuntimeException {

    private final String code;

    protected RecruitingException(String message, String code) {
        super(message);
        this.code = code;
    }

    /**
     * Whether retrying against freshly fetched state may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
