package dev.talentmatch.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class ValidationException extends RecruitingException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_STAGE_TRANSITION = "INVALID_STAGE_TRANSITION";

    private final List<String> violations;

    public ValidationException(String message) {
        this(message, VALIDATION_ERROR);
    }

    public ValidationException(String message, String code) {
        super(message, code);
        this.violations = List.of(message);
    }

    public ValidationException(String entity, List<String> violations) {
        super("Invalid " + entity + ": " + String.join("; ", violations), VALIDATION_ERROR);
        this.violations = List.copyOf(violations);
    }
}
