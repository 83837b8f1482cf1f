package dev.talentmatch.validation;

import dev.talentmatch.exception.ValidationException;

import java.util.List;

/**
 * Outcome of validating one entity: the value with defaults applied, and the
 * violations found. The value is only meaningful when there are none.
 */
public record ValidationResult<T>(T value, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public T orElseThrow(String entity) {
        if (!isValid()) {
            throw new ValidationException(entity, errors);
        }
        return value;
    }
}
