package io.surveylogic.core.model;

import java.util.Objects;

/**
 * One rule violation found by {@code ValidationEngine}. Returned as data, never thrown.
 *
 * @param fieldId violating field
 * @param code    violated rule or implicit value check
 * @param message human-readable message
 */
public record ValidationError(String fieldId, Code code, String message) {

    /** Error codes: one per rule kind plus the implicit value checks. */
    public enum Code {
        REQUIRED,
        MIN_VALUE,
        MAX_VALUE,
        MIN_LENGTH,
        MAX_LENGTH,
        PATTERN,
        /** Answer cannot be read as the field's declared type. */
        TYPE_MISMATCH,
        /** Choice answer is not one of the declared options. */
        UNKNOWN_OPTION;

        public static Code of(ValidationRule.Kind kind) {
            return switch (kind) {
                case REQUIRED -> REQUIRED;
                case MIN_VALUE -> MIN_VALUE;
                case MAX_VALUE -> MAX_VALUE;
                case MIN_LENGTH -> MIN_LENGTH;
                case MAX_LENGTH -> MAX_LENGTH;
                case PATTERN -> PATTERN;
            };
        }
    }

    public ValidationError {
        Objects.requireNonNull(fieldId, "fieldId must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
