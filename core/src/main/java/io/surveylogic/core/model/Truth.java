package io.surveylogic.core.model;

/**
 * Three-valued outcome of evaluating a condition. {@link #INDETERMINATE} means a referenced answer
 * is absent (or unreadable as its declared type), which is distinct from a definite {@link #FALSE}.
 */
public enum Truth {
    TRUE,
    FALSE,
    INDETERMINATE;

    public static Truth of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /** Kleene negation: swaps TRUE and FALSE, keeps INDETERMINATE. */
    public Truth not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case INDETERMINATE -> INDETERMINATE;
        };
    }

    /** Kleene conjunction. */
    public Truth and(Truth other) {
        if (this == FALSE || other == FALSE) {
            return FALSE;
        }
        if (this == INDETERMINATE || other == INDETERMINATE) {
            return INDETERMINATE;
        }
        return TRUE;
    }

    /** Kleene disjunction. */
    public Truth or(Truth other) {
        if (this == TRUE || other == TRUE) {
            return TRUE;
        }
        if (this == INDETERMINATE || other == INDETERMINATE) {
            return INDETERMINATE;
        }
        return FALSE;
    }

    /** Visibility reading: only a definite TRUE counts as satisfied. */
    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isIndeterminate() {
        return this == INDETERMINATE;
    }
}
