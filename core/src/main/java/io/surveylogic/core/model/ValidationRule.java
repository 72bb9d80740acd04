package io.surveylogic.core.model;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validation rule attached to one field. Immutable, thread-safe; created at load time by {@code
 * DefinitionParser}.
 *
 * @param kind    rule kind
 * @param limit   numeric bound for {@code minValue}/{@code maxValue}/{@code minLength}/{@code
 *                maxLength}, otherwise {@code null}
 * @param pattern compiled pattern for {@code pattern} rules, otherwise {@code null}
 * @param message optional author-supplied message replacing the default one
 */
public record ValidationRule(Kind kind, BigDecimal limit, Pattern pattern, String message) {

    /** Rule kinds as named in definition files. */
    public enum Kind {
        REQUIRED("required"),
        MIN_VALUE("minValue"),
        MAX_VALUE("maxValue"),
        MIN_LENGTH("minLength"),
        MAX_LENGTH("maxLength"),
        PATTERN("pattern");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Optional<Kind> fromWireName(String name) {
            return Arrays.stream(values())
                    .filter(kind -> kind.wireName.equals(name))
                    .findFirst();
        }
    }

    public ValidationRule {
        Objects.requireNonNull(kind, "kind must not be null");
        switch (kind) {
            case REQUIRED -> {
                if (limit != null || pattern != null) {
                    throw new IllegalArgumentException("required takes no operand");
                }
            }
            case PATTERN -> Objects.requireNonNull(pattern, "pattern rule requires a pattern");
            default -> Objects.requireNonNull(limit, kind.wireName() + " rule requires a limit");
        }
    }

    public static ValidationRule required() {
        return new ValidationRule(Kind.REQUIRED, null, null, null);
    }

    public static ValidationRule minValue(BigDecimal min) {
        return new ValidationRule(Kind.MIN_VALUE, min, null, null);
    }

    public static ValidationRule maxValue(BigDecimal max) {
        return new ValidationRule(Kind.MAX_VALUE, max, null, null);
    }

    public static ValidationRule minLength(int min) {
        return new ValidationRule(Kind.MIN_LENGTH, BigDecimal.valueOf(min), null, null);
    }

    public static ValidationRule maxLength(int max) {
        return new ValidationRule(Kind.MAX_LENGTH, BigDecimal.valueOf(max), null, null);
    }

    public static ValidationRule pattern(String regex) {
        return new ValidationRule(Kind.PATTERN, null, Pattern.compile(regex), null);
    }

    /** Returns a copy of this rule carrying a custom error message. */
    public ValidationRule withMessage(String customMessage) {
        return new ValidationRule(kind, limit, pattern, customMessage);
    }
}
