package io.surveylogic.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads raw JSON answers and operands as typed values. Every reader returns empty when the value
 * cannot be read as the requested type; callers decide whether that is indeterminate (evaluation),
 * a type mismatch (validation) or a definition error (parsing).
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class AnswerValues {

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off");

    private AnswerValues() {}

    /** Finite numbers, and strings holding a plain decimal number. NaN and infinities are unreadable. */
    public static Optional<BigDecimal> asNumber(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isFloatingPointNumber() && !Double.isFinite(value.doubleValue())) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.decimalValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(new BigDecimal(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /** Booleans, and the words true/yes/on and false/no/off in any case. */
    public static Optional<Boolean> asBoolean(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isBoolean()) {
            return Optional.of(value.booleanValue());
        }
        if (value.isTextual()) {
            String word = value.asText().trim().toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(word)) {
                return Optional.of(Boolean.TRUE);
            }
            if (FALSE_WORDS.contains(word)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    /** ISO-8601 dates; an ISO date-time is read as its date part. */
    public static Optional<LocalDate> asDate(JsonNode value) {
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(text).toLocalDate());
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }

    /** Scalars rendered as text. Arrays and objects are not text. */
    public static Optional<String> asText(JsonNode value) {
        if (value == null || !value.isValueNode() || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    /**
     * Multi-choice selections: an array of scalars, or a single scalar read as a one-element
     * selection.
     */
    public static Optional<List<String>> asSelections(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isArray()) {
            List<String> selections = new ArrayList<>();
            for (JsonNode element : value) {
                Optional<String> text = asText(element);
                if (text.isEmpty()) {
                    return Optional.empty();
                }
                selections.add(text.get());
            }
            return Optional.of(List.copyOf(selections));
        }
        return asText(value).map(List::of);
    }
}
