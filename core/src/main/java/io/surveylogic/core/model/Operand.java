package io.surveylogic.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Typed leaf operand, converted from the untyped definition once at parse time. Sealed so the
 * evaluator never has to inspect raw JSON.
 */
public sealed interface Operand {

    /** Text or choice option value. */
    record Text(String value) implements Operand {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Numeric value; compared with {@link BigDecimal#compareTo}, so {@code 1} equals {@code 1.0}. */
    record Number(BigDecimal value) implements Operand {
        public Number {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Boolean value. */
    record Flag(boolean value) implements Operand {}

    /** ISO-8601 calendar date. */
    record Date(LocalDate value) implements Operand {
        public Date {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * Compiled regular expression. {@code anchored} is {@code true} when the pattern must match
     * the whole value; patterns that carry their own {@code ^} or {@code $} are searched as
     * written.
     */
    record Regex(Pattern pattern, boolean anchored) implements Operand {
        public Regex {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Regex that
                    && anchored == that.anchored
                    && pattern.pattern().equals(that.pattern.pattern())
                    && pattern.flags() == that.pattern.flags();
        }

        @Override
        public int hashCode() {
            return Objects.hash(pattern.pattern(), pattern.flags(), anchored);
        }
    }
}
