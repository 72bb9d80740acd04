package io.surveylogic.cli.config;

import io.surveylogic.core.engine.EngineOptions;

/**
 * Configuration of the command-line runner. Every field has a default; use {@link #builder()}.
 *
 * @param loggingFormat     {@code text} or {@code json}
 * @param loggingLevel      level of the {@code io.surveylogic} loggers
 * @param maxConditionDepth deepest condition nesting accepted when loading definitions
 * @param maxPatternLength  longest regular expression accepted when loading definitions
 */
public record CliConfig(String loggingFormat, String loggingLevel, int maxConditionDepth, int maxPatternLength) {

    public static Builder builder() {
        return new Builder();
    }

    public static CliConfig defaults() {
        return builder().build();
    }

    /** Parse limits for the engine. */
    public EngineOptions engineOptions() {
        return new EngineOptions(maxConditionDepth, maxPatternLength);
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {

        private String loggingFormat = "text";
        private String loggingLevel = "WARN";
        private int maxConditionDepth = EngineOptions.DEFAULT.maxConditionDepth();
        private int maxPatternLength = EngineOptions.DEFAULT.maxPatternLength();

        Builder() {}

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder maxConditionDepth(int maxConditionDepth) {
            this.maxConditionDepth = maxConditionDepth;
            return this;
        }

        public Builder maxPatternLength(int maxPatternLength) {
            this.maxPatternLength = maxPatternLength;
            return this;
        }

        /**
         * @throws ConfigLoadException if a value is out of range
         */
        public CliConfig build() {
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException(
                        "Invalid logging.format '" + loggingFormat + "': expected 'text' or 'json'");
            }
            if (maxConditionDepth <= 0) {
                throw new ConfigLoadException("engine.max-condition-depth must be positive, got " + maxConditionDepth);
            }
            if (maxPatternLength <= 0) {
                throw new ConfigLoadException("engine.max-pattern-length must be positive, got " + maxPatternLength);
            }
            return new CliConfig(loggingFormat, loggingLevel, maxConditionDepth, maxPatternLength);
        }
    }
}
