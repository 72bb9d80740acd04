package io.surveylogic.core.engine;

/**
 * Load-time limits applied while parsing survey definitions. They guard against pathological
 * definitions (deeply nested conditions, huge regular expressions) so that the evaluation hot
 * path never meets them.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxConditionDepth maximum nesting depth of a condition tree, a single leaf being depth 1
 *                          (default: 32)
 * @param maxPatternLength  maximum length of a regular expression in a condition or validation
 *                          rule (default: 1000)
 */
public record EngineOptions(int maxConditionDepth, int maxPatternLength) {

    /** Default options: depth 32, pattern length 1000. */
    public static final EngineOptions DEFAULT = new EngineOptions(32, 1000);

    public EngineOptions {
        if (maxConditionDepth <= 0) {
            throw new IllegalArgumentException("maxConditionDepth must be positive, got: " + maxConditionDepth);
        }
        if (maxPatternLength <= 0) {
            throw new IllegalArgumentException("maxPatternLength must be positive, got: " + maxPatternLength);
        }
    }
}
