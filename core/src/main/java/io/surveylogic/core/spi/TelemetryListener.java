package io.surveylogic.core.spi;

/**
 * SPI for observability hooks. Integrations bridge these events to metrics or tracing systems;
 * the core has no telemetry dependency of its own.
 *
 * <p>
 * Events are immutable. Implementations must be thread-safe and non-blocking. Exceptions thrown
 * by a listener are caught and logged by the engine and never affect loading or evaluation.
 *
 * <p>
 * Suggested metrics vocabulary:
 * <ul>
 * <li>{@code survey_definitions_loaded_total}: counter, incremented on loaded</li>
 * <li>{@code survey_definition_load_errors_total}: counter, incremented on rejected</li>
 * <li>{@code survey_evaluations_total}: counter, incremented on completed</li>
 * <li>{@code survey_evaluation_duration_seconds}: histogram of evaluation duration</li>
 * </ul>
 */
public interface TelemetryListener {

    /**
     * Called when a definition is parsed, validated and registered.
     *
     * @param event contains surveyId, surveyVersion, source
     */
    void onDefinitionLoaded(DefinitionLoadedEvent event);

    /**
     * Called when a definition is rejected at load time.
     *
     * @param event contains source, surveyId (may be null), errorDetail
     */
    void onDefinitionRejected(DefinitionRejectedEvent event);

    /**
     * Called when a full evaluation (visibility, navigation, validation) completes.
     *
     * @param event contains surveyId, surveyVersion, sectionId, durations and counts
     */
    void onEvaluationCompleted(EvaluationCompletedEvent event);

    // --- Event records ---

    /** Event emitted when a definition is loaded. */
    record DefinitionLoadedEvent(String surveyId, String surveyVersion, String source) {}

    /** Event emitted when a definition is rejected. */
    record DefinitionRejectedEvent(String source, String surveyId, String errorDetail) {}

    /** Event emitted when an evaluation completes. */
    record EvaluationCompletedEvent(
            String surveyId,
            String surveyVersion,
            String sectionId,
            long durationMicros,
            int visibleFields,
            int validationErrors) {}
}
