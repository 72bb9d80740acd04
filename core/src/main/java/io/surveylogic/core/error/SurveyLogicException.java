package io.surveylogic.core.error;

/**
 * Abstract base for all survey-logic exceptions. Never thrown directly; use the concrete
 * subclasses under {@link DefinitionLoadException} or {@link SurveyEvalException}.
 */
public abstract class SurveyLogicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final String surveyId;
    private final Phase phase;

    protected SurveyLogicException(String message, String surveyId, Phase phase) {
        super(message);
        this.surveyId = surveyId;
        this.phase = phase;
    }

    protected SurveyLogicException(String message, Throwable cause, String surveyId, Phase phase) {
        super(message, cause);
        this.surveyId = surveyId;
        this.phase = phase;
    }

    /** The survey that triggered the error, or {@code null} if not yet identified. */
    public String surveyId() {
        return surveyId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
