package io.surveylogic.core.error;

/**
 * Abstract parent for per-request evaluation errors. Evaluation against a loaded definition does
 * not fail on missing answers (those are indeterminate); these exceptions signal a caller error
 * such as naming a section the definition does not contain.
 */
public abstract class SurveyEvalException extends SurveyLogicException {

    private static final long serialVersionUID = 1L;

    protected SurveyEvalException(String message, String surveyId) {
        super(message, surveyId, Phase.EVALUATION);
    }
}
