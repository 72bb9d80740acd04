package io.surveylogic.core.error;

/** Thrown when an evaluation names a current section that is not part of the definition. */
public final class UnknownSectionException extends SurveyEvalException {

    private static final long serialVersionUID = 1L;

    private final String sectionId;

    public UnknownSectionException(String sectionId, String surveyId) {
        super("Unknown section '" + sectionId + "' in survey '" + surveyId + "'", surveyId);
        this.sectionId = sectionId;
    }

    /** The section id that could not be resolved. */
    public String sectionId() {
        return sectionId;
    }
}
