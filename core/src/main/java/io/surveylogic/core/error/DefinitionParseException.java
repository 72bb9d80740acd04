package io.surveylogic.core.error;

/**
 * Thrown when a survey definition cannot be read, violates the structural schema, or has
 * missing, duplicated or contradictory sections, fields and validation rules.
 */
public final class DefinitionParseException extends DefinitionLoadException {

    private static final long serialVersionUID = 1L;

    public DefinitionParseException(String message, String surveyId, String source, String path) {
        super(message, surveyId, source, path);
    }

    public DefinitionParseException(String message, Throwable cause, String surveyId, String source, String path) {
        super(message, cause, surveyId, source, path);
    }
}
