package io.surveylogic.core.error;

/**
 * Thrown when a condition tree is malformed: unknown operator, dangling or forward field
 * reference, operand incompatible with the field type, bad {@code NOT}/{@code AND}/{@code OR}
 * arity, or nesting beyond the configured depth.
 */
public final class ConditionParseException extends DefinitionLoadException {

    private static final long serialVersionUID = 1L;

    public ConditionParseException(String message, String surveyId, String source, String path) {
        super(message, surveyId, source, path);
    }

    public ConditionParseException(String message, Throwable cause, String surveyId, String source, String path) {
        super(message, cause, surveyId, source, path);
    }
}
