package io.surveylogic.core.error;

/**
 * Abstract parent for load-time definition errors. Thrown during {@code
 * SurveyLogicEngine.loadDefinition()} and always fatal to that survey version: nothing is
 * registered when one of these escapes. Carries the {@code source} (file or resource) and the
 * {@code path} of the offending node inside the definition, e.g. {@code
 * sections[1].fields[0].visibilityCondition.conditions[2]}.
 */
public abstract class DefinitionLoadException extends SurveyLogicException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final String path;

    protected DefinitionLoadException(String message, String surveyId, String source, String path) {
        super(message, surveyId, Phase.LOAD);
        this.source = source;
        this.path = path;
    }

    protected DefinitionLoadException(String message, Throwable cause, String surveyId, String source, String path) {
        super(message, cause, surveyId, Phase.LOAD);
        this.source = source;
        this.path = path;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }

    /** Path of the offending node inside the definition, or {@code null} for whole-document errors. */
    public String path() {
        return path;
    }
}
