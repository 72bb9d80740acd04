package io.surveylogic.cli.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML or an invalid value.
 * Carries a message suitable for command-line error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
