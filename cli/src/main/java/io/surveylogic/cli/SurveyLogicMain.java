package io.surveylogic.cli;

/**
 * Entry point for the {@code survey-logic} command. Delegates to {@link CliApp} and exits with
 * its status code.
 */
public final class SurveyLogicMain {

    private SurveyLogicMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code check survey.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int exit = new CliApp(System.out, System.err).run(args);
        System.exit(exit);
    }
}
