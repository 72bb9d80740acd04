package io.surveylogic.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.surveylogic.cli.config.CliConfig;
import io.surveylogic.cli.config.ConfigLoadException;
import io.surveylogic.cli.config.ConfigLoader;
import io.surveylogic.core.engine.SurveyLogicEngine;
import io.surveylogic.core.error.DefinitionLoadException;
import io.surveylogic.core.error.SurveyLogicException;
import io.surveylogic.core.model.AnswerSet;
import io.surveylogic.core.model.EvaluationResult;
import io.surveylogic.core.model.SurveyDefinition;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line runner.
 *
 * <pre>
 * survey-logic [--config file] check &lt;definition&gt;...
 * survey-logic [--config file] evaluate &lt;definition&gt; --answers &lt;file&gt; [--section &lt;id&gt;]
 * </pre>
 *
 * <p>
 * Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_FAILURE} when a definition, answer file
 * or configuration cannot be loaded, {@value #EXIT_USAGE} on usage errors.
 */
public final class CliApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage:",
            "  survey-logic [--config <file>] check <definition>...",
            "  survey-logic [--config <file>] evaluate <definition> --answers <file> [--section <id>]");

    private static final Logger LOG = LoggerFactory.getLogger(CliApp.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final boolean configureLogging;

    public CliApp(PrintStream out, PrintStream err) {
        this(out, err, System::getenv, true);
    }

    CliApp(PrintStream out, PrintStream err, Function<String, String> envLookup, boolean configureLogging) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
        this.configureLogging = configureLogging;
    }

    /**
     * Runs one command.
     *
     * @return process exit code
     */
    public int run(String[] args) {
        CliConfig config;
        List<String> rest;
        try {
            config = ConfigLoader.load(args, envLookup);
            rest = stripConfigOption(args);
        } catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        } catch (ConfigLoadException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (configureLogging) {
            LogbackConfigurator.apply(config);
        }
        if (rest.isEmpty()) {
            return usage("Missing command");
        }

        SurveyLogicEngine engine = new SurveyLogicEngine(config.engineOptions());
        String command = rest.get(0);
        List<String> commandArgs = rest.subList(1, rest.size());
        return switch (command) {
            case "check" -> check(engine, commandArgs);
            case "evaluate" -> evaluate(engine, commandArgs);
            default -> usage("Unknown command '" + command + "'");
        };
    }

    private int check(SurveyLogicEngine engine, List<String> args) {
        if (args.isEmpty()) {
            return usage("check requires at least one definition file");
        }
        int exit = EXIT_OK;
        for (String file : args) {
            try {
                SurveyDefinition definition = engine.loadDefinition(Path.of(file));
                out.println("OK    " + file + " (" + definition.key() + ", " + definition.sections().size()
                        + " sections, " + definition.fields().size() + " fields)");
            } catch (DefinitionLoadException e) {
                out.println("FAIL  " + file + ": " + describe(e));
                exit = EXIT_FAILURE;
            }
        }
        return exit;
    }

    private int evaluate(SurveyLogicEngine engine, List<String> args) {
        String definitionFile = null;
        String answersFile = null;
        String section = null;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "--answers", "--section" -> {
                    if (i + 1 >= args.size()) {
                        return usage(arg + " requires a value");
                    }
                    String value = args.get(++i);
                    if (arg.equals("--answers")) {
                        answersFile = value;
                    } else {
                        section = value;
                    }
                }
                default -> {
                    if (definitionFile != null) {
                        return usage("Unexpected argument '" + arg + "'");
                    }
                    definitionFile = arg;
                }
            }
        }
        if (definitionFile == null || answersFile == null) {
            return usage("evaluate requires a definition file and --answers <file>");
        }

        try {
            SurveyDefinition definition = engine.loadDefinition(Path.of(definitionFile));
            AnswerSet answers = readAnswers(Path.of(answersFile));
            String current = section != null ? section : definition.sections().get(0).id();
            EvaluationResult result = engine.evaluate(definition, answers, current);
            out.println(JSON_MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(ResultJson.toJson(JSON_MAPPER, result)));
            return EXIT_OK;
        } catch (SurveyLogicException e) {
            err.println("Error: " + describe(e));
            return EXIT_FAILURE;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            LOG.debug("evaluate failed", e);
            return EXIT_FAILURE;
        }
    }

    private static AnswerSet readAnswers(Path path) throws IOException {
        JsonNode node = YAML_MAPPER.readTree(path.toFile());
        return AnswerSet.fromJson(node);
    }

    private static String describe(SurveyLogicException e) {
        if (e instanceof DefinitionLoadException load && load.path() != null) {
            return e.getMessage() + " (at " + load.path() + ")";
        }
        return e.getMessage();
    }

    private int usage(String problem) {
        err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static List<String> stripConfigOption(String[] args) {
        List<String> rest = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                i++;
            } else {
                rest.add(args[i]);
            }
        }
        return rest;
    }
}
