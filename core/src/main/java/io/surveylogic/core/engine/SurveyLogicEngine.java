package io.surveylogic.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.surveylogic.core.error.SurveyLogicException;
import io.surveylogic.core.model.AnswerSet;
import io.surveylogic.core.model.Condition;
import io.surveylogic.core.model.ConditionTrace;
import io.surveylogic.core.model.EvaluationResult;
import io.surveylogic.core.model.NavigationResult;
import io.surveylogic.core.model.SurveyDefinition;
import io.surveylogic.core.model.Truth;
import io.surveylogic.core.model.ValidationError;
import io.surveylogic.core.model.VisibilitySnapshot;
import io.surveylogic.core.spec.DefinitionParser;
import io.surveylogic.core.spi.TelemetryListener;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the survey logic engine: loads definitions and answers visibility, navigation
 * and validation questions about them.
 *
 * <p>
 * Loaded definitions live in an immutable {@link DefinitionRegistry} held by an
 * {@link AtomicReference}. A definition becomes visible to other threads only after it has been
 * fully parsed and validated; a failed load or reload leaves the previous registry untouched.
 *
 * <p>
 * Evaluation methods take the definition explicitly and are pure functions of their arguments,
 * so any number of threads may call them concurrently.
 */
public final class SurveyLogicEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SurveyLogicEngine.class);

    private final DefinitionParser parser;
    private final ConditionEvaluator evaluator;
    private final VisibilityResolver visibilityResolver;
    private final NavigationResolver navigationResolver;
    private final ValidationEngine validationEngine;
    private final TelemetryListener telemetryListener;
    private final AtomicReference<DefinitionRegistry> registryRef = new AtomicReference<>(DefinitionRegistry.empty());

    /** Creates an engine with default options and no telemetry listener. */
    public SurveyLogicEngine() {
        this(EngineOptions.DEFAULT, null);
    }

    public SurveyLogicEngine(EngineOptions options) {
        this(options, null);
    }

    /**
     * @param options           parse limits
     * @param telemetryListener optional listener for load and evaluation events, may be null
     */
    public SurveyLogicEngine(EngineOptions options, TelemetryListener telemetryListener) {
        this.parser = new DefinitionParser(Objects.requireNonNull(options, "options must not be null"));
        this.evaluator = new ConditionEvaluator();
        this.visibilityResolver = new VisibilityResolver(evaluator);
        this.navigationResolver = new NavigationResolver(evaluator);
        this.validationEngine = new ValidationEngine();
        this.telemetryListener = telemetryListener; // nullable
    }

    // --- Loading ---

    /**
     * Loads a definition file (YAML or JSON) and registers it under its id and id@version.
     *
     * @throws io.surveylogic.core.error.DefinitionLoadException if the definition is invalid
     */
    public SurveyDefinition loadDefinition(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        try {
            return register(parser.parse(path), source);
        } catch (SurveyLogicException e) {
            rejected(source, e);
            throw e;
        }
    }

    /**
     * Loads an already-read definition tree and registers it.
     *
     * @param root   definition root
     * @param source label for logs and errors
     */
    public SurveyDefinition loadDefinition(JsonNode root, String source) {
        try {
            return register(parser.parse(root, source), source);
        } catch (SurveyLogicException e) {
            rejected(source, e);
            throw e;
        }
    }

    /**
     * Replaces all loaded definitions with the given files. Every file is parsed before the
     * swap; if any one fails, the exception propagates and the current registry stays active.
     */
    public void reload(List<Path> paths) {
        DefinitionRegistry.Builder builder = DefinitionRegistry.builder();
        List<SurveyDefinition> loaded = new ArrayList<>(paths.size());
        for (Path path : paths) {
            try {
                SurveyDefinition definition = parser.parse(path);
                builder.add(definition);
                loaded.add(definition);
            } catch (SurveyLogicException e) {
                rejected(path.toString(), e);
                throw e;
            }
        }
        DefinitionRegistry newRegistry = builder.build();
        registryRef.set(newRegistry);
        LOG.info("registry.reloaded definitions={}", newRegistry.definitionCount());
        for (int i = 0; i < loaded.size(); i++) {
            notifyLoaded(loaded.get(i), paths.get(i).toString());
        }
    }

    /** Current registry snapshot. */
    public DefinitionRegistry registry() {
        return registryRef.get();
    }

    /** Looks up a loaded definition by id (latest version) or {@code id@version}. */
    public Optional<SurveyDefinition> getDefinition(String key) {
        return registryRef.get().get(key);
    }

    public DefinitionParser parser() {
        return parser;
    }

    // --- Evaluation ---

    /** Visible sections and fields for {@code answers}. */
    public VisibilitySnapshot computeVisibility(SurveyDefinition definition, AnswerSet answers, String currentSection) {
        return visibilityResolver.computeVisibility(definition, answers, currentSection);
    }

    /** Section following {@code currentSection}, or the survey-complete marker. */
    public NavigationResult resolveNext(
            SurveyDefinition definition, VisibilitySnapshot snapshot, String currentSection) {
        return navigationResolver.resolveNext(definition, snapshot, currentSection);
    }

    /** Rule violations of the visible fields. */
    public List<ValidationError> validate(SurveyDefinition definition, VisibilitySnapshot snapshot, AnswerSet answers) {
        return validationEngine.validate(definition, snapshot, answers);
    }

    /**
     * Full recompute of visibility, navigation and validation for one answer set. Callers
     * re-invoke this after every answer change; results are never patched incrementally.
     */
    public EvaluationResult evaluate(SurveyDefinition definition, AnswerSet answers, String currentSection) {
        long start = System.nanoTime();
        VisibilitySnapshot snapshot = visibilityResolver.computeVisibility(definition, answers, currentSection);
        NavigationResult next = navigationResolver.resolveNext(definition, snapshot, currentSection);
        List<ValidationError> errors = validationEngine.validate(definition, snapshot, answers);
        EvaluationResult result = new EvaluationResult(snapshot, next, errors);
        long micros = (System.nanoTime() - start) / 1_000;

        LOG.debug(
                "evaluation.completed survey_id={} version={} section={} visible_fields={} next={} errors={}"
                        + " duration_us={}",
                definition.id(),
                definition.version(),
                currentSection,
                snapshot.visibleFieldIds().size(),
                next.isComplete() ? "COMPLETE" : next.sectionId(),
                errors.size(),
                micros);
        notifyEvaluated(definition, currentSection, micros, result);
        return result;
    }

    /** Evaluates one condition. */
    public Truth evaluateCondition(Condition condition, AnswerSet answers) {
        return evaluator.evaluate(condition, answers);
    }

    /** Evaluates one condition and returns the outcome of every node. */
    public ConditionTrace explain(Condition condition, AnswerSet answers) {
        return evaluator.explain(condition, answers);
    }

    /**
     * Parses an ad-hoc condition against a definition (all fields in scope) and explains it.
     *
     * @throws io.surveylogic.core.error.ConditionParseException if the condition is invalid
     */
    public ConditionTrace explain(SurveyDefinition definition, JsonNode condition, AnswerSet answers) {
        return evaluator.explain(parser.parseCondition(definition, condition), answers);
    }

    // --- Internals ---

    private SurveyDefinition register(SurveyDefinition definition, String source) {
        registryRef.updateAndGet(old -> old.with(definition));
        LOG.info(
                "definition.loaded survey_id={} version={} sections={} fields={} source={}",
                definition.id(),
                definition.version(),
                definition.sections().size(),
                definition.fields().size(),
                source);
        notifyLoaded(definition, source);
        return definition;
    }

    private void rejected(String source, SurveyLogicException e) {
        LOG.warn(
                "definition.rejected source={} survey_id={} phase={} reason={}",
                source,
                e.surveyId(),
                e.phase(),
                e.getMessage());
        if (telemetryListener == null) return;
        try {
            telemetryListener.onDefinitionRejected(
                    new TelemetryListener.DefinitionRejectedEvent(source, e.surveyId(), e.getMessage()));
        } catch (Exception listenerFailure) {
            LOG.warn("TelemetryListener.onDefinitionRejected failed", listenerFailure);
        }
    }

    private void notifyLoaded(SurveyDefinition definition, String source) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onDefinitionLoaded(
                    new TelemetryListener.DefinitionLoadedEvent(definition.id(), definition.version(), source));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onDefinitionLoaded failed", e);
        }
    }

    private void notifyEvaluated(
            SurveyDefinition definition, String section, long micros, EvaluationResult result) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onEvaluationCompleted(new TelemetryListener.EvaluationCompletedEvent(
                    definition.id(),
                    definition.version(),
                    section,
                    micros,
                    result.visibleFieldIds().size(),
                    result.errors().size()));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onEvaluationCompleted failed", e);
        }
    }
}
