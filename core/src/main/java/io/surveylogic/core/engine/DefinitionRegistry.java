package io.surveylogic.core.engine;

import io.surveylogic.core.model.SurveyDefinition;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of all loaded survey definitions.
 *
 * <p>
 * This is the unit of atomic swap in {@link SurveyLogicEngine#reload}. The engine holds a
 * {@code DefinitionRegistry} through an {@link java.util.concurrent.atomic.AtomicReference};
 * evaluations that captured the old snapshot finish with it, new ones see the new snapshot.
 *
 * <p>
 * Every definition is registered under its {@code id@version} key and under its plain id; the
 * plain id resolves to the version registered last.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class DefinitionRegistry {

    private final Map<String, SurveyDefinition> definitions;

    /**
     * @param definitions map of keys (id and id@version) to definitions, copied on construction
     */
    public DefinitionRegistry(Map<String, SurveyDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new HashMap<>(definitions));
    }

    public static DefinitionRegistry empty() {
        return new DefinitionRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a definition by id (latest registered version) or by {@code id@version}.
     */
    public Optional<SurveyDefinition> get(String key) {
        return Optional.ofNullable(definitions.get(key));
    }

    /** Unmodifiable view of all entries, keyed by id and by id@version. */
    public Map<String, SurveyDefinition> allDefinitions() {
        return definitions;
    }

    /** Distinct definitions (one per id@version), sorted by key. */
    public List<SurveyDefinition> distinctDefinitions() {
        Map<String, SurveyDefinition> byKey = new LinkedHashMap<>();
        definitions.values().stream()
                .sorted((a, b) -> a.key().compareTo(b.key()))
                .forEach(def -> byKey.putIfAbsent(def.key(), def));
        return List.copyOf(byKey.values());
    }

    /** Number of distinct definitions (id@version pairs). */
    public int definitionCount() {
        return distinctDefinitions().size();
    }

    /** Returns a copy of this registry with one more definition. */
    DefinitionRegistry with(SurveyDefinition definition) {
        Map<String, SurveyDefinition> updated = new HashMap<>(definitions);
        updated.put(definition.id(), definition);
        updated.put(definition.key(), definition);
        return new DefinitionRegistry(updated);
    }

    /**
     * Builder for a {@link DefinitionRegistry}. Each definition is registered under its id and its
     * {@code id@version} key.
     */
    public static final class Builder {

        private final Map<String, SurveyDefinition> definitions = new HashMap<>();

        Builder() {}

        public Builder add(SurveyDefinition definition) {
            definitions.put(definition.id(), definition);
            definitions.put(definition.key(), definition);
            return this;
        }

        public DefinitionRegistry build() {
            return new DefinitionRegistry(definitions);
        }
    }
}
