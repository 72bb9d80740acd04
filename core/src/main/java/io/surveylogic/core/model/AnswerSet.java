package io.surveylogic.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Answers supplied for one evaluation call: field id to raw value. Values keep their untyped JSON
 * shape; they are read against the field's declared type during evaluation.
 *
 * <p>
 * A missing key, JSON {@code null}, a blank string and an empty array all mean "unanswered";
 * such entries are dropped on construction. Values are deep-copied on construction, so later
 * changes to the caller's JSON nodes are not seen. Immutable: {@link #with} and {@link #without}
 * return new instances.
 */
public final class AnswerSet {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AnswerSet EMPTY = new AnswerSet(Map.of());

    private final Map<String, JsonNode> answers;

    private AnswerSet(Map<String, JsonNode> answers) {
        this.answers = answers;
    }

    public static AnswerSet empty() {
        return EMPTY;
    }

    /**
     * Builds an answer set from plain Java values ({@link String}, {@link Number}, {@link
     * Boolean}, {@link java.util.List} ...). {@code null} values are treated as unanswered.
     */
    public static AnswerSet of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        Map<String, JsonNode> converted = new LinkedHashMap<>();
        values.forEach((fieldId, value) -> putIfAnswered(converted, fieldId, MAPPER.valueToTree(value)));
        return new AnswerSet(Collections.unmodifiableMap(converted));
    }

    /**
     * Builds an answer set from a JSON object of {@code fieldId: value} pairs.
     *
     * @throws IllegalArgumentException if {@code node} is not a JSON object
     */
    public static AnswerSet fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Answers must be a JSON object, got: " + node.getNodeType());
        }
        Map<String, JsonNode> converted = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : node.properties()) {
            putIfAnswered(converted, entry.getKey(), entry.getValue());
        }
        return new AnswerSet(Collections.unmodifiableMap(converted));
    }

    /** Returns {@code true} if the value carries no answer (null, blank text, empty array). */
    public static boolean isUnanswered(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isTextual()) {
            return value.asText().isBlank();
        }
        return value.isArray() && value.isEmpty();
    }

    public boolean isAnswered(String fieldId) {
        return answers.containsKey(fieldId);
    }

    /** The raw answer for a field, or empty if unanswered. */
    public Optional<JsonNode> get(String fieldId) {
        return Optional.ofNullable(answers.get(fieldId));
    }

    /** Returns a copy with the given answer replaced; a {@code null} value clears it. */
    public AnswerSet with(String fieldId, Object value) {
        Map<String, JsonNode> copy = new LinkedHashMap<>(answers);
        copy.remove(fieldId);
        putIfAnswered(copy, fieldId, MAPPER.valueToTree(value));
        return new AnswerSet(Collections.unmodifiableMap(copy));
    }

    /** Returns a copy without the given answer. */
    public AnswerSet without(String fieldId) {
        if (!answers.containsKey(fieldId)) {
            return this;
        }
        Map<String, JsonNode> copy = new LinkedHashMap<>(answers);
        copy.remove(fieldId);
        return new AnswerSet(Collections.unmodifiableMap(copy));
    }

    public Set<String> answeredFieldIds() {
        return answers.keySet();
    }

    public Map<String, JsonNode> asMap() {
        return answers;
    }

    public int size() {
        return answers.size();
    }

    public boolean isEmpty() {
        return answers.isEmpty();
    }

    private static void putIfAnswered(Map<String, JsonNode> target, String fieldId, JsonNode value) {
        Objects.requireNonNull(fieldId, "field id must not be null");
        if (!isUnanswered(value)) {
            target.put(fieldId, value.deepCopy());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnswerSet that)) return false;
        return answers.equals(that.answers);
    }

    @Override
    public int hashCode() {
        return answers.hashCode();
    }

    @Override
    public String toString() {
        return "AnswerSet" + answers;
    }
}
