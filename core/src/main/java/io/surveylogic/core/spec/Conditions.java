package io.surveylogic.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surveylogic.core.model.Operator;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fluent builder for condition structures, for definitions assembled in code rather than read
 * from files. Produces the same wire shape the parser reads, so a built condition goes through
 * exactly the same validation:
 *
 * <pre>{@code
 * JsonNode when = Conditions.and(
 *         Conditions.field("employed").equalTo(true),
 *         Conditions.field("income").greaterThan(50_000));
 * }</pre>
 */
public final class Conditions {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Conditions() {}

    /** Starts a comparison on the given field. */
    public static FieldRef field(String fieldId) {
        return new FieldRef(Objects.requireNonNull(fieldId, "fieldId must not be null"));
    }

    public static ObjectNode and(JsonNode... conditions) {
        return composite("AND", Arrays.asList(conditions));
    }

    public static ObjectNode or(JsonNode... conditions) {
        return composite("OR", Arrays.asList(conditions));
    }

    public static ObjectNode not(JsonNode condition) {
        return composite("NOT", List.of(condition));
    }

    private static ObjectNode composite(String operator, List<JsonNode> conditions) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("operator", operator);
        ArrayNode children = node.putArray("conditions");
        conditions.forEach(children::add);
        return node;
    }

    /** Comparison builder bound to one field. */
    public static final class FieldRef {

        private final String fieldId;

        private FieldRef(String fieldId) {
            this.fieldId = fieldId;
        }

        public ObjectNode equalTo(Object value) {
            return leaf(Operator.EQUALS, value);
        }

        public ObjectNode notEqualTo(Object value) {
            return leaf(Operator.NOT_EQUALS, value);
        }

        public ObjectNode in(Object... values) {
            return leaf(Operator.IN, List.of(values));
        }

        public ObjectNode notIn(Object... values) {
            return leaf(Operator.NOT_IN, List.of(values));
        }

        public ObjectNode greaterThan(Object value) {
            return leaf(Operator.GREATER_THAN, value);
        }

        public ObjectNode greaterThanOrEqual(Object value) {
            return leaf(Operator.GREATER_THAN_OR_EQUAL, value);
        }

        public ObjectNode lessThan(Object value) {
            return leaf(Operator.LESS_THAN, value);
        }

        public ObjectNode lessThanOrEqual(Object value) {
            return leaf(Operator.LESS_THAN_OR_EQUAL, value);
        }

        public ObjectNode between(Object low, Object high) {
            return leaf(Operator.BETWEEN, List.of(low, high));
        }

        public ObjectNode contains(Object value) {
            return leaf(Operator.CONTAINS, value);
        }

        public ObjectNode notContains(Object value) {
            return leaf(Operator.NOT_CONTAINS, value);
        }

        public ObjectNode startsWith(String prefix) {
            return leaf(Operator.STARTS_WITH, prefix);
        }

        public ObjectNode endsWith(String suffix) {
            return leaf(Operator.ENDS_WITH, suffix);
        }

        public ObjectNode matches(String regex) {
            return leaf(Operator.MATCHES_PATTERN, regex);
        }

        public ObjectNode isEmpty() {
            return leaf(Operator.IS_EMPTY, null);
        }

        public ObjectNode isNotEmpty() {
            return leaf(Operator.IS_NOT_EMPTY, null);
        }

        private ObjectNode leaf(Operator operator, Object value) {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("field", fieldId);
            node.put("comparison", operator.wireName());
            if (value != null) {
                node.set("value", MAPPER.valueToTree(value));
            }
            return node;
        }
    }
}
