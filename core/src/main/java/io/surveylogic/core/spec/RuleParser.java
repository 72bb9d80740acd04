package io.surveylogic.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import io.surveylogic.core.engine.AnswerValues;
import io.surveylogic.core.engine.EngineOptions;
import io.surveylogic.core.error.DefinitionParseException;
import io.surveylogic.core.model.FieldType;
import io.surveylogic.core.model.ValidationRule;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Parses the {@code rules} list of a field. A rule is either the bare string {@code required}
 * or an object {@code {kind, value, message}}.
 *
 * <p>
 * Rejects rules that can never be satisfied or never apply: a kind not applicable to the field
 * type, the same kind declared twice, {@code minValue > maxValue}, {@code minLength >
 * maxLength}, negative or fractional lengths and patterns that do not compile.
 */
final class RuleParser {

    private static final Set<String> KNOWN_RULE_KEYS = Set.of("kind", "value", "message");

    private static final Map<ValidationRule.Kind, Set<FieldType>> APPLICABLE_TYPES =
            new EnumMap<>(ValidationRule.Kind.class);

    static {
        APPLICABLE_TYPES.put(ValidationRule.Kind.REQUIRED, EnumSet.allOf(FieldType.class));
        APPLICABLE_TYPES.put(ValidationRule.Kind.MIN_VALUE, EnumSet.of(FieldType.NUMBER));
        APPLICABLE_TYPES.put(ValidationRule.Kind.MAX_VALUE, EnumSet.of(FieldType.NUMBER));
        APPLICABLE_TYPES.put(ValidationRule.Kind.MIN_LENGTH, EnumSet.of(FieldType.TEXT, FieldType.MULTICHOICE));
        APPLICABLE_TYPES.put(ValidationRule.Kind.MAX_LENGTH, EnumSet.of(FieldType.TEXT, FieldType.MULTICHOICE));
        APPLICABLE_TYPES.put(ValidationRule.Kind.PATTERN, EnumSet.of(FieldType.TEXT));
    }

    private final EngineOptions options;

    RuleParser(EngineOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Parses the {@code rules} list of one field. {@code pattern} rules on a case-insensitive
     * field are compiled case-insensitively, like {@code matchesPattern} conditions on it.
     */
    List<ValidationRule> parse(
            JsonNode rulesNode,
            String fieldId,
            FieldType type,
            boolean caseInsensitive,
            String surveyId,
            String source,
            String path) {
        if (rulesNode == null || rulesNode.isNull()) {
            return List.of();
        }
        if (!rulesNode.isArray()) {
            throw new DefinitionParseException("'rules' must be a list", surveyId, source, path);
        }
        int patternFlags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
        Map<ValidationRule.Kind, ValidationRule> byKind = new EnumMap<>(ValidationRule.Kind.class);
        List<ValidationRule> rules = new ArrayList<>(rulesNode.size());
        for (int i = 0; i < rulesNode.size(); i++) {
            String rulePath = path + "[" + i + "]";
            ValidationRule rule = parseRule(rulesNode.get(i), patternFlags, surveyId, source, rulePath);
            if (!APPLICABLE_TYPES.get(rule.kind()).contains(type)) {
                throw new DefinitionParseException(
                        "Rule '" + rule.kind().wireName() + "' cannot be applied to " + type.wireName()
                                + " field '" + fieldId + "'",
                        surveyId,
                        source,
                        rulePath);
            }
            if (byKind.put(rule.kind(), rule) != null) {
                throw new DefinitionParseException(
                        "Rule '" + rule.kind().wireName() + "' is declared more than once on field '" + fieldId
                                + "'",
                        surveyId,
                        source,
                        rulePath);
            }
            rules.add(rule);
        }
        rejectContradiction(
                byKind, ValidationRule.Kind.MIN_VALUE, ValidationRule.Kind.MAX_VALUE, fieldId, surveyId, source, path);
        rejectContradiction(
                byKind,
                ValidationRule.Kind.MIN_LENGTH,
                ValidationRule.Kind.MAX_LENGTH,
                fieldId,
                surveyId,
                source,
                path);
        return rules;
    }

    private ValidationRule parseRule(JsonNode node, int patternFlags, String surveyId, String source, String path) {
        if (node.isTextual()) {
            ValidationRule.Kind kind = parseKind(node.asText(), surveyId, source, path);
            if (kind != ValidationRule.Kind.REQUIRED) {
                throw new DefinitionParseException(
                        "Rule '" + kind.wireName() + "' requires a value; use {kind, value}", surveyId, source, path);
            }
            return ValidationRule.required();
        }
        if (!node.isObject()) {
            throw new DefinitionParseException(
                    "Rule must be a string or an object, got: " + node.getNodeType(), surveyId, source, path);
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !KNOWN_RULE_KEYS.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new DefinitionParseException(
                    "Unknown keys in rule: " + unknown + "; recognized keys are: " + KNOWN_RULE_KEYS,
                    surveyId,
                    source,
                    path);
        }
        JsonNode kindNode = node.get("kind");
        if (kindNode == null || !kindNode.isTextual()) {
            throw new DefinitionParseException("Missing or invalid required field: 'kind'", surveyId, source, path);
        }
        ValidationRule.Kind kind = parseKind(kindNode.asText(), surveyId, source, path);
        JsonNode value = node.get("value");
        JsonNode messageNode = node.get("message");
        String message = messageNode == null || messageNode.isNull() ? null : messageNode.asText();

        ValidationRule rule =
                switch (kind) {
                    case REQUIRED -> {
                        if (value != null && !value.isNull()) {
                            throw new DefinitionParseException(
                                    "Rule 'required' takes no value", surveyId, source, path + ".value");
                        }
                        yield ValidationRule.required();
                    }
                    case MIN_VALUE, MAX_VALUE -> new ValidationRule(
                            kind, requireNumber(kind, value, surveyId, source, path), null, null);
                    case MIN_LENGTH, MAX_LENGTH -> new ValidationRule(
                            kind, requireLength(kind, value, surveyId, source, path), null, null);
                    case PATTERN -> new ValidationRule(
                            kind, null, requirePattern(value, patternFlags, surveyId, source, path), null);
                };
        return message == null ? rule : rule.withMessage(message);
    }

    private static ValidationRule.Kind parseKind(String name, String surveyId, String source, String path) {
        return ValidationRule.Kind.fromWireName(name)
                .orElseThrow(() -> new DefinitionParseException(
                        "Unknown rule kind '" + name + "'; valid kinds: "
                                + Arrays.stream(ValidationRule.Kind.values())
                                        .map(ValidationRule.Kind::wireName)
                                        .collect(Collectors.toList()),
                        surveyId,
                        source,
                        path));
    }

    private static BigDecimal requireNumber(
            ValidationRule.Kind kind, JsonNode value, String surveyId, String source, String path) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new DefinitionParseException(
                    "Rule '" + kind.wireName() + "' requires a numeric value", surveyId, source, path + ".value");
        }
        return AnswerValues.asNumber(value)
                .orElseThrow(() -> new DefinitionParseException(
                        "Rule '" + kind.wireName() + "' requires a numeric value, got: " + value,
                        surveyId,
                        source,
                        path + ".value"));
    }

    private static BigDecimal requireLength(
            ValidationRule.Kind kind, JsonNode value, String surveyId, String source, String path) {
        BigDecimal length = requireNumber(kind, value, surveyId, source, path);
        if (length.signum() < 0 || length.stripTrailingZeros().scale() > 0) {
            throw new DefinitionParseException(
                    "Rule '" + kind.wireName() + "' requires a non-negative integer, got: " + value,
                    surveyId,
                    source,
                    path + ".value");
        }
        return length;
    }

    private Pattern requirePattern(JsonNode value, int flags, String surveyId, String source, String path) {
        if (value == null || !value.isTextual()) {
            throw new DefinitionParseException(
                    "Rule 'pattern' requires a regular expression string", surveyId, source, path + ".value");
        }
        String regex = value.asText();
        if (regex.length() > options.maxPatternLength()) {
            throw new DefinitionParseException(
                    "Pattern exceeds the maximum length of " + options.maxPatternLength() + " characters",
                    surveyId,
                    source,
                    path + ".value");
        }
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            throw new DefinitionParseException(
                    "Invalid pattern '" + regex + "': " + e.getDescription(), e, surveyId, source, path + ".value");
        }
    }

    private static void rejectContradiction(
            Map<ValidationRule.Kind, ValidationRule> byKind,
            ValidationRule.Kind minKind,
            ValidationRule.Kind maxKind,
            String fieldId,
            String surveyId,
            String source,
            String path) {
        ValidationRule min = byKind.get(minKind);
        ValidationRule max = byKind.get(maxKind);
        if (min != null && max != null && min.limit().compareTo(max.limit()) > 0) {
            throw new DefinitionParseException(
                    "Contradictory rules on field '" + fieldId + "': " + minKind.wireName() + " "
                            + min.limit().toPlainString() + " exceeds " + maxKind.wireName() + " "
                            + max.limit().toPlainString(),
                    surveyId,
                    source,
                    path);
        }
    }
}
