package com.al.shopsync.service.transform;

import com.al.shopsync.exception.TransformationException;
import com.al.shopsync.model.MetafieldDefinition;
import com.al.shopsync.model.TransformationRule;
import com.al.shopsync.model.enums.TransformationType;
import com.al.shopsync.service.path.PathResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies a {@link TransformationRule} to a single value.
 *
 * <p>
 * Rules other than {@code direct} work on the text of the value: strings as
 * they are, numbers and booleans as their JSON text, objects and arrays as
 * their JSON serialization.
 *
 * <p>
 * Values bound for a product metafield whose declared type is a
 * {@code list.*} type come out as the JSON text of a string array, which is
 * how Shopify expects list metafield values.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TransformationInterpreter {

    private static final Pattern PYTHON_GROUP_REF = Pattern.compile("\\\\(\\d{1,2})");
    private static final Pattern LABEL_PREFIX = Pattern.compile("^[^:\\s][^:]*:");
    private static final List<String> LIST_DELIMITERS = List.of("|", ";", ",");

    private final CustomExpressionEvaluator customExpressionEvaluator;

    /**
     * @param rule      rule to apply, null means {@code direct}
     * @param value     the value read from the source record
     * @param fieldName target field, for error messages
     * @return the transformed value, absent when {@code value} is absent
     */
    public JsonNode apply(TransformationRule rule, JsonNode value, String fieldName) {
        if (PathResolver.isAbsent(value)) {
            return MissingNode.getInstance();
        }
        TransformationRule effective = rule == null ? TransformationRule.direct() : rule;
        switch (effective.effectiveType()) {
            case REPLACE:
                return replace(effective, value);
            case REGEX:
                return regex(effective, value, fieldName);
            case SPLIT_JOIN:
                return splitJoin(effective, value);
            case CUSTOM:
                return custom(effective, value, fieldName);
            default:
                return value;
        }
    }

    /**
     * Like {@link #apply(TransformationRule, JsonNode, String)} for a value
     * written to a product metafield.
     *
     * @param metafieldType declared type of the metafield, null when the shop
     *                      declares none
     */
    public JsonNode applyToMetafield(TransformationRule rule, JsonNode value, String fieldName,
            String metafieldType) {
        if (PathResolver.isAbsent(value)) {
            return MissingNode.getInstance();
        }
        TransformationRule effective = rule == null ? TransformationRule.direct() : rule;
        boolean listType = MetafieldDefinition.isListType(metafieldType);
        switch (effective.effectiveType()) {
            case DIRECT:
                return listType ? directList(value) : value;
            case SPLIT_JOIN:
                // without a declared type, an empty join delimiter asks for a list
                boolean asList = listType
                        || (metafieldType == null && nullToEmpty(effective.getJoinDelimiter()).isEmpty());
                if (asList && effective.getSplitDelimiter() != null && !effective.getSplitDelimiter().isEmpty()) {
                    return jsonList(splitParts(effective, value));
                }
                return splitJoin(effective, value);
            default:
                return apply(effective, value, fieldName);
        }
    }

    /**
     * Transforms every element of a list produced by a {@code []} read. Length
     * and order are preserved.
     */
    public ArrayNode applyEach(TransformationRule rule, ArrayNode values, String fieldName) {
        return applyEach(rule, values, fieldName, false, null);
    }

    /**
     * {@link #applyEach(TransformationRule, ArrayNode, String)} for values
     * written to a product metafield.
     */
    public ArrayNode applyEachToMetafield(TransformationRule rule, ArrayNode values, String fieldName,
            String metafieldType) {
        return applyEach(rule, values, fieldName, true, metafieldType);
    }

    private ArrayNode applyEach(TransformationRule rule, ArrayNode values, String fieldName, boolean metafield,
            String metafieldType) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode(values.size());
        for (JsonNode element : values) {
            JsonNode transformed = metafield
                    ? applyToMetafield(rule, element, fieldName, metafieldType)
                    : apply(rule, element, fieldName);
            out.add(PathResolver.isAbsent(transformed) ? NullNode.getInstance() : transformed);
        }
        return out;
    }

    private JsonNode replace(TransformationRule rule, JsonNode value) {
        String find = rule.getFind();
        if (find == null || find.isEmpty()) {
            return value;
        }
        String text = textOf(value);
        if (!text.contains(find)) {
            return value;
        }
        return TextNode.valueOf(text.replace(find, nullToEmpty(rule.getReplace())));
    }

    private JsonNode regex(TransformationRule rule, JsonNode value, String fieldName) {
        String find = rule.getFind();
        if (find == null || find.isEmpty()) {
            return value;
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(find);
        } catch (PatternSyntaxException e) {
            throw new TransformationException(TransformationType.REGEX, fieldName,
                    "invalid pattern '" + find + "': " + e.getDescription(), e);
        }
        String text = textOf(value);
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return value;
        }
        try {
            return TextNode.valueOf(matcher.replaceAll(toJavaReplacement(nullToEmpty(rule.getReplace()))));
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new TransformationException(TransformationType.REGEX, fieldName,
                    "invalid replacement '" + rule.getReplace() + "': " + e.getMessage(), e);
        }
    }

    private JsonNode splitJoin(TransformationRule rule, JsonNode value) {
        String split = rule.getSplitDelimiter();
        if (split == null || split.isEmpty()) {
            return value;
        }
        return TextNode.valueOf(String.join(nullToEmpty(rule.getJoinDelimiter()), splitParts(rule, value)));
    }

    private static List<String> splitParts(TransformationRule rule, JsonNode value) {
        List<String> parts = new ArrayList<>();
        for (String part : textOf(value).split(Pattern.quote(rule.getSplitDelimiter()), -1)) {
            String cleaned = LABEL_PREFIX.matcher(part.trim()).replaceFirst("").trim();
            if (!cleaned.isEmpty()) {
                parts.add(cleaned);
            }
        }
        return parts;
    }

    /** Text holding one of the list delimiters becomes a list; anything else is kept. */
    private static JsonNode directList(JsonNode value) {
        if (value.isArray()) {
            List<String> items = new ArrayList<>();
            for (JsonNode element : value) {
                if (!PathResolver.isAbsent(element)) {
                    items.add(textOf(element));
                }
            }
            return jsonList(items);
        }
        if (!value.isTextual()) {
            return value;
        }
        String text = value.textValue();
        for (String delimiter : LIST_DELIMITERS) {
            if (!text.contains(delimiter)) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (String part : text.split(Pattern.quote(delimiter), -1)) {
                if (!part.isBlank()) {
                    parts.add(part.trim());
                }
            }
            if (parts.size() > 1) {
                return jsonList(parts);
            }
        }
        return value;
    }

    /** The JSON text of a string array, kept as one text value so it is written as a single field. */
    private static JsonNode jsonList(List<String> items) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode(items.size());
        items.forEach(array::add);
        return TextNode.valueOf(array.toString());
    }

    private JsonNode custom(TransformationRule rule, JsonNode value, String fieldName) {
        String code = rule.getCustomCode();
        if (code == null || code.isBlank()) {
            return value;
        }
        Object result;
        try {
            result = customExpressionEvaluator.evaluate(code, toJava(value));
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new TransformationException(TransformationType.CUSTOM, fieldName, e.getMessage(), e);
        }
        log.debug("Custom expression for '{}' produced {}", fieldName, result);
        return toNode(result);
    }

    static String textOf(JsonNode value) {
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    private static Object toJava(JsonNode value) {
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.toString();
    }

    private static JsonNode toNode(Object result) {
        if (result == null) {
            return MissingNode.getInstance();
        }
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (result instanceof JsonNode) {
            return (JsonNode) result;
        }
        if (result instanceof Boolean) {
            return BooleanNode.valueOf((Boolean) result);
        }
        if (result instanceof Integer || result instanceof Short || result instanceof Byte) {
            return factory.numberNode(((Number) result).intValue());
        }
        if (result instanceof Long) {
            return factory.numberNode((Long) result);
        }
        if (result instanceof BigInteger) {
            return factory.numberNode((BigInteger) result);
        }
        if (result instanceof BigDecimal) {
            return factory.numberNode((BigDecimal) result);
        }
        if (result instanceof Number) {
            return factory.numberNode(((Number) result).doubleValue());
        }
        return TextNode.valueOf(result.toString());
    }

    private static String toJavaReplacement(String replacement) {
        return PYTHON_GROUP_REF.matcher(replacement)
                .replaceAll(match -> Matcher.quoteReplacement("$" + match.group(1)));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
