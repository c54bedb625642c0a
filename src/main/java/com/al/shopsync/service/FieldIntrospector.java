package com.al.shopsync.service;

import com.al.shopsync.model.FieldDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates the field paths present in sample records, for building mappings.
 * Objects are walked up to three levels deep; arrays of objects are walked
 * through their first element object and reported with a {@code []} suffix.
 */
@Component
public class FieldIntrospector {

    static final int MAX_DEPTH = 3;
    static final int SAMPLE_VALUE_LENGTH = 100;

    public List<FieldDescriptor> extractFields(JsonNode sample) {
        return mergeFields(List.of(sample));
    }

    /**
     * Union of the fields of all samples, de-duplicated by path. The first
     * non-null occurrence of a path determines its type and sample value.
     */
    public List<FieldDescriptor> mergeFields(List<JsonNode> samples) {
        Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        for (JsonNode sample : samples) {
            if (sample != null) {
                walk(sample, "", 1, fields);
            }
        }
        return new ArrayList<>(fields.values());
    }

    private void walk(JsonNode node, String prefix, int depth, Map<String, FieldDescriptor> fields) {
        if (!node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            JsonNode value = entry.getValue();

            FieldDescriptor existing = fields.get(path);
            if (existing == null || ("null".equals(existing.getType()) && !value.isNull())) {
                fields.put(path, describe(path, value));
            }

            if (depth >= MAX_DEPTH) {
                continue;
            }
            if (value.isObject()) {
                walk(value, path, depth + 1, fields);
            } else if (value.isArray()) {
                for (JsonNode element : value) {
                    if (element.isObject()) {
                        walk(element, path + "[]", depth + 1, fields);
                        break;
                    }
                }
            }
        }
    }

    private FieldDescriptor describe(String path, JsonNode value) {
        return FieldDescriptor.builder()
                .path(path)
                .type(typeOf(value))
                .sampleValue(sampleOf(value))
                .build();
    }

    static String typeOf(JsonNode value) {
        if (value.isNull()) {
            return "null";
        }
        if (value.isTextual()) {
            return "string";
        }
        if (value.isIntegralNumber()) {
            return "integer";
        }
        if (value.isNumber()) {
            return "number";
        }
        if (value.isBoolean()) {
            return "boolean";
        }
        return value.isArray() ? "array" : "object";
    }

    private static String sampleOf(JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        String text = value.isValueNode() ? value.asText() : value.toString();
        return text.length() > SAMPLE_VALUE_LENGTH ? text.substring(0, SAMPLE_VALUE_LENGTH) : text;
    }
}
