package com.al.shopsync.service.path;

import com.al.shopsync.exception.InvalidPathException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads and writes values inside JSON records by {@link FieldPath}.
 *
 * <p>
 * Absent values are represented by {@link MissingNode}; a JSON {@code null}
 * is read as absent. Reading through {@code []} yields an {@link ArrayNode}
 * of the suffix resolved against every element. With a single {@code []} the
 * list stays positional: an element resolving to absent is kept as a JSON
 * {@code null}, and a list without any present value reads as empty. Nested
 * {@code []} flatten one level each and leave absent elements out. Writing
 * through {@code []} touches every existing element and never grows an
 * existing array.
 *
 * @author Shop Sync Team
 * @since 1.0.0
 */
@Component
public class PathResolver {

    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

    public JsonNode get(JsonNode record, String path) {
        return get(record, FieldPath.parse(path));
    }

    public JsonNode get(JsonNode record, FieldPath path) {
        return resolve(record, path, 0);
    }

    public void set(JsonNode record, String path, JsonNode value) {
        set(record, FieldPath.parse(path), value);
    }

    /**
     * Writes {@code value} at {@code path}, creating intermediate objects and
     * arrays as needed. Writing an absent value is a no-op.
     */
    public void set(JsonNode record, FieldPath path, JsonNode value) {
        if (isAbsent(value)) {
            return;
        }
        if (record == null || !record.isContainerNode()) {
            throw new InvalidPathException(path.toString(), "record is not an object or array");
        }
        write(record, path, 0, value);
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    private JsonNode resolve(JsonNode node, FieldPath path, int i) {
        if (isAbsent(node)) {
            return MissingNode.getInstance();
        }
        if (i == path.size()) {
            return node;
        }
        PathSegment segment = path.segment(i);
        switch (segment.getKind()) {
            case KEY: {
                if (!node.isObject()) {
                    return MissingNode.getInstance();
                }
                return resolve(node.get(segment.getKey()), path, i + 1);
            }
            case INDEX: {
                if (!node.isArray() || segment.getIndex() >= node.size()) {
                    return MissingNode.getInstance();
                }
                return resolve(node.get(segment.getIndex()), path, i + 1);
            }
            default: {
                if (!node.isArray()) {
                    return MissingNode.getInstance();
                }
                boolean flatten = path.hasEachFrom(i + 1);
                ArrayNode out = nodeFactory.arrayNode();
                boolean anyPresent = false;
                for (JsonNode element : node) {
                    JsonNode resolved = resolve(element, path, i + 1);
                    if (isAbsent(resolved)) {
                        if (!flatten) {
                            // keeps the index aligned with the source element
                            out.add(NullNode.getInstance());
                        }
                        continue;
                    }
                    anyPresent = true;
                    if (flatten && resolved.isArray()) {
                        out.addAll((ArrayNode) resolved);
                    } else {
                        out.add(resolved);
                    }
                }
                return anyPresent ? out : nodeFactory.arrayNode();
            }
        }
    }

    private void write(JsonNode container, FieldPath path, int i, JsonNode value) {
        PathSegment segment = path.segment(i);
        boolean last = i == path.size() - 1;
        switch (segment.getKind()) {
            case KEY:
                writeKey(container, path, i, last, value);
                break;
            case INDEX:
                writeIndex(container, path, i, last, value);
                break;
            default:
                writeEach(container, path, i, last, value);
                break;
        }
    }

    private void writeKey(JsonNode container, FieldPath path, int i, boolean last, JsonNode value) {
        if (!container.isObject()) {
            throw new InvalidPathException(path.toString(), "cannot set key '" + path.segment(i).getKey()
                    + "' on a non-object value");
        }
        ObjectNode object = (ObjectNode) container;
        String key = path.segment(i).getKey();
        if (last) {
            object.set(key, value);
            return;
        }
        PathSegment next = path.segment(i + 1);
        JsonNode child = object.get(key);
        if (next.getKind() == PathSegment.Kind.EACH && (isAbsent(child) || !child.isArray())) {
            // a missing array under [] is seeded with one element per value
            int count = value.isArray() ? value.size() : 1;
            if (count == 0) {
                return;
            }
            ArrayNode seeded = object.putArray(key);
            for (int k = 0; k < count; k++) {
                seeded.add(placeholderFor(path, i + 2));
            }
            child = seeded;
        } else if (!fits(child, next)) {
            child = next.getKind() == PathSegment.Kind.KEY ? object.putObject(key) : object.putArray(key);
        }
        write(child, path, i + 1, value);
    }

    private void writeIndex(JsonNode container, FieldPath path, int i, boolean last, JsonNode value) {
        if (!container.isArray()) {
            throw new InvalidPathException(path.toString(), "cannot index into a non-array value");
        }
        ArrayNode array = (ArrayNode) container;
        int index = path.segment(i).getIndex();
        while (array.size() <= index) {
            array.add(last ? NullNode.getInstance() : placeholderFor(path, i + 1));
        }
        if (last) {
            array.set(index, value);
            return;
        }
        JsonNode element = array.get(index);
        if (!fits(element, path.segment(i + 1))) {
            element = placeholderFor(path, i + 1);
            array.set(index, element);
        }
        write(element, path, i + 1, value);
    }

    private void writeEach(JsonNode container, FieldPath path, int i, boolean last, JsonNode value) {
        if (!container.isArray()) {
            throw new InvalidPathException(path.toString(), "cannot apply [] to a non-array value");
        }
        ArrayNode array = (ArrayNode) container;
        boolean parallel = value.isArray();
        int count = parallel ? Math.min(array.size(), value.size()) : array.size();
        for (int k = 0; k < count; k++) {
            JsonNode elementValue = parallel ? value.get(k) : value;
            if (isAbsent(elementValue)) {
                continue;
            }
            if (last) {
                array.set(k, elementValue);
                continue;
            }
            JsonNode element = array.get(k);
            if (!fits(element, path.segment(i + 1))) {
                element = placeholderFor(path, i + 1);
                array.set(k, element);
            }
            write(element, path, i + 1, elementValue);
        }
    }

    private static boolean fits(JsonNode node, PathSegment next) {
        if (isAbsent(node)) {
            return false;
        }
        return next.getKind() == PathSegment.Kind.KEY ? node.isObject() : node.isArray();
    }

    private JsonNode placeholderFor(FieldPath path, int nextIndex) {
        if (nextIndex >= path.size()) {
            return NullNode.getInstance();
        }
        List<PathSegment> segments = path.segments();
        return segments.get(nextIndex).getKind() == PathSegment.Kind.KEY
                ? nodeFactory.objectNode()
                : nodeFactory.arrayNode();
    }
}
