package com.al.shopsync.service;

import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.service.path.FieldPath;
import com.al.shopsync.service.path.PathResolver;
import com.al.shopsync.service.transform.TransformationInterpreter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Projects a source record into a fresh target-shaped record.
 *
 * <p>
 * Mappings are applied in list order, so when two mappings write the same
 * target path the later one wins. Absent source values leave the target path
 * unset. The source record is never modified.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MappingApplier {

    private final PathResolver pathResolver;
    private final TransformationInterpreter transformationInterpreter;

    public ObjectNode project(JsonNode source, List<FieldMapping> mappings) {
        return project(source, mappings, Map.of());
    }

    /**
     * @param metafieldTypes declared product metafield types keyed by
     *                       {@code <namespace>.<key>}, used for mappings that
     *                       target a metafield
     */
    public ObjectNode project(JsonNode source, List<FieldMapping> mappings, Map<String, String> metafieldTypes) {
        ObjectNode target = JsonNodeFactory.instance.objectNode();
        for (FieldMapping mapping : mappings) {
            FieldPath sourcePath = FieldPath.parse(mapping.getSourceField());
            FieldPath targetPath = FieldPath.parse(mapping.getTargetField());

            JsonNode raw = pathResolver.get(source, sourcePath);
            if (PathResolver.isAbsent(raw)) {
                log.debug("Source field '{}' absent, '{}' left unset", sourcePath, targetPath);
                continue;
            }

            JsonNode transformed = transform(mapping, sourcePath, targetPath, raw, metafieldTypes);
            if (PathResolver.isAbsent(transformed)) {
                continue;
            }
            pathResolver.set(target, targetPath, transformed.deepCopy());
        }
        return target;
    }

    private JsonNode transform(FieldMapping mapping, FieldPath sourcePath, FieldPath targetPath, JsonNode raw,
            Map<String, String> metafieldTypes) {
        boolean each = sourcePath.hasEach() && raw.isArray();
        String metafieldKey = targetPath.metafieldKey();
        if (metafieldKey == null) {
            return each
                    ? transformationInterpreter.applyEach(mapping.getTransformation(), (ArrayNode) raw,
                            mapping.getTargetField())
                    : transformationInterpreter.apply(mapping.getTransformation(), raw, mapping.getTargetField());
        }
        String declaredType = metafieldTypes.get(metafieldKey);
        return each
                ? transformationInterpreter.applyEachToMetafield(mapping.getTransformation(), (ArrayNode) raw,
                        mapping.getTargetField(), declaredType)
                : transformationInterpreter.applyToMetafield(mapping.getTransformation(), raw,
                        mapping.getTargetField(), declaredType);
    }
}
