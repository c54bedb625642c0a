package com.al.shopsync.service;

import com.al.shopsync.dto.MappingValidationResult;
import com.al.shopsync.exception.InvalidRecordException;
import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.RequiredField;
import com.al.shopsync.model.TransformationRule;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncMode;
import com.al.shopsync.model.enums.TransformationType;
import com.al.shopsync.service.path.FieldPath;
import com.al.shopsync.service.path.PathResolver;
import com.al.shopsync.service.path.PathSegment;
import com.al.shopsync.service.transform.CustomExpressionEvaluator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Static checks of a mapping set and per-record checks of mapped records.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MappingValidationService {

    private final PathResolver pathResolver;
    private final CustomExpressionEvaluator customExpressionEvaluator;

    /**
     * Checks a mapping set against the required target fields of the entity type
     * for the given mode.
     */
    public MappingValidationResult validate(EntityType entityType, List<FieldMapping> mappings, SyncMode mode) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (mappings == null || mappings.isEmpty()) {
            errors.add("No field mappings defined for " + entityType.getValue());
            return MappingValidationResult.of(errors, warnings);
        }
        if (!entityType.supports(mode)) {
            errors.add("Sync mode '" + mode.getValue() + "' is not supported for " + entityType.getValue());
        }

        errors.addAll(findDuplicates(mappings));

        Set<String> coveredTargets = new HashSet<>();
        for (FieldMapping mapping : mappings) {
            checkPath(mapping.getSourceField(), "source", errors);
            FieldPath target = checkPath(mapping.getTargetField(), "target", errors);
            if (target != null) {
                coveredTargets.add(target.normalized());
                if (target.isMetafieldPath() && target.metafieldKey() == null) {
                    errors.add("Invalid target path '" + target + "': metafields must be mapped as "
                            + "metafields[].<namespace>.<key>");
                }
            }
            checkRule(mapping, errors);
        }

        for (RequiredField field : entityType.getRequiredFields()) {
            if (coveredTargets.contains(field.getPath())) {
                continue;
            }
            if (field.isRequiredFor(mode)) {
                errors.add("Required target field '" + field.getPath() + "' is not mapped (mode "
                        + mode.getValue() + ")");
            } else if (field.isRecommendedFor(mode)) {
                warnings.add("Target field '" + field.getPath() + "' is not mapped; records cannot be matched later");
            }
        }

        log.debug("Validated {} mapping(s) for {} ({}): {} error(s), {} warning(s)",
                mappings.size(), entityType.getValue(), mode.getValue(), errors.size(), warnings.size());
        return MappingValidationResult.of(errors, warnings);
    }

    /**
     * Duplicate {@code (source_field, target_field)} pairs in a mapping set.
     */
    public List<String> findDuplicates(List<FieldMapping> mappings) {
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (FieldMapping mapping : mappings) {
            String key = mapping.pairKey();
            if (!seen.add(key) && !duplicates.contains("Duplicate mapping: " + key)) {
                duplicates.add("Duplicate mapping: " + key);
            }
        }
        return duplicates;
    }

    /**
     * Verifies that a projected record carries a non-empty value for every field
     * required in {@code mode}.
     *
     * @throws InvalidRecordException listing the missing fields
     */
    public void validateRecord(EntityType entityType, JsonNode mapped, SyncMode mode) {
        List<String> missing = new ArrayList<>();
        for (RequiredField field : entityType.getRequiredFields()) {
            if (field.isRequiredFor(mode) && !isPresent(mapped, FieldPath.parse(field.getPath()))) {
                missing.add(field.getPath());
            }
        }
        if (!missing.isEmpty()) {
            throw new InvalidRecordException(missing);
        }
    }

    private boolean isPresent(JsonNode mapped, FieldPath path) {
        if (!path.hasEach()) {
            return hasValue(pathResolver.get(mapped, path));
        }
        return presentInEvery(mapped, path, 0);
    }

    /** Every element reached through {@code []} must carry a value, and no list may be empty. */
    private boolean presentInEvery(JsonNode node, FieldPath path, int i) {
        if (PathResolver.isAbsent(node)) {
            return false;
        }
        if (i == path.size()) {
            return hasValue(node);
        }
        PathSegment segment = path.segment(i);
        switch (segment.getKind()) {
            case KEY:
                return presentInEvery(node.get(segment.getKey()), path, i + 1);
            case INDEX:
                return node.isArray() && presentInEvery(node.get(segment.getIndex()), path, i + 1);
            default:
                if (!node.isArray() || node.isEmpty()) {
                    return false;
                }
                for (JsonNode element : node) {
                    if (!presentInEvery(element, path, i + 1)) {
                        return false;
                    }
                }
                return true;
        }
    }

    private static boolean hasValue(JsonNode node) {
        if (PathResolver.isAbsent(node)) {
            return false;
        }
        if (node.isArray()) {
            return !node.isEmpty();
        }
        return !node.isTextual() || !node.textValue().isBlank();
    }

    private FieldPath checkPath(String path, String side, List<String> errors) {
        try {
            return FieldPath.parse(path);
        } catch (IllegalArgumentException e) {
            errors.add("Invalid " + side + " path: " + e.getMessage());
            return null;
        }
    }

    private void checkRule(FieldMapping mapping, List<String> errors) {
        TransformationRule rule = mapping.getTransformation();
        if (rule == null) {
            return;
        }
        TransformationType type = rule.effectiveType();
        if (type == TransformationType.REGEX && rule.getFind() != null && !rule.getFind().isEmpty()) {
            try {
                Pattern.compile(rule.getFind());
            } catch (PatternSyntaxException e) {
                errors.add("Invalid regex for '" + mapping.getTargetField() + "': " + e.getDescription());
            }
        }
        if (type == TransformationType.CUSTOM && rule.getCustomCode() != null && !rule.getCustomCode().isBlank()) {
            if (!customExpressionEvaluator.isEnabled()) {
                errors.add("Custom expressions are disabled but used for '" + mapping.getTargetField() + "'");
                return;
            }
            String syntaxError = customExpressionEvaluator.checkSyntax(rule.getCustomCode());
            if (syntaxError != null) {
                errors.add("Invalid custom expression for '" + mapping.getTargetField() + "': " + syntaxError);
            }
        }
    }
}
