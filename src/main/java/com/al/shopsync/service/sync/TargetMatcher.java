package com.al.shopsync.service.sync;

import com.al.shopsync.client.TargetSystemClient;
import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncMode;
import com.al.shopsync.service.path.PathResolver;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a mapped record creates, updates or skips a target record.
 *
 * <p>
 * The natural key is read from the source record (by default
 * {@link EntityType#getNaturalKeyPath()}, overridable per entity type), then
 * from the mapped record. When the target lookup finds nothing, a link
 * recorded earlier in the same invocation is used instead.
 */
@Component
@Slf4j
public class TargetMatcher {

    private final TargetSystemClient targetClient;
    private final PathResolver pathResolver;
    private final Map<String, String> naturalKeyOverrides;

    public TargetMatcher(TargetSystemClient targetClient, PathResolver pathResolver,
            ShopSyncProperties properties) {
        this.targetClient = targetClient;
        this.pathResolver = pathResolver;
        this.naturalKeyOverrides = properties.getMapping().getNaturalKeys();
    }

    public MatchDecision resolveTarget(EntityType entityType, String sourceId, JsonNode source, JsonNode mapped,
            SyncMode mode, SyncContext context) {
        if (mode == SyncMode.CREATE && !entityType.isTargetReadOnly()) {
            return MatchDecision.create();
        }

        String key = naturalKeyOf(entityType, source, mapped);
        Optional<Long> found = Optional.empty();
        if (key != null) {
            found = targetClient.findByNaturalKey(entityType, key).flatMap(this::idOf);
        }
        if (found.isEmpty()) {
            found = context.linkedTarget(sourceId);
        }

        if (entityType.isTargetReadOnly()) {
            return found.map(MatchDecision::matched)
                    .orElseGet(() -> MatchDecision.skip(notFound(entityType, key)));
        }
        if (mode == SyncMode.UPDATE) {
            return found.map(MatchDecision::update)
                    .orElseGet(() -> MatchDecision.skip(notFound(entityType, key)));
        }
        return found.map(MatchDecision::update).orElseGet(MatchDecision::create);
    }

    /**
     * @return the natural key of the record, or null when it has none
     */
    String naturalKeyOf(EntityType entityType, JsonNode source, JsonNode mapped) {
        String sourcePath = naturalKeyOverrides.getOrDefault(entityType.getValue(), entityType.getNaturalKeyPath());
        String key = firstText(pathResolver.get(source, sourcePath));
        if (key == null && mapped != null) {
            key = firstText(pathResolver.get(mapped, entityType.getTargetKeyPath()));
        }
        return key;
    }

    private Optional<Long> idOf(JsonNode match) {
        JsonNode id = match.path("id");
        if (!id.canConvertToLong() && !(id.isTextual() && id.asText().matches("\\d+"))) {
            log.warn("Target lookup returned a record without a usable id: {}", match);
            return Optional.empty();
        }
        return Optional.of(id.asLong());
    }

    private static String firstText(JsonNode node) {
        if (PathResolver.isAbsent(node)) {
            return null;
        }
        JsonNode value = node.isArray() ? firstPresent(node) : node;
        if (PathResolver.isAbsent(value) || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static JsonNode firstPresent(JsonNode array) {
        for (JsonNode element : array) {
            if (!PathResolver.isAbsent(element)) {
                return element;
            }
        }
        return null;
    }

    private static String notFound(EntityType entityType, String key) {
        return key == null
                ? entityType.getTargetLabel() + " record has no natural key and no known target"
                : entityType.getTargetLabel() + " with key '" + key + "' not found in target";
    }
}
