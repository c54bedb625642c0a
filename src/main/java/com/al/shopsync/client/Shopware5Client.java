package com.al.shopsync.client;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.dto.ConnectionStatus;
import com.al.shopsync.dto.EntityPage;
import com.al.shopsync.exception.NotFoundException;
import com.al.shopsync.exception.TransportException;
import com.al.shopsync.model.FieldDescriptor;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.service.FieldIntrospector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Shopware 5 REST API client.
 *
 * <p>
 * Every response is wrapped in a {@code {"data": ..., "total": n}} envelope.
 * Listings page with {@code limit}/{@code start}. Articles can be fetched by
 * order number instead of id with {@code useNumberAsId=true}.
 */
@Component
@Slf4j
public class Shopware5Client implements SourceSystemClient {

    static final String SYSTEM = "Shopware 5";

    private final RestTemplate restTemplate;
    private final FieldIntrospector fieldIntrospector;
    private final int fieldSampleSize;

    public Shopware5Client(@Qualifier("shopwareRestTemplate") RestTemplate restTemplate,
            FieldIntrospector fieldIntrospector, ShopSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.fieldIntrospector = fieldIntrospector;
        this.fieldSampleSize = properties.getSource().getFieldSampleSize();
    }

    @Override
    public ConnectionStatus testConnection() {
        try {
            JsonNode body = restTemplate.getForObject("/version", JsonNode.class);
            JsonNode data = body == null ? MissingNode.getInstance() : body.path("data");
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("version", data.path("version").asText(null));
            info.put("revision", data.path("revision").asText(null));
            return ConnectionStatus.ok(SYSTEM, info);
        } catch (RestClientException e) {
            log.warn("Shopware 5 connection test failed: {}", e.getMessage());
            return ConnectionStatus.failed(SYSTEM, e.getMessage());
        }
    }

    @Override
    public EntityPage listIds(EntityType entityType, int limit, int offset) {
        // limit 0 asks for the total only; the API needs at least one row
        int requested = Math.max(limit, 1);
        JsonNode body = execute("listing " + entityType.getSourceResource(),
                () -> restTemplate.getForObject("/{resource}?limit={limit}&start={start}", JsonNode.class,
                        entityType.getSourceResource(), requested, offset));
        List<JsonNode> data = new ArrayList<>();
        if (body != null && limit > 0) {
            body.path("data").forEach(data::add);
        }
        long total = body == null ? 0 : body.path("total").asLong(data.size());
        log.debug("Listed {} {} at offset {} (total {})", data.size(), entityType.getSourceResource(), offset, total);
        return new EntityPage(data, total);
    }

    @Override
    public JsonNode getById(EntityType entityType, String id) {
        if (id == null || id.isBlank()) {
            throw new NotFoundException(entityType.getSourceLabel() + " id is empty");
        }
        String trimmed = id.trim();
        boolean byNumber = entityType == EntityType.ARTICLES && !isNumeric(trimmed);
        String url = byNumber ? "/{resource}/{id}?useNumberAsId=true" : "/{resource}/{id}";
        JsonNode body = execute("fetching " + entityType.getSourceResource() + "/" + trimmed,
                () -> restTemplate.getForObject(url, JsonNode.class, entityType.getSourceResource(), trimmed));
        JsonNode data = body == null ? MissingNode.getInstance() : body.path("data");
        if (data.isMissingNode() || data.isNull() || (data.isContainerNode() && data.isEmpty())) {
            throw new NotFoundException(entityType.getSourceLabel() + " " + trimmed + " not found in " + SYSTEM);
        }
        return data;
    }

    @Override
    public List<FieldDescriptor> getFields(EntityType entityType, String identifier) {
        if (identifier != null && !identifier.isBlank()) {
            return fieldIntrospector.extractFields(findSample(entityType, identifier.trim()));
        }
        // listings carry fewer fields than the detail endpoint
        List<JsonNode> samples = new ArrayList<>();
        for (JsonNode row : listIds(entityType, fieldSampleSize, 0).getData()) {
            String id = row.path("id").asText(null);
            if (id != null) {
                samples.add(getById(entityType, id));
            }
        }
        return fieldIntrospector.mergeFields(samples);
    }

    private JsonNode findSample(EntityType entityType, String identifier) {
        if (entityType == EntityType.ARTICLES || isNumeric(identifier)) {
            return getById(entityType, identifier);
        }
        // customers by e-mail, orders by order number
        String property = entityType.getNaturalKeyPath();
        JsonNode body = execute("searching " + entityType.getSourceResource() + " by " + property,
                () -> restTemplate.getForObject(
                        "/{resource}?limit=1&filter[0][property]={property}&filter[0][value]={value}",
                        JsonNode.class, entityType.getSourceResource(), property, identifier));
        JsonNode first = body == null ? MissingNode.getInstance() : body.path("data").path(0);
        if (first.isMissingNode()) {
            throw new NotFoundException(entityType.getSourceLabel() + " " + identifier + " not found in " + SYSTEM);
        }
        return getById(entityType, first.path("id").asText());
    }

    private <T> T execute(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (HttpClientErrorException.NotFound e) {
            throw new NotFoundException(SYSTEM + ": nothing found while " + action, e);
        } catch (HttpStatusCodeException e) {
            if (RemoteStatus.isTransportFailure(e.getStatusCode())) {
                throw new TransportException(SYSTEM, SYSTEM + " API error " + e.getStatusCode().value()
                        + " while " + action, e);
            }
            throw new NotFoundException(SYSTEM + " rejected " + action + " (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransportException(SYSTEM, SYSTEM + " unreachable while " + action + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TransportException(SYSTEM, SYSTEM + " call failed while " + action + ": " + e.getMessage(), e);
        }
    }

    private static boolean isNumeric(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
