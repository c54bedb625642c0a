package com.al.shopsync.client;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.dto.ConnectionStatus;
import com.al.shopsync.exception.NotFoundException;
import com.al.shopsync.exception.TargetWriteException;
import com.al.shopsync.exception.TransportException;
import com.al.shopsync.model.FieldDescriptor;
import com.al.shopsync.model.MetafieldDefinition;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.service.FieldIntrospector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Shopify admin API client.
 *
 * <p>
 * Records are written through the REST admin API, wrapped in their singular
 * root key ({@code {"product": {...}}}). Products are matched by variant SKU
 * through the GraphQL admin API, customers by e-mail and orders by name.
 * Orders are read-only.
 *
 * <p>
 * Product metafields are written with the type declared by the shop's
 * metafield definitions, which are loaded through GraphQL and kept in the
 * {@value #METAFIELD_TYPES_CACHE} cache.
 */
@Component
@Slf4j
public class ShopifyClient implements TargetSystemClient {

    static final String SYSTEM = "Shopify";

    static final String VARIANT_BY_SKU_QUERY = "query($query: String!) { productVariants(first: 1, query: $query) "
            + "{ edges { node { id sku product { id legacyResourceId title } } } } }";

    static final String METAFIELD_DEFINITIONS_QUERY = "{ metafieldDefinitions(first: 100, ownerType: PRODUCT) "
            + "{ edges { node { name namespace key description type { name } } } } }";

    static final String METAFIELD_TYPES_CACHE = "metafieldTypes";

    static final String DEFAULT_METAFIELD_TYPE = "single_line_text_field";

    private final RestTemplate restTemplate;
    private final FieldIntrospector fieldIntrospector;
    private final CacheManager cacheManager;
    private final int fieldSampleSize;
    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

    public ShopifyClient(@Qualifier("shopifyRestTemplate") RestTemplate restTemplate,
            FieldIntrospector fieldIntrospector, CacheManager cacheManager, ShopSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.fieldIntrospector = fieldIntrospector;
        this.cacheManager = cacheManager;
        this.fieldSampleSize = properties.getTarget().getFieldSampleSize();
    }

    @Override
    public ConnectionStatus testConnection() {
        try {
            JsonNode body = restTemplate.getForObject("/shop.json", JsonNode.class);
            JsonNode shop = body == null ? MissingNode.getInstance() : body.path("shop");
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("name", shop.path("name").asText(null));
            info.put("domain", shop.path("domain").asText(null));
            info.put("email", shop.path("email").asText(null));
            return ConnectionStatus.ok(SYSTEM, info);
        } catch (RestClientException e) {
            log.warn("Shopify connection test failed: {}", e.getMessage());
            return ConnectionStatus.failed(SYSTEM, e.getMessage());
        }
    }

    @Override
    public List<FieldDescriptor> getFields(EntityType entityType, String identifier) {
        List<JsonNode> samples = new ArrayList<>();
        if (identifier != null && !identifier.isBlank()) {
            samples.add(fetchSample(entityType, identifier.trim()));
        } else {
            JsonNode body = read("listing " + entityType.getTargetResource(),
                    () -> restTemplate.getForObject("/{resource}.json?limit={limit}", JsonNode.class,
                            entityType.getTargetResource(), fieldSampleSize));
            if (body != null) {
                body.path(entityType.getTargetResource()).forEach(samples::add);
            }
        }
        List<FieldDescriptor> fields = new ArrayList<>(fieldIntrospector.mergeFields(samples));
        if (entityType == EntityType.ARTICLES) {
            try {
                for (MetafieldDefinition definition : getMetafieldDefinitions(entityType)) {
                    fields.add(FieldDescriptor.builder()
                            .path("metafields[]." + definition.qualifiedKey())
                            .type(definition.getType())
                            .required(false)
                            .description(describe(definition))
                            .build());
                }
            } catch (TransportException e) {
                log.warn("Metafield definitions left out of the field list: {}", e.getMessage());
            }
        }
        return fields;
    }

    @Override
    public List<MetafieldDefinition> getMetafieldDefinitions(EntityType entityType) {
        if (entityType != EntityType.ARTICLES) {
            return List.of();
        }
        ObjectNode request = nodeFactory.objectNode();
        request.put("query", METAFIELD_DEFINITIONS_QUERY);
        JsonNode body = read("loading metafield definitions",
                () -> restTemplate.postForObject("/graphql.json", jsonEntity(request), JsonNode.class));
        if (body == null) {
            return List.of();
        }
        JsonNode errors = body.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new TransportException(SYSTEM, "Shopify metafield definitions query failed: "
                    + errors.path(0).path("message").asText(errors.toString()));
        }
        List<MetafieldDefinition> definitions = new ArrayList<>();
        for (JsonNode edge : body.path("data").path("metafieldDefinitions").path("edges")) {
            JsonNode node = edge.path("node");
            String namespace = node.path("namespace").asText("");
            String key = node.path("key").asText("");
            if (namespace.isEmpty() || key.isEmpty()) {
                continue;
            }
            definitions.add(MetafieldDefinition.builder()
                    .namespace(namespace)
                    .key(key)
                    .name(node.path("name").asText(namespace + "." + key))
                    .type(node.path("type").path("name").asText(DEFAULT_METAFIELD_TYPE))
                    .description(node.path("description").asText(null))
                    .build());
        }
        log.debug("Loaded {} Shopify metafield definition(s)", definitions.size());
        return definitions;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, String> getMetafieldTypes(EntityType entityType) {
        if (entityType != EntityType.ARTICLES) {
            return Map.of();
        }
        Cache cache = cacheManager.getCache(METAFIELD_TYPES_CACHE);
        if (cache != null) {
            Map<String, String> cached = cache.get(entityType.getValue(), Map.class);
            if (cached != null) {
                return cached;
            }
        }
        Map<String, String> types = new LinkedHashMap<>();
        try {
            for (MetafieldDefinition definition : getMetafieldDefinitions(entityType)) {
                types.put(definition.qualifiedKey(), definition.getType());
            }
        } catch (TransportException e) {
            log.warn("Metafield types unavailable, falling back to value-based types: {}", e.getMessage());
            return Map.of();
        }
        if (cache != null) {
            cache.put(entityType.getValue(), types);
        }
        return types;
    }

    @Override
    public long create(EntityType entityType, JsonNode record) {
        requireWritable(entityType);
        ObjectNode payload = wrap(entityType, normalize(entityType, record));
        JsonNode body = write("creating " + entityType.getTargetSingular(),
                () -> restTemplate.postForObject("/{resource}.json", jsonEntity(payload), JsonNode.class,
                        entityType.getTargetResource()));
        long id = idFrom(entityType, body);
        log.info("Created Shopify {} {}", entityType.getTargetSingular(), id);
        return id;
    }

    @Override
    public long update(EntityType entityType, long targetId, JsonNode record) {
        requireWritable(entityType);
        ObjectNode normalized = normalize(entityType, record);
        if (entityType == EntityType.ARTICLES) {
            carryVariantIds(targetId, normalized);
        }
        normalized.put("id", targetId);
        ObjectNode payload = wrap(entityType, normalized);
        JsonNode body = write("updating " + entityType.getTargetSingular() + " " + targetId,
                () -> restTemplate.exchange("/{resource}/{id}.json", HttpMethod.PUT, jsonEntity(payload),
                        JsonNode.class, entityType.getTargetResource(), targetId).getBody());
        long id = idFrom(entityType, body);
        log.info("Updated Shopify {} {}", entityType.getTargetSingular(), id);
        return id;
    }

    @Override
    public Optional<JsonNode> findByNaturalKey(EntityType entityType, String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String trimmed = key.trim();
        try {
            switch (entityType) {
                case ARTICLES:
                    return findProductBySku(trimmed);
                case CUSTOMERS:
                    return firstOf(read("searching customers by email",
                            () -> restTemplate.getForObject("/customers/search.json?query={query}", JsonNode.class,
                                    "email:" + trimmed)),
                            "customers");
                default:
                    return firstOf(read("searching orders by name",
                            () -> restTemplate.getForObject("/orders.json?name={name}&status=any", JsonNode.class,
                                    trimmed)),
                            "orders");
            }
        } catch (NotFoundException e) {
            log.debug("Lookup of {} '{}' returned 404", entityType.getValue(), trimmed);
            return Optional.empty();
        }
    }

    private Optional<JsonNode> findProductBySku(String sku) {
        ObjectNode request = nodeFactory.objectNode();
        request.put("query", VARIANT_BY_SKU_QUERY);
        request.putObject("variables").put("query", "sku:\"" + sku.replace("\"", "\\\"") + "\"");

        JsonNode body = read("looking up product by SKU " + sku,
                () -> restTemplate.postForObject("/graphql.json", jsonEntity(request), JsonNode.class));
        if (body == null) {
            return Optional.empty();
        }
        JsonNode errors = body.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new TransportException(SYSTEM, "Shopify GraphQL lookup failed: " + errors.path(0).path("message")
                    .asText(errors.toString()));
        }
        JsonNode node = body.path("data").path("productVariants").path("edges").path(0).path("node");
        JsonNode legacyId = node.path("product").path("legacyResourceId");
        if (legacyId.isMissingNode() || legacyId.isNull()) {
            return Optional.empty();
        }
        ObjectNode match = nodeFactory.objectNode();
        match.put("id", legacyId.asLong());
        match.put("sku", node.path("sku").asText(sku));
        match.put("title", node.path("product").path("title").asText(null));
        return Optional.of(match);
    }

    private JsonNode fetchSample(EntityType entityType, String identifier) {
        long id;
        if (identifier.chars().allMatch(Character::isDigit)) {
            id = Long.parseLong(identifier);
        } else {
            id = findByNaturalKey(entityType, identifier)
                    .map(found -> found.path("id").asLong())
                    .orElseThrow(() -> new NotFoundException(entityType.getTargetLabel() + " " + identifier
                            + " not found in " + SYSTEM));
        }
        JsonNode body = read("fetching " + entityType.getTargetSingular() + " " + id,
                () -> restTemplate.getForObject("/{resource}/{id}.json", JsonNode.class,
                        entityType.getTargetResource(), id));
        JsonNode record = body == null ? MissingNode.getInstance() : body.path(entityType.getTargetSingular());
        if (record.isMissingNode()) {
            throw new NotFoundException(entityType.getTargetLabel() + " " + identifier + " not found in " + SYSTEM);
        }
        return record;
    }

    /**
     * Copies the ids of the product's existing variants onto the payload
     * variants, position by position, so Shopify updates them in place instead
     * of replacing them.
     */
    private void carryVariantIds(long productId, ObjectNode product) {
        JsonNode variants = product.get("variants");
        if (variants == null || !variants.isArray() || variants.isEmpty()) {
            return;
        }
        boolean missingIds = false;
        for (JsonNode variant : variants) {
            if (variant.isObject() && !variant.has("id")) {
                missingIds = true;
                break;
            }
        }
        if (!missingIds) {
            return;
        }
        JsonNode body = read("fetching product " + productId,
                () -> restTemplate.getForObject("/products/{id}.json", JsonNode.class, productId));
        JsonNode existing = body == null ? MissingNode.getInstance() : body.path("product").path("variants");
        for (int i = 0; i < variants.size() && i < existing.size(); i++) {
            JsonNode variant = variants.get(i);
            JsonNode existingId = existing.get(i).path("id");
            if (variant.isObject() && !variant.has("id") && existingId.isNumber()) {
                ((ObjectNode) variant).put("id", existingId.asLong());
            }
        }
    }

    /**
     * Copies the record. For products, metafields mapped as
     * {@code {namespace: {key: value}}}, or as a list of such objects (from
     * {@code metafields[].<namespace>.<key>} targets), are turned into
     * Shopify's metafield list. Entries already carrying {@code namespace},
     * {@code key} and {@code value} are kept as they are.
     */
    private ObjectNode normalize(EntityType entityType, JsonNode record) {
        if (record == null || !record.isObject()) {
            throw new TargetWriteException("Mapped " + entityType.getValue() + " record is not a JSON object");
        }
        ObjectNode copy = ((ObjectNode) record).deepCopy();
        JsonNode metafields = copy.get("metafields");
        if (entityType != EntityType.ARTICLES || metafields == null
                || !(metafields.isObject() || metafields.isArray())) {
            return copy;
        }
        Map<String, String> declaredTypes = getMetafieldTypes(entityType);
        ArrayNode list = nodeFactory.arrayNode();
        if (metafields.isObject()) {
            addMetafields(list, metafields, declaredTypes);
        } else {
            for (JsonNode element : metafields) {
                if (element.has("namespace") && element.has("key") && element.has("value")) {
                    list.add(element);
                } else if (element.isObject()) {
                    addMetafields(list, element, declaredTypes);
                }
            }
        }
        copy.set("metafields", dropRepeatedMetafields(list));
        return copy;
    }

    /** A value broadcast over several {@code metafields[]} elements is sent once. */
    private ArrayNode dropRepeatedMetafields(ArrayNode list) {
        Set<String> seen = new HashSet<>();
        ArrayNode unique = nodeFactory.arrayNode(list.size());
        for (JsonNode metafield : list) {
            if (seen.add(metafield.path("namespace").asText() + "." + metafield.path("key").asText())) {
                unique.add(metafield);
            }
        }
        return unique;
    }

    private void addMetafields(ArrayNode list, JsonNode byNamespace, Map<String, String> declaredTypes) {
        Iterator<Map.Entry<String, JsonNode>> namespaces = byNamespace.fields();
        while (namespaces.hasNext()) {
            Map.Entry<String, JsonNode> namespace = namespaces.next();
            if (!namespace.getValue().isObject()) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> keys = namespace.getValue().fields();
            while (keys.hasNext()) {
                Map.Entry<String, JsonNode> entry = keys.next();
                JsonNode value = entry.getValue();
                if (value.isNull()) {
                    continue;
                }
                String declared = declaredTypes.get(namespace.getKey() + "." + entry.getKey());
                ObjectNode metafield = list.addObject();
                metafield.put("namespace", namespace.getKey());
                metafield.put("key", entry.getKey());
                metafield.put("value", value.isValueNode() ? value.asText() : value.toString());
                metafield.put("type", declared != null ? declared : metafieldType(value));
            }
        }
    }

    private static String describe(MetafieldDefinition definition) {
        String name = definition.getName() != null ? definition.getName() : definition.qualifiedKey();
        return definition.getDescription() == null || definition.getDescription().isBlank()
                ? name + " - Custom metafield"
                : name + " - " + definition.getDescription();
    }

    static String metafieldType(JsonNode value) {
        if (value.isArray()) {
            return "list.single_line_text_field";
        }
        if (value.isIntegralNumber()) {
            return "number_integer";
        }
        if (value.isNumber()) {
            return "number_decimal";
        }
        if (value.isBoolean()) {
            return "boolean";
        }
        if (value.isObject()) {
            return "json";
        }
        return DEFAULT_METAFIELD_TYPE;
    }

    private void requireWritable(EntityType entityType) {
        if (entityType.isTargetReadOnly()) {
            throw new TargetWriteException(SYSTEM + " " + entityType.getTargetResource() + " are read-only");
        }
    }

    private ObjectNode wrap(EntityType entityType, ObjectNode record) {
        ObjectNode payload = nodeFactory.objectNode();
        payload.set(entityType.getTargetSingular(), record);
        return payload;
    }

    private long idFrom(EntityType entityType, JsonNode body) {
        JsonNode id = body == null ? MissingNode.getInstance() : body.path(entityType.getTargetSingular()).path("id");
        if (!id.canConvertToLong()) {
            throw new TargetWriteException(SYSTEM + " response did not contain a " + entityType.getTargetSingular()
                    + " id");
        }
        return id.asLong();
    }

    private static Optional<JsonNode> firstOf(JsonNode body, String rootKey) {
        if (body == null) {
            return Optional.empty();
        }
        JsonNode first = body.path(rootKey).path(0);
        return first.isMissingNode() ? Optional.empty() : Optional.of(first);
    }

    private static HttpEntity<JsonNode> jsonEntity(JsonNode body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private <T> T read(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (HttpClientErrorException.NotFound e) {
            throw new NotFoundException(SYSTEM + ": nothing found while " + action, e);
        } catch (HttpStatusCodeException e) {
            throw new TransportException(SYSTEM, SYSTEM + " API error " + e.getStatusCode().value() + " while "
                    + action + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransportException(SYSTEM, SYSTEM + " unreachable while " + action + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TransportException(SYSTEM, SYSTEM + " call failed while " + action + ": " + e.getMessage(), e);
        }
    }

    private <T> T write(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (HttpClientErrorException.NotFound e) {
            throw new NotFoundException(SYSTEM + ": nothing found while " + action, e);
        } catch (HttpStatusCodeException e) {
            if (RemoteStatus.isTransportFailure(e.getStatusCode())) {
                throw new TransportException(SYSTEM, SYSTEM + " API error " + e.getStatusCode().value() + " while "
                        + action, e);
            }
            throw new TargetWriteException(SYSTEM + " rejected " + action + ": " + e.getResponseBodyAsString(),
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new TransportException(SYSTEM, SYSTEM + " unreachable while " + action + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TransportException(SYSTEM, SYSTEM + " call failed while " + action + ": " + e.getMessage(), e);
        }
    }
}
