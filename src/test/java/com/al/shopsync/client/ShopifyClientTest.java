package com.al.shopsync.client;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.exception.TargetWriteException;
import com.al.shopsync.exception.TransportException;
import com.al.shopsync.model.FieldDescriptor;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.service.FieldIntrospector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class ShopifyClientTest {

    private static final String ROOT = "https://store.test/admin/api/2024-01";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private ConcurrentMapCacheManager cacheManager;
    private ShopifyClient client;

    @BeforeEach
    public void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(ROOT).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        cacheManager = new ConcurrentMapCacheManager();
        client = new ShopifyClient(restTemplate, new FieldIntrospector(), cacheManager, new ShopSyncProperties());
    }

    private static String json(String text) {
        return text.replace('\'', '"');
    }

    private JsonNode node(String text) throws Exception {
        return objectMapper.readTree(json(text));
    }

    @Test
    public void testCreate_WrapsPayload() throws Exception {
        server.expect(requestTo(ROOT + "/customers.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.customer.email").value("a@example.com"))
                .andRespond(withSuccess(json("{'customer':{'id':123,'email':'a@example.com'}}"),
                        MediaType.APPLICATION_JSON));

        long id = client.create(EntityType.CUSTOMERS, node("{'email':'a@example.com'}"));

        assertEquals(123L, id);
        server.verify();
    }

    private void expectDefinitions(String edges) {
        server.expect(requestTo(ROOT + "/graphql.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string(containsString("metafieldDefinitions")))
                .andRespond(withSuccess(json("{'data':{'metafieldDefinitions':{'edges':" + edges + "}}}"),
                        MediaType.APPLICATION_JSON));
    }

    @Test
    public void testCreate_MetafieldsNormalized() throws Exception {
        expectDefinitions("[]");
        server.expect(requestTo(ROOT + "/products.json"))
                .andExpect(jsonPath("$.product.metafields[0].namespace").value("shopware"))
                .andExpect(jsonPath("$.product.metafields[0].key").value("weight"))
                .andExpect(jsonPath("$.product.metafields[0].value").value("1.5"))
                .andExpect(jsonPath("$.product.metafields[0].type").value("number_decimal"))
                .andExpect(jsonPath("$.product.metafields[1].type").value("single_line_text_field"))
                .andRespond(withSuccess(json("{'product':{'id':9}}"), MediaType.APPLICATION_JSON));

        long id = client.create(EntityType.ARTICLES,
                node("{'title':'Shirt','metafields':{'shopware':{'weight':1.5,'supplier':'ACME','ean':null}}}"));

        assertEquals(9L, id);
        server.verify();
    }

    @Test
    public void testCreate_ValidationErrorIsWriteFailure() throws Exception {
        server.expect(requestTo(ROOT + "/customers.json"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(json("{'errors':{'email':['has already been taken']}}")));

        TargetWriteException e = assertThrows(TargetWriteException.class,
                () -> client.create(EntityType.CUSTOMERS, node("{'email':'a@example.com'}")));

        assertEquals(422, e.getStatusCode());
        assertTrue(e.getMessage().contains("has already been taken"));
    }

    @Test
    public void testCreate_RateLimitedIsTransport() throws Exception {
        server.expect(requestTo(ROOT + "/customers.json")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThrows(TransportException.class,
                () -> client.create(EntityType.CUSTOMERS, node("{'email':'a@example.com'}")));
    }

    @Test
    public void testCreate_OrdersReadOnly() {
        assertThrows(TargetWriteException.class, () -> client.create(EntityType.ORDERS, node("{'name':'#1001'}")));
        server.verify();
    }

    @Test
    public void testUpdate_CarriesExistingVariantIds() throws Exception {
        server.expect(requestTo(ROOT + "/products/9.json"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(json("{'product':{'id':9,'variants':[{'id':901},{'id':902}]}}"),
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(ROOT + "/products/9.json"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.product.id").value(9))
                .andExpect(jsonPath("$.product.variants[0].id").value(901))
                .andExpect(jsonPath("$.product.variants[0].sku").value("A"))
                .andRespond(withSuccess(json("{'product':{'id':9}}"), MediaType.APPLICATION_JSON));

        long id = client.update(EntityType.ARTICLES, 9L, node("{'title':'Shirt','variants':[{'sku':'A'}]}"));

        assertEquals(9L, id);
        server.verify();
    }

    @Test
    public void testFindByNaturalKey_SkuViaGraphql() {
        server.expect(requestTo(ROOT + "/graphql.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.variables.query").value("sku:\"SW-1\""))
                .andExpect(content().string(containsString("productVariants")))
                .andRespond(withSuccess(json("{'data':{'productVariants':{'edges':[{'node':{'id':'gid://v/1',"
                        + "'sku':'SW-1','product':{'id':'gid://p/9','legacyResourceId':'9','title':'Shirt'}}}]}}}"),
                        MediaType.APPLICATION_JSON));

        Optional<JsonNode> found = client.findByNaturalKey(EntityType.ARTICLES, "SW-1");

        assertTrue(found.isPresent());
        assertEquals(9L, found.get().get("id").asLong());
        assertEquals("Shirt", found.get().get("title").asText());
    }

    @Test
    public void testFindByNaturalKey_SkuNotFound() {
        server.expect(requestTo(ROOT + "/graphql.json"))
                .andRespond(withSuccess(json("{'data':{'productVariants':{'edges':[]}}}"),
                        MediaType.APPLICATION_JSON));

        assertTrue(client.findByNaturalKey(EntityType.ARTICLES, "missing").isEmpty());
    }

    @Test
    public void testFindByNaturalKey_GraphqlErrors() {
        server.expect(requestTo(ROOT + "/graphql.json"))
                .andRespond(withSuccess(json("{'errors':[{'message':'Throttled'}]}"), MediaType.APPLICATION_JSON));

        TransportException e = assertThrows(TransportException.class,
                () -> client.findByNaturalKey(EntityType.ARTICLES, "SW-1"));
        assertTrue(e.getMessage().contains("Throttled"));
    }

    @Test
    public void testFindByNaturalKey_CustomerByEmail() {
        server.expect(requestTo(containsString("/customers/search.json?query=email:")))
                .andRespond(withSuccess(json("{'customers':[{'id':55,'email':'a@example.com'}]}"),
                        MediaType.APPLICATION_JSON));

        assertEquals(55L, client.findByNaturalKey(EntityType.CUSTOMERS, "a@example.com").get().get("id").asLong());
    }

    @Test
    public void testFindByNaturalKey_OrderNotFound() {
        server.expect(requestTo(containsString("/orders.json?name=")))
                .andRespond(withResourceNotFound());

        assertTrue(client.findByNaturalKey(EntityType.ORDERS, "#1001").isEmpty());
    }

    @Test
    public void testFindByNaturalKey_BlankKey() {
        assertTrue(client.findByNaturalKey(EntityType.CUSTOMERS, "  ").isEmpty());
        server.verify();
    }

    @Test
    public void testMetafieldType() throws Exception {
        assertEquals("number_integer", ShopifyClient.metafieldType(node("3")));
        assertEquals("boolean", ShopifyClient.metafieldType(node("true")));
        assertEquals("json", ShopifyClient.metafieldType(node("{'a':1}")));
        assertEquals("list.single_line_text_field", ShopifyClient.metafieldType(node("['a']")));
    }

    @Test
    public void testCreate_DeclaredMetafieldTypesWin() throws Exception {
        expectDefinitions("[{'node':{'namespace':'shopware','key':'colors','name':'Colors',"
                + "'type':{'name':'list.single_line_text_field'}}},"
                + "{'node':{'namespace':'shopware','key':'weight','name':'Weight','type':{'name':'weight'}}}]");
        server.expect(requestTo(ROOT + "/products.json"))
                .andExpect(jsonPath("$.product.metafields[0].key").value("colors"))
                .andExpect(jsonPath("$.product.metafields[0].value").value("[\"red\",\"blue\"]"))
                .andExpect(jsonPath("$.product.metafields[0].type").value("list.single_line_text_field"))
                .andExpect(jsonPath("$.product.metafields[1].type").value("weight"))
                .andExpect(jsonPath("$.product.metafields[2].key").value("supplier"))
                .andExpect(jsonPath("$.product.metafields[2].type").value("single_line_text_field"))
                .andRespond(withSuccess(json("{'product':{'id':9}}"), MediaType.APPLICATION_JSON));

        client.create(EntityType.ARTICLES, node("{'title':'Shirt','metafields':[{'shopware':"
                + "{'colors':'[\\'red\\',\\'blue\\']','weight':'{\\'value\\':1.5,\\'unit\\':\\'kg\\'}',"
                + "'supplier':'ACME'}}]}"));

        server.verify();
    }

    @Test
    public void testCreate_MetafieldListFormFlattenedOnce() throws Exception {
        expectDefinitions("[]");
        server.expect(requestTo(ROOT + "/products.json"))
                .andExpect(jsonPath("$.product.metafields.length()").value(2))
                .andExpect(jsonPath("$.product.metafields[0].key").value("care"))
                .andExpect(jsonPath("$.product.metafields[1].key").value("origin"))
                .andExpect(jsonPath("$.product.metafields[1].value").value("IT"))
                .andRespond(withSuccess(json("{'product':{'id':9}}"), MediaType.APPLICATION_JSON));

        client.create(EntityType.ARTICLES, node("{'title':'Shirt','metafields':["
                + "{'shopware':{'care':'wash cold'}},{'shopware':{'care':'wash cold'}},"
                + "{'namespace':'custom','key':'origin','value':'IT','type':'single_line_text_field'}]}"));

        server.verify();
    }

    @Test
    public void testGetMetafieldTypes_CachedAfterFirstLoad() {
        expectDefinitions("[{'node':{'namespace':'shopware','key':'colors','type':{'name':'list.color'}}}]");

        Map<String, String> first = client.getMetafieldTypes(EntityType.ARTICLES);
        Map<String, String> second = client.getMetafieldTypes(EntityType.ARTICLES);

        assertEquals("list.color", first.get("shopware.colors"));
        assertEquals(first, second);
        assertTrue(client.getMetafieldTypes(EntityType.CUSTOMERS).isEmpty());
        server.verify();
    }

    @Test
    public void testGetMetafieldTypes_QueryErrorFallsBackWithoutCaching() {
        server.expect(requestTo(ROOT + "/graphql.json"))
                .andRespond(withSuccess(json("{'errors':[{'message':'Access denied'}]}"), MediaType.APPLICATION_JSON));

        assertTrue(client.getMetafieldTypes(EntityType.ARTICLES).isEmpty());
        assertNull(cacheManager.getCache(ShopifyClient.METAFIELD_TYPES_CACHE).get("articles"));
        server.verify();
    }

    @Test
    public void testGetFields_ListsMetafieldDefinitions() {
        server.expect(requestTo(ROOT + "/products.json?limit=10"))
                .andRespond(withSuccess(json("{'products':[{'id':1,'title':'Shirt'}]}"), MediaType.APPLICATION_JSON));
        expectDefinitions("[{'node':{'namespace':'shopware','key':'material','name':'Material',"
                + "'description':'Fabric','type':{'name':'single_line_text_field'}}}]");

        List<FieldDescriptor> fields = client.getFields(EntityType.ARTICLES, null);

        FieldDescriptor material = fields.stream()
                .filter(field -> field.getPath().equals("metafields[].shopware.material"))
                .findFirst().orElseThrow();
        assertEquals("single_line_text_field", material.getType());
        assertEquals("Material - Fabric", material.getDescription());
        assertFalse(material.getRequired());
        server.verify();
    }
}
