package com.al.shopsync.service;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.TransformationRule;
import com.al.shopsync.model.enums.TransformationType;
import com.al.shopsync.service.path.PathResolver;
import com.al.shopsync.service.transform.CustomExpressionEvaluator;
import com.al.shopsync.service.transform.TransformationInterpreter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MappingApplierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MappingApplier applier;

    @BeforeEach
    public void setUp() {
        applier = new MappingApplier(new PathResolver(),
                new TransformationInterpreter(new CustomExpressionEvaluator(new ShopSyncProperties())));
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text.replace('\'', '"'));
    }

    @Test
    public void testProject_ArticleToProduct() throws Exception {
        JsonNode article = json("{'name':'Shirt','descriptionLong':'<p>Soft</p>',"
                + "'mainDetail':{'number':'SW-1','prices':[{'price':19.99}]},"
                + "'details':[{'number':'SW-1.1'},{'number':'SW-1.2'}]}");
        TransformationRule stripTags = TransformationRule.builder()
                .type(TransformationType.REGEX).find("<[^>]+>").replace("").build();
        List<FieldMapping> mappings = List.of(
                FieldMapping.of("name", "title"),
                FieldMapping.of("descriptionLong", "body_html", stripTags),
                FieldMapping.of("details[].number", "variants[].sku"),
                FieldMapping.of("mainDetail.prices[0].price", "variants[].price"));

        ObjectNode product = applier.project(article, mappings);

        assertEquals(json("{'title':'Shirt','body_html':'Soft',"
                + "'variants':[{'sku':'SW-1.1','price':19.99},{'sku':'SW-1.2','price':19.99}]}"), product);
    }

    @Test
    public void testProject_AbsentSourceLeavesTargetUnset() throws Exception {
        ObjectNode mapped = applier.project(json("{'name':'Shirt','ean':null}"), List.of(
                FieldMapping.of("name", "title"),
                FieldMapping.of("ean", "barcode"),
                FieldMapping.of("missing.path", "vendor")));

        assertEquals(json("{'title':'Shirt'}"), mapped);
    }

    @Test
    public void testProject_LaterMappingWins() throws Exception {
        ObjectNode mapped = applier.project(json("{'a':'first','b':'second'}"), List.of(
                FieldMapping.of("a", "title"),
                FieldMapping.of("b", "title")));

        assertEquals("second", mapped.get("title").asText());
    }

    @Test
    public void testProject_TransformsEachListElement() throws Exception {
        TransformationRule upper = TransformationRule.builder()
                .type(TransformationType.CUSTOM).customCode("#value.toUpperCase()").build();

        ObjectNode mapped = applier.project(json("{'details':[{'number':'a'},{'number':'b'}]}"),
                List.of(FieldMapping.of("details[].number", "variants[].sku", upper)));

        assertEquals(json("{'variants':[{'sku':'A'},{'sku':'B'}]}"), mapped);
    }

    @Test
    public void testProject_SparseListsStayAligned() throws Exception {
        JsonNode article = json("{'details':[{'number':'A','price':1},{'price':2},{'number':'C','price':3}]}");

        ObjectNode product = applier.project(article, List.of(
                FieldMapping.of("details[].number", "variants[].sku"),
                FieldMapping.of("details[].price", "variants[].price")));

        assertEquals(json("{'variants':[{'sku':'A','price':1},{'price':2},{'sku':'C','price':3}]}"), product);
    }

    @Test
    public void testProject_SparseListMappedSecondStaysAligned() throws Exception {
        JsonNode article = json("{'details':[{'number':'A','price':1},{'price':2},{'number':'C','price':3}]}");

        ObjectNode product = applier.project(article, List.of(
                FieldMapping.of("details[].price", "variants[].price"),
                FieldMapping.of("details[].number", "variants[].sku")));

        assertEquals(json("{'variants':[{'price':1,'sku':'A'},{'price':2},{'price':3,'sku':'C'}]}"), product);
    }

    @Test
    public void testProject_SourceNotModified() throws Exception {
        JsonNode source = json("{'address':{'city':'Berlin'}}");
        JsonNode before = source.deepCopy();

        ObjectNode mapped = applier.project(source, List.of(FieldMapping.of("address", "default_address")));
        ((ObjectNode) mapped.get("default_address")).put("city", "Hamburg");

        assertEquals(before, source);
    }

    @Test
    public void testProject_EmptyMappings() throws Exception {
        assertEquals(0, applier.project(json("{'a':1}"), List.of()).size());
    }

    @Test
    public void testProject_SingleFieldCopied() throws Exception {
        ObjectNode mapped = applier.project(json("{'name':'Bike'}"), List.of(FieldMapping.of("name", "title")));

        assertEquals(json("{'title':'Bike'}"), mapped);
    }

    @Test
    public void testProject_Deterministic() throws Exception {
        JsonNode source = json("{'name':'Shirt','tags':'a|b','details':[{'number':'S1'},{'number':'S2'}]}");
        TransformationRule split = TransformationRule.builder()
                .type(TransformationType.SPLIT_JOIN).splitDelimiter("|").joinDelimiter(",").build();
        List<FieldMapping> mappings = List.of(
                FieldMapping.of("name", "title"),
                FieldMapping.of("tags", "tags", split),
                FieldMapping.of("details[].number", "variants[].sku"));

        assertEquals(applier.project(source, mappings), applier.project(source, mappings));
    }

    @Test
    public void testProject_MetafieldUsesDeclaredListType() throws Exception {
        JsonNode article = json("{'name':'Shirt','attribute':{'attr1':'cotton, linen','attr2':'Italy, EU'}}");
        List<FieldMapping> mappings = List.of(
                FieldMapping.of("name", "title"),
                FieldMapping.of("attribute.attr1", "metafields[].shopware.material"),
                FieldMapping.of("attribute.attr2", "metafields[].shopware.origin"));

        ObjectNode product = applier.project(article, mappings,
                Map.of("shopware.material", "list.single_line_text_field"));

        assertEquals(1, product.get("metafields").size());
        JsonNode shopware = product.at("/metafields/0/shopware");
        assertEquals("[\"cotton\",\"linen\"]", shopware.get("material").asText());
        assertEquals("Italy, EU", shopware.get("origin").asText());
    }

    @Test
    public void testProject_WithoutTypesLeavesMetafieldTextAlone() throws Exception {
        JsonNode article = json("{'attribute':{'attr1':'cotton, linen'}}");

        ObjectNode product = applier.project(article,
                List.of(FieldMapping.of("attribute.attr1", "metafields[].shopware.material")));

        assertEquals("cotton, linen", product.at("/metafields/0/shopware/material").asText());
    }
}
