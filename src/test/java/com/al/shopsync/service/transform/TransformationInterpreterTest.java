package com.al.shopsync.service.transform;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.exception.TransformationException;
import com.al.shopsync.model.TransformationRule;
import com.al.shopsync.model.enums.TransformationType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TransformationInterpreterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TransformationInterpreter interpreter;

    @BeforeEach
    public void setUp() {
        interpreter = new TransformationInterpreter(new CustomExpressionEvaluator(new ShopSyncProperties()));
    }

    private static TransformationRule rule(TransformationType type) {
        return TransformationRule.builder().type(type).build();
    }

    @Test
    public void testDirect_ReturnsValueUnchanged() {
        JsonNode value = IntNode.valueOf(7);

        assertSame(value, interpreter.apply(null, value, "f"));
        assertSame(value, interpreter.apply(TransformationRule.direct(), value, "f"));
    }

    @Test
    public void testAbsentInput_StaysAbsent() {
        TransformationRule replace = rule(TransformationType.REPLACE);
        replace.setFind("a");

        assertTrue(interpreter.apply(replace, MissingNode.getInstance(), "f").isMissingNode());
        assertTrue(interpreter.apply(replace, objectMapper.nullNode(), "f").isMissingNode());
    }

    @Test
    public void testReplace_AllOccurrences() {
        TransformationRule rule = rule(TransformationType.REPLACE);
        rule.setFind("-");
        rule.setReplace("_");

        assertEquals("a_b_c", interpreter.apply(rule, TextNode.valueOf("a-b-c"), "f").asText());
    }

    @Test
    public void testReplace_NoMatchKeepsType() {
        TransformationRule rule = rule(TransformationType.REPLACE);
        rule.setFind("x");
        rule.setReplace("y");
        JsonNode value = IntNode.valueOf(12);

        assertSame(value, interpreter.apply(rule, value, "f"));
    }

    @Test
    public void testReplace_EmptyFindIsIdentity() {
        TransformationRule rule = rule(TransformationType.REPLACE);
        rule.setFind("");
        rule.setReplace("y");

        assertEquals("abc", interpreter.apply(rule, TextNode.valueOf("abc"), "f").asText());
    }

    @Test
    public void testReplace_NumberBecomesText() {
        TransformationRule rule = rule(TransformationType.REPLACE);
        rule.setFind("1");
        rule.setReplace("9");

        JsonNode result = interpreter.apply(rule, IntNode.valueOf(12), "f");

        assertTrue(result.isTextual());
        assertEquals("92", result.asText());
    }

    @Test
    public void testRegex_GroupReferences() {
        TransformationRule rule = rule(TransformationType.REGEX);
        rule.setFind("(\\d+)-(\\d+)");
        rule.setReplace("\\2/\\1");

        assertEquals("item 34/12", interpreter.apply(rule, TextNode.valueOf("item 12-34"), "sku").asText());
    }

    @Test
    public void testRegex_JavaStyleReferences() {
        TransformationRule rule = rule(TransformationType.REGEX);
        rule.setFind("^SW(\\d+)$");
        rule.setReplace("SKU-$1");

        assertEquals("SKU-100", interpreter.apply(rule, TextNode.valueOf("SW100"), "sku").asText());
    }

    @Test
    public void testRegex_InvalidPattern() {
        TransformationRule rule = rule(TransformationType.REGEX);
        rule.setFind("([a-z");

        TransformationException e = assertThrows(TransformationException.class,
                () -> interpreter.apply(rule, TextNode.valueOf("abc"), "title"));
        assertEquals("title", e.getField());
        assertEquals(TransformationType.REGEX, e.getRuleType());
    }

    @Test
    public void testRegex_StripHtml() {
        TransformationRule rule = rule(TransformationType.REGEX);
        rule.setFind("<[^>]+>");
        rule.setReplace("");

        assertEquals("Bold text", interpreter.apply(rule, TextNode.valueOf("<b>Bold</b> text"), "f").asText());
    }

    @Test
    public void testRegex_NoMatchReturnsOriginal() {
        TransformationRule rule = rule(TransformationType.REGEX);
        rule.setFind("^\\d{5}$");
        rule.setReplace("zip");
        JsonNode value = TextNode.valueOf("Main Street 1");

        assertEquals(value, interpreter.apply(rule, value, "street"));
    }

    @Test
    public void testSplitJoin_StripsLabelsAndEmptyParts() {
        TransformationRule rule = rule(TransformationType.SPLIT_JOIN);
        rule.setSplitDelimiter("|");
        rule.setJoinDelimiter(", ");

        JsonNode result = interpreter.apply(rule, TextNode.valueOf("Color: Red | | Size:XL |Cotton"), "tags");

        assertEquals("Red, XL, Cotton", result.asText());
    }

    @Test
    public void testSplitJoin_LabelPrefixRemoved() {
        TransformationRule rule = rule(TransformationType.SPLIT_JOIN);
        rule.setSplitDelimiter("|");
        rule.setJoinDelimiter(", ");

        assertEquals("A, B", interpreter.apply(rule, TextNode.valueOf("Use:A|Use:B"), "tags").asText());
    }

    @Test
    public void testSplitJoin_SameDelimiterIsIdempotent() {
        TransformationRule rule = rule(TransformationType.SPLIT_JOIN);
        rule.setSplitDelimiter("|");
        rule.setJoinDelimiter("|");

        JsonNode once = interpreter.apply(rule, TextNode.valueOf("red| blue |green"), "tags");
        JsonNode twice = interpreter.apply(rule, once, "tags");

        assertEquals("red|blue|green", once.asText());
        assertEquals(once, twice);
    }

    @Test
    public void testSplitJoin_EmptyDelimiterIsIdentity() {
        TransformationRule rule = rule(TransformationType.SPLIT_JOIN);
        rule.setSplitDelimiter("");
        rule.setJoinDelimiter(",");

        assertEquals("a|b", interpreter.apply(rule, TextNode.valueOf("a|b"), "f").asText());
    }

    @Test
    public void testCustom_ResultTypes() {
        TransformationRule rule = rule(TransformationType.CUSTOM);

        rule.setCustomCode("#value.length()");
        assertTrue(interpreter.apply(rule, TextNode.valueOf("abcd"), "f").isInt());

        rule.setCustomCode("#value > 10");
        assertTrue(interpreter.apply(rule, IntNode.valueOf(11), "f").booleanValue());

        rule.setCustomCode("null");
        assertTrue(interpreter.apply(rule, TextNode.valueOf("x"), "f").isMissingNode());
    }

    @Test
    public void testCustom_BlankCodeIsIdentity() {
        TransformationRule rule = rule(TransformationType.CUSTOM);
        rule.setCustomCode("  ");

        assertEquals("x", interpreter.apply(rule, TextNode.valueOf("x"), "f").asText());
    }

    @Test
    public void testCustom_FailureWrapped() {
        TransformationRule rule = rule(TransformationType.CUSTOM);
        rule.setCustomCode("#value.noSuchMethod()");

        TransformationException e = assertThrows(TransformationException.class,
                () -> interpreter.apply(rule, TextNode.valueOf("x"), "title"));
        assertTrue(e.getMessage().startsWith("Transformation 'custom' failed for field 'title'"));
    }

    @Test
    public void testCustom_Disabled() {
        ShopSyncProperties properties = new ShopSyncProperties();
        properties.getTransform().setCustomExpressionsEnabled(false);
        TransformationInterpreter disabled = new TransformationInterpreter(new CustomExpressionEvaluator(properties));
        TransformationRule rule = rule(TransformationType.CUSTOM);
        rule.setCustomCode("#value");

        assertThrows(TransformationException.class, () -> disabled.apply(rule, TextNode.valueOf("x"), "f"));
    }

    @Test
    public void testApplyEach_PreservesLength() throws Exception {
        TransformationRule rule = rule(TransformationType.CUSTOM);
        rule.setCustomCode("#value == 'drop' ? null : #value.toUpperCase()");
        ArrayNode values = (ArrayNode) objectMapper.readTree("[\"a\",\"drop\",\"c\"]");

        ArrayNode result = interpreter.applyEach(rule, values, "tags");

        assertEquals(3, result.size());
        assertEquals("A", result.get(0).asText());
        assertTrue(result.get(1).isNull());
        assertEquals("C", result.get(2).asText());
    }

    @Test
    public void testMetafield_DirectListTypeSplitsDelimitedText() {
        JsonNode result = interpreter.applyToMetafield(null, TextNode.valueOf("red | blue|green"), "f",
                "list.single_line_text_field");

        assertTrue(result.isTextual());
        assertEquals("[\"red\",\"blue\",\"green\"]", result.asText());
    }

    @Test
    public void testMetafield_DirectListTypeSingleValueKept() {
        JsonNode value = TextNode.valueOf("red");

        assertSame(value, interpreter.applyToMetafield(null, value, "f", "list.single_line_text_field"));
    }

    @Test
    public void testMetafield_DirectScalarTypeKeepsDelimiters() {
        JsonNode value = TextNode.valueOf("a, b");

        assertSame(value, interpreter.applyToMetafield(null, value, "f", "single_line_text_field"));
    }

    @Test
    public void testMetafield_SplitJoinListTypeIgnoresJoinDelimiter() {
        TransformationRule rule = rule(TransformationType.SPLIT_JOIN);
        rule.setSplitDelimiter("|");
        rule.setJoinDelimiter(", ");

        JsonNode result = interpreter.applyToMetafield(rule, TextNode.valueOf("Color: red|Size: L"), "f",
                "list.single_line_text_field");

        assertEquals("[\"red\",\"L\"]", result.asText());
    }

    @Test
    public void testMetafield_SplitJoinUndeclaredTypeWithoutJoinIsList() {
        TransformationRule rule = rule(TransformationType.SPLIT_JOIN);
        rule.setSplitDelimiter(";");

        assertEquals("[\"a\",\"b\"]", interpreter.applyToMetafield(rule, TextNode.valueOf("a;b"), "f", null).asText());
        rule.setJoinDelimiter("/");
        assertEquals("a/b", interpreter.applyToMetafield(rule, TextNode.valueOf("a;b"), "f", null).asText());
    }

    @Test
    public void testMetafield_OtherRulesUnaffected() {
        TransformationRule rule = rule(TransformationType.REPLACE);
        rule.setFind("|");
        rule.setReplace("/");

        assertEquals("a/b", interpreter.applyToMetafield(rule, TextNode.valueOf("a|b"), "f",
                "list.single_line_text_field").asText());
    }
}
