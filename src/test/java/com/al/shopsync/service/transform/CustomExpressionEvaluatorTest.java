package com.al.shopsync.service.transform;

import com.al.shopsync.config.ShopSyncProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CustomExpressionEvaluatorTest {

    private CustomExpressionEvaluator evaluator(boolean enabled) {
        ShopSyncProperties properties = new ShopSyncProperties();
        properties.getTransform().setCustomExpressionsEnabled(enabled);
        return new CustomExpressionEvaluator(properties);
    }

    @Test
    public void testEvaluate_StringMethod() {
        assertEquals("SHIRT", evaluator(true).evaluate("#value.toUpperCase()", "shirt"));
    }

    @Test
    public void testEvaluate_Arithmetic() {
        Object result = evaluator(true).evaluate("#value * 2", 21);

        assertEquals(42, ((Number) result).intValue());
    }

    @Test
    public void testEvaluate_NullResult() {
        assertNull(evaluator(true).evaluate("#value.isEmpty() ? null : #value", ""));
    }

    @Test
    public void testEvaluate_TypeReferencesBlocked() {
        CustomExpressionEvaluator evaluator = evaluator(true);

        assertThrows(IllegalArgumentException.class,
                () -> evaluator.evaluate("T(java.lang.System).exit(0)", "x"));
    }

    @Test
    public void testEvaluate_MethodThrows() {
        CustomExpressionEvaluator evaluator = evaluator(true);

        assertThrows(IllegalArgumentException.class, () -> evaluator.evaluate("#value.substring(10)", "abc"));
    }

    @Test
    public void testEvaluate_Disabled() {
        CustomExpressionEvaluator evaluator = evaluator(false);

        assertFalse(evaluator.isEnabled());
        assertThrows(IllegalStateException.class, () -> evaluator.evaluate("#value", "x"));
    }

    @Test
    public void testCheckSyntax() {
        CustomExpressionEvaluator evaluator = evaluator(true);

        assertNull(evaluator.checkSyntax("#value.trim()"));
        assertNotNull(evaluator.checkSyntax("#value.trim("));
    }
}
