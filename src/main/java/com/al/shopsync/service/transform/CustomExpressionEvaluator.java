package com.al.shopsync.service.transform;

import com.al.shopsync.config.ShopSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * Evaluates user-supplied {@code custom} transformation code as a Spring
 * Expression Language expression in a restricted context.
 *
 * <p>
 * The only binding is {@code #value}. Instance methods on the value are
 * available ({@code #value.toUpperCase()}), type references, constructors,
 * bean references and assignment are not. Mapping authors are still trusted:
 * an expression can loop or allocate without bound.
 */
@Component
@Slf4j
public class CustomExpressionEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();
    private final boolean enabled;

    public CustomExpressionEvaluator(ShopSyncProperties properties) {
        this.enabled = properties.getTransform().isCustomExpressionsEnabled();
        if (!enabled) {
            log.info("Custom transformation expressions are disabled");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @param code  expression text
     * @param value String, Number, Boolean or null
     * @return the expression result, possibly null
     * @throws IllegalArgumentException if the expression does not parse or fails
     * @throws IllegalStateException    if custom expressions are disabled
     */
    public Object evaluate(String code, Object value) {
        if (!enabled) {
            throw new IllegalStateException("custom expressions are disabled");
        }
        try {
            Expression expression = parser.parseExpression(code);
            SimpleEvaluationContext context = SimpleEvaluationContext
                    .forReadOnlyDataBinding()
                    .withInstanceMethods()
                    .build();
            context.setVariable("value", value);
            return expression.getValue(context);
        } catch (ExpressionException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        } catch (RuntimeException e) {
            // methods invoked by the expression may throw directly
            throw new IllegalArgumentException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses without evaluating.
     *
     * @return the parse error, or null when the expression is well-formed
     */
    public String checkSyntax(String code) {
        try {
            parser.parseExpression(code);
            return null;
        } catch (ExpressionException e) {
            return e.getMessage();
        }
    }
}
