package org.kidoni.calculator;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.kidoni.calculator.expr.Expr.number;

@SpringBootTest(properties = {
        "calculator.repl.enabled=false",
        "calculator.decimal-precision=7",
        "calculator.simplifier.alternate-negative-one=true",
})
class CalculatorApplicationTests {
    @Autowired
    private ApplicationContext context;

    @Autowired
    private CalculatorProperties properties;

    @Autowired
    private Evaluator evaluator;

    @Test
    void bindsProperties() {
        assertEquals(7, properties.decimalPrecision());
        assertEquals("% ", properties.prompt());
        assertFalse(properties.echoParsed());
        assertEquals(1_000, properties.parser().maxDepth());
        assertEquals(10_000, properties.simplifier().maxChainLength());
        assertEquals(10_000, properties.simplifier().maxExponent());
        assertTrue(properties.simplifier().alternateNegativeOne());
        assertFalse(properties.repl().enabled());
    }

    @Test
    void consoleIsNotStartedWhenDisabled() {
        assertTrue(context.getBeansOfType(Repl.class).isEmpty());
    }

    @Test
    void evaluatorIsWiredToTheConfiguredSimplifier() {
        assertEquals(number(1024), evaluator.evaluate("2 ^ 10").orElseThrow());
        assertEquals(number(1), evaluator.evaluate("(-1) ^ 4").orElseThrow());
    }
}
