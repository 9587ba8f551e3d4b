package org.kidoni.calculator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under the {@code calculator} prefix.
 *
 * @param prompt text written before each line is read
 * @param decimalPrecision fractional digits of the decimal expansion shown for non-integer results
 * @param echoParsed print the parsed tree before evaluating it
 * @param parser parser limits
 * @param simplifier simplifier limits and switches
 * @param repl console session switches
 */
@ConfigurationProperties(prefix = "calculator")
public record CalculatorProperties(
        @DefaultValue("% ") String prompt,
        @DefaultValue("5") int decimalPrecision,
        @DefaultValue("false") boolean echoParsed,
        @DefaultValue ParserProperties parser,
        @DefaultValue SimplifierProperties simplifier,
        @DefaultValue ReplProperties repl) {

    public record ParserProperties(@DefaultValue("1000") int maxDepth) {
    }

    public record SimplifierProperties(
            @DefaultValue("10000") int maxChainLength,
            @DefaultValue("10000") int maxExponent,
            @DefaultValue("false") boolean alternateNegativeOne) {
    }

    public record ReplProperties(@DefaultValue("true") boolean enabled) {
    }
}
