package org.kidoni.calculator;

import org.kidoni.calculator.rewrite.Normalizer;
import org.kidoni.calculator.rewrite.Simplifier;
import org.kidoni.calculator.store.VariableStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(CalculatorProperties.class)
public class CalculatorConfiguration {
    @Bean
    VariableStore variableStore() {
        return new VariableStore();
    }

    @Bean
    Normalizer normalizer() {
        return new Normalizer();
    }

    @Bean
    Simplifier simplifier(final CalculatorProperties properties) {
        return new Simplifier(properties.simplifier().maxChainLength(), properties.simplifier().maxExponent(),
                properties.simplifier().alternateNegativeOne());
    }

    @Bean
    Evaluator evaluator(final VariableStore variableStore, final Normalizer normalizer, final Simplifier simplifier,
            final CalculatorProperties properties) {
        return new Evaluator(variableStore, normalizer, simplifier, properties.parser().maxDepth());
    }

    @Bean
    @ConditionalOnProperty(prefix = "calculator.repl", name = "enabled", havingValue = "true", matchIfMissing = true)
    Repl repl(final Evaluator evaluator, final CalculatorProperties properties) {
        return new Repl(evaluator, properties, System.in, System.out);
    }
}
