package org.kidoni.calculator.expr;

import org.kidoni.calculator.CalculatorException;

/**
 * The statement is too large to evaluate within the configured limits.
 */
public class ExpressionTooComplexException extends CalculatorException {
    public ExpressionTooComplexException(final String message) {
        super(message);
    }

    public ExpressionTooComplexException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public static ExpressionTooComplexException chainTooLong(final int length, final int limit) {
        return new ExpressionTooComplexException("expression chain of " + length + " terms exceeds the limit of " + limit);
    }

    public static ExpressionTooComplexException nestedTooDeeply(final int limit) {
        return new ExpressionTooComplexException("expression nesting exceeds the limit of " + limit + " levels");
    }
}
