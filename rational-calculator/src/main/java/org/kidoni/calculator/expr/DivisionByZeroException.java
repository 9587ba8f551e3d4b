package org.kidoni.calculator.expr;

import org.kidoni.calculator.CalculatorException;

public class DivisionByZeroException extends CalculatorException {
    public DivisionByZeroException() {
        super("division by zero");
    }

    public DivisionByZeroException(final String message) {
        super(message);
    }
}
