package org.kidoni.calculator;

/**
 * Base of every error reported against a single input line. The session prints the message and moves on to the
 * next line.
 */
public class CalculatorException extends RuntimeException {
    public CalculatorException(final String message) {
        super(message);
    }

    public CalculatorException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
