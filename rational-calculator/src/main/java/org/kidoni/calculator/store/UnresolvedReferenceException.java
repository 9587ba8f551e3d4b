package org.kidoni.calculator.store;

import org.kidoni.calculator.CalculatorException;

public class UnresolvedReferenceException extends CalculatorException {
    private final String name;

    public UnresolvedReferenceException(final String name, final String message) {
        super(message);
        this.name = name;
    }

    public static UnresolvedReferenceException cyclic(final String name) {
        return new UnresolvedReferenceException(name, "cyclic reference to '" + name + "'");
    }

    public String getName() {
        return name;
    }
}
