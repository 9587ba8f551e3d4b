package org.kidoni.calculator.expr;

/**
 * Binary operators with their binding powers. A pair with {@code left > right} makes the operator
 * right-associative, an equal pair left-associative.
 */
public enum Op {
    ADD("+", 6, 6, true),
    SUBTRACT("−", 6, 6, false),
    MULTIPLY("∙", 7, 7, true),
    ADJACENT(" ", 7, 7, true),
    DIVIDE("÷", 7, 7, false),
    MODULUS("%", 7, 7, false),
    EXPONENT("^", 10, 9, false),
    EQUALS("=", 3, 3, false);

    private final String symbol;
    private final int leftBindingPower;
    private final int rightBindingPower;
    private final boolean associative;

    Op(final String symbol, final int leftBindingPower, final int rightBindingPower, final boolean associative) {
        this.symbol = symbol;
        this.leftBindingPower = leftBindingPower;
        this.rightBindingPower = rightBindingPower;
        this.associative = associative;
    }

    public String symbol() {
        return symbol;
    }

    public int leftBindingPower() {
        return leftBindingPower;
    }

    public int rightBindingPower() {
        return rightBindingPower;
    }

    public int precedence() {
        return leftBindingPower;
    }

    public boolean isAssociative() {
        return associative;
    }

    public boolean isRightAssociative() {
        return leftBindingPower > rightBindingPower;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
