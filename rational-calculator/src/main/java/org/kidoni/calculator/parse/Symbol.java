package org.kidoni.calculator.parse;

import java.util.Optional;

import org.kidoni.calculator.expr.Op;

/**
 * Fixed punctuation and operator tokens.
 */
public enum Symbol {
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    COMMA(","),
    PLUS("+"),
    MINUS("−"),
    TIMES("∙"),
    DIVIDE("÷"),
    PERCENT("%"),
    CARET("^"),
    EQUALS("="),
    ASSIGN(":=");

    private final String text;

    Symbol(final String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * The binary operator this symbol spells, if any.
     */
    public Optional<Op> binaryOp() {
        Op op = switch (this) {
            case PLUS -> Op.ADD;
            case MINUS -> Op.SUBTRACT;
            case TIMES -> Op.MULTIPLY;
            case DIVIDE -> Op.DIVIDE;
            case PERCENT -> Op.MODULUS;
            case CARET -> Op.EXPONENT;
            case EQUALS -> Op.EQUALS;
            default -> null;
        };
        return Optional.ofNullable(op);
    }

    @Override
    public String toString() {
        return text;
    }
}
