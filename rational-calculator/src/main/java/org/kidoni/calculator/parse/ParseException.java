package org.kidoni.calculator.parse;

import java.util.Optional;

import org.kidoni.calculator.CalculatorException;

public class ParseException extends CalculatorException {
    private final transient Token token;

    public ParseException(final String message) {
        this(message, (Token) null);
    }

    public ParseException(final String message, final Token token) {
        super(message);
        this.token = token;
    }

    public static ParseException unexpected(final Token token) {
        return new ParseException("unexpected token '" + token + "' at column " + token.position(), token);
    }

    public static ParseException unterminated() {
        return new ParseException("unterminated expression");
    }

    /**
     * The offending token; empty when input ended early.
     */
    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }
}
