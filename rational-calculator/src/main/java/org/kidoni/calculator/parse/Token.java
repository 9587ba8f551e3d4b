package org.kidoni.calculator.parse;

import org.kidoni.calculator.expr.Rational;

/**
 * Lexical token. Each carries the 0-based column it started at.
 */
public sealed interface Token {
    int position();

    record NumberToken(Rational value, String lexeme, int position) implements Token {
        @Override
        public String toString() {
            return lexeme;
        }
    }

    record NameToken(String name, int position) implements Token {
        @Override
        public String toString() {
            return name;
        }
    }

    record SymbolToken(Symbol symbol, int position) implements Token {
        @Override
        public String toString() {
            return symbol.text();
        }
    }
}
