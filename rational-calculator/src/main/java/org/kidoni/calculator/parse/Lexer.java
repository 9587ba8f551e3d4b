package org.kidoni.calculator.parse;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.kidoni.calculator.expr.Rational;

import static java.lang.Character.isDigit;
import static java.lang.Character.isLetter;
import static java.lang.Character.isWhitespace;

/**
 * Splits one line of input into tokens.
 * <p>
 * Lexical grammar:
 * <pre>
 *  Number: [0-9] ( [0-9] | '_' )* ( '.' [0-9] ( [0-9] | '_' )* )?
 *  Name:   letter+
 *  Symbol: '(' | ')' | ',' | '+' | '-' | '−' | '*' | '∙' | '·' | '×' | '/' | '÷' | '%' | '^' | '=' | ':='
 *  WS:     whitespace, ignored
 * </pre>
 * Decimal literals are exact: {@code 0.1} is the rational {@code 1/10}.
 */
public class Lexer {
    private final String input;
    private int position;

    public Lexer(final String input) {
        assert input != null;
        this.input = input;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        position = 0;

        while (position < input.length()) {
            char c = input.charAt(position);
            if (isWhitespace(c)) {
                position++;
            }
            else if (isDigit(c)) {
                tokens.add(readNumber());
            }
            else if (isLetter(c)) {
                tokens.add(readName());
            }
            else {
                tokens.add(readSymbol(c));
            }
        }

        return tokens;
    }

    private Token readNumber() {
        int start = position;
        StringBuilder digits = new StringBuilder();
        boolean seenPoint = false;

        while (position < input.length()) {
            char c = input.charAt(position);
            if (isDigit(c)) {
                digits.append(c);
            }
            else if (c == '.' && !seenPoint && position + 1 < input.length() && isDigit(input.charAt(position + 1))) {
                seenPoint = true;
                digits.append(c);
            }
            else if (c != '_') {
                break;
            }
            position++;
        }

        Rational value = Rational.of(new BigDecimal(digits.toString()));
        return new Token.NumberToken(value, input.substring(start, position), start);
    }

    private Token readName() {
        int start = position;
        while (position < input.length() && isLetter(input.charAt(position))) {
            position++;
        }
        return new Token.NameToken(input.substring(start, position), start);
    }

    private Token readSymbol(final char c) {
        int start = position;
        Symbol symbol = switch (c) {
            case '(' -> Symbol.LEFT_PAREN;
            case ')' -> Symbol.RIGHT_PAREN;
            case ',' -> Symbol.COMMA;
            case '+' -> Symbol.PLUS;
            case '-', '−' -> Symbol.MINUS;
            case '*', '∙', '·', '×' -> Symbol.TIMES;
            case '/', '÷' -> Symbol.DIVIDE;
            case '%' -> Symbol.PERCENT;
            case '^' -> Symbol.CARET;
            case '=' -> Symbol.EQUALS;
            case ':' -> {
                if (start + 1 < input.length() && input.charAt(start + 1) == '=') {
                    position++;
                    yield Symbol.ASSIGN;
                }
                throw new LexException(c, start);
            }
            default -> throw new LexException(c, start);
        };
        position++;
        return new Token.SymbolToken(symbol, start);
    }
}
