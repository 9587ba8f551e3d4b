package org.kidoni.calculator.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.kidoni.calculator.expr.Expr;
import org.kidoni.calculator.expr.Expr.AssignExpr;
import org.kidoni.calculator.expr.Expr.BinaryExpr;
import org.kidoni.calculator.expr.Expr.BooleanExpr;
import org.kidoni.calculator.expr.Expr.NameExpr;
import org.kidoni.calculator.expr.Expr.NumberExpr;
import org.kidoni.calculator.expr.Expr.TupleExpr;
import org.kidoni.calculator.expr.ExpressionTooComplexException;
import org.kidoni.calculator.expr.Op;

/**
 * Precedence-climbing parser for one statement.
 * <p>
 * Grammar:
 * <pre>
 *  Statement: ( Expr ( ':=' Expr )? )?
 *  Expr:      Primary ( BinOp Expr | Primary )*      -- a bare Primary is implicit multiplication
 *  Primary:   Number | Name | '-' Expr | '(' ( Expr ( ',' Expr )* )? ')'
 *  BinOp:     '=' | '+' | '-' | '*' | '/' | '%' | '^'
 * </pre>
 * Binding powers come from {@link Op}; unary minus binds at {@value #UNARY_MINUS_BINDING_POWER} and reads
 * {@code -x} as {@code 0 − x}.
 * <p>
 * Both the nesting of the input and the height of the resulting tree are bounded by {@code maxDepth}, so a long
 * operator run such as {@code x + x + … + x} counts one level per operator.
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 1_000;

    static final int UNARY_MINUS_BINDING_POWER = 8;

    private final List<Token> tokens;
    private final int maxDepth;
    private int position;
    private int depth;

    public Parser(final List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public Parser(final List<Token> tokens, final int maxDepth) {
        assert tokens != null;
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.tokens = List.copyOf(tokens);
        this.maxDepth = maxDepth;
    }

    public Expr parse() {
        position = 0;
        depth = 0;
        if (tokens.isEmpty()) {
            return TupleExpr.empty();
        }

        Expr expr = parseExpression(0).expr();

        if (matches(Symbol.ASSIGN)) {
            position++;
            if (!(expr instanceof NameExpr)) {
                throw new AssignTargetException(expr);
            }
            expr = new AssignExpr(expr, parseExpression(0).expr());
        }

        Optional<Token> trailing = peek();
        if (trailing.isPresent()) {
            throw ParseException.unexpected(trailing.get());
        }

        return expr;
    }

    private Node parseExpression(final int minBindingPower) {
        if (++depth > maxDepth) {
            throw ExpressionTooComplexException.nestedTooDeeply(maxDepth);
        }
        try {
            return parseOperators(parsePrimary(), minBindingPower);
        }
        finally {
            depth--;
        }
    }

    private Node parseOperators(final Node first, final int minBindingPower) {
        Node left = first;

        Optional<Token> next;
        while ((next = peek()).isPresent()) {
            Token token = next.get();

            Op op;
            if (startsPrimary(token)) {
                op = Op.ADJACENT;
            }
            else {
                Optional<Op> binary = binaryOp(token);
                if (binary.isEmpty()) {
                    break;
                }
                op = binary.get();
            }

            if (op.leftBindingPower() <= minBindingPower) {
                break;
            }
            if (op != Op.ADJACENT) {
                position++;
            }

            Node right = parseExpression(op.rightBindingPower());
            left = node(new BinaryExpr(left.expr(), op, right.expr()), Math.max(left.height(), right.height()) + 1);
        }

        return left;
    }

    private Node parsePrimary() {
        Token token = peek().orElseThrow(ParseException::unterminated);
        position++;

        if (token instanceof Token.NumberToken number) {
            return new Node(new NumberExpr(number.value()), 0);
        }
        if (token instanceof Token.NameToken name) {
            Expr leaf = switch (name.name()) {
                case "true" -> new BooleanExpr(true);
                case "false" -> new BooleanExpr(false);
                default -> new NameExpr(name.name());
            };
            return new Node(leaf, 0);
        }
        if (token instanceof Token.SymbolToken symbol) {
            if (symbol.symbol() == Symbol.MINUS) {
                Node operand = parseExpression(UNARY_MINUS_BINDING_POWER);
                return node(new BinaryExpr(Expr.number(0), Op.SUBTRACT, operand.expr()), operand.height() + 1);
            }
            if (symbol.symbol() == Symbol.LEFT_PAREN) {
                return parseGroup();
            }
        }

        throw ParseException.unexpected(token);
    }

    private Node parseGroup() {
        if (matches(Symbol.RIGHT_PAREN)) {
            position++;
            return new Node(TupleExpr.empty(), 0);
        }

        List<Node> elements = new ArrayList<>();
        elements.add(parseExpression(0));
        while (matches(Symbol.COMMA)) {
            position++;
            elements.add(parseExpression(0));
        }

        Token closing = peek().orElseThrow(ParseException::unterminated);
        if (!matches(Symbol.RIGHT_PAREN)) {
            throw ParseException.unexpected(closing);
        }
        position++;

        if (elements.size() == 1) {
            return elements.get(0);
        }
        int height = 0;
        List<Expr> exprs = new ArrayList<>();
        for (Node element : elements) {
            height = Math.max(height, element.height());
            exprs.add(element.expr());
        }
        return node(new TupleExpr(exprs), height + 1);
    }

    private Node node(final Expr expr, final int height) {
        if (height > maxDepth) {
            throw ExpressionTooComplexException.nestedTooDeeply(maxDepth);
        }
        return new Node(expr, height);
    }

    private Optional<Token> peek() {
        return position < tokens.size() ? Optional.of(tokens.get(position)) : Optional.empty();
    }

    private boolean matches(final Symbol symbol) {
        return peek()
                .filter(token -> token instanceof Token.SymbolToken s && s.symbol() == symbol)
                .isPresent();
    }

    private static boolean startsPrimary(final Token token) {
        return token instanceof Token.NumberToken
                || token instanceof Token.NameToken
                || (token instanceof Token.SymbolToken s && s.symbol() == Symbol.LEFT_PAREN);
    }

    private static Optional<Op> binaryOp(final Token token) {
        if (token instanceof Token.SymbolToken s) {
            return s.symbol().binaryOp();
        }
        return Optional.empty();
    }

    /**
     * A parsed subtree with the number of levels below its root.
     */
    private record Node(Expr expr, int height) {
    }
}
