package org.kidoni.calculator.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression tree. Every variant is an immutable record compared structurally, so a rewrite always builds a new
 * tree and two trees of the same shape are {@code equals}.
 * <p>
 * {@code toString()} renders the canonical symbolic form, inserting parentheses only where reading the text back
 * would otherwise produce a different tree.
 */
public sealed interface Expr {
    static NumberExpr number(final long value) {
        return new NumberExpr(Rational.of(value));
    }

    static NumberExpr number(final Rational value) {
        return new NumberExpr(value);
    }

    static NameExpr name(final String name) {
        return new NameExpr(name);
    }

    static BinaryExpr binary(final Expr left, final Op op, final Expr right) {
        return new BinaryExpr(left, op, right);
    }

    record NumberExpr(Rational value) implements Expr {
        public NumberExpr {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record NameExpr(String name) implements Expr {
        public NameExpr {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record BooleanExpr(boolean value) implements Expr {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record TupleExpr(List<Expr> elements) implements Expr {
        public TupleExpr {
            elements = List.copyOf(elements);
        }

        public static TupleExpr empty() {
            return new TupleExpr(List.of());
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        @Override
        public String toString() {
            return elements.stream()
                    .map(Expr::toString)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
    }

    record AssignExpr(Expr target, Expr value) implements Expr {
        public AssignExpr {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return target + " := " + value;
        }
    }

    record BinaryExpr(Expr left, Op op, Expr right) implements Expr {
        private static final int UNARY_MINUS_PRECEDENCE = 8;

        public BinaryExpr {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            String lhs = operand(left, true);
            String rhs = operand(right, false);
            if (op == Op.ADJACENT) {
                return lhs + " " + rhs;
            }
            return lhs + " " + op.symbol() + " " + rhs;
        }

        private String operand(final Expr child, final boolean leftSide) {
            return needsParentheses(child, leftSide) ? "(" + child + ")" : child.toString();
        }

        private boolean needsParentheses(final Expr child, final boolean leftSide) {
            if (child instanceof AssignExpr) {
                return true;
            }
            if (child instanceof NumberExpr number) {
                Rational value = number.value();
                // "a -1" would read back as a subtraction
                if (value.signum() < 0 && op == Op.ADJACENT) {
                    return true;
                }
                if (!value.isInteger()) {
                    return needsParentheses(Op.DIVIDE, leftSide);
                }
                return value.signum() < 0 && UNARY_MINUS_PRECEDENCE < op.precedence();
            }
            if (child instanceof BinaryExpr binary) {
                return needsParentheses(binary.op(), leftSide);
            }
            return false;
        }

        private boolean needsParentheses(final Op childOp, final boolean leftSide) {
            if (childOp.precedence() != op.precedence()) {
                return childOp.precedence() < op.precedence();
            }
            if (op.isRightAssociative()) {
                return leftSide;
            }
            if (leftSide) {
                return false;
            }
            return !op.isAssociative() || childOp == Op.MODULUS;
        }
    }
}
