package org.kidoni.calculator.rewrite;

import org.kidoni.calculator.expr.Expr;
import org.kidoni.calculator.expr.Expr.BinaryExpr;
import org.kidoni.calculator.expr.Expr.NumberExpr;
import org.kidoni.calculator.expr.Op;
import org.kidoni.calculator.expr.Rational;

/**
 * One collected operand of a chain while it is being simplified: {@code coefficient ∙ base ^ exponent}. Sums only
 * use the coefficient, products only the exponent.
 */
record Term(Rational coefficient, Expr base, Rational exponent) {
    /**
     * Splits a leading numeric factor off a summand: {@code 3 ∙ x ∙ y} is {@code (3, x ∙ y)}.
     */
    static Term ofAddend(final Expr addend) {
        if (addend instanceof BinaryExpr binary
                && binary.op() == Op.MULTIPLY
                && binary.left() instanceof NumberExpr number) {
            return new Term(number.value(), binary.right(), Rational.ONE);
        }
        return new Term(Rational.ONE, addend, Rational.ONE);
    }

    /**
     * Splits a numeric exponent off a factor: {@code x ^ 2} is {@code (x, 2)}.
     */
    static Term ofFactor(final Expr factor) {
        if (factor instanceof BinaryExpr binary
                && binary.op() == Op.EXPONENT
                && binary.right() instanceof NumberExpr number) {
            return new Term(Rational.ONE, binary.left(), number.value());
        }
        return new Term(Rational.ONE, factor, Rational.ONE);
    }

    Term plusCoefficient(final Rational amount) {
        return new Term(coefficient.add(amount), base, exponent);
    }

    Term plusExponent(final Rational amount) {
        return new Term(coefficient, base, exponent.add(amount));
    }

    Expr toAddend() {
        if (coefficient.isOne()) {
            return base;
        }
        return new BinaryExpr(new NumberExpr(coefficient), Op.MULTIPLY, base);
    }

    Expr toFactor() {
        if (exponent.isOne()) {
            return base;
        }
        return new BinaryExpr(base, Op.EXPONENT, new NumberExpr(exponent));
    }
}
