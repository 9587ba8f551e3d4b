package org.kidoni.calculator.rewrite;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;

import org.kidoni.calculator.expr.DivisionByZeroException;
import org.kidoni.calculator.expr.Expr;
import org.kidoni.calculator.expr.Expr.AssignExpr;
import org.kidoni.calculator.expr.Expr.BinaryExpr;
import org.kidoni.calculator.expr.Expr.BooleanExpr;
import org.kidoni.calculator.expr.Expr.NumberExpr;
import org.kidoni.calculator.expr.Expr.TupleExpr;
import org.kidoni.calculator.expr.ExpressionTooComplexException;
import org.kidoni.calculator.expr.Op;
import org.kidoni.calculator.expr.Rational;

/**
 * Collects and folds terms of a {@link Normalizer normalized} tree.
 * <p>
 * Sums merge structurally equal summands by adding their coefficients and gather every number into one leading
 * constant. Products merge structurally equal bases by adding exponents and gather every number into one leading
 * coefficient. Numeric powers fold only for integer exponents no larger than the configured maximum, and only when
 * the folded value stays below {@value #MAX_FOLDED_BITS} bits; anything bigger stays symbolic. Merged terms keep the
 * position of their first occurrence, so equal input always gives equal output.
 */
public class Simplifier {
    public static final int DEFAULT_MAX_CHAIN_LENGTH = 10_000;
    public static final int DEFAULT_MAX_EXPONENT = 10_000;

    static final long MAX_FOLDED_BITS = 1L << 20;

    private final int maxChainLength;
    private final int maxExponent;
    private final boolean alternateNegativeOne;

    public Simplifier() {
        this(DEFAULT_MAX_CHAIN_LENGTH, DEFAULT_MAX_EXPONENT, false);
    }

    public Simplifier(final int maxChainLength, final boolean alternateNegativeOne) {
        this(maxChainLength, DEFAULT_MAX_EXPONENT, alternateNegativeOne);
    }

    /**
     * @param maxChainLength longest {@code +} or {@code ∙} chain accepted; merging is quadratic in its length
     * @param maxExponent largest exponent magnitude folded into a number
     * @param alternateNegativeOne fold {@code (−1)^n} by the parity of {@code n} instead of always to {@code −1}
     */
    public Simplifier(final int maxChainLength, final int maxExponent, final boolean alternateNegativeOne) {
        if (maxChainLength < 1) {
            throw new IllegalArgumentException("maxChainLength must be positive: " + maxChainLength);
        }
        if (maxExponent < 1) {
            throw new IllegalArgumentException("maxExponent must be positive: " + maxExponent);
        }
        this.maxChainLength = maxChainLength;
        this.maxExponent = maxExponent;
        this.alternateNegativeOne = alternateNegativeOne;
    }

    public Expr simplify(final Expr expr) {
        if (expr instanceof BinaryExpr binary) {
            return switch (binary.op()) {
                case ADD -> simplifySum(binary);
                case MULTIPLY -> simplifyProduct(binary);
                case EXPONENT -> simplifyPower(simplify(binary.left()), simplify(binary.right()));
                case MODULUS -> simplifyModulus(simplify(binary.left()), simplify(binary.right()));
                case EQUALS -> simplifyEquals(simplify(binary.left()), simplify(binary.right()));
                default -> Expr.binary(simplify(binary.left()), binary.op(), simplify(binary.right()));
            };
        }
        if (expr instanceof TupleExpr tuple) {
            return new TupleExpr(tuple.elements().stream().map(this::simplify).toList());
        }
        if (expr instanceof AssignExpr assign) {
            return new AssignExpr(assign.target(), simplify(assign.value()));
        }
        return expr;
    }

    private Expr simplifySum(final BinaryExpr sum) {
        Rational constant = Rational.ZERO;
        List<Term> terms = new ArrayList<>();

        for (Expr addend : operands(Op.ADD, sum)) {
            for (Expr part : operands(Op.ADD, simplify(addend))) {
                if (part instanceof NumberExpr number) {
                    constant = constant.add(number.value());
                }
                else {
                    merge(terms, Term.ofAddend(part), (kept, next) -> kept.plusCoefficient(next.coefficient()));
                }
            }
        }

        List<Expr> result = new ArrayList<>();
        if (!constant.isZero()) {
            result.add(Expr.number(constant));
        }
        for (Term term : terms) {
            if (!term.coefficient().isZero()) {
                result.add(term.toAddend());
            }
        }

        return result.isEmpty() ? Expr.number(0) : Chains.rebuild(Op.ADD, result);
    }

    private Expr simplifyProduct(final BinaryExpr product) {
        Rational coefficient = Rational.ONE;
        List<Term> terms = new ArrayList<>();

        // every factor is simplified before a zero coefficient may discard it, so 0 ∙ 0^−1 still fails
        for (Expr factor : operands(Op.MULTIPLY, product)) {
            for (Expr part : operands(Op.MULTIPLY, simplify(factor))) {
                if (part instanceof NumberExpr number) {
                    coefficient = coefficient.multiply(number.value());
                }
                else {
                    merge(terms, Term.ofFactor(part), (kept, next) -> kept.plusExponent(next.exponent()));
                }
            }
        }

        List<Expr> result = new ArrayList<>();
        for (Term term : terms) {
            if (term.exponent().isZero()) {
                continue;
            }
            if (term.base() instanceof NumberExpr number) {
                Optional<Rational> folded = foldPower(number.value(), term.exponent());
                if (folded.isPresent()) {
                    coefficient = coefficient.multiply(folded.get());
                    continue;
                }
            }
            result.add(term.toFactor());
        }

        if (coefficient.isZero()) {
            return Expr.number(0);
        }
        if (!coefficient.isOne()) {
            result.add(0, Expr.number(coefficient));
        }

        return result.isEmpty() ? Expr.number(1) : Chains.rebuild(Op.MULTIPLY, result);
    }

    private Expr simplifyPower(final Expr base, final Expr exponent) {
        if (exponent instanceof NumberExpr power) {
            Rational n = power.value();
            if (base instanceof NumberExpr number) {
                return foldPower(number.value(), n)
                        .<Expr>map(NumberExpr::new)
                        .orElseGet(() -> Expr.binary(base, Op.EXPONENT, exponent));
            }
            if (n.isOne()) {
                return base;
            }
            if (n.isZero()) {
                return Expr.number(1);
            }
            if (n.isInteger()
                    && base instanceof BinaryExpr inner
                    && inner.op() == Op.EXPONENT
                    && inner.right() instanceof NumberExpr innerPower) {
                return simplifyPower(inner.left(), Expr.number(innerPower.value().multiply(n)));
            }
        }
        return Expr.binary(base, Op.EXPONENT, exponent);
    }

    /**
     * Exact numeric power, or empty when the result must stay symbolic.
     */
    private Optional<Rational> foldPower(final Rational base, final Rational exponent) {
        if (base.isOne()) {
            return Optional.of(Rational.ONE);
        }
        if (base.isZero() && exponent.isInteger()) {
            if (exponent.signum() < 0) {
                throw new DivisionByZeroException();
            }
            return Optional.of(exponent.isZero() ? Rational.ONE : Rational.ZERO);
        }
        if (base.equals(Rational.MINUS_ONE)) {
            if (!alternateNegativeOne) {
                return Optional.of(Rational.MINUS_ONE);
            }
            if (exponent.isInteger()) {
                return Optional.of(exponent.numerator().testBit(0) ? Rational.MINUS_ONE : Rational.ONE);
            }
            return Optional.empty();
        }
        if (!exponent.isInteger()) {
            return Optional.empty();
        }
        BigInteger magnitude = exponent.numerator().abs();
        if (magnitude.compareTo(BigInteger.valueOf(maxExponent)) > 0
                || (long) base.bitLength() * magnitude.longValue() > MAX_FOLDED_BITS) {
            return Optional.empty();
        }
        return Optional.of(base.pow(exponent.numerator().intValue()));
    }

    private Expr simplifyModulus(final Expr dividend, final Expr divisor) {
        if (divisor instanceof NumberExpr d) {
            if (d.value().isZero()) {
                throw new DivisionByZeroException("modulus by zero");
            }
            if (dividend instanceof NumberExpr n) {
                return Expr.number(n.value().remainder(d.value()));
            }
        }
        return Expr.binary(dividend, Op.MODULUS, divisor);
    }

    private Expr simplifyEquals(final Expr left, final Expr right) {
        if (left.equals(right)) {
            return new BooleanExpr(true);
        }
        if ((left instanceof NumberExpr && right instanceof NumberExpr)
                || (left instanceof BooleanExpr && right instanceof BooleanExpr)) {
            return new BooleanExpr(false);
        }
        return Expr.binary(left, Op.EQUALS, right);
    }

    private List<Expr> operands(final Op op, final Expr expr) {
        List<Expr> operands = new ArrayList<>();
        Chains.flatten(op, expr, operands);
        if (operands.size() > maxChainLength) {
            throw ExpressionTooComplexException.chainTooLong(operands.size(), maxChainLength);
        }
        return operands;
    }

    private static void merge(final List<Term> terms, final Term term, final BinaryOperator<Term> combine) {
        for (int i = 0; i < terms.size(); i++) {
            if (terms.get(i).base().equals(term.base())) {
                terms.set(i, combine.apply(terms.get(i), term));
                return;
            }
        }
        terms.add(term);
    }
}
