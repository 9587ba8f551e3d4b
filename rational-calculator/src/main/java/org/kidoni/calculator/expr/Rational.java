package org.kidoni.calculator.expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable arbitrary-precision fraction. Always reduced to lowest terms, the sign lives on the numerator and the
 * denominator is strictly positive, so two equal values are also {@link #equals(Object) equal} structurally.
 */
public final class Rational implements Comparable<Rational> {
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    private static final String ELLIPSIS = "…";
    private static final char MINUS = '−';

    private final BigInteger numerator;
    private final BigInteger denominator;

    private Rational(final BigInteger numerator, final BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Rational of(final long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(final long numerator, final long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational of(final BigInteger value) {
        return new Rational(Objects.requireNonNull(value, "value"), BigInteger.ONE);
    }

    public static Rational of(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.signum() == 0) {
            throw new DivisionByZeroException();
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        return new Rational(numerator, denominator);
    }

    /**
     * Exact conversion: {@code 12.50} becomes {@code 25/2}.
     */
    public static Rational of(final BigDecimal value) {
        if (value.scale() <= 0) {
            return of(value.toBigIntegerExact());
        }
        return of(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
    }

    public BigInteger numerator() {
        return numerator;
    }

    public BigInteger denominator() {
        return denominator;
    }

    public Rational add(final Rational other) {
        if (denominator.equals(other.denominator)) {
            return of(numerator.add(other.numerator), denominator);
        }
        return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational subtract(final Rational other) {
        return add(other.negate());
    }

    public Rational multiply(final Rational other) {
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational divide(final Rational other) {
        if (other.isZero()) {
            throw new DivisionByZeroException();
        }
        return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    /**
     * Floored remainder: the result takes the sign of {@code divisor}, so {@code -7 % 3} is {@code 2}.
     */
    public Rational remainder(final Rational divisor) {
        if (divisor.isZero()) {
            throw new DivisionByZeroException("modulus by zero");
        }
        Rational quotient = divide(divisor);
        return subtract(divisor.multiply(of(quotient.floor())));
    }

    public Rational negate() {
        return isZero() ? this : new Rational(numerator.negate(), denominator);
    }

    public Rational reciprocal() {
        if (isZero()) {
            throw new DivisionByZeroException();
        }
        return of(denominator, numerator);
    }

    /**
     * Raises to an integer power. Numerator and denominator are powered independently, a negative exponent takes
     * the reciprocal first.
     *
     * @throws ExpressionTooComplexException when the result cannot be represented
     */
    public Rational pow(final int exponent) {
        if (exponent < 0) {
            if (exponent == Integer.MIN_VALUE) {
                throw new ExpressionTooComplexException("exponent out of range: " + exponent);
            }
            return reciprocal().pow(-exponent);
        }
        try {
            return new Rational(numerator.pow(exponent), denominator.pow(exponent));
        }
        catch (ArithmeticException e) {
            throw new ExpressionTooComplexException("power " + this + " ^ " + exponent + " is out of range", e);
        }
    }

    /**
     * Bit length of the larger of numerator and denominator.
     */
    public int bitLength() {
        return Math.max(numerator.bitLength(), denominator.bitLength());
    }

    public BigInteger floor() {
        BigInteger[] qr = numerator.divideAndRemainder(denominator);
        if (numerator.signum() < 0 && qr[1].signum() != 0) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    public int signum() {
        return numerator.signum();
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return equals(ONE);
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    /**
     * Decimal rendering truncated to {@code precision} fractional digits. Exact expansions drop trailing zeros,
     * truncated ones end with an ellipsis.
     */
    public String toDecimalString(final int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must not be negative: " + precision);
        }
        BigInteger scaled = numerator.abs().multiply(BigInteger.TEN.pow(precision));
        boolean exact = scaled.mod(denominator).signum() == 0;

        BigDecimal magnitude = new BigDecimal(numerator.abs())
                .divide(new BigDecimal(denominator), precision, RoundingMode.DOWN);

        StringBuilder builder = new StringBuilder();
        if (signum() < 0) {
            builder.append(MINUS);
        }
        if (exact) {
            builder.append(magnitude.stripTrailingZeros().toPlainString());
        }
        else {
            builder.append(magnitude.toPlainString()).append(ELLIPSIS);
        }
        return builder.toString();
    }

    @Override
    public int compareTo(final Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Rational other)) {
            return false;
        }
        return numerator.equals(other.numerator) && denominator.equals(other.denominator);
    }

    @Override
    public int hashCode() {
        return 31 * numerator.hashCode() + denominator.hashCode();
    }

    @Override
    public String toString() {
        String magnitude = isInteger() ? numerator.abs().toString() : numerator.abs() + "÷" + denominator;
        return signum() < 0 ? MINUS + magnitude : magnitude;
    }
}
