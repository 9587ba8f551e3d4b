package org.kidoni.calculator.rewrite;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.kidoni.calculator.expr.DivisionByZeroException;
import org.kidoni.calculator.expr.Expr;
import org.kidoni.calculator.expr.Expr.BooleanExpr;
import org.kidoni.calculator.expr.Expr.TupleExpr;
import org.kidoni.calculator.expr.ExpressionTooComplexException;
import org.kidoni.calculator.expr.Op;
import org.kidoni.calculator.expr.Rational;
import org.kidoni.calculator.parse.Lexer;
import org.kidoni.calculator.parse.Parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.kidoni.calculator.expr.Expr.binary;
import static org.kidoni.calculator.expr.Expr.name;
import static org.kidoni.calculator.expr.Expr.number;

class SimplifierTest {
    private final Normalizer normalizer = new Normalizer();
    private final Simplifier simplifier = new Simplifier();

    private Expr parse(final String text) {
        return new Parser(new Lexer(text).tokenize()).parse();
    }

    private Expr simplify(final String text) {
        return simplifier.simplify(normalizer.normalize(parse(text)));
    }

    @Test
    void likeTermsMerge() {
        assertEquals(simplify("5 x"), simplify("2 x + 3 x"));
        assertEquals(binary(number(5), Op.MULTIPLY, name("x")), simplify("2 x + 3 x"));
    }

    @Test
    void exponentFolding() {
        assertEquals(number(8), simplify("2 ^ 3"));
        assertEquals(number(Rational.of(1, 2)), simplify("2 ^ -1"));
        assertEquals(number(Rational.of(9, 4)), simplify("(2 / 3) ^ -2"));
        assertEquals(number(1), simplify("5 ^ 0"));
    }

    @Test
    void nonIntegerExponentsStaySymbolic() {
        assertEquals(binary(number(4), Op.EXPONENT, number(Rational.of(1, 2))), simplify("4 ^ (1 / 2)"));
        assertEquals("4 ^ (1÷2)", simplify("4 ^ 0.5").toString());
    }

    @Test
    void mergedNumericPowersFoldOnceIntegral() {
        assertEquals(number(2), simplify("2 ^ (1/2) ∙ 2 ^ (1/2)"));
        assertEquals(binary(number(2), Op.EXPONENT, number(Rational.of(5, 6))), simplify("2 ^ (1/2) 2 ^ (1/3)"));
    }

    @Test
    void divisionByZero() {
        assertThrows(DivisionByZeroException.class, () -> simplify("1 / 0"));
        assertThrows(DivisionByZeroException.class, () -> simplify("x / (2 - 2)"));
        assertThrows(DivisionByZeroException.class, () -> simplify("0 ^ -2"));
        assertThrows(DivisionByZeroException.class, () -> simplify("0 * (1 / 0)"));
        assertThrows(DivisionByZeroException.class, () -> simplify("7 % 0"));
        assertThrows(DivisionByZeroException.class, () -> simplify("x % (1 - 1)"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "x - x                | 0",
            "x / x                | 1",
            "x x                  | x ^ 2",
            "x + 1 + 2            | 3 + x",
            "x - 1                | −1 + x",
            "2 x ∙ 3 y            | 6 ∙ x ∙ y",
            "y + x + y            | 2 ∙ y + x",
            "a - b                | a + −1 ∙ b",
            "x ^ 1                | x",
            "x ^ 0                | 1",
            "(x ^ 2) ^ 3          | x ^ 6",
            "x ^ 2 ∙ x ^ -2       | 1",
            "0 x y                | 0",
            "2 x - x / 2 + 4      | 4 + 3÷2 ∙ x",
            "(x + 1)(x + 1)       | (1 + x) ^ 2",
            "x y - y x            | x ∙ y + −1 ∙ y ∙ x",
            "1 / 3 + 1 / 6        | 1÷2",
            "-(-x)                | x",
            "x ^ y ∙ x ^ y        | (x ^ y) ^ 2",
            "7 % 3                | 1",
            "-7 % 3               | 2",
            "x % 3                | x % 3",
            "x = x                | true",
            "1 = 2                | false",
            "x = y                | x = y",
            "2 + 2 = 4            | true",
    })
    void simplifiedForms(String input, String expected) {
        assertEquals(expected, simplify(input).toString());
    }

    @Test
    void tuplesSimplifyElementWise() {
        assertEquals(new TupleExpr(List.of(number(2), binary(name("x"), Op.EXPONENT, number(2)))), simplify("(1 + 1, x x)"));
        assertEquals(TupleExpr.empty(), simplify("()"));
    }

    @Test
    void booleansAreLeaves() {
        assertEquals(new BooleanExpr(true), simplify("true"));
        assertEquals(new BooleanExpr(false), simplify("true = false"));
    }

    @Test
    void negativeOneIsAFixedPointByDefault() {
        assertEquals(number(-1), simplify("(-1) ^ 2"));
        assertEquals(number(-1), simplify("(-1) ^ 3"));
        assertEquals(number(1), simplify("1 ^ (1 / 2)"));
    }

    @Test
    void negativeOneAlternatesWhenEnabled() {
        var alternating = new Simplifier(Simplifier.DEFAULT_MAX_CHAIN_LENGTH, true);
        assertEquals(number(1), alternating.simplify(normalizer.normalize(parse("(-1) ^ 2"))));
        assertEquals(number(-1), alternating.simplify(normalizer.normalize(parse("(-1) ^ 3"))));
        assertEquals(binary(number(-1), Op.EXPONENT, number(Rational.of(1, 2))),
                alternating.simplify(normalizer.normalize(parse("(-1) ^ (1 / 2)"))));
    }

    @Test
    void overlongChainsAreRejected() {
        var bounded = new Simplifier(3, false);
        var normalized = normalizer.normalize(parse("a + b + c + d"));
        assertThrows(ExpressionTooComplexException.class, () -> bounded.simplify(normalized));
        assertEquals(binary(name("a"), Op.ADD, binary(name("b"), Op.ADD, name("c"))),
                bounded.simplify(normalizer.normalize(parse("a + b + c"))));
    }

    @Test
    void invalidChainLimit() {
        assertThrows(IllegalArgumentException.class, () -> new Simplifier(0, false));
        assertThrows(IllegalArgumentException.class, () -> new Simplifier(10, 0, false));
    }

    @Test
    void hugeExponentsStaySymbolic() {
        assertEquals(binary(number(10), Op.EXPONENT, number(Integer.MAX_VALUE)), simplify("10 ^ 2147483647"));
        assertEquals(binary(number(2), Op.EXPONENT, number(Integer.MIN_VALUE)), simplify("2 ^ -2147483648"));
        assertEquals(binary(number(3), Op.EXPONENT, number(999_999_999)), simplify("3 ^ 999999999"));
        assertEquals(number(1), simplify("10 ^ 2147483647 ∙ 10 ^ -2147483647"));
        assertEquals(number(1), simplify("1 ^ 2147483647"));
        assertEquals(number(0), simplify("0 ^ 2147483647"));
        assertThrows(DivisionByZeroException.class, () -> simplify("0 ^ -2147483648"));
    }

    @Test
    void exponentLimitIsConfigurable() {
        assertEquals(number(Rational.of(BigInteger.TWO.pow(10_000))), simplify("2 ^ 10000"));

        var bounded = new Simplifier(Simplifier.DEFAULT_MAX_CHAIN_LENGTH, 8, false);
        assertEquals(number(256), bounded.simplify(normalizer.normalize(parse("2 ^ 8"))));
        assertEquals(binary(number(2), Op.EXPONENT, number(9)), bounded.simplify(normalizer.normalize(parse("2 ^ 9"))));
    }

    @Test
    void foldedPowersAreBoundedBySize() {
        var power = simplify("(10 ^ 5000) ^ 1000");
        assertEquals(Op.EXPONENT, ((Expr.BinaryExpr) power).op());
        assertEquals(number(1000), ((Expr.BinaryExpr) power).right());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "2 x + 3 x",
            "2 x - x / 2 + 4",
            "(x + 1) ^ 2 (x + 1)",
            "x ^ y x ^ y",
            "a b c - c b a + 2 a b c",
            "2 ^ (1/2) 3 ^ (1/2) 2 ^ (1/2)",
            "(1, x - 1, y / y)",
            "x = 2 x - x",
            "1 / 7 + x % 4",
            "-x ^ 2 + (x ^ 3) ^ -1",
    })
    void simplificationIsIdempotent(String text) {
        var once = simplify(text);
        var twice = simplifier.simplify(normalizer.normalize(once));
        assertEquals(once, twice);
    }
}
