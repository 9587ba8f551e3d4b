package org.kidoni.calculator.rewrite;

import java.util.ArrayList;
import java.util.List;

import org.kidoni.calculator.expr.Expr;
import org.kidoni.calculator.expr.Expr.AssignExpr;
import org.kidoni.calculator.expr.Expr.BinaryExpr;
import org.kidoni.calculator.expr.Expr.TupleExpr;
import org.kidoni.calculator.expr.Op;

/**
 * Rewrites a parsed tree into canonical operators and shape.
 * <ul>
 *     <li>{@code a b} becomes {@code a ∙ b}</li>
 *     <li>{@code a − b} becomes {@code a + −1 ∙ b}</li>
 *     <li>{@code a ÷ b} becomes {@code a ∙ b ^ −1}</li>
 *     <li>runs of {@code +} or {@code ∙} are rebuilt as one right-nested chain</li>
 * </ul>
 * The result never contains {@link Op#SUBTRACT}, {@link Op#DIVIDE} or {@link Op#ADJACENT}.
 */
public class Normalizer {
    public Expr normalize(final Expr expr) {
        if (expr instanceof BinaryExpr binary) {
            return normalizeBinary(binary);
        }
        if (expr instanceof TupleExpr tuple) {
            return new TupleExpr(tuple.elements().stream().map(this::normalize).toList());
        }
        if (expr instanceof AssignExpr assign) {
            return new AssignExpr(assign.target(), normalize(assign.value()));
        }
        return expr;
    }

    private Expr normalizeBinary(final BinaryExpr binary) {
        Expr left = normalize(binary.left());
        Expr right = normalize(binary.right());

        return switch (binary.op()) {
            case ADJACENT, MULTIPLY -> chain(Op.MULTIPLY, left, right);
            case SUBTRACT -> chain(Op.ADD, left, chain(Op.MULTIPLY, Expr.number(-1), right));
            case DIVIDE -> chain(Op.MULTIPLY, left, Expr.binary(right, Op.EXPONENT, Expr.number(-1)));
            case ADD -> chain(Op.ADD, left, right);
            default -> Expr.binary(left, binary.op(), right);
        };
    }

    /**
     * Joins two already normalized operands under {@code op}, splicing their own {@code op} chains so the result is
     * right-nested whatever the original grouping was.
     */
    static Expr chain(final Op op, final Expr left, final Expr right) {
        List<Expr> operands = new ArrayList<>();
        Chains.flatten(op, left, operands);
        Chains.flatten(op, right, operands);
        return Chains.rebuild(op, operands);
    }
}
