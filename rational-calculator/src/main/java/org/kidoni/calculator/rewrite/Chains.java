package org.kidoni.calculator.rewrite;

import java.util.List;

import org.kidoni.calculator.expr.Expr;
import org.kidoni.calculator.expr.Expr.BinaryExpr;
import org.kidoni.calculator.expr.Op;

final class Chains {
    private Chains() {
    }

    /**
     * Appends the operands of the {@code op} chain rooted at {@code expr}, left to right. Anything else is a single
     * operand.
     */
    static void flatten(final Op op, final Expr expr, final List<Expr> into) {
        Expr current = expr;
        while (current instanceof BinaryExpr binary && binary.op() == op) {
            flatten(op, binary.left(), into);
            current = binary.right();
        }
        into.add(current);
    }

    /**
     * Folds a non-empty operand list into a right-nested chain: {@code a op (b op (c op d))}.
     */
    static Expr rebuild(final Op op, final List<Expr> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("cannot rebuild an empty " + op.name() + " chain");
        }
        Expr result = operands.get(operands.size() - 1);
        for (int i = operands.size() - 2; i >= 0; i--) {
            result = new BinaryExpr(operands.get(i), op, result);
        }
        return result;
    }
}
