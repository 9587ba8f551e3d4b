package org.kidoni.calculator.parse;

import org.kidoni.calculator.expr.Expr;

/**
 * The left side of {@code :=} was not a bare name.
 */
public class AssignTargetException extends ParseException {
    private final transient Expr target;

    public AssignTargetException(final Expr target) {
        super("cannot assign to '" + target + "': target must be a name");
        this.target = target;
    }

    public Expr getTarget() {
        return target;
    }
}
