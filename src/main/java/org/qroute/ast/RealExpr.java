package org.qroute.ast;

import java.util.Objects;

/**
 * Real literal.
 */
public record RealExpr(Position pos, double value) implements Expr {

    public RealExpr {
        pos = Objects.requireNonNull(pos, "pos");
    }

    @Override
    public ExprKind kind() {
        return ExprKind.REAL;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
