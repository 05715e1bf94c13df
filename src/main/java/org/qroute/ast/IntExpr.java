package org.qroute.ast;

import java.util.Objects;

/**
 * Integer literal.
 */
public record IntExpr(Position pos, long value) implements Expr {

    public IntExpr {
        pos = Objects.requireNonNull(pos, "pos");
    }

    @Override
    public ExprKind kind() {
        return ExprKind.INT;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
