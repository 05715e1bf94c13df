package org.qroute.ast;

import java.util.Objects;

/**
 * The constant {@code pi}.
 */
public record PiExpr(Position pos) implements Expr {

    public PiExpr {
        pos = Objects.requireNonNull(pos, "pos");
    }

    @Override
    public ExprKind kind() {
        return ExprKind.PI;
    }

    @Override
    public String toString() {
        return "pi";
    }
}
