package org.qroute.ast;

import java.util.Objects;

/**
 * Reference to a classical gate parameter.
 */
public record VarExpr(Position pos, String var) implements Expr {

    public VarExpr {
        pos = Objects.requireNonNull(pos, "pos");
        var = Objects.requireNonNull(var, "var");
    }

    @Override
    public ExprKind kind() {
        return ExprKind.VAR;
    }

    @Override
    public String toString() {
        return var;
    }
}
