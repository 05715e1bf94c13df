package org.qroute.ast;

import java.util.Objects;

/**
 * Binary arithmetic expression {@code lexp op rexp}.
 */
public record BinaryExpr(Position pos, Expr lexp, BinaryOp op, Expr rexp) implements Expr {

    public BinaryExpr {
        pos = Objects.requireNonNull(pos, "pos");
        lexp = Objects.requireNonNull(lexp, "lexp");
        op = Objects.requireNonNull(op, "op");
        rexp = Objects.requireNonNull(rexp, "rexp");
    }

    @Override
    public ExprKind kind() {
        return ExprKind.BINARY;
    }

    @Override
    public String toString() {
        return "(" + lexp + op.symbol() + rexp + ")";
    }
}
