package org.qroute.ast;

import java.util.Objects;

/**
 * Negation or built-in function application.
 */
public record UnaryExpr(Position pos, UnaryOp op, Expr subexp) implements Expr {

    public UnaryExpr {
        pos = Objects.requireNonNull(pos, "pos");
        op = Objects.requireNonNull(op, "op");
        subexp = Objects.requireNonNull(subexp, "subexp");
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNARY;
    }

    @Override
    public String toString() {
        return op == UnaryOp.NEG ? "-" + subexp : op.symbol() + "(" + subexp + ")";
    }
}
