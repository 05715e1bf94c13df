package org.qroute.ast;

import java.util.Objects;

/**
 * Parametrized single-qubit primitive {@code U(theta,phi,lambda) arg}.
 */
public record UGate(Position pos, Expr theta, Expr phi, Expr lambda, VarAccess arg) implements Gate {

    public UGate {
        pos = Objects.requireNonNull(pos, "pos");
        theta = Objects.requireNonNull(theta, "theta");
        phi = Objects.requireNonNull(phi, "phi");
        lambda = Objects.requireNonNull(lambda, "lambda");
        arg = Objects.requireNonNull(arg, "arg");
    }

    @Override
    public StmtKind kind() {
        return StmtKind.U_GATE;
    }

    @Override
    public String toString() {
        return "U(" + theta + "," + phi + "," + lambda + ") " + arg + ";";
    }
}
