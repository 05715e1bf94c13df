package org.qroute.ast;

import java.util.Objects;

/**
 * Measurement {@code measure qArg -> cArg}.
 */
public record MeasureStmt(Position pos, VarAccess qArg, VarAccess cArg) implements QuantumOp {

    public MeasureStmt {
        pos = Objects.requireNonNull(pos, "pos");
        qArg = Objects.requireNonNull(qArg, "qArg");
        cArg = Objects.requireNonNull(cArg, "cArg");
    }

    @Override
    public StmtKind kind() {
        return StmtKind.MEASURE;
    }

    @Override
    public String toString() {
        return "measure " + qArg + " -> " + cArg + ";";
    }
}
