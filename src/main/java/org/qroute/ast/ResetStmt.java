package org.qroute.ast;

import java.util.Objects;

/**
 * Qubit reset.
 */
public record ResetStmt(Position pos, VarAccess arg) implements QuantumOp {

    public ResetStmt {
        pos = Objects.requireNonNull(pos, "pos");
        arg = Objects.requireNonNull(arg, "arg");
    }

    @Override
    public StmtKind kind() {
        return StmtKind.RESET;
    }

    @Override
    public String toString() {
        return "reset " + arg + ";";
    }
}
