package org.qroute.ast;

import java.util.Objects;

/**
 * Directed two-qubit primitive {@code CX ctrl,tgt}.
 */
public record CNOTGate(Position pos, VarAccess ctrl, VarAccess tgt) implements Gate {

    public CNOTGate {
        pos = Objects.requireNonNull(pos, "pos");
        ctrl = Objects.requireNonNull(ctrl, "ctrl");
        tgt = Objects.requireNonNull(tgt, "tgt");
    }

    @Override
    public StmtKind kind() {
        return StmtKind.CNOT_GATE;
    }

    @Override
    public String toString() {
        return "CX " + ctrl + "," + tgt + ";";
    }
}
