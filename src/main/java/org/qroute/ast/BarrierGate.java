package org.qroute.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Scheduling barrier across a set of qubits.
 */
public record BarrierGate(Position pos, List<VarAccess> args) implements Gate {

    public BarrierGate {
        pos = Objects.requireNonNull(pos, "pos");
        args = List.copyOf(args);
    }

    @Override
    public StmtKind kind() {
        return StmtKind.BARRIER_GATE;
    }

    @Override
    public String toString() {
        return "barrier " + args.stream().map(VarAccess::toString).collect(Collectors.joining(",")) + ";";
    }
}
