package org.qroute.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Application of a declared (or standard library) gate, for example {@code rz(pi/4) q[1]}.
 */
public record DeclaredGate(Position pos, String name, List<Expr> classicalArgs, List<VarAccess> quantumArgs)
        implements Gate {

    public DeclaredGate {
        pos = Objects.requireNonNull(pos, "pos");
        name = Objects.requireNonNull(name, "name");
        classicalArgs = List.copyOf(classicalArgs);
        quantumArgs = List.copyOf(quantumArgs);
    }

    @Override
    public StmtKind kind() {
        return StmtKind.DECLARED_GATE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (!classicalArgs.isEmpty()) {
            sb.append('(')
                    .append(classicalArgs.stream().map(Expr::toString).collect(Collectors.joining(",")))
                    .append(')');
        }
        return sb.append(' ')
                .append(quantumArgs.stream().map(VarAccess::toString).collect(Collectors.joining(",")))
                .append(';')
                .toString();
    }
}
