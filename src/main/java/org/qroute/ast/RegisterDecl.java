package org.qroute.ast;

import java.util.Objects;

/**
 * Quantum ({@code qreg}) or classical ({@code creg}) register declaration.
 */
public record RegisterDecl(Position pos, String id, boolean quantum, int size) implements Stmt {

    public RegisterDecl {
        pos = Objects.requireNonNull(pos, "pos");
        id = Objects.requireNonNull(id, "id");
        if (size <= 0) {
            throw new IllegalArgumentException("register size must be positive: " + size);
        }
    }

    @Override
    public StmtKind kind() {
        return StmtKind.REGISTER_DECL;
    }

    @Override
    public String toString() {
        return (quantum ? "qreg " : "creg ") + id + "[" + size + "];";
    }
}
