package org.qroute.ast;

import java.util.Objects;

/**
 * Local ancilla declaration left behind by oracle synthesis.
 */
public record AncillaDecl(Position pos, String id, boolean dirty, int size) implements Stmt {

    public AncillaDecl {
        pos = Objects.requireNonNull(pos, "pos");
        id = Objects.requireNonNull(id, "id");
    }

    @Override
    public StmtKind kind() {
        return StmtKind.ANCILLA_DECL;
    }

    @Override
    public String toString() {
        return (dirty ? "dirty ancilla " : "ancilla ") + id + "[" + size + "];";
    }
}
