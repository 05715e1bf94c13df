package org.qroute.ast;

import java.util.Objects;

/**
 * Classically controlled operation {@code if (var == value) then}.
 */
public record IfStmt(Position pos, String var, int value, QuantumOp then) implements Stmt {

    public IfStmt {
        pos = Objects.requireNonNull(pos, "pos");
        var = Objects.requireNonNull(var, "var");
        then = Objects.requireNonNull(then, "then");
    }

    /**
     * Wraps another operation under the same classical condition.
     */
    public IfStmt withThen(QuantumOp newThen) {
        return new IfStmt(pos, var, value, newThen);
    }

    @Override
    public StmtKind kind() {
        return StmtKind.IF;
    }

    @Override
    public String toString() {
        return "if(" + var + "==" + value + ") " + then;
    }
}
