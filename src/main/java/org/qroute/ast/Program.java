package org.qroute.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Root of a program tree: an ordered, mutable sequence of top-level statements.
 *
 * <p>Passes rewrite the statement list in place. The list returned by {@link #body()}
 * is the live list, so statements spliced in by a pass are visible to every holder
 * of this program.</p>
 */
public final class Program {
    private final Position pos;
    private final List<Stmt> body;

    /**
     * Creates a program owning a mutable copy of the given statements.
     *
     * @param pos source position of the program root.
     * @param statements initial top-level statements, in declaration order.
     */
    public Program(Position pos, Collection<? extends Stmt> statements) {
        this.pos = Objects.requireNonNull(pos, "pos");
        this.body = new ArrayList<>(Objects.requireNonNull(statements, "statements"));
    }

    public static Program of(Stmt... statements) {
        return new Program(Position.UNKNOWN, List.of(statements));
    }

    public Position pos() {
        return pos;
    }

    /**
     * Returns the live statement list.
     */
    public List<Stmt> body() {
        return body;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("OPENQASM 2.0;\n");
        for (Stmt stmt : body) {
            sb.append(stmt).append('\n');
        }
        return sb.toString();
    }
}
