package org.qroute.ast.replace;

import org.qroute.ast.Expr;
import org.qroute.ast.Stmt;
import org.qroute.ast.VarAccess;

/**
 * Rewrite rules consulted by {@link TreeReplacer} at every node.
 *
 * <p>Implementations dispatch on the node-kind tag ({@code stmt.kind()}) with an
 * exhaustive switch. Nodes handed to a hook have already had their children
 * rewritten.</p>
 */
public interface Transformation {

    /**
     * Decides whether the engine rewrites a statement's children before offering the
     * statement to {@link #replaceStmt(Stmt)}. When false, no hook sees anything
     * inside the statement.
     */
    default boolean descendInto(Stmt stmt) {
        return true;
    }

    /**
     * Decides what happens to a statement after its children were rewritten.
     */
    Replacement<Stmt> replaceStmt(Stmt stmt);

    /**
     * Decides what happens to an expression. Only KEEP or ONE are accepted.
     */
    default Replacement<Expr> replaceExpr(Expr expr) {
        return Replacement.keep();
    }

    /**
     * Decides what happens to a register reference. Only KEEP or ONE are accepted.
     */
    default Replacement<VarAccess> replaceAccess(VarAccess access) {
        return Replacement.keep();
    }
}
