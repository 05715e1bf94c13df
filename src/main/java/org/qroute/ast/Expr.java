package org.qroute.ast;

/**
 * Classical parameter expression node.
 */
public interface Expr {

    /**
     * Returns the node-kind tag used for exhaustive dispatch.
     */
    ExprKind kind();

    /**
     * Returns the source position of this node.
     */
    Position pos();
}
