package org.qroute.ast;

/**
 * Statement node of a program tree.
 *
 * <p>Implementations are immutable; passes rewrite a program by replacing statements
 * in the owning list rather than mutating nodes.</p>
 */
public interface Stmt {

    /**
     * Returns the node-kind tag used for exhaustive dispatch.
     */
    StmtKind kind();

    /**
     * Returns the source position of this node.
     */
    Position pos();
}
