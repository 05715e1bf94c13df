package org.qroute.ast;

/**
 * Closed set of expression node kinds.
 */
public enum ExprKind {
    INT,
    REAL,
    PI,
    VAR,
    BINARY,
    UNARY
}
