package org.qroute.ast;

/**
 * Closed set of statement node kinds.
 */
public enum StmtKind {
    REGISTER_DECL,
    ANCILLA_DECL,
    GATE_DECL,
    ORACLE_DECL,
    CNOT_GATE,
    U_GATE,
    BARRIER_GATE,
    DECLARED_GATE,
    MEASURE,
    RESET,
    IF
}
