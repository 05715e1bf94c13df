package org.qroute.ast;

/**
 * Statement that acts on qubits and may appear under classical control.
 */
public interface QuantumOp extends Stmt {
}
