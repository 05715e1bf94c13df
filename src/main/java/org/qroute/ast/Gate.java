package org.qroute.ast;

/**
 * Unitary gate application; the only statements allowed in a gate declaration body.
 */
public interface Gate extends QuantumOp {
}
