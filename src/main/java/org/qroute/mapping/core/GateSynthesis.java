package org.qroute.mapping.core;

import org.qroute.ast.BinaryExpr;
import org.qroute.ast.BinaryOp;
import org.qroute.ast.CNOTGate;
import org.qroute.ast.Gate;
import org.qroute.ast.IntExpr;
import org.qroute.ast.PiExpr;
import org.qroute.ast.Position;
import org.qroute.ast.UGate;
import org.qroute.ast.VarAccess;

import java.util.List;
import java.util.Objects;

/**
 * Builds the primitive nodes emitted by the router, all addressed on one register.
 */
public final class GateSynthesis {
    private final String registerName;

    public GateSynthesis(String registerName) {
        this.registerName = Objects.requireNonNull(registerName, "registerName");
    }

    /**
     * {@code CX reg[control],reg[target]}.
     */
    public CNOTGate cnot(int control, int target, Position pos) {
        return new CNOTGate(pos, VarAccess.of(pos, registerName, control), VarAccess.of(pos, registerName, target));
    }

    /**
     * Hadamard as {@code U(pi/2, 0, pi) reg[qubit]}.
     */
    public UGate hadamard(int qubit, Position pos) {
        return new UGate(
                pos,
                new BinaryExpr(pos, new PiExpr(pos), BinaryOp.DIVIDE, new IntExpr(pos, 2)),
                new IntExpr(pos, 0),
                new PiExpr(pos),
                VarAccess.of(pos, registerName, qubit)
        );
    }

    /**
     * CNOT with control {@code control} and target {@code target}, realized on the
     * opposite native direction: {@code H c; H t; CX t,c; H c; H t}.
     */
    public List<Gate> reversedCnot(int control, int target, Position pos) {
        return List.of(
                hadamard(control, pos),
                hadamard(target, pos),
                cnot(target, control, pos),
                hadamard(control, pos),
                hadamard(target, pos)
        );
    }
}
