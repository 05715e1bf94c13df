package org.qroute.ast;

import java.util.Objects;

/**
 * Reference to a register, optionally indexed ({@code q} or {@code q[3]}).
 *
 * @param pos source position.
 * @param var register or gate-parameter name.
 * @param offset element index, or {@code null} for a whole-register reference.
 */
public record VarAccess(Position pos, String var, Integer offset) {

    public VarAccess {
        pos = Objects.requireNonNull(pos, "pos");
        var = Objects.requireNonNull(var, "var");
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative: " + offset);
        }
    }

    /**
     * Creates an indexed reference {@code var[offset]}.
     */
    public static VarAccess of(Position pos, String var, int offset) {
        return new VarAccess(pos, var, offset);
    }

    /**
     * Creates a whole-register reference.
     */
    public static VarAccess whole(Position pos, String var) {
        return new VarAccess(pos, var, null);
    }

    public boolean isIndexed() {
        return offset != null;
    }

    /**
     * Returns a copy of this reference pointing at another element of the same register.
     */
    public VarAccess withOffset(int newOffset) {
        return new VarAccess(pos, var, newOffset);
    }

    @Override
    public String toString() {
        return offset == null ? var : var + "[" + offset + "]";
    }
}
