package org.qroute.mapping.core;

import it.unimi.dsi.fastutil.ints.Int2IntAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMaps;

import java.util.Arrays;

/**
 * Live logical-to-physical qubit correspondence.
 *
 * <p>Stored as two arrays kept in sync: {@code physicalOf[logical]} and its inverse
 * {@code logicalOf[physical]}. The only mutation is {@link #swapPhysical(int, int)},
 * a transposition applied by value, so the mapping stays a bijection on
 * {@code [0, size)}.</p>
 *
 * <p>This class is NOT thread-safe.</p>
 */
public final class Permutation {
    private final int[] physicalOf;
    private final int[] logicalOf;

    private Permutation(int[] physicalOf, int[] logicalOf) {
        this.physicalOf = physicalOf;
        this.logicalOf = logicalOf;
    }

    /**
     * Creates the identity mapping over {@code size} qubits.
     *
     * @throws IllegalArgumentException when {@code size <= 0}.
     */
    public static Permutation identity(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        int[] forward = new int[size];
        for (int i = 0; i < size; i++) {
            forward[i] = i;
        }
        return new Permutation(forward, forward.clone());
    }

    public int size() {
        return physicalOf.length;
    }

    /**
     * Returns the physical qubit currently holding the given logical qubit.
     *
     * @throws IllegalArgumentException when {@code logical} is out of range.
     */
    public int apply(int logical) {
        checkIndex(logical, "logical");
        return physicalOf[logical];
    }

    /**
     * Returns the logical qubit currently held by the given physical qubit.
     *
     * @throws IllegalArgumentException when {@code physical} is out of range.
     */
    public int logicalAt(int physical) {
        checkIndex(physical, "physical");
        return logicalOf[physical];
    }

    /**
     * Exchanges the contents of physical qubits {@code a} and {@code b}: whichever
     * logical qubit pointed at {@code a} now points at {@code b}, and vice versa.
     *
     * @throws IllegalArgumentException when either index is out of range.
     */
    public void swapPhysical(int a, int b) {
        checkIndex(a, "physical");
        checkIndex(b, "physical");
        int logicalA = logicalOf[a];
        int logicalB = logicalOf[b];
        physicalOf[logicalA] = b;
        physicalOf[logicalB] = a;
        logicalOf[a] = logicalB;
        logicalOf[b] = logicalA;
    }

    /**
     * Checks the forward mapping independently of the inverse array.
     */
    public boolean isBijection() {
        boolean[] seen = new boolean[physicalOf.length];
        for (int physical : physicalOf) {
            if (physical < 0 || physical >= seen.length || seen[physical]) {
                return false;
            }
            seen[physical] = true;
        }
        return true;
    }

    public boolean isIdentity() {
        for (int i = 0; i < physicalOf.length; i++) {
            if (physicalOf[i] != i) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a snapshot as an ordered, unmodifiable logical-to-physical map.
     */
    public Int2IntSortedMap asMap() {
        Int2IntAVLTreeMap map = new Int2IntAVLTreeMap();
        for (int logical = 0; logical < physicalOf.length; logical++) {
            map.put(logical, physicalOf[logical]);
        }
        return Int2IntSortedMaps.unmodifiable(map);
    }

    /**
     * Returns a copy of the forward mapping indexed by logical qubit.
     */
    public int[] toArray() {
        return physicalOf.clone();
    }

    public Permutation copy() {
        return new Permutation(physicalOf.clone(), logicalOf.clone());
    }

    private void checkIndex(int index, String role) {
        if (index < 0 || index >= physicalOf.length) {
            throw new IllegalArgumentException(
                    role + " qubit " + index + " out of range [0, " + physicalOf.length + ")");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Permutation)) {
            return false;
        }
        return Arrays.equals(physicalOf, ((Permutation) o).physicalOf);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(physicalOf);
    }

    @Override
    public String toString() {
        return "Permutation" + Arrays.toString(physicalOf);
    }
}
