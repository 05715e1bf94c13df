package org.qroute.mapping.search;

import java.util.BitSet;

/**
 * Compact set of qubits already reached by a search.
 * <p>
 * Wraps a {@link java.util.BitSet}: O(1) access and about one bit per physical qubit.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within a single search call.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * Constructs a new VisitedSet.
     *
     * @param qubitCount number of physical qubits on the device.
     */
    public VisitedSet(int qubitCount) {
        this.visited = new BitSet(qubitCount);
    }

    /**
     * Marks a qubit as visited if it hasn't been visited already.
     *
     * @param qubit physical qubit index.
     * @return {@code true} if the qubit was NOT previously visited.
     */
    public boolean markVisited(int qubit) {
        if (visited.get(qubit)) {
            return false;
        }
        visited.set(qubit);
        return true;
    }

    public boolean isVisited(int qubit) {
        return visited.get(qubit);
    }

    /**
     * Clears all marks for reuse.
     */
    public void clear() {
        visited.clear();
    }
}
