package org.qroute.mapping.search;

import java.util.function.IntConsumer;

/**
 * Read-only adjacency view consumed by {@link PathSearch}.
 */
@FunctionalInterface
public interface NeighbourSource {

    /**
     * Visits every neighbour of {@code qubit} in ascending index order.
     */
    void forEachNeighbour(int qubit, IntConsumer consumer);
}
