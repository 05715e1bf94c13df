package org.qroute.mapping.search;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.Objects;

/**
 * Unweighted shortest-path search over a qubit adjacency view.
 */
@UtilityClass
public final class PathSearch {
    private static final int NO_PREDECESSOR = -1;

    /**
     * Breadth-first search from {@code source} to {@code target}.
     *
     * <p>Neighbours are expanded in the order the source reports them, so for a given
     * adjacency the returned path is deterministic. Cost is O(V + E).</p>
     *
     * @param nodeCount number of nodes; valid indices are {@code [0, nodeCount)}.
     * @param neighbours adjacency view.
     * @param source start node.
     * @param target end node.
     * @return unmodifiable path including both endpoints, {@code [source]} when
     * {@code source == target}, or empty when the target is unreachable or either
     * endpoint is out of range.
     */
    public static IntList shortestPath(int nodeCount, NeighbourSource neighbours, int source, int target) {
        Objects.requireNonNull(neighbours, "neighbours");
        if (source < 0 || source >= nodeCount || target < 0 || target >= nodeCount) {
            return IntLists.emptyList();
        }
        if (source == target) {
            return IntLists.singleton(source);
        }

        int[] predecessor = new int[nodeCount];
        Arrays.fill(predecessor, NO_PREDECESSOR);
        VisitedSet visited = new VisitedSet(nodeCount);
        IntArrayFIFOQueue frontier = new IntArrayFIFOQueue();

        visited.markVisited(source);
        frontier.enqueue(source);
        while (!frontier.isEmpty() && !visited.isVisited(target)) {
            int current = frontier.dequeueInt();
            neighbours.forEachNeighbour(current, next -> {
                if (visited.markVisited(next)) {
                    predecessor[next] = current;
                    frontier.enqueue(next);
                }
            });
        }

        if (!visited.isVisited(target)) {
            return IntLists.emptyList();
        }

        IntArrayList path = new IntArrayList();
        for (int node = target; node != NO_PREDECESSOR; node = predecessor[node]) {
            path.add(node);
        }
        // predecessor[source] stays NO_PREDECESSOR, so the walk ends on the source
        int[] ordered = path.toIntArray();
        IntArrays.reverse(ordered);
        return IntLists.unmodifiable(IntArrayList.wrap(ordered));
    }
}
