package org.qroute.ast.replace;

import java.util.List;
import java.util.Objects;

/**
 * Per-node decision returned by a {@link Transformation}.
 *
 * <p>Four outcomes are possible: keep the node, replace it with one node, splice an
 * ordered sequence of nodes in its place, or remove it. Only statements accept the
 * last two; the engine rejects them for expressions and qubit references.</p>
 *
 * @param <T> node type the decision applies to.
 */
public final class Replacement<T> {
    private static final Replacement<?> KEEP = new Replacement<>(Kind.KEEP, List.of());
    private static final Replacement<?> REMOVE = new Replacement<>(Kind.REMOVE, List.of());

    /**
     * Replacement outcome tag.
     */
    public enum Kind {
        KEEP,
        ONE,
        MANY,
        REMOVE
    }

    private final Kind kind;
    private final List<T> nodes;

    private Replacement(Kind kind, List<T> nodes) {
        this.kind = kind;
        this.nodes = nodes;
    }

    @SuppressWarnings("unchecked")
    public static <T> Replacement<T> keep() {
        return (Replacement<T>) KEEP;
    }

    @SuppressWarnings("unchecked")
    public static <T> Replacement<T> remove() {
        return (Replacement<T>) REMOVE;
    }

    public static <T> Replacement<T> with(T node) {
        return new Replacement<>(Kind.ONE, List.of(Objects.requireNonNull(node, "node")));
    }

    /**
     * Splices the given nodes, in order, where the visited node was.
     *
     * @param nodes replacement sequence; an empty sequence behaves like {@link #remove()}.
     */
    public static <T> Replacement<T> withAll(List<? extends T> nodes) {
        return new Replacement<>(Kind.MANY, List.copyOf(nodes));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the replacement nodes (empty for KEEP and REMOVE).
     */
    public List<T> nodes() {
        return nodes;
    }

    /**
     * Returns the single replacement node of a ONE decision.
     *
     * @throws IllegalStateException when this decision is not ONE.
     */
    public T single() {
        if (kind != Kind.ONE) {
            throw new IllegalStateException("replacement of kind " + kind + " has no single node");
        }
        return nodes.get(0);
    }

    @Override
    public String toString() {
        return "Replacement{" + kind + (nodes.isEmpty() ? "" : ", " + nodes) + "}";
    }
}
