package org.qroute.mapping.device;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.qroute.ast.Position;
import org.qroute.mapping.diagnostics.MappingDiagnostic;
import org.qroute.mapping.diagnostics.MappingDiagnostics;
import org.qroute.mapping.diagnostics.Severity;
import org.qroute.mapping.search.PathSearch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Physical device: qubit count, directed coupling relation and fidelities.
 *
 * <p>{@code coupled(i, j)} means a CNOT with control {@code i} and target {@code j}
 * runs natively. Path search ignores direction; the router uses {@link #coupled}
 * afterwards to decide whether a direction correction is needed.</p>
 *
 * <p>Instances are immutable and safe to share once built.</p>
 */
public final class Device {
    public static final String REASON_INVALID_QUBIT_COUNT = "DEVICE_INVALID_QUBIT_COUNT";
    public static final String REASON_QUBIT_OUT_OF_RANGE = "DEVICE_QUBIT_OUT_OF_RANGE";
    public static final String REASON_SELF_LOOP = "DEVICE_SELF_LOOP";
    public static final String REASON_FIDELITY_OUT_OF_RANGE = "DEVICE_FIDELITY_OUT_OF_RANGE";

    /** Fidelity assumed for qubits and couplings without calibration data. */
    public static final double IDEAL_FIDELITY = 1.0d;

    @Getter
    @Accessors(fluent = true)
    private final String name;
    @Getter
    @Accessors(fluent = true)
    private final int qubitCount;
    private final boolean[][] couplings;
    private final double[] qubitFidelities;
    private final double[][] edgeFidelities;
    // undirected neighbour lists in ascending order, used for path search
    private final int[][] neighbours;
    private final int edgeCount;
    private final List<MappingDiagnostic> constructionWarnings;

    private Device(Builder builder) {
        this.name = builder.name;
        this.qubitCount = builder.qubitCount;
        this.couplings = new boolean[qubitCount][];
        this.edgeFidelities = new double[qubitCount][];
        for (int i = 0; i < qubitCount; i++) {
            couplings[i] = builder.couplings[i].clone();
            edgeFidelities[i] = builder.edgeFidelities[i].clone();
        }
        this.qubitFidelities = builder.qubitFidelities.clone();

        int edges = 0;
        this.neighbours = new int[qubitCount][];
        for (int i = 0; i < qubitCount; i++) {
            IntArrayList adjacent = new IntArrayList();
            for (int j = 0; j < qubitCount; j++) {
                if (couplings[i][j]) {
                    edges++;
                }
                if (couplings[i][j] || couplings[j][i]) {
                    adjacent.add(j);
                }
            }
            neighbours[i] = adjacent.toIntArray();
        }
        this.edgeCount = edges;
        this.constructionWarnings = List.copyOf(builder.warnings);
    }

    /**
     * Starts building a device with its own diagnostic sink.
     *
     * @param name display name.
     * @param qubitCount number of physical qubits.
     * @throws DeviceException when {@code qubitCount <= 0}.
     */
    public static Builder builder(String name, int qubitCount) {
        return new Builder(name, qubitCount, new MappingDiagnostics());
    }

    /**
     * Starts building a device that reports construction warnings into a shared sink.
     *
     * @throws DeviceException when {@code qubitCount <= 0}.
     */
    public static Builder builder(String name, int qubitCount, MappingDiagnostics diagnostics) {
        return new Builder(name, qubitCount, diagnostics);
    }

    /**
     * Returns whether a CNOT with the given control and target runs natively.
     * Out-of-range indices are never coupled.
     */
    public boolean coupled(int control, int target) {
        return inRange(control) && inRange(target) && couplings[control][target];
    }

    /**
     * Returns whether the two qubits share a coupling in either direction.
     */
    public boolean connected(int a, int b) {
        return coupled(a, b) || coupled(b, a);
    }

    /**
     * Returns the qubits connected to {@code qubit} in either direction, ascending.
     */
    public IntList neighbours(int qubit) {
        checkQubit(qubit);
        return IntLists.unmodifiable(IntArrayList.wrap(neighbours[qubit]));
    }

    /**
     * Finds a minimum-hop path between two physical qubits ignoring coupling direction.
     *
     * @return path including both endpoints, or an empty list when no path exists.
     */
    public IntList shortestPath(int source, int target) {
        return PathSearch.shortestPath(qubitCount, this::forEachNeighbour, source, target);
    }

    public double qubitFidelity(int qubit) {
        checkQubit(qubit);
        return qubitFidelities[qubit];
    }

    /**
     * Returns the two-qubit fidelity of the directed coupling, or
     * {@link #IDEAL_FIDELITY} when no calibration was supplied.
     */
    public double edgeFidelity(int control, int target) {
        checkQubit(control);
        checkQubit(target);
        return edgeFidelities[control][target];
    }

    /**
     * Returns the number of directed couplings.
     */
    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Returns warnings raised while this device was built (dropped edges or fidelities).
     */
    public List<MappingDiagnostic> constructionWarnings() {
        return constructionWarnings;
    }

    private void forEachNeighbour(int qubit, IntConsumer consumer) {
        for (int next : neighbours[qubit]) {
            consumer.accept(next);
        }
    }

    private boolean inRange(int qubit) {
        return qubit >= 0 && qubit < qubitCount;
    }

    private void checkQubit(int qubit) {
        if (!inRange(qubit)) {
            throw new IndexOutOfBoundsException("Qubit " + qubit + " out of range [0, " + qubitCount + ")");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append("Device{name='").append(name)
                .append("', qubits=").append(qubitCount)
                .append(", couplings=[");
        boolean first = true;
        for (int i = 0; i < qubitCount; i++) {
            for (int j = 0; j < qubitCount; j++) {
                if (couplings[i][j]) {
                    if (!first) {
                        sb.append(", ");
                    }
                    sb.append(i).append("->").append(j);
                    first = false;
                }
            }
        }
        return sb.append("]}").toString();
    }

    /**
     * Mutable device description. Invalid edges and fidelities are dropped with a
     * warning instead of failing the build.
     */
    public static final class Builder {
        private final String name;
        private final int qubitCount;
        private final boolean[][] couplings;
        private final double[] qubitFidelities;
        private final double[][] edgeFidelities;
        private final MappingDiagnostics diagnostics;
        private final List<MappingDiagnostic> warnings = new ArrayList<>();

        private Builder(String name, int qubitCount, MappingDiagnostics diagnostics) {
            if (qubitCount <= 0) {
                throw new DeviceException(REASON_INVALID_QUBIT_COUNT, "Invalid device qubit count: " + qubitCount);
            }
            this.name = Objects.requireNonNull(name, "name");
            this.qubitCount = qubitCount;
            this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
            this.couplings = new boolean[qubitCount][qubitCount];
            this.qubitFidelities = new double[qubitCount];
            this.edgeFidelities = new double[qubitCount][qubitCount];
            Arrays.fill(qubitFidelities, IDEAL_FIDELITY);
            for (double[] row : edgeFidelities) {
                Arrays.fill(row, IDEAL_FIDELITY);
            }
        }

        /**
         * Adds a coupling usable in both directions with ideal fidelity.
         */
        public Builder addEdge(int control, int target) {
            return addEdge(control, target, false, IDEAL_FIDELITY);
        }

        /**
         * Adds a coupling that only runs with {@code control} as CNOT control.
         */
        public Builder addDirectedEdge(int control, int target) {
            return addEdge(control, target, true, IDEAL_FIDELITY);
        }

        /**
         * Adds a coupling with an optional two-qubit fidelity.
         *
         * <p>An edge with an out-of-range endpoint (or a self-loop) is dropped. A fidelity
         * outside [0, 1] is dropped but the edge itself is kept.</p>
         *
         * @param control CNOT control qubit.
         * @param target CNOT target qubit.
         * @param directed when false the reverse direction is coupled as well.
         * @param fidelity two-qubit fidelity in [0, 1].
         */
        public Builder addEdge(int control, int target, boolean directed, double fidelity) {
            if (!inRange(control) || !inRange(target)) {
                warn(REASON_QUBIT_OUT_OF_RANGE, "Qubit(s) out of range: " + control + "," + target);
                return this;
            }
            if (control == target) {
                warn(REASON_SELF_LOOP, "Self-coupling ignored on qubit " + control);
                return this;
            }
            couplings[control][target] = true;
            if (!directed) {
                couplings[target][control] = true;
            }
            if (fidelity != IDEAL_FIDELITY) {
                if (!validFidelity(fidelity)) {
                    warn(REASON_FIDELITY_OUT_OF_RANGE, "Fidelity out of range: " + fidelity);
                } else {
                    edgeFidelities[control][target] = fidelity;
                    if (!directed) {
                        edgeFidelities[target][control] = fidelity;
                    }
                }
            }
            return this;
        }

        /**
         * Sets the single-qubit fidelity of one qubit.
         */
        public Builder setQubitFidelity(int qubit, double fidelity) {
            if (!inRange(qubit)) {
                warn(REASON_QUBIT_OUT_OF_RANGE, "Qubit out of range: " + qubit);
            } else if (!validFidelity(fidelity)) {
                warn(REASON_FIDELITY_OUT_OF_RANGE, "Fidelity out of range: " + fidelity);
            } else {
                qubitFidelities[qubit] = fidelity;
            }
            return this;
        }

        public Device build() {
            return new Device(this);
        }

        private boolean inRange(int qubit) {
            return qubit >= 0 && qubit < qubitCount;
        }

        private static boolean validFidelity(double fidelity) {
            return fidelity >= 0.0d && fidelity <= 1.0d;
        }

        private void warn(String reasonCode, String message) {
            MappingDiagnostic warning = new MappingDiagnostic(
                    reasonCode,
                    Severity.WARNING,
                    "device '" + name + "': " + message,
                    Position.UNKNOWN
            );
            warnings.add(warning);
            diagnostics.report(warning);
        }
    }
}
