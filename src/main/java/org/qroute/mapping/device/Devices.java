package org.qroute.mapping.device;

import lombok.experimental.UtilityClass;

/**
 * Factory for common device topologies. All couplings are bidirectional with ideal fidelity.
 */
@UtilityClass
public final class Devices {

    /**
     * Every pair of qubits is coupled. Used when no device description is supplied.
     */
    public static Device fullyConnected(int qubitCount) {
        Device.Builder builder = Device.builder("Fully connected device", qubitCount);
        for (int i = 0; i < qubitCount; i++) {
            for (int j = i + 1; j < qubitCount; j++) {
                builder.addEdge(i, j);
            }
        }
        return builder.build();
    }

    /**
     * Chain {@code 0 - 1 - ... - (n-1)}.
     */
    public static Device linear(int qubitCount) {
        Device.Builder builder = Device.builder("Linear device", qubitCount);
        for (int i = 0; i + 1 < qubitCount; i++) {
            builder.addEdge(i, i + 1);
        }
        return builder.build();
    }

    /**
     * Chain closed into a cycle. Rings of fewer than three qubits degenerate to a chain.
     */
    public static Device ring(int qubitCount) {
        Device.Builder builder = Device.builder("Ring device", qubitCount);
        for (int i = 0; i + 1 < qubitCount; i++) {
            builder.addEdge(i, i + 1);
        }
        if (qubitCount > 2) {
            builder.addEdge(qubitCount - 1, 0);
        }
        return builder.build();
    }

    /**
     * Row-major {@code rows x cols} lattice with nearest-neighbour couplings.
     *
     * @throws DeviceException when either dimension is not positive.
     */
    public static Device grid(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new DeviceException(
                    Device.REASON_INVALID_QUBIT_COUNT,
                    "Invalid grid dimensions: " + rows + "x" + cols
            );
        }
        Device.Builder builder = Device.builder(rows + "x" + cols + " grid device", rows * cols);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int qubit = r * cols + c;
                if (c + 1 < cols) {
                    builder.addEdge(qubit, qubit + 1);
                }
                if (r + 1 < rows) {
                    builder.addEdge(qubit, qubit + cols);
                }
            }
        }
        return builder.build();
    }
}
