package org.qroute.mapping.core;

import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.IntList;
import org.qroute.ast.CNOTGate;
import org.qroute.ast.Gate;
import org.qroute.ast.IfStmt;
import org.qroute.ast.Position;
import org.qroute.ast.Program;
import org.qroute.ast.Stmt;
import org.qroute.ast.StmtKind;
import org.qroute.ast.VarAccess;
import org.qroute.ast.replace.Replacement;
import org.qroute.ast.replace.Transformation;
import org.qroute.ast.replace.TreeReplacer;
import org.qroute.mapping.device.Device;
import org.qroute.mapping.diagnostics.MappingDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy swap-inserting hardware mapper.
 *
 * <p>Before every CNOT whose endpoints are not adjacent on the device, swaps are
 * inserted along a shortest path to bring the control next to the target. The mapper
 * tracks the resulting qubit permutation instead of swapping back, so every later
 * reference to the configured register is rewritten through the current permutation.</p>
 *
 * <p>Execution flow, driven by {@link TreeReplacer} in program order:</p>
 * <ul>
 * <li>Register references are rewritten from logical to current physical indices.</li>
 * <li>Each CNOT (already physical, since traversal is post-order) is replaced by its
 * swap chain followed by the terminal CNOT, direction-corrected when only the
 * reverse coupling exists.</li>
 * <li>Leftover gate and oracle declarations are dropped.</li>
 * </ul>
 *
 * <p>The circuit is assumed to use a single global register with the configured name
 * and to have had its initial layout applied already. Unroutable CNOTs are left in
 * place and reported on the diagnostic sink; the run always completes.</p>
 *
 * <p>A mapper instance is single-use and NOT thread-safe.</p>
 */
public final class SwapMapper implements Transformation {
    public static final String REASON_NO_CONNECTION = "MAP_NO_CONNECTION";
    public static final String REASON_UNINDEXED_ACCESS = "MAP_UNINDEXED_ACCESS";
    public static final String REASON_ACCESS_OUT_OF_RANGE = "MAP_ACCESS_OUT_OF_RANGE";
    public static final String REASON_DEGENERATE_CNOT = "MAP_DEGENERATE_CNOT";

    private static final Logger LOG = LoggerFactory.getLogger(SwapMapper.class);

    private final Device device;
    private final String registerName;
    private final MappingDiagnostics diagnostics;
    private final GateSynthesis synthesis;
    private final Permutation permutation;

    private boolean used;
    private int swapsInserted;
    private int directionCorrections;

    /**
     * Creates a mapper on register {@code q} with a private diagnostic sink.
     */
    public SwapMapper(Device device) {
        this(device, SwapMapperConfig.defaults(), new MappingDiagnostics());
    }

    /**
     * Creates a mapper.
     *
     * @param device target device; the permutation spans all of its qubits.
     * @param config mapper options.
     * @param diagnostics sink receiving routing diagnostics.
     */
    public SwapMapper(Device device, SwapMapperConfig config, MappingDiagnostics diagnostics) {
        this.device = Objects.requireNonNull(device, "device");
        this.registerName = Objects.requireNonNull(
                Objects.requireNonNull(config, "config").getRegisterName(),
                "config.registerName"
        );
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.synthesis = new GateSynthesis(registerName);
        this.permutation = Permutation.identity(device.qubitCount());
    }

    /**
     * Maps the program onto the device, rewriting it in place.
     *
     * @param program program with its initial layout applied.
     * @return rewritten program, final permutation and diagnostics of this run.
     * @throws IllegalStateException when this mapper already ran.
     */
    public MappingResult run(Program program) {
        Objects.requireNonNull(program, "program");
        if (used) {
            throw new IllegalStateException("SwapMapper instances are single-use");
        }
        used = true;

        int reportedBefore = diagnostics.all().size();
        LOG.debug("Mapping {} statements onto {} (register '{}')", program.body().size(), device, registerName);
        new TreeReplacer(this).rewrite(program);
        LOG.debug("Mapping finished: {} swaps, {} direction corrections, final {}",
                swapsInserted, directionCorrections, permutation);

        return MappingResult.builder()
                .program(program)
                .permutation(permutation.copy())
                .diagnostics(diagnostics.all().subList(reportedBefore, diagnostics.all().size()))
                .swapsInserted(swapsInserted)
                .directionCorrections(directionCorrections)
                .build();
    }

    /**
     * Applies the swap mapper to a program and returns the final logical-to-physical map.
     */
    public static Int2IntSortedMap mapOntoDevice(Device device, Program program) {
        return new SwapMapper(device).run(program).getPermutation().asMap();
    }

    /**
     * Returns a snapshot of the current permutation. Later changes to the snapshot do
     * not reach the mapper.
     */
    public Permutation permutation() {
        return permutation.copy();
    }

    /**
     * Leftover declarations are dropped unseen; their bodies use parameter names, not
     * device qubits.
     */
    @Override
    public boolean descendInto(Stmt stmt) {
        return stmt.kind() != StmtKind.GATE_DECL && stmt.kind() != StmtKind.ORACLE_DECL;
    }

    @Override
    public Replacement<VarAccess> replaceAccess(VarAccess access) {
        if (!registerName.equals(access.var())) {
            return Replacement.keep();
        }
        if (!access.isIndexed()) {
            diagnostics.error(
                    REASON_UNINDEXED_ACCESS,
                    "whole-register reference to '" + registerName + "' cannot be remapped; desugar it first",
                    access.pos()
            );
            return Replacement.keep();
        }
        int logical = access.offset();
        if (logical >= permutation.size()) {
            diagnostics.error(
                    REASON_ACCESS_OUT_OF_RANGE,
                    "qubit " + access + " does not exist on a " + permutation.size() + "-qubit device",
                    access.pos()
            );
            return Replacement.keep();
        }
        return Replacement.with(access.withOffset(permutation.apply(logical)));
    }

    @Override
    public Replacement<Stmt> replaceStmt(Stmt stmt) {
        return switch (stmt.kind()) {
            case GATE_DECL, ORACLE_DECL -> {
                // should have been inlined away; leftovers are dropped
                LOG.debug("Dropping leftover {} at {}", stmt.kind(), stmt.pos());
                yield Replacement.remove();
            }
            case CNOT_GATE -> replaceCnot((CNOTGate) stmt);
            case IF -> replaceConditional((IfStmt) stmt);
            case REGISTER_DECL, ANCILLA_DECL, U_GATE, BARRIER_GATE, DECLARED_GATE, MEASURE, RESET ->
                    Replacement.keep();
        };
    }

    private Replacement<Stmt> replaceCnot(CNOTGate gate) {
        RoutedCnot routed = route(gate);
        if (routed == null) {
            return Replacement.keep();
        }
        List<Stmt> replacement = new ArrayList<>(routed.swaps().size() + routed.terminal().size());
        replacement.addAll(routed.swaps());
        replacement.addAll(routed.terminal());
        return Replacement.withAll(replacement);
    }

    /**
     * Routes a classically controlled CNOT. Swaps run unconditionally because the
     * permutation records them for every later statement; only the terminal CNOT
     * (or each node of its direction correction) stays under the condition.
     */
    private Replacement<Stmt> replaceConditional(IfStmt ifStmt) {
        if (!(ifStmt.then() instanceof CNOTGate)) {
            return Replacement.keep();
        }
        RoutedCnot routed = route((CNOTGate) ifStmt.then());
        if (routed == null) {
            return Replacement.keep();
        }
        List<Stmt> replacement = new ArrayList<>(routed.swaps().size() + routed.terminal().size());
        replacement.addAll(routed.swaps());
        for (Gate gate : routed.terminal()) {
            replacement.add(ifStmt.withThen(gate));
        }
        return Replacement.withAll(replacement);
    }

    /**
     * Builds the swap chain and terminal CNOT for an already-physical CNOT.
     *
     * @return routed gates, or null when the CNOT is not ours or cannot be routed.
     */
    private RoutedCnot route(CNOTGate gate) {
        if (!isRoutable(gate.ctrl()) || !isRoutable(gate.tgt())) {
            return null;
        }
        int ctrl = gate.ctrl().offset();
        int tgt = gate.tgt().offset();
        Position pos = gate.pos();

        if (ctrl == tgt) {
            diagnostics.error(REASON_DEGENERATE_CNOT, "CNOT control and target are both qubit " + ctrl, pos);
            return null;
        }

        IntList path = device.shortestPath(ctrl, tgt);
        if (path.isEmpty()) {
            diagnostics.error(
                    REASON_NO_CONNECTION,
                    "could not find a connection between qubits " + ctrl + " and " + tgt,
                    pos
            );
            return null;
        }

        List<Gate> swaps = new ArrayList<>();
        List<Gate> terminal = new ArrayList<>();
        int swapsBefore = swapsInserted;
        int i = ctrl;
        for (int step = 0; step < path.size(); step++) {
            int j = path.getInt(step);
            if (j == tgt) {
                if (device.coupled(i, j)) {
                    terminal.add(synthesis.cnot(i, j, pos));
                } else {
                    terminal.addAll(synthesis.reversedCnot(i, j, pos));
                    directionCorrections++;
                }
                break;
            } else if (j != i) {
                appendSwap(swaps, i, j, pos);
            }
            i = j;
        }

        LOG.debug("Routed CX {}->{} along {} with {} swap(s)", ctrl, tgt, path, swapsInserted - swapsBefore);
        return new RoutedCnot(swaps, terminal);
    }

    /**
     * Emits a three-CNOT swap of adjacent qubits {@code i} and {@code j}, oriented so
     * the outer CNOTs use a coupled direction, then records it in the permutation.
     */
    private void appendSwap(List<Gate> out, int i, int j, Position pos) {
        int swapI = i;
        int swapJ = j;
        if (!device.coupled(i, j)) {
            swapI = j;
            swapJ = i;
        }

        out.add(synthesis.cnot(swapI, swapJ, pos));
        if (device.coupled(swapJ, swapI)) {
            out.add(synthesis.cnot(swapJ, swapI, pos));
        } else {
            out.addAll(synthesis.reversedCnot(swapJ, swapI, pos));
            directionCorrections++;
        }
        out.add(synthesis.cnot(swapI, swapJ, pos));

        permutation.swapPhysical(i, j);
        swapsInserted++;
    }

    private boolean isRoutable(VarAccess access) {
        return registerName.equals(access.var())
                && access.isIndexed()
                && access.offset() < permutation.size();
    }

    private record RoutedCnot(List<Gate> swaps, List<Gate> terminal) {
    }
}
