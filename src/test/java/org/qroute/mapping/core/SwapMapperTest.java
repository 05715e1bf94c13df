package org.qroute.mapping.core;

import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import org.qroute.ast.AncillaDecl;
import org.qroute.ast.CNOTGate;
import org.qroute.ast.GateDecl;
import org.qroute.ast.IfStmt;
import org.qroute.ast.OracleDecl;
import org.qroute.ast.Program;
import org.qroute.ast.Stmt;
import org.qroute.ast.StmtKind;
import org.qroute.ast.VarAccess;
import org.qroute.mapping.device.Device;
import org.qroute.mapping.device.DeviceException;
import org.qroute.mapping.device.Devices;
import org.qroute.mapping.diagnostics.MappingDiagnostics;
import org.qroute.mapping.diagnostics.Severity;
import org.qroute.testutil.CircuitSimulator;
import org.qroute.testutil.CircuitSimulator.State;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.qroute.testutil.ProgramFixtures.POS;
import static org.qroute.testutil.ProgramFixtures.cnots;
import static org.qroute.testutil.ProgramFixtures.count;
import static org.qroute.testutil.ProgramFixtures.creg;
import static org.qroute.testutil.ProgramFixtures.cx;
import static org.qroute.testutil.ProgramFixtures.cxGateDecl;
import static org.qroute.testutil.ProgramFixtures.measure;
import static org.qroute.testutil.ProgramFixtures.program;
import static org.qroute.testutil.ProgramFixtures.q;
import static org.qroute.testutil.ProgramFixtures.qreg;

@DisplayName("SwapMapper Tests")
class SwapMapperTest {
    private static final GateSynthesis SYNTHESIS = new GateSynthesis("q");

    private static Device directed(String name, int qubits, int... edges) {
        Device.Builder builder = Device.builder(name, qubits);
        for (int i = 0; i + 1 < edges.length; i += 2) {
            builder.addDirectedEdge(edges[i], edges[i + 1]);
        }
        return builder.build();
    }

    private static List<String> rendered(List<? extends Stmt> statements) {
        List<String> out = new ArrayList<>();
        for (Stmt stmt : statements) {
            out.add(stmt.toString());
        }
        return out;
    }

    private static void assertHardwareValid(Device device, List<Stmt> statements) {
        for (Stmt stmt : statements) {
            Stmt op = stmt.kind() == StmtKind.IF ? ((IfStmt) stmt).then() : stmt;
            if (op.kind() == StmtKind.CNOT_GATE) {
                CNOTGate cnot = (CNOTGate) op;
                assertTrue(device.coupled(cnot.ctrl().offset(), cnot.tgt().offset()), "uncoupled " + cnot);
            }
        }
    }

    /**
     * Routed circuit on input x must equal the logical circuit on x with every qubit k
     * moved to its final physical position.
     */
    private static void assertRoutedEquivalent(
            int qubits,
            List<Stmt> logical,
            List<Stmt> routed,
            Permutation permutation,
            boolean conditionsHold
    ) {
        int[] physicalOf = permutation.toArray();
        for (int input = 0; input < 1 << qubits; input++) {
            State expected = CircuitSimulator.run(qubits, logical, input, conditionsHold).relabel(physicalOf);
            State actual = CircuitSimulator.run(qubits, routed, input, conditionsHold);
            assertTrue(actual.approxEquals(expected), "mismatch on input " + input);
        }
    }

    @Test
    @DisplayName("CNOT across one hop on a chain gets one swap and a terminal CNOT")
    void testOneHopOnChain() {
        Program program = program(qreg(3), cx(0, 2));
        List<Stmt> logical = List.copyOf(program.body());

        MappingResult result = new SwapMapper(Devices.linear(3)).run(program);

        assertEquals(
                List.of("qreg q[3];", "CX q[0],q[1];", "CX q[1],q[0];", "CX q[0],q[1];", "CX q[1],q[2];"),
                rendered(program.body())
        );
        assertArrayEquals(new int[]{1, 0, 2}, result.getPermutation().toArray());
        assertEquals(1, result.getSwapsInserted());
        assertEquals(0, result.getDirectionCorrections());
        assertTrue(result.getDiagnostics().isEmpty());
        assertTrue(result.isHardwareValid());
        assertRoutedEquivalent(3, logical, program.body(), result.getPermutation(), true);
    }

    @Test
    @DisplayName("Adjacent CNOT becomes exactly one primitive")
    void testAdjacentCnot() {
        Program program = program(qreg(2), cx(1, 0));
        MappingResult result = new SwapMapper(Devices.linear(2)).run(program);

        assertEquals(List.of("qreg q[2];", "CX q[1],q[0];"), rendered(program.body()));
        assertTrue(result.getPermutation().isIdentity());
        assertEquals(0, result.getSwapsInserted());
    }

    @Test
    @DisplayName("CNOT against a one-way coupling is wrapped in Hadamards")
    void testDirectionCorrection() {
        Device device = directed("OneWay", 2, 1, 0);
        Program program = program(qreg(2), cx(0, 1));
        List<Stmt> logical = List.copyOf(program.body());

        MappingResult result = new SwapMapper(device).run(program);

        List<Stmt> body = program.body();
        assertEquals(6, body.size());
        assertEquals(rendered(SYNTHESIS.reversedCnot(0, 1, POS)), rendered(body.subList(1, 6)));
        assertEquals(0, result.getSwapsInserted());
        assertEquals(1, result.getDirectionCorrections());
        assertTrue(result.getPermutation().isIdentity());
        assertHardwareValid(device, body);
        assertRoutedEquivalent(2, logical, body, result.getPermutation(), true);
    }

    @Test
    @DisplayName("Swap whose middle CNOT runs against the coupling gets a reversed middle")
    void testSwapOverOneWayCouplings() {
        Device device = directed("Chain", 3, 0, 1, 1, 2);
        Program program = program(qreg(3), cx(0, 2));
        List<Stmt> logical = List.copyOf(program.body());

        MappingResult result = new SwapMapper(device).run(program);

        List<Stmt> body = program.body();
        // qreg + (CX, 5-node reversed CX, CX) + terminal CX
        assertEquals(9, body.size());
        assertEquals("CX q[0],q[1];", body.get(1).toString());
        assertEquals(rendered(SYNTHESIS.reversedCnot(1, 0, POS)), rendered(body.subList(2, 7)));
        assertEquals("CX q[0],q[1];", body.get(7).toString());
        assertEquals("CX q[1],q[2];", body.get(8).toString());
        assertEquals(1, result.getSwapsInserted());
        assertEquals(1, result.getDirectionCorrections());
        assertHardwareValid(device, body);
        assertRoutedEquivalent(3, logical, body, result.getPermutation(), true);
    }

    @Test
    @DisplayName("Later CNOTs see the permutation left by earlier swaps")
    void testPermutationCarriesForward() {
        Program program = program(qreg(3), cx(0, 2), cx(0, 2), measure(0, 0));
        List<Stmt> logical = List.of(qreg(3), cx(0, 2), cx(0, 2));

        MappingResult result = new SwapMapper(Devices.linear(3)).run(program);

        List<Stmt> body = program.body();
        assertEquals(7, body.size());
        assertEquals("CX q[1],q[2];", body.get(5).toString());
        assertEquals("measure q[1] -> c[0];", body.get(6).toString());
        assertEquals(1, result.getSwapsInserted());
        assertRoutedEquivalent(3, logical, body.subList(0, 6), result.getPermutation(), true);
    }

    @Test
    @DisplayName("Disconnected qubits leave the CNOT in place with an error")
    void testNoConnection() {
        Device device = Device.builder("Split", 4).addEdge(0, 1).addEdge(2, 3).build();
        Program program = program(qreg(4), cx(0, 3));

        MappingResult result = new SwapMapper(device).run(program);

        assertEquals(List.of(qreg(4), cx(0, 3)), program.body());
        assertTrue(result.getPermutation().isIdentity());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(SwapMapper.REASON_NO_CONNECTION, result.getDiagnostics().get(0).reasonCode());
        assertEquals(Severity.ERROR, result.getDiagnostics().get(0).severity());
        assertFalse(result.isHardwareValid());
    }

    @Test
    @DisplayName("Routing continues after an unroutable CNOT")
    void testContinuesAfterFailure() {
        Device device = Device.builder("Split", 5).addEdge(0, 1).addEdge(1, 2).addEdge(3, 4).build();
        Program program = program(qreg(5), cx(0, 3), cx(0, 2));

        MappingResult result = new SwapMapper(device).run(program);

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(1, result.getSwapsInserted());
        assertEquals(cx(0, 3), program.body().get(1));
        assertEquals(6, program.body().size());
    }

    @Test
    @DisplayName("Non-positive device size is rejected before mapping")
    void testZeroQubitDevice() {
        DeviceException exception = assertThrows(DeviceException.class, () -> Device.builder("Empty", 0));
        assertEquals(Device.REASON_INVALID_QUBIT_COUNT, exception.reasonCode());
    }

    @Test
    @DisplayName("References to other registers are left alone")
    void testOtherRegisterUntouched() {
        Program program = program(qreg(3), cx("r", 0, 2), measure(2, 1));

        MappingResult result = new SwapMapper(Devices.linear(3)).run(program);

        assertEquals(List.of(qreg(3), cx("r", 0, 2), measure(2, 1)), program.body());
        assertTrue(result.getDiagnostics().isEmpty());
        assertTrue(result.getPermutation().isIdentity());
    }

    @Test
    @DisplayName("Configured register name selects which register is routed")
    void testConfiguredRegister() {
        Program program = program(cx("r", 0, 2), cx(0, 2));
        SwapMapper mapper = new SwapMapper(
                Devices.linear(3),
                SwapMapperConfig.forRegister("r"),
                new MappingDiagnostics()
        );

        MappingResult result = mapper.run(program);

        assertEquals(
                List.of("CX r[0],r[1];", "CX r[1],r[0];", "CX r[0],r[1];", "CX r[1],r[2];", "CX q[0],q[2];"),
                rendered(program.body())
        );
        assertEquals(1, result.getSwapsInserted());
    }

    @Test
    @DisplayName("Conditional CNOT: swaps run unconditionally, the terminal CNOT stays conditional")
    void testConditionalCnot() {
        Program program = program(qreg(3), creg("c", 1), new IfStmt(POS, "c", 1, cx(0, 2)));
        List<Stmt> logical = List.copyOf(program.body());

        MappingResult result = new SwapMapper(Devices.linear(3)).run(program);

        List<Stmt> body = program.body();
        assertEquals(6, body.size());
        assertEquals(3, count(body.subList(2, 5), StmtKind.CNOT_GATE));
        assertEquals("if(c==1) CX q[1],q[2];", body.get(5).toString());
        assertEquals(1, result.getSwapsInserted());
        assertRoutedEquivalent(3, logical, body, result.getPermutation(), true);
        assertRoutedEquivalent(3, logical, body, result.getPermutation(), false);
    }

    @Test
    @DisplayName("Direction-corrected conditional CNOT keeps the condition on every node")
    void testConditionalDirectionCorrection() {
        Device device = directed("OneWay", 2, 1, 0);
        Program program = program(qreg(2), new IfStmt(POS, "c", 0, cx(0, 1)));
        List<Stmt> logical = List.copyOf(program.body());

        MappingResult result = new SwapMapper(device).run(program);

        List<Stmt> body = program.body();
        assertEquals(6, body.size());
        for (Stmt stmt : body.subList(1, 6)) {
            IfStmt ifStmt = assertInstanceOf(IfStmt.class, stmt);
            assertEquals("c", ifStmt.var());
            assertEquals(0, ifStmt.value());
        }
        assertEquals(1, result.getDirectionCorrections());
        assertRoutedEquivalent(2, logical, body, result.getPermutation(), true);
        assertRoutedEquivalent(2, logical, body, result.getPermutation(), false);
    }

    @Test
    @DisplayName("Leftover gate and oracle declarations are dropped")
    void testDeclarationsRemoved() {
        Program program = program(
                qreg(2),
                cxGateDecl("pair"),
                new OracleDecl(POS, "oracle", List.of("a", "b"), "oracle.v"),
                cx(0, 1)
        );

        MappingResult result = new SwapMapper(Devices.linear(2)).run(program);

        assertEquals(List.of("qreg q[2];", "CX q[0],q[1];"), rendered(program.body()));
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("Leftover declaration bodies never touch routing state")
    void testLeftoverDeclarationsIgnored() {
        GateDecl farPair = new GateDecl(POS, "far", false, List.of(), List.of(), List.of(cx(0, 2)));
        GateDecl shadowing = new GateDecl(
                POS,
                "shadow",
                false,
                List.of(),
                List.of("q", "b"),
                List.of(new CNOTGate(POS, VarAccess.whole(POS, "q"), VarAccess.whole(POS, "b")))
        );
        Program program = program(
                qreg(3),
                farPair,
                shadowing,
                new OracleDecl(POS, "oracle", List.of("q"), "oracle.v"),
                cx(0, 1)
        );

        MappingResult result = new SwapMapper(Devices.linear(3)).run(program);

        assertEquals(List.of("qreg q[3];", "CX q[0],q[1];"), rendered(program.body()));
        assertTrue(result.getPermutation().isIdentity());
        assertEquals(0, result.getSwapsInserted());
        assertEquals(0, result.getDirectionCorrections());
        assertTrue(result.getDiagnostics().isEmpty());
        assertTrue(result.isHardwareValid());
    }

    @Test
    @DisplayName("Result and accessor permutations are detached snapshots")
    void testPermutationSnapshots() {
        SwapMapper mapper = new SwapMapper(Devices.linear(3));
        MappingResult result = mapper.run(program(qreg(3), cx(0, 2)));

        result.getPermutation().swapPhysical(0, 1);
        mapper.permutation().swapPhysical(1, 2);

        assertArrayEquals(new int[]{1, 0, 2}, mapper.permutation().toArray());
        assertTrue(result.getPermutation().isIdentity());
    }

    @Test
    @DisplayName("Register and ancilla declarations pass through unchanged")
    void testOtherDeclarationsKept() {
        AncillaDecl ancilla = new AncillaDecl(POS, "anc", true, 2);
        Program program = program(qreg(2), creg("c", 2), ancilla);

        new SwapMapper(Devices.linear(2)).run(program);

        assertEquals(List.of("qreg q[2];", "creg c[2];", "dirty ancilla anc[2];"), rendered(program.body()));
        assertSame(ancilla, program.body().get(2));
    }

    @Test
    @DisplayName("Whole-register and out-of-range references are reported and kept")
    void testBadReferences() {
        CNOTGate wholeRegister = new CNOTGate(POS, VarAccess.whole(POS, "q"), q(1));
        Program program = program(qreg(2), wholeRegister, cx(0, 5));

        MappingResult result = new SwapMapper(Devices.linear(2)).run(program);

        assertEquals(List.of(qreg(2), wholeRegister, cx(0, 5)), program.body());
        assertEquals(2, result.getDiagnostics().size());
        assertEquals(SwapMapper.REASON_UNINDEXED_ACCESS, result.getDiagnostics().get(0).reasonCode());
        assertEquals(SwapMapper.REASON_ACCESS_OUT_OF_RANGE, result.getDiagnostics().get(1).reasonCode());
        assertFalse(result.isHardwareValid());
    }

    @Test
    @DisplayName("CNOT with identical control and target is reported and kept")
    void testDegenerateCnot() {
        Program program = program(qreg(2), cx(1, 1));

        MappingResult result = new SwapMapper(Devices.linear(2)).run(program);

        assertEquals(cx(1, 1), program.body().get(1));
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(SwapMapper.REASON_DEGENERATE_CNOT, result.getDiagnostics().get(0).reasonCode());
    }

    @Test
    @DisplayName("Result carries only the diagnostics of its own run")
    void testSharedDiagnosticSink() {
        MappingDiagnostics sink = new MappingDiagnostics();
        sink.warn("EARLIER", "reported before mapping", POS);
        Device device = Device.builder("Split", 4).addEdge(0, 1).addEdge(2, 3).build();

        MappingResult result = new SwapMapper(device, SwapMapperConfig.defaults(), sink)
                .run(program(qreg(4), cx(1, 2)));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(SwapMapper.REASON_NO_CONNECTION, result.getDiagnostics().get(0).reasonCode());
        assertEquals(2, sink.all().size());
    }

    @Test
    @DisplayName("Mapper instances are single-use")
    void testSingleUse() {
        SwapMapper mapper = new SwapMapper(Devices.linear(2));
        mapper.run(program(qreg(2)));
        assertThrows(IllegalStateException.class, () -> mapper.run(program(qreg(2))));
    }

    @Test
    @DisplayName("mapOntoDevice returns the final logical-to-physical map")
    void testMapOntoDevice() {
        Program program = program(qreg(3), cx(0, 2));
        Int2IntSortedMap layout = SwapMapper.mapOntoDevice(Devices.linear(3), program);

        assertEquals(3, layout.size());
        assertEquals(1, layout.get(0));
        assertEquals(0, layout.get(1));
        assertEquals(2, layout.get(2));
        assertEquals(5, program.body().size());
    }

    @Test
    @DisplayName("Default configuration owns register q")
    void testConfigDefaults() {
        assertEquals("q", SwapMapperConfig.defaults().getRegisterName());
        assertEquals(SwapMapperConfig.DEFAULT_REGISTER_NAME, SwapMapperConfig.builder().build().getRegisterName());
        assertEquals("data", SwapMapperConfig.forRegister("data").getRegisterName());
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1L, 7L, 42L, 1234L})
    @DisplayName("Random circuits stay equivalent and hardware-valid after routing")
    void testRandomCircuits(long seed) {
        Random random = new Random(seed);
        List<Device> devices = List.of(
                Devices.grid(2, 3),
                Devices.linear(5),
                directed("DirectedRing", 5, 0, 1, 1, 2, 2, 3, 3, 4, 4, 0)
        );
        for (Device device : devices) {
            int n = device.qubitCount();
            List<Stmt> statements = new ArrayList<>();
            statements.add(qreg(n));
            for (int g = 0; g < 30; g++) {
                if (random.nextInt(4) == 0) {
                    statements.add(SYNTHESIS.hadamard(random.nextInt(n), POS));
                } else {
                    int control = random.nextInt(n);
                    int target = (control + 1 + random.nextInt(n - 1)) % n;
                    statements.add(cx(control, target));
                }
            }
            List<Stmt> logical = List.copyOf(statements);
            Program program = new Program(POS, statements);

            MappingResult result = new SwapMapper(device).run(program);

            assertTrue(result.getDiagnostics().isEmpty(), device.name());
            assertTrue(result.getPermutation().isBijection(), device.name());
            assertHardwareValid(device, program.body());
            assertEquals(
                    count(logical, StmtKind.U_GATE) + 4 * result.getDirectionCorrections(),
                    count(program.body(), StmtKind.U_GATE),
                    device.name()
            );
            assertEquals(
                    cnots(logical).size() + 3 * result.getSwapsInserted(),
                    cnots(program.body()).size(),
                    device.name()
            );
            assertRoutedEquivalent(n, logical, program.body(), result.getPermutation(), true);
        }
    }
}
