/*
 * This file is part of BddSynth.
 * Copyright (c) 2026 The BddSynth authors.
 *
 * BddSynth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * BddSynth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with BddSynth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.bddsynth.netlist;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import de.tum.in.bddsynth.Bdd;
import de.tum.in.bddsynth.BddFactory;
import de.tum.in.bddsynth.DontCarePolicy;
import de.tum.in.bddsynth.ImmutableBddConfiguration;
import de.tum.in.bddsynth.InvalidDiagramReferenceException;
import de.tum.in.bddsynth.MintermTruthTable;
import de.tum.in.bddsynth.TruthTable;
import de.tum.in.bddsynth.TruthValue;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class NetlistSynthesizerTest {
    private static final List<String> NAMES = ImmutableList.of("a", "b", "c");

    private static Bdd create(DontCarePolicy policy) {
        return BddFactory.buildBdd(ImmutableBddConfiguration.builder().dontCarePolicy(policy).build());
    }

    /* Every gate reads driven signals only and every signal is driven at most once. */
    private static void checkWellFormed(Netlist netlist) {
        Set<Signal> driven = new HashSet<>(netlist.inputs());
        for (Gate gate : netlist.gates()) {
            for (Signal input : gate.inputs()) {
                assertThat("Undriven input of " + gate, input.isConstant() || driven.contains(input), is(true));
            }
            assertThat("Multiple drivers of " + gate.output(), driven.add(gate.output()), is(true));
        }
        Signal output = netlist.output();
        assertThat(output.isConstant() || driven.contains(output), is(true));
    }

    private static long driversOf(Netlist netlist, Signal signal) {
        return netlist.gates().stream().filter(gate -> gate.output().equals(signal)).count();
    }

    @Test
    public void testExampleFunction() {
        MintermTruthTable table = MintermTruthTable.of(3, new int[] {0, 1, 2, 7}, new int[] {4});
        for (DontCarePolicy policy : DontCarePolicy.values()) {
            Bdd bdd = create(policy);
            int root = bdd.buildFromTruthTable(table);
            Netlist netlist = new NetlistSynthesizer(bdd).synthesize(root, NAMES, "f");
            checkWellFormed(netlist);

            for (int minterm = 0; minterm < 8; minterm++) {
                TruthValue value = table.valueOf(minterm);
                if (value.isDefined()) {
                    assertThat(netlist.evaluate(TruthTable.assignmentOf(minterm, 3)), is(value == TruthValue.ON));
                }
            }
            assertThat(netlist.output(), is(Signal.output("f")));
            Gate last = netlist.gates().get(netlist.gateCount() - 1);
            assertThat(last.kind(), is(GateKind.BUFFER));
            assertThat(last.inputs(), contains(netlist.signalOf(root)));
        }
    }

    @ParameterizedTest
    @EnumSource(DontCarePolicy.class)
    public void testAllFunctionsOfThreeVariables(DontCarePolicy policy) {
        for (int function = 0; function < 256; function++) {
            BitSet on = new BitSet();
            for (int minterm = 0; minterm < 8; minterm++) {
                if ((function >>> minterm & 1) != 0) {
                    on.set(minterm);
                }
            }
            Bdd bdd = create(policy);
            int root = bdd.buildFromOnSet(on, new BitSet(), 3);
            NetlistSynthesizer synthesizer = new NetlistSynthesizer(bdd);

            List<Netlist> netlists =
                    List.of(synthesizer.synthesize(root, NAMES), synthesizer.synthesize(root, NAMES, "y"));
            for (Netlist netlist : netlists) {
                checkWellFormed(netlist);
                for (int minterm = 0; minterm < 8; minterm++) {
                    assertThat("Function " + function + " minterm " + minterm,
                            netlist.evaluate(TruthTable.assignmentOf(minterm, 3)), is(on.get(minterm)));
                }
                assertThat(netlist.gateCount(), lessThanOrEqualTo(4 * bdd.reachableNodeCount(root) + 1));

                Set<Signal> nodeSignals = new HashSet<>();
                for (Map.Entry<Integer, Signal> entry : netlist.signalMap().entrySet()) {
                    if (bdd.isLeaf(entry.getKey())) {
                        assertThat(entry.getValue().isConstant(), is(true));
                        continue;
                    }
                    assertThat(nodeSignals.add(entry.getValue()), is(true));
                    assertThat(driversOf(netlist, entry.getValue()), is(1L));
                }
                assertThat(nodeSignals.size(), is(bdd.reachableNodeCount(root)));
            }
        }
    }

    @Test
    public void testRandomFunctionsWithDontCares() {
        Random random = new Random(5);
        List<String> names = ImmutableList.of("p", "q", "r", "s", "t");
        for (int i = 0; i < 200; i++) {
            BitSet on = new BitSet();
            BitSet dontCare = new BitSet();
            for (int minterm = 0; minterm < 32; minterm++) {
                int draw = random.nextInt(5);
                if (draw < 2) {
                    on.set(minterm);
                } else if (draw == 2) {
                    dontCare.set(minterm);
                }
            }
            for (DontCarePolicy policy : DontCarePolicy.values()) {
                Bdd bdd = create(policy);
                int root = bdd.buildFromOnSet(on, dontCare, 5);
                Netlist netlist = new NetlistSynthesizer(bdd).synthesize(root, names, "out");
                checkWellFormed(netlist);
                for (int minterm = 0; minterm < 32; minterm++) {
                    if (!dontCare.get(minterm)) {
                        assertThat(netlist.evaluate(TruthTable.assignmentOf(minterm, 5)), is(on.get(minterm)));
                    }
                }
            }
        }
    }

    @Test
    public void testSharedNodeYieldsSingleGate() {
        Bdd bdd = BddFactory.buildBdd(4, ImmutableBddConfiguration.builder().build());
        int x0 = bdd.variableNode(0);
        int x1 = bdd.variableNode(1);
        int shared = bdd.xor(bdd.variableNode(2), bdd.variableNode(3));
        int root = bdd.ifThenElse(x0, bdd.and(x1, shared), bdd.or(x1, shared));

        Netlist netlist = new NetlistSynthesizer(bdd).synthesize(root, ImmutableList.of("w", "x", "y", "z"));
        checkWellFormed(netlist);
        assertThat(netlist.gateCounts().get(GateKind.XOR), is(1));
        assertThat(driversOf(netlist, netlist.signalOf(shared)), is(1L));
        for (int minterm = 0; minterm < 16; minterm++) {
            boolean[] assignment = TruthTable.assignmentOf(minterm, 4);
            assertThat(netlist.evaluate(assignment), is(bdd.evaluate(root, assignment)));
        }
    }

    @Test
    public void testNodeClassification() {
        Bdd bdd = BddFactory.buildBdd(3, ImmutableBddConfiguration.builder().build());
        int x = bdd.variableNode(0);
        int y = bdd.variableNode(1);
        int z = bdd.variableNode(2);
        NetlistSynthesizer synthesizer = new NetlistSynthesizer(bdd);

        Netlist and = synthesizer.synthesize(bdd.and(x, y), NAMES);
        assertThat(and.gateCounts().keySet(), contains(GateKind.AND, GateKind.BUFFER));

        Netlist or = synthesizer.synthesize(bdd.or(x, y), NAMES);
        assertThat(or.gateCounts().keySet(), contains(GateKind.OR, GateKind.BUFFER));

        Netlist xor = synthesizer.synthesize(bdd.xor(x, y), NAMES);
        assertThat(xor.gateCounts().keySet(), contains(GateKind.NOT, GateKind.XOR, GateKind.BUFFER));

        Netlist inverter = synthesizer.synthesize(bdd.not(x), NAMES);
        assertThat(inverter.gates(), contains(Gate.of(GateKind.NOT, Signal.wire("n0"), Signal.input("a"))));
        assertThat(inverter.output(), is(Signal.wire("n0")));

        Netlist multiplexer = synthesizer.synthesize(bdd.ifThenElse(x, y, z), NAMES);
        assertThat(multiplexer.gateCounts().keySet(),
                contains(GateKind.AND, GateKind.OR, GateKind.NOT, GateKind.BUFFER));
        assertThat(multiplexer.gateCounts().get(GateKind.AND), is(2));
        assertThat(multiplexer.gateCounts().get(GateKind.OR), is(1));
    }

    @Test
    public void testInverterIsReused() {
        Bdd bdd = BddFactory.buildBdd(3, ImmutableBddConfiguration.builder().build());
        int x = bdd.variableNode(0);
        int y = bdd.variableNode(1);
        int z = bdd.variableNode(2);
        // Both the multiplexer and the function of the low successor invert a
        int root = bdd.ifThenElse(x, y, bdd.and(bdd.not(y), z));
        Netlist netlist = new NetlistSynthesizer(bdd).synthesize(root, NAMES);
        checkWellFormed(netlist);
        long inverters = netlist.gates().stream()
                .filter(gate -> gate.kind() == GateKind.NOT)
                .map(gate -> gate.inputs().get(0))
                .distinct()
                .count();
        assertThat(netlist.gateCounts().get(GateKind.NOT), is((int) inverters));
    }

    @ParameterizedTest
    @EnumSource(DontCarePolicy.class)
    public void testConstantRoot(DontCarePolicy policy) {
        Bdd bdd = create(policy);
        int root = bdd.buildFromOnSet(new BitSet(), new BitSet(), 3);
        Netlist unnamed = new NetlistSynthesizer(bdd).synthesize(root, NAMES);
        assertThat(unnamed.gates(), empty());
        assertThat(unnamed.output(), is(Signal.constant(false)));
        assertThat(unnamed.evaluate(new boolean[3]), is(false));
        assertThat(unnamed.inputs().size(), is(3));
    }

    @ParameterizedTest
    @EnumSource(DontCarePolicy.class)
    public void testConstantRootKeepsOutputName(DontCarePolicy policy) {
        Bdd bdd = create(policy);
        BitSet all = new BitSet();
        all.set(0, 8);
        for (boolean value : new boolean[] {false, true}) {
            int root = bdd.buildFromOnSet(value ? all : new BitSet(), new BitSet(), 3);
            Netlist netlist = new NetlistSynthesizer(bdd).synthesize(root, NAMES, "f");
            checkWellFormed(netlist);
            assertThat(netlist.output(), is(Signal.output("f")));
            assertThat(netlist.gates(),
                    contains(Gate.of(GateKind.BUFFER, Signal.output("f"), Signal.constant(value))));
            for (int minterm = 0; minterm < 8; minterm++) {
                assertThat(netlist.evaluate(TruthTable.assignmentOf(minterm, 3)), is(value));
            }
        }
    }

    @Test
    public void testParityUsesNoMultiplexers() {
        int variables = 10;
        Bdd bdd = BddFactory.buildBdd(variables, ImmutableBddConfiguration.builder().build());
        List<String> names = new ArrayList<>(variables);
        int root = Bdd.FALSE_NODE;
        for (int i = 0; i < variables; i++) {
            root = bdd.xor(root, bdd.variableNode(i));
            names.add("x" + i);
        }
        Netlist netlist = new NetlistSynthesizer(bdd).synthesize(root, names, "parity");
        checkWellFormed(netlist);

        // Both successors of every node are complements of each other
        Map<GateKind, Integer> counts = netlist.gateCounts();
        assertThat(counts, not(hasKey(GateKind.AND)));
        assertThat(counts, not(hasKey(GateKind.OR)));
        assertThat(counts.get(GateKind.NOT), is(1));
        for (int minterm = 0; minterm < 1 << variables; minterm++) {
            assertThat(netlist.evaluate(TruthTable.assignmentOf(minterm, variables)),
                    is(Integer.bitCount(minterm) % 2 == 1));
        }
    }

    @Test
    public void testRejectsInvalidArguments() {
        Bdd bdd = BddFactory.buildBdd(3, ImmutableBddConfiguration.builder().build());
        int root = bdd.and(bdd.variableNode(0), bdd.variableNode(2));
        NetlistSynthesizer synthesizer = new NetlistSynthesizer(bdd);

        assertThrows(InvalidDiagramReferenceException.class, () -> synthesizer.synthesize(bdd.nodeCount(), NAMES));
        assertThrows(InvalidDiagramReferenceException.class, () -> synthesizer.synthesize(-3, NAMES));
        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(root, List.of("a", "b")));
        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(root, List.of("a", "b", "a")));
        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(root, List.of("a", "n1", "c")));
        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(root, NAMES, "c"));

        Netlist netlist = synthesizer.synthesize(root, NAMES);
        assertThrows(IllegalArgumentException.class, () -> netlist.evaluate(new boolean[2]));
    }

    @Test
    public void testIncompleteTableIsReported() {
        Bdd bdd = BddFactory.buildBdd(2, ImmutableBddConfiguration.builder().build());
        int root = bdd.and(bdd.variableNode(0), bdd.variableNode(1));
        NetlistSynthesizer synthesizer = new NetlistSynthesizer(bdd, PatternTable.empty());
        assertThrows(IncompletePatternTableException.class, () -> synthesizer.synthesize(root, List.of("a", "b")));
    }

    @Test
    public void testStatistics() {
        Bdd bdd = BddFactory.buildBdd(3, ImmutableBddConfiguration.builder().build());
        int root = bdd.ifThenElse(bdd.variableNode(0), bdd.variableNode(1), bdd.variableNode(2));
        Netlist netlist = new NetlistSynthesizer(bdd).synthesize(root, NAMES, "f");
        int total = netlist.gateCounts().values().stream().mapToInt(Integer::intValue).sum();
        assertThat(total, is(netlist.gateCount()));
        assertThat(netlist.statistics().contains(netlist.gateCount() + " gates"), is(true));
        assertThrows(UnsupportedOperationException.class, () -> netlist.signalMap().put(0, Signal.constant(true)));
        assertThrows(IllegalArgumentException.class, () -> netlist.signalOf(bdd.nodeCount() + 1));
    }
}
