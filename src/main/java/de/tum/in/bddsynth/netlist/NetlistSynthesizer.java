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

import de.tum.in.bddsynth.Bdd;
import de.tum.in.bddsynth.InvalidDiagramReferenceException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Translates a diagram into a netlist of primitive gates. Every internal node computes
 * {@code ITE(x, high, low)} for its variable {@code x}, which is classified as a function of two
 * inputs through the {@link PatternTable} and emitted as one cell, possibly with inverters in front.
 * Nodes where both successors are independent functions are multiplexers and are emitted as
 * {@code OR(AND(x, high), LT(x, low))}.
 *
 * <p>The synthesizer only reads the diagram, it never creates nodes.</p>
 */
public final class NetlistSynthesizer {
    private static final Logger logger = Logger.getLogger(NetlistSynthesizer.class.getName());
    private static final Pattern WIRE_NAME = Pattern.compile("n[0-9]+");

    private final Bdd bdd;
    private final PatternTable patternTable;

    public NetlistSynthesizer(Bdd bdd) {
        this(bdd, PatternTable.standard());
    }

    NetlistSynthesizer(Bdd bdd, PatternTable patternTable) {
        this.bdd = bdd;
        this.patternTable = patternTable;
    }

    public Netlist synthesize(int root, List<String> variableNames) {
        return synthesize(root, variableNames, null);
    }

    /**
     * Synthesizes the function of {@code root}.
     *
     * @param root
     *     The diagram node to synthesize.
     * @param variableNames
     *     Names of the primary inputs, indexed by variable.
     * @param outputName
     *     If given, the result is driven onto an output signal of this name by a final buffer, also
     *     when the function is constant.
     *
     * @throws InvalidDiagramReferenceException if {@code root} is not a node of the diagram.
     * @throws IllegalArgumentException if the names are insufficient, duplicate or clash with wires.
     */
    public Netlist synthesize(int root, List<String> variableNames, @Nullable String outputName) {
        if (!bdd.isNodeValidOrLeaf(root)) {
            throw new InvalidDiagramReferenceException(root);
        }
        BitSet support = bdd.support(root);
        if (support.length() > variableNames.size()) {
            throw new IllegalArgumentException(String.format(
                    "Node %d depends on %d variables but only %d names were given",
                    root, support.length(), variableNames.size()));
        }
        Set<String> names = new HashSet<>();
        for (String name : variableNames) {
            if (WIRE_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Variable name " + name + " clashes with a wire name");
            }
            if (!names.add(name)) {
                throw new IllegalArgumentException("Duplicate variable name " + name);
            }
        }
        if (outputName != null && (names.contains(outputName) || WIRE_NAME.matcher(outputName).matches())) {
            throw new IllegalArgumentException("Output name " + outputName + " is already used");
        }

        Synthesis synthesis = new Synthesis(variableNames);
        Signal rootSignal = synthesis.signalOf(root);
        Signal output = rootSignal;
        if (outputName != null) {
            output = Signal.output(outputName);
            synthesis.gates.add(Gate.of(GateKind.BUFFER, output, rootSignal));
        }

        Netlist netlist = new Netlist(synthesis.inputs, synthesis.gates, output, synthesis.signals);
        logger.log(Level.FINE, "Synthesized {0} gates for {1} diagram nodes",
                new Object[] {netlist.gateCount(), bdd.reachableNodeCount(root)});
        return netlist;
    }

    /* State of a single synthesis run. */
    private final class Synthesis {
        final List<Signal> inputs;
        final List<Gate> gates = new ArrayList<>();
        final Map<Integer, Signal> signals = new HashMap<>();
        private final Map<Signal, Signal> inverters = new HashMap<>();
        private final Map<Long, Boolean> complements = new HashMap<>();
        private int wireCount = 0;

        Synthesis(List<String> variableNames) {
            inputs = new ArrayList<>(variableNames.size());
            for (String name : variableNames) {
                inputs.add(Signal.input(name));
            }
        }

        Signal signalOf(int node) {
            Signal signal = signals.get(node);
            if (signal != null) {
                return signal;
            }
            if (bdd.isLeaf(node)) {
                signal = Signal.constant(node == Bdd.TRUE_NODE);
            } else {
                Signal low = signalOf(bdd.low(node));
                Signal high = signalOf(bdd.high(node));
                signal = synthesizeNode(node, inputs.get(bdd.variableOf(node)), low, high);
            }
            signals.put(node, signal);
            return signal;
        }

        private Signal synthesizeNode(int node, Signal selector, Signal low, Signal high) {
            assert !(low.isConstant() && high.isConstant() && low.equals(high));

            if (!low.isConstant() && !high.isConstant()
                    && !isComplement(bdd.high(node), bdd.low(node))) {
                Signal whenTrue = emit(patternTable.lookup(TwoInputFunction.AND.truthTable()), selector, high);
                Signal whenFalse = emit(patternTable.lookup(TwoInputFunction.LESS_THAN.truthTable()),
                        selector, low);
                return emit(patternTable.lookup(TwoInputFunction.OR.truthTable()), whenTrue, whenFalse);
            }

            // The operand is the non-constant successor, or low if high is its complement
            Signal operand = low.isConstant() ? high : low;
            TwoInputFunction function = patternTable.lookup(TwoInputFunction.index(
                    successorValue(low, operand, false), successorValue(low, operand, true),
                    successorValue(high, operand, false), successorValue(high, operand, true)));
            return emit(function, selector, operand);
        }

        /* Value of a successor signal given the operand value. A non-constant successor which is not
         * the operand is its complement. */
        private boolean successorValue(Signal successor, Signal operand, boolean operandValue) {
            if (successor.isConstant()) {
                return successor.constantValue();
            }
            return successor.equals(operand) == operandValue;
        }

        /* Same as Bdd#isComplement, with results shared over the whole run. */
        private boolean isComplement(int node1, int node2) {
            if (bdd.isLeaf(node1) || bdd.isLeaf(node2)) {
                return bdd.isLeaf(node1) && bdd.isLeaf(node2) && node1 != node2;
            }
            if (bdd.variableOf(node1) != bdd.variableOf(node2)) {
                return false;
            }
            long pair = ((long) node1 << 32) | node2;
            Boolean known = complements.get(pair);
            if (known != null) {
                return known;
            }
            boolean complement = isComplement(bdd.low(node1), bdd.low(node2))
                    && isComplement(bdd.high(node1), bdd.high(node2));
            complements.put(pair, complement);
            return complement;
        }

        private Signal emit(TwoInputFunction function, Signal first, Signal second) {
            if (function.isConstant()) {
                return Signal.constant(function.constantValue());
            }
            List<TwoInputFunction.Operand> operands = function.operands();
            Signal[] gateInputs = new Signal[operands.size()];
            for (int i = 0; i < gateInputs.length; i++) {
                gateInputs[i] = operandSignal(operands.get(i), first, second);
            }
            GateKind kind = function.gateKind();
            assert kind != null;
            if (kind == GateKind.NOT) {
                return inverterOf(gateInputs[0]);
            }
            Signal wire = freshWire();
            gates.add(Gate.of(kind, wire, gateInputs));
            return wire;
        }

        private Signal operandSignal(TwoInputFunction.Operand operand, Signal first, Signal second) {
            switch (operand) {
                case FIRST:
                    return first;
                case SECOND:
                    return second;
                case NOT_FIRST:
                    return inverterOf(first);
                case NOT_SECOND:
                    return inverterOf(second);
                default:
                    throw new AssertionError(operand);
            }
        }

        private Signal inverterOf(Signal signal) {
            if (signal.isConstant()) {
                return Signal.constant(!signal.constantValue());
            }
            Signal inverted = inverters.get(signal);
            if (inverted == null) {
                inverted = freshWire();
                gates.add(Gate.of(GateKind.NOT, inverted, signal));
                inverters.put(signal, inverted);
            }
            return inverted;
        }

        private Signal freshWire() {
            Signal wire = Signal.wire("n" + wireCount);
            wireCount += 1;
            return wire;
        }
    }
}
