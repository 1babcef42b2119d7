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

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A combinational gate-level circuit with a single output. Gates are stored in a valid evaluation
 * order, i.e. every gate only reads primary inputs, constants and outputs of earlier gates.
 */
public final class Netlist {
    private final List<Signal> inputs;
    private final List<Gate> gates;
    private final Signal output;
    private final Map<Integer, Signal> signalMap;

    Netlist(List<Signal> inputs, List<Gate> gates, Signal output, Map<Integer, Signal> signalMap) {
        this.inputs = List.copyOf(inputs);
        this.gates = List.copyOf(gates);
        this.output = output;
        this.signalMap = Collections.unmodifiableMap(signalMap);
    }

    /**
     * The primary inputs, one per variable in variable order.
     */
    public List<Signal> inputs() {
        return inputs;
    }

    public List<Gate> gates() {
        return gates;
    }

    public Signal output() {
        return output;
    }

    /**
     * Unmodifiable map from every diagram node visited during synthesis to the signal carrying its
     * function.
     */
    public Map<Integer, Signal> signalMap() {
        return signalMap;
    }

    public Signal signalOf(int node) {
        Signal signal = signalMap.get(node);
        if (signal == null) {
            throw new IllegalArgumentException(String.format("Node %d has no signal", node));
        }
        return signal;
    }

    public int gateCount() {
        return gates.size();
    }

    public Map<GateKind, Integer> gateCounts() {
        Map<GateKind, Integer> counts = new EnumMap<>(GateKind.class);
        for (Gate gate : gates) {
            counts.merge(gate.kind(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Simulates the circuit on the given input values.
     *
     * @throws IllegalArgumentException if the number of values differs from the number of inputs.
     */
    public boolean evaluate(boolean[] assignment) {
        if (assignment.length != inputs.size()) {
            throw new IllegalArgumentException(String.format("Expected %d input values, got %d",
                    inputs.size(), assignment.length));
        }
        Map<Signal, Boolean> values = new HashMap<>();
        for (int i = 0; i < assignment.length; i++) {
            values.put(inputs.get(i), assignment[i]);
        }
        for (Gate gate : gates) {
            List<Signal> gateInputs = gate.inputs();
            boolean[] inputValues = new boolean[gateInputs.size()];
            for (int i = 0; i < inputValues.length; i++) {
                inputValues[i] = valueOf(values, gateInputs.get(i));
            }
            values.put(gate.output(), gate.kind().evaluate(inputValues));
        }
        return valueOf(values, output);
    }

    private static boolean valueOf(Map<Signal, Boolean> values, Signal signal) {
        if (signal.isConstant()) {
            return signal.constantValue();
        }
        Boolean value = values.get(signal);
        assert value != null : "Signal " + signal + " read before it is driven";
        return value;
    }

    public String statistics() {
        StringBuilder builder = new StringBuilder(64);
        builder.append("Netlist: ").append(inputs.size()).append(" inputs, ")
                .append(gates.size()).append(" gates");
        Map<GateKind, Integer> counts = gateCounts();
        if (!counts.isEmpty()) {
            builder.append(' ').append(counts);
        }
        return builder.append(", output ").append(output).toString();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("inputs ").append(inputs).append('\n');
        for (Gate gate : gates) {
            builder.append(gate).append('\n');
        }
        return builder.append("output ").append(output).toString();
    }
}
