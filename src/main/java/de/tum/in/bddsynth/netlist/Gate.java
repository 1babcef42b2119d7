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

import java.util.List;
import org.immutables.value.Value;

/**
 * One instance of a primitive cell.
 */
@Value.Immutable
public abstract class Gate {
    public abstract GateKind kind();

    public abstract List<Signal> inputs();

    public abstract Signal output();

    public static Gate of(GateKind kind, Signal output, Signal... inputs) {
        return ImmutableGate.builder().kind(kind).addInputs(inputs).output(output).build();
    }

    @Value.Check
    protected void check() {
        if (inputs().size() != kind().arity()) {
            throw new IllegalStateException(String.format("%s expects %d inputs, got %s",
                    kind(), kind().arity(), inputs()));
        }
        if (output().isConstant() || output().kind() == Signal.Kind.INPUT) {
            throw new IllegalStateException("Gate cannot drive " + output());
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(output()).append(" = ").append(kind()).append('(');
        List<Signal> inputs = inputs();
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(inputs.get(i));
        }
        return builder.append(')').toString();
    }
}
