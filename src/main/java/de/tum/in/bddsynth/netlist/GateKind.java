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

/**
 * The primitive cells a netlist is built from.
 */
public enum GateKind {
    AND(2),
    OR(2),
    NOT(1),
    NAND(2),
    NOR(2),
    XOR(2),
    XNOR(2),
    BUFFER(1);

    private final int arity;

    GateKind(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    public boolean evaluate(boolean[] inputs) {
        assert inputs.length == arity;
        switch (this) {
            case AND:
                return inputs[0] && inputs[1];
            case OR:
                return inputs[0] || inputs[1];
            case NOT:
                return !inputs[0];
            case NAND:
                return !(inputs[0] && inputs[1]);
            case NOR:
                return !(inputs[0] || inputs[1]);
            case XOR:
                return inputs[0] ^ inputs[1];
            case XNOR:
                return inputs[0] == inputs[1];
            case BUFFER:
                return inputs[0];
            default:
                throw new AssertionError(this);
        }
    }
}
