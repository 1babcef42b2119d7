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
import javax.annotation.Nullable;

/**
 * The sixteen Boolean functions {@code F(f, g)} of two inputs together with their realization by
 * primitive cells. A function is identified by its truth table
 * {@code F(0,0) F(0,1) F(1,0) F(1,1)}, read as a four bit number with {@code F(0,0)} as most
 * significant bit.
 *
 * <p>Four functions (f &gt; g, f &lt; g, f &ge; g, f &le; g) have no primitive of their own. They
 * are composites which invert one operand before the final AND or OR.</p>
 */
public enum TwoInputFunction {
    FALSE(0b0000, false),
    AND(0b0001, GateKind.AND, Operand.FIRST, Operand.SECOND),
    GREATER_THAN(0b0010, GateKind.AND, Operand.FIRST, Operand.NOT_SECOND),
    FIRST(0b0011, GateKind.BUFFER, Operand.FIRST),
    LESS_THAN(0b0100, GateKind.AND, Operand.NOT_FIRST, Operand.SECOND),
    SECOND(0b0101, GateKind.BUFFER, Operand.SECOND),
    XOR(0b0110, GateKind.XOR, Operand.FIRST, Operand.SECOND),
    OR(0b0111, GateKind.OR, Operand.FIRST, Operand.SECOND),
    NOR(0b1000, GateKind.NOR, Operand.FIRST, Operand.SECOND),
    XNOR(0b1001, GateKind.XNOR, Operand.FIRST, Operand.SECOND),
    NOT_SECOND(0b1010, GateKind.NOT, Operand.SECOND),
    GREATER_EQUAL(0b1011, GateKind.OR, Operand.FIRST, Operand.NOT_SECOND),
    NOT_FIRST(0b1100, GateKind.NOT, Operand.FIRST),
    LESS_EQUAL(0b1101, GateKind.OR, Operand.NOT_FIRST, Operand.SECOND),
    NAND(0b1110, GateKind.NAND, Operand.FIRST, Operand.SECOND),
    TRUE(0b1111, true);

    /**
     * Input of the realizing cell, possibly through an inverter.
     */
    public enum Operand {
        FIRST,
        SECOND,
        NOT_FIRST,
        NOT_SECOND;

        public boolean isInverted() {
            return this == NOT_FIRST || this == NOT_SECOND;
        }

        public boolean value(boolean first, boolean second) {
            switch (this) {
                case FIRST:
                    return first;
                case SECOND:
                    return second;
                case NOT_FIRST:
                    return !first;
                case NOT_SECOND:
                    return !second;
                default:
                    throw new AssertionError(this);
            }
        }
    }

    private final int truthTable;
    @Nullable
    private final GateKind gateKind;
    private final List<Operand> operands;

    TwoInputFunction(int truthTable, boolean constant) {
        assert truthTable == (constant ? 0b1111 : 0b0000);
        this.truthTable = truthTable;
        this.gateKind = null;
        this.operands = List.of();
    }

    TwoInputFunction(int truthTable, GateKind gateKind, Operand... operands) {
        assert gateKind.arity() == operands.length;
        this.truthTable = truthTable;
        this.gateKind = gateKind;
        this.operands = List.of(operands);
    }

    /**
     * Computes the truth table index of the function with the given values.
     */
    public static int index(boolean f0g0, boolean f0g1, boolean f1g0, boolean f1g1) {
        return (f0g0 ? 0b1000 : 0) | (f0g1 ? 0b0100 : 0) | (f1g0 ? 0b0010 : 0) | (f1g1 ? 0b0001 : 0);
    }

    public int truthTable() {
        return truthTable;
    }

    public boolean evaluate(boolean first, boolean second) {
        int position = 3 - ((first ? 2 : 0) + (second ? 1 : 0));
        return ((truthTable >>> position) & 1) != 0;
    }

    public boolean isConstant() {
        return gateKind == null;
    }

    /**
     * Returns the constant value of a constant function.
     *
     * @throws IllegalStateException if this function is not constant.
     */
    public boolean constantValue() {
        if (!isConstant()) {
            throw new IllegalStateException(this + " is not constant");
        }
        return truthTable != 0;
    }

    /**
     * Returns the cell computing this function or {@code null} for constants.
     */
    @Nullable
    public GateKind gateKind() {
        return gateKind;
    }

    public List<Operand> operands() {
        return operands;
    }

    /**
     * Whether the realization needs inverters in addition to its cell.
     */
    public boolean isComposite() {
        return operands.stream().anyMatch(Operand::isInverted);
    }
}
