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

import org.immutables.value.Value;

/**
 * A named net of a netlist: a primary input, an internal wire, the primary output or one of the
 * two literal constants.
 */
@Value.Immutable
public abstract class Signal {
    public enum Kind {
        INPUT,
        WIRE,
        OUTPUT,
        CONSTANT
    }

    @Value.Parameter
    public abstract Kind kind();

    @Value.Parameter
    public abstract String name();

    public static Signal input(String name) {
        return ImmutableSignal.of(Kind.INPUT, name);
    }

    public static Signal wire(String name) {
        return ImmutableSignal.of(Kind.WIRE, name);
    }

    public static Signal output(String name) {
        return ImmutableSignal.of(Kind.OUTPUT, name);
    }

    public static Signal constant(boolean value) {
        return value ? Constants.TRUE : Constants.FALSE;
    }

    public boolean isConstant() {
        return kind() == Kind.CONSTANT;
    }

    public boolean constantValue() {
        if (!isConstant()) {
            throw new IllegalStateException(name() + " is not a constant");
        }
        return this.equals(Constants.TRUE);
    }

    @Value.Check
    protected void check() {
        if (name().isEmpty()) {
            throw new IllegalStateException("Signal names must not be empty");
        }
    }

    @Override
    public String toString() {
        return name();
    }

    private static final class Constants {
        static final Signal FALSE = ImmutableSignal.of(Kind.CONSTANT, "0");
        static final Signal TRUE = ImmutableSignal.of(Kind.CONSTANT, "1");
    }
}
