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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;

/**
 * Lookup from a four bit truth table index to the corresponding {@link TwoInputFunction}.
 */
public final class PatternTable {
    public static final int SIZE = 16;

    private static final PatternTable STANDARD = new PatternTable(Arrays.asList(TwoInputFunction.values()));

    private final TwoInputFunction[] entries;

    PatternTable(Collection<TwoInputFunction> functions) {
        entries = new TwoInputFunction[SIZE];
        for (TwoInputFunction function : functions) {
            entries[function.truthTable()] = function;
        }
    }

    /**
     * Returns the complete table containing all sixteen functions.
     */
    public static PatternTable standard() {
        return STANDARD;
    }

    static PatternTable empty() {
        return new PatternTable(Collections.emptyList());
    }

    /**
     * Returns the function with the given truth table index.
     *
     * @throws IncompletePatternTableException if the table has no entry for {@code index}.
     */
    public TwoInputFunction lookup(int index) {
        if (index < 0 || index >= SIZE || entries[index] == null) {
            throw new IncompletePatternTableException(index);
        }
        return entries[index];
    }

    public TwoInputFunction lookup(boolean f0g0, boolean f0g1, boolean f1g0, boolean f1g1) {
        return lookup(TwoInputFunction.index(f0g0, f0g1, f1g0, f1g1));
    }

    public boolean isComplete() {
        return Arrays.stream(entries).allMatch(entry -> entry != null);
    }
}
