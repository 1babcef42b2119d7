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
package de.tum.in.bddsynth;

import java.util.BitSet;

/**
 * Truth table given by explicit on and don't-care minterm sets. All other minterms are off.
 */
public final class MintermTruthTable implements TruthTable {
    static final int MAXIMAL_VARIABLE_COUNT = 30;

    private final int numberOfVariables;
    private final BitSet onSet;
    private final BitSet dontCareSet;

    public MintermTruthTable(int numberOfVariables, BitSet onSet, BitSet dontCareSet) {
        Util.checkArgument(0 <= numberOfVariables && numberOfVariables <= MAXIMAL_VARIABLE_COUNT,
                "Unsupported number of variables %d", numberOfVariables);
        int size = 1 << numberOfVariables;
        Util.checkArgument(onSet.length() <= size, "On minterm %d out of range for %d variables",
                onSet.length() - 1, numberOfVariables);
        Util.checkArgument(dontCareSet.length() <= size, "Don't-care minterm %d out of range for %d variables",
                dontCareSet.length() - 1, numberOfVariables);
        Util.checkArgument(!onSet.intersects(dontCareSet), "Minterms %s are both on and don't-care",
                BitSets.intersection(onSet, dontCareSet));

        this.numberOfVariables = numberOfVariables;
        this.onSet = BitSets.copyOf(onSet);
        this.dontCareSet = BitSets.copyOf(dontCareSet);
    }

    public static MintermTruthTable of(int numberOfVariables, int[] onSet, int[] dontCareSet) {
        return new MintermTruthTable(numberOfVariables, BitSets.of(onSet), BitSets.of(dontCareSet));
    }

    @Override
    public int numberOfVariables() {
        return numberOfVariables;
    }

    @Override
    public TruthValue valueOf(int minterm) {
        if (minterm < 0 || minterm >= size()) {
            throw new IndexOutOfBoundsException(
                    String.format("Minterm %d out of range for %d variables", minterm, numberOfVariables));
        }
        if (onSet.get(minterm)) {
            return TruthValue.ON;
        }
        return dontCareSet.get(minterm) ? TruthValue.DONT_CARE : TruthValue.OFF;
    }

    public BitSet onSet() {
        return BitSets.copyOf(onSet);
    }

    public BitSet dontCareSet() {
        return BitSets.copyOf(dontCareSet);
    }

    @Override
    public String toString() {
        return String.format("%d variables, on %s, dc %s", numberOfVariables, onSet, dontCareSet);
    }
}
