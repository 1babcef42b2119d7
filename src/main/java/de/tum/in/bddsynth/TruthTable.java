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

/**
 * Membership oracle for a (partially specified) Boolean function over a fixed variable ordering.
 * Minterm {@code i} assigns variable {@code 0} to the most significant of the
 * {@link #numberOfVariables()} bits of {@code i}.
 */
public interface TruthTable {
    int numberOfVariables();

    /**
     * Returns the value of the function on the given minterm.
     *
     * @throws IndexOutOfBoundsException if {@code minterm} is not in {@code [0, 2^n)}.
     */
    TruthValue valueOf(int minterm);

    default int size() {
        return 1 << numberOfVariables();
    }

    /**
     * Returns the minterm index of the given assignment of all variables.
     */
    static int mintermOf(boolean[] assignment) {
        int minterm = 0;
        for (boolean value : assignment) {
            minterm = (minterm << 1) | (value ? 1 : 0);
        }
        return minterm;
    }

    /**
     * Inverse of {@link #mintermOf(boolean[])}.
     */
    static boolean[] assignmentOf(int minterm, int numberOfVariables) {
        boolean[] assignment = new boolean[numberOfVariables];
        for (int variable = 0; variable < numberOfVariables; variable++) {
            assignment[variable] = ((minterm >>> (numberOfVariables - 1 - variable)) & 1) != 0;
        }
        return assignment;
    }
}
