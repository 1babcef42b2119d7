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
 * Determines how don't-care minterms are resolved while building a diagram from a truth table.
 * Every policy agrees with the table on all defined minterms; they only differ in diagram size.
 */
public enum DontCarePolicy {
    /**
     * Every don't-care minterm is treated as off.
     */
    ASSIGN_FALSE,
    /**
     * Don't-care minterms take the value which allows two cofactors to coincide. A sub-table without
     * on minterms becomes {@code false}, one without off minterms becomes {@code true} and two
     * cofactor sub-tables without conflicting defined positions are merged, eliminating the test.
     */
    MERGE
}
