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
 * Thrown when a node is classified into a pattern for which the table has no entry. With the
 * standard table this cannot happen.
 */
public class IncompletePatternTableException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final int index;

    public IncompletePatternTableException(int index) {
        super("No pattern for index " + index);
        this.index = index;
    }

    public int index() {
        return index;
    }
}
