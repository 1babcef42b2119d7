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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.BitSet;
import org.junit.jupiter.api.Test;

public class MintermTruthTableTest {
    @Test
    public void testValues() {
        MintermTruthTable table = MintermTruthTable.of(3, new int[] {0, 1, 2, 7}, new int[] {4});
        assertThat(table.size(), is(8));
        assertThat(table.valueOf(0), is(TruthValue.ON));
        assertThat(table.valueOf(3), is(TruthValue.OFF));
        assertThat(table.valueOf(4), is(TruthValue.DONT_CARE));
        assertThat(table.valueOf(4).isDefined(), is(false));
        assertThat(table.valueOf(7).isDefined(), is(true));
        assertThrows(IndexOutOfBoundsException.class, () -> table.valueOf(8));
        assertThrows(IndexOutOfBoundsException.class, () -> table.valueOf(-1));
    }

    @Test
    public void testDefensiveCopies() {
        BitSet on = BitSets.of(1, 2);
        MintermTruthTable table = new MintermTruthTable(2, on, new BitSet());
        on.set(3);
        assertThat(table.valueOf(3), is(TruthValue.OFF));
        table.onSet().set(0);
        assertThat(table.valueOf(0), is(TruthValue.OFF));
    }

    @Test
    public void testRejectsInvalidSets() {
        assertThrows(IllegalArgumentException.class, () -> MintermTruthTable.of(2, new int[] {4}, new int[0]));
        assertThrows(IllegalArgumentException.class, () -> MintermTruthTable.of(2, new int[0], new int[] {5}));
        assertThrows(IllegalArgumentException.class, () -> MintermTruthTable.of(2, new int[] {1}, new int[] {1}));
        assertThrows(IllegalArgumentException.class, () -> MintermTruthTable.of(-1, new int[0], new int[0]));
    }
}
