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
package de.tum.in.bddsynth.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.bddsynth.MintermTruthTable;
import de.tum.in.bddsynth.TruthValue;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class MintermSpecReaderTest {
    private static List<MintermSpec> read(String text, int variables) throws IOException, InvalidFormatException {
        return MintermSpecReader.read(new BufferedReader(new StringReader(text)), variables);
    }

    @Test
    public void testReadsFunctions() throws IOException, InvalidFormatException {
        List<MintermSpec> specs = read("# two outputs\n"
                + "\n"
                + "f = m(0, 1, 2, 7) + d(4)\n"
                + "  g=m{3,5}   # no don't-cares\n"
                + "h = m() + d{1}\n", 3);

        assertThat(specs.size(), is(3));
        MintermSpec f = specs.get(0);
        assertThat(f.name(), is("f"));
        assertThat(f.onSet(), contains(0, 1, 2, 7));
        assertThat(f.dontCareSet(), contains(4));
        assertThat(specs.get(1).name(), is("g"));
        assertThat(specs.get(1).onSet(), contains(3, 5));
        assertThat(specs.get(1).dontCareSet(), empty());
        assertThat(specs.get(2).onSet(), empty());
        assertThat(specs.get(2).dontCareSet(), contains(1));

        MintermTruthTable table = f.toTruthTable(3);
        assertThat(table.valueOf(4), is(TruthValue.DONT_CARE));
        assertThat(table.valueOf(7), is(TruthValue.ON));
        assertThat(table.valueOf(6), is(TruthValue.OFF));
    }

    @Test
    public void testDuplicateIndicesAreMerged() throws IOException, InvalidFormatException {
        List<MintermSpec> specs = read("f = m(1, 1, 3)", 2);
        assertThat(specs.get(0).onSet(), contains(1, 3));
    }

    @Test
    public void testRejectsMalformedInput() {
        assertThrows(InvalidFormatException.class, () -> read("", 3));
        assertThrows(InvalidFormatException.class, () -> read("# only a comment\n", 3));
        assertThrows(InvalidFormatException.class, () -> read("f = 0, 1", 3));
        assertThrows(InvalidFormatException.class, () -> read("f = m(0, x)", 3));
        assertThrows(InvalidFormatException.class, () -> read("f = m(0, 1}", 3));
        assertThrows(InvalidFormatException.class, () -> read("f = m(0) + q(1)", 3));
        assertThrows(InvalidFormatException.class, () -> read("1f = m(0)", 3));
        assertThrows(InvalidFormatException.class, () -> read("f = m(0)\nf = m(1)", 3));
    }

    @Test
    public void testRejectsInvalidIndices() {
        InvalidFormatException range = assertThrows(InvalidFormatException.class, () -> read("f = m(8)", 3));
        assertThat(range.getMessage(), containsString("out of range"));
        assertThrows(InvalidFormatException.class, () -> read("f = m(-1)", 3));
        InvalidFormatException overlap =
                assertThrows(InvalidFormatException.class, () -> read("f = m(1, 2) + d(2)", 3));
        assertThat(overlap.getMessage(), containsString("both on and don't-care"));
    }

    @Test
    public void testRoundTripOfRandomSpecification() throws IOException, InvalidFormatException {
        Random random = new Random(1);
        MintermSpec spec = MintermSpec.random("f0", 4, 0.35, 0.15, random);
        assertThat(spec.onSet().isEmpty(), is(false));
        List<MintermSpec> read = read(spec.toString(), 4);
        assertThat(read, contains(spec));
    }

    @Test
    public void testRandomSpecificationHasOnMinterm() {
        Random random = new Random(2);
        for (int i = 0; i < 20; i++) {
            MintermSpec spec = MintermSpec.random("f", 2, 0.0, 0.5, random);
            assertThat(spec.onSet().size(), is(1));
            assertThat(spec.dontCareSet().contains(spec.onSet().get(0)), is(false));
        }
        assertThrows(IllegalArgumentException.class, () -> MintermSpec.random("f", 2, 0.7, 0.5, random));
    }
}
