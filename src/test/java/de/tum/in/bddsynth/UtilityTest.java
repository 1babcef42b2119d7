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

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

public class UtilityTest {
    @Test
    public void testPrimes() {
        for (int n = 0; n < 10_000; n++) {
            assertThat(String.valueOf(n), Primes.isPrime(n), is(BigInteger.valueOf(n).isProbablePrime(50)));
        }
        assertThat(Primes.nextPrime(0), is(3));
        assertThat(Primes.nextPrime(1024), is(1031));
        assertThat(Primes.nextPrime(1031), is(1031));
    }

    @Test
    public void testMinimum() {
        assertThat(Util.min(3, 1, 2), is(1));
        assertThat(Util.min(-1, 1, 2), is(-1));
        assertThat(Util.min(5, 5, 4), is(4));
    }

    @Test
    public void testChecks() {
        Util.checkArgument(true, "unused %d", 1);
        IllegalArgumentException argument =
                assertThrows(IllegalArgumentException.class, () -> Util.checkArgument(false, "value %d", 7));
        assertThat(argument.getMessage(), is("value 7"));
        assertThrows(IllegalStateException.class, () -> Util.checkState(false));
    }

    @Test
    public void testMintermConversion() {
        assertThat(TruthTable.mintermOf(new boolean[] {true, false, false}), is(4));
        assertThat(TruthTable.mintermOf(new boolean[] {false, true, true}), is(3));
        assertThat(TruthTable.assignmentOf(6, 3), is(new boolean[] {true, true, false}));
        for (int minterm = 0; minterm < 32; minterm++) {
            assertThat(TruthTable.mintermOf(TruthTable.assignmentOf(minterm, 5)), is(minterm));
        }
    }
}
