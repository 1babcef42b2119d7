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

public final class BddFactory {
    private BddFactory() {}

    public static Bdd buildBdd() {
        return buildBdd(ImmutableBddConfiguration.builder().build());
    }

    public static Bdd buildBdd(BddConfiguration configuration) {
        return new BddImpl(configuration);
    }

    public static Bdd buildBddRecursive(BddConfiguration configuration) {
        return buildBdd(ImmutableBddConfiguration.copyOf(configuration).withIterative(false));
    }

    public static Bdd buildBddIterative(BddConfiguration configuration) {
        return buildBdd(ImmutableBddConfiguration.copyOf(configuration).withIterative(true));
    }

    /**
     * Creates a diagram with {@code variableCount} variables already allocated.
     */
    public static Bdd buildBdd(int variableCount, BddConfiguration configuration) {
        Bdd bdd = buildBdd(configuration);
        bdd.createVariables(variableCount);
        return bdd;
    }
}
