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

import de.tum.in.bddsynth.MintermTruthTable;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.immutables.value.Value;

/**
 * A named, partially specified Boolean function given by its on and don't-care minterms.
 */
@Value.Immutable
public abstract class MintermSpec {
    public abstract String name();

    public abstract List<Integer> onSet();

    public abstract List<Integer> dontCareSet();

    public static MintermSpec of(String name, List<Integer> onSet, List<Integer> dontCareSet) {
        return ImmutableMintermSpec.builder().name(name).onSet(onSet).dontCareSet(dontCareSet).build();
    }

    /**
     * Draws a random function. Every minterm is on with probability {@code onRatio}, otherwise
     * don't-care with probability {@code dontCareRatio}. At least one minterm is on.
     */
    public static MintermSpec random(String name, int numberOfVariables, double onRatio, double dontCareRatio,
            Random random) {
        if (numberOfVariables < 0 || numberOfVariables > 20) {
            throw new IllegalArgumentException("Unsupported number of variables " + numberOfVariables);
        }
        if (onRatio < 0.0 || dontCareRatio < 0.0 || onRatio + dontCareRatio > 1.0) {
            throw new IllegalArgumentException(
                    String.format("Invalid ratios on %f, don't-care %f", onRatio, dontCareRatio));
        }
        ImmutableMintermSpec.Builder builder = ImmutableMintermSpec.builder().name(name);
        int size = 1 << numberOfVariables;
        boolean anyOn = false;
        int forcedOn = random.nextInt(size);
        for (int minterm = 0; minterm < size; minterm++) {
            double draw = random.nextDouble();
            if (draw < onRatio) {
                builder.addOnSet(minterm);
                anyOn = true;
            } else if (draw < onRatio + dontCareRatio && minterm != forcedOn) {
                builder.addDontCareSet(minterm);
            }
        }
        if (!anyOn) {
            builder.addOnSet(forcedOn);
        }
        return builder.build();
    }

    public MintermTruthTable toTruthTable(int numberOfVariables) {
        return MintermTruthTable.of(numberOfVariables,
                onSet().stream().mapToInt(Integer::intValue).toArray(),
                dontCareSet().stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Renders this function in the format understood by {@link MintermSpecReader}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(name()).append(" = m(").append(join(onSet())).append(')');
        if (!dontCareSet().isEmpty()) {
            builder.append(" + d(").append(join(dontCareSet())).append(')');
        }
        return builder.toString();
    }

    private static String join(List<Integer> minterms) {
        return minterms.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
