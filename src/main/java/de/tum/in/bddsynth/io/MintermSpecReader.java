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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Reads functions in sum-of-minterms notation, one per line, e.g.
 * <pre>
 * # comment
 * f = m(0, 1, 2, 7) + d(4)
 * g = m{3, 5}
 * </pre>
 */
public final class MintermSpecReader {
    private static final Pattern LINE = Pattern.compile(
            "([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*m\\s*(?:\\(([^)]*)\\)|\\{([^}]*)\\})"
                    + "\\s*(?:\\+\\s*d\\s*(?:\\(([^)]*)\\)|\\{([^}]*)\\}))?");
    private static final Pattern SEPARATOR = Pattern.compile("\\s*,\\s*");

    private MintermSpecReader() {}

    @Nullable
    private static String nextLine(BufferedReader reader) throws IOException {
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.strip();
            if (!line.isEmpty()) {
                return line;
            }
        }
    }

    /**
     * Reads all functions of the given stream.
     *
     * @param numberOfVariables
     *     The number of inputs, which bounds the minterm indices.
     *
     * @throws InvalidFormatException
     *     if a line is malformed, an index is out of range, a minterm is both on and don't-care, a
     *     name repeats or the stream contains no function.
     */
    public static List<MintermSpec> read(BufferedReader reader, int numberOfVariables)
            throws IOException, InvalidFormatException {
        if (numberOfVariables < 0 || numberOfVariables > 30) {
            throw new IllegalArgumentException("Unsupported number of variables " + numberOfVariables);
        }
        List<MintermSpec> specs = new ArrayList<>();
        Set<String> names = new HashSet<>();
        while (true) {
            String line = nextLine(reader);
            if (line == null) {
                break;
            }
            Matcher matcher = LINE.matcher(line);
            if (!matcher.matches()) {
                throw new InvalidFormatException("Invalid line " + line);
            }
            String name = matcher.group(1);
            if (!names.add(name)) {
                throw new InvalidFormatException("Duplicate function " + name);
            }
            String onList = matcher.group(2) == null ? matcher.group(3) : matcher.group(2);
            String dontCareList = matcher.group(4) == null ? matcher.group(5) : matcher.group(4);
            List<Integer> onSet = parseIndices(onList, numberOfVariables, line);
            List<Integer> dontCareSet = dontCareList == null
                    ? List.of()
                    : parseIndices(dontCareList, numberOfVariables, line);

            BitSet on = new BitSet();
            onSet.forEach(on::set);
            for (int minterm : dontCareSet) {
                if (on.get(minterm)) {
                    throw new InvalidFormatException(
                            String.format("Minterm %d of %s is both on and don't-care", minterm, name));
                }
            }
            specs.add(MintermSpec.of(name, onSet, dontCareSet));
        }
        if (specs.isEmpty()) {
            throw new InvalidFormatException("No function specified");
        }
        return specs;
    }

    private static List<Integer> parseIndices(String list, int numberOfVariables, String line)
            throws InvalidFormatException {
        String stripped = list.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        long size = 1L << numberOfVariables;
        BitSet seen = new BitSet();
        List<Integer> indices = new ArrayList<>();
        for (String element : SEPARATOR.split(stripped)) {
            int index;
            try {
                index = Integer.parseInt(element);
            } catch (NumberFormatException e) {
                throw new InvalidFormatException("Invalid minterm " + element + " in " + line, e);
            }
            if (index < 0 || index >= size) {
                throw new InvalidFormatException(String.format("Minterm %d out of range for %d variables in %s",
                        index, numberOfVariables, line));
            }
            if (!seen.get(index)) {
                seen.set(index);
                indices.add(index);
            }
        }
        return indices;
    }
}
