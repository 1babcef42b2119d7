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

import de.tum.in.bddsynth.netlist.Netlist;
import de.tum.in.bddsynth.netlist.NetlistSynthesizer;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

public class SynthesisBenchmark {
    @State(Scope.Benchmark)
    public static class TruthTableState extends BddState {
        private static final int SEED = 1234;
        private static final int FUNCTION_COUNT = 20;

        @Param({"8", "12"})
        private int variables;

        public List<MintermTruthTable> tables;
        public List<String> names;

        @Setup(Level.Trial)
        public void setUpTables() {
            Random random = new Random(SEED);
            tables = new ArrayList<>(FUNCTION_COUNT);
            for (int i = 0; i < FUNCTION_COUNT; i++) {
                BitSet on = new BitSet();
                BitSet dontCare = new BitSet();
                for (int minterm = 0; minterm < 1 << variables; minterm++) {
                    double draw = random.nextDouble();
                    if (draw < 0.35) {
                        on.set(minterm);
                    } else if (draw < 0.5) {
                        dontCare.set(minterm);
                    }
                }
                tables.add(new MintermTruthTable(variables, on, dontCare));
            }
            names = new ArrayList<>(variables);
            for (int i = 0; i < variables; i++) {
                names.add("x" + i);
            }
        }
    }

    @Benchmark
    public static void benchmarkBuild(TruthTableState state, Blackhole blackhole) {
        Bdd bdd = state.bdd();
        for (MintermTruthTable table : state.tables) {
            blackhole.consume(bdd.buildFromTruthTable(table));
        }
    }

    @Benchmark
    public static void benchmarkBuildAndSynthesize(TruthTableState state, Blackhole blackhole) {
        Bdd bdd = state.bdd();
        NetlistSynthesizer synthesizer = new NetlistSynthesizer(bdd);
        for (MintermTruthTable table : state.tables) {
            Netlist netlist = synthesizer.synthesize(bdd.buildFromTruthTable(table), state.names);
            blackhole.consume(netlist.gateCount());
        }
    }

    @Benchmark
    public static void benchmarkIfThenElse(TruthTableState state, Blackhole blackhole) {
        Bdd bdd = state.bdd();
        int previous = bdd.falseNode();
        for (MintermTruthTable table : state.tables) {
            int node = bdd.buildFromTruthTable(table);
            previous = bdd.ifThenElse(bdd.variableNode(0), node, bdd.xor(previous, node));
        }
        blackhole.consume(previous);
    }
}
