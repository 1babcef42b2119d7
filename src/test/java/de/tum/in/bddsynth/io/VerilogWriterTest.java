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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.bddsynth.Bdd;
import de.tum.in.bddsynth.BddFactory;
import de.tum.in.bddsynth.MintermTruthTable;
import de.tum.in.bddsynth.netlist.Netlist;
import de.tum.in.bddsynth.netlist.NetlistSynthesizer;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

public class VerilogWriterTest {
    private static final List<String> NAMES = List.of("a", "b", "c");
    private static final MintermTruthTable TABLE = MintermTruthTable.of(3, new int[] {0, 1, 2, 7}, new int[] {4});

    private static int count(String text, String pattern) {
        Matcher matcher = Pattern.compile(pattern).matcher(text);
        int count = 0;
        while (matcher.find()) {
            count += 1;
        }
        return count;
    }

    private static Netlist synthesize(MintermTruthTable table, String outputName) {
        Bdd bdd = BddFactory.buildBdd();
        return new NetlistSynthesizer(bdd).synthesize(bdd.buildFromTruthTable(table), NAMES, outputName);
    }

    @Test
    public void testModule() throws IOException {
        Netlist netlist = synthesize(TABLE, "f");
        StringWriter writer = new StringWriter();
        VerilogWriter.writeModule(netlist, "spec_f", writer);
        String module = writer.toString();

        assertThat(module, containsString("module spec_f ("));
        assertThat(module, containsString("    input  logic a,\n    input  logic b,\n    input  logic c,\n"));
        assertThat(module, containsString("    output logic f\n);"));
        assertThat(count(module, "(?m)^    assign "), is(netlist.gateCount()));
        assertThat(count(module, "(?m)^    logic n[0-9]+;"), is(netlist.gateCount() - 1));
        assertThat(module, containsString("    assign f = "));
        assertThat(module.endsWith("endmodule\n"), is(true));
    }

    @Test
    public void testModuleWithoutOutputName() throws IOException {
        Netlist netlist = synthesize(TABLE, null);
        StringWriter writer = new StringWriter();
        VerilogWriter.writeModule(netlist, "anonymous", writer);
        String module = writer.toString();

        assertThat(module, containsString("    output logic out\n"));
        assertThat(count(module, "(?m)^    assign "), is(netlist.gateCount() + 1));
        assertThat(module, containsString("    assign out = " + netlist.output().name() + ";\n"));
    }

    @Test
    public void testConstantModule() throws IOException {
        Netlist netlist = synthesize(MintermTruthTable.of(3, new int[0], new int[] {1}), "zero");
        assertThat(VerilogWriter.outputPort(netlist), is("zero"));
        StringWriter writer = new StringWriter();
        VerilogWriter.writeModule(netlist, "constant", writer);
        String module = writer.toString();
        assertThat(module, containsString("    output logic zero\n);"));
        assertThat(module, containsString("    assign zero = 1'b0;\n"));
        assertThat(count(module, "(?m)^    assign "), is(1));
        assertThat(module, not(containsString("logic out")));
    }

    @Test
    public void testConstantModuleWithInputNamedOut() throws IOException {
        Bdd bdd = BddFactory.buildBdd();
        Netlist netlist = new NetlistSynthesizer(bdd).synthesize(Bdd.FALSE_NODE, List.of("out", "b", "c"), "f");
        StringWriter writer = new StringWriter();
        VerilogWriter.writeModule(netlist, "constant", writer);
        String module = writer.toString();
        assertThat(count(module, "logic out\\b"), is(1));
        assertThat(module, containsString("    output logic f\n);"));
        assertThat(module, containsString("    assign f = 1'b0;\n"));
    }

    @Test
    public void testRejectsUnusablePortNames() {
        Bdd bdd = BddFactory.buildBdd();
        int root = bdd.buildFromTruthTable(TABLE);
        NetlistSynthesizer synthesizer = new NetlistSynthesizer(bdd);

        // The default output port clashes with an input
        Netlist unnamed = synthesizer.synthesize(root, List.of("out", "b", "c"));
        assertThrows(IllegalArgumentException.class,
                () -> VerilogWriter.writeModule(unnamed, "clash", new StringWriter()));

        Netlist testbenchNames = synthesizer.synthesize(root, List.of("expected", "errors", "c"), "dut");
        assertThrows(IllegalArgumentException.class,
                () -> VerilogWriter.writeTestbench(testbenchNames, "clash", TABLE, new StringWriter()));
        assertThrows(IllegalArgumentException.class,
                () -> VerilogWriter.writeModule(testbenchNames, "clash", new StringWriter()));

        Netlist keywords = synthesizer.synthesize(root, List.of("module", "logic", "c"), "f");
        assertThrows(IllegalArgumentException.class,
                () -> VerilogWriter.writeModule(keywords, "clash", new StringWriter()));

        for (String name : new String[] {"expected", "errors", "dut", "module", "logic", "assign", "1a", "a b", ""}) {
            assertThrows(IllegalArgumentException.class, () -> VerilogWriter.checkPortName(name), name);
        }
        for (String name : new String[] {"a", "cin", "_carry", "x$1", "out"}) {
            VerilogWriter.checkPortName(name);
        }
    }

    @Test
    public void testTestbench() throws IOException {
        Netlist netlist = synthesize(TABLE, "f");
        StringWriter writer = new StringWriter();
        VerilogWriter.writeTestbench(netlist, "spec_f", TABLE, writer);
        String testbench = writer.toString();

        assertThat(testbench, containsString("module spec_f_tb;"));
        assertThat(testbench, containsString("    spec_f dut (\n        .a(a),\n        .b(b),\n        .c(c),\n"
                + "        .f(f)\n    );"));
        // The don't-care minterm 4 is not checked
        assertThat(count(testbench, "if \\(f !== expected\\)"), is(7));
        assertThat(testbench, not(containsString("a = 1'b1;\n        b = 1'b0;\n        c = 1'b0;\n")));
        assertThat(testbench, containsString("a = 1'b1;\n        b = 1'b1;\n        c = 1'b1;\n"
                + "        expected = 1'b1;\n"));
        assertThat(testbench, containsString("$display(\"PASS\");"));
    }
}
