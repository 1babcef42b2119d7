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

import de.tum.in.bddsynth.TruthTable;
import de.tum.in.bddsynth.TruthValue;
import de.tum.in.bddsynth.netlist.Gate;
import de.tum.in.bddsynth.netlist.Netlist;
import de.tum.in.bddsynth.netlist.Signal;
import java.io.IOException;
import java.io.Writer;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Writes a {@link Netlist} as structural SystemVerilog together with an exhaustive testbench.
 */
public final class VerilogWriter {
    static final String DEFAULT_OUTPUT_PORT = "out";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");
    private static final Set<String> TESTBENCH_NAMES = Set.of("expected", "errors", "dut");
    private static final Set<String> KEYWORDS = Set.of(
            "accept_on", "alias", "always", "always_comb", "always_ff", "always_latch", "and", "assert",
            "assign", "assume", "automatic", "before", "begin", "bind", "bins", "binsof", "bit", "break",
            "buf", "bufif0", "bufif1", "byte", "case", "casex", "casez", "cell", "chandle", "checker", "class",
            "clocking", "cmos", "config", "const", "constraint", "context", "continue", "cover", "covergroup",
            "coverpoint", "cross", "deassign", "default", "defparam", "design", "disable", "dist", "do",
            "edge", "else", "end", "endcase", "endchecker", "endclass", "endclocking", "endconfig",
            "endfunction", "endgenerate", "endgroup", "endinterface", "endmodule", "endpackage",
            "endprimitive", "endprogram", "endproperty", "endspecify", "endsequence", "endtable", "endtask",
            "enum", "event", "eventually", "expect", "export", "extends", "extern", "final", "first_match",
            "for", "force", "foreach", "forever", "fork", "forkjoin", "function", "generate", "genvar",
            "global", "highz0", "highz1", "if", "iff", "ifnone", "ignore_bins", "illegal_bins", "implements",
            "implies", "import", "incdir", "include", "initial", "inout", "input", "inside", "instance", "int",
            "integer", "interconnect", "interface", "intersect", "join", "join_any", "join_none", "large",
            "let", "liblist", "library", "local", "localparam", "logic", "longint", "macromodule", "matches",
            "medium", "modport", "module", "nand", "negedge", "nettype", "new", "nexttime", "nmos", "nor",
            "noshowcancelled", "not", "notif0", "notif1", "null", "or", "output", "package", "packed",
            "parameter", "pmos", "posedge", "primitive", "priority", "program", "property", "protected",
            "pull0", "pull1", "pulldown", "pullup", "pulsestyle_ondetect", "pulsestyle_onevent", "pure",
            "rand", "randc", "randcase", "randsequence", "rcmos", "real", "realtime", "ref", "reg",
            "reject_on", "release", "repeat", "restrict", "return", "rnmos", "rpmos", "rtran", "rtranif0",
            "rtranif1", "s_always", "s_eventually", "s_nexttime", "s_until", "s_until_with", "scalared",
            "sequence", "shortint", "shortreal", "showcancelled", "signed", "small", "soft", "solve",
            "specify", "specparam", "static", "string", "strong", "strong0", "strong1", "struct", "super",
            "supply0", "supply1", "sync_accept_on", "sync_reject_on", "table", "tagged", "task", "this",
            "throughout", "time", "timeprecision", "timeunit", "tran", "tranif0", "tranif1", "tri", "tri0",
            "tri1", "triand", "trior", "trireg", "type", "typedef", "union", "unique", "unique0", "unsigned",
            "until", "until_with", "untyped", "use", "uwire", "var", "vectored", "virtual", "void", "wait",
            "wait_order", "wand", "weak", "weak0", "weak1", "while", "wildcard", "wire", "with", "within",
            "wor", "xnor", "xor");

    private VerilogWriter() {}

    /**
     * Checks that {@code name} can be used as a port name, i.e. it is a simple identifier and neither a
     * SystemVerilog keyword nor one of the names declared by the testbench.
     *
     * @throws IllegalArgumentException if the name is not usable.
     */
    public static void checkPortName(String name) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Port name " + name + " is not a valid identifier");
        }
        if (KEYWORDS.contains(name)) {
            throw new IllegalArgumentException("Port name " + name + " is a SystemVerilog keyword");
        }
        if (TESTBENCH_NAMES.contains(name)) {
            throw new IllegalArgumentException("Port name " + name + " is reserved by the testbench");
        }
    }

    /* All ports must be usable and distinct. */
    private static void checkPorts(Netlist netlist) {
        Set<String> names = new HashSet<>();
        for (Signal input : netlist.inputs()) {
            checkPortName(input.name());
            if (!names.add(input.name())) {
                throw new IllegalArgumentException("Duplicate port name " + input.name());
            }
        }
        String outputPort = outputPort(netlist);
        checkPortName(outputPort);
        if (names.contains(outputPort)) {
            throw new IllegalArgumentException("Output port " + outputPort + " clashes with an input");
        }
    }

    /**
     * Name of the output port. Netlists without a named output use {@value #DEFAULT_OUTPUT_PORT}.
     * Named outputs keep their name, also for constant functions.
     */
    public static String outputPort(Netlist netlist) {
        Signal output = netlist.output();
        return output.kind() == Signal.Kind.OUTPUT ? output.name() : DEFAULT_OUTPUT_PORT;
    }

    /**
     * Writes the netlist as a module.
     *
     * @throws IllegalArgumentException if a port name is not usable, see {@link #checkPortName(String)}.
     */
    public static void writeModule(Netlist netlist, String moduleName, Writer writer) throws IOException {
        checkPorts(netlist);
        List<Signal> inputs = netlist.inputs();
        String outputPort = outputPort(netlist);
        StringBuilder builder = new StringBuilder(256);

        builder.append("// Structural netlist synthesized from a binary decision diagram\n")
                .append("// Inputs: ").append(joinNames(inputs)).append('\n')
                .append("// Gates: ").append(netlist.gateCount()).append("\n\n")
                .append("module ").append(moduleName).append(" (\n");
        for (Signal input : inputs) {
            builder.append("    input  logic ").append(input.name()).append(",\n");
        }
        builder.append("    output logic ").append(outputPort).append("\n);\n\n");

        List<Gate> wires = netlist.gates().stream()
                .filter(gate -> gate.output().kind() == Signal.Kind.WIRE)
                .collect(Collectors.toList());
        if (!wires.isEmpty()) {
            for (Gate gate : wires) {
                builder.append("    logic ").append(gate.output().name()).append(";\n");
            }
            builder.append('\n');
        }

        for (Gate gate : netlist.gates()) {
            builder.append("    assign ").append(gate.output().name()).append(" = ")
                    .append(expression(gate)).append(";\n");
        }
        Signal output = netlist.output();
        if (output.kind() != Signal.Kind.OUTPUT) {
            builder.append("    assign ").append(outputPort).append(" = ").append(reference(output)).append(";\n");
        }
        builder.append("endmodule\n");
        writer.write(builder.toString());
    }

    /**
     * Writes a testbench applying every minterm of {@code table} which is not don't-care and
     * comparing the module output against the expected value.
     *
     * @throws IllegalArgumentException if a port name is not usable or the table does not match.
     */
    public static void writeTestbench(Netlist netlist, String moduleName, TruthTable table, Writer writer)
            throws IOException {
        checkPorts(netlist);
        List<Signal> inputs = netlist.inputs();
        if (inputs.size() != table.numberOfVariables()) {
            throw new IllegalArgumentException(String.format("Netlist has %d inputs, truth table %d variables",
                    inputs.size(), table.numberOfVariables()));
        }
        String outputPort = outputPort(netlist);
        StringBuilder builder = new StringBuilder(1024);

        builder.append("// Exhaustive testbench for ").append(moduleName).append("\n\n")
                .append("module ").append(moduleName).append("_tb;\n");
        for (Signal input : inputs) {
            builder.append("    logic ").append(input.name()).append(";\n");
        }
        builder.append("    logic ").append(outputPort).append(";\n")
                .append("    logic expected;\n")
                .append("    int errors = 0;\n\n");

        builder.append("    ").append(moduleName).append(" dut (\n");
        for (Signal input : inputs) {
            builder.append("        .").append(input.name()).append('(').append(input.name()).append("),\n");
        }
        builder.append("        .").append(outputPort).append('(').append(outputPort).append(")\n    );\n\n");

        String format = inputs.stream().map(input -> "%b").collect(Collectors.joining(" "));
        String arguments = inputs.isEmpty() ? "" : joinNames(inputs) + ", ";
        builder.append("    initial begin\n");
        for (int minterm = 0; minterm < table.size(); minterm++) {
            TruthValue value = table.valueOf(minterm);
            if (!value.isDefined()) {
                continue;
            }
            boolean[] assignment = TruthTable.assignmentOf(minterm, inputs.size());
            for (int i = 0; i < assignment.length; i++) {
                builder.append("        ").append(inputs.get(i).name())
                        .append(assignment[i] ? " = 1'b1;\n" : " = 1'b0;\n");
            }
            builder.append("        expected = ").append(value == TruthValue.ON ? "1'b1" : "1'b0").append(";\n")
                    .append("        #10;\n")
                    .append("        if (").append(outputPort).append(" !== expected) begin\n")
                    .append("            errors++;\n")
                    .append("            $display(\"FAIL ").append(format).append(" -> %b, expected %b\", ")
                    .append(arguments).append(outputPort).append(", expected);\n")
                    .append("        end\n");
        }
        builder.append("        if (errors == 0)\n")
                .append("            $display(\"PASS\");\n")
                .append("        else\n")
                .append("            $display(\"FAIL: %0d errors\", errors);\n")
                .append("        $finish;\n")
                .append("    end\n")
                .append("endmodule\n");
        writer.write(builder.toString());
    }

    private static String expression(Gate gate) {
        List<Signal> inputs = gate.inputs();
        String first = reference(inputs.get(0));
        switch (gate.kind()) {
            case BUFFER:
                return first;
            case NOT:
                return "~" + first;
            case AND:
                return first + " & " + reference(inputs.get(1));
            case OR:
                return first + " | " + reference(inputs.get(1));
            case XOR:
                return first + " ^ " + reference(inputs.get(1));
            case NAND:
                return "~(" + first + " & " + reference(inputs.get(1)) + ")";
            case NOR:
                return "~(" + first + " | " + reference(inputs.get(1)) + ")";
            case XNOR:
                return "~(" + first + " ^ " + reference(inputs.get(1)) + ")";
            default:
                throw new AssertionError(gate.kind());
        }
    }

    private static String reference(Signal signal) {
        if (signal.isConstant()) {
            return signal.constantValue() ? "1'b1" : "1'b0";
        }
        return signal.name();
    }

    private static String joinNames(List<Signal> signals) {
        return signals.stream().map(Signal::name).collect(Collectors.joining(", "));
    }
}
