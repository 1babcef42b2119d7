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
package de.tum.in.bddsynth.cli;

import de.tum.in.bddsynth.Bdd;
import de.tum.in.bddsynth.BddConfiguration;
import de.tum.in.bddsynth.BddFactory;
import de.tum.in.bddsynth.DontCarePolicy;
import de.tum.in.bddsynth.ImmutableBddConfiguration;
import de.tum.in.bddsynth.MintermTruthTable;
import de.tum.in.bddsynth.TruthTable;
import de.tum.in.bddsynth.TruthValue;
import de.tum.in.bddsynth.io.InvalidFormatException;
import de.tum.in.bddsynth.io.MintermSpec;
import de.tum.in.bddsynth.io.MintermSpecReader;
import de.tum.in.bddsynth.io.VerilogWriter;
import de.tum.in.bddsynth.netlist.Netlist;
import de.tum.in.bddsynth.netlist.NetlistSynthesizer;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import joptsimple.util.PathConverter;

/**
 * Command line entry point: reads (or draws) minterm specifications and writes one SystemVerilog
 * module and testbench per specified function.
 */
public final class SynthesisMain {
    private static final Logger logger = Logger.getLogger(SynthesisMain.class.getName());

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String RANDOM_SPEC_STEM = "random_spec";
    private static final double MAXIMAL_ON_RATIO = 0.5;
    private static final int MAXIMAL_PRINTED_NODES = 10;

    private final OptionParser parser = new OptionParser();
    private final OptionSpec<Path> specOption = parser.accepts("spec", "Specification file")
            .withRequiredArg().withValuesConvertedBy(new PathConverter()).describedAs("file");
    private final OptionSpec<Void> randomOption = parser.accepts("random", "Synthesize random functions");
    private final OptionSpec<Integer> inputsOption = parser.accepts("inputs", "Number of input variables")
            .withRequiredArg().ofType(Integer.class).defaultsTo(3);
    private final OptionSpec<Integer> outputsOption = parser.accepts("outputs", "Number of random functions")
            .withRequiredArg().ofType(Integer.class).defaultsTo(1);
    private final OptionSpec<Double> onRatioOption = parser.accepts("on-ratio", "Share of on minterms")
            .withRequiredArg().ofType(Double.class).defaultsTo(0.35);
    private final OptionSpec<Double> dontCareRatioOption = parser.accepts("dc-ratio",
            "Share of don't-care minterms").withRequiredArg().ofType(Double.class).defaultsTo(0.15);
    private final OptionSpec<Long> seedOption = parser.accepts("seed", "Seed of the random generator")
            .withRequiredArg().ofType(Long.class);
    private final OptionSpec<String> namesOption = parser.accepts("names", "Comma separated input names")
            .withRequiredArg().withValuesSeparatedBy(',');
    private final OptionSpec<Path> outputDirectoryOption = parser.accepts("output-dir", "Output directory")
            .withRequiredArg().withValuesConvertedBy(new PathConverter()).defaultsTo(Path.of("output"));
    private final OptionSpec<String> dontCareOption = parser.accepts("dont-care",
            "Don't-care handling, assign-false or merge").withRequiredArg().defaultsTo("assign-false");
    private final OptionSpec<Void> iterativeOption = parser.accepts("iterative", "Use iterative if-then-else");
    private final OptionSpec<Void> helpOption = parser.acceptsAll(Arrays.asList("help", "h", "?"), "Print help")
            .forHelp();

    public static void main(String[] args) {
        System.exit(new SynthesisMain().run(args));
    }

    int run(String[] args) {
        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            logger.log(Level.SEVERE, "Invalid arguments: {0}", e.getMessage());
            printHelp();
            return EXIT_USAGE;
        }
        if (options.has(helpOption)) {
            printHelp();
            return EXIT_SUCCESS;
        }
        if (options.has(specOption) == options.has(randomOption)) {
            logger.log(Level.SEVERE, "Exactly one of --spec and --random is required");
            printHelp();
            return EXIT_USAGE;
        }

        try {
            Run run = configure(options);
            run.execute();
            return EXIT_SUCCESS;
        } catch (OptionException e) {
            logger.log(Level.SEVERE, "Invalid arguments: {0}", e.getMessage());
            return EXIT_USAGE;
        } catch (InvalidFormatException e) {
            logger.log(Level.SEVERE, "Invalid specification: {0}", e.getMessage());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "I/O error", e);
        } catch (IllegalArgumentException e) {
            logger.log(Level.SEVERE, "Invalid configuration: {0}", e.getMessage());
        }
        return EXIT_FAILURE;
    }

    private Run configure(OptionSet options) throws IOException, InvalidFormatException {
        int inputs = options.valueOf(inputsOption);
        if (inputs < 1 || inputs > 16) {
            throw new IllegalArgumentException("Number of inputs must be in [1, 16], got " + inputs);
        }
        List<String> names;
        if (options.has(namesOption)) {
            names = options.valuesOf(namesOption);
            if (names.size() != inputs) {
                throw new IllegalArgumentException(
                        String.format("Expected %d input names, got %s", inputs, names));
            }
        } else {
            names = new ArrayList<>(inputs);
            for (int i = 0; i < inputs; i++) {
                names.add("x" + i);
            }
        }
        names.forEach(VerilogWriter::checkPortName);

        BddConfiguration configuration = ImmutableBddConfiguration.builder()
                .iterative(options.has(iterativeOption))
                .dontCarePolicy(parseDontCarePolicy(options.valueOf(dontCareOption)))
                .build();
        Path outputDirectory = options.valueOf(outputDirectoryOption);
        Files.createDirectories(outputDirectory);

        String stem;
        List<MintermSpec> specs;
        if (options.has(specOption)) {
            Path specFile = options.valueOf(specOption);
            stem = stemOf(specFile);
            try (BufferedReader reader = Files.newBufferedReader(specFile, StandardCharsets.UTF_8)) {
                specs = MintermSpecReader.read(reader, inputs);
            }
        } else {
            stem = RANDOM_SPEC_STEM;
            specs = randomSpecs(options, inputs);
            Path specFile = outputDirectory.resolve(RANDOM_SPEC_STEM + ".txt");
            try (BufferedWriter writer = Files.newBufferedWriter(specFile, StandardCharsets.UTF_8)) {
                for (MintermSpec spec : specs) {
                    writer.write(spec.toString());
                    writer.newLine();
                }
            }
            logger.log(Level.INFO, "Generated random specification {0}", specFile);
        }
        for (MintermSpec spec : specs) {
            VerilogWriter.checkPortName(spec.name());
            if (names.contains(spec.name())) {
                throw new IllegalArgumentException("Function " + spec.name() + " has the name of an input");
            }
        }
        return new Run(configuration, inputs, names, specs, outputDirectory, stem);
    }

    private List<MintermSpec> randomSpecs(OptionSet options, int inputs) {
        int outputs = options.valueOf(outputsOption);
        if (outputs < 1) {
            throw new IllegalArgumentException("Number of outputs must be positive, got " + outputs);
        }
        double onRatio = options.valueOf(onRatioOption);
        if (onRatio > MAXIMAL_ON_RATIO) {
            logger.log(Level.WARNING, "On ratio {0} is clamped to {1}", new Object[] {onRatio, MAXIMAL_ON_RATIO});
            onRatio = MAXIMAL_ON_RATIO;
        }
        double dontCareRatio = options.valueOf(dontCareRatioOption);
        Random random = options.has(seedOption) ? new Random(options.valueOf(seedOption)) : new Random();

        List<MintermSpec> specs = new ArrayList<>(outputs);
        for (int i = 0; i < outputs; i++) {
            specs.add(MintermSpec.random("f" + i, inputs, onRatio, dontCareRatio, random));
        }
        return specs;
    }

    static DontCarePolicy parseDontCarePolicy(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "assign-false":
                return DontCarePolicy.ASSIGN_FALSE;
            case "merge":
                return DontCarePolicy.MERGE;
            default:
                throw new IllegalArgumentException("Unknown don't-care handling " + value);
        }
    }

    static String stemOf(Path file) {
        String name = file.getFileName().toString();
        int extension = name.lastIndexOf('.');
        return extension > 0 ? name.substring(0, extension) : name;
    }

    /* One row per minterm, don't-cares are shown as "-". */
    static String tableToString(TruthTable table, List<String> names, String outputName) {
        StringBuilder builder = new StringBuilder(names.size() * 2 * (table.size() + 1));
        builder.append(String.join(" ", names)).append(" | ").append(outputName);
        for (int minterm = 0; minterm < table.size(); minterm++) {
            builder.append('\n');
            for (boolean value : TruthTable.assignmentOf(minterm, table.numberOfVariables())) {
                builder.append(value ? '1' : '0').append(' ');
            }
            TruthValue value = table.valueOf(minterm);
            builder.append("| ").append(value == TruthValue.DONT_CARE ? "-" : value == TruthValue.ON ? "1" : "0");
        }
        return builder.toString();
    }

    private void printHelp() {
        StringWriter help = new StringWriter();
        try {
            parser.printHelpOn(help);
        } catch (IOException e) {
            throw new AssertionError(e);
        }
        logger.log(Level.INFO, "Usage: SynthesisMain (--spec <file> | --random) [options]\n{0}", help);
    }

    private static final class Run {
        private final BddConfiguration configuration;
        private final int inputs;
        private final List<String> names;
        private final List<MintermSpec> specs;
        private final Path outputDirectory;
        private final String stem;

        Run(BddConfiguration configuration, int inputs, List<String> names, List<MintermSpec> specs,
                Path outputDirectory, String stem) {
            this.configuration = configuration;
            this.inputs = inputs;
            this.names = names;
            this.specs = specs;
            this.outputDirectory = outputDirectory;
            this.stem = stem;
        }

        void execute() throws IOException {
            logger.log(Level.INFO, "Synthesizing {0} functions over inputs {1}", new Object[] {specs.size(), names});
            for (MintermSpec spec : specs) {
                synthesize(spec);
            }
            logger.log(Level.INFO, "Output files written to {0}", outputDirectory);
        }

        private void synthesize(MintermSpec spec) throws IOException {
            MintermTruthTable table = spec.toTruthTable(inputs);
            Bdd bdd = BddFactory.buildBdd(inputs, configuration);
            int root = bdd.buildFromTruthTable(table);
            logger.log(Level.INFO, "Function {0}: on {1}, don''t-care {2}, {3} diagram nodes ({4} internal)",
                    new Object[] {spec.name(), spec.onSet(), spec.dontCareSet(), bdd.nodeCount(),
                            bdd.internalNodeCount()});
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Truth table of {0}:\n{1}",
                        new Object[] {spec.name(), tableToString(table, names, spec.name())});
                logger.log(Level.FINE, "{0}", bdd.statistics());
                if (bdd.reachableNodeCount(root) <= MAXIMAL_PRINTED_NODES) {
                    logger.log(Level.FINE, "Diagram of {0}:\n{1}",
                            new Object[] {spec.name(), bdd.structureOf(root)});
                }
            }

            Netlist netlist = new NetlistSynthesizer(bdd).synthesize(root, names, spec.name());
            logger.log(Level.INFO, "Function {0}: {1}", new Object[] {spec.name(), netlist.statistics()});
            logger.log(Level.FINE, "Netlist of {0}:\n{1}", new Object[] {spec.name(), netlist});

            String moduleName = stem + '_' + spec.name();
            Path moduleFile = outputDirectory.resolve(moduleName + ".sv");
            Path testbenchFile = outputDirectory.resolve(moduleName + "_tb.sv");
            try (BufferedWriter writer = Files.newBufferedWriter(moduleFile, StandardCharsets.UTF_8)) {
                VerilogWriter.writeModule(netlist, moduleName, writer);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(testbenchFile, StandardCharsets.UTF_8)) {
                VerilogWriter.writeTestbench(netlist, moduleName, table, writer);
            }
            logger.log(Level.INFO, "Wrote {0} and {1}", new Object[] {moduleFile, testbenchFile});
        }
    }
}
