package org.dxworks.exgraph;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.dxworks.exgraph.render.GraphSelection;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command line of {@link App}. Flags override the values read from {@link ExgraphConfig}.
 */
public final class CliArguments {

    static final String DEFAULT_OUTPUT_DIR = "output";

    private final Path input;
    private final OutputFormat format;
    private final GraphSelection selection;
    private final List<String> prune;
    private final AnalysisOptions analysisOptions;
    private final Path outputDir;
    private final boolean help;

    private CliArguments(Path input, OutputFormat format, GraphSelection selection, List<String> prune,
                         AnalysisOptions analysisOptions, Path outputDir, boolean help) {
        this.input = input;
        this.format = format;
        this.selection = selection;
        this.prune = prune;
        this.analysisOptions = analysisOptions;
        this.outputDir = outputDir;
        this.help = help;
    }

    public static Options options() {
        Options options = new Options();
        options.addOption("f", "format", true, "Output format: json|dot (default: json)");
        options.addOption("g", "graph", true, "Graph type: modules|calls|module_calls|both (default: both)");
        options.addOption(null, "prune", true, "Comma-separated module names to omit from DOT output");
        options.addOption(null, "internal-only", false, "Keep only modules defined in the scanned project (default)");
        options.addOption(null, "no-internal-only", false, "Include external modules in graphs");
        options.addOption(null, "include-tests", false, "Also analyze *_test.exs files");
        options.addOption(Option.builder("o").longOpt("output").hasArg()
                .desc("Output directory (default: ./" + DEFAULT_OUTPUT_DIR + ")").build());
        options.addOption("h", "help", false, "Show this help");
        return options;
    }

    /**
     * @throws ParseException           for unknown options, missing values or a missing project path
     * @throws IllegalArgumentException for an unknown format or graph type
     */
    public static CliArguments parse(String[] args, ExgraphConfig config) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options(), args);

        if (cmd.hasOption("help")) {
            return new CliArguments(null, OutputFormat.JSON, GraphSelection.ALL, Collections.emptyList(),
                    AnalysisOptions.from(config), Paths.get(DEFAULT_OUTPUT_DIR), true);
        }
        List<String> positional = cmd.getArgList();
        if (positional.isEmpty()) {
            throw new ParseException("Missing PROJECT_PATH");
        }
        if (positional.size() > 1) {
            throw new ParseException("Unexpected arguments: " + positional.subList(1, positional.size()));
        }
        if (cmd.hasOption("internal-only") && cmd.hasOption("no-internal-only")) {
            throw new ParseException("--internal-only and --no-internal-only are mutually exclusive");
        }

        OutputFormat format = OutputFormat.fromOption(cmd.getOptionValue("format", "json"));
        GraphSelection selection = GraphSelection.fromOption(cmd.getOptionValue("graph", "both"));

        AnalysisOptions analysisOptions = AnalysisOptions.from(config);
        if (cmd.hasOption("internal-only")) {
            analysisOptions = analysisOptions.withInternalOnly(true);
        } else if (cmd.hasOption("no-internal-only")) {
            analysisOptions = analysisOptions.withInternalOnly(false);
        }
        if (cmd.hasOption("include-tests")) {
            analysisOptions = analysisOptions.withIncludeTests(true);
        }

        return new CliArguments(
                Paths.get(positional.get(0)),
                format,
                selection,
                parsePrune(cmd.getOptionValue("prune")),
                analysisOptions,
                Paths.get(cmd.getOptionValue("output", DEFAULT_OUTPUT_DIR)),
                false);
    }

    static List<String> parsePrune(String value) {
        if (value == null) return Collections.emptyList();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public Path getInput() {
        return input;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public GraphSelection getSelection() {
        return selection;
    }

    public List<String> getPrune() {
        return prune;
    }

    public AnalysisOptions getAnalysisOptions() {
        return analysisOptions;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public boolean isHelp() {
        return help;
    }
}
