package org.dxworks.exgraph;

import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.ParseException;
import org.dxworks.exgraph.model.Graphs;
import org.dxworks.exgraph.render.DotRenderer;
import org.dxworks.exgraph.render.JsonRenderer;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class App {

    private static final String USAGE = "exgraph PROJECT_PATH [options]";
    private static final String FOOTER = "\nExamples:\n"
            + "  exgraph my_project/lib\n"
            + "  exgraph my_project/lib --format dot --graph modules\n"
            + "  exgraph my_project/lib --format dot --graph module_calls --prune MyApp.Repo,MyApp.Schema\n"
            + "  exgraph my_project/lib --format json --graph calls --no-internal-only\n";

    public static void main(String[] args) throws IOException {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args, ExgraphConfig.load());
        } catch (ParseException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage(System.err);
            System.exit(2);
            return;
        }
        if (arguments.isHelp()) {
            printUsage(System.out);
            return;
        }

        Path input = arguments.getInput();
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        System.out.println("Starting analysis...");
        System.out.println("Input: " + input.toAbsolutePath());
        Path written = run(arguments, new ProjectAnalyzer());
        System.out.println("Saved " + written.getFileName());
        System.out.println("\nOutput saved to: " + arguments.getOutputDir().toAbsolutePath());
    }

    /**
     * Analyzes the input and writes the selected artifact into the output directory.
     *
     * @return the file written
     */
    static Path run(CliArguments arguments, ProjectAnalyzer analyzer) throws IOException {
        Graphs graphs = analyzer.analyze(arguments.getInput(), arguments.getAnalysisOptions());

        String content;
        switch (arguments.getFormat()) {
            case DOT:
                content = new DotRenderer(arguments.getPrune()).render(graphs, arguments.getSelection());
                break;
            case JSON:
            default:
                content = new JsonRenderer().render(graphs, arguments.getSelection());
                break;
        }

        Path outputDir = arguments.getOutputDir();
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(arguments.getSelection().fileName(arguments.getFormat().getExtension()));
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target;
    }

    static void printUsage(PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null,
                CliArguments.options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, FOOTER);
        writer.flush();
    }
}
