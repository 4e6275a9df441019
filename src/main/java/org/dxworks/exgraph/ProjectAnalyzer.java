package org.dxworks.exgraph;

import org.dxworks.exgraph.analyzer.GraphBuilder;
import org.dxworks.exgraph.analyzer.ModuleExtractor;
import org.dxworks.exgraph.model.Graphs;
import org.dxworks.exgraph.model.ModuleRecord;
import org.dxworks.exgraph.parser.ElixirParser;
import org.dxworks.exgraph.parser.ParseException;
import org.dxworks.exgraph.parser.SourceParser;
import org.dxworks.exgraph.parser.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans, parses and extracts a source tree and builds its graphs.
 * <p>
 * A file that cannot be read or parsed is logged and contributes no modules; it never stops
 * the run.
 */
public class ProjectAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private final SourceParser parser;
    private final ModuleExtractor extractor;
    private final GraphBuilder graphBuilder;

    public ProjectAnalyzer() {
        this(new ElixirParser(), new ModuleExtractor(), new GraphBuilder());
    }

    public ProjectAnalyzer(SourceParser parser, ModuleExtractor extractor, GraphBuilder graphBuilder) {
        this.parser = parser;
        this.extractor = extractor;
        this.graphBuilder = graphBuilder;
    }

    public Graphs analyze(Path root, AnalysisOptions options) {
        List<Path> files = new SourceScanner(options.getMaxFileLines()).scan(root, options.isIncludeTests());
        LOGGER.debug("Found {} source files under {}", files.size(), root);
        List<ModuleRecord> records = extractAll(files, options.isParallel());
        return graphBuilder.build(records, options.isInternalOnly());
    }

    /**
     * Extracts every file; records come back in file order whether or not the work ran in parallel.
     */
    public List<ModuleRecord> extractAll(List<Path> files, boolean parallel) {
        Stream<Path> stream = parallel ? files.parallelStream() : files.stream();
        return stream.map(this::parseFile)
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    public List<ModuleRecord> parseFile(Path file) {
        String sourceCode;
        try {
            sourceCode = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            return Collections.emptyList();
        }
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }
        return parseString(sourceCode, file.toString());
    }

    public List<ModuleRecord> parseString(String sourceCode, String file) {
        SyntaxNode root;
        try {
            root = parser.parse(sourceCode, file);
        } catch (ParseException e) {
            LOGGER.warn("Skipping file that does not parse: {}", e.getMessage());
            return Collections.emptyList();
        }
        return extractor.extract(root, file);
    }
}
