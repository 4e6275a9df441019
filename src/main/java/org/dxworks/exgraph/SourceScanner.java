package org.dxworks.exgraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds Elixir sources ({@code .ex}, {@code .exs}) under a directory, sorted by path.
 * Test scripts ({@code *_test.exs}) are left out unless asked for.
 */
public class SourceScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceScanner.class);

    private final int maxFileLines;

    public SourceScanner(int maxFileLines) {
        this.maxFileLines = maxFileLines;
    }

    public List<Path> scan(Path root, boolean includeTests) {
        if (root == null || !Files.exists(root)) {
            return Collections.emptyList();
        }
        if (Files.isRegularFile(root)) {
            return accepts(root, includeTests) ? List.of(root) : Collections.emptyList();
        }

        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(root)) {
            stream.filter(Files::isRegularFile)
                  .filter(p -> accepts(p, includeTests))
                  .forEach(files::add);
        } catch (IOException | UncheckedIOException e) {
            LOGGER.warn("Could not fully scan {}: {}", root, e.getMessage());
        }
        return files.stream().sorted().collect(Collectors.toList());
    }

    private boolean accepts(Path file, boolean includeTests) {
        return isElixirSource(file, includeTests) && withinMaxLines(file);
    }

    public static boolean isElixirSource(Path file, boolean includeTests) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith("_test.exs")) {
            return includeTests;
        }
        return fileName.endsWith(".ex") || fileName.endsWith(".exs");
    }

    private boolean withinMaxLines(Path path) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                LOGGER.warn("Skipping {}: longer than {} lines", path, maxFileLines);
                return false;
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            // unreadable files are reported when they are parsed
            return true;
        }
    }
}
