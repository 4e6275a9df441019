package org.dxworks.exgraph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceScannerTest {

    @TempDir
    Path root;

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @BeforeEach
    void createTree() throws IOException {
        write("lib/b.exs", "defmodule B do\nend\n");
        write("lib/deep/c.ex", "defmodule C do\nend\n");
        write("lib/a.ex", "defmodule A do\nend\n");
        write("test/a_test.exs", "defmodule ATest do\nend\n");
        write("README.md", "# readme\n");
        write("mix.lock", "%{}\n");
    }

    @Test
    void findsElixirSourcesSortedByPath() {
        List<Path> files = new SourceScanner(100).scan(root, false);

        assertEquals(List.of(root.resolve("lib/a.ex"), root.resolve("lib/b.exs"), root.resolve("lib/deep/c.ex")), files);
    }

    @Test
    void testScriptsOnlyWhenRequested() {
        List<Path> files = new SourceScanner(100).scan(root, true);

        assertEquals(4, files.size());
        assertEquals(root.resolve("test/a_test.exs"), files.get(3));
    }

    @Test
    void filesOverTheLineLimitAreSkipped() throws IOException {
        write("lib/long.ex", "defmodule Long do\n  def a, do: 1\n  def b, do: 2\nend\n");

        List<Path> files = new SourceScanner(3).scan(root.resolve("lib"), false);

        assertFalse(files.contains(root.resolve("lib/long.ex")));
        assertTrue(files.contains(root.resolve("lib/a.ex")));
    }

    @Test
    void singleFileRoot() {
        Path file = root.resolve("lib/a.ex");

        assertEquals(List.of(file), new SourceScanner(100).scan(file, false));
        assertTrue(new SourceScanner(100).scan(root.resolve("README.md"), false).isEmpty());
    }

    @Test
    void missingRootIsEmpty() {
        assertTrue(new SourceScanner(100).scan(root.resolve("nope"), false).isEmpty());
    }

    @Test
    void recognizesElixirExtensions() {
        assertTrue(SourceScanner.isElixirSource(Path.of("lib/Foo.EX"), false));
        assertTrue(SourceScanner.isElixirSource(Path.of("mix.exs"), false));
        assertFalse(SourceScanner.isElixirSource(Path.of("test/foo_test.exs"), false));
        assertTrue(SourceScanner.isElixirSource(Path.of("test/foo_test.exs"), true));
        assertFalse(SourceScanner.isElixirSource(Path.of("lib/foo.eex"), true));
    }
}
