package org.example.pkgdep.export;

import org.example.pkgdep.exception.ExportException;
import org.example.pkgdep.model.DependencyGraph;
import org.example.pkgdep.model.PackageName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DotGraphExporter.
 */
class DotGraphExporterTest {

    @TempDir
    Path tempDir;

    private final DotGraphExporter exporter = new DotGraphExporter();

    private static PackageName name(String value) {
        return PackageName.of(value);
    }

    @Test
    @DisplayName("should render packages and edges in insertion order")
    void shouldRenderDot() {
        DependencyGraph graph = DependencyGraph.builder(name("bash"))
                .addEdge(name("bash"), name("libc6"))
                .addEdge(name("bash"), name("libc6"))
                .addEdge(name("libc6"), name("libgcc-s1"))
                .build();

        assertThat(exporter.toDot(graph)).isEqualTo(
                "digraph \"bash\" {\n" +
                "  \"bash\" [style=bold];\n" +
                "  \"libc6\";\n" +
                "  \"libgcc-s1\";\n" +
                "  \"bash\" -> \"libc6\";\n" +
                "  \"bash\" -> \"libc6\";\n" +
                "  \"libc6\" -> \"libgcc-s1\";\n" +
                "}\n");
    }

    @Test
    @DisplayName("should escape quotes in package names")
    void shouldEscapeQuotes() {
        DependencyGraph graph = new DependencyGraph(name("odd\"name"));

        assertThat(exporter.toDot(graph)).contains("\"odd\\\"name\" [style=bold];");
    }

    @Test
    @DisplayName("should write UTF-8 file and create parent directories")
    void shouldWriteFile() throws Exception {
        DependencyGraph graph = DependencyGraph.builder(name("bash"))
                .addEdge(name("bash"), name("libc6"))
                .build();
        Path target = tempDir.resolve("nested/dir/bash.dot");

        ExportResult result = exporter.export(graph, target);

        assertThat(result.getPackagesExported()).isEqualTo(2);
        assertThat(result.getEdgesExported()).isEqualTo(1);
        assertThat(result.getTarget()).isEqualTo(target);
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo(exporter.toDot(graph));
    }

    @Test
    @DisplayName("should throw ExportException when the target cannot be written")
    void shouldThrowWhenTargetUnwritable() {
        DependencyGraph graph = new DependencyGraph(name("bash"));

        assertThatThrownBy(() -> exporter.export(graph, tempDir))
                .isInstanceOf(ExportException.class)
                .hasMessageContaining("Failed to write graph to");
    }
}
