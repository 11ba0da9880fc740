package org.example.pkgdep;

import org.apache.maven.plugin.MojoExecutionException;
import org.example.pkgdep.config.PluginConfiguration;
import org.example.pkgdep.exception.ExportException;
import org.example.pkgdep.export.DotGraphExporter;
import org.example.pkgdep.export.GraphExporter;
import org.example.pkgdep.model.DependencyGraph;
import org.example.pkgdep.provider.PackageMetadataProvider;
import org.example.pkgdep.provider.ScriptedMetadataProvider;
import org.example.pkgdep.render.QueryReport;
import org.example.pkgdep.render.QueryReport.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExploreDependenciesMojo.
 */
class ExploreDependenciesMojoTest {

    private ScriptedMetadataProvider provider;
    private GraphExporter exporter;
    private ExploreDependenciesMojo mojo;

    @BeforeEach
    void setUp() {
        provider = new ScriptedMetadataProvider()
                .depends("bash", "libc6", "base-files")
                .depends("libc6", "libgcc-s1")
                .depends("libgcc-s1", "libc6");
        mojo = new ExploreDependenciesMojo() {
            @Override
            protected PackageMetadataProvider createProvider(PluginConfiguration config) {
                return provider;
            }

            @Override
            protected GraphExporter createExporter() {
                return exporter;
            }
        };
        exporter = new DotGraphExporter();
        mojo.setPackageName("bash");
        mojo.setQuery("dependencies");
        mojo.setProviderExecutable("apt-cache");
        mojo.setTimeoutSeconds(10);
        mojo.setBreadthCap(10);
        mojo.setMaxDepth(-1);
        mojo.setMaxDisplayedCycles(20);
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("should map parameters to configuration")
        void shouldMapParameters() {
            mojo.setExhaustiveCycleSearch(true);
            mojo.setExcludeFilters(List.of("lib*"));

            PluginConfiguration config = mojo.buildConfiguration();

            assertThat(config.getPackageName()).isEqualTo("bash");
            assertThat(config.isExhaustiveCycleSearch()).isTrue();
            assertThat(config.getExcludeFilters()).containsExactly("lib*");
            assertThat(config.getIncludeFilters()).isEmpty();
        }

        @Test
        @DisplayName("should fail the build for invalid configuration")
        void shouldFailForInvalidConfiguration() {
            mojo.setQuery("tree");
            mojo.setBreadthCap(0);

            assertThatThrownBy(() -> mojo.execute())
                    .isInstanceOf(MojoExecutionException.class)
                    .hasMessageContaining("query must be one of")
                    .hasMessageContaining("breadthCap must be >= 1");
            assertThat(provider.getTotalCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("should run the dependencies query")
        void shouldRunDependenciesQuery() throws Exception {
            QueryReport report = mojo.runQuery(mojo.buildConfiguration());

            assertThat(report.getStatusLine()).isEqualTo("bash: 2 dependencies");
            assertThat(provider.getDependencyCalls()).containsExactly("bash", "libc6", "base-files");
        }

        @Test
        @DisplayName("should run the cycles query")
        void shouldRunCyclesQuery() throws Exception {
            mojo.setQuery("cycles");

            QueryReport report = mojo.runQuery(mojo.buildConfiguration());

            assertThat(report.getOutcome()).isEqualTo(Outcome.RESULTS);
            assertThat(report.getRows()).extracting(r -> r.getTitle())
                    .containsExactly("libc6 → libgcc-s1 → libc6");
        }

        @Test
        @DisplayName("should complete execution for a successful query")
        void shouldExecute() {
            assertThatCode(() -> mojo.execute()).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Error Handling")
    class ErrorHandling {

        @Test
        @DisplayName("should continue when lookup fails and failOnError is false")
        void shouldContinueWhenFailOnErrorFalse() {
            provider.failing("bash");

            assertThatCode(() -> mojo.execute()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should fail the build when lookup fails and failOnError is true")
        void shouldFailWhenFailOnErrorTrue() {
            provider.failing("bash");
            mojo.setFailOnError(true);

            assertThatThrownBy(() -> mojo.execute())
                    .isInstanceOf(MojoExecutionException.class)
                    .hasMessage("bash: lookup failed");
        }

        @Test
        @DisplayName("should not fail the build for an empty result")
        void shouldNotFailForEmptyResult() {
            mojo.setPackageName("leaf");
            mojo.setFailOnError(true);

            assertThatCode(() -> mojo.execute()).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Graph Export")
    class GraphExport {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should not write anything without an output file")
        void shouldNotExportWithoutOutputFile() {
            exporter = mock(GraphExporter.class);

            assertThatCode(() -> mojo.execute()).doesNotThrowAnyException();

            verifyNoInteractions(exporter);
        }

        @Test
        @DisplayName("should write the dependency view graph as DOT")
        void shouldExportDependencyGraph() throws Exception {
            Path target = tempDir.resolve("graphs/bash.dot");
            mojo.setOutputFile(target.toFile());

            mojo.execute();

            assertThat(Files.readString(target, StandardCharsets.UTF_8))
                    .startsWith("digraph \"bash\" {")
                    .contains("\"bash\" -> \"libc6\";")
                    .contains("\"bash\" -> \"base-files\";")
                    .contains("\"libc6\" -> \"libgcc-s1\";");
        }

        @Test
        @DisplayName("should write the explored graph of a cycle search")
        void shouldExportExploredGraph() throws Exception {
            Path target = tempDir.resolve("cycles.dot");
            mojo.setQuery("cycles");
            mojo.setOutputFile(target.toFile());

            mojo.execute();

            assertThat(Files.readString(target, StandardCharsets.UTF_8))
                    .contains("\"libc6\" -> \"libgcc-s1\";")
                    .contains("\"libgcc-s1\" -> \"libc6\";");
        }

        @Test
        @DisplayName("should skip export when the lookup failed")
        void shouldSkipExportOnLookupFailure() throws Exception {
            exporter = mock(GraphExporter.class);
            provider.failing("bash");
            mojo.setOutputFile(tempDir.resolve("bash.dot").toFile());

            mojo.execute();

            verifyNoInteractions(exporter);
        }

        @Test
        @DisplayName("should fail the build when export fails and failOnError is true")
        void shouldFailWhenExportFails() throws Exception {
            exporter = mock(GraphExporter.class);
            when(exporter.export(any(DependencyGraph.class), any(Path.class)))
                    .thenThrow(new ExportException("disk full"));
            mojo.setOutputFile(tempDir.resolve("bash.dot").toFile());
            mojo.setFailOnError(true);

            assertThatThrownBy(() -> mojo.execute())
                    .isInstanceOf(MojoExecutionException.class)
                    .hasMessageContaining("disk full");
        }

        @Test
        @DisplayName("should continue when export fails and failOnError is false")
        void shouldContinueWhenExportFails() throws Exception {
            exporter = mock(GraphExporter.class);
            when(exporter.export(any(DependencyGraph.class), any(Path.class)))
                    .thenThrow(new ExportException("disk full"));
            mojo.setOutputFile(tempDir.resolve("bash.dot").toFile());

            assertThatCode(() -> mojo.execute()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject a directory as output file")
        void shouldRejectDirectory() {
            mojo.setOutputFile(tempDir.toFile());

            assertThatThrownBy(() -> mojo.execute())
                    .isInstanceOf(MojoExecutionException.class)
                    .hasMessageContaining("outputFile must be a file");
        }
    }
}
