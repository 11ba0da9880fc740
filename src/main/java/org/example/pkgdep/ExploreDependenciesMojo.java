package org.example.pkgdep;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.example.pkgdep.config.ConfigurationValidator;
import org.example.pkgdep.config.PluginConfiguration;
import org.example.pkgdep.exception.ConfigurationException;
import org.example.pkgdep.exception.ExportException;
import org.example.pkgdep.export.DotGraphExporter;
import org.example.pkgdep.export.ExportResult;
import org.example.pkgdep.export.GraphExporter;
import org.example.pkgdep.filter.PackageFilter;
import org.example.pkgdep.graph.CycleDetector;
import org.example.pkgdep.graph.CycleSearchMode;
import org.example.pkgdep.graph.DependencyGraphBuilder;
import org.example.pkgdep.provider.AptCacheMetadataProvider;
import org.example.pkgdep.provider.PackageMetadataProvider;
import org.example.pkgdep.provider.ProcessCommandRunner;
import org.example.pkgdep.query.QueryDispatcher;
import org.example.pkgdep.query.QueryType;
import org.example.pkgdep.render.QueryReport;
import org.example.pkgdep.render.ReportRow;
import org.example.pkgdep.render.ResultRenderer;

import java.io.File;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Shows the dependencies, reverse dependencies or circular dependencies of a Debian package.
 *
 * Usage: mvn pkgdep:explore -Dpkgdep.package=bash -Dpkgdep.query=cycles
 */
@Mojo(name = "explore", requiresProject = false, threadSafe = true)
public class ExploreDependenciesMojo extends AbstractMojo {

    // ========== Required Configuration ==========

    /**
     * Package to inspect.
     */
    @Parameter(property = "pkgdep.package", required = true)
    private String packageName;

    // ========== Optional Configuration ==========

    /**
     * Query to run: "dependencies", "reverse" or "cycles".
     */
    @Parameter(property = "pkgdep.query", defaultValue = "dependencies")
    private String query;

    /**
     * Package metadata provider executable.
     */
    @Parameter(property = "pkgdep.executable", defaultValue = "apt-cache")
    private String providerExecutable;

    /**
     * Hard limit for each provider call, in seconds.
     */
    @Parameter(property = "pkgdep.timeoutSeconds", defaultValue = "10")
    private int timeoutSeconds;

    /**
     * Dependencies explored per package during cycle search.
     */
    @Parameter(property = "pkgdep.breadthCap", defaultValue = "10")
    private int breadthCap;

    /**
     * Cycle search depth.
     * -1 = unlimited (default), 0 = root only, N = N levels.
     */
    @Parameter(property = "pkgdep.maxDepth", defaultValue = "-1")
    private int maxDepth;

    /**
     * Re-expand already explored packages during cycle search.
     */
    @Parameter(property = "pkgdep.exhaustive", defaultValue = "false")
    private boolean exhaustiveCycleSearch;

    /**
     * Include filter patterns (glob style) for listed packages.
     */
    @Parameter(property = "pkgdep.includeFilters")
    private List<String> includeFilters;

    /**
     * Exclude filter patterns (glob style) for listed packages.
     */
    @Parameter(property = "pkgdep.excludeFilters")
    private List<String> excludeFilters;

    /**
     * Maximum number of circular dependencies listed.
     */
    @Parameter(property = "pkgdep.maxDisplayedCycles", defaultValue = "20")
    private int maxDisplayedCycles;

    /**
     * Whether to fail the build when a lookup fails.
     */
    @Parameter(property = "pkgdep.failOnError", defaultValue = "false")
    private boolean failOnError;

    /**
     * File to write the query's dependency graph to, in DOT format. Not written when unset.
     */
    @Parameter(property = "pkgdep.outputFile")
    private File outputFile;

    // ========== Execution ==========

    @Override
    public void execute() throws MojoExecutionException {
        logBanner();

        PluginConfiguration config = buildConfiguration();
        try {
            new ConfigurationValidator().validateOrThrow(config);
        } catch (ConfigurationException e) {
            // Configuration errors always fail the build (ignore failOnError)
            logError("Configuration validation failed", e);
            throw new MojoExecutionException("Plugin configuration is invalid: " + e.getMessage(), e);
        }

        logConfigurationSummary(config);

        QueryReport report = runQuery(config);
        logReport(report);

        if (report.isError()) {
            if (config.isFailOnError()) {
                throw new MojoExecutionException(report.getStatusLine());
            }
            getLog().warn("Lookup failed but continuing build (failOnError=false)");
        }

        exportGraph(config, report);
    }

    /**
     * Builds the plugin configuration from Mojo parameters.
     */
    PluginConfiguration buildConfiguration() {
        return PluginConfiguration.builder()
                .packageName(packageName)
                .query(query)
                .providerExecutable(providerExecutable)
                .timeoutSeconds(timeoutSeconds)
                .breadthCap(breadthCap)
                .maxDepth(maxDepth)
                .exhaustiveCycleSearch(exhaustiveCycleSearch)
                .includeFilters(includeFilters)
                .excludeFilters(excludeFilters)
                .maxDisplayedCycles(maxDisplayedCycles)
                .failOnError(failOnError)
                .outputFile(outputFile)
                .build();
    }

    /**
     * Runs the configured query on a worker thread and waits for its report.
     */
    QueryReport runQuery(PluginConfiguration config) throws MojoExecutionException {
        QueryType type = QueryType.fromId(config.getQuery())
                .orElseThrow(() -> new MojoExecutionException("Unsupported query: " + config.getQuery()));

        PackageMetadataProvider provider = createProvider(config);
        DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder(provider, config.getTimeout(),
                new PackageFilter(config.getIncludeFilters(), config.getExcludeFilters()));
        CycleDetector cycleDetector = new CycleDetector(provider, config.getTimeout(),
                config.getBreadthCap(), config.getMaxDepth(),
                config.isExhaustiveCycleSearch() ? CycleSearchMode.EXHAUSTIVE : CycleSearchMode.MEMOIZED);
        ResultRenderer renderer = new ResultRenderer(config.getMaxDisplayedCycles());

        try (QueryDispatcher dispatcher = new QueryDispatcher(graphBuilder, cycleDetector, renderer)) {
            CompletableFuture<QueryReport> pending = dispatcher.submit(type, config.getPackageName())
                    .orElseThrow(() -> new MojoExecutionException("packageName is required"));
            return pending.join();
        } catch (CompletionException e) {
            throw new MojoExecutionException("Query failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Writes the report's graph to the configured output file, if any.
     */
    private void exportGraph(PluginConfiguration config, QueryReport report) throws MojoExecutionException {
        if (config.getOutputFile() == null) {
            return;
        }
        if (report.isError()) {
            getLog().warn("Skipping graph export: lookup failed");
            return;
        }

        try {
            ExportResult result = createExporter().export(report.getGraph(), config.getOutputFile().toPath());
            getLog().info("Graph exported to " + result.getTarget() + " (" + result.getPackagesExported()
                    + " packages, " + result.getEdgesExported() + " edges)");
        } catch (ExportException e) {
            logError("Graph export failed", e);
            if (config.isFailOnError()) {
                throw new MojoExecutionException("Graph export failed: " + e.getMessage(), e);
            }
            getLog().warn("Graph export failed but continuing build (failOnError=false)");
        }
    }

    /**
     * Creates the package metadata provider.
     */
    protected PackageMetadataProvider createProvider(PluginConfiguration config) {
        return new AptCacheMetadataProvider(config.getProviderExecutable(), new ProcessCommandRunner());
    }

    /**
     * Creates the graph exporter used for {@code outputFile}.
     */
    protected GraphExporter createExporter() {
        return new DotGraphExporter();
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("Package Dependency Explorer");
        getLog().info("============================================================");
    }

    private void logConfigurationSummary(PluginConfiguration config) {
        getLog().info("Configuration:");
        getLog().info("  Package: " + config.getPackageName().trim());
        getLog().info("  Query: " + config.getQuery());
        getLog().info("  Provider: " + config.getProviderExecutable() + " (timeout " + config.getTimeoutSeconds() + "s)");

        if (QueryType.fromId(config.getQuery()).orElse(null) == QueryType.CYCLES) {
            getLog().info("  Breadth cap: " + config.getBreadthCap());
            getLog().info("  Max depth: " + (config.getMaxDepth() == -1 ? "unlimited" : config.getMaxDepth()));
            getLog().info("  Search mode: " + (config.isExhaustiveCycleSearch() ? "exhaustive" : "memoized"));
        }

        if (!config.getIncludeFilters().isEmpty()) {
            getLog().info("  Include filters: " + config.getIncludeFilters());
        }

        if (!config.getExcludeFilters().isEmpty()) {
            getLog().info("  Exclude filters: " + config.getExcludeFilters());
        }

        if (config.getOutputFile() != null) {
            getLog().info("  Output file: " + config.getOutputFile());
        }

        getLog().info("  Fail on error: " + config.isFailOnError());
        getLog().info("============================================================");
    }

    private void logReport(QueryReport report) {
        getLog().info(report.getTitle());
        for (ReportRow row : report.getRows()) {
            if (row.isHighlighted()) {
                getLog().warn("  " + row);
            } else {
                getLog().info("  " + row);
            }
        }
        getLog().info("============================================================");
        if (report.isError()) {
            getLog().error(report.getStatusLine());
        } else {
            getLog().info(report.getStatusLine());
        }
        getLog().info("============================================================");
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("Package Dependency Explorer Failed: " + message);
        getLog().error("============================================================");
        getLog().error("Error: " + e.getMessage());
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }

    // ========== Parameter Setters ==========

    void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    void setQuery(String query) {
        this.query = query;
    }

    void setProviderExecutable(String providerExecutable) {
        this.providerExecutable = providerExecutable;
    }

    void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    void setBreadthCap(int breadthCap) {
        this.breadthCap = breadthCap;
    }

    void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    void setExhaustiveCycleSearch(boolean exhaustiveCycleSearch) {
        this.exhaustiveCycleSearch = exhaustiveCycleSearch;
    }

    void setIncludeFilters(List<String> includeFilters) {
        this.includeFilters = includeFilters;
    }

    void setExcludeFilters(List<String> excludeFilters) {
        this.excludeFilters = excludeFilters;
    }

    void setMaxDisplayedCycles(int maxDisplayedCycles) {
        this.maxDisplayedCycles = maxDisplayedCycles;
    }

    void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    void setOutputFile(File outputFile) {
        this.outputFile = outputFile;
    }
}
