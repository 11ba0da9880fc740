package org.example.pkgdep.config;

import java.io.File;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plugin configuration model.
 * Contains all configuration parameters of the package dependency explorer.
 */
public class PluginConfiguration {

    /**
     * Package to inspect.
     */
    private String packageName;

    /**
     * Query to run - "dependencies", "reverse" or "cycles".
     * Default: "dependencies"
     */
    private String query = "dependencies";

    /**
     * Provider executable.
     * Default: "apt-cache"
     */
    private String providerExecutable = "apt-cache";

    /**
     * Hard limit for each provider call, in seconds.
     * Default: 10
     */
    private int timeoutSeconds = 10;

    /**
     * Dependencies explored per package during cycle search.
     * Default: 10
     */
    private int breadthCap = 10;

    /**
     * Cycle search depth.
     * -1 = unlimited, 0 = root only, N = N levels.
     * Default: -1
     */
    private int maxDepth = -1;

    /**
     * Whether the cycle search re-expands packages it has already explored.
     * Default: false
     */
    private boolean exhaustiveCycleSearch = false;

    /**
     * Include filter patterns (glob style) for view rows.
     */
    private List<String> includeFilters = new ArrayList<>();

    /**
     * Exclude filter patterns (glob style) for view rows.
     */
    private List<String> excludeFilters = new ArrayList<>();

    /**
     * Maximum number of cycles displayed.
     * Default: 20
     */
    private int maxDisplayedCycles = 20;

    /**
     * Whether to fail the build when a lookup fails.
     * Default: false
     */
    private boolean failOnError = false;

    /**
     * File the query's dependency graph is written to, in DOT format.
     * Default: none (no export)
     */
    private File outputFile;

    // Constructors

    public PluginConfiguration() {
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters and Setters

    public String getPackageName() {
        return packageName;
    }

    public void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getProviderExecutable() {
        return providerExecutable;
    }

    public void setProviderExecutable(String providerExecutable) {
        this.providerExecutable = providerExecutable;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public int getBreadthCap() {
        return breadthCap;
    }

    public void setBreadthCap(int breadthCap) {
        this.breadthCap = breadthCap;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public boolean isExhaustiveCycleSearch() {
        return exhaustiveCycleSearch;
    }

    public void setExhaustiveCycleSearch(boolean exhaustiveCycleSearch) {
        this.exhaustiveCycleSearch = exhaustiveCycleSearch;
    }

    public List<String> getIncludeFilters() {
        return includeFilters;
    }

    public void setIncludeFilters(List<String> includeFilters) {
        this.includeFilters = includeFilters != null ? includeFilters : new ArrayList<>();
    }

    public List<String> getExcludeFilters() {
        return excludeFilters;
    }

    public void setExcludeFilters(List<String> excludeFilters) {
        this.excludeFilters = excludeFilters != null ? excludeFilters : new ArrayList<>();
    }

    public int getMaxDisplayedCycles() {
        return maxDisplayedCycles;
    }

    public void setMaxDisplayedCycles(int maxDisplayedCycles) {
        this.maxDisplayedCycles = maxDisplayedCycles;
    }

    public boolean isFailOnError() {
        return failOnError;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    public File getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(File outputFile) {
        this.outputFile = outputFile;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginConfiguration that = (PluginConfiguration) o;
        return timeoutSeconds == that.timeoutSeconds &&
                breadthCap == that.breadthCap &&
                maxDepth == that.maxDepth &&
                exhaustiveCycleSearch == that.exhaustiveCycleSearch &&
                maxDisplayedCycles == that.maxDisplayedCycles &&
                failOnError == that.failOnError &&
                Objects.equals(packageName, that.packageName) &&
                Objects.equals(query, that.query) &&
                Objects.equals(providerExecutable, that.providerExecutable) &&
                Objects.equals(includeFilters, that.includeFilters) &&
                Objects.equals(excludeFilters, that.excludeFilters) &&
                Objects.equals(outputFile, that.outputFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, query, providerExecutable, timeoutSeconds, breadthCap, maxDepth,
                exhaustiveCycleSearch, includeFilters, excludeFilters, maxDisplayedCycles, failOnError, outputFile);
    }

    @Override
    public String toString() {
        return "PluginConfiguration{" +
                "packageName='" + packageName + '\'' +
                ", query='" + query + '\'' +
                ", providerExecutable='" + providerExecutable + '\'' +
                ", timeoutSeconds=" + timeoutSeconds +
                ", breadthCap=" + breadthCap +
                ", maxDepth=" + maxDepth +
                ", exhaustiveCycleSearch=" + exhaustiveCycleSearch +
                ", includeFilters=" + includeFilters +
                ", excludeFilters=" + excludeFilters +
                ", maxDisplayedCycles=" + maxDisplayedCycles +
                ", failOnError=" + failOnError +
                ", outputFile=" + outputFile +
                '}';
    }

    /**
     * Builder for PluginConfiguration.
     */
    public static class Builder {
        private final PluginConfiguration config = new PluginConfiguration();

        public Builder packageName(String packageName) {
            config.setPackageName(packageName);
            return this;
        }

        public Builder query(String query) {
            config.setQuery(query);
            return this;
        }

        public Builder providerExecutable(String providerExecutable) {
            config.setProviderExecutable(providerExecutable);
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            config.setTimeoutSeconds(timeoutSeconds);
            return this;
        }

        public Builder breadthCap(int breadthCap) {
            config.setBreadthCap(breadthCap);
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            config.setMaxDepth(maxDepth);
            return this;
        }

        public Builder exhaustiveCycleSearch(boolean exhaustiveCycleSearch) {
            config.setExhaustiveCycleSearch(exhaustiveCycleSearch);
            return this;
        }

        public Builder includeFilters(List<String> includeFilters) {
            config.setIncludeFilters(includeFilters);
            return this;
        }

        public Builder excludeFilters(List<String> excludeFilters) {
            config.setExcludeFilters(excludeFilters);
            return this;
        }

        public Builder maxDisplayedCycles(int maxDisplayedCycles) {
            config.setMaxDisplayedCycles(maxDisplayedCycles);
            return this;
        }

        public Builder failOnError(boolean failOnError) {
            config.setFailOnError(failOnError);
            return this;
        }

        public Builder outputFile(File outputFile) {
            config.setOutputFile(outputFile);
            return this;
        }

        public PluginConfiguration build() {
            return config;
        }
    }
}
