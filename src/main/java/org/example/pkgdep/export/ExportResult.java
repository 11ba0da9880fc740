package org.example.pkgdep.export;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of a dependency graph export.
 */
public class ExportResult {

    private final Path target;
    private final int packagesExported;
    private final int edgesExported;
    private final long executionTimeMs;

    public ExportResult(Path target, int packagesExported, int edgesExported, long executionTimeMs) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.packagesExported = packagesExported;
        this.edgesExported = edgesExported;
        this.executionTimeMs = executionTimeMs;
    }

    public Path getTarget() {
        return target;
    }

    public int getPackagesExported() {
        return packagesExported;
    }

    public int getEdgesExported() {
        return edgesExported;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    @Override
    public String toString() {
        return String.format("ExportResult{target=%s, packages=%d, edges=%d, time=%dms}",
                target, packagesExported, edgesExported, executionTimeMs);
    }
}
