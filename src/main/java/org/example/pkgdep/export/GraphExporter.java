package org.example.pkgdep.export;

import org.example.pkgdep.exception.ExportException;
import org.example.pkgdep.model.DependencyGraph;

import java.nio.file.Path;

/**
 * Interface for graph exporters.
 * Implementations write a dependency graph to a file in a specific format.
 */
public interface GraphExporter {

    /**
     * Writes the graph to the target file, replacing any existing content.
     *
     * @param graph  the dependency graph to export
     * @param target the file to write
     * @return the export result with statistics
     * @throws ExportException if the file cannot be written
     */
    ExportResult export(DependencyGraph graph, Path target) throws ExportException;
}
