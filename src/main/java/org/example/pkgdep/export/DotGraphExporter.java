package org.example.pkgdep.export;

import org.example.pkgdep.exception.ExportException;
import org.example.pkgdep.model.DependencyEdge;
import org.example.pkgdep.model.DependencyGraph;
import org.example.pkgdep.model.PackageName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a dependency graph as a Graphviz DOT digraph, UTF-8 encoded.
 *
 * <p>The root is drawn bold. Packages and edges keep the graph's insertion
 * order, and duplicate edges are written once per occurrence.</p>
 */
public class DotGraphExporter implements GraphExporter {

    private static final Logger log = LoggerFactory.getLogger(DotGraphExporter.class);

    @Override
    public ExportResult export(DependencyGraph graph, Path target) throws ExportException {
        long startTime = System.currentTimeMillis();
        log.info("Exporting graph of {} ({} packages, {} edges) to {}",
                graph.getRootPackage(), graph.getPackageCount(), graph.getEdgeCount(), target);

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                writer.write(toDot(graph));
            }
        } catch (IOException e) {
            throw new ExportException("Failed to write graph to " + target + ": " + e.getMessage(), e);
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.debug("Graph written to {} in {}ms", target, elapsed);
        return new ExportResult(target, graph.getPackageCount(), graph.getEdgeCount(), elapsed);
    }

    /**
     * Renders the graph in DOT syntax.
     */
    String toDot(DependencyGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(graph.getRootPackage())).append(" {\n");
        for (PackageName packageName : graph.getPackages()) {
            sb.append("  ").append(quote(packageName));
            if (packageName.equals(graph.getRootPackage())) {
                sb.append(" [style=bold]");
            }
            sb.append(";\n");
        }
        for (DependencyEdge edge : graph.getEdges()) {
            sb.append("  ").append(quote(edge.getFrom()))
                    .append(" -> ").append(quote(edge.getTo())).append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String quote(PackageName packageName) {
        return '"' + packageName.getValue().replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
