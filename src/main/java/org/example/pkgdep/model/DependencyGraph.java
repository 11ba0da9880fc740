package org.example.pkgdep.model;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Adjacency structure assembled for a single query.
 * Contains packages (nodes) and dependency edges. Edges are kept in insertion
 * order and duplicates reported by the provider are not collapsed.
 */
public class DependencyGraph {

    private final PackageName rootPackage;
    private final Set<PackageName> packages;
    private final List<DependencyEdge> edges;

    /**
     * Creates a new DependencyGraph with the specified root package.
     */
    public DependencyGraph(PackageName rootPackage) {
        this.rootPackage = Objects.requireNonNull(rootPackage, "rootPackage cannot be null");
        this.packages = new LinkedHashSet<>();
        this.edges = new ArrayList<>();
        this.packages.add(rootPackage);
    }

    /**
     * Creates a new DependencyGraph using the builder pattern.
     */
    public static Builder builder(PackageName rootPackage) {
        return new Builder(rootPackage);
    }

    // Getters

    public PackageName getRootPackage() {
        return rootPackage;
    }

    public Set<PackageName> getPackages() {
        return Collections.unmodifiableSet(packages);
    }

    public List<DependencyEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    // Modification methods

    public void addPackage(PackageName packageName) {
        packages.add(packageName);
    }

    /**
     * Adds an edge to the graph.
     * Also ensures both ends are in the graph.
     */
    public void addEdge(DependencyEdge edge) {
        packages.add(edge.getFrom());
        packages.add(edge.getTo());
        edges.add(edge);
    }

    public void addEdge(PackageName from, PackageName to) {
        addEdge(new DependencyEdge(from, to));
    }

    // Query methods

    public int getPackageCount() {
        return packages.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public boolean containsPackage(PackageName packageName) {
        return packages.contains(packageName);
    }

    /**
     * Forward query: packages the given package depends on, in insertion order.
     */
    public List<PackageName> getDependenciesOf(PackageName packageName) {
        return edges.stream()
                .filter(e -> e.getFrom().equals(packageName))
                .map(DependencyEdge::getTo)
                .collect(Collectors.toList());
    }

    /**
     * Reverse query: packages that depend on the given package, in insertion order.
     */
    public List<PackageName> getDependentsOf(PackageName packageName) {
        return edges.stream()
                .filter(e -> e.getTo().equals(packageName))
                .map(DependencyEdge::getFrom)
                .collect(Collectors.toList());
    }

    public boolean hasEdge(PackageName from, PackageName to) {
        return edges.stream()
                .anyMatch(e -> e.getFrom().equals(from) && e.getTo().equals(to));
    }

    /**
     * Returns all edges that point back at their own source.
     */
    public List<DependencyEdge> getSelfDependencies() {
        return edges.stream()
                .filter(DependencyEdge::isSelfDependency)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
                "rootPackage=" + rootPackage +
                ", packageCount=" + packages.size() +
                ", edgeCount=" + edges.size() +
                '}';
    }

    /**
     * Returns a detailed string representation of the graph.
     */
    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("DependencyGraph:\n");
        sb.append("  Root: ").append(rootPackage).append("\n");
        sb.append("  Packages (").append(packages.size()).append("):\n");
        for (PackageName packageName : packages) {
            sb.append("    - ").append(packageName).append("\n");
        }
        sb.append("  Edges (").append(edges.size()).append("):\n");
        for (DependencyEdge edge : edges) {
            sb.append("    - ").append(edge).append("\n");
        }
        return sb.toString();
    }

    /**
     * Builder for DependencyGraph.
     */
    public static class Builder {
        private final DependencyGraph graph;

        public Builder(PackageName rootPackage) {
            this.graph = new DependencyGraph(rootPackage);
        }

        public Builder addPackage(PackageName packageName) {
            graph.addPackage(packageName);
            return this;
        }

        public Builder addEdge(PackageName from, PackageName to) {
            graph.addEdge(from, to);
            return this;
        }

        public Builder addRecord(DependencyRecord record) {
            graph.addPackage(record.getPackageName());
            record.getEdges().forEach(graph::addEdge);
            return this;
        }

        public Builder addRecord(ReverseDependencyRecord record) {
            graph.addPackage(record.getPackageName());
            record.getEdges().forEach(graph::addEdge);
            return this;
        }

        public DependencyGraph build() {
            return graph;
        }
    }
}
