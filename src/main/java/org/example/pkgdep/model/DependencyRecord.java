package org.example.pkgdep.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A package and its direct dependencies, in provider order.
 * Duplicates reported by the provider are kept.
 */
public class DependencyRecord {

    private final PackageName packageName;
    private final List<PackageName> dependencies;

    public DependencyRecord(PackageName packageName, List<PackageName> dependencies) {
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.dependencies = List.copyOf(Objects.requireNonNull(dependencies, "dependencies cannot be null"));
    }

    public PackageName getPackageName() {
        return packageName;
    }

    public List<PackageName> getDependencies() {
        return dependencies;
    }

    public int getDependencyCount() {
        return dependencies.size();
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /**
     * Returns the outgoing edges of this package.
     */
    public List<DependencyEdge> getEdges() {
        return dependencies.stream()
                .map(dep -> new DependencyEdge(packageName, dep))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "DependencyRecord{" + packageName + " -> " + dependencies + '}';
    }
}
