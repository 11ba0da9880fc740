package org.example.pkgdep.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A package and the packages that declare a dependency on it.
 * Entries are kept verbatim from the provider, one per declaring package, not deduplicated.
 */
public class ReverseDependencyRecord {

    private final PackageName packageName;
    private final List<PackageName> dependents;

    public ReverseDependencyRecord(PackageName packageName, List<PackageName> dependents) {
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.dependents = List.copyOf(Objects.requireNonNull(dependents, "dependents cannot be null"));
    }

    public PackageName getPackageName() {
        return packageName;
    }

    public List<PackageName> getDependents() {
        return dependents;
    }

    public int getDependentCount() {
        return dependents.size();
    }

    /**
     * Returns the incoming edges of this package (dependent -> package).
     */
    public List<DependencyEdge> getEdges() {
        return dependents.stream()
                .map(dependent -> new DependencyEdge(dependent, packageName))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "ReverseDependencyRecord{" + packageName + " <- " + dependents + '}';
    }
}
