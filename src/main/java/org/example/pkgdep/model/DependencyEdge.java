package org.example.pkgdep.model;

import java.util.Objects;

/**
 * A dependency relationship: {@code from} depends on {@code to}.
 * This is an edge in the dependency graph.
 */
public class DependencyEdge {

    private final PackageName from;
    private final PackageName to;

    public DependencyEdge(PackageName from, PackageName to) {
        this.from = Objects.requireNonNull(from, "from cannot be null");
        this.to = Objects.requireNonNull(to, "to cannot be null");
    }

    public PackageName getFrom() {
        return from;
    }

    public PackageName getTo() {
        return to;
    }

    public boolean isSelfDependency() {
        return from.equals(to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependencyEdge that = (DependencyEdge) o;
        return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
