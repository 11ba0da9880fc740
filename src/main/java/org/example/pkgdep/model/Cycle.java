package org.example.pkgdep.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A circular dependency chain: a path along forward dependency edges that
 * returns to its origin. The first and last elements are always equal and a
 * self-dependency is the two-element cycle {@code [A, A]}.
 */
public class Cycle {

    public static final String ARROW = " → ";

    private final List<PackageName> packages;

    /**
     * Creates a new Cycle.
     *
     * @param packages the closed path, first element repeated at the end
     * @throws IllegalArgumentException if the path has fewer than two elements or is not closed
     */
    public Cycle(List<PackageName> packages) {
        Objects.requireNonNull(packages, "packages cannot be null");
        if (packages.size() < 2) {
            throw new IllegalArgumentException("A cycle needs at least two elements, got " + packages);
        }
        if (!packages.get(0).equals(packages.get(packages.size() - 1))) {
            throw new IllegalArgumentException("A cycle must end where it starts, got " + packages);
        }
        this.packages = List.copyOf(packages);
    }

    /**
     * Closes the given open path back onto its first element.
     */
    public static Cycle closing(List<PackageName> openPath) {
        List<PackageName> closed = new ArrayList<>(openPath);
        if (!closed.isEmpty()) {
            closed.add(closed.get(0));
        }
        return new Cycle(closed);
    }

    public List<PackageName> getPackages() {
        return packages;
    }

    public PackageName getOrigin() {
        return packages.get(0);
    }

    /**
     * Number of elements including the repeated origin.
     */
    public int length() {
        return packages.size();
    }

    public boolean isSelfDependency() {
        return packages.size() == 2;
    }

    /**
     * Returns the consecutive edges that make up this cycle.
     */
    public List<DependencyEdge> getEdges() {
        List<DependencyEdge> edges = new ArrayList<>(packages.size() - 1);
        for (int i = 0; i < packages.size() - 1; i++) {
            edges.add(new DependencyEdge(packages.get(i), packages.get(i + 1)));
        }
        return edges;
    }

    /**
     * Returns the chain joined with arrows, e.g. {@code a → b → a}.
     */
    public String toChainString() {
        return packages.stream()
                .map(PackageName::getValue)
                .collect(Collectors.joining(ARROW));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cycle cycle = (Cycle) o;
        return packages.equals(cycle.packages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packages);
    }

    @Override
    public String toString() {
        return "Cycle" + packages;
    }
}
