package org.example.pkgdep.model;

import java.util.*;

/**
 * Result of a circular dependency search from a single root.
 */
public class CycleReport {

    private final PackageName root;
    private final List<Cycle> cycles;
    private final DependencyGraph exploredGraph;
    private final Map<PackageName, String> failedLookups;
    private final int expandedCount;

    public CycleReport(PackageName root, List<Cycle> cycles, DependencyGraph exploredGraph,
                       Map<PackageName, String> failedLookups, int expandedCount) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.cycles = List.copyOf(cycles);
        this.exploredGraph = Objects.requireNonNull(exploredGraph, "exploredGraph cannot be null");
        this.failedLookups = Collections.unmodifiableMap(new LinkedHashMap<>(failedLookups));
        this.expandedCount = expandedCount;
    }

    public PackageName getRoot() {
        return root;
    }

    /**
     * Cycles in discovery order. Structurally identical cycles reached from different entry points are not merged.
     */
    public List<Cycle> getCycles() {
        return cycles;
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    public DependencyGraph getExploredGraph() {
        return exploredGraph;
    }

    /**
     * Packages whose dependency lookup failed during the search, with the failure message.
     */
    public Map<PackageName, String> getFailedLookups() {
        return failedLookups;
    }

    /**
     * True if every lookup made during the search succeeded.
     */
    public boolean isComplete() {
        return failedLookups.isEmpty();
    }

    /**
     * True if the root's own lookup failed, i.e. nothing could be searched.
     */
    public boolean isRootLookupFailed() {
        return failedLookups.containsKey(root);
    }

    /**
     * Number of packages whose dependencies were fetched.
     */
    public int getExpandedCount() {
        return expandedCount;
    }

    @Override
    public String toString() {
        return "CycleReport{" +
                "root=" + root +
                ", cycles=" + cycles.size() +
                ", expanded=" + expandedCount +
                ", failedLookups=" + failedLookups.size() +
                '}';
    }
}
