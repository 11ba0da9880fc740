package org.example.pkgdep.graph;

import org.example.pkgdep.model.Cycle;
import org.example.pkgdep.model.DependencyGraph;
import org.example.pkgdep.model.PackageName;

import java.util.*;

/**
 * Mutable state of one cycle search. Created per query and discarded with it.
 */
class TraversalState {

    private final Set<PackageName> visited = new HashSet<>();
    private final List<PackageName> path = new ArrayList<>();
    private final DependencyGraph exploredGraph;
    private final Map<PackageName, String> failedLookups = new LinkedHashMap<>();
    private int expandedCount;

    TraversalState(PackageName root) {
        this.exploredGraph = new DependencyGraph(root);
    }

    boolean isOnPath(PackageName packageName) {
        return path.contains(packageName);
    }

    boolean isVisited(PackageName packageName) {
        return visited.contains(packageName);
    }

    void markVisited(PackageName packageName) {
        visited.add(packageName);
    }

    void push(PackageName packageName) {
        path.add(packageName);
        expandedCount++;
    }

    void pop() {
        path.remove(path.size() - 1);
    }

    /**
     * Depth of the next package to be pushed; the root has depth 0.
     */
    int depth() {
        return path.size();
    }

    /**
     * Builds the cycle closed by reaching a package that is already on the path.
     */
    Cycle closeCycle(PackageName packageName) {
        int start = path.indexOf(packageName);
        return Cycle.closing(path.subList(start, path.size()));
    }

    void recordEdge(PackageName from, PackageName to) {
        exploredGraph.addEdge(from, to);
    }

    void recordFailure(PackageName packageName, String message) {
        failedLookups.put(packageName, message);
    }

    DependencyGraph getExploredGraph() {
        return exploredGraph;
    }

    Map<PackageName, String> getFailedLookups() {
        return failedLookups;
    }

    int getExpandedCount() {
        return expandedCount;
    }
}
