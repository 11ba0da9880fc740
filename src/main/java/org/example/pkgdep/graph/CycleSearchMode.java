package org.example.pkgdep.graph;

/**
 * How the cycle detector treats packages it has already explored.
 */
public enum CycleSearchMode {

    /**
     * A fully explored package is never expanded again. Bounds the number of
     * provider calls to one per package, but misses cycles that re-enter an
     * already explored subtree through a different parent.
     */
    MEMOIZED,

    /**
     * Every path is followed until it closes a cycle or ends. Finds all cycles
     * reachable within the breadth and depth limits; cost grows exponentially
     * with shared sub-dependencies.
     */
    EXHAUSTIVE
}
