package org.example.pkgdep.graph;

import org.example.pkgdep.model.Cycle;
import org.example.pkgdep.model.CycleReport;
import org.example.pkgdep.model.PackageName;
import org.example.pkgdep.provider.LookupResult;
import org.example.pkgdep.provider.PackageMetadataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds circular dependency chains reachable from a root package.
 *
 * <p>Depth-first search over the forward relation, fetching dependencies lazily
 * with one provider call per expanded package. For each package:</p>
 * <ol>
 *   <li>If it is on the current path, the path from its first occurrence plus
 *       the package itself is a cycle; it is not expanded again.</li>
 *   <li>In {@link CycleSearchMode#MEMOIZED} mode, a package that was already
 *       expanded is skipped.</li>
 *   <li>A package deeper than {@code maxDepth} is skipped without being marked visited.</li>
 *   <li>Otherwise it is marked visited, pushed, and its first {@code breadthCap}
 *       dependencies are searched in provider order before it is popped.</li>
 * </ol>
 *
 * <p>Cycles are reported in discovery order and are not deduplicated.</p>
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    public static final int DEFAULT_BREADTH_CAP = 10;
    public static final int UNLIMITED_DEPTH = -1;

    private final PackageMetadataProvider provider;
    private final Duration timeout;
    private final int breadthCap;
    private final int maxDepth;
    private final CycleSearchMode mode;

    public CycleDetector(PackageMetadataProvider provider, Duration timeout) {
        this(provider, timeout, DEFAULT_BREADTH_CAP, UNLIMITED_DEPTH, CycleSearchMode.MEMOIZED);
    }

    /**
     * Creates a CycleDetector.
     *
     * @param provider   source of dependency lists
     * @param timeout    limit for each provider call
     * @param breadthCap maximum number of dependencies explored per package
     * @param maxDepth   maximum depth expanded (-1 = unlimited, 0 = root only)
     * @param mode       whether explored packages are expanded again
     */
    public CycleDetector(PackageMetadataProvider provider, Duration timeout,
                         int breadthCap, int maxDepth, CycleSearchMode mode) {
        if (breadthCap < 1) {
            throw new IllegalArgumentException("breadthCap must be >= 1, but was: " + breadthCap);
        }
        if (maxDepth < UNLIMITED_DEPTH) {
            throw new IllegalArgumentException("maxDepth must be -1 (unlimited) or >= 0, but was: " + maxDepth);
        }
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.breadthCap = breadthCap;
        this.maxDepth = maxDepth;
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
    }

    /**
     * Searches for cycles starting at the given root.
     *
     * @param root the package to start from
     * @return the cycles found, with the explored graph and any failed lookups
     */
    public CycleReport findCycles(PackageName root) {
        log.info("Searching for circular dependencies from {} (breadth cap {}, depth {}, {})",
                root, breadthCap, maxDepth == UNLIMITED_DEPTH ? "unlimited" : maxDepth, mode);

        TraversalState state = new TraversalState(root);
        List<Cycle> cycles = new ArrayList<>();
        visit(root, state, cycles);

        CycleReport report = new CycleReport(root, cycles, state.getExploredGraph(),
                state.getFailedLookups(), state.getExpandedCount());
        log.info("Found {} circular dependencies from {} ({} packages expanded, {} lookups failed)",
                cycles.size(), root, report.getExpandedCount(), report.getFailedLookups().size());
        return report;
    }

    private void visit(PackageName packageName, TraversalState state, List<Cycle> cycles) {
        if (state.isOnPath(packageName)) {
            Cycle cycle = state.closeCycle(packageName);
            log.debug("Cycle found: {}", cycle.toChainString());
            cycles.add(cycle);
            return;
        }

        if (mode == CycleSearchMode.MEMOIZED && state.isVisited(packageName)) {
            return;
        }

        if (maxDepth != UNLIMITED_DEPTH && state.depth() > maxDepth) {
            log.debug("Depth limit reached at {}", packageName);
            return;
        }

        state.markVisited(packageName);
        state.push(packageName);
        try {
            LookupResult lookup = provider.getDirectDependencies(packageName, timeout);
            if (!lookup.isSuccess()) {
                state.recordFailure(packageName, lookup.getErrorMessage());
                return;
            }

            List<PackageName> dependencies = lookup.getPackages();
            if (dependencies.size() > breadthCap) {
                log.debug("{} has {} dependencies, exploring the first {}",
                        packageName, dependencies.size(), breadthCap);
                dependencies = dependencies.subList(0, breadthCap);
            }

            for (PackageName dependency : dependencies) {
                state.recordEdge(packageName, dependency);
                visit(dependency, state, cycles);
            }
        } finally {
            state.pop();
        }
    }

    public int getBreadthCap() {
        return breadthCap;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public CycleSearchMode getMode() {
        return mode;
    }
}
