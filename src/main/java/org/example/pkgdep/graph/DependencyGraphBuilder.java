package org.example.pkgdep.graph;

import org.example.pkgdep.filter.PackageFilter;
import org.example.pkgdep.model.ChildSummary;
import org.example.pkgdep.model.DependencyGraph;
import org.example.pkgdep.model.DependencyRecord;
import org.example.pkgdep.model.DependencyView;
import org.example.pkgdep.model.DependencyView.Direction;
import org.example.pkgdep.model.PackageName;
import org.example.pkgdep.model.ReverseDependencyRecord;
import org.example.pkgdep.provider.LookupResult;
import org.example.pkgdep.provider.PackageMetadataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the flat dependency and reverse-dependency views of a root package.
 *
 * <p>The forward view looks one level ahead: every shown child costs one more
 * provider call, made sequentially, to annotate it with its own dependency
 * count. Nothing is expanded further and nothing is cached between calls.</p>
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final PackageMetadataProvider provider;
    private final Duration timeout;
    private final PackageFilter filter;

    public DependencyGraphBuilder(PackageMetadataProvider provider, Duration timeout) {
        this(provider, timeout, PackageFilter.acceptAll());
    }

    public DependencyGraphBuilder(PackageMetadataProvider provider, Duration timeout, PackageFilter filter) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.filter = filter != null ? filter : PackageFilter.acceptAll();
    }

    /**
     * Builds the forward view: the root's direct dependencies, each annotated
     * with its own direct dependency count.
     *
     * @param root the package to inspect
     * @return the view, or a failed view if the root lookup failed
     */
    public DependencyView buildDependencyView(PackageName root) {
        log.info("Building dependency view for {}", root);

        LookupResult rootLookup = provider.getDirectDependencies(root, timeout);
        if (!rootLookup.isSuccess()) {
            return DependencyView.failed(Direction.FORWARD, root, rootLookup.getErrorMessage());
        }

        DependencyRecord rootRecord = new DependencyRecord(root, rootLookup.getPackages());
        DependencyGraph.Builder graph = DependencyGraph.builder(root).addRecord(rootRecord);

        List<ChildSummary> children = new ArrayList<>();
        int filteredOut = 0;

        for (PackageName dependency : rootRecord.getDependencies()) {
            if (!filter.accepts(dependency)) {
                filteredOut++;
                continue;
            }

            LookupResult childLookup = provider.getDirectDependencies(dependency, timeout);
            if (childLookup.isSuccess()) {
                DependencyRecord childRecord = new DependencyRecord(dependency, childLookup.getPackages());
                graph.addRecord(childRecord);
                children.add(ChildSummary.counted(dependency, childRecord.getDependencyCount()));
            } else {
                children.add(ChildSummary.unknown(dependency));
            }
        }

        log.info("{} has {} direct dependencies ({} shown)", root, rootRecord.getDependencyCount(), children.size());

        return DependencyView.builder(Direction.FORWARD, root)
                .totalCount(rootRecord.getDependencyCount())
                .children(children)
                .filteredOutCount(filteredOut)
                .graph(graph.build())
                .build();
    }

    /**
     * Builds the reverse view: the packages that depend on the root, without lookahead.
     *
     * @param root the package to inspect
     * @return the view, or a failed view if the lookup failed
     */
    public DependencyView buildReverseView(PackageName root) {
        log.info("Building reverse dependency view for {}", root);

        LookupResult lookup = provider.getReverseDependencies(root, timeout);
        if (!lookup.isSuccess()) {
            return DependencyView.failed(Direction.REVERSE, root, lookup.getErrorMessage());
        }

        ReverseDependencyRecord record = new ReverseDependencyRecord(root, lookup.getPackages());

        List<ChildSummary> children = new ArrayList<>();
        int filteredOut = 0;
        for (PackageName dependent : record.getDependents()) {
            if (filter.accepts(dependent)) {
                children.add(ChildSummary.uncounted(dependent));
            } else {
                filteredOut++;
            }
        }

        log.info("{} has {} reverse dependencies ({} shown)", root, record.getDependentCount(), children.size());

        return DependencyView.builder(Direction.REVERSE, root)
                .totalCount(record.getDependentCount())
                .children(children)
                .filteredOutCount(filteredOut)
                .graph(DependencyGraph.builder(root).addRecord(record).build())
                .build();
    }

    public PackageFilter getFilter() {
        return filter;
    }
}
