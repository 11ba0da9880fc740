package org.example.pkgdep.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Flat, ordered result of a dependency or reverse-dependency query:
 * a header for the root followed by one summary per child.
 */
public class DependencyView {

    public enum Direction {
        FORWARD,
        REVERSE
    }

    private final Direction direction;
    private final PackageName root;
    private final int totalCount;
    private final List<ChildSummary> children;
    private final int filteredOutCount;
    private final DependencyGraph graph;
    private final String errorMessage;

    private DependencyView(Builder builder) {
        this.direction = Objects.requireNonNull(builder.direction, "direction cannot be null");
        this.root = Objects.requireNonNull(builder.root, "root cannot be null");
        this.totalCount = builder.totalCount;
        this.children = List.copyOf(builder.children);
        this.filteredOutCount = builder.filteredOutCount;
        this.graph = builder.graph != null ? builder.graph : new DependencyGraph(builder.root);
        this.errorMessage = builder.errorMessage;
    }

    public static Builder builder(Direction direction, PackageName root) {
        return new Builder(direction, root);
    }

    /**
     * Creates a view for a root whose own lookup failed.
     */
    public static DependencyView failed(Direction direction, PackageName root, String errorMessage) {
        return builder(direction, root)
                .errorMessage(errorMessage != null ? errorMessage : "lookup failed")
                .build();
    }

    public Direction getDirection() {
        return direction;
    }

    public PackageName getRoot() {
        return root;
    }

    /**
     * Number of direct entries the provider reported for the root, before filtering.
     */
    public int getTotalCount() {
        return totalCount;
    }

    public List<ChildSummary> getChildren() {
        return children;
    }

    public int getFilteredOutCount() {
        return filteredOutCount;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public boolean isLookupFailed() {
        return errorMessage != null;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (isLookupFailed()) {
            return String.format("DependencyView{%s, root=%s, error='%s'}", direction, root, errorMessage);
        }
        return String.format("DependencyView{%s, root=%s, total=%d, shown=%d, filteredOut=%d}",
                direction, root, totalCount, children.size(), filteredOutCount);
    }

    public static class Builder {
        private final Direction direction;
        private final PackageName root;
        private int totalCount;
        private List<ChildSummary> children = List.of();
        private int filteredOutCount;
        private DependencyGraph graph;
        private String errorMessage;

        private Builder(Direction direction, PackageName root) {
            this.direction = direction;
            this.root = root;
        }

        public Builder totalCount(int totalCount) {
            this.totalCount = totalCount;
            return this;
        }

        public Builder children(List<ChildSummary> children) {
            this.children = children;
            return this;
        }

        public Builder filteredOutCount(int filteredOutCount) {
            this.filteredOutCount = filteredOutCount;
            return this;
        }

        public Builder graph(DependencyGraph graph) {
            this.graph = graph;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public DependencyView build() {
            return new DependencyView(this);
        }
    }
}
