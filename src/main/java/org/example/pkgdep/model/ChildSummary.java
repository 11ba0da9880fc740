package org.example.pkgdep.model;

import java.util.Objects;

/**
 * One row of a dependency view: a direct dependency (or dependent) of the root,
 * annotated with its own direct dependency count.
 */
public class ChildSummary {

    /**
     * Whether the dependency count of a child is known.
     */
    public enum CountStatus {
        /** The lookahead lookup succeeded. */
        KNOWN,
        /** The lookahead lookup failed; the count is reported as 0. */
        UNKNOWN,
        /** No lookahead was made (reverse views). */
        NOT_REQUESTED
    }

    private final PackageName packageName;
    private final int dependencyCount;
    private final CountStatus countStatus;

    private ChildSummary(PackageName packageName, int dependencyCount, CountStatus countStatus) {
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.dependencyCount = dependencyCount;
        this.countStatus = countStatus;
    }

    public static ChildSummary counted(PackageName packageName, int dependencyCount) {
        if (dependencyCount < 0) {
            throw new IllegalArgumentException("dependencyCount must be >= 0, but was: " + dependencyCount);
        }
        return new ChildSummary(packageName, dependencyCount, CountStatus.KNOWN);
    }

    public static ChildSummary unknown(PackageName packageName) {
        return new ChildSummary(packageName, 0, CountStatus.UNKNOWN);
    }

    public static ChildSummary uncounted(PackageName packageName) {
        return new ChildSummary(packageName, 0, CountStatus.NOT_REQUESTED);
    }

    public PackageName getPackageName() {
        return packageName;
    }

    /**
     * Returns the child's own direct dependency count, 0 unless the count is {@link CountStatus#KNOWN}.
     */
    public int getDependencyCount() {
        return dependencyCount;
    }

    public CountStatus getCountStatus() {
        return countStatus;
    }

    public boolean isCountKnown() {
        return countStatus == CountStatus.KNOWN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChildSummary that = (ChildSummary) o;
        return dependencyCount == that.dependencyCount &&
               packageName.equals(that.packageName) &&
               countStatus == that.countStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, dependencyCount, countStatus);
    }

    @Override
    public String toString() {
        return packageName + " (" + countStatus + ", " + dependencyCount + ")";
    }
}
