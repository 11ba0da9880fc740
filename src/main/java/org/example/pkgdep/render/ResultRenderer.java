package org.example.pkgdep.render;

import org.example.pkgdep.model.ChildSummary;
import org.example.pkgdep.model.Cycle;
import org.example.pkgdep.model.CycleReport;
import org.example.pkgdep.model.DependencyView;
import org.example.pkgdep.render.QueryReport.Outcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns dependency views and cycle reports into rows and a status line.
 */
public class ResultRenderer {

    public static final int DEFAULT_MAX_DISPLAYED_CYCLES = 20;

    static final String NO_CYCLES = "No circular dependencies found";

    private final int maxDisplayedCycles;

    public ResultRenderer() {
        this(DEFAULT_MAX_DISPLAYED_CYCLES);
    }

    public ResultRenderer(int maxDisplayedCycles) {
        if (maxDisplayedCycles < 1) {
            throw new IllegalArgumentException("maxDisplayedCycles must be >= 1, but was: " + maxDisplayedCycles);
        }
        this.maxDisplayedCycles = maxDisplayedCycles;
    }

    public QueryReport render(DependencyView view) {
        boolean forward = view.getDirection() == DependencyView.Direction.FORWARD;
        String root = view.getRoot().getValue();
        String title = forward ? "Dependencies of " + root : "Reverse dependencies of " + root;
        String noun = forward ? "dependencies" : "reverse dependencies";

        if (view.isLookupFailed()) {
            String error = view.getErrorMessage().orElse("lookup failed");
            return new QueryReport(title,
                    List.of(new ReportRow("Lookup failed", error, true)),
                    lookupFailedStatus(root), Outcome.ERROR, 0, view.getGraph());
        }

        List<ReportRow> rows = new ArrayList<>();
        rows.add(ReportRow.of(title, view.getTotalCount() + " packages"));

        int unknownCounts = 0;
        for (ChildSummary child : view.getChildren()) {
            rows.add(ReportRow.of(child.getPackageName().getValue(), childSubtitle(child)));
            if (child.getCountStatus() == ChildSummary.CountStatus.UNKNOWN) {
                unknownCounts++;
            }
        }

        StringBuilder status = new StringBuilder()
                .append(root).append(": ").append(view.getTotalCount()).append(' ').append(noun);
        if (view.getFilteredOutCount() > 0) {
            status.append(" (").append(view.getFilteredOutCount()).append(" hidden by filters)");
        }
        if (unknownCounts > 0) {
            status.append(" (").append(unknownCounts).append(" lookups failed)");
        }

        Outcome outcome = view.getTotalCount() > 0 ? Outcome.RESULTS : Outcome.EMPTY;
        return new QueryReport(title, rows, status.toString(), outcome, view.getTotalCount(), view.getGraph());
    }

    public QueryReport render(CycleReport report) {
        String root = report.getRoot().getValue();
        String title = "Circular dependencies of " + root;

        if (report.isRootLookupFailed()) {
            return new QueryReport(title,
                    List.of(new ReportRow("Lookup failed", report.getFailedLookups().get(report.getRoot()), true)),
                    lookupFailedStatus(root), Outcome.ERROR, 0, report.getExploredGraph());
        }

        List<ReportRow> rows = new ArrayList<>();
        List<Cycle> cycles = report.getCycles();
        if (cycles.isEmpty()) {
            rows.add(ReportRow.of(NO_CYCLES, root));
        } else {
            cycles.stream()
                    .limit(maxDisplayedCycles)
                    .forEach(cycle -> rows.add(ReportRow.highlighted(cycle.toChainString())));
        }

        StringBuilder status = new StringBuilder()
                .append(cycles.size()).append(" circular dependencies found");
        if (cycles.size() > maxDisplayedCycles) {
            status.append(" (showing first ").append(maxDisplayedCycles).append(')');
        }
        if (!report.isComplete()) {
            status.append(" (").append(report.getFailedLookups().size()).append(" lookups failed)");
        }

        Outcome outcome = cycles.isEmpty() ? Outcome.EMPTY : Outcome.RESULTS;
        return new QueryReport(title, rows, status.toString(), outcome, cycles.size(), report.getExploredGraph());
    }

    private static String childSubtitle(ChildSummary child) {
        switch (child.getCountStatus()) {
            case KNOWN:
                return child.getDependencyCount() > 0
                        ? child.getDependencyCount() + " dependencies"
                        : null;
            case UNKNOWN:
                return "dependencies unknown";
            default:
                return null;
        }
    }

    private static String lookupFailedStatus(String root) {
        return root + ": lookup failed";
    }

    public int getMaxDisplayedCycles() {
        return maxDisplayedCycles;
    }
}
