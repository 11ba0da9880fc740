package org.example.pkgdep.render;

import org.example.pkgdep.model.DependencyGraph;

import java.util.List;
import java.util.Objects;

/**
 * Presentation-ready result of one query: a title, rows and a status line,
 * plus the dependency graph the query assembled.
 */
public class QueryReport {

    /**
     * What the status line reports.
     */
    public enum Outcome {
        /** The query produced at least one result row. */
        RESULTS,
        /** The query succeeded with nothing to show. */
        EMPTY,
        /** A lookup failed; the result is unknown rather than empty. */
        ERROR
    }

    private final String title;
    private final List<ReportRow> rows;
    private final String statusLine;
    private final Outcome outcome;
    private final int count;
    private final DependencyGraph graph;

    public QueryReport(String title, List<ReportRow> rows, String statusLine, Outcome outcome, int count,
                       DependencyGraph graph) {
        this.title = Objects.requireNonNull(title, "title cannot be null");
        this.rows = List.copyOf(rows);
        this.statusLine = Objects.requireNonNull(statusLine, "statusLine cannot be null");
        this.outcome = Objects.requireNonNull(outcome, "outcome cannot be null");
        this.count = count;
        this.graph = Objects.requireNonNull(graph, "graph cannot be null");
    }

    public String getTitle() {
        return title;
    }

    public List<ReportRow> getRows() {
        return rows;
    }

    public String getStatusLine() {
        return statusLine;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isError() {
        return outcome == Outcome.ERROR;
    }

    /**
     * The number the status line reports (dependencies, dependents or cycles).
     */
    public int getCount() {
        return count;
    }

    /**
     * Packages and edges seen while answering the query. For cycle searches this is the explored part only.
     */
    public DependencyGraph getGraph() {
        return graph;
    }

    @Override
    public String toString() {
        return "QueryReport{" + outcome + ", '" + statusLine + "'}";
    }
}
