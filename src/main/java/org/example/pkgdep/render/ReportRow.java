package org.example.pkgdep.render;

import java.util.Objects;
import java.util.Optional;

/**
 * One displayed row: a title, an optional subtitle and a highlight flag for error rows.
 */
public class ReportRow {

    private final String title;
    private final String subtitle;
    private final boolean highlighted;

    public ReportRow(String title, String subtitle, boolean highlighted) {
        this.title = Objects.requireNonNull(title, "title cannot be null");
        this.subtitle = subtitle;
        this.highlighted = highlighted;
    }

    public static ReportRow of(String title) {
        return new ReportRow(title, null, false);
    }

    public static ReportRow of(String title, String subtitle) {
        return new ReportRow(title, subtitle, false);
    }

    public static ReportRow highlighted(String title) {
        return new ReportRow(title, null, true);
    }

    public String getTitle() {
        return title;
    }

    public Optional<String> getSubtitle() {
        return Optional.ofNullable(subtitle);
    }

    public boolean isHighlighted() {
        return highlighted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReportRow that = (ReportRow) o;
        return highlighted == that.highlighted &&
               title.equals(that.title) &&
               Objects.equals(subtitle, that.subtitle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, subtitle, highlighted);
    }

    @Override
    public String toString() {
        return subtitle == null ? title : title + " - " + subtitle;
    }
}
