package org.example.pkgdep.model;

import java.util.Objects;

/**
 * Identifies a package. Case-sensitive; the uniqueness key for all graph operations.
 */
public final class PackageName {

    private final String value;

    private PackageName(String value) {
        this.value = value;
    }

    /**
     * Creates a package name from raw text, trimming surrounding whitespace only.
     *
     * @param raw the raw name
     * @return the package name
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static PackageName of(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("Package name cannot be null or blank");
        }
        return new PackageName(raw.trim());
    }

    /**
     * Creates a package name from provider output, stripping whitespace and the
     * angle-bracket markers of virtual packages ({@code <pkg>} becomes {@code pkg}).
     *
     * @param raw the raw token
     * @return the normalized package name
     * @throws IllegalArgumentException if nothing is left after normalization
     */
    public static PackageName normalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Package name cannot be null or blank");
        }
        String trimmed = raw.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && isMarker(trimmed.charAt(start))) {
            start++;
        }
        while (end > start && isMarker(trimmed.charAt(end - 1))) {
            end--;
        }
        return of(trimmed.substring(start, end));
    }

    /**
     * Returns true if the text is null or blank, i.e. would be rejected by {@link #of(String)}.
     */
    public static boolean isBlank(String raw) {
        return raw == null || raw.trim().isEmpty();
    }

    private static boolean isMarker(char c) {
        return c == '<' || c == '>';
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageName that = (PackageName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
