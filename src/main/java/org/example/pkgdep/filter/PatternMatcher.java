package org.example.pkgdep.filter;

import org.example.pkgdep.model.PackageName;

import java.util.regex.Pattern;

/**
 * Matches package names against glob-style patterns.
 *
 * <p>Wildcards:</p>
 * <ul>
 *   <li>{@code *} - matches zero or more characters</li>
 *   <li>{@code ?} - matches exactly one character</li>
 * </ul>
 *
 * <p>Examples:</p>
 * <ul>
 *   <li>{@code lib*} - all library packages</li>
 *   <li>{@code *-dev} - development headers</li>
 *   <li>{@code python3.1?} - python3.10 to python3.19</li>
 * </ul>
 */
public class PatternMatcher {

    private final String originalPattern;
    private final Pattern pattern;

    /**
     * Creates a new PatternMatcher for the given pattern.
     *
     * @param pattern the glob pattern
     * @throws IllegalArgumentException if pattern is null or empty
     */
    public PatternMatcher(String pattern) {
        if (pattern == null || pattern.trim().isEmpty()) {
            throw new IllegalArgumentException("Pattern cannot be null or empty");
        }

        this.originalPattern = pattern.trim();
        this.pattern = globToRegex(originalPattern);
    }

    /**
     * Tests if the given package name matches this pattern.
     */
    public boolean matches(PackageName packageName) {
        if (packageName == null) {
            return false;
        }
        return pattern.matcher(packageName.getValue()).matches();
    }

    public String getPattern() {
        return originalPattern;
    }

    /**
     * Converts a glob pattern to a regex Pattern.
     * {@code *} becomes {@code .*}, {@code ?} becomes {@code .}, everything else is literal.
     */
    private Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        regex.append("^");

        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append(".");
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }

        regex.append("$");
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return "PatternMatcher{" + originalPattern + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PatternMatcher that = (PatternMatcher) o;
        return originalPattern.equals(that.originalPattern);
    }

    @Override
    public int hashCode() {
        return originalPattern.hashCode();
    }
}
