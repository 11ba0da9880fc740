package org.example.pkgdep.filter;

import org.example.pkgdep.model.PackageName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides which packages appear as rows of a dependency view.
 *
 * <p>Filter Logic:</p>
 * <ol>
 *   <li>Check exclude patterns first - reject if matches any</li>
 *   <li>If include patterns exist - must match at least one</li>
 * </ol>
 *
 * <p>Only view rows are filtered. Header counts and cycle searches always see
 * everything the provider reports.</p>
 */
public class PackageFilter {

    private static final PackageFilter ACCEPT_ALL = new PackageFilter(List.of(), List.of());

    private final List<PatternMatcher> includeMatchers;
    private final List<PatternMatcher> excludeMatchers;

    /**
     * Creates a new PackageFilter.
     *
     * @param includeFilters patterns for packages to show (null or empty = show all)
     * @param excludeFilters patterns for packages to hide (null or empty = hide none)
     */
    public PackageFilter(List<String> includeFilters, List<String> excludeFilters) {
        this.includeMatchers = parsePatterns(includeFilters);
        this.excludeMatchers = parsePatterns(excludeFilters);
    }

    public static PackageFilter acceptAll() {
        return ACCEPT_ALL;
    }

    public boolean accepts(PackageName packageName) {
        if (excludeMatchers.stream().anyMatch(m -> m.matches(packageName))) {
            return false;
        }
        return includeMatchers.isEmpty() || includeMatchers.stream().anyMatch(m -> m.matches(packageName));
    }

    public boolean isActive() {
        return !includeMatchers.isEmpty() || !excludeMatchers.isEmpty();
    }

    public List<String> getIncludePatterns() {
        return includeMatchers.stream().map(PatternMatcher::getPattern).collect(Collectors.toList());
    }

    public List<String> getExcludePatterns() {
        return excludeMatchers.stream().map(PatternMatcher::getPattern).collect(Collectors.toList());
    }

    private static List<PatternMatcher> parsePatterns(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return Collections.emptyList();
        }
        List<PatternMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern != null && !pattern.trim().isEmpty()) {
                matchers.add(new PatternMatcher(pattern));
            }
        }
        return Collections.unmodifiableList(matchers);
    }

    @Override
    public String toString() {
        return "PackageFilter{include=" + getIncludePatterns() + ", exclude=" + getExcludePatterns() + "}";
    }
}
