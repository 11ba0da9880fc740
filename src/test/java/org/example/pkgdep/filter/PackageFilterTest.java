package org.example.pkgdep.filter;

import org.example.pkgdep.model.PackageName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PackageFilter.
 */
class PackageFilterTest {

    @Test
    @DisplayName("should accept everything without patterns")
    void shouldAcceptEverythingWithoutPatterns() {
        PackageFilter filter = new PackageFilter(null, List.of());

        assertThat(filter.isActive()).isFalse();
        assertThat(filter.accepts(PackageName.of("libc6"))).isTrue();
        assertThat(PackageFilter.acceptAll().accepts(PackageName.of("anything"))).isTrue();
    }

    @Test
    @DisplayName("should reject excluded packages")
    void shouldRejectExcluded() {
        PackageFilter filter = new PackageFilter(List.of(), List.of("lib*"));

        assertThat(filter.accepts(PackageName.of("libc6"))).isFalse();
        assertThat(filter.accepts(PackageName.of("dpkg"))).isTrue();
    }

    @Test
    @DisplayName("should require a match when include patterns exist")
    void shouldRequireIncludeMatch() {
        PackageFilter filter = new PackageFilter(List.of("*-dev", "python3*"), List.of());

        assertThat(filter.accepts(PackageName.of("libc6-dev"))).isTrue();
        assertThat(filter.accepts(PackageName.of("python3-yaml"))).isTrue();
        assertThat(filter.accepts(PackageName.of("bash"))).isFalse();
    }

    @Test
    @DisplayName("should apply exclude before include")
    void shouldApplyExcludeBeforeInclude() {
        PackageFilter filter = new PackageFilter(List.of("lib*"), List.of("libc6*"));

        assertThat(filter.accepts(PackageName.of("libssl3"))).isTrue();
        assertThat(filter.accepts(PackageName.of("libc6-dev"))).isFalse();
    }

    @Test
    @DisplayName("should ignore blank patterns")
    void shouldIgnoreBlankPatterns() {
        PackageFilter filter = new PackageFilter(Arrays.asList("", null, " "), List.of());

        assertThat(filter.isActive()).isFalse();
        assertThat(filter.getIncludePatterns()).isEmpty();
    }
}
