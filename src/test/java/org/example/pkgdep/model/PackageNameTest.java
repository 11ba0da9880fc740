package org.example.pkgdep.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PackageName.
 */
class PackageNameTest {

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        @DisplayName("should trim surrounding whitespace")
        void shouldTrimWhitespace() {
            assertThat(PackageName.of("  libc6 \t").getValue()).isEqualTo("libc6");
        }

        @Test
        @DisplayName("should keep angle brackets when not normalizing")
        void shouldKeepBracketsWithOf() {
            assertThat(PackageName.of("<debconf-2.0>").getValue()).isEqualTo("<debconf-2.0>");
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t"})
        @DisplayName("should reject blank names")
        void shouldRejectBlankNames(String raw) {
            assertThatThrownBy(() -> PackageName.of(raw))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cannot be null or blank");
            assertThat(PackageName.isBlank(raw)).isTrue();
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("should strip virtual package markers")
        void shouldStripVirtualMarkers() {
            assertThat(PackageName.normalize("<virtual-pkg>").getValue()).isEqualTo("virtual-pkg");
        }

        @Test
        @DisplayName("should strip markers and whitespace together")
        void shouldStripMarkersAndWhitespace() {
            assertThat(PackageName.normalize("  <awk> ").getValue()).isEqualTo("awk");
        }

        @Test
        @DisplayName("should leave plain names unchanged")
        void shouldLeavePlainNamesUnchanged() {
            assertThat(PackageName.normalize("libstdc++6").getValue()).isEqualTo("libstdc++6");
        }

        @Test
        @DisplayName("should reject a name that is only markers")
        void shouldRejectOnlyMarkers() {
            assertThatThrownBy(() -> PackageName.normalize("<>"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should be case-sensitive")
    void shouldBeCaseSensitive() {
        assertThat(PackageName.of("Foo")).isNotEqualTo(PackageName.of("foo"));
        assertThat(PackageName.of("foo")).isEqualTo(PackageName.of(" foo "));
    }
}
