package com.keypointcensus.core.traversal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link OutputLayout}.
 */
class OutputLayoutTest {

    private static final Path ROOT = Paths.get("data", "train");

    @Test
    @DisplayName("Should keep outputs next to the inputs in place")
    void shouldResolveInPlace() {
        OutputLayout layout = OutputLayout.inPlace(ROOT);
        Path dir = ROOT.resolve("A");

        assertThat(layout.outputDirectoryFor(dir)).isEqualTo(dir);
        assertThat(layout.isMirrored()).isFalse();
    }

    @Test
    @DisplayName("Should mirror the input tree below the output root")
    void shouldResolveMirrored() {
        OutputLayout layout = OutputLayout.mirrored(ROOT, Paths.get("out"));

        assertThat(layout.outputDirectoryFor(ROOT)).isEqualTo(Paths.get("out"));
        assertThat(layout.outputDirectoryFor(ROOT.resolve("A").resolve("B")))
                .isEqualTo(Paths.get("out", "A", "B"));
        assertThat(layout.isMirrored()).isTrue();
    }

    @Test
    @DisplayName("Should reject a directory outside the input root when mirrored")
    void shouldRejectForeignDirectory() {
        OutputLayout layout = OutputLayout.mirrored(ROOT, Paths.get("out"));

        assertThatThrownBy(() -> layout.outputDirectoryFor(Paths.get("elsewhere")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not below the input root");
    }
}
