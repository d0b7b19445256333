package com.keypointcensus.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CensusConfigLoader}.
 */
class CensusConfigLoaderTest {

    @Test
    @DisplayName("Should load every setting from classpath")
    void shouldLoadFromClasspath() {
        CensusConfig config = CensusConfigLoader.fromClasspath("test-census.yml");

        assertThat(config.getDetectors()).isEqualTo("all");
        assertThat(config.isRecurse()).isTrue();
        assertThat(config.isAnnotate()).isFalse();
        assertThat(config.getExtensions()).containsExactly("jpg", "png");
        assertThat(config.getPathStyle()).isEqualTo("name");
        assertThat(config.isFullPaths()).isFalse();
        assertThat(config.getStatsFileName()).isEqualTo("summary.csv");
        assertThat(config.hasOutputRoot()).isTrue();
        assertThat(config.getOutputRoot()).isEqualTo("build/census");
        assertThat(config.getThreads()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile() {
        CensusConfig config = CensusConfigLoader.fromClasspath("empty-census.yml");

        assertThat(config.getDetectors()).isEqualTo("desc");
        assertThat(config.isRecurse()).isFalse();
        assertThat(config.getExtensions()).containsExactly("jpg");
        assertThat(config.isFullPaths()).isTrue();
        assertThat(config.getStatsFileName()).isEqualTo("stats.csv");
        assertThat(config.hasOutputRoot()).isFalse();
        assertThat(config.getThreads()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should collect every validation error")
    void shouldRejectInvalidConfig() {
        assertThatThrownBy(() -> CensusConfigLoader.fromClasspath("invalid-census.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unknown detector selection")
                .hasMessageContaining("extensions")
                .hasMessageContaining("pathStyle")
                .hasMessageContaining("threads");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> CensusConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file and reject unknown keys")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path good = dir.resolve("census.yml");
        Files.writeString(good, "detectors: ORB\nrecurse: true\n");
        CensusConfig config = CensusConfigLoader.fromFile(good.toString());
        assertThat(config.getDetectors()).isEqualTo("ORB");
        assertThat(config.isRecurse()).isTrue();

        Path bad = dir.resolve("bad.yml");
        Files.writeString(bad, "detector: ORB\n");
        assertThatThrownBy(() -> CensusConfigLoader.fromFile(bad.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");

        assertThatThrownBy(() -> CensusConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
