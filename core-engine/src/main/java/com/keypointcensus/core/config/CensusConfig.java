package com.keypointcensus.core.config;

import com.keypointcensus.core.detection.DetectorSelector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Top-level POJO for the census YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * detectors: desc
 * recurse: true
 * annotate: false
 * extensions: [jpg]
 * pathStyle: full
 * statsFileName: stats.csv
 * outputRoot: ""
 * threads: 1
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading or after applying overrides.
 * </p>
 *
 * @since 1.0.0
 */
public class CensusConfig {

    /** Per-image rows carry the full image path. */
    public static final String PATH_STYLE_FULL = "full";

    /** Per-image rows carry only the image file name. */
    public static final String PATH_STYLE_NAME = "name";

    /** Detector selection, see {@link DetectorSelector}. */
    private String detectors = DetectorSelector.DEFAULT_SELECTION;

    /** Descend into subdirectories. */
    private boolean recurse;

    /** Render detected keypoints onto a copy of every image. */
    private boolean annotate;

    /** Accepted image extensions, without the dot, matched case-insensitively. */
    private List<String> extensions = new ArrayList<>(List.of("jpg"));

    /** {@value #PATH_STYLE_FULL} or {@value #PATH_STYLE_NAME}. */
    private String pathStyle = PATH_STYLE_FULL;

    /** Name of the statistics file written for every visited directory. */
    private String statsFileName = "stats.csv";

    /** Root of a mirrored output tree; blank writes next to the images. */
    private String outputRoot = "";

    /** Worker threads for decoding and detection. */
    private int threads = 1;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting, collecting all problems into one exception.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!DetectorSelector.isValid(detectors)) {
            errors.add("Unknown detector selection: '" + detectors
                    + "'. Supported: " + DetectorSelector.SUPPORTED);
        }
        if (extensions == null || extensions.isEmpty()) {
            errors.add("'extensions' must list at least one image extension");
        } else {
            for (String ext : extensions) {
                if (ext == null || ext.isBlank() || ext.contains(".")) {
                    errors.add("Invalid extension '" + ext + "' (give it without the dot)");
                }
            }
        }
        if (!PATH_STYLE_FULL.equals(pathStyle) && !PATH_STYLE_NAME.equals(pathStyle)) {
            errors.add("'pathStyle' must be '" + PATH_STYLE_FULL + "' or '" + PATH_STYLE_NAME
                    + "', got: '" + pathStyle + "'");
        }
        if (statsFileName == null || statsFileName.isBlank()) {
            errors.add("'statsFileName' is required");
        } else if (statsFileName.contains("/") || statsFileName.contains("\\")) {
            errors.add("'statsFileName' must be a plain file name, got: '" + statsFileName + "'");
        }
        if (threads < 1) {
            errors.add("'threads' must be >= 1, got: " + threads);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Census configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getDetectors() {
        return detectors;
    }

    public void setDetectors(String detectors) {
        this.detectors = detectors;
    }

    public boolean isRecurse() {
        return recurse;
    }

    public void setRecurse(boolean recurse) {
        this.recurse = recurse;
    }

    public boolean isAnnotate() {
        return annotate;
    }

    public void setAnnotate(boolean annotate) {
        this.annotate = annotate;
    }

    /**
     * Return the accepted extensions. The returned list is
     * <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of extensions
     */
    public List<String> getExtensions() {
        return Collections.unmodifiableList(extensions);
    }

    /**
     * Set the accepted extensions, normalised to lowercase.
     *
     * @param extensions image extensions without the dot
     */
    public void setExtensions(List<String> extensions) {
        this.extensions = new ArrayList<>();
        if (extensions != null) {
            for (String ext : extensions) {
                this.extensions.add(ext != null ? ext.toLowerCase(Locale.ROOT) : null);
            }
        }
    }

    public String getPathStyle() {
        return pathStyle;
    }

    /**
     * Set the path style, normalised to lowercase.
     *
     * @param pathStyle {@code full} or {@code name}
     */
    public void setPathStyle(String pathStyle) {
        this.pathStyle = pathStyle != null ? pathStyle.toLowerCase(Locale.ROOT) : null;
    }

    /**
     * @return {@code true} if per-image rows carry the full image path
     */
    public boolean isFullPaths() {
        return PATH_STYLE_FULL.equals(pathStyle);
    }

    public String getStatsFileName() {
        return statsFileName;
    }

    public void setStatsFileName(String statsFileName) {
        this.statsFileName = statsFileName;
    }

    public String getOutputRoot() {
        return outputRoot;
    }

    public void setOutputRoot(String outputRoot) {
        this.outputRoot = outputRoot != null ? outputRoot : "";
    }

    /**
     * @return {@code true} if statistics go to a mirrored output tree
     */
    public boolean hasOutputRoot() {
        return !outputRoot.isBlank();
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    @Override
    public String toString() {
        return "CensusConfig{" +
                "detectors='" + detectors + '\'' +
                ", recurse=" + recurse +
                ", annotate=" + annotate +
                ", extensions=" + extensions +
                ", pathStyle='" + pathStyle + '\'' +
                ", statsFileName='" + statsFileName + '\'' +
                ", outputRoot='" + outputRoot + '\'' +
                ", threads=" + threads +
                '}';
    }
}
