package com.keypointcensus.core.traversal;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Maps input directories to the directories their outputs are written to.
 *
 * <p>
 * In place, outputs land next to the images. Mirrored, the input tree below
 * {@code inputRoot} is reproduced below {@code outputRoot}.
 * </p>
 *
 * @since 1.0.0
 */
public final class OutputLayout {

    private final Path inputRoot;
    private final Path outputRoot;

    private OutputLayout(Path inputRoot, Path outputRoot) {
        this.inputRoot = Objects.requireNonNull(inputRoot, "Input root must not be null");
        this.outputRoot = outputRoot;
    }

    /**
     * @param inputRoot root of the traversal
     * @return layout writing every output into the directory it describes
     */
    public static OutputLayout inPlace(Path inputRoot) {
        return new OutputLayout(inputRoot, null);
    }

    /**
     * @param inputRoot  root of the traversal
     * @param outputRoot root of the mirrored tree; must not be {@code null}
     * @return layout mirroring the input tree below {@code outputRoot}
     */
    public static OutputLayout mirrored(Path inputRoot, Path outputRoot) {
        return new OutputLayout(inputRoot,
                Objects.requireNonNull(outputRoot, "Output root must not be null"));
    }

    /**
     * Resolve the output directory of an input directory.
     *
     * @param inputDirectory a directory at or below the input root
     * @return where outputs for {@code inputDirectory} belong
     * @throws IllegalArgumentException if the directory is outside the input
     *                                  root in mirrored mode
     */
    public Path outputDirectoryFor(Path inputDirectory) {
        Objects.requireNonNull(inputDirectory, "Input directory must not be null");
        if (outputRoot == null) {
            return inputDirectory;
        }
        if (!inputDirectory.startsWith(inputRoot)) {
            throw new IllegalArgumentException(
                    inputDirectory + " is not below the input root " + inputRoot);
        }
        return outputRoot.resolve(inputRoot.relativize(inputDirectory));
    }

    /**
     * @return {@code true} if outputs are written to a separate tree
     */
    public boolean isMirrored() {
        return outputRoot != null;
    }

    @Override
    public String toString() {
        return outputRoot == null
                ? "OutputLayout{in place, root=" + inputRoot + '}'
                : "OutputLayout{" + inputRoot + " -> " + outputRoot + '}';
    }
}
