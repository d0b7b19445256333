package com.keypointcensus.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Resolves a detector selection string to an ordered list of
 * {@link DetectorType}s.
 *
 * <p>
 * Accepted selections are any canonical detector name, the short aliases
 * {@code blob}, {@code Agast} and {@code GFTT}, and the groups {@code desc}
 * (descriptor-capable detectors) and {@code all}. Matching is
 * case-sensitive. Group members keep declaration order.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorSelector {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorSelector.class);

    /** Selection used when none is configured. */
    public static final String DEFAULT_SELECTION = "desc";

    /** Human-readable list of accepted selections, for usage messages. */
    public static final String SUPPORTED =
            "SIFT, BRISK, ORB, MSER, AKAZE, FAST, blob, Agast, GFTT, desc, all";

    private DetectorSelector() {
        // utility class, not instantiable
    }

    /**
     * Resolve a selection.
     *
     * @param selection selection string; must not be {@code null}
     * @return unmodifiable, non-empty list of detector types
     * @throws NullPointerException     if {@code selection} is {@code null}
     * @throws IllegalArgumentException if the selection is unknown
     */
    public static List<DetectorType> resolve(String selection) {
        Objects.requireNonNull(selection, "Detector selection must not be null");

        List<DetectorType> types = switch (selection) {
            case "desc" -> Arrays.stream(DetectorType.values())
                    .filter(DetectorType::isDescriptorCapable)
                    .toList();
            case "all" -> List.of(DetectorType.values());
            case "blob" -> List.of(DetectorType.SIMPLE_BLOB);
            case "Agast" -> List.of(DetectorType.AGAST);
            case "GFTT" -> List.of(DetectorType.GFTT);
            default -> DetectorType.fromCanonicalName(selection)
                    .map(List::of)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown detector: '" + selection + "'. Supported: " + SUPPORTED));
        };

        LOG.debug("Detector selection '{}' resolved to {}", selection, types);
        return types;
    }

    /**
     * @param selection selection string, may be {@code null}
     * @return {@code true} if {@link #resolve(String)} would accept it
     */
    public static boolean isValid(String selection) {
        if (selection == null) {
            return false;
        }
        try {
            resolve(selection);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
