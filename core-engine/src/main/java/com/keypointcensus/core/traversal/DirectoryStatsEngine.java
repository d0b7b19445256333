package com.keypointcensus.core.traversal;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.detection.FeatureDetector;
import com.keypointcensus.core.model.AggregateNode;
import com.keypointcensus.core.model.Detection;
import com.keypointcensus.core.model.Keypoint;
import com.keypointcensus.core.model.SummaryRecord;
import com.keypointcensus.core.report.StatsWriter;
import com.keypointcensus.core.report.StatsWriterFactory;
import com.keypointcensus.core.stats.StatisticsFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Depth-first traversal that turns a directory tree of images into
 * per-directory statistics files.
 *
 * <h3>Per directory</h3>
 * <ol>
 * <li>Open the directory's {@link StatsWriter}.</li>
 * <li>Walk the entries in listing order. Every accepted image is decoded and
 * run through every detector; its rows are written at once and its
 * detections merged into this directory's aggregates. Every subdirectory (when
 * recursion is on) is processed recursively and its returned aggregates are
 * merged in; its rows are not repeated here.</li>
 * <li>Write one {@code **} row per detector and return the aggregates.</li>
 * </ol>
 *
 * <h3>Failures</h3>
 * <p>
 * An image that cannot be decoded is logged and skipped. Any failure to write
 * output aborts the current subtree with an {@link OutputWriteException}.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * With one thread everything runs on the caller's thread. With more, decoding
 * and detection of a directory's images run on a worker pool while rows,
 * merges and listener callbacks stay on the caller's thread in listing order,
 * so the output is identical to a single-threaded run. A single engine must
 * not run two traversals at the same time.
 * </p>
 *
 * @since 1.0.0
 */
public class DirectoryStatsEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryStatsEngine.class);

    private final List<FeatureDetector> detectors;
    private final List<DetectorType> detectorTypes;
    private final ImageSource imageSource;
    private final DirectoryLister lister;
    private final StatsWriterFactory writerFactory;
    private final Set<String> extensions;
    private final boolean recurse;
    private final boolean fullPaths;
    private final Annotator annotator;
    private final List<ImageListener> listeners;
    private final ExecutorService workers;

    private RunCounters counters;

    private DirectoryStatsEngine(Builder b) {
        this.detectors = List.copyOf(b.detectors);
        this.detectorTypes = detectors.stream().map(FeatureDetector::getType).toList();
        this.imageSource = b.imageSource;
        this.lister = b.lister;
        this.writerFactory = b.writerFactory;
        this.extensions = Set.copyOf(b.extensions);
        this.recurse = b.recurse;
        this.fullPaths = b.fullPaths;
        this.annotator = b.annotator;
        this.listeners = List.copyOf(b.listeners);
        this.workers = b.threads > 1 ? Executors.newFixedThreadPool(b.threads, new WorkerThreadFactory()) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Traverse the tree below {@code root} and return its grand totals.
     *
     * @param root directory to start from; must exist
     * @return totals and counters for the whole run
     * @throws IOException if output cannot be written or a directory cannot be
     *                     listed
     */
    public CensusResult run(Path root) throws IOException {
        Objects.requireNonNull(root, "Root directory must not be null");
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("path must be a directory: " + root);
        }

        Instant started = Instant.now();
        counters = new RunCounters();
        LOG.info("Starting census of {} with detectors {}", root, detectorTypes);

        Map<DetectorType, AggregateNode> totals = processDirectory(root);

        CensusResult result = new CensusResult(root, totals,
                counters.directories, counters.images, counters.failures,
                started, Instant.now());
        LOG.info("Census finished: {}", result);
        return result;
    }

    /**
     * Process one directory and everything below it.
     *
     * @param directory the directory
     * @return one aggregate per configured detector, in configured order
     * @throws IOException if output cannot be written or the directory cannot be
     *                     listed
     */
    Map<DetectorType, AggregateNode> processDirectory(Path directory) throws IOException {
        if (counters == null) {
            counters = new RunCounters();
        }
        counters.directories++;

        Map<DetectorType, AggregateNode> aggregates = new LinkedHashMap<>();
        for (DetectorType type : detectorTypes) {
            aggregates.put(type, new AggregateNode(directory, type));
        }

        List<Path> entries = lister.list(directory);
        Map<Path, Future<ImageOutcome>> pending = submitImages(entries);

        try (StatsWriter writer = openWriter(directory)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    if (!isAcceptedImage(entry)) {
                        LOG.trace("Skipping {}", entry);
                        continue;
                    }
                    ImageOutcome outcome = workers == null ? analyse(entry) : await(pending.get(entry));
                    record(outcome, writer, aggregates, directory);
                } else if (Files.isDirectory(entry)) {
                    if (!recurse) {
                        continue;
                    }
                    Map<DetectorType, AggregateNode> child = processDirectory(entry);
                    for (AggregateNode node : child.values()) {
                        aggregates.get(node.getDetector()).merge(node);
                    }
                } else {
                    LOG.trace("Skipping {}", entry);
                }
            }

            for (AggregateNode node : aggregates.values()) {
                writeRow(writer, directory, node.toSummary());
            }
        } finally {
            for (Future<ImageOutcome> f : pending.values()) {
                f.cancel(true);
            }
        }

        LOG.info("Finished {}: {} image(s) in scope", directory,
                aggregates.values().iterator().next().getCount());
        return aggregates;
    }

    @Override
    public void close() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Image handling
    // ---------------------------------------------------------------

    /**
     * Accepted extension, and not the annotation output of an earlier run.
     */
    private boolean isAcceptedImage(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && dot < name.length() - 1 && extensions.contains(name.substring(dot + 1))
                && !Java2dAnnotator.isAnnotationFile(file);
    }

    private Map<Path, Future<ImageOutcome>> submitImages(List<Path> entries) {
        if (workers == null) {
            return Collections.emptyMap();
        }
        Map<Path, Future<ImageOutcome>> pending = new LinkedHashMap<>();
        for (Path entry : entries) {
            if (Files.isRegularFile(entry) && isAcceptedImage(entry)) {
                pending.put(entry, workers.submit(() -> analyse(entry)));
            }
        }
        return pending;
    }

    /**
     * Decode one image and run every detector on it. Safe to call from worker
     * threads: touches no engine state besides the immutable configuration.
     */
    private ImageOutcome analyse(Path image) throws IOException {
        LOG.info("Open {}", image);
        BufferedImage gray;
        try {
            gray = imageSource.load(image);
        } catch (ImageDecodeException e) {
            return ImageOutcome.failed(image, e);
        }

        List<Detection> detections = new ArrayList<>(detectors.size());
        for (FeatureDetector detector : detectors) {
            long startNanos = System.nanoTime();
            List<Keypoint> keypoints = detector.detect(gray);
            LOG.debug("{} found {} keypoint(s) in {} ({} ms)", detector.getType(), keypoints.size(), image,
                    (System.nanoTime() - startNanos) / 1_000_000);
            detections.add(Detection.fromKeypoints(image, detector.getType(), keypoints));

            if (annotator != null) {
                try {
                    annotator.annotate(image, gray, detector.getType(), keypoints);
                } catch (IOException e) {
                    throw new OutputWriteException(image.getParent(),
                            "Failed to write annotation for " + image.getFileName(), e);
                }
            }
        }
        return ImageOutcome.succeeded(image, detections);
    }

    private ImageOutcome await(Future<ImageOutcome> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for image analysis");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Image analysis failed", cause);
        }
    }

    private void record(ImageOutcome outcome,
            StatsWriter writer,
            Map<DetectorType, AggregateNode> aggregates,
            Path directory) throws IOException {
        Path image = outcome.image;
        if (outcome.failure != null) {
            counters.failures++;
            LOG.warn("Failed to load image: {}", image);
            LOG.debug("Decode failure detail", outcome.failure);
            for (ImageListener listener : listeners) {
                listener.onDecodeFailure(image, outcome.failure);
            }
            return;
        }

        counters.images++;
        String label = fullPaths ? image.toString() : image.getFileName().toString();
        for (Detection detection : outcome.detections) {
            writeRow(writer, directory, StatisticsFormatter.format(detection, label));
            aggregates.get(detection.getDetector()).merge(detection);
        }
        for (ImageListener listener : listeners) {
            listener.onImage(image, outcome.detections);
        }
    }

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------

    private StatsWriter openWriter(Path directory) throws OutputWriteException {
        try {
            return writerFactory.open(directory);
        } catch (IOException e) {
            throw new OutputWriteException(directory, "Cannot create statistics output", e);
        }
    }

    private static void writeRow(StatsWriter writer, Path directory, SummaryRecord row)
            throws OutputWriteException {
        try {
            writer.write(row);
        } catch (IOException e) {
            throw new OutputWriteException(directory, "Cannot write statistics row", e);
        }
    }

    // ---------------------------------------------------------------
    // Internal types
    // ---------------------------------------------------------------

    /** Result of analysing one image: either detections or a decode failure. */
    private static final class ImageOutcome {
        private final Path image;
        private final List<Detection> detections;
        private final ImageDecodeException failure;

        private ImageOutcome(Path image, List<Detection> detections, ImageDecodeException failure) {
            this.image = image;
            this.detections = detections;
            this.failure = failure;
        }

        static ImageOutcome succeeded(Path image, List<Detection> detections) {
            return new ImageOutcome(image, List.copyOf(detections), null);
        }

        static ImageOutcome failed(Path image, ImageDecodeException failure) {
            return new ImageOutcome(image, List.of(), failure);
        }
    }

    /** Counters of the traversal in progress; only touched on the traversal thread. */
    private static final class RunCounters {
        private int directories;
        private int images;
        private int failures;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "census-worker-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DirectoryStatsEngine}.
     *
     * <p>
     * Detectors and a writer factory are required. The image source defaults to
     * {@link ImageIoImageSource}, the lister to
     * {@link FileSystemDirectoryLister}, the extensions to {@code jpg}.
     * </p>
     */
    public static class Builder {
        private final List<FeatureDetector> detectors = new ArrayList<>();
        private ImageSource imageSource = new ImageIoImageSource();
        private DirectoryLister lister = new FileSystemDirectoryLister();
        private StatsWriterFactory writerFactory;
        private final Set<String> extensions = new HashSet<>(Set.of("jpg"));
        private boolean recurse;
        private boolean fullPaths = true;
        private Annotator annotator;
        private final List<ImageListener> listeners = new ArrayList<>();
        private int threads = 1;

        public Builder detectors(List<? extends FeatureDetector> v) {
            this.detectors.clear();
            this.detectors.addAll(v);
            return this;
        }

        public Builder imageSource(ImageSource v) {
            this.imageSource = v;
            return this;
        }

        public Builder directoryLister(DirectoryLister v) {
            this.lister = v;
            return this;
        }

        public Builder writerFactory(StatsWriterFactory v) {
            this.writerFactory = v;
            return this;
        }

        /**
         * @param v accepted extensions without the dot; matched
         *          case-insensitively
         * @return this builder
         */
        public Builder extensions(Iterable<String> v) {
            this.extensions.clear();
            for (String ext : v) {
                this.extensions.add(ext.toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public Builder recurse(boolean v) {
            this.recurse = v;
            return this;
        }

        public Builder fullPaths(boolean v) {
            this.fullPaths = v;
            return this;
        }

        /**
         * @param v annotator to run for every detection, or {@code null} to
         *          disable annotation
         * @return this builder
         */
        public Builder annotator(Annotator v) {
            this.annotator = v;
            return this;
        }

        public Builder listener(ImageListener v) {
            this.listeners.add(Objects.requireNonNull(v, "listener must not be null"));
            return this;
        }

        public Builder threads(int v) {
            this.threads = v;
            return this;
        }

        /**
         * Build and validate the engine.
         *
         * @return a new engine; close it to release its worker threads
         * @throws IllegalArgumentException if the configuration is invalid
         */
        public DirectoryStatsEngine build() {
            Objects.requireNonNull(imageSource, "imageSource required");
            Objects.requireNonNull(lister, "directoryLister required");
            Objects.requireNonNull(writerFactory, "writerFactory required");

            if (detectors.isEmpty()) {
                throw new IllegalArgumentException("At least one detector is required");
            }
            Set<DetectorType> seen = new HashSet<>();
            for (FeatureDetector detector : detectors) {
                Objects.requireNonNull(detector, "detector must not be null");
                if (!seen.add(detector.getType())) {
                    throw new IllegalArgumentException("Duplicate detector: " + detector.getType());
                }
            }
            if (extensions.isEmpty()) {
                throw new IllegalArgumentException("At least one image extension is required");
            }
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
            }
            return new DirectoryStatsEngine(this);
        }
    }
}
