package com.keypointcensus.cli;

import com.keypointcensus.core.config.CensusConfig;
import com.keypointcensus.core.config.CensusConfigLoader;
import com.keypointcensus.core.detection.DetectorSelector;
import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.detection.FeatureDetector;
import com.keypointcensus.core.model.SummaryRecord;
import com.keypointcensus.core.report.CsvStatsWriter;
import com.keypointcensus.core.report.FeatureCountReport;
import com.keypointcensus.core.traversal.CensusResult;
import com.keypointcensus.core.traversal.DirectoryStatsEngine;
import com.keypointcensus.core.traversal.Java2dAnnotator;
import com.keypointcensus.core.traversal.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Main entry point: walks an image tree and writes keypoint response
 * statistics for every directory.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Load {@link CensusConfig} (explicit {@code --config}, else the usual
 * lookup) and apply command-line overrides.</li>
 * <li>Resolve the detector selection and create the OpenCV adapters.</li>
 * <li>Run {@link DirectoryStatsEngine} over the input path.</li>
 * <li>Log the grand totals and optionally write the JSON run summary.</li>
 * </ol>
 *
 * @since 1.0.0
 */
@CommandLine.Command(name = "keypoint-census",
        mixinStandardHelpOptions = true,
        version = "keypoint-census 1.0.0",
        header = "Keypoint response statistics for a directory tree of images",
        description = "Runs the selected feature detectors on every image below <path> and writes "
                + "one statistics file per directory: a row per image and detector, then one "
                + "aggregate row per detector covering the whole subtree.",
        exitCodeListHeading = "Exit Codes:%n",
        exitCodeList = {
            "0: census completed",
            "1: invalid input, configuration or output failure"
        })
public class KeypointCensusCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(KeypointCensusCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    @CommandLine.Parameters(index = "0", paramLabel = "<path>", description = "Root directory of the images")
    private Path path;

    @CommandLine.Option(names = {"-r", "--recurse"}, description = "Descend into subdirectories")
    private Boolean recurse;

    @CommandLine.Option(names = {"-a", "--annotate"}, description = "Write <stem>__<DETECTOR>.jpg per image and detector; "
                    + "files with that name shape are never counted as images")
    private Boolean annotate;

    @CommandLine.Option(names = {"-d", "--detector"}, paramLabel = "<detector>",
            description = "Detector name, alias or group: " + DetectorSelector.SUPPORTED)
    private String detector;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "<outputRoot>",
            description = "Mirror outputs below this directory instead of writing them next to the images")
    private Path outputRoot;

    @CommandLine.Option(names = "--threads", paramLabel = "N", description = "Worker threads for decoding and detection")
    private Integer threads;

    @CommandLine.Option(names = "--names-only", description = "Label image rows with the file name only")
    private Boolean namesOnly;

    @CommandLine.Option(names = "--config", paramLabel = "<yml>",
            description = "YAML configuration file; takes precedence over "
                    + CensusConfigLoader.ENV_CONFIG_PATH + " and the bundled census.yml")
    private Path configFile;

    @CommandLine.Option(names = "--counts-file", paramLabel = "<csv>",
            description = "Also write one keypoint-count row per image to this file")
    private Path countsFile;

    @CommandLine.Option(names = "--summary-json", paramLabel = "<json>",
            description = "Also write a JSON summary of the run to this file")
    private Path summaryJson;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec commandSpec;

    private final Function<List<DetectorType>, List<FeatureDetector>> detectorFactory;

    public KeypointCensusCommand() {
        this(OpenCvDetectors::createAll);
    }

    KeypointCensusCommand(Function<List<DetectorType>, List<FeatureDetector>> detectorFactory) {
        this.detectorFactory = Objects.requireNonNull(detectorFactory, "Detector factory must not be null");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new KeypointCensusCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter err = commandSpec.commandLine().getErr();
        if (!Files.isDirectory(path)) {
            err.println("path must be a directory: " + path);
            return EXIT_ERROR;
        }

        CensusConfig config;
        List<DetectorType> types;
        try {
            config = resolveConfig();
            types = DetectorSelector.resolve(config.getDetectors());
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_ERROR;
        }
        LOG.info("Starting keypoint census with config: {}", config);

        try {
            CensusResult result = runCensus(config, types);
            logTotals(result);
            if (summaryJson != null) {
                new RunSummaryWriter().write(result, summaryJson);
            }
            return EXIT_OK;
        } catch (IOException e) {
            LOG.error("Census of {} failed: {}", path, e.getMessage(), e);
            err.println("Census failed: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    // ---------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------

    /**
     * Load the configuration and apply every option given on the command line.
     *
     * @return the validated configuration
     * @throws IllegalStateException    if the merged configuration is invalid
     * @throws IllegalArgumentException if the configuration file is missing
     */
    CensusConfig resolveConfig() {
        CensusConfig config = configFile != null
                ? CensusConfigLoader.fromFile(configFile.toString())
                : CensusConfigLoader.load();

        if (detector != null) {
            config.setDetectors(detector);
        }
        if (recurse != null) {
            config.setRecurse(recurse);
        }
        if (annotate != null) {
            config.setAnnotate(annotate);
        }
        if (outputRoot != null) {
            config.setOutputRoot(outputRoot.toString());
        }
        if (threads != null) {
            config.setThreads(threads);
        }
        if (Boolean.TRUE.equals(namesOnly)) {
            config.setPathStyle(CensusConfig.PATH_STYLE_NAME);
        }
        config.validate();
        return config;
    }

    // ---------------------------------------------------------------
    // Run
    // ---------------------------------------------------------------

    private CensusResult runCensus(CensusConfig config, List<DetectorType> types) throws IOException {
        OutputLayout layout = config.hasOutputRoot()
                ? OutputLayout.mirrored(path, Paths.get(config.getOutputRoot()))
                : OutputLayout.inPlace(path);

        DirectoryStatsEngine.Builder builder = DirectoryStatsEngine.builder()
                .detectors(detectorFactory.apply(types))
                .writerFactory(CsvStatsWriter.factory(layout, config.getStatsFileName()))
                .extensions(config.getExtensions())
                .recurse(config.isRecurse())
                .fullPaths(config.isFullPaths())
                .threads(config.getThreads());
        if (config.isAnnotate()) {
            builder.annotator(new Java2dAnnotator(layout));
        }

        FeatureCountReport counts = countsFile != null ? FeatureCountReport.open(countsFile, types) : null;
        try {
            if (counts != null) {
                builder.listener(counts);
            }
            try (DirectoryStatsEngine engine = builder.build()) {
                return engine.run(path);
            }
        } finally {
            if (counts != null) {
                counts.close();
            }
        }
    }

    private static void logTotals(CensusResult result) {
        LOG.info("Processed {} image(s) in {} director(ies), {} failed to load, in {} ms",
                result.getImagesProcessed(), result.getDirectoriesVisited(), result.getImagesFailed(),
                result.getElapsed().toMillis());
        for (SummaryRecord total : result.getTotalSummaries()) {
            LOG.info("Total {}", CsvStatsWriter.formatRow(total));
        }
    }
}
