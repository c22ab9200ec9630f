package batteryhealth;

import batteryhealth.config.PipelineConfig;
import batteryhealth.config.PipelineConfigLoader;
import batteryhealth.core.BatteryHealthProcessor;
import batteryhealth.domain.PipelineReport;
import batteryhealth.input.JsonFileTelemetryInput;
import batteryhealth.output.ConsoleHealthOutput;
import batteryhealth.output.HealthOutput;
import batteryhealth.processor.FeaturePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main application class for the battery health pipeline.
 * Reads one telemetry file, runs it through the feature pipeline and prints the report.
 */
public class BatteryHealthApplication {
    private static final Logger logger = LoggerFactory.getLogger(BatteryHealthApplication.class);

    private final BatteryHealthProcessor processor;
    private final ExecutorService executor;
    private final Path telemetryFile;
    private Runnable exitHook = () -> System.exit(1);

    /**
     * Create the application.
     *
     * @param telemetryFile JSON file of raw telemetry samples
     * @param config pipeline configuration
     * @param verbose verbose console output
     * @param colorized colorized console output
     */
    public BatteryHealthApplication(Path telemetryFile, PipelineConfig config, boolean verbose, boolean colorized) {
        this(telemetryFile, config, new ConsoleHealthOutput(verbose, colorized));
    }

    BatteryHealthApplication(Path telemetryFile, PipelineConfig config, HealthOutput output) {
        this.telemetryFile = telemetryFile;
        this.executor = Executors.newFixedThreadPool(Math.max(1, Runtime.getRuntime().availableProcessors()));
        this.processor = new BatteryHealthProcessor(new JsonFileTelemetryInput(telemetryFile),
                new FeaturePipeline(config), List.of(output), executor);
    }

    protected void setExitHook(Runnable exitHook) {
        this.exitHook = exitHook;
    }

    protected void exitApplication() {
        exitHook.run();
    }

    /**
     * Process the telemetry file once, then shut down.
     *
     * @return the report, or null if processing failed
     */
    public PipelineReport run() {
        logger.info("Starting battery health pipeline on {}", telemetryFile);
        PipelineReport report = null;
        try {
            processor.start();
            report = processor.getLastReport();
            if (report == null) {
                logger.error("No report produced for {}", telemetryFile);
            }
        } catch (Exception e) {
            logger.error("Failed to process {}", telemetryFile, e);
        } finally {
            shutdown();
        }

        // exit only once the executor is released and the statistics are logged
        if (report == null) {
            exitApplication();
        }
        return report;
    }

    /**
     * Stop the processor and release the worker threads.
     */
    public void shutdown() {
        processor.stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        BatteryHealthProcessor.ProcessorStatistics stats = processor.getStatistics();
        logger.info("Final statistics:");
        logger.info("   • Devices processed: {}", stats.getDevicesProcessed());
        logger.info("   • Devices with insufficient data: {}", stats.getDevicesInsufficient());
        logger.info("   • Windows built: {}", stats.getWindowsBuilt());
        logger.info("   • Samples dropped: {}", stats.getSamplesDropped());
    }

    BatteryHealthProcessor getProcessor() {
        return processor;
    }

    /**
     * Main entry point.
     *
     * @param args command line arguments:
     *             [0] - telemetry JSON file (required)
     *             [1] - pipeline configuration JSON file (default: bundled pipeline-config.json)
     *             [2] - verbose (default: false)
     *             [3] - colorized (default: true)
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: BatteryHealthApplication <telemetry.json> [config.json] [verbose] [colorized]");
            System.exit(2);
        }

        Path telemetryFile = Path.of(args[0]);
        String configArg = args.length > 1 ? args[1] : "";
        boolean verbose = args.length > 2 && Boolean.parseBoolean(args[2]);
        boolean colorized = args.length <= 3 || Boolean.parseBoolean(args[3]);

        logger.info("Configuration:");
        logger.info("  • Telemetry: {}", telemetryFile);
        logger.info("  • Config: {}", configArg.isEmpty() ? PipelineConfigLoader.DEFAULT_RESOURCE : configArg);
        logger.info("  • Verbose: {}", verbose);
        logger.info("  • Colorized: {}", colorized);

        PipelineConfig config = configArg.isEmpty()
                ? PipelineConfigLoader.loadDefault()
                : PipelineConfigLoader.load(Path.of(configArg));

        BatteryHealthApplication app = new BatteryHealthApplication(telemetryFile, config, verbose, colorized);
        app.run();
    }
}
