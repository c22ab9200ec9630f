package batteryhealth.core;

import batteryhealth.domain.PipelineReport;
import batteryhealth.domain.TelemetrySample;
import batteryhealth.input.TelemetryInput;
import batteryhealth.output.HealthOutput;
import batteryhealth.processor.FeaturePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Core processor that orchestrates data flow from a telemetry input, through the feature
 * pipeline, to the report outputs.
 * A failing batch or a failing output is logged and counted; it never stops the processor.
 */
public class BatteryHealthProcessor {
    private static final Logger logger = LoggerFactory.getLogger(BatteryHealthProcessor.class);

    private final TelemetryInput input;
    private final List<HealthOutput> outputs;
    private final FeaturePipeline pipeline;
    private final ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<PipelineReport> lastReport = new AtomicReference<>();
    private final ProcessorStatistics statistics = new ProcessorStatistics();

    /**
     * Create a processor running the pipeline on the input thread with a single output.
     */
    public BatteryHealthProcessor(TelemetryInput input, FeaturePipeline pipeline, HealthOutput output) {
        this(input, pipeline, List.of(output), null);
    }

    /**
     * Create a processor with multiple outputs.
     *
     * @param input the telemetry source
     * @param pipeline the feature pipeline applied to every batch
     * @param outputs the report destinations
     * @param executor if non-null, devices of a batch are processed in parallel on it
     */
    public BatteryHealthProcessor(TelemetryInput input, FeaturePipeline pipeline, List<HealthOutput> outputs,
                                  ExecutorService executor) {
        this.input = Objects.requireNonNull(input, "input cannot be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline cannot be null");
        this.outputs = new CopyOnWriteArrayList<>(
                Objects.requireNonNull(outputs, "outputs cannot be null"));
        this.executor = executor;

        if (outputs.isEmpty()) {
            throw new IllegalArgumentException("At least one output is required");
        }

        this.input.setBatchListener(this::handleBatch);
    }

    /**
     * Start the processor.
     * Initializes outputs and starts the input source. Inputs may deliver batches
     * synchronously from {@link TelemetryInput#start()}.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            try {
                initializeOutputs();
                statistics.recordStart();
                input.start();
                logger.info("BatteryHealthProcessor started with {} output(s)", outputs.size());
            } catch (Exception e) {
                running.set(false);
                closeResources();
                throw new IllegalStateException("Failed to start BatteryHealthProcessor", e);
            }
        }
    }

    /**
     * Stop the processor.
     * Stops the input source and closes all outputs.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            try {
                input.stop();
                closeResources();
                statistics.recordStop();
                logger.info("BatteryHealthProcessor stopped. Statistics: {}", statistics);
            } catch (Exception e) {
                logger.error("Error during BatteryHealthProcessor shutdown", e);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the report of the last successfully processed batch, or null if none yet
     */
    public PipelineReport getLastReport() {
        return lastReport.get();
    }

    public ProcessorStatistics getStatistics() {
        return statistics;
    }

    /**
     * Add a new output dynamically.
     *
     * @param output the output to add
     */
    public void addOutput(HealthOutput output) {
        Objects.requireNonNull(output, "output cannot be null");
        if (running.get()) {
            output.initialize();
        }
        outputs.add(output);
        logger.info("Added new output: {}", output.getClass().getSimpleName());
    }

    /**
     * Remove an output dynamically.
     *
     * @param output the output to remove
     * @return true if removed, false if not found
     */
    public boolean removeOutput(HealthOutput output) {
        boolean removed = outputs.remove(output);
        if (removed) {
            try {
                output.close();
            } catch (Exception e) {
                logger.warn("Error closing removed output", e);
            }
            logger.info("Removed output: {}", output.getClass().getSimpleName());
        }
        return removed;
    }

    private void handleBatch(List<TelemetrySample> samples) {
        if (!running.get()) {
            return;
        }

        PipelineReport report;
        try {
            report = executor != null ? pipeline.runAll(samples, executor) : pipeline.run(samples);
        } catch (RuntimeException e) {
            statistics.recordBatchFailure();
            logger.error("Failed to process batch of {} sample(s)", samples.size(), e);
            return;
        }

        lastReport.set(report);
        statistics.recordReport(report);
        distributeToOutputs(report);
    }

    private void distributeToOutputs(PipelineReport report) {
        for (HealthOutput output : outputs) {
            try {
                output.send(report);
            } catch (Exception e) {
                statistics.recordOutputError();
                logger.error("Error sending to output: {}",
                        output.getClass().getSimpleName(), e);
            }
        }
    }

    private void initializeOutputs() {
        for (HealthOutput output : outputs) {
            try {
                output.initialize();
                logger.debug("Initialized output: {}", output.getClass().getSimpleName());
            } catch (Exception e) {
                logger.error("Failed to initialize output: {}",
                        output.getClass().getSimpleName(), e);
                throw new IllegalStateException("Failed to initialize output", e);
            }
        }
    }

    private void closeResources() {
        for (HealthOutput output : outputs) {
            try {
                output.close();
            } catch (Exception e) {
                logger.warn("Error closing output: {}",
                        output.getClass().getSimpleName(), e);
            }
        }
    }

    /**
     * Statistics tracking for the processor.
     */
    public static class ProcessorStatistics {
        private volatile long startTime;
        private volatile long stopTime;
        private volatile long startNano;
        private final AtomicLong batchesProcessed = new AtomicLong();
        private final AtomicLong batchesFailed = new AtomicLong();
        private final AtomicLong devicesProcessed = new AtomicLong();
        private final AtomicLong devicesInsufficient = new AtomicLong();
        private final AtomicLong windowsBuilt = new AtomicLong();
        private final AtomicLong samplesDropped = new AtomicLong();
        private final AtomicLong outputErrors = new AtomicLong();

        void recordStart() {
            startTime = System.currentTimeMillis();
            startNano = System.nanoTime();
            stopTime = 0;
        }

        void recordStop() {
            stopTime = System.currentTimeMillis();
        }

        void recordReport(PipelineReport report) {
            batchesProcessed.incrementAndGet();
            long ok = report.okDevices();
            devicesProcessed.addAndGet(ok);
            devicesInsufficient.addAndGet(report.devices().size() - ok);
            windowsBuilt.addAndGet(report.totalWindows());
            samplesDropped.addAndGet(report.droppedSamples());
        }

        void recordBatchFailure() {
            batchesFailed.incrementAndGet();
        }

        void recordOutputError() {
            outputErrors.incrementAndGet();
        }

        public long getUptime() {
            if (startTime == 0) return 0;
            if (stopTime > 0) {
                return stopTime - startTime;
            }
            long elapsedMs = (System.nanoTime() - startNano) / 1_000_000L;
            return elapsedMs > 0 ? elapsedMs : 1L;
        }

        public long getBatchesProcessed() {
            return batchesProcessed.get();
        }

        public long getBatchesFailed() {
            return batchesFailed.get();
        }

        public long getDevicesProcessed() {
            return devicesProcessed.get();
        }

        public long getDevicesInsufficient() {
            return devicesInsufficient.get();
        }

        public long getWindowsBuilt() {
            return windowsBuilt.get();
        }

        public long getSamplesDropped() {
            return samplesDropped.get();
        }

        public long getOutputErrors() {
            return outputErrors.get();
        }

        @Override
        public String toString() {
            return String.format("ProcessorStatistics{uptime=%dms, batches=%d, failedBatches=%d, " +
                            "devicesOk=%d, devicesInsufficient=%d, windows=%d, droppedSamples=%d, outputErrors=%d}",
                    getUptime(), batchesProcessed.get(), batchesFailed.get(), devicesProcessed.get(),
                    devicesInsufficient.get(), windowsBuilt.get(), samplesDropped.get(), outputErrors.get());
        }
    }
}
