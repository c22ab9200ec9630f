package batteryhealth.processor;

import batteryhealth.config.PipelineConfig;
import batteryhealth.domain.CycleSeries;
import batteryhealth.domain.DeviceReport;
import batteryhealth.domain.DeviceSeries;
import batteryhealth.domain.DeviceStatus;
import batteryhealth.domain.FeatureTable;
import batteryhealth.domain.NormalizedTelemetry;
import batteryhealth.domain.PipelineReport;
import batteryhealth.domain.SohPoint;
import batteryhealth.domain.SohSeries;
import batteryhealth.domain.SohSummary;
import batteryhealth.domain.TelemetrySample;
import batteryhealth.domain.ThroughputEnergyRecord;
import batteryhealth.domain.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Composes the per-device stages into the full feature pipeline:
 * normalize, estimate capacity and SoH, accumulate cycles, derive throughput and energy,
 * merge, add aging features and z-scores, and cut model windows.
 * <p>
 * Devices never share state, so a batch may be processed sequentially with {@link #run(List)}
 * or fanned out over an executor with {@link #runAll(List, ExecutorService)}; both produce the
 * same report.
 */
public class FeaturePipeline {
    private static final Logger logger = LoggerFactory.getLogger(FeaturePipeline.class);

    private final PipelineConfig config;
    private final TelemetryNormalizer normalizer;
    private final CapacityEstimator capacityEstimator;
    private final CycleAccumulator cycleAccumulator;
    private final ThroughputEnergyCalculator throughputEnergyCalculator;
    private final FeatureMerger featureMerger;
    private final AgingFeatureBuilder agingFeatureBuilder;
    private final ZScoreNormalizer zScoreNormalizer;
    private final WindowBuilder windowBuilder;

    public FeaturePipeline(PipelineConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.normalizer = new TelemetryNormalizer();
        this.capacityEstimator = new CapacityEstimator(config);
        this.cycleAccumulator = new CycleAccumulator();
        this.throughputEnergyCalculator = new ThroughputEnergyCalculator();
        this.featureMerger = new FeatureMerger();
        this.agingFeatureBuilder = new AgingFeatureBuilder(config.emaFastSpan(), config.emaSlowSpan());
        this.zScoreNormalizer = new ZScoreNormalizer(config.zscoreCols());
        this.windowBuilder = new WindowBuilder(config.windowSize(), config.featureCols(),
                config.missingFeatureValue());
    }

    /**
     * Run the pipeline over a batch, one device after the other.
     */
    public PipelineReport run(List<TelemetrySample> samples) {
        NormalizedTelemetry normalized = normalizer.normalize(samples);
        List<DeviceReport> reports = new ArrayList<>(normalized.devices().size());
        for (DeviceSeries series : normalized.devices().values()) {
            reports.add(process(series));
        }
        return finish(reports, normalized.droppedSamples());
    }

    /**
     * Run the pipeline over a batch with one task per device.
     * Results are gathered in device id order, so the report matches {@link #run(List)}.
     *
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public PipelineReport runAll(List<TelemetrySample> samples, ExecutorService executor) {
        NormalizedTelemetry normalized = normalizer.normalize(samples);
        List<Future<DeviceReport>> futures = new ArrayList<>(normalized.devices().size());
        for (DeviceSeries series : normalized.devices().values()) {
            futures.add(executor.submit(() -> process(series)));
        }

        List<DeviceReport> reports = new ArrayList<>(futures.size());
        try {
            for (Future<DeviceReport> future : futures) {
                reports.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while waiting for device results", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Device processing failed", cause);
        }
        return finish(reports, normalized.droppedSamples());
    }

    /**
     * Run every stage for a single device series.
     */
    public DeviceReport process(DeviceSeries series) {
        SohSeries soh = capacityEstimator.estimate(series);
        CycleSeries cycles = cycleAccumulator.accumulate(soh);
        List<ThroughputEnergyRecord> throughputEnergy = throughputEnergyCalculator.calculate(series);

        FeatureTable table = featureMerger.merge(series, soh, cycles, throughputEnergy);
        table = agingFeatureBuilder.build(table);
        table = zScoreNormalizer.apply(table);

        // no SoH target without a capacity source, so no windows either
        List<Window> windows = soh.hasCapacitySource() ? windowBuilder.build(table) : List.of();

        DeviceStatus status = DeviceStatus.OK;
        String reason = null;
        if (!soh.hasCapacitySource()) {
            status = DeviceStatus.INSUFFICIENT_DATA;
            reason = "no charge counter or current samples";
        } else if (windows.isEmpty()) {
            status = DeviceStatus.INSUFFICIENT_DATA;
            reason = series.size() + " samples, at least " + (config.windowSize() + 1)
                    + " needed for a window";
        }
        if (status != DeviceStatus.OK) {
            logger.info("Device {}: insufficient data ({})", series.deviceId(), reason);
        }

        SohSummary summary = summarize(series.deviceId(), status, reason, soh, cycles, table, windows.size());
        return new DeviceReport(series.deviceId(), status, reason, soh, cycles, throughputEnergy, table,
                windows, summary);
    }

    private PipelineReport finish(List<DeviceReport> reports, int droppedSamples) {
        PipelineReport report = PipelineReport.create(reports, droppedSamples);
        logger.info("Pipeline processed {} device(s): {} ok, {} windows, {} sample(s) dropped",
                reports.size(), report.okDevices(), report.totalWindows(), droppedSamples);
        return report;
    }

    private static SohSummary summarize(String deviceId, DeviceStatus status, String reason, SohSeries soh,
                                        CycleSeries cycles, FeatureTable table, int windows) {
        double[] sohPct = soh.sohPct();
        double[] sohSmoothPct = soh.sohSmoothPct();
        double[] efc = cycles.efc();
        List<Instant> timestamps = table.timestamps();

        List<SohPoint> points = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            points.add(new SohPoint(timestamps.get(i),
                    NumericGuards.finiteOrNull(sohPct[i]),
                    NumericGuards.finiteOrNull(sohSmoothPct[i]),
                    NumericGuards.finiteOrNull(efc[i])));
        }

        return new SohSummary(
                deviceId,
                status,
                reason,
                soh.source(),
                NumericGuards.finiteOrNull(soh.referenceCapacityMah()),
                soh.fullChargeBlocks(),
                NumericGuards.finiteOrNull(SeriesMath.lastValid(sohPct)),
                NumericGuards.finiteOrNull(SeriesMath.lastValid(sohSmoothPct)),
                NumericGuards.finiteOrNull(cycles.totalEfc()),
                windows,
                List.copyOf(points));
    }

    public PipelineConfig config() {
        return config;
    }

    public WindowBuilder windowBuilder() {
        return windowBuilder;
    }
}
