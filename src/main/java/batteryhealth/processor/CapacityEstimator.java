package batteryhealth.processor;

import batteryhealth.config.PipelineConfig;
import batteryhealth.config.PipelineConfigurationException;
import batteryhealth.domain.CapacitySource;
import batteryhealth.domain.DeviceSeries;
import batteryhealth.domain.SohSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Turns a noisy charge-counter series, or integrated current when no counter is reported,
 * into a capacity estimate per full-charge event and a State of Health relative to the
 * device's reference capacity.
 */
public class CapacityEstimator {
    private static final Logger logger = LoggerFactory.getLogger(CapacityEstimator.class);

    public static final double CAPACITY_PERCENTILE = 95.0;
    public static final double CAPACITY_OUTLIER_PERCENTILE = 99.0;
    public static final double MIN_CAPACITY_FACTOR = 0.70;
    public static final double MAX_CAPACITY_FACTOR = 1.15;
    public static final double MIN_REFERENCE_FACTOR = 0.95;
    public static final double MAX_REFERENCE_FACTOR = 1.05;
    public static final double MAX_SOH = 1.2;
    public static final int FALLBACK_WINDOW = 6;
    public static final int FALLBACK_MIN_PERIODS = 3;
    public static final int SMOOTHING_WINDOW = 3;

    private final HampelFilter hampelFilter;
    private final PipelineConfig config;
    private final double fullLevel;

    public CapacityEstimator(PipelineConfig config, HampelFilter hampelFilter) {
        this.config = config;
        this.hampelFilter = hampelFilter;
        if (!(config.defaultCapacity() > 0)) {
            throw new PipelineConfigurationException("Reference capacity default must be positive");
        }
        this.fullLevel = Math.max(config.fullChargeThreshold() - 1.0, 98.0);
    }

    public CapacityEstimator(PipelineConfig config) {
        this(config, new HampelFilter(config.hampelK(), config.hampelNsigma()));
    }

    /**
     * Estimate capacity and SoH for one device.
     *
     * @return the estimate, or {@link SohSeries#insufficient(int)} when the device reports neither
     *         a charge counter nor an average current
     */
    public SohSeries estimate(DeviceSeries series) {
        int n = series.size();
        double[] chargeCounter = series.chargeCounterUah();
        double[] current = series.currentAvgUa();

        CapacitySource source;
        double[] raw;
        double[] charge;
        if (SeriesMath.hasAnyValue(chargeCounter)) {
            source = CapacitySource.CHARGE_COUNTER;
            raw = SeriesMath.scale(chargeCounter, 1.0 / 1000.0);
            charge = hampelFilter.apply(raw);
            // some devices report the counter with a discharge sign
            if (SeriesMath.median(charge) < 0) {
                charge = SeriesMath.scale(charge, -1.0);
            }
        } else if (SeriesMath.hasAnyValue(current)) {
            source = CapacitySource.INTEGRATED_CURRENT;
            charge = integrateCurrent(current, series.deltaTSeconds());
            raw = charge.clone();
        } else {
            logger.warn("Device {} reports neither charge counter nor current; SoH unavailable",
                    series.deviceId());
            return SohSeries.insufficient(n);
        }

        double[] fullBlockId = detectFullChargeBlocks(series.batteryLevel());
        Map<Integer, Integer> blockSizes = blockSizes(fullBlockId);

        double[] capacity = SeriesMath.nanArray(n);
        assignBlockCandidates(charge, fullBlockId, blockSizes, capacity);

        if (!SeriesMath.hasAnyValue(capacity)) {
            logger.debug("Device {} has no usable full-charge block, using rolling max of charge",
                    series.deviceId());
            capacity = SeriesMath.rollingMaxTrailing(charge, FALLBACK_WINDOW, FALLBACK_MIN_PERIODS);
        }

        OptionalDouble nominal = config.nominalCapacityFor(series.deviceId());
        if (nominal.isPresent()) {
            capacity = SeriesMath.clip(capacity,
                    MIN_CAPACITY_FACTOR * nominal.getAsDouble(), MAX_CAPACITY_FACTOR * nominal.getAsDouble());
        }
        capacity = SeriesMath.forwardFill(capacity);

        double reference = referenceCapacity(capacity, nominal);

        double[] soh = SeriesMath.clip(SeriesMath.scale(capacity, 1.0 / reference), 0.0, MAX_SOH);
        double[] sohSmooth = SeriesMath.rollingMedianCentered(soh, SMOOTHING_WINDOW, 1);

        logger.debug("Device {}: source={}, fullChargeBlocks={}, C0_ref={} mAh",
                series.deviceId(), source, blockSizes.size(), reference);
        return new SohSeries(source, charge, raw, capacity, reference, soh, sohSmooth, fullBlockId,
                blockSizes.size());
    }

    /**
     * Cumulative charge (mAh) from average current (uA) and elapsed seconds, shifted so its minimum is 0.
     */
    static double[] integrateCurrent(double[] currentUa, double[] deltaTSeconds) {
        double[] deltaQAh = new double[currentUa.length];
        for (int i = 0; i < currentUa.length; i++) {
            double dt = Double.isNaN(deltaTSeconds[i]) ? 0.0 : deltaTSeconds[i];
            deltaQAh[i] = (currentUa[i] / 1e6) * dt / 3600.0;
        }
        double[] chargeAh = SeriesMath.cumulativeSum(deltaQAh);
        double min = SeriesMath.percentile(chargeAh, 0.0);
        double[] chargeMah = new double[chargeAh.length];
        for (int i = 0; i < chargeAh.length; i++) {
            chargeMah[i] = (chargeAh[i] - min) * 1000.0;
        }
        return chargeMah;
    }

    /**
     * Label contiguous runs of samples at or above the full-charge level.
     * Run ids count every change of the full/not-full flag, starting at 1 for the first run.
     *
     * @return block id per sample, NaN for samples outside a full-charge run
     */
    double[] detectFullChargeBlocks(double[] batteryLevel) {
        double[] blockId = SeriesMath.nanArray(batteryLevel.length);
        int runId = 0;
        boolean previous = false;
        for (int i = 0; i < batteryLevel.length; i++) {
            // a missing level never counts as full
            boolean full = batteryLevel[i] >= fullLevel;
            if (i == 0 || full != previous) {
                runId++;
            }
            if (full) {
                blockId[i] = runId;
            }
            previous = full;
        }
        return blockId;
    }

    private static Map<Integer, Integer> blockSizes(double[] fullBlockId) {
        Map<Integer, Integer> sizes = new TreeMap<>();
        for (double id : fullBlockId) {
            if (!Double.isNaN(id)) {
                sizes.merge((int) id, 1, Integer::sum);
            }
        }
        return sizes;
    }

    /**
     * For every block with valid charge values, write the 95th percentile of its charge at the index
     * of its maximum charge. Blocks are visited in id order; a later block overwrites an earlier one.
     */
    private static void assignBlockCandidates(double[] charge, double[] fullBlockId,
                                              Map<Integer, Integer> blockSizes, double[] capacity) {
        for (int block : blockSizes.keySet()) {
            double[] values = new double[blockSizes.get(block)];
            int count = 0;
            int peakIndex = -1;
            for (int i = 0; i < charge.length; i++) {
                if (fullBlockId[i] == block && !Double.isNaN(charge[i])) {
                    values[count++] = charge[i];
                    if (peakIndex < 0 || charge[i] > charge[peakIndex]) {
                        peakIndex = i;
                    }
                }
            }
            if (count == 0) {
                continue;
            }
            double[] valid = new double[count];
            System.arraycopy(values, 0, valid, 0, count);
            capacity[peakIndex] = SeriesMath.percentile(valid, CAPACITY_PERCENTILE);
        }
    }

    /**
     * C0_ref: 95th percentile of the estimates after dropping those above their 99th percentile,
     * clamped around the nominal capacity when one is known.
     */
    double referenceCapacity(double[] capacity, OptionalDouble nominal) {
        double[] valid = SeriesMath.validValues(capacity);
        double fromData = Double.NaN;
        if (valid.length > 0) {
            double ceiling = SeriesMath.percentile(valid, CAPACITY_OUTLIER_PERCENTILE);
            double[] kept = Arrays.stream(valid).filter(v -> v <= ceiling).toArray();
            fromData = SeriesMath.percentile(kept, CAPACITY_PERCENTILE);
        }

        if (nominal.isPresent() && !Double.isNaN(fromData)) {
            double rated = nominal.getAsDouble();
            return Math.min(MAX_REFERENCE_FACTOR * rated, Math.max(MIN_REFERENCE_FACTOR * rated, fromData));
        }
        if (!Double.isNaN(fromData) && fromData > 0) {
            return fromData;
        }
        if (nominal.isPresent()) {
            return nominal.getAsDouble();
        }
        return config.defaultCapacity();
    }
}
