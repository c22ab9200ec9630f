package batteryhealth.processor;

import batteryhealth.domain.DeviceSeries;
import batteryhealth.domain.ThroughputEnergyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Network throughput from consecutive byte counters, battery energy per interval, and the
 * empirical energy-per-bit and battery-cost-of-traffic (BoT) figures derived from them.
 */
public class ThroughputEnergyCalculator {
    private static final Logger logger = LoggerFactory.getLogger(ThroughputEnergyCalculator.class);

    // energy_per_bit = alpha / throughput_bps + beta, in nJ
    public static final double ALPHA_TX = 446.0;
    public static final double BETA_TX = 3.381132;
    public static final double ALPHA_RX = 357.5443;
    public static final double BETA_RX = 1.969068;
    public static final double NANO = 1e-9;

    /**
     * Compute one record per sample that has byte counters and a usable interval to the
     * previous sample with byte counters.
     *
     * @return records in timestamp order; empty when fewer than two samples carry byte counters
     */
    public List<ThroughputEnergyRecord> calculate(DeviceSeries series) {
        double[] tx = series.txTotalBytes();
        double[] rx = series.rxTotalBytes();
        double[] voltageMv = series.battVoltageMv();
        double[] currentUa = series.currentAvgUa();
        double[] tempC = series.battTempC();
        double[] deltaT = series.deltaTSeconds();
        List<Instant> timestamps = series.timestamps();

        List<Interval> intervals = new ArrayList<>();
        int previous = -1;
        for (int i = 0; i < series.size(); i++) {
            if (Double.isNaN(tx[i]) || Double.isNaN(rx[i])) {
                continue;
            }
            if (previous >= 0) {
                double seconds = Duration.between(timestamps.get(previous), timestamps.get(i)).toNanos() / 1e9;
                // no rate over zero-length or non-physical gaps
                if (seconds > 0 && seconds <= TelemetryNormalizer.MAX_GAP_SECONDS) {
                    intervals.add(new Interval(i, seconds, tx[i] - tx[previous], rx[i] - rx[previous]));
                }
            }
            previous = i;
        }

        if (intervals.isEmpty()) {
            logger.debug("Device {} has no usable byte-counter interval", series.deviceId());
            return List.of();
        }

        double[] voltageV = new double[intervals.size()];
        for (int j = 0; j < intervals.size(); j++) {
            voltageV[j] = voltageMv[intervals.get(j).index()] / 1000.0;
        }
        double meanVoltage = SeriesMath.mean(voltageV);

        List<ThroughputEnergyRecord> records = new ArrayList<>(intervals.size());
        for (int j = 0; j < intervals.size(); j++) {
            Interval interval = intervals.get(j);
            int i = interval.index();

            double uploadBps = interval.deltaTx() * 8.0 / interval.seconds();
            double downloadBps = interval.deltaRx() * 8.0 / interval.seconds();
            double totalBps = (interval.deltaTx() + interval.deltaRx()) * 8.0 / interval.seconds();

            double currentA = currentUa[i] / 1e6;
            double energyWh = voltageV[j] * currentA * deltaT[i] / 3600.0;

            double[] perBit = energyPerBit(totalBps);
            double bot = botMahPerGbps(perBit[2], meanVoltage);

            records.add(new ThroughputEnergyRecord(
                    timestamps.get(i),
                    interval.seconds(),
                    uploadBps / 1e6,
                    downloadBps / 1e6,
                    totalBps / 1e6,
                    totalBps,
                    voltageV[j],
                    tempC[i],
                    energyWh,
                    perBit[0],
                    perBit[1],
                    perBit[2],
                    bot));
        }
        logger.debug("Device {}: {} throughput/energy records", series.deviceId(), records.size());
        return records;
    }

    /**
     * Energy per bit in joules for transmit, receive and their average.
     * A zero throughput is treated as missing, so all three come back NaN.
     */
    static double[] energyPerBit(double throughputBps) {
        if (throughputBps == 0.0 || Double.isNaN(throughputBps)) {
            return new double[]{Double.NaN, Double.NaN, Double.NaN};
        }
        double tx = (ALPHA_TX / throughputBps + BETA_TX) * NANO;
        double rx = (ALPHA_RX / throughputBps + BETA_RX) * NANO;
        return new double[]{tx, rx, (tx + rx) / 2.0};
    }

    /**
     * Battery charge (mAh) spent per Gbps of traffic at the device's mean voltage.
     */
    static double botMahPerGbps(double energyPerBitAvgJ, double meanVoltage) {
        if (!(meanVoltage > 0)) {
            return Double.NaN;
        }
        return energyPerBitAvgJ * 8e9 / meanVoltage * (1000.0 / 3600.0);
    }

    private record Interval(int index, double seconds, double deltaTx, double deltaRx) {
    }
}
