package batteryhealth.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Telemetry of exactly one device, sorted ascending by timestamp and stored column-wise.
 * Missing measurements are {@link Double#NaN}. Accessors hand out copies, so a series
 * can be shared between stages running on different threads.
 */
public final class DeviceSeries {

    private final String deviceId;
    private final List<Instant> timestamps;
    private final double[] deltaTSeconds;
    private final double[] chargeCounterUah;
    private final double[] currentAvgUa;
    private final double[] batteryLevel;
    private final double[] battVoltageMv;
    private final double[] battTempC;
    private final double[] txTotalBytes;
    private final double[] rxTotalBytes;
    private final List<String> foregroundPackages;

    private DeviceSeries(String deviceId, List<Instant> timestamps, List<TelemetrySample> samples,
                         double[] deltaTSeconds) {
        this.deviceId = deviceId;
        this.timestamps = List.copyOf(timestamps);
        this.deltaTSeconds = deltaTSeconds.clone();
        this.chargeCounterUah = column(samples, TelemetrySample::chargeCounterUah);
        this.currentAvgUa = column(samples, TelemetrySample::currentAvgUa);
        this.batteryLevel = column(samples, TelemetrySample::batteryLevel);
        this.battVoltageMv = column(samples, TelemetrySample::battVoltageMv);
        this.battTempC = column(samples, TelemetrySample::battTempC);
        this.txTotalBytes = column(samples, TelemetrySample::txTotalBytes);
        this.rxTotalBytes = column(samples, TelemetrySample::rxTotalBytes);

        List<String> packages = new ArrayList<>(samples.size());
        for (TelemetrySample sample : samples) {
            packages.add(sample.foregroundPackage());
        }
        this.foregroundPackages = Collections.unmodifiableList(packages);
    }

    /**
     * Build a series from samples that are already sorted by their parsed timestamps.
     *
     * @param deviceId the device the samples belong to
     * @param timestamps parsed timestamps, one per sample, ascending
     * @param samples the raw samples in the same order
     * @param deltaTSeconds elapsed seconds since the previous sample, NaN for the first one
     * @return the column-wise series
     */
    public static DeviceSeries fromSorted(String deviceId, List<Instant> timestamps,
                                          List<TelemetrySample> samples, double[] deltaTSeconds) {
        Objects.requireNonNull(deviceId, "deviceId cannot be null");
        if (timestamps.size() != samples.size() || deltaTSeconds.length != samples.size()) {
            throw new IllegalArgumentException("timestamps, samples and deltaT must have the same length");
        }
        return new DeviceSeries(deviceId, timestamps, samples, deltaTSeconds);
    }

    private static double[] column(List<TelemetrySample> samples, Function<TelemetrySample, Number> getter) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            Number value = getter.apply(samples.get(i));
            values[i] = value != null ? value.doubleValue() : Double.NaN;
        }
        return values;
    }

    public String deviceId() {
        return deviceId;
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public List<Instant> timestamps() {
        return timestamps;
    }

    public double[] deltaTSeconds() {
        return deltaTSeconds.clone();
    }

    public double[] chargeCounterUah() {
        return chargeCounterUah.clone();
    }

    public double[] currentAvgUa() {
        return currentAvgUa.clone();
    }

    public double[] batteryLevel() {
        return batteryLevel.clone();
    }

    public double[] battVoltageMv() {
        return battVoltageMv.clone();
    }

    public double[] battTempC() {
        return battTempC.clone();
    }

    public double[] txTotalBytes() {
        return txTotalBytes.clone();
    }

    public double[] rxTotalBytes() {
        return rxTotalBytes.clone();
    }

    public List<String> foregroundPackages() {
        return foregroundPackages;
    }

    @Override
    public String toString() {
        return "DeviceSeries{deviceId=" + deviceId + ", samples=" + size() + "}";
    }
}
