package batteryhealth.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merged per-sample feature table of one device, keyed by (device id, timestamp).
 * Immutable: {@link #withColumn(String, double[])} returns a new table.
 */
public final class FeatureTable {

    private final String deviceId;
    private final List<Instant> timestamps;
    private final Map<String, double[]> columns;

    public FeatureTable(String deviceId, List<Instant> timestamps, Map<String, double[]> columns) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId cannot be null");
        this.timestamps = List.copyOf(timestamps);
        Map<String, double[]> copy = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            if (values.length != this.timestamps.size()) {
                throw new IllegalArgumentException("Column " + name + " has " + values.length
                        + " rows, expected " + this.timestamps.size());
            }
            copy.put(name, values.clone());
        });
        this.columns = Collections.unmodifiableMap(copy);
    }

    public String deviceId() {
        return deviceId;
    }

    public List<Instant> timestamps() {
        return timestamps;
    }

    public int rowCount() {
        return timestamps.size();
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Copy of a column; an absent column reads as all missing.
     */
    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            double[] missing = new double[rowCount()];
            Arrays.fill(missing, Double.NaN);
            return missing;
        }
        return values.clone();
    }

    public double value(String name, int row) {
        double[] values = columns.get(name);
        return values != null ? values[row] : Double.NaN;
    }

    public FeatureTable withColumn(String name, double[] values) {
        Map<String, double[]> next = new LinkedHashMap<>(columns);
        next.put(name, values);
        return new FeatureTable(deviceId, timestamps, next);
    }

    public FeatureTable withColumns(Map<String, double[]> added) {
        Map<String, double[]> next = new LinkedHashMap<>(columns);
        next.putAll(added);
        return new FeatureTable(deviceId, timestamps, next);
    }

    @Override
    public String toString() {
        return "FeatureTable{deviceId=" + deviceId + ", rows=" + rowCount()
                + ", columns=" + columns.size() + "}";
    }
}
