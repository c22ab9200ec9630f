package batteryhealth.processor;

import batteryhealth.config.PipelineConfigurationException;
import batteryhealth.domain.FeatureColumns;
import batteryhealth.domain.FeatureTable;
import batteryhealth.domain.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Slides a fixed-length window over a device's feature matrix.
 * <p>
 * Window {@code i} (for {@code windowSize <= i < n}) holds rows {@code [i - windowSize, i)} and is
 * labelled with the timestamp, SoH and EFC of row {@code i}, so a device with {@code n} rows yields
 * {@code max(0, n - windowSize)} windows. Missing feature values are replaced with a configured
 * constant because the model cannot consume NaN.
 */
public class WindowBuilder {
    private static final Logger logger = LoggerFactory.getLogger(WindowBuilder.class);

    private final int windowSize;
    private final List<String> featureCols;
    private final double missingValue;

    public WindowBuilder(int windowSize, List<String> featureCols, double missingValue) {
        if (windowSize <= 0) {
            throw new PipelineConfigurationException("Window size must be positive, got " + windowSize);
        }
        if (featureCols == null || featureCols.isEmpty()) {
            throw new PipelineConfigurationException("At least one feature column is required");
        }
        if (!Double.isFinite(missingValue)) {
            throw new PipelineConfigurationException("Missing feature value must be finite");
        }
        this.windowSize = windowSize;
        this.featureCols = List.copyOf(featureCols);
        this.missingValue = missingValue;
    }

    public WindowBuilder(int windowSize, List<String> featureCols) {
        this(windowSize, featureCols, 0.0);
    }

    public List<Window> build(FeatureTable table) {
        int n = table.rowCount();
        if (n <= windowSize) {
            logger.debug("Device {} has {} rows, window size {}: no windows", table.deviceId(), n, windowSize);
            return List.of();
        }

        double[][] matrix = featureMatrix(table);
        double[] sohTrue = sohTrue(table);
        double[] efc = table.column(FeatureColumns.EFC);

        List<Window> windows = new ArrayList<>(n - windowSize);
        for (int i = windowSize; i < n; i++) {
            double[][] rows = new double[windowSize][];
            for (int r = 0; r < windowSize; r++) {
                rows[r] = matrix[i - windowSize + r];
            }
            windows.add(new Window(table.deviceId(), rows, table.timestamps().get(i), sohTrue[i], efc[i]));
        }
        return windows;
    }

    /**
     * Row-major matrix of the configured feature columns with missing cells replaced.
     */
    double[][] featureMatrix(FeatureTable table) {
        int n = table.rowCount();
        double[][] matrix = new double[n][featureCols.size()];
        for (int c = 0; c < featureCols.size(); c++) {
            String name = featureCols.get(c);
            if (!table.hasColumn(name)) {
                logger.debug("Device {} lacks feature column {}, filling with {}", table.deviceId(), name,
                        missingValue);
            }
            double[] column = table.column(name);
            for (int r = 0; r < n; r++) {
                matrix[r][c] = NumericGuards.finiteOr(column[r], missingValue);
            }
        }
        return matrix;
    }

    private static double[] sohTrue(FeatureTable table) {
        double[] smooth = table.column(FeatureColumns.SOH_SMOOTH);
        double[] raw = table.column(FeatureColumns.SOH);
        double[] result = new double[smooth.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = Double.isNaN(smooth[i]) ? raw[i] : smooth[i];
        }
        return result;
    }

    public int windowSize() {
        return windowSize;
    }

    public List<String> featureCols() {
        return featureCols;
    }
}
