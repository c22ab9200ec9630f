package batteryhealth.processor;

import batteryhealth.domain.FeatureColumns;
import batteryhealth.domain.FeatureTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-device z-score of selected columns, written to {@code <column>_z}.
 * A column with zero or undefined spread scores 0 on every row. Absent columns are skipped.
 */
public class ZScoreNormalizer {

    private final List<String> columns;

    public ZScoreNormalizer(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    public ZScoreNormalizer() {
        this(FeatureColumns.AGING_BASE_COLS);
    }

    public FeatureTable apply(FeatureTable table) {
        Map<String, double[]> added = new LinkedHashMap<>();
        for (String column : columns) {
            if (!table.hasColumn(column)) {
                continue;
            }
            added.put(FeatureColumns.zscore(column), zscore(table.column(column)));
        }
        return table.withColumns(added);
    }

    /**
     * {@code (x - mean) / populationStd}; missing inputs stay missing.
     */
    public static double[] zscore(double[] values) {
        double mean = SeriesMath.mean(values);
        double std = SeriesMath.populationStd(values);
        double[] result = new double[values.length];
        if (!(std > 0) || Double.isInfinite(std) || isConstant(values)) {
            return result;
        }
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - mean) / std;
        }
        return result;
    }

    // rounding in the mean can leave a tiny non-zero spread on a constant column
    private static boolean isConstant(double[] values) {
        double first = Double.NaN;
        for (double v : values) {
            if (Double.isNaN(v)) {
                continue;
            }
            if (Double.isNaN(first)) {
                first = v;
            } else if (v != first) {
                return false;
            }
        }
        return true;
    }

    public List<String> columns() {
        return columns;
    }
}
