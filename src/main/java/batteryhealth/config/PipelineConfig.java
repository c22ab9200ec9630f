package batteryhealth.config;

import batteryhealth.domain.FeatureColumns;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Numeric configuration of the feature pipeline and the RUL model.
 *
 * @param windowSize rows per model window
 * @param featureCols model input columns, in order
 * @param zscoreCols columns normalised per device
 * @param nominalCapacityTable device id or model to nominal capacity (mAh)
 * @param defaultCapacity reference capacity used when nothing else is known (mAh)
 * @param fullChargeThreshold battery level counted as a full charge
 * @param hampelK half width of the outlier filter window
 * @param hampelNsigma outlier threshold in robust standard deviations
 * @param emaFastSpan span of the fast moving averages
 * @param emaSlowSpan span of the slow SoH moving average
 * @param rulKGlobal SoH lost per equivalent full cycle
 * @param rulSohEol end-of-life SoH (fraction)
 * @param rulHoursPerCycle wall-clock hours per equivalent full cycle
 * @param missingFeatureValue value written into a window cell whose feature is missing
 */
public record PipelineConfig(
        int windowSize,
        List<String> featureCols,
        List<String> zscoreCols,
        Map<String, Double> nominalCapacityTable,
        double defaultCapacity,
        double fullChargeThreshold,
        int hampelK,
        double hampelNsigma,
        int emaFastSpan,
        int emaSlowSpan,
        double rulKGlobal,
        double rulSohEol,
        double rulHoursPerCycle,
        double missingFeatureValue
) {
    public static final int DEFAULT_WINDOW_SIZE = 24;
    public static final double DEFAULT_CAPACITY_MAH = 5000.0;
    public static final double DEFAULT_FULL_CHARGE_THRESHOLD = 100.0;
    public static final int DEFAULT_HAMPEL_K = 7;
    public static final double DEFAULT_HAMPEL_NSIGMA = 5.0;
    public static final int DEFAULT_EMA_FAST_SPAN = 6;
    public static final int DEFAULT_EMA_SLOW_SPAN = 48;
    public static final double DEFAULT_RUL_K_GLOBAL = 0.0002;
    public static final double DEFAULT_RUL_SOH_EOL = 0.7;
    public static final double DEFAULT_RUL_HOURS_PER_CYCLE = 24.0;

    public PipelineConfig {
        if (windowSize <= 0) {
            throw new PipelineConfigurationException("window_size must be positive, got " + windowSize);
        }
        if (featureCols == null || featureCols.isEmpty()) {
            throw new PipelineConfigurationException("feature_cols must not be empty");
        }
        if (!(defaultCapacity > 0) || Double.isInfinite(defaultCapacity)) {
            throw new PipelineConfigurationException("default_capacity must be a positive number, got "
                    + defaultCapacity);
        }
        if (!(fullChargeThreshold > 0) || fullChargeThreshold > 100) {
            throw new PipelineConfigurationException("full_charge_threshold must be in (0, 100], got "
                    + fullChargeThreshold);
        }
        if (hampelK < 1) {
            throw new PipelineConfigurationException("hampel_k must be at least 1, got " + hampelK);
        }
        if (!(hampelNsigma > 0) || Double.isInfinite(hampelNsigma)) {
            throw new PipelineConfigurationException("hampel_nsigma must be positive, got " + hampelNsigma);
        }
        if (emaFastSpan < 1 || emaSlowSpan < 1) {
            throw new PipelineConfigurationException("EMA spans must be at least 1");
        }
        if (!(rulKGlobal > 0) || Double.isInfinite(rulKGlobal)) {
            throw new PipelineConfigurationException("rul_k_global must be a positive number, got " + rulKGlobal);
        }
        if (!(rulSohEol > 0) || rulSohEol > 1.2) {
            throw new PipelineConfigurationException("rul_soh_eol must be in (0, 1.2], got " + rulSohEol);
        }
        if (!(rulHoursPerCycle > 0) || Double.isInfinite(rulHoursPerCycle)) {
            throw new PipelineConfigurationException("rul_hours_per_cycle must be a positive number, got "
                    + rulHoursPerCycle);
        }
        if (!Double.isFinite(missingFeatureValue)) {
            throw new PipelineConfigurationException("missing_feature_value must be finite");
        }
        if (nominalCapacityTable != null) {
            nominalCapacityTable.forEach((model, capacity) -> {
                if (capacity == null || !(capacity > 0) || capacity.isInfinite()) {
                    throw new PipelineConfigurationException("Nominal capacity of " + model
                            + " must be a positive number, got " + capacity);
                }
            });
        }
        nominalCapacityTable = nominalCapacityTable == null ? Map.of() : Map.copyOf(nominalCapacityTable);
        featureCols = List.copyOf(featureCols);
        zscoreCols = zscoreCols == null ? List.of() : List.copyOf(zscoreCols);
    }

    /**
     * Configuration with every default and an empty nominal capacity table.
     */
    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .windowSize(windowSize)
                .featureCols(featureCols)
                .zscoreCols(zscoreCols)
                .nominalCapacityTable(nominalCapacityTable)
                .defaultCapacity(defaultCapacity)
                .fullChargeThreshold(fullChargeThreshold)
                .hampelK(hampelK)
                .hampelNsigma(hampelNsigma)
                .emaFastSpan(emaFastSpan)
                .emaSlowSpan(emaSlowSpan)
                .rulKGlobal(rulKGlobal)
                .rulSohEol(rulSohEol)
                .rulHoursPerCycle(rulHoursPerCycle)
                .missingFeatureValue(missingFeatureValue);
    }

    /**
     * Nominal capacity of a device: exact id first, then its model prefix
     * (everything before the last {@code '-'}, e.g. {@code SM-A556E} for {@code SM-A556E-7ecd17}).
     */
    public OptionalDouble nominalCapacityFor(String deviceId) {
        if (deviceId == null) {
            return OptionalDouble.empty();
        }
        Double exact = nominalCapacityTable.get(deviceId);
        if (exact != null) {
            return OptionalDouble.of(exact);
        }
        int cut = deviceId.lastIndexOf('-');
        if (cut > 0) {
            Double model = nominalCapacityTable.get(deviceId.substring(0, cut));
            if (model != null) {
                return OptionalDouble.of(model);
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Mutable builder pre-filled with the defaults.
     */
    public static final class Builder {
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private List<String> featureCols = FeatureColumns.MODEL_FEATURE_COLS;
        private List<String> zscoreCols = FeatureColumns.AGING_BASE_COLS;
        private Map<String, Double> nominalCapacityTable = Map.of();
        private double defaultCapacity = DEFAULT_CAPACITY_MAH;
        private double fullChargeThreshold = DEFAULT_FULL_CHARGE_THRESHOLD;
        private int hampelK = DEFAULT_HAMPEL_K;
        private double hampelNsigma = DEFAULT_HAMPEL_NSIGMA;
        private int emaFastSpan = DEFAULT_EMA_FAST_SPAN;
        private int emaSlowSpan = DEFAULT_EMA_SLOW_SPAN;
        private double rulKGlobal = DEFAULT_RUL_K_GLOBAL;
        private double rulSohEol = DEFAULT_RUL_SOH_EOL;
        private double rulHoursPerCycle = DEFAULT_RUL_HOURS_PER_CYCLE;
        private double missingFeatureValue = 0.0;

        private Builder() {
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder featureCols(List<String> featureCols) {
            this.featureCols = featureCols;
            return this;
        }

        public Builder zscoreCols(List<String> zscoreCols) {
            this.zscoreCols = zscoreCols;
            return this;
        }

        public Builder nominalCapacityTable(Map<String, Double> nominalCapacityTable) {
            this.nominalCapacityTable = nominalCapacityTable;
            return this;
        }

        public Builder defaultCapacity(double defaultCapacity) {
            this.defaultCapacity = defaultCapacity;
            return this;
        }

        public Builder fullChargeThreshold(double fullChargeThreshold) {
            this.fullChargeThreshold = fullChargeThreshold;
            return this;
        }

        public Builder hampelK(int hampelK) {
            this.hampelK = hampelK;
            return this;
        }

        public Builder hampelNsigma(double hampelNsigma) {
            this.hampelNsigma = hampelNsigma;
            return this;
        }

        public Builder emaFastSpan(int emaFastSpan) {
            this.emaFastSpan = emaFastSpan;
            return this;
        }

        public Builder emaSlowSpan(int emaSlowSpan) {
            this.emaSlowSpan = emaSlowSpan;
            return this;
        }

        public Builder rulKGlobal(double rulKGlobal) {
            this.rulKGlobal = rulKGlobal;
            return this;
        }

        public Builder rulSohEol(double rulSohEol) {
            this.rulSohEol = rulSohEol;
            return this;
        }

        public Builder rulHoursPerCycle(double rulHoursPerCycle) {
            this.rulHoursPerCycle = rulHoursPerCycle;
            return this;
        }

        public Builder missingFeatureValue(double missingFeatureValue) {
            this.missingFeatureValue = missingFeatureValue;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(windowSize, featureCols, zscoreCols, nominalCapacityTable,
                    defaultCapacity, fullChargeThreshold, hampelK, hampelNsigma, emaFastSpan, emaSlowSpan,
                    rulKGlobal, rulSohEol, rulHoursPerCycle, missingFeatureValue);
        }
    }
}
