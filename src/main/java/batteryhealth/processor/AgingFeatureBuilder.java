package batteryhealth.processor;

import batteryhealth.config.PipelineConfigurationException;
import batteryhealth.domain.FeatureTable;

import java.util.LinkedHashMap;
import java.util.Map;

import static batteryhealth.domain.FeatureColumns.*;

/**
 * Adds aging trend features to a merged per-device table: SoH fast/slow EMAs and their
 * divergence, EFC increments, and short-term temperature, throughput and energy-per-bit context.
 */
public class AgingFeatureBuilder {

    private final int fastSpan;
    private final int slowSpan;

    public AgingFeatureBuilder(int fastSpan, int slowSpan) {
        if (fastSpan < 1 || slowSpan < 1) {
            throw new PipelineConfigurationException("EMA spans must be at least 1, got fast="
                    + fastSpan + ", slow=" + slowSpan);
        }
        this.fastSpan = fastSpan;
        this.slowSpan = slowSpan;
    }

    public AgingFeatureBuilder() {
        this(6, 48);
    }

    public FeatureTable build(FeatureTable table) {
        int n = table.rowCount();
        Map<String, double[]> added = new LinkedHashMap<>();

        double[] sohFilled = sohFilled(table);
        double[] emaFast = SeriesMath.ewmMean(sohFilled, fastSpan);
        double[] emaSlow = SeriesMath.ewmMean(sohFilled, slowSpan);
        double[] trend = new double[n];
        for (int i = 0; i < n; i++) {
            trend[i] = emaFast[i] - emaSlow[i];
        }
        added.put(SOH_FILLED, sohFilled);
        added.put(SOH_EMA_FAST, emaFast);
        added.put(SOH_EMA_SLOW, emaSlow);
        added.put(SOH_TREND, trend);
        added.put(EFC_DELTA, SeriesMath.fillMissing(SeriesMath.diff(table.column(EFC)), 0.0));

        double[] temperature = table.column(BATT_TEMP_C);
        if (SeriesMath.hasAnyValue(temperature)) {
            added.put(TEMP_EMA, SeriesMath.ewmMean(temperature, fastSpan));
            added.put(TEMP_MAX_WIN, SeriesMath.rollingMaxTrailing(temperature, fastSpan, 1));
        } else {
            added.put(TEMP_EMA, new double[n]);
            added.put(TEMP_MAX_WIN, new double[n]);
        }

        added.put(TP_EMA, emaOrZero(table.column(THROUGHPUT_TOTAL_MBPS), n));
        added.put(EPB_EMA, emaOrZero(table.column(ENERGY_PER_BIT_AVG_J), n));

        return table.withColumns(added);
    }

    /**
     * Continuous SoH proxy: smoothed SoH where available, raw SoH otherwise,
     * then forward- and backward-filled.
     */
    static double[] sohFilled(FeatureTable table) {
        double[] smooth = table.column(SOH_SMOOTH);
        double[] raw = table.column(SOH);
        double[] proxy = new double[smooth.length];
        for (int i = 0; i < proxy.length; i++) {
            proxy[i] = Double.isNaN(smooth[i]) ? raw[i] : smooth[i];
        }
        return SeriesMath.backwardFill(SeriesMath.forwardFill(proxy));
    }

    private double[] emaOrZero(double[] values, int n) {
        return SeriesMath.hasAnyValue(values) ? SeriesMath.ewmMean(values, fastSpan) : new double[n];
    }

    public int fastSpan() {
        return fastSpan;
    }

    public int slowSpan() {
        return slowSpan;
    }
}
