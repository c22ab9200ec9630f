package batteryhealth.processor;

import batteryhealth.config.PipelineConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Robust outlier rejection with a centered rolling median and median absolute deviation.
 * <p>
 * A value is an outlier when {@code |x - med| > nsigma * 1.4826 * mad} over a window of
 * {@code 2k + 1} samples. Outliers are replaced with NaN rather than removed, so indices stay
 * aligned with the rest of the device series. Windows holding fewer than three valid values give
 * no verdict and keep their sample.
 */
public class HampelFilter {
    private static final Logger logger = LoggerFactory.getLogger(HampelFilter.class);

    /** Scales a MAD to the standard deviation of a normal distribution. */
    public static final double MAD_SCALE = 1.4826;
    public static final int MIN_PERIODS = 3;

    private final int k;
    private final double nsigma;

    public HampelFilter(int k, double nsigma) {
        if (k < 1) {
            throw new PipelineConfigurationException("Hampel half width must be at least 1, got " + k);
        }
        if (!(nsigma > 0) || Double.isInfinite(nsigma)) {
            throw new PipelineConfigurationException("Hampel nsigma must be a positive number, got " + nsigma);
        }
        this.k = k;
        this.nsigma = nsigma;
    }

    public HampelFilter() {
        this(7, 5.0);
    }

    /**
     * @param values series to clean; not modified
     * @return a copy with outliers replaced by NaN
     */
    public double[] apply(double[] values) {
        double[] result = values.clone();
        if (!SeriesMath.hasAnyValue(values)) {
            return result;
        }

        int window = 2 * k + 1;
        double[] median = SeriesMath.rollingMedianCentered(values, window, MIN_PERIODS);
        double[] deviation = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviation[i] = Math.abs(values[i] - median[i]);
        }
        double[] mad = SeriesMath.rollingMedianCentered(deviation, window, MIN_PERIODS);

        int outliers = 0;
        for (int i = 0; i < values.length; i++) {
            double threshold = nsigma * MAD_SCALE * mad[i];
            // NaN on either side means no verdict
            if (deviation[i] > threshold) {
                result[i] = Double.NaN;
                outliers++;
            }
        }
        if (outliers > 0) {
            logger.debug("Hampel filter (k={}, nsigma={}) rejected {} of {} samples", k, nsigma, outliers,
                    values.length);
        }
        return result;
    }

    public int k() {
        return k;
    }

    public double nsigma() {
        return nsigma;
    }
}
