package batteryhealth.processor;

import java.util.Arrays;

/**
 * NaN-aware statistics over ordered per-device series.
 * <p>
 * {@link Double#NaN} marks a missing value everywhere. Aggregates skip missing values;
 * rolling statistics report NaN while fewer than {@code minPeriods} valid values are in the window.
 * Inputs are never modified.
 */
public final class SeriesMath {

    public static double[] nanArray(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }

    public static boolean hasAnyValue(double[] values) {
        for (double v : values) {
            if (!Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    public static int countValid(double[] values) {
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                count++;
            }
        }
        return count;
    }

    public static double[] validValues(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }

    public static double mean(double[] values) {
        double sum = 0.0;
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    /**
     * Population standard deviation (divides by n) of the valid values.
     */
    public static double populationStd(double[] values) {
        double mu = mean(values);
        if (Double.isNaN(mu)) {
            return Double.NaN;
        }
        double sumSq = 0.0;
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                double d = v - mu;
                sumSq += d * d;
                count++;
            }
        }
        return Math.sqrt(sumSq / count);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /**
     * Percentile of the valid values with linear interpolation between closest ranks.
     *
     * @param percentile in [0, 100]
     * @return the percentile, or NaN when there is no valid value
     */
    public static double percentile(double[] values, double percentile) {
        double[] sorted = validValues(values);
        if (sorted.length == 0) {
            return Double.NaN;
        }
        Arrays.sort(sorted);
        return sortedPercentile(sorted, percentile);
    }

    private static double sortedPercentile(double[] sorted, double percentile) {
        double rank = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Centered rolling median. The window for index {@code i} spans
     * {@code [i - window/2, i - window/2 + window - 1]}, truncated at both ends of the series.
     */
    public static double[] rollingMedianCentered(double[] values, int window, int minPeriods) {
        requireWindow(window, minPeriods);
        int n = values.length;
        double[] result = new double[n];
        int offset = window / 2;
        double[] buffer = new double[window];
        for (int i = 0; i < n; i++) {
            int start = Math.max(0, i - offset);
            int end = Math.min(n - 1, i - offset + window - 1);
            int count = 0;
            for (int j = start; j <= end; j++) {
                if (!Double.isNaN(values[j])) {
                    buffer[count++] = values[j];
                }
            }
            if (count < minPeriods || count == 0) {
                result[i] = Double.NaN;
            } else {
                double[] valid = Arrays.copyOf(buffer, count);
                Arrays.sort(valid);
                result[i] = sortedPercentile(valid, 50.0);
            }
        }
        return result;
    }

    /**
     * Trailing rolling maximum over {@code [i - window + 1, i]}.
     */
    public static double[] rollingMaxTrailing(double[] values, int window, int minPeriods) {
        requireWindow(window, minPeriods);
        int n = values.length;
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            int start = Math.max(0, i - window + 1);
            int count = 0;
            double max = Double.NEGATIVE_INFINITY;
            for (int j = start; j <= i; j++) {
                if (!Double.isNaN(values[j])) {
                    max = Math.max(max, values[j]);
                    count++;
                }
            }
            result[i] = count >= minPeriods && count > 0 ? max : Double.NaN;
        }
        return result;
    }

    /**
     * Exponential moving average with {@code alpha = 2 / (span + 1)} and the recursive
     * (non-adjusted) form {@code y = (1 - alpha) * y + alpha * x}.
     * <p>
     * Leading missing values stay missing. A missing value inside the series repeats the previous
     * average, and the weight of that average keeps decaying for every missing step, so the next
     * observation counts proportionally more.
     */
    public static double[] ewmMean(double[] values, int span) {
        if (span < 1) {
            throw new IllegalArgumentException("span must be at least 1, got " + span);
        }
        double alpha = 2.0 / (span + 1.0);
        double decay = 1.0 - alpha;
        int n = values.length;
        double[] result = new double[n];
        double weighted = Double.NaN;
        double oldWeight = 1.0;
        for (int i = 0; i < n; i++) {
            double current = values[i];
            boolean observed = !Double.isNaN(current);
            if (!Double.isNaN(weighted)) {
                oldWeight *= decay;
                if (observed) {
                    if (weighted != current) {
                        weighted = (oldWeight * weighted + alpha * current) / (oldWeight + alpha);
                    }
                    oldWeight = 1.0;
                }
            } else if (observed) {
                weighted = current;
                oldWeight = 1.0;
            }
            result[i] = weighted;
        }
        return result;
    }

    /**
     * First difference; the first element and any difference involving a missing value are NaN.
     */
    public static double[] diff(double[] values) {
        double[] result = new double[values.length];
        if (values.length == 0) {
            return result;
        }
        result[0] = Double.NaN;
        for (int i = 1; i < values.length; i++) {
            result[i] = values[i] - values[i - 1];
        }
        return result;
    }

    /**
     * Running sum that skips missing values; a missing input stays missing in the output.
     */
    public static double[] cumulativeSum(double[] values) {
        double[] result = new double[values.length];
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                result[i] = Double.NaN;
            } else {
                sum += values[i];
                result[i] = sum;
            }
        }
        return result;
    }

    public static double[] forwardFill(double[] values) {
        double[] result = values.clone();
        double last = Double.NaN;
        for (int i = 0; i < result.length; i++) {
            if (Double.isNaN(result[i])) {
                result[i] = last;
            } else {
                last = result[i];
            }
        }
        return result;
    }

    public static double[] backwardFill(double[] values) {
        double[] result = values.clone();
        double next = Double.NaN;
        for (int i = result.length - 1; i >= 0; i--) {
            if (Double.isNaN(result[i])) {
                result[i] = next;
            } else {
                next = result[i];
            }
        }
        return result;
    }

    public static double[] fillMissing(double[] values, double fill) {
        double[] result = values.clone();
        for (int i = 0; i < result.length; i++) {
            if (Double.isNaN(result[i])) {
                result[i] = fill;
            }
        }
        return result;
    }

    /**
     * Clip every valid value into {@code [lower, upper]}; missing values stay missing.
     */
    public static double[] clip(double[] values, double lower, double upper) {
        double[] result = values.clone();
        for (int i = 0; i < result.length; i++) {
            if (!Double.isNaN(result[i])) {
                result[i] = Math.min(upper, Math.max(lower, result[i]));
            }
        }
        return result;
    }

    public static double[] scale(double[] values, double factor) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] * factor;
        }
        return result;
    }

    public static double lastValid(double[] values) {
        for (int i = values.length - 1; i >= 0; i--) {
            if (!Double.isNaN(values[i])) {
                return values[i];
            }
        }
        return Double.NaN;
    }

    private static void requireWindow(int window, int minPeriods) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1, got " + window);
        }
        if (minPeriods < 0) {
            throw new IllegalArgumentException("minPeriods must not be negative, got " + minPeriods);
        }
    }

    private SeriesMath() {
        throw new UnsupportedOperationException("Utility class");
    }
}
