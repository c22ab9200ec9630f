package batteryhealth.processor;

/**
 * Coercion of NaN and infinite values at output boundaries.
 */
public final class NumericGuards {

    /**
     * @return {@code value} when finite, {@code fallback} otherwise
     */
    public static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }

    /**
     * @return {@code value} boxed when finite, {@code null} otherwise
     */
    public static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private NumericGuards() {
        throw new UnsupportedOperationException("Utility class");
    }
}
