package batteryhealth.prediction;

/**
 * Column-wise transform fitted offline and applied to every window before the model sees it.
 */
public interface FeatureScaler {

    /**
     * Scale one window.
     *
     * @param window {@code rows x features} matrix; not modified
     * @return the scaled copy
     */
    double[][] transform(double[][] window);

    /**
     * Scaler that returns an unchanged copy.
     */
    static FeatureScaler identity() {
        return window -> {
            double[][] copy = new double[window.length][];
            for (int i = 0; i < window.length; i++) {
                copy[i] = window[i].clone();
            }
            return copy;
        };
    }
}
