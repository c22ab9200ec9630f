package batteryhealth.prediction;

/**
 * Sequence model forecasting SoH from scaled feature windows.
 * Implementations wrap a model trained elsewhere; none ships with the pipeline.
 */
@FunctionalInterface
public interface SohModel {

    /**
     * @param windows {@code windows x rows x features}, already scaled
     * @return one predicted SoH fraction per window, in input order
     */
    double[] predict(double[][][] windows);
}
