package batteryhealth.domain;

/**
 * Per-sample discharge accounting for one device.
 *
 * @param deltaQMah change of the charge curve since the previous sample, 0 where undefined
 * @param dischargeMah charge removed by the sample, capped at the series' 99th percentile
 * @param efc equivalent full cycles accumulated up to and including the sample
 */
public record CycleSeries(double[] deltaQMah, double[] dischargeMah, double[] efc) {

    public double totalEfc() {
        for (int i = efc.length - 1; i >= 0; i--) {
            if (!Double.isNaN(efc[i])) {
                return efc[i];
            }
        }
        return Double.NaN;
    }
}
