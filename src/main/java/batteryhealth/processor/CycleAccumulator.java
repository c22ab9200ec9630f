package batteryhealth.processor;

import batteryhealth.domain.CycleSeries;
import batteryhealth.domain.SohSeries;

/**
 * Accumulates discharged charge into equivalent full cycles (EFC).
 * Charging samples contribute nothing, so EFC never decreases along a series.
 */
public class CycleAccumulator {

    public static final double DISCHARGE_CAP_PERCENTILE = 99.0;

    public CycleSeries accumulate(SohSeries soh) {
        return accumulate(soh.chargeMah(), soh.referenceCapacityMah());
    }

    /**
     * @param chargeMah filtered charge curve, NaN where missing
     * @param referenceCapacityMah C0_ref; when it is not a positive number every EFC is NaN
     */
    public CycleSeries accumulate(double[] chargeMah, double referenceCapacityMah) {
        int n = chargeMah.length;
        double[] deltaQ = SeriesMath.fillMissing(SeriesMath.diff(chargeMah), 0.0);

        double[] discharge = new double[n];
        for (int i = 0; i < n; i++) {
            discharge[i] = deltaQ[i] < 0 ? -deltaQ[i] : 0.0;
        }

        // bound single-sample jumps such as counter resets
        double cap = SeriesMath.percentile(discharge, DISCHARGE_CAP_PERCENTILE);
        if (!Double.isNaN(cap)) {
            for (int i = 0; i < n; i++) {
                discharge[i] = Math.min(discharge[i], cap);
            }
        }

        double[] efc;
        if (referenceCapacityMah > 0 && Double.isFinite(referenceCapacityMah)) {
            efc = SeriesMath.scale(SeriesMath.cumulativeSum(discharge), 1.0 / referenceCapacityMah);
        } else {
            efc = SeriesMath.nanArray(n);
        }
        return new CycleSeries(deltaQ, discharge, efc);
    }
}
