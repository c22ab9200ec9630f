package batteryhealth.domain;

import java.util.Arrays;

/**
 * Output of capacity estimation for one device, aligned index by index with its {@link DeviceSeries}.
 *
 * @param source where the charge curve came from
 * @param chargeMah filtered charge curve Q (mAh), NaN where rejected or missing
 * @param rawChargeMah charge curve before outlier rejection
 * @param capacityMah forward-filled capacity estimate Ct (mAh)
 * @param referenceCapacityMah C0_ref, NaN when no charge source exists
 * @param soh Ct / C0_ref clipped to [0, 1.2]
 * @param sohSmooth centered rolling median of {@code soh}
 * @param fullBlockId id of the full-charge block a sample belongs to, NaN outside blocks
 * @param fullChargeBlocks number of full-charge blocks detected
 */
public record SohSeries(
        CapacitySource source,
        double[] chargeMah,
        double[] rawChargeMah,
        double[] capacityMah,
        double referenceCapacityMah,
        double[] soh,
        double[] sohSmooth,
        double[] fullBlockId,
        int fullChargeBlocks
) {

    /**
     * Series of missing values used when a device reports neither charge counter nor current.
     */
    public static SohSeries insufficient(int size) {
        return new SohSeries(CapacitySource.NONE, nan(size), nan(size), nan(size), Double.NaN,
                nan(size), nan(size), nan(size), 0);
    }

    public boolean hasCapacitySource() {
        return source != CapacitySource.NONE;
    }

    public int size() {
        return soh.length;
    }

    public double[] sohPct() {
        return percent(soh);
    }

    public double[] sohSmoothPct() {
        return percent(sohSmooth);
    }

    private static double[] percent(double[] fraction) {
        double[] pct = new double[fraction.length];
        for (int i = 0; i < pct.length; i++) {
            pct[i] = fraction[i] * 100.0;
        }
        return pct;
    }

    private static double[] nan(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
