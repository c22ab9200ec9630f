package batteryhealth.processor;

import batteryhealth.config.PipelineConfig;
import batteryhealth.domain.CapacitySource;
import batteryhealth.domain.DeviceSeries;
import batteryhealth.domain.SohSeries;
import batteryhealth.domain.TelemetrySample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static batteryhealth.support.TelemetryFixtures.*;
import static org.assertj.core.api.Assertions.*;

class CapacityEstimatorTest {

    private final CapacityEstimator estimator = new CapacityEstimator(PipelineConfig.defaults());

    @Test
    @DisplayName("Should place the block's 95th percentile charge at its peak sample")
    void testFullChargeBlockCapacity() {
        double[] chargeMah = {3000, 3500, 3900, 4000, 3950, 3800};
        int[] levels = {80, 90, 100, 100, 100, 95};

        SohSeries soh = estimator.estimate(series(counterSamples("phone-1", chargeMah, levels)));

        assertThat(soh.source()).isEqualTo(CapacitySource.CHARGE_COUNTER);
        assertThat(soh.fullChargeBlocks()).isEqualTo(1);
        assertThat(soh.capacityMah()[2]).isNaN();
        assertThat(soh.capacityMah()[3]).isCloseTo(3995.0, within(1e-9));
        assertThat(soh.capacityMah()[5]).isCloseTo(3995.0, within(1e-9));
        assertThat(soh.referenceCapacityMah()).isCloseTo(3995.0, within(1e-9));
        assertThat(soh.soh()[4]).isCloseTo(1.0, within(1e-12));
        assertThat(soh.soh()[0]).isNaN();
        assertThat(soh.sohSmooth()[2]).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should give SoH 1.0 for a battery charging to its full capacity every cycle")
    void testSawtoothDevice() {
        SohSeries soh = estimator.estimate(series(sawtoothDevice("phone-1", 60, 4000)));

        assertThat(soh.fullChargeBlocks()).isEqualTo(3);
        assertThat(soh.referenceCapacityMah()).isCloseTo(4000.0, within(1e-9));
        assertThat(Arrays.stream(soh.soh()).allMatch(v -> Math.abs(v - 1.0) < 1e-12)).isTrue();
        assertThat(Arrays.stream(soh.sohSmooth()).allMatch(v -> Math.abs(v - 1.0) < 1e-12)).isTrue();
    }

    @Test
    @DisplayName("Should flip a charge counter reported with a discharge sign")
    void testSignInversion() {
        List<TelemetrySample> negative = new ArrayList<>();
        for (TelemetrySample s : sawtoothDevice("phone-1", 40, 4000)) {
            negative.add(new TelemetrySample(s.deviceId(), s.timestamp(), -s.chargeCounterUah(),
                    s.currentAvgUa(), s.batteryLevel(), s.battVoltageMv(), s.battTempC(),
                    s.txTotalBytes(), s.rxTotalBytes(), s.foregroundPackage()));
        }

        SohSeries soh = estimator.estimate(series(negative));

        assertThat(soh.chargeMah()[0]).isCloseTo(4000.0, within(1e-9));
        assertThat(soh.rawChargeMah()[0]).isCloseTo(-4000.0, within(1e-9));
        assertThat(soh.referenceCapacityMah()).isCloseTo(4000.0, within(1e-9));
        assertThat(soh.soh()[10]).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should integrate current when no charge counter is reported")
    void testCurrentIntegrationFallback() {
        List<TelemetrySample> samples = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            samples.add(sample("phone-1", at(i), null, -1_000_000.0, 50));
        }

        SohSeries soh = estimator.estimate(series(samples));

        assertThat(soh.source()).isEqualTo(CapacitySource.INTEGRATED_CURRENT);
        assertThat(soh.hasCapacitySource()).isTrue();
        // 1 A for 10 minutes per step, curve shifted so the lowest point is 0
        assertThat(soh.chargeMah()[0]).isCloseTo(1500.0, within(1e-6));
        assertThat(soh.chargeMah()[9]).isCloseTo(0.0, within(1e-6));
        assertThat(soh.capacityMah()[0]).isNaN();
        assertThat(soh.capacityMah()[2]).isCloseTo(1500.0, within(1e-6));
        for (int i = 2; i < 10; i++) {
            assertThat(soh.soh()[i]).isBetween(0.0, 1.2);
        }
    }

    @Test
    @DisplayName("Should report no capacity source when neither counter nor current exists")
    void testNoSource() {
        DeviceSeries series = series(sourcelessDevice("phone-1", 5));

        SohSeries soh = estimator.estimate(series);

        assertThat(soh.source()).isEqualTo(CapacitySource.NONE);
        assertThat(soh.hasCapacitySource()).isFalse();
        assertThat(soh.size()).isEqualTo(5);
        assertThat(soh.referenceCapacityMah()).isNaN();
        assertThat(Arrays.stream(soh.soh()).allMatch(Double::isNaN)).isTrue();
    }

    @Test
    @DisplayName("Should clamp the reference capacity around a known nominal capacity")
    void testNominalClamp() {
        PipelineConfig config = PipelineConfig.builder()
                .nominalCapacityTable(Map.of("SM-A556E", 5000.0))
                .build();
        CapacityEstimator withNominal = new CapacityEstimator(config);

        SohSeries soh = withNominal.estimate(series(sawtoothDevice("SM-A556E-7ecd17", 40, 4000)));

        assertThat(soh.referenceCapacityMah()).isCloseTo(4750.0, within(1e-9));
        assertThat(soh.capacityMah()[0]).isCloseTo(4000.0, within(1e-9));
        assertThat(soh.soh()[0]).isCloseTo(4000.0 / 4750.0, within(1e-12));
    }

    @Test
    @DisplayName("Should clip capacity estimates to 70-115 % of the nominal capacity")
    void testCapacityClip() {
        PipelineConfig config = PipelineConfig.builder()
                .nominalCapacityTable(Map.of("phone-1", 5000.0))
                .build();

        SohSeries soh = new CapacityEstimator(config).estimate(series(sawtoothDevice("phone-1", 40, 2000)));

        assertThat(soh.capacityMah()[0]).isCloseTo(3500.0, within(1e-9));
        assertThat(soh.referenceCapacityMah()).isCloseTo(4750.0, within(1e-9));
    }

    @Test
    @DisplayName("Should label full-charge runs with change-counting ids")
    void testDetectFullChargeBlocks() {
        double[] levels = {50, 100, 100, 50, 99, 98, Double.NaN};

        double[] blocks = estimator.detectFullChargeBlocks(levels);

        assertThat(blocks).containsExactly(Double.NaN, 2.0, 2.0, Double.NaN, 4.0, Double.NaN, Double.NaN);
    }

    @Test
    @DisplayName("Should never require a full level below 98")
    void testFullLevelFloor() {
        CapacityEstimator lowThreshold = new CapacityEstimator(
                PipelineConfig.builder().fullChargeThreshold(90).build());

        double[] blocks = lowThreshold.detectFullChargeBlocks(new double[]{97, 98, 99});

        assertThat(blocks).containsExactly(Double.NaN, 2.0, 2.0);
    }

    @Test
    @DisplayName("Should drop estimates above the 99th percentile before taking the reference")
    void testReferenceCapacityOutlier() {
        double[] capacity = {4000, 4000, 4000, 4000, 4000, 4000, 4000, 4000, 4000, 10000};

        assertThat(estimator.referenceCapacity(capacity, OptionalDouble.empty())).isEqualTo(4000.0);
    }

    @Test
    @DisplayName("Should fall back to nominal, then default capacity")
    void testReferenceCapacityFallbacks() {
        double[] none = {Double.NaN, Double.NaN};

        assertThat(estimator.referenceCapacity(none, OptionalDouble.of(4500))).isEqualTo(4500.0);
        assertThat(estimator.referenceCapacity(none, OptionalDouble.empty())).isEqualTo(5000.0);
        assertThat(estimator.referenceCapacity(new double[]{-10, -20}, OptionalDouble.empty()))
                .isEqualTo(5000.0);
    }

    private static List<TelemetrySample> counterSamples(String deviceId, double[] chargeMah, int[] levels) {
        List<TelemetrySample> samples = new ArrayList<>();
        for (int i = 0; i < chargeMah.length; i++) {
            samples.add(sample(deviceId, at(i), chargeMah[i] * 1000.0, null, levels[i]));
        }
        return samples;
    }
}
