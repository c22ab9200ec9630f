package batteryhealth.processor;

import batteryhealth.domain.DeviceSeries;
import batteryhealth.domain.TelemetrySample;
import batteryhealth.domain.ThroughputEnergyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static batteryhealth.support.TelemetryFixtures.series;
import static org.assertj.core.api.Assertions.*;

class ThroughputEnergyCalculatorTest {

    private final ThroughputEnergyCalculator calculator = new ThroughputEnergyCalculator();

    @Test
    @DisplayName("Should compute throughput from byte counter deltas")
    void testThroughput() {
        DeviceSeries series = series(List.of(
                traffic("2024-05-01T00:00:00Z", 0L, 0L),
                traffic("2024-05-01T00:00:10Z", 1000L, 500L),
                traffic("2024-05-01T00:00:20Z", 3000L, 1500L)));

        List<ThroughputEnergyRecord> records = calculator.calculate(series);

        assertThat(records).hasSize(2);
        assertThat(records.get(0).throughputTotalMbps()).isCloseTo(0.0012, within(1e-12));
        assertThat(records.get(1).throughputTotalMbps()).isCloseTo(0.0024, within(1e-12));
        assertThat(records.get(0).throughputUploadMbps()).isCloseTo(0.0008, within(1e-12));
        assertThat(records.get(0).throughputDownloadMbps()).isCloseTo(0.0004, within(1e-12));
        assertThat(records.get(0).throughputTotalBps()).isCloseTo(1200.0, within(1e-9));
        assertThat(records.get(0).deltaTSeconds()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should derive energy, energy per bit and BoT for each interval")
    void testEnergy() {
        DeviceSeries series = series(List.of(
                traffic("2024-05-01T00:00:00Z", 0L, 0L),
                traffic("2024-05-01T00:00:10Z", 1000L, 500L)));

        ThroughputEnergyRecord record = calculator.calculate(series).get(0);

        double tx = (446.0 / 1200.0 + 3.381132) * 1e-9;
        double rx = (357.5443 / 1200.0 + 1.969068) * 1e-9;
        assertThat(record.batteryVoltageV()).isCloseTo(3.9, within(1e-12));
        assertThat(record.energyWh()).isCloseTo(3.9 * -0.5 * 10 / 3600.0, within(1e-12));
        assertThat(record.energyPerBitTxJ()).isCloseTo(tx, within(1e-18));
        assertThat(record.energyPerBitRxJ()).isCloseTo(rx, within(1e-18));
        assertThat(record.energyPerBitAvgJ()).isCloseTo((tx + rx) / 2, within(1e-18));
        assertThat(record.botMahPerGbps())
                .isCloseTo((tx + rx) / 2 * 8e9 / 3.9 * (1000.0 / 3600.0), within(1e-9));
    }

    @Test
    @DisplayName("Should treat zero throughput as missing energy per bit")
    void testZeroThroughput() {
        DeviceSeries series = series(List.of(
                traffic("2024-05-01T00:00:00Z", 500L, 500L),
                traffic("2024-05-01T00:00:10Z", 500L, 500L)));

        ThroughputEnergyRecord record = calculator.calculate(series).get(0);

        assertThat(record.throughputTotalMbps()).isZero();
        assertThat(record.energyPerBitAvgJ()).isNaN();
        assertThat(record.botMahPerGbps()).isNaN();
    }

    @Test
    @DisplayName("Should skip samples without counters and intervals longer than an hour")
    void testSkippedIntervals() {
        DeviceSeries series = series(List.of(
                traffic("2024-05-01T00:00:00Z", 0L, 0L),
                traffic("2024-05-01T00:00:10Z", null, null),
                traffic("2024-05-01T00:00:20Z", 800L, 200L),
                traffic("2024-05-01T02:00:20Z", 1600L, 400L)));

        List<ThroughputEnergyRecord> records = calculator.calculate(series);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).deltaTSeconds()).isEqualTo(20.0);
        assertThat(records.get(0).throughputTotalBps()).isCloseTo(400.0, within(1e-9));
    }

    @Test
    @DisplayName("Should return no records without two samples carrying counters")
    void testNoRecords() {
        DeviceSeries series = series(List.of(traffic("2024-05-01T00:00:00Z", 0L, 0L)));

        assertThat(calculator.calculate(series)).isEmpty();
    }

    @Test
    @DisplayName("Energy per bit should approach the fixed cost at high throughput")
    void testEnergyPerBitCurve() {
        double[] low = ThroughputEnergyCalculator.energyPerBit(1e3);
        double[] high = ThroughputEnergyCalculator.energyPerBit(1e9);

        assertThat(low[0]).isGreaterThan(high[0]);
        assertThat(high[0]).isCloseTo(3.381132e-9, within(1e-12));
        assertThat(ThroughputEnergyCalculator.botMahPerGbps(1e-9, 0.0)).isNaN();
    }

    private static TelemetrySample traffic(String timestamp, Long tx, Long rx) {
        return new TelemetrySample("phone-1", timestamp, null, -500_000.0, 80, 3900.0, 31.0, tx, rx, null);
    }
}
