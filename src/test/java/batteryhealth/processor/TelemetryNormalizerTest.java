package batteryhealth.processor;

import batteryhealth.domain.DeviceSeries;
import batteryhealth.domain.NormalizedTelemetry;
import batteryhealth.domain.TelemetrySample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static batteryhealth.support.TelemetryFixtures.sample;
import static org.assertj.core.api.Assertions.*;

class TelemetryNormalizerTest {

    private final TelemetryNormalizer normalizer = new TelemetryNormalizer();

    @Test
    @DisplayName("Should group by device and sort each device by timestamp")
    void testGroupAndSort() {
        List<TelemetrySample> samples = List.of(
                sample("phone-b", "2024-05-01T00:20:00Z", 3000.0, null, 50),
                sample("phone-a", "2024-05-01T00:10:00Z", 2000.0, null, 40),
                sample("phone-b", "2024-05-01T00:00:00Z", 1000.0, null, 30),
                sample("phone-a", "2024-05-01T00:00:00Z", 4000.0, null, 60)
        );

        NormalizedTelemetry result = normalizer.normalize(samples);

        assertThat(result.devices()).containsOnlyKeys("phone-a", "phone-b");
        assertThat(result.devices().keySet()).containsExactly("phone-a", "phone-b");
        assertThat(result.droppedSamples()).isZero();

        DeviceSeries b = result.devices().get("phone-b");
        assertThat(b.timestamps()).containsExactly(
                Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-01T00:20:00Z"));
        assertThat(b.chargeCounterUah()).containsExactly(1000.0, 3000.0);
        assertThat(b.batteryLevel()).containsExactly(30.0, 50.0);
    }

    @Test
    @DisplayName("Should compute elapsed seconds with NaN first and zero for long gaps")
    void testDeltaT() {
        List<TelemetrySample> samples = List.of(
                sample("phone", "2024-05-01T00:00:00Z", null, null, 50),
                sample("phone", "2024-05-01T00:10:00Z", null, null, 50),
                sample("phone", "2024-05-01T03:10:00Z", null, null, 50),
                sample("phone", "2024-05-01T03:10:30Z", null, null, 50)
        );

        double[] deltaT = normalizer.normalize(samples).devices().get("phone").deltaTSeconds();

        assertThat(deltaT[0]).isNaN();
        assertThat(deltaT[1]).isEqualTo(600.0);
        assertThat(deltaT[2]).isZero();
        assertThat(deltaT[3]).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Should keep missing measurements as NaN")
    void testMissingMeasurements() {
        DeviceSeries series = normalizer.normalize(List.of(
                new TelemetrySample("phone", "2024-05-01T00:00:00Z", null, null, null, null, null,
                        null, null, null))).devices().get("phone");

        assertThat(series.chargeCounterUah()[0]).isNaN();
        assertThat(series.batteryLevel()[0]).isNaN();
        assertThat(series.txTotalBytes()[0]).isNaN();
        assertThat(series.foregroundPackages()).containsExactly((String) null);
    }

    @Test
    @DisplayName("Should drop samples without device id or with an unparseable timestamp")
    void testDropsInvalidSamples() {
        List<TelemetrySample> samples = List.of(
                sample(null, "2024-05-01T00:00:00Z", 1.0, null, 50),
                sample(" ", "2024-05-01T00:00:00Z", 1.0, null, 50),
                sample("phone", "yesterday", 1.0, null, 50),
                sample("phone", null, 1.0, null, 50),
                sample("phone", "2024-05-01T00:00:00Z", 1.0, null, 50)
        );

        NormalizedTelemetry result = normalizer.normalize(samples);

        assertThat(result.droppedSamples()).isEqualTo(4);
        assertThat(result.devices().get("phone").size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return an empty result for an empty batch")
    void testEmptyBatch() {
        NormalizedTelemetry result = normalizer.normalize(List.of());

        assertThat(result.isEmpty()).isTrue();
        assertThat(normalizer.normalizeDevice("phone", List.of())).isEmpty();
    }

    @Test
    @DisplayName("Should parse the supported timestamp formats")
    void testTimestampFormats() {
        Instant expected = Instant.parse("2024-05-01T12:30:00Z");

        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01T12:30:00Z")).contains(expected);
        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01T14:30:00+02:00")).contains(expected);
        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01 12:30:00")).contains(expected);
        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01T12:30:00")).contains(expected);
        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01 12:30:00.250"))
                .contains(expected.plusMillis(250));
        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01 12:30:00+00:00")).contains(expected);
        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01 12:30:00+00")).contains(expected);
        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01 14:30:00+0200")).contains(expected);
        assertThat(TelemetryNormalizer.parseTimestamp("2024-05-01 10:30:00.5-02")).contains(expected.plusMillis(500));
        assertThat(TelemetryNormalizer.parseTimestamp(String.valueOf(expected.getEpochSecond())))
                .contains(expected);
        assertThat(TelemetryNormalizer.parseTimestamp("not a date")).isEmpty();
        assertThat(TelemetryNormalizer.parseTimestamp("")).isEmpty();
    }

    @Test
    @DisplayName("Should keep arrival order for equal timestamps")
    void testStableSort() {
        List<TelemetrySample> samples = List.of(
                sample("phone", "2024-05-01T00:00:00Z", 1.0, null, 50),
                sample("phone", "2024-05-01T00:00:00Z", 2.0, null, 50)
        );

        DeviceSeries series = normalizer.normalize(samples).devices().get("phone");

        assertThat(series.chargeCounterUah()).containsExactly(1.0, 2.0);
        assertThat(series.deltaTSeconds()[1]).isZero();
    }
}
