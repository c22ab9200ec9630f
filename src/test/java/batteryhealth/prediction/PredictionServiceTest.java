package batteryhealth.prediction;

import batteryhealth.config.PipelineConfig;
import batteryhealth.domain.DeviceReport;
import batteryhealth.domain.DeviceStatus;
import batteryhealth.domain.FeatureColumns;
import batteryhealth.domain.PipelineReport;
import batteryhealth.domain.RulEstimate;
import batteryhealth.domain.TelemetrySample;
import batteryhealth.processor.FeaturePipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static batteryhealth.support.TelemetryFixtures.sawtoothDevice;
import static batteryhealth.support.TelemetryFixtures.sourcelessDevice;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class PredictionServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    @Mock
    private SohModel mockModel;

    private PredictionService service;
    private PipelineReport report;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        PipelineConfig config = PipelineConfig.builder().windowSize(5).build();
        service = new PredictionService(FeatureScaler.identity(), mockModel, new RulEstimator(config),
                new ExpiryDateCalculator(Clock.fixed(NOW, ZoneOffset.UTC)));

        List<TelemetrySample> samples = new ArrayList<>(sawtoothDevice("phone-a", 10, 4000));
        samples.addAll(sourcelessDevice("phone-b", 10));
        report = new FeaturePipeline(config).run(samples);
    }

    @Test
    @DisplayName("Should predict SoH, remaining life and expiry date from the last window")
    void testPredict() {
        when(mockModel.predict(any())).thenReturn(new double[]{0.95, 0.94, 0.93, 0.92, 0.9});
        DeviceReport device = report.device("phone-a").orElseThrow();

        PredictionResult result = service.predict(device);

        assertThat(result.isOk()).isTrue();
        assertThat(result.message()).isEqualTo("Prediction successful");
        assertThat(result.sohPred()).isEqualTo(0.9);
        assertThat(result.sohPredPct()).isCloseTo(90.0, within(1e-9));
        assertThat(result.rul().cycles()).isCloseTo(1000.0, within(1e-6));
        assertThat(result.expiryDate()).isCloseTo(NOW.plus(Duration.ofDays(1000)), within(1, ChronoUnit.SECONDS));
        assertThat(result.sohSeries()).hasSize(5);
        assertThat(result.sohSeries().get(0).sohPredPct()).isCloseTo(95.0, within(1e-9));
        assertThat(result.sohSeries().get(0).sohTruePct()).isCloseTo(100.0, within(1e-9));
        assertThat(result.sohSeries().get(4).timestamp()).isEqualTo(device.windows().get(4).targetTimestamp());
    }

    @Test
    @DisplayName("Should hand the model one scaled tensor with every window")
    void testModelInput() {
        when(mockModel.predict(any())).thenReturn(new double[5]);

        service.predict(report.device("phone-a").orElseThrow());

        ArgumentCaptor<double[][][]> captor = ArgumentCaptor.forClass(double[][][].class);
        verify(mockModel).predict(captor.capture());
        double[][][] tensor = captor.getValue();
        assertThat(tensor.length).isEqualTo(5);
        assertThat(tensor[0].length).isEqualTo(5);
        assertThat(tensor[0][0].length).isEqualTo(FeatureColumns.MODEL_FEATURE_COLS.size());
    }

    @Test
    @DisplayName("Should return an insufficient-data result without calling the model")
    void testInsufficientData() {
        PredictionResult result = service.predict(report.device("phone-b").orElseThrow());

        assertThat(result.status()).isEqualTo(DeviceStatus.INSUFFICIENT_DATA);
        assertThat(result.message()).isEqualTo("no charge counter or current samples");
        assertThat(result.rul()).isEqualTo(RulEstimate.ZERO);
        assertThat(result.sohSeries()).isEmpty();
        verifyNoInteractions(mockModel);
    }

    @Test
    @DisplayName("Should replace non-finite predictions with zero")
    void testNonFinitePrediction() {
        when(mockModel.predict(any())).thenReturn(new double[]{0.9, 0.9, 0.9, 0.9, Double.NaN});

        PredictionResult result = service.predict(report.device("phone-a").orElseThrow());

        assertThat(result.sohPred()).isZero();
        assertThat(result.rul().cycles()).isZero();
        assertThat(result.expiryDate()).isEqualTo(NOW);
        assertThat(result.sohSeries().get(4).sohPredPct()).isZero();
    }

    @Test
    @DisplayName("Should fail when the model returns the wrong number of predictions")
    void testModelLengthMismatch() {
        when(mockModel.predict(any())).thenReturn(new double[]{0.9});

        assertThatThrownBy(() -> service.predict(report.device("phone-a").orElseThrow()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1 predictions for 5 windows");
    }

    @Test
    @DisplayName("Should predict every device of a report")
    void testPredictAll() {
        when(mockModel.predict(any())).thenReturn(new double[]{0.8, 0.8, 0.8, 0.8, 0.8});

        List<PredictionResult> results = service.predictAll(report);

        assertThat(results).extracting(PredictionResult::deviceId).containsExactly("phone-a", "phone-b");
        assertThat(results).extracting(PredictionResult::status)
                .containsExactly(DeviceStatus.OK, DeviceStatus.INSUFFICIENT_DATA);
    }
}
