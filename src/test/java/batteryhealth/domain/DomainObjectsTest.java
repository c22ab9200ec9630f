package batteryhealth.domain;

import batteryhealth.config.PipelineConfig;
import batteryhealth.processor.FeaturePipeline;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static batteryhealth.support.TelemetryFixtures.sawtoothDevice;
import static batteryhealth.support.TelemetryFixtures.sourcelessDevice;
import static org.assertj.core.api.Assertions.*;

class DomainObjectsTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    @DisplayName("Should serialise a report to JSON without NaN values")
    void testReportToJson() throws Exception {
        List<TelemetrySample> samples = new ArrayList<>(sawtoothDevice("phone-a", 30, 4000));
        samples.addAll(sourcelessDevice("phone-b", 5));
        PipelineReport report = new FeaturePipeline(PipelineConfig.defaults()).run(samples);

        String json = report.toJSON();

        assertThat(json).doesNotContain("NaN").doesNotContain("Infinity");
        JsonNode root = new ObjectMapper().readTree(json);
        assertThat(root.has("generatedAt")).isTrue();
        assertThat(root.get("droppedSamples").asInt()).isZero();
        assertThat(root.get("devices")).hasSize(2);
        assertThat(root.get("devices").get(0).get("deviceId").asText()).isEqualTo("phone-a");
        assertThat(root.get("devices").get(1).get("status").asText()).isEqualTo("INSUFFICIENT_DATA");
        assertThat(root.get("devices").get(1).get("referenceCapacityMah").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should split devices into processed and excluded")
    void testReportViews() {
        List<TelemetrySample> samples = new ArrayList<>(sawtoothDevice("phone-a", 30, 4000));
        samples.addAll(sourcelessDevice("phone-b", 5));
        PipelineReport report = new FeaturePipeline(PipelineConfig.defaults()).run(samples);

        assertThat(report.okDevices()).isEqualTo(1);
        assertThat(report.processed()).extracting(DeviceReport::deviceId).containsExactly("phone-a");
        assertThat(report.excluded()).extracting(DeviceReport::deviceId).containsExactly("phone-b");
        assertThat(report.device("phone-z")).isEmpty();
        assertThat(report.totalWindows()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should not expose the window matrix to callers")
    void testWindowDeepCopy() {
        double[][] matrix = {{1.0, 2.0}, {3.0, 4.0}};
        Window window = new Window("phone-a", matrix, T0, 0.95, 1.5);

        matrix[0][0] = 99.0;
        window.features()[1][1] = 99.0;

        assertThat(window.features()[0][0]).isEqualTo(1.0);
        assertThat(window.features()[1][1]).isEqualTo(4.0);
        assertThat(window.length()).isEqualTo(2);
        assertThat(window.featureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should compare windows by content")
    void testWindowEquality() {
        Window window = new Window("phone-a", new double[][]{{1.0, 2.0}, {3.0, 4.0}}, T0, 0.95, 1.5);
        Window same = new Window("phone-a", new double[][]{{1.0, 2.0}, {3.0, 4.0}}, T0, 0.95, 1.5);
        Window otherCell = new Window("phone-a", new double[][]{{1.0, 2.0}, {3.0, 4.5}}, T0, 0.95, 1.5);
        Window otherTarget = new Window("phone-a", new double[][]{{1.0, 2.0}, {3.0, 4.0}}, T0, 0.90, 1.5);

        assertThat(window).isEqualTo(same).hasSameHashCodeAs(same);
        assertThat(window).isNotEqualTo(otherCell).isNotEqualTo(otherTarget);
        assertThat(window.toString()).contains("phone-a").contains("rows=2");
    }

    @Test
    @DisplayName("Should read absent feature columns as missing and reject misaligned ones")
    void testFeatureTable() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("soh", new double[]{1.0, 0.99});
        FeatureTable table = new FeatureTable("phone-a", List.of(T0, T0.plusSeconds(600)), columns);

        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.value("soh", 1)).isEqualTo(0.99);
        assertThat(Arrays.stream(table.column("efc")).allMatch(Double::isNaN)).isTrue();
        assertThat(Double.isNaN(table.value("efc", 0))).isTrue();

        FeatureTable extended = table.withColumn("efc", new double[]{0.0, 0.1});
        assertThat(extended.columnNames()).containsExactly("soh", "efc");
        assertThat(table.hasColumn("efc")).isFalse();

        assertThatThrownBy(() -> table.withColumn("bad", new double[]{1.0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Column bad has 1 rows");
    }

    @Test
    @DisplayName("Should describe a device without a capacity source as all missing")
    void testInsufficientSohSeries() {
        SohSeries series = SohSeries.insufficient(3);

        assertThat(series.hasCapacitySource()).isFalse();
        assertThat(series.size()).isEqualTo(3);
        assertThat(series.fullChargeBlocks()).isZero();
        assertThat(Double.isNaN(series.referenceCapacityMah())).isTrue();
        assertThat(Arrays.stream(series.sohPct()).allMatch(Double::isNaN)).isTrue();
    }

    @Test
    @DisplayName("Should report the last accumulated cycle count")
    void testCycleSeriesTotal() {
        CycleSeries cycles = new CycleSeries(new double[3], new double[3], new double[]{0.0, 0.4, Double.NaN});
        CycleSeries empty = new CycleSeries(new double[0], new double[0], new double[0]);

        assertThat(cycles.totalEfc()).isEqualTo(0.4);
        assertThat(Double.isNaN(empty.totalEfc())).isTrue();
        assertThat(RulEstimate.ZERO.cycles()).isZero();
    }
}
