package batteryhealth.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one pipeline run over a batch of telemetry, one {@link DeviceReport} per device
 * in device id order.
 */
public record PipelineReport(
        Instant generatedAt,
        List<DeviceReport> devices,
        int droppedSamples
) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static PipelineReport create(List<DeviceReport> devices, int droppedSamples) {
        return new PipelineReport(Instant.now(), List.copyOf(devices), droppedSamples);
    }

    public Optional<DeviceReport> device(String deviceId) {
        return devices.stream().filter(d -> d.deviceId().equals(deviceId)).findFirst();
    }

    public long okDevices() {
        return devices.stream().filter(DeviceReport::isOk).count();
    }

    public List<DeviceReport> processed() {
        return devices.stream().filter(DeviceReport::isOk).toList();
    }

    /**
     * Devices excluded for insufficient data, each carrying its reason.
     */
    public List<DeviceReport> excluded() {
        return devices.stream().filter(d -> !d.isOk()).toList();
    }

    public int totalWindows() {
        return devices.stream().mapToInt(d -> d.windows().size()).sum();
    }

    public List<SohSummary> summaries() {
        return devices.stream().map(DeviceReport::summary).toList();
    }

    /**
     * JSON view of the report: generation time, dropped samples and the per-device summaries.
     */
    public String toJSON() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("generatedAt", generatedAt);
        view.put("droppedSamples", droppedSamples);
        view.put("devices", summaries());
        try {
            return MAPPER.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise pipeline report", e);
        }
    }
}
