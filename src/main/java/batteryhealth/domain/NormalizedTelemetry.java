package batteryhealth.domain;

import java.util.Map;

/**
 * Telemetry partitioned by device: an indexed collection of sorted {@link DeviceSeries}.
 *
 * @param devices series keyed by device id, iterated in device id order
 * @param droppedSamples samples discarded for a missing device id or an unparseable timestamp
 */
public record NormalizedTelemetry(Map<String, DeviceSeries> devices, int droppedSamples) {

    public boolean isEmpty() {
        return devices.isEmpty();
    }
}
