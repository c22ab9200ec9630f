package batteryhealth.domain;

import java.util.List;

/**
 * Everything the feature pipeline derived for one device.
 */
public record DeviceReport(
        String deviceId,
        DeviceStatus status,
        String reason,
        SohSeries soh,
        CycleSeries cycles,
        List<ThroughputEnergyRecord> throughputEnergy,
        FeatureTable features,
        List<Window> windows,
        SohSummary summary
) {

    public boolean isOk() {
        return status == DeviceStatus.OK;
    }
}
