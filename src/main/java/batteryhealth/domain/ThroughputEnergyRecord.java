package batteryhealth.domain;

import java.time.Instant;

/**
 * Network throughput and energy figures derived from one pair of consecutive samples.
 * Keyed by the timestamp of the later sample.
 */
public record ThroughputEnergyRecord(
        Instant timestamp,
        double deltaTSeconds,
        double throughputUploadMbps,
        double throughputDownloadMbps,
        double throughputTotalMbps,
        double throughputTotalBps,
        double batteryVoltageV,
        double batteryTempC,
        double energyWh,
        double energyPerBitTxJ,
        double energyPerBitRxJ,
        double energyPerBitAvgJ,
        double botMahPerGbps
) {
}
