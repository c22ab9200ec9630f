package batteryhealth.domain;

import java.util.List;

/**
 * Compact SoH/EFC view of one device, safe to serialise (no NaN or infinite values).
 */
public record SohSummary(
        String deviceId,
        DeviceStatus status,
        String reason,
        CapacitySource source,
        Double referenceCapacityMah,
        int fullChargeBlocks,
        Double latestSohPct,
        Double latestSohSmoothPct,
        Double totalEfc,
        int windows,
        List<SohPoint> series
) {
}
