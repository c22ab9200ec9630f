package batteryhealth.prediction;

import batteryhealth.domain.DeviceStatus;
import batteryhealth.domain.RulEstimate;

import java.time.Instant;
import java.util.List;

/**
 * SoH forecast and remaining useful life of one device. All numbers are finite.
 *
 * @param sohPred last predicted SoH as a fraction
 * @param sohPredPct the same in percent
 * @param expiryDate date the battery is expected to reach end of life
 * @param sohSeries observed vs predicted SoH for every window
 */
public record PredictionResult(
        String deviceId,
        DeviceStatus status,
        String message,
        double sohPred,
        double sohPredPct,
        RulEstimate rul,
        Instant expiryDate,
        List<SohPredictionPoint> sohSeries
) {

    public static PredictionResult insufficient(String deviceId, String message) {
        return new PredictionResult(deviceId, DeviceStatus.INSUFFICIENT_DATA, message, 0.0, 0.0,
                RulEstimate.ZERO, null, List.of());
    }

    public boolean isOk() {
        return status == DeviceStatus.OK;
    }
}
