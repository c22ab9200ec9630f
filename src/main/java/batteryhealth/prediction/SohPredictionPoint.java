package batteryhealth.prediction;

import java.time.Instant;

/**
 * Observed and predicted SoH (percent) at a window target.
 */
public record SohPredictionPoint(Instant timestamp, double sohTruePct, double sohPredPct) {
}
