package batteryhealth.domain;

import java.time.Instant;

/**
 * One point of the SoH/EFC summary series. Missing values are {@code null}.
 */
public record SohPoint(Instant timestamp, Double sohPct, Double sohSmoothPct, Double efc) {
}
