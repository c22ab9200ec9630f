package batteryhealth.prediction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Battery expiry date: now plus the remaining useful life, counting a month as 30 days.
 */
public class ExpiryDateCalculator {

    private static final long SECONDS_PER_MONTH = Duration.ofDays(30).toSeconds();

    private final Clock clock;

    public ExpiryDateCalculator(Clock clock) {
        this.clock = clock;
    }

    public ExpiryDateCalculator() {
        this(Clock.systemUTC());
    }

    /**
     * @param rulMonths remaining life in months; negative or non-finite values count as 0
     */
    public Instant expiryDate(double rulMonths) {
        Instant now = clock.instant();
        if (!Double.isFinite(rulMonths) || rulMonths <= 0) {
            return now;
        }
        long seconds = Math.round(rulMonths * SECONDS_PER_MONTH);
        return now.plusSeconds(seconds);
    }
}
