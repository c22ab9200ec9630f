package batteryhealth.domain;

/**
 * Remaining useful life expressed in cycles and in calendar units. Never negative.
 */
public record RulEstimate(double cycles, double hours, double months, double years) {

    public static final RulEstimate ZERO = new RulEstimate(0.0, 0.0, 0.0, 0.0);
}
