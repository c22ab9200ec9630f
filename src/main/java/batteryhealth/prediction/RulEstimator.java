package batteryhealth.prediction;

import batteryhealth.config.PipelineConfig;
import batteryhealth.config.PipelineConfigurationException;
import batteryhealth.domain.RulEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remaining useful life from a predicted SoH under a linear fade model:
 * {@code cycles = max((soh - sohEol) / kGlobal, 0)}.
 */
public class RulEstimator {
    private static final Logger logger = LoggerFactory.getLogger(RulEstimator.class);

    private final double kGlobal;
    private final double sohEol;
    private final double hoursPerCycle;

    /**
     * @param kGlobal SoH lost per equivalent full cycle
     * @param sohEol end-of-life SoH as a fraction
     * @param hoursPerCycle wall-clock hours one cycle takes
     */
    public RulEstimator(double kGlobal, double sohEol, double hoursPerCycle) {
        if (!(kGlobal > 0) || Double.isInfinite(kGlobal)) {
            throw new PipelineConfigurationException("k_global must be a positive number, got " + kGlobal);
        }
        if (!(sohEol > 0) || sohEol > 1.2) {
            throw new PipelineConfigurationException("soh_eol must be in (0, 1.2], got " + sohEol);
        }
        if (!(hoursPerCycle > 0) || Double.isInfinite(hoursPerCycle)) {
            throw new PipelineConfigurationException("hours_per_cycle must be a positive number, got "
                    + hoursPerCycle);
        }
        this.kGlobal = kGlobal;
        this.sohEol = sohEol;
        this.hoursPerCycle = hoursPerCycle;
    }

    public RulEstimator(PipelineConfig config) {
        this(config.rulKGlobal(), config.rulSohEol(), config.rulHoursPerCycle());
    }

    /**
     * @param sohPred predicted SoH as a fraction (not percent)
     * @return the estimate; zero at or below end of life, and zero for a non-finite prediction
     */
    public RulEstimate estimate(double sohPred) {
        if (!Double.isFinite(sohPred)) {
            logger.warn("Non-finite SoH prediction {}, reporting zero remaining life", sohPred);
            return RulEstimate.ZERO;
        }
        if (sohPred <= sohEol) {
            return RulEstimate.ZERO;
        }
        double cycles = (sohPred - sohEol) / kGlobal;
        double hours = cycles * hoursPerCycle;
        double days = hours / 24.0;
        return new RulEstimate(cycles, hours, days / 30.0, days / 365.0);
    }

    public double kGlobal() {
        return kGlobal;
    }

    public double sohEol() {
        return sohEol;
    }

    public double hoursPerCycle() {
        return hoursPerCycle;
    }
}
