package batteryhealth.output;

import batteryhealth.domain.PipelineReport;

/**
 * Interface for pipeline report destinations.
 * Implementations handle formatting and delivery to a specific sink.
 */
public interface HealthOutput {
    /**
     * Deliver a pipeline report.
     *
     * @param report the report to send
     * @throws RuntimeException if sending fails
     */
    void send(PipelineReport report);

    /**
     * Initialize the output if needed.
     * Called before first use.
     */
    default void initialize() {
        // Default no-op implementation
    }

    /**
     * Close and cleanup resources.
     * Should be idempotent.
     */
    void close();
}
