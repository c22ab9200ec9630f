package batteryhealth.config;

/**
 * Raised when the pipeline is configured with values it cannot run with.
 * Thrown at construction time so a bad setting never surfaces later as a division by zero.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
