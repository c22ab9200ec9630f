package batteryhealth.input;

import batteryhealth.domain.TelemetrySample;

import java.util.List;

/**
 * Interface for telemetry sources.
 * Implementations fetch raw samples from wherever they are stored and hand them over in batches.
 */
public interface TelemetryInput {
    /**
     * Start delivering batches to the listener.
     * @throws RuntimeException if the source cannot be opened
     */
    void start();

    /**
     * Stop delivering batches and release the source.
     */
    void stop();

    /**
     * @return true while the source is delivering
     */
    boolean isRunning();

    /**
     * Set the listener receiving batches.
     * @param listener the batch listener
     */
    void setBatchListener(BatchListener listener);

    /**
     * Callback for each batch of raw samples.
     */
    @FunctionalInterface
    interface BatchListener {
        void onBatchReceived(List<TelemetrySample> samples);
    }
}
