package batteryhealth.domain;

/**
 * Outcome of running the feature pipeline for one device.
 */
public enum DeviceStatus {
    /** Capacity source found and at least one model window built. */
    OK,
    /** Partial result: no capacity source, or too few samples for a window. */
    INSUFFICIENT_DATA
}
