package batteryhealth.domain;

/**
 * Signal the charge curve of a device was derived from.
 */
public enum CapacitySource {
    CHARGE_COUNTER,
    INTEGRATED_CURRENT,
    NONE
}
