package com.seismic.sentinel.monitor.enums;

/**
 * Ordinal severity of a recommendation. Declaration order is the ranking order.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    EXTREME;

    /**
     * Severity of a magnitude against the STRONG and MAJOR breakpoints.
     *
     * @param magnitude observed magnitude
     * @param strong    lower bound of the STRONG bucket
     * @param major     lower bound of the MAJOR bucket
     * @return EXTREME at or above major, HIGH at or above strong, otherwise MEDIUM
     */
    public static Severity forMagnitude(double magnitude, double strong, double major) {
        if (magnitude >= major) {
            return EXTREME;
        } else if (magnitude >= strong) {
            return HIGH;
        } else {
            return MEDIUM;
        }
    }
}
