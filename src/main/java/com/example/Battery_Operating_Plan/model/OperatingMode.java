package com.example.Battery_Operating_Plan.model;

/**
 * Planned power direction for one hour (internal planning field, not submitted)
 */
public enum OperatingMode {
    CHARGE,
    DISCHARGE,
    HOLD;

    public static OperatingMode forTarget(double targetMw) {
        if (targetMw > 0) return DISCHARGE;
        if (targetMw < 0) return CHARGE;
        return HOLD;
    }
}
