package com.example.Battery_Operating_Plan.model;

/**
 * Categories reported by the COP validator, grouped by check family
 */
public enum FindingType {

    // SOC feasibility
    SOC_INFEASIBLE_CHARGE(Severity.ERROR),
    SOC_INFEASIBLE_DISCHARGE(Severity.ERROR),

    // SOC bounds
    SOC_BELOW_MIN(Severity.ERROR),
    SOC_ABOVE_MAX(Severity.ERROR),
    SOC_MIN_INCONSISTENT(Severity.WARNING),
    SOC_MAX_INCONSISTENT(Severity.WARNING),

    // Ramp rate
    RAMP_RATE_EXCEEDED(Severity.WARNING),

    // Ancillary service sufficiency
    INSUFFICIENT_SOC_FOR_RRS(Severity.WARNING),
    INSUFFICIENT_SOC_FOR_ECRS(Severity.WARNING),

    // Completeness
    MISSING_FIELDS(Severity.ERROR),
    NULL_VALUES(Severity.ERROR),

    // Horizon and hour sequence
    INSUFFICIENT_HORIZON(Severity.WARNING),
    HOUR_SEQUENCE_INVALID(Severity.ERROR);

    private final Severity severity;

    FindingType(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
