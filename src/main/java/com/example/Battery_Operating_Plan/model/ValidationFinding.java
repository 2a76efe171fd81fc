package com.example.Battery_Operating_Plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single validator result. {@code hour} is null for plan-level findings.
 */
public final class ValidationFinding {

    private final FindingType type;
    private final Integer hour;
    private final String message;
    private final Severity severity;

    @JsonCreator
    public ValidationFinding(@JsonProperty("type") FindingType type,
                             @JsonProperty("hour") Integer hour,
                             @JsonProperty("message") String message) {
        this.type = Objects.requireNonNull(type, "Finding type cannot be null");
        this.hour = hour;
        this.message = message;
        this.severity = type.getSeverity();
    }

    public static ValidationFinding atHour(FindingType type, int hour, String message) {
        return new ValidationFinding(type, hour, message);
    }

    public static ValidationFinding forPlan(FindingType type, String message) {
        return new ValidationFinding(type, null, message);
    }

    public FindingType getType() { return type; }
    public Integer getHour() { return hour; }
    public String getMessage() { return message; }
    public Severity getSeverity() { return severity; }

    @Override
    public String toString() {
        return String.format("%s[%s]%s: %s", severity, type, hour != null ? " hour " + hour : "", message);
    }
}
