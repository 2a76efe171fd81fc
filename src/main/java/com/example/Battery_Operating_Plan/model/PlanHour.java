package com.example.Battery_Operating_Plan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * One hourly record of a Current Operating Plan
 *
 * Fields required by the market are boxed so that a plan received from outside
 * (e.g. posted for validation) can be audited for missing values.
 */
public class PlanHour {

    @JsonProperty("hourEnding")
    public LocalDateTime hourEnding;

    @JsonProperty("status")
    public ResourceStatus status;

    // Power envelope (MW)
    @JsonProperty("hsl")
    public Double hsl;

    @JsonProperty("lsl")
    public Double lsl;

    @JsonProperty("hel")
    public Double hel;

    @JsonProperty("lel")
    public Double lel;

    // State of charge (MWh)
    @JsonProperty("socBegin")
    public Double socBegin;

    @JsonProperty("socMin")
    public Double socMin;

    @JsonProperty("socMax")
    public Double socMax;

    // Ramp rates (MW/min)
    @JsonProperty("normalRampUp")
    public Double normalRampUp;

    @JsonProperty("normalRampDown")
    public Double normalRampDown;

    @JsonProperty("emergencyRampUp")
    public Double emergencyRampUp;

    @JsonProperty("emergencyRampDown")
    public Double emergencyRampDown;

    // Internal planning fields
    @JsonProperty("targetMw")
    public Double targetMw; // positive = discharge, negative = charge

    @JsonProperty("mode")
    public OperatingMode mode;

    @JsonProperty("auxLoad")
    public Double auxLoad;

    @JsonProperty("resourceType")
    public String resourceType;

    @JsonProperty("fuelType")
    public String fuelType;

    public PlanHour() {}

    public PlanHour(LocalDateTime hourEnding, ResourceStatus status) {
        this.hourEnding = hourEnding;
        this.status = status;
    }

    /**
     * Planned MW, treating an unset target as hold
     */
    public double targetOrZero() {
        return targetMw != null ? targetMw : 0.0;
    }

    public void setTarget(double targetMw) {
        this.targetMw = targetMw;
        this.mode = OperatingMode.forTarget(targetMw);
    }

    public PlanHour copy() {
        PlanHour copy = new PlanHour(hourEnding, status);
        copy.hsl = hsl;
        copy.lsl = lsl;
        copy.hel = hel;
        copy.lel = lel;
        copy.socBegin = socBegin;
        copy.socMin = socMin;
        copy.socMax = socMax;
        copy.normalRampUp = normalRampUp;
        copy.normalRampDown = normalRampDown;
        copy.emergencyRampUp = emergencyRampUp;
        copy.emergencyRampDown = emergencyRampDown;
        copy.targetMw = targetMw;
        copy.mode = mode;
        copy.auxLoad = auxLoad;
        copy.resourceType = resourceType;
        copy.fuelType = fuelType;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("PlanHour{hour=%s, status=%s, target=%sMW, soc=%s [%s, %s]MWh}",
                hourEnding, status, targetMw, socBegin, socMin, socMax);
    }
}
