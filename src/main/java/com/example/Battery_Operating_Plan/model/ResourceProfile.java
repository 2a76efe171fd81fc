package com.example.Battery_Operating_Plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Energy Storage Resource (ESR) technical parameters
 * Immutable description of one battery resource as registered with the market operator
 *
 * Sign convention follows the COP: positive MW = discharge, negative MW = charge.
 * SOC limits are expressed in MWh, not percent.
 */
public final class ResourceProfile {

    private final String resourceName;
    private final double capacityMw;        // MW - nameplate power
    private final double capacityMwh;       // MWh - nameplate energy
    private final double roundTripEfficiency;
    private final double rampUpMwPerMin;
    private final double rampDownMwPerMin;
    private final double minSoc;            // MWh
    private final double maxSoc;            // MWh
    private final double auxLoadMw;

    @JsonCreator
    public ResourceProfile(@JsonProperty("resourceName") String resourceName,
                           @JsonProperty("capacityMw") double capacityMw,
                           @JsonProperty("capacityMwh") double capacityMwh,
                           @JsonProperty("roundTripEfficiency") double roundTripEfficiency,
                           @JsonProperty("rampUpMwPerMin") double rampUpMwPerMin,
                           @JsonProperty("rampDownMwPerMin") double rampDownMwPerMin,
                           @JsonProperty("minSoc") double minSoc,
                           @JsonProperty("maxSoc") double maxSoc,
                           @JsonProperty("auxLoadMw") double auxLoadMw) {
        this.resourceName = Objects.requireNonNull(resourceName, "Resource name cannot be null");
        this.capacityMw = capacityMw;
        this.capacityMwh = capacityMwh;
        this.roundTripEfficiency = roundTripEfficiency;
        this.rampUpMwPerMin = rampUpMwPerMin;
        this.rampDownMwPerMin = rampDownMwPerMin;
        this.minSoc = minSoc;
        this.maxSoc = maxSoc;
        this.auxLoadMw = auxLoadMw;
    }

    public String getResourceName() { return resourceName; }
    public double getCapacityMw() { return capacityMw; }
    public double getCapacityMwh() { return capacityMwh; }
    public double getRoundTripEfficiency() { return roundTripEfficiency; }
    public double getRampUpMwPerMin() { return rampUpMwPerMin; }
    public double getRampDownMwPerMin() { return rampDownMwPerMin; }
    public double getMinSoc() { return minSoc; }
    public double getMaxSoc() { return maxSoc; }
    public double getAuxLoadMw() { return auxLoadMw; }

    /**
     * High Sustained Limit - maximum discharge power (MW)
     */
    @JsonIgnore
    public double getHsl() {
        return capacityMw;
    }

    /**
     * Low Sustained Limit - maximum charge power, negative by convention (MW)
     */
    @JsonIgnore
    public double getLsl() {
        return -capacityMw;
    }

    @JsonIgnore
    public double getDurationHours() {
        return capacityMwh / capacityMw;
    }

    /**
     * Energy that can be added to the battery in one hour at full charge power (MWh)
     */
    @JsonIgnore
    public double getHourlyChargeEnergy() {
        return Math.abs(getLsl()) * roundTripEfficiency;
    }

    /**
     * List every parameter that is not physically meaningful.
     *
     * @return empty list when the profile can be planned against
     */
    public List<String> physicalViolations() {
        List<String> violations = new ArrayList<>();
        if (!(capacityMw > 0)) {
            violations.add(String.format("capacityMw must be > 0 (was %.2f)", capacityMw));
        }
        if (!(capacityMwh > 0)) {
            violations.add(String.format("capacityMwh must be > 0 (was %.2f)", capacityMwh));
        }
        if (!(roundTripEfficiency > 0 && roundTripEfficiency <= 1.0)) {
            violations.add(String.format("roundTripEfficiency must be in (0, 1] (was %.3f)", roundTripEfficiency));
        }
        if (!(rampUpMwPerMin > 0) || !(rampDownMwPerMin > 0)) {
            violations.add("ramp rates must be > 0");
        }
        if (minSoc < 0) {
            violations.add(String.format("minSoc must be >= 0 (was %.2f)", minSoc));
        }
        if (!(minSoc < maxSoc)) {
            violations.add(String.format("minSoc (%.2f) must be below maxSoc (%.2f)", minSoc, maxSoc));
        }
        if (auxLoadMw < 0) {
            violations.add(String.format("auxLoadMw must be >= 0 (was %.2f)", auxLoadMw));
        }
        return violations;
    }

    @Override
    public String toString() {
        return String.format("ESR{name='%s', %.1fMW/%.1fMWh, eff=%.2f, SOC=[%.1f, %.1f]MWh}",
                resourceName, capacityMw, capacityMwh, roundTripEfficiency, minSoc, maxSoc);
    }
}
