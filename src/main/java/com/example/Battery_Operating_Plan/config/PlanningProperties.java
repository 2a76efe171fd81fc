package com.example.Battery_Operating_Plan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Planning and validation coefficients, externalized to application.properties
 *
 * Price thresholds use half-open intervals:
 * charge below {@code fullChargePrice}, hold on [fullChargePrice, partialDischargePrice],
 * partial discharge on (partialDischargePrice, fullDischargePrice], full discharge above.
 */
@Configuration
@ConfigurationProperties(prefix = "cop.planning")
public class PlanningProperties {

    /** Hours per plan (7 days) */
    private int horizonHours = 168;

    /** Starting SOC as a fraction of maxSoc when the caller supplies none */
    private double initialSocFraction = 0.5;

    // Default diurnal pattern (hour of day, end exclusive)
    private int chargeStartHour = 0;
    private int chargeEndHour = 6;
    private int dischargeStartHour = 14;
    private int dischargeEndHour = 20;

    /** Night charge power as a fraction of LSL */
    private double chargeFactor = 0.8;

    /** Afternoon discharge power as a fraction of HSL */
    private double dischargeFactor = 0.9;

    // Price thresholds ($/MWh)
    private double fullDischargePrice = 80.0;
    private double partialDischargePrice = 50.0;
    private double fullChargePrice = 25.0;

    /** Discharge power as a fraction of HSL when price is above partialDischargePrice */
    private double partialDischargeFactor = 0.5;

    /** MWh slack allowed when auditing SOC transitions */
    private double socTolerance = 0.01;

    /** Multiplier on ramp capability before a ramp is flagged */
    private double rampTolerance = 1.05;

    private double emergencyRampMultiplier = 1.5;

    /** Hours the market expects the COP to cover */
    private int requiredHorizonHours = 168;

    public int getHorizonHours() { return horizonHours; }
    public void setHorizonHours(int horizonHours) { this.horizonHours = horizonHours; }

    public double getInitialSocFraction() { return initialSocFraction; }
    public void setInitialSocFraction(double initialSocFraction) { this.initialSocFraction = initialSocFraction; }

    public int getChargeStartHour() { return chargeStartHour; }
    public void setChargeStartHour(int chargeStartHour) { this.chargeStartHour = chargeStartHour; }

    public int getChargeEndHour() { return chargeEndHour; }
    public void setChargeEndHour(int chargeEndHour) { this.chargeEndHour = chargeEndHour; }

    public int getDischargeStartHour() { return dischargeStartHour; }
    public void setDischargeStartHour(int dischargeStartHour) { this.dischargeStartHour = dischargeStartHour; }

    public int getDischargeEndHour() { return dischargeEndHour; }
    public void setDischargeEndHour(int dischargeEndHour) { this.dischargeEndHour = dischargeEndHour; }

    public double getChargeFactor() { return chargeFactor; }
    public void setChargeFactor(double chargeFactor) { this.chargeFactor = chargeFactor; }

    public double getDischargeFactor() { return dischargeFactor; }
    public void setDischargeFactor(double dischargeFactor) { this.dischargeFactor = dischargeFactor; }

    public double getFullDischargePrice() { return fullDischargePrice; }
    public void setFullDischargePrice(double fullDischargePrice) { this.fullDischargePrice = fullDischargePrice; }

    public double getPartialDischargePrice() { return partialDischargePrice; }
    public void setPartialDischargePrice(double partialDischargePrice) { this.partialDischargePrice = partialDischargePrice; }

    public double getFullChargePrice() { return fullChargePrice; }
    public void setFullChargePrice(double fullChargePrice) { this.fullChargePrice = fullChargePrice; }

    public double getPartialDischargeFactor() { return partialDischargeFactor; }
    public void setPartialDischargeFactor(double partialDischargeFactor) { this.partialDischargeFactor = partialDischargeFactor; }

    public double getSocTolerance() { return socTolerance; }
    public void setSocTolerance(double socTolerance) { this.socTolerance = socTolerance; }

    public double getRampTolerance() { return rampTolerance; }
    public void setRampTolerance(double rampTolerance) { this.rampTolerance = rampTolerance; }

    public double getEmergencyRampMultiplier() { return emergencyRampMultiplier; }
    public void setEmergencyRampMultiplier(double emergencyRampMultiplier) { this.emergencyRampMultiplier = emergencyRampMultiplier; }

    public int getRequiredHorizonHours() { return requiredHorizonHours; }
    public void setRequiredHorizonHours(int requiredHorizonHours) { this.requiredHorizonHours = requiredHorizonHours; }
}
