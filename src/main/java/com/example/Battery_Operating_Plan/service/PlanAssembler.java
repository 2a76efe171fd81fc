package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.config.PlanningProperties;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import org.springframework.stereotype.Service;

/**
 * Fills the static COP fields every hour must carry for submission
 * (ramp rates, emergency limits, auxiliary load, resource and fuel type).
 */
@Service
public class PlanAssembler {

    public static final String RESOURCE_TYPE = "ESR";
    public static final String FUEL_TYPE = "BATTERY";

    private final PlanningProperties properties;

    public PlanAssembler(PlanningProperties properties) {
        this.properties = properties;
    }

    public Plan assemble(Plan plan, ResourceProfile profile) {
        double emergencyMultiplier = properties.getEmergencyRampMultiplier();

        for (PlanHour hour : plan.hours) {
            hour.normalRampUp = profile.getRampUpMwPerMin();
            hour.normalRampDown = profile.getRampDownMwPerMin();
            hour.emergencyRampUp = profile.getRampUpMwPerMin() * emergencyMultiplier;
            hour.emergencyRampDown = profile.getRampDownMwPerMin() * emergencyMultiplier;

            // Emergency limits equal sustained limits for storage
            hour.hel = hour.hsl;
            hour.lel = hour.lsl;

            hour.auxLoad = profile.getAuxLoadMw();
            hour.resourceType = RESOURCE_TYPE;
            hour.fuelType = FUEL_TYPE;
        }
        return plan;
    }
}
