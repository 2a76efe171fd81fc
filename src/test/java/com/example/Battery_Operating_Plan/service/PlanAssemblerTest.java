package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.config.PlanningProperties;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import com.example.Battery_Operating_Plan.model.ResourceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanAssemblerTest {

    private PlanningProperties properties;
    private PlanAssembler assembler;
    private ResourceProfile profile;

    @BeforeEach
    void setUp() {
        properties = new PlanningProperties();
        assembler = new PlanAssembler(properties);
        profile = new ResourceProfile("BESS_WEST_100MW", 100.0, 200.0, 0.86, 50.0, 40.0, 0.0, 200.0, 2.0);
    }

    private Plan singleHourPlan() {
        PlanHour hour = new PlanHour(LocalDateTime.of(2025, 8, 1, 14, 0), ResourceStatus.ON);
        hour.hsl = 100.0;
        hour.lsl = -100.0;
        hour.socBegin = 120.0;
        hour.setTarget(90.0);
        return new Plan(profile.getResourceName(), List.of(hour));
    }

    @Test
    void testAssemble_FillsStaticFields() {
        // When
        Plan plan = assembler.assemble(singleHourPlan(), profile);

        // Then
        PlanHour hour = plan.hour(0);
        assertEquals(50.0, hour.normalRampUp, 1e-9);
        assertEquals(40.0, hour.normalRampDown, 1e-9);
        assertEquals(75.0, hour.emergencyRampUp, 1e-9);
        assertEquals(60.0, hour.emergencyRampDown, 1e-9);
        assertEquals(100.0, hour.hel, 1e-9);
        assertEquals(-100.0, hour.lel, 1e-9);
        assertEquals(2.0, hour.auxLoad, 1e-9);
        assertEquals(PlanAssembler.RESOURCE_TYPE, hour.resourceType);
        assertEquals(PlanAssembler.FUEL_TYPE, hour.fuelType);
    }

    @Test
    void testAssemble_LeavesPlanningFieldsAlone() {
        // When
        Plan plan = assembler.assemble(singleHourPlan(), profile);

        // Then
        PlanHour hour = plan.hour(0);
        assertEquals(120.0, hour.socBegin, 1e-9);
        assertEquals(90.0, hour.targetMw, 1e-9);
        assertEquals(ResourceStatus.ON, hour.status);
    }

    @Test
    void testAssemble_EmergencyMultiplierConfigurable() {
        // Given
        properties.setEmergencyRampMultiplier(2.0);

        // When
        Plan plan = assembler.assemble(singleHourPlan(), profile);

        // Then
        assertEquals(100.0, plan.hour(0).emergencyRampUp, 1e-9);
        assertEquals(80.0, plan.hour(0).emergencyRampDown, 1e-9);
    }
}
