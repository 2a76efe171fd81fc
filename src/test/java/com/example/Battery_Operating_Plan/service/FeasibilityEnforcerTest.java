package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.model.OperatingMode;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import com.example.Battery_Operating_Plan.model.ResourceStatus;
import com.example.Battery_Operating_Plan.model.SocSequence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SOC feasibility enforcement
 *
 * Tests cover:
 * - Charge clamp against max SOC headroom
 * - Discharge clamp against energy above min SOC
 * - Final clipping into [minSoc, maxSoc]
 * - Idempotence on arbitrary sequences
 * - In-place repair of a plan
 */
class FeasibilityEnforcerTest {

    private FeasibilityEnforcer enforcer;
    private ResourceProfile profile;

    @BeforeEach
    void setUp() {
        enforcer = new FeasibilityEnforcer();
        // 10MW / 20MWh, lossless, full SOC range
        profile = new ResourceProfile("BESS_10MW", 10.0, 20.0, 1.0, 1.0, 1.0, 0.0, 20.0, 0.0);
    }

    @Test
    void testChargeBeyondMaxSoc_ClampedAndForcedToFullCharge() {
        // Given
        SocSequence input = SocSequence.ofSoc(10.0, 19.0, 28.0);

        // When
        SocSequence repaired = enforcer.enforce(input, profile);

        // Then
        assertArrayEquals(new double[]{10.0, 19.0, 20.0}, repaired.getSocBegin(), 1e-9);
        assertEquals(-10.0, repaired.getTargetMw()[1], 1e-9); // LSL
        assertEquals(0.0, repaired.getTargetMw()[0], 1e-9);   // first step was feasible
        assertEquals(1, repaired.getRepairCount());
    }

    @Test
    void testDischargeBelowMinSoc_ClampedAndForcedToFullDischarge() {
        // Given - 5MWh available but 12MWh requested
        SocSequence input = SocSequence.ofSoc(5.0, -7.0);

        // When
        SocSequence repaired = enforcer.enforce(input, profile);

        // Then
        assertArrayEquals(new double[]{5.0, 0.0}, repaired.getSocBegin(), 1e-9);
        assertEquals(10.0, repaired.getTargetMw()[0], 1e-9); // HSL
    }

    @Test
    void testDischargeBeyondPowerLimit_ClampedToHsl() {
        // Given - 15MWh drop in one hour exceeds 10MW HSL
        SocSequence input = SocSequence.ofSoc(18.0, 3.0);

        // When
        SocSequence repaired = enforcer.enforce(input, profile);

        // Then
        assertArrayEquals(new double[]{18.0, 8.0}, repaired.getSocBegin(), 1e-9);
    }

    @Test
    void testChargeLimitedByEfficiency() {
        // Given - 80% efficient 10MW battery can only add 8MWh per hour
        ResourceProfile lossy = new ResourceProfile("BESS_LOSSY", 10.0, 20.0, 0.8, 1.0, 1.0, 0.0, 20.0, 0.0);
        SocSequence input = SocSequence.ofSoc(2.0, 12.0);

        // When
        SocSequence repaired = enforcer.enforce(input, lossy);

        // Then
        assertEquals(10.0, repaired.getSocBegin()[1], 1e-9);
    }

    @Test
    void testFeasibleSequence_Unchanged() {
        // Given
        SocSequence input = new SocSequence(new double[]{10.0, 15.0, 12.0, 12.0}, new double[]{-5.0, 3.0, 0.0, 0.0});

        // When
        SocSequence repaired = enforcer.enforce(input, profile);

        // Then
        assertEquals(input, repaired);
        assertEquals(0, repaired.getRepairCount());
    }

    @Test
    void testOutOfRangeStart_ClippedIntoBounds() {
        // When
        SocSequence repaired = enforcer.enforce(SocSequence.ofSoc(25.0, 25.0, 25.0), profile);

        // Then
        assertArrayEquals(new double[]{20.0, 20.0, 20.0}, repaired.getSocBegin(), 1e-9);
    }

    @Test
    void testStartBelowMinSoc_FirstStepClampedBeforeFinalClip() {
        // Given - 13MWh rise from -5 exceeds the 10MWh charge limit
        SocSequence input = SocSequence.ofSoc(-5.0, 8.0);

        // When
        SocSequence repaired = enforcer.enforce(input, profile);

        // Then
        assertArrayEquals(new double[]{0.0, 5.0}, repaired.getSocBegin(), 1e-9);
        assertEquals(-10.0, repaired.getTargetMw()[0], 1e-9); // LSL
        assertEquals(1, repaired.getRepairCount());
    }

    @Test
    void testEmptyAndSingleValueSequences() {
        assertEquals(0, enforcer.enforce(SocSequence.ofSoc(), profile).length());
        assertArrayEquals(new double[]{0.0}, enforcer.enforce(SocSequence.ofSoc(-3.0), profile).getSocBegin(), 1e-9);
    }

    @Test
    void testIdempotence_RandomSequences() {
        // Given
        Random random = new Random(7);

        for (int run = 0; run < 50; run++) {
            double[] soc = new double[48];
            double[] target = new double[48];
            for (int i = 0; i < soc.length; i++) {
                soc[i] = random.nextDouble() * 40.0 - 10.0;
                target[i] = random.nextDouble() * 20.0 - 10.0;
            }

            // When
            SocSequence once = enforcer.enforce(new SocSequence(soc, target), profile);
            SocSequence twice = enforcer.enforce(once, profile);

            // Then
            assertEquals(once, twice, "Second pass must not change the sequence (run " + run + ")");
            for (double value : once.getSocBegin()) {
                assertTrue(value >= profile.getMinSoc() && value <= profile.getMaxSoc());
            }
        }
    }

    @Test
    void testMismatchedTargetLength_Rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new SocSequence(new double[]{1.0, 2.0}, new double[]{0.0}));
    }

    @Test
    void testEnforcePlan_RepairsInPlaceAndUpdatesMode() {
        // Given
        Plan plan = planWithSoc(10.0, 19.0, 28.0);

        // When
        int repairs = enforcer.enforce(plan, profile);

        // Then
        assertEquals(1, repairs);
        assertEquals(20.0, plan.hour(2).socBegin, 1e-9);
        assertEquals(-10.0, plan.hour(1).targetMw, 1e-9);
        assertEquals(OperatingMode.CHARGE, plan.hour(1).mode);
        assertEquals(OperatingMode.HOLD, plan.hour(0).mode);
    }

    @Test
    void testMaxChargeAndDischargeLimits() {
        assertEquals(10.0, FeasibilityEnforcer.maxCharge(5.0, profile), 1e-9);
        assertEquals(1.0, FeasibilityEnforcer.maxCharge(19.0, profile), 1e-9);
        assertEquals(4.0, FeasibilityEnforcer.maxDischarge(4.0, profile), 1e-9);
        assertEquals(10.0, FeasibilityEnforcer.maxDischarge(15.0, profile), 1e-9);
    }

    private Plan planWithSoc(double... soc) {
        LocalDateTime start = LocalDateTime.of(2025, 8, 1, 0, 0);
        List<PlanHour> hours = new ArrayList<>();
        for (int i = 0; i < soc.length; i++) {
            PlanHour hour = new PlanHour(start.plusHours(i), ResourceStatus.ON);
            hour.socBegin = soc[i];
            hour.setTarget(0.0);
            hours.add(hour);
        }
        return new Plan("BESS_10MW", hours);
    }
}
