package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.config.PlanningProperties;
import com.example.Battery_Operating_Plan.model.FindingType;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import com.example.Battery_Operating_Plan.model.ResourceStatus;
import com.example.Battery_Operating_Plan.model.Severity;
import com.example.Battery_Operating_Plan.model.ValidationFinding;
import com.example.Battery_Operating_Plan.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OperatingPlanValidator
 *
 * Each test starts from a complete, feasible 168-hour plan for a 10MW / 20MWh
 * lossless battery and breaks one thing.
 */
class OperatingPlanValidatorTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 8, 1, 0, 0);

    private OperatingPlanValidator validator;
    private ResourceProfile profile;

    @BeforeEach
    void setUp() {
        validator = new OperatingPlanValidator(new PlanningProperties());
        profile = new ResourceProfile("BESS_10MW", 10.0, 20.0, 1.0, 1.0, 1.0, 0.0, 20.0, 0.0);
    }

    private Plan completePlan(int hours) {
        List<PlanHour> records = new ArrayList<>();
        for (int i = 0; i < hours; i++) {
            PlanHour hour = new PlanHour(START.plusHours(i), ResourceStatus.ON);
            hour.hsl = 10.0;
            hour.lsl = -10.0;
            hour.normalRampUp = 1.0;
            hour.normalRampDown = 1.0;
            hour.setTarget(0.0);
            setSoc(hour, 10.0);
            records.add(hour);
        }
        return new Plan("BESS_10MW", records);
    }

    private static void setSoc(PlanHour hour, double soc) {
        hour.socBegin = soc;
        hour.socMin = Math.max(0.0, soc - 10.0);
        hour.socMax = Math.min(20.0, soc + 10.0);
    }

    @Test
    void testCompletePlan_Valid() {
        // When
        ValidationReport report = validator.validate(completePlan(168), profile);

        // Then
        assertTrue(report.isValid());
        assertEquals(0, report.getErrorCount());
        assertEquals(0, report.getWarningCount());
        assertEquals("COP validation PASSED - ready for submission", report.getSummary());
    }

    @Test
    void testSocBelowMinimum_Error() {
        // Given
        Plan plan = completePlan(1);
        plan.hour(0).socBegin = -1.0;

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.SOC_BELOW_MIN));
        ValidationFinding finding = report.getErrors().stream()
                .filter(f -> f.getType() == FindingType.SOC_BELOW_MIN)
                .findFirst().orElseThrow();
        assertEquals(0, finding.getHour());
        assertEquals(Severity.ERROR, finding.getSeverity());
    }

    @Test
    void testSocAboveMaximum_Error() {
        // Given
        Plan plan = completePlan(168);
        setSoc(plan.hour(167), 20.0);
        plan.hour(167).socBegin = 20.5;
        setSoc(plan.hour(166), 15.0);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.SOC_ABOVE_MAX));
    }

    @Test
    void testInfeasibleCharge_Error() {
        // Given - 5 -> 18 needs 13MWh in one hour, max 10
        Plan plan = completePlan(168);
        setSoc(plan.hour(10), 5.0);
        setSoc(plan.hour(11), 18.0);
        setSoc(plan.hour(12), 10.0);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.SOC_INFEASIBLE_CHARGE));
        assertEquals(10, report.getErrors().get(0).getHour());
    }

    @Test
    void testInfeasibleDischarge_Error() {
        // Given - 15 -> 2 releases 13MWh in one hour, max 10
        Plan plan = completePlan(168);
        setSoc(plan.hour(20), 15.0);
        setSoc(plan.hour(21), 2.0);
        setSoc(plan.hour(22), 10.0);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.SOC_INFEASIBLE_DISCHARGE));
    }

    @Test
    void testChargeWithinTolerance_Valid() {
        // Given - 10.005MWh in one hour, max 10 with 0.01 tolerance
        Plan plan = completePlan(168);
        setSoc(plan.hour(0), 5.0);
        setSoc(plan.hour(1), 15.005);
        setSoc(plan.hour(2), 10.0);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertTrue(report.isValid(), report.getErrors().toString());
    }

    @Test
    void testBracketInconsistent_Warnings() {
        // Given
        Plan plan = completePlan(168);
        plan.hour(3).socMin = 12.0;
        plan.hour(4).socMax = 8.0;

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertTrue(report.isValid());
        assertTrue(report.hasFinding(FindingType.SOC_MIN_INCONSISTENT));
        assertTrue(report.hasFinding(FindingType.SOC_MAX_INCONSISTENT));
        assertEquals(2, report.getWarningCount());
    }

    @Test
    void testRampExceeded_WarningOnly() {
        // Given - 0 -> 100MW with a 1MW/min ramp (63MW/hour with tolerance)
        Plan plan = completePlan(168);
        plan.hour(1).setTarget(100.0);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertTrue(report.isValid());
        assertTrue(report.hasFinding(FindingType.RAMP_RATE_EXCEEDED));
        assertEquals(2, report.getWarningCount()); // up at hour 0, down at hour 1
        assertEquals(Severity.WARNING, report.getWarnings().get(0).getSeverity());
    }

    @Test
    void testRampWithinTolerance_NoWarning() {
        // Given
        Plan plan = completePlan(168);
        plan.hour(1).setTarget(62.0);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.hasFinding(FindingType.RAMP_RATE_EXCEEDED));
    }

    @Test
    void testRampAcrossStatusChange_Skipped() {
        // Given
        Plan plan = completePlan(168);
        plan.hour(1).setTarget(100.0);
        plan.hour(1).status = ResourceStatus.ONREG;

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.hasFinding(FindingType.RAMP_RATE_EXCEEDED));
    }

    @Test
    void testResponsiveReserve_InsufficientSoc() {
        // Given - ONRR needs 1 hour at HSL (10MWh), only 5MWh held
        Plan plan = completePlan(168);
        setSoc(plan.hour(5), 5.0);
        plan.hour(5).status = ResourceStatus.ONRR;

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertTrue(report.isValid());
        assertTrue(report.hasFinding(FindingType.INSUFFICIENT_SOC_FOR_RRS));
        assertEquals(5, report.getWarnings().stream()
                .filter(f -> f.getType() == FindingType.INSUFFICIENT_SOC_FOR_RRS)
                .findFirst().orElseThrow().getHour());
    }

    @Test
    void testEcrs_RequiresTwoHoursOfEnergy() {
        // Given
        Plan plan = completePlan(168);
        setSoc(plan.hour(5), 15.0);
        plan.hour(5).status = ResourceStatus.ONECRS;
        setSoc(plan.hour(6), 20.0);
        plan.hour(6).status = ResourceStatus.ONECRS;
        setSoc(plan.hour(7), 15.0);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        List<ValidationFinding> ecrs = report.getWarnings().stream()
                .filter(f -> f.getType() == FindingType.INSUFFICIENT_SOC_FOR_ECRS)
                .toList();
        assertEquals(1, ecrs.size());
        assertEquals(5, ecrs.get(0).getHour());
    }

    @Test
    void testShortHorizon_Warning() {
        // When
        ValidationReport report = validator.validate(completePlan(100), profile);

        // Then
        assertTrue(report.isValid());
        assertTrue(report.hasFinding(FindingType.INSUFFICIENT_HORIZON));
        assertNull(report.getWarnings().get(0).getHour());
    }

    @Test
    void testFieldNullInSomeHours_NullValues() {
        // Given
        Plan plan = completePlan(168);
        plan.hour(40).socMin = null;

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.NULL_VALUES));
        assertFalse(report.hasFinding(FindingType.MISSING_FIELDS));
    }

    @Test
    void testFieldNullInEveryHour_MissingFields() {
        // Given
        Plan plan = completePlan(168);
        plan.hours.forEach(hour -> hour.normalRampUp = null);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.MISSING_FIELDS));
        assertTrue(report.getErrors().get(0).getMessage().contains("normalRampUp"));
    }

    @Test
    void testMissingResourceName_MissingFields() {
        // Given
        Plan plan = completePlan(168);
        plan.resourceName = null;

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.MISSING_FIELDS));
    }

    @Test
    void testEmptyPlan_MissingFieldsAndShortHorizon() {
        // When
        ValidationReport report = validator.validate(new Plan("BESS_10MW", new ArrayList<>()), profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.MISSING_FIELDS));
        assertTrue(report.hasFinding(FindingType.INSUFFICIENT_HORIZON));
    }

    @Test
    void testDuplicateHour_SequenceError() {
        // Given
        Plan plan = completePlan(168);
        plan.hour(50).hourEnding = plan.hour(49).hourEnding;

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.HOUR_SEQUENCE_INVALID));
    }

    @Test
    void testGapInHours_SequenceError() {
        // Given
        Plan plan = completePlan(168);
        plan.hours.remove(30);

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertFalse(report.isValid());
        assertTrue(report.hasFinding(FindingType.HOUR_SEQUENCE_INVALID));
        assertEquals(30, report.getErrors().get(0).getHour());
    }

    @Test
    void testFailedSummary_ListsErrorTypes() {
        // Given
        Plan plan = completePlan(168);
        plan.hour(0).socBegin = -1.0;
        plan.hour(60).socMin = null;

        // When
        ValidationReport report = validator.validate(plan, profile);

        // Then
        assertTrue(report.getSummary().startsWith("COP validation FAILED - "));
        assertTrue(report.getSummary().contains("SOC_BELOW_MIN"));
        assertTrue(report.getSummary().contains("NULL_VALUES"));
    }

    @Test
    void testRepeatedCalls_NoStateCarriedOver() {
        // Given
        Plan broken = completePlan(168);
        broken.hour(0).socBegin = -1.0;
        Plan clean = completePlan(168);

        // When
        ValidationReport first = validator.validate(broken, profile);
        ValidationReport second = validator.validate(clean, profile);
        ValidationReport third = validator.validate(broken, profile);

        // Then
        assertFalse(first.isValid());
        assertTrue(second.isValid());
        assertEquals(0, second.getErrorCount());
        assertEquals(first.getErrorCount(), third.getErrorCount());
        assertNotSame(first, third);
    }

    @Test
    void testValidation_DoesNotModifyPlan() {
        // Given
        Plan plan = completePlan(168);
        plan.hour(0).socBegin = -1.0;

        // When
        validator.validate(plan, profile);

        // Then
        assertEquals(-1.0, plan.hour(0).socBegin, 1e-9);
        assertEquals(168, plan.size());
    }
}
