package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.config.PlanningProperties;
import com.example.Battery_Operating_Plan.model.AncillaryService;
import com.example.Battery_Operating_Plan.model.FindingType;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.PlanHour;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import com.example.Battery_Operating_Plan.model.ResourceStatus;
import com.example.Battery_Operating_Plan.model.Severity;
import com.example.Battery_Operating_Plan.model.ValidationFinding;
import com.example.Battery_Operating_Plan.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * COP Validator
 *
 * Read-only audit of a finished plan against six check families:
 * 1. SOC feasibility of every hour-to-hour transition
 * 2. SOC absolute bounds and working bracket consistency
 * 3. Ramp rates between hours with unchanged status
 * 4. SOC sufficiency for RRS / ECRS commitments
 * 5. Completeness of required fields
 * 6. Horizon length and hour sequence
 *
 * All families run on every call and their findings are concatenated.
 * No state is kept between calls; each call returns a fresh report.
 */
@Service
public class OperatingPlanValidator {

    private static final Logger logger = LoggerFactory.getLogger(OperatingPlanValidator.class);

    private static final Map<String, Function<PlanHour, Object>> REQUIRED_FIELDS = requiredFields();

    private final PlanningProperties properties;

    public OperatingPlanValidator(PlanningProperties properties) {
        this.properties = properties;
    }

    public ValidationReport validate(Plan plan, ResourceProfile profile) {
        List<ValidationFinding> findings = new ArrayList<>();
        List<PlanHour> hours = plan.hours != null ? plan.hours : Collections.emptyList();

        validateSocFeasibility(hours, profile, findings);
        validateSocBounds(hours, profile, findings);
        validateRampRates(hours, findings);
        validateAsRequirements(hours, findings);
        validateCompleteness(plan, hours, findings);
        validateHorizon(hours, findings);

        List<ValidationFinding> errors = new ArrayList<>();
        List<ValidationFinding> warnings = new ArrayList<>();
        for (ValidationFinding finding : findings) {
            if (finding.getSeverity() == Severity.ERROR) {
                errors.add(finding);
            } else {
                warnings.add(finding);
            }
        }

        ValidationReport report = new ValidationReport(errors, warnings);
        if (report.isValid()) {
            logger.info("COP validation PASSED for {}: {} hours, {} warnings",
                    plan.resourceName, hours.size(), report.getWarningCount());
        } else {
            logger.warn("COP validation FAILED for {}: {} errors ({}), {} warnings",
                    plan.resourceName, report.getErrorCount(), report.getErrorTypes(), report.getWarningCount());
        }
        return report;
    }

    private void validateSocFeasibility(List<PlanHour> hours, ResourceProfile profile, List<ValidationFinding> findings) {
        double tolerance = properties.getSocTolerance();

        for (int i = 0; i < hours.size() - 1; i++) {
            PlanHour current = hours.get(i);
            PlanHour next = hours.get(i + 1);
            if (current == null || next == null || current.socBegin == null || next.socBegin == null) {
                continue;
            }

            double maxDischarge = FeasibilityEnforcer.maxDischarge(current.socBegin, profile);
            double maxCharge = FeasibilityEnforcer.maxCharge(current.socBegin, profile);
            double socChange = next.socBegin - current.socBegin;

            if (socChange > maxCharge + tolerance) {
                findings.add(ValidationFinding.atHour(FindingType.SOC_INFEASIBLE_CHARGE, i,
                        String.format("Hour %d: Cannot charge %.1f MWh (max: %.1f)", i, socChange, maxCharge)));
            } else if (socChange < -(maxDischarge + tolerance)) {
                findings.add(ValidationFinding.atHour(FindingType.SOC_INFEASIBLE_DISCHARGE, i,
                        String.format("Hour %d: Cannot discharge %.1f MWh (max: %.1f)", i, -socChange, maxDischarge)));
            }
        }
    }

    private void validateSocBounds(List<PlanHour> hours, ResourceProfile profile, List<ValidationFinding> findings) {
        for (int i = 0; i < hours.size(); i++) {
            PlanHour hour = hours.get(i);
            if (hour == null || hour.socBegin == null) {
                continue;
            }
            double soc = hour.socBegin;

            if (soc < profile.getMinSoc()) {
                findings.add(ValidationFinding.atHour(FindingType.SOC_BELOW_MIN, i,
                        String.format("SOC %.1f below minimum %.1f", soc, profile.getMinSoc())));
            } else if (soc > profile.getMaxSoc()) {
                findings.add(ValidationFinding.atHour(FindingType.SOC_ABOVE_MAX, i,
                        String.format("SOC %.1f above maximum %.1f", soc, profile.getMaxSoc())));
            }

            if (hour.socMin != null && hour.socMin > soc) {
                findings.add(ValidationFinding.atHour(FindingType.SOC_MIN_INCONSISTENT, i,
                        String.format("MinSOC %.1f > Beginning SOC %.1f", hour.socMin, soc)));
            }
            if (hour.socMax != null && hour.socMax < soc) {
                findings.add(ValidationFinding.atHour(FindingType.SOC_MAX_INCONSISTENT, i,
                        String.format("MaxSOC %.1f < Beginning SOC %.1f", hour.socMax, soc)));
            }
        }
    }

    private void validateRampRates(List<PlanHour> hours, List<ValidationFinding> findings) {
        for (int i = 0; i < hours.size() - 1; i++) {
            PlanHour current = hours.get(i);
            PlanHour next = hours.get(i + 1);
            if (current == null || next == null) {
                continue;
            }

            // A status change covers startup/shutdown ramping
            if (current.status == null || current.status != next.status) {
                continue;
            }
            if (current.normalRampUp == null || current.normalRampDown == null) {
                continue;
            }

            double mwChange = Math.abs(next.targetOrZero() - current.targetOrZero());
            double maxRamp = Math.max(current.normalRampUp, current.normalRampDown) * 60; // MW/hour

            if (mwChange > maxRamp * properties.getRampTolerance()) {
                findings.add(ValidationFinding.atHour(FindingType.RAMP_RATE_EXCEEDED, i,
                        String.format("Hour %d: Ramp %.1f MW exceeds capability %.1f MW/hr", i, mwChange, maxRamp)));
            }
        }
    }

    private void validateAsRequirements(List<PlanHour> hours, List<ValidationFinding> findings) {
        for (int i = 0; i < hours.size(); i++) {
            PlanHour hour = hours.get(i);
            if (hour == null || hour.socBegin == null || hour.hsl == null) {
                continue;
            }

            if (hour.status == ResourceStatus.ONRR) {
                double requiredSoc = hour.hsl * AncillaryService.RESPONSIVE_RESERVE.getReserveHours();
                if (hour.socBegin < requiredSoc) {
                    findings.add(ValidationFinding.atHour(FindingType.INSUFFICIENT_SOC_FOR_RRS, i,
                            String.format("Hour %d: SOC %.1f insufficient for RRS %.1f", i, hour.socBegin, requiredSoc)));
                }
            } else if (hour.status == ResourceStatus.ONECRS) {
                double requiredSoc = hour.hsl * AncillaryService.ECRS.getReserveHours();
                if (hour.socBegin < requiredSoc) {
                    findings.add(ValidationFinding.atHour(FindingType.INSUFFICIENT_SOC_FOR_ECRS, i,
                            String.format("Hour %d: SOC %.1f insufficient for ECRS %.1f", i, hour.socBegin, requiredSoc)));
                }
            }
        }
    }

    /**
     * A field null in every hour is reported as missing, a field null in some hours as null values
     */
    private void validateCompleteness(Plan plan, List<PlanHour> hours, List<ValidationFinding> findings) {
        List<String> missingFields = new ArrayList<>();

        if (plan.resourceName == null || plan.resourceName.isBlank()) {
            missingFields.add("resourceName");
        }

        if (hours.isEmpty()) {
            missingFields.addAll(REQUIRED_FIELDS.keySet());
        } else {
            for (Map.Entry<String, Function<PlanHour, Object>> field : REQUIRED_FIELDS.entrySet()) {
                long nullCount = hours.stream()
                        .filter(hour -> hour == null || field.getValue().apply(hour) == null)
                        .count();

                if (nullCount == hours.size()) {
                    missingFields.add(field.getKey());
                } else if (nullCount > 0) {
                    findings.add(ValidationFinding.forPlan(FindingType.NULL_VALUES,
                            String.format("Null values found in required field: %s (%d hours)", field.getKey(), nullCount)));
                }
            }
        }

        if (!missingFields.isEmpty()) {
            findings.add(ValidationFinding.forPlan(FindingType.MISSING_FIELDS,
                    "Missing required fields: " + missingFields));
        }
    }

    private void validateHorizon(List<PlanHour> hours, List<ValidationFinding> findings) {
        int required = properties.getRequiredHorizonHours();
        if (hours.size() < required) {
            findings.add(ValidationFinding.forPlan(FindingType.INSUFFICIENT_HORIZON,
                    String.format("COP contains %d hours, %d required for %d days", hours.size(), required, required / 24)));
        }

        for (int i = 1; i < hours.size(); i++) {
            PlanHour previous = hours.get(i - 1);
            PlanHour current = hours.get(i);
            if (previous == null || current == null || previous.hourEnding == null || current.hourEnding == null) {
                continue;
            }

            LocalDateTime expected = previous.hourEnding.plusHours(1);
            if (current.hourEnding.equals(expected)) {
                continue;
            }

            String problem;
            if (current.hourEnding.equals(previous.hourEnding)) {
                problem = "duplicates";
            } else if (current.hourEnding.isBefore(previous.hourEnding)) {
                problem = "precedes";
            } else {
                problem = "leaves a gap after";
            }
            findings.add(ValidationFinding.atHour(FindingType.HOUR_SEQUENCE_INVALID, i,
                    String.format("Hour %d: %s %s %s", i, current.hourEnding, problem, previous.hourEnding)));
        }
    }

    private static Map<String, Function<PlanHour, Object>> requiredFields() {
        Map<String, Function<PlanHour, Object>> fields = new LinkedHashMap<>();
        fields.put("hourEnding", hour -> hour.hourEnding);
        fields.put("status", hour -> hour.status);
        fields.put("hsl", hour -> hour.hsl);
        fields.put("lsl", hour -> hour.lsl);
        fields.put("socBegin", hour -> hour.socBegin);
        fields.put("socMin", hour -> hour.socMin);
        fields.put("socMax", hour -> hour.socMax);
        fields.put("normalRampUp", hour -> hour.normalRampUp);
        fields.put("normalRampDown", hour -> hour.normalRampDown);
        return Collections.unmodifiableMap(fields);
    }
}
