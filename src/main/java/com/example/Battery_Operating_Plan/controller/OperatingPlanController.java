package com.example.Battery_Operating_Plan.controller;

import com.example.Battery_Operating_Plan.config.PlanningProperties;
import com.example.Battery_Operating_Plan.dto.ApplyCommitmentsRequest;
import com.example.Battery_Operating_Plan.dto.CommitmentEntry;
import com.example.Battery_Operating_Plan.dto.DailyRunRequest;
import com.example.Battery_Operating_Plan.dto.DailyRunResult;
import com.example.Battery_Operating_Plan.dto.GeneratePlanRequest;
import com.example.Battery_Operating_Plan.dto.PricePoint;
import com.example.Battery_Operating_Plan.dto.SubmissionRecord;
import com.example.Battery_Operating_Plan.dto.SubmissionStatus;
import com.example.Battery_Operating_Plan.exception.InvalidProfileException;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import com.example.Battery_Operating_Plan.model.SocSequence;
import com.example.Battery_Operating_Plan.model.ValidationReport;
import com.example.Battery_Operating_Plan.service.AncillaryCommitmentApplier;
import com.example.Battery_Operating_Plan.service.FeasibilityEnforcer;
import com.example.Battery_Operating_Plan.service.OperatingPlanGenerator;
import com.example.Battery_Operating_Plan.service.OperatingPlanService;
import com.example.Battery_Operating_Plan.service.OperatingPlanValidator;
import com.example.Battery_Operating_Plan.service.PlanSubmitter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API Controller for Current Operating Plans
 *
 * Exposes the planning engine for the configured battery resource:
 * - Plan generation (default pattern or price forecast, optional AS commitments)
 * - Standalone SOC feasibility repair
 * - AS commitment overlay on an existing plan
 * - Plan validation
 * - Daily run (generate, validate, submit) and submission history
 */
@RestController
@RequestMapping("/api/v1/plans")
@CrossOrigin(origins = "*")
public class OperatingPlanController {

    private static final Logger logger = LoggerFactory.getLogger(OperatingPlanController.class);

    private final ResourceProfile resourceProfile;
    private final PlanningProperties planningProperties;
    private final OperatingPlanGenerator generator;
    private final FeasibilityEnforcer feasibilityEnforcer;
    private final AncillaryCommitmentApplier commitmentApplier;
    private final OperatingPlanValidator validator;
    private final OperatingPlanService operatingPlanService;
    private final PlanSubmitter planSubmitter;

    public OperatingPlanController(ResourceProfile resourceProfile,
                                   PlanningProperties planningProperties,
                                   OperatingPlanGenerator generator,
                                   FeasibilityEnforcer feasibilityEnforcer,
                                   AncillaryCommitmentApplier commitmentApplier,
                                   OperatingPlanValidator validator,
                                   OperatingPlanService operatingPlanService,
                                   PlanSubmitter planSubmitter) {
        this.resourceProfile = resourceProfile;
        this.planningProperties = planningProperties;
        this.generator = generator;
        this.feasibilityEnforcer = feasibilityEnforcer;
        this.commitmentApplier = commitmentApplier;
        this.validator = validator;
        this.operatingPlanService = operatingPlanService;
        this.planSubmitter = planSubmitter;
    }

    /**
     * Get the configured resource
     *
     * GET /api/v1/plans/profile
     */
    @GetMapping("/profile")
    public ResponseEntity<ResourceProfile> getProfile() {
        return ResponseEntity.ok(resourceProfile);
    }

    /**
     * Generate a plan
     *
     * POST /api/v1/plans/generate
     * Body: {"startTime": "2025-08-01T00:00:00", "horizonHours": 168,
     *        "priceForecast": [{"hourEnding": "...", "price": 42.0}], "asCommitments": [...]}
     */
    @PostMapping("/generate")
    public ResponseEntity<Plan> generatePlan(@Valid @RequestBody GeneratePlanRequest request) {

        int horizon = request.horizonHours != null ? request.horizonHours : planningProperties.getHorizonHours();
        logger.info("Plan generation request: start={}, horizon={}h, priceForecast={}, asCommitments={}",
                request.startTime, horizon,
                request.priceForecast != null ? request.priceForecast.size() : "none",
                request.asCommitments != null ? request.asCommitments.size() : "none");

        try {
            Plan plan = generator.generate(resourceProfile,
                    request.startTime,
                    horizon,
                    PricePoint.toForecast(request.priceForecast),
                    CommitmentEntry.toCommitments(request.asCommitments),
                    request.initialSoc);
            return ResponseEntity.ok(plan);
        } catch (InvalidProfileException | IllegalArgumentException error) {
            logger.warn("Rejected plan generation request: {}", error.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).build();
        } catch (Exception error) {
            logger.error("Error generating plan", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * Repair a SOC sequence
     *
     * POST /api/v1/plans/feasibility
     * Body: {"socBegin": [100, 180, 260], "targetMw": [-80, -80, 0]}
     */
    @PostMapping("/feasibility")
    public ResponseEntity<SocSequence> enforceFeasibility(@RequestBody SocSequence sequence) {
        try {
            return ResponseEntity.ok(feasibilityEnforcer.enforce(sequence, resourceProfile));
        } catch (Exception error) {
            logger.error("Error enforcing SOC feasibility", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * Overlay AS commitments on a plan
     *
     * POST /api/v1/plans/commitments
     */
    @PostMapping("/commitments")
    public ResponseEntity<Plan> applyCommitments(@Valid @RequestBody ApplyCommitmentsRequest request) {
        try {
            Plan plan = commitmentApplier.apply(request.plan, CommitmentEntry.toCommitments(request.asCommitments));
            return ResponseEntity.ok(plan);
        } catch (Exception error) {
            logger.error("Error applying AS commitments", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * Validate a plan against the configured resource
     *
     * POST /api/v1/plans/validate
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationReport> validatePlan(@RequestBody Plan plan) {
        try {
            ValidationReport report = validator.validate(plan, resourceProfile);
            logger.debug("Validation requested for {}: {}", plan.resourceName, report.getSummary());
            return ResponseEntity.ok(report);
        } catch (Exception error) {
            logger.error("Error validating plan", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * Run the daily COP process
     *
     * POST /api/v1/plans/daily-run
     * Body: {"priceForecast": [...], "asCommitments": [...], "autoSubmit": false}
     */
    @PostMapping("/daily-run")
    public ResponseEntity<DailyRunResult> runDailyPlan(@RequestBody(required = false) DailyRunRequest request) {

        DailyRunRequest effective = request != null ? request : new DailyRunRequest();
        logger.info("Daily COP run triggered (autoSubmit={})", effective.autoSubmit);

        try {
            DailyRunResult result = operatingPlanService.runDailyPlan(
                    PricePoint.toForecast(effective.priceForecast),
                    CommitmentEntry.toCommitments(effective.asCommitments),
                    effective.autoSubmit);
            return ResponseEntity.ok(result);
        } catch (InvalidProfileException error) {
            logger.warn("Daily COP run rejected: {}", error.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).build();
        } catch (Exception error) {
            logger.error("Error during daily COP run", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * Get submission history
     *
     * GET /api/v1/plans/submissions
     */
    @GetMapping("/submissions")
    public ResponseEntity<List<SubmissionRecord>> getSubmissions() {
        return ResponseEntity.ok(planSubmitter.getSubmissionHistory());
    }

    /**
     * Check the status of a submitted COP
     *
     * GET /api/v1/plans/submissions/{planId}
     */
    @GetMapping("/submissions/{planId}")
    public ResponseEntity<SubmissionStatus> getSubmissionStatus(@PathVariable("planId") String planId) {
        SubmissionStatus status = planSubmitter.checkSubmissionStatus(planId);
        if (!status.found) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(status);
        }
        return ResponseEntity.ok(status);
    }

    /**
     * Health check endpoint
     *
     * GET /api/v1/plans/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {

        try {
            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("resourceName", resourceProfile.getResourceName());
            health.put("profileValid", resourceProfile.physicalViolations().isEmpty());
            health.put("horizonHours", planningProperties.getHorizonHours());
            health.put("submissions", planSubmitter.getSubmissionHistory().size());
            health.put("timestamp", System.currentTimeMillis());
            health.put("version", "1.0.0");

            return ResponseEntity.ok(health);
        } catch (Exception error) {
            logger.error("Error during health check", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}
