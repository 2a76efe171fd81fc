package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.config.PlanningProperties;
import com.example.Battery_Operating_Plan.config.SubmissionProperties;
import com.example.Battery_Operating_Plan.dto.DailyRunResult;
import com.example.Battery_Operating_Plan.dto.SubmissionResult;
import com.example.Battery_Operating_Plan.model.AsCommitment;
import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.ResourceProfile;
import com.example.Battery_Operating_Plan.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Daily COP process for the configured resource
 *
 * Generates a 7-day plan starting at the next market-day midnight, validates it,
 * and submits it only when it is valid, auto-submit is requested and the daily
 * submission cutoff has not passed.
 */
@Service
public class OperatingPlanService {

    private static final Logger logger = LoggerFactory.getLogger(OperatingPlanService.class);

    private final ResourceProfile resourceProfile;
    private final OperatingPlanGenerator generator;
    private final OperatingPlanValidator validator;
    private final PlanSubmitter submitter;
    private final PlanningProperties planningProperties;
    private final SubmissionProperties submissionProperties;
    private final Clock clock;

    public OperatingPlanService(ResourceProfile resourceProfile,
                                OperatingPlanGenerator generator,
                                OperatingPlanValidator validator,
                                PlanSubmitter submitter,
                                PlanningProperties planningProperties,
                                SubmissionProperties submissionProperties,
                                Clock clock) {
        this.resourceProfile = resourceProfile;
        this.generator = generator;
        this.validator = validator;
        this.submitter = submitter;
        this.planningProperties = planningProperties;
        this.submissionProperties = submissionProperties;
        this.clock = clock;
    }

    public DailyRunResult runDailyPlan(Map<LocalDateTime, Double> priceForecast,
                                       Map<LocalDateTime, AsCommitment> asCommitments,
                                       boolean autoSubmit) {
        logger.info("Starting daily COP generation process for {}", resourceProfile.getResourceName());

        ZonedDateTime marketNow = ZonedDateTime.now(clock).withZoneSameInstant(submissionProperties.getMarketZone());
        LocalDateTime startDate = marketNow.toLocalDate().plusDays(1).atStartOfDay();

        Plan plan = generator.generate(resourceProfile, startDate, planningProperties.getHorizonHours(),
                priceForecast, asCommitments);
        logger.info("Generated COP with {} hours", plan.size());

        ValidationReport validation = validator.validate(plan, resourceProfile);

        SubmissionResult submission;
        if (!validation.isValid()) {
            logger.error("COP validation FAILED: {} errors", validation.getErrorCount());
            submission = SubmissionResult.notSubmitted("Validation failed");
        } else if (!autoSubmit) {
            submission = SubmissionResult.notSubmitted("Auto-submit disabled");
        } else if (isPastCutoff(marketNow)) {
            logger.warn("COP not submitted: market time {} is past the daily cutoff {}",
                    marketNow.toLocalTime(), submissionProperties.getDailyCutoff());
            submission = SubmissionResult.notSubmitted("Submission deadline passed");
        } else {
            submission = submitter.submit(plan, submissionProperties.isTestMode());
            logger.info("COP submission result: {}", submission.status);
        }

        DailyRunResult result = new DailyRunResult();
        result.generationTime = LocalDateTime.now(clock);
        result.planSummary = new DailyRunResult.PlanSummary(plan);
        result.validation = validation;
        result.submission = submission;
        result.plan = validation.isValid() ? plan : null;
        return result;
    }

    /**
     * Whether a submission made now would miss the daily cutoff
     */
    public boolean isPastCutoff(ZonedDateTime marketNow) {
        LocalTime cutoff = submissionProperties.getDailyCutoff();
        return cutoff != null && marketNow.toLocalTime().isAfter(cutoff);
    }

    public ResourceProfile getResourceProfile() {
        return resourceProfile;
    }
}
