package com.example.Battery_Operating_Plan.dto;

import com.example.Battery_Operating_Plan.model.Plan;
import com.example.Battery_Operating_Plan.model.ValidationReport;

import java.time.LocalDateTime;

/**
 * Result of the daily COP run: generation summary, validation and submission outcome.
 * The plan itself is only included when it passed validation.
 */
public class DailyRunResult {

    public LocalDateTime generationTime;
    public PlanSummary planSummary;
    public ValidationReport validation;
    public SubmissionResult submission;
    public Plan plan;

    public DailyRunResult() {}

    public static class PlanSummary {
        public String resourceName;
        public int hours;
        public LocalDateTime start;
        public LocalDateTime end;

        public PlanSummary(Plan plan) {
            this.resourceName = plan.resourceName;
            this.hours = plan.size();
            this.start = plan.getStart();
            this.end = plan.getEnd();
        }
    }
}
