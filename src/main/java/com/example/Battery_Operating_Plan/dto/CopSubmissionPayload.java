package com.example.Battery_Operating_Plan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Market submission body: {"cop_submission": {"qse_name", "submission_time", "cop_data": [...]}}
 */
public class CopSubmissionPayload {

    @JsonProperty("cop_submission")
    public Submission copSubmission;

    public CopSubmissionPayload() {}

    public CopSubmissionPayload(String qseName, String submissionTime, List<CopEntry> copData) {
        this.copSubmission = new Submission(qseName, submissionTime, copData);
    }

    public static class Submission {

        @JsonProperty("qse_name")
        public String qseName;

        @JsonProperty("submission_time")
        public String submissionTime;

        @JsonProperty("cop_data")
        public List<CopEntry> copData;

        public Submission() {}

        public Submission(String qseName, String submissionTime, List<CopEntry> copData) {
            this.qseName = qseName;
            this.submissionTime = submissionTime;
            this.copData = copData;
        }
    }

    /**
     * One hourly COP record in market field naming
     */
    public static class CopEntry {

        @JsonProperty("hour_ending")
        public String hourEnding;

        @JsonProperty("resource_name")
        public String resourceName;

        @JsonProperty("resource_status")
        public String resourceStatus;

        @JsonProperty("hsl")
        public Double hsl;

        @JsonProperty("lsl")
        public Double lsl;

        @JsonProperty("hel")
        public Double hel;

        @JsonProperty("lel")
        public Double lel;

        @JsonProperty("normal_ramp_rate_up")
        public Double normalRampRateUp;

        @JsonProperty("normal_ramp_rate_down")
        public Double normalRampRateDown;

        @JsonProperty("emergency_ramp_rate_up")
        public Double emergencyRampRateUp;

        @JsonProperty("emergency_ramp_rate_down")
        public Double emergencyRampRateDown;

        @JsonProperty("minimum_soc")
        public Double minimumSoc;

        @JsonProperty("maximum_soc")
        public Double maximumSoc;

        @JsonProperty("hour_beginning_planned_soc")
        public Double hourBeginningPlannedSoc;

        public CopEntry() {}
    }
}
