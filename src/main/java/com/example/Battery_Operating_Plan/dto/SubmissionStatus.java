package com.example.Battery_Operating_Plan.dto;

/**
 * Status of a previously submitted COP, looked up by its plan id
 */
public class SubmissionStatus {

    public String planId;
    public boolean found;
    public SubmissionResult.Status status; // null when the id is unknown
    public String message;
    public String timestamp;

    public SubmissionStatus() {}

    public SubmissionStatus(String planId, SubmissionResult result) {
        this.planId = planId;
        this.found = true;
        this.status = result.status;
        this.message = result.message;
        this.timestamp = result.timestamp;
    }

    public static SubmissionStatus notFound(String planId) {
        SubmissionStatus status = new SubmissionStatus();
        status.planId = planId;
        status.found = false;
        status.message = "No submission recorded for plan id " + planId;
        return status;
    }
}
