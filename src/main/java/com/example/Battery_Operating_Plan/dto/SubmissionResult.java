package com.example.Battery_Operating_Plan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a COP submission attempt
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubmissionResult {

    public enum Status {
        TEST_SUCCESS,
        SUCCESS,
        ERROR,
        NOT_SUBMITTED
    }

    public Status status;
    public String message;
    public String timestamp;
    public String planId;       // opaque id assigned by the market operator
    public Integer payloadSize; // bytes, test mode only
    public String error;

    public SubmissionResult() {}

    public SubmissionResult(Status status, String message, String timestamp) {
        this.status = status;
        this.message = message;
        this.timestamp = timestamp;
    }

    public static SubmissionResult notSubmitted(String message) {
        return new SubmissionResult(Status.NOT_SUBMITTED, message, null);
    }

    public boolean isAccepted() {
        return status == Status.SUCCESS || status == Status.TEST_SUCCESS;
    }
}
