package com.example.Battery_Operating_Plan.dto;

import java.time.LocalDateTime;

/**
 * Submission history entry
 */
public class SubmissionRecord {

    public LocalDateTime timestamp;
    public SubmissionResult result;
    public int hours;
    public LocalDateTime start;
    public LocalDateTime end;

    public SubmissionRecord() {}

    public SubmissionRecord(LocalDateTime timestamp, SubmissionResult result, int hours,
                            LocalDateTime start, LocalDateTime end) {
        this.timestamp = timestamp;
        this.result = result;
        this.hours = hours;
        this.start = start;
        this.end = end;
    }
}
