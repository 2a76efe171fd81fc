package com.example.Battery_Operating_Plan.dto;

import java.util.List;

/**
 * Data Transfer Object for triggering the daily COP run
 */
public class DailyRunRequest {

    public List<PricePoint> priceForecast;

    public List<CommitmentEntry> asCommitments;

    public boolean autoSubmit;

    public DailyRunRequest() {}
}
