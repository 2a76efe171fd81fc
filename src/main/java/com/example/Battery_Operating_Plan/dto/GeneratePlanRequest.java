package com.example.Battery_Operating_Plan.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Data Transfer Object for plan generation
 */
public class GeneratePlanRequest {

    @NotNull
    public LocalDateTime startTime;

    public Integer horizonHours; // defaults to the configured horizon

    public Double initialSoc; // MWh, defaults to 50% of max SOC

    public List<PricePoint> priceForecast;

    public List<CommitmentEntry> asCommitments;

    public GeneratePlanRequest() {}

    public GeneratePlanRequest(LocalDateTime startTime, Integer horizonHours) {
        this.startTime = startTime;
        this.horizonHours = horizonHours;
    }
}
