package com.example.Battery_Operating_Plan.dto;

import com.example.Battery_Operating_Plan.model.Plan;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Data Transfer Object for overlaying AS commitments on an existing plan
 */
public class ApplyCommitmentsRequest {

    @NotNull
    public Plan plan;

    public List<CommitmentEntry> asCommitments;

    public ApplyCommitmentsRequest() {}
}
