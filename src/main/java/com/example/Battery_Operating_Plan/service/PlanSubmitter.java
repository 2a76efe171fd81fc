package com.example.Battery_Operating_Plan.service;

import com.example.Battery_Operating_Plan.dto.SubmissionRecord;
import com.example.Battery_Operating_Plan.dto.SubmissionResult;
import com.example.Battery_Operating_Plan.dto.SubmissionStatus;
import com.example.Battery_Operating_Plan.model.Plan;

import java.util.List;

/**
 * Market operator submission service. Only plans that passed validation should be handed over.
 */
public interface PlanSubmitter {

    /**
     * @param plan Validated plan
     * @param testMode Format and size the payload without sending it
     * @return Outcome; failures are reported as {@link SubmissionResult.Status#ERROR}, not thrown
     */
    SubmissionResult submit(Plan plan, boolean testMode);

    List<SubmissionRecord> getSubmissionHistory();

    /**
     * @param planId Id returned by an earlier submission
     * @return Recorded outcome, or a not-found status when the id is unknown
     */
    SubmissionStatus checkSubmissionStatus(String planId);
}
