package com.example.Battery_Operating_Plan.dto;

import com.example.Battery_Operating_Plan.model.AsCommitment;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ancillary service award for one hour as received over the API
 */
public class CommitmentEntry {

    public LocalDateTime hourEnding;

    public double regulationMw;

    public double responsiveReserveMw;

    public double ecrsMw;

    public CommitmentEntry() {}

    public CommitmentEntry(LocalDateTime hourEnding, double regulationMw, double responsiveReserveMw, double ecrsMw) {
        this.hourEnding = hourEnding;
        this.regulationMw = regulationMw;
        this.responsiveReserveMw = responsiveReserveMw;
        this.ecrsMw = ecrsMw;
    }

    public static Map<LocalDateTime, AsCommitment> toCommitments(List<CommitmentEntry> entries) {
        if (entries == null) {
            return null;
        }
        Map<LocalDateTime, AsCommitment> commitments = new LinkedHashMap<>();
        for (CommitmentEntry entry : entries) {
            if (entry != null && entry.hourEnding != null) {
                commitments.put(entry.hourEnding,
                        new AsCommitment(entry.regulationMw, entry.responsiveReserveMw, entry.ecrsMw));
            }
        }
        return commitments;
    }
}
