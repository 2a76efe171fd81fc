package com.example.Battery_Operating_Plan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ancillary service award for one hour, as supplied by the AS commitment provider
 */
public class AsCommitment {

    @JsonProperty("regulationMw")
    public double regulationMw;

    @JsonProperty("responsiveReserveMw")
    public double responsiveReserveMw; // RRS - 1 hour of energy held

    @JsonProperty("ecrsMw")
    public double ecrsMw; // ECRS - 2 hours of energy held

    public AsCommitment() {}

    public AsCommitment(double regulationMw, double responsiveReserveMw, double ecrsMw) {
        this.regulationMw = regulationMw;
        this.responsiveReserveMw = responsiveReserveMw;
        this.ecrsMw = ecrsMw;
    }

    @Override
    public String toString() {
        return String.format("AS{reg=%.1fMW, rrs=%.1fMW, ecrs=%.1fMW}",
                regulationMw, responsiveReserveMw, ecrsMw);
    }
}
