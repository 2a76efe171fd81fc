package com.example.Battery_Operating_Plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Beginning-of-hour SOC values (MWh) paired with the planned MW of each hour.
 * Input and output of feasibility enforcement; arrays are defensively copied.
 */
public final class SocSequence {

    private final double[] socBegin;
    private final double[] targetMw;
    private final int repairCount;

    public SocSequence(double[] socBegin, double[] targetMw) {
        this(socBegin, targetMw, 0);
    }

    @JsonCreator
    public SocSequence(@JsonProperty("socBegin") double[] socBegin,
                       @JsonProperty("targetMw") double[] targetMw,
                       @JsonProperty("repairCount") int repairCount) {
        Objects.requireNonNull(socBegin, "SOC sequence cannot be null");
        this.socBegin = socBegin.clone();
        this.targetMw = targetMw != null ? targetMw.clone() : new double[socBegin.length];
        if (this.targetMw.length != this.socBegin.length) {
            throw new IllegalArgumentException(String.format(
                    "targetMw length %d does not match socBegin length %d",
                    this.targetMw.length, this.socBegin.length));
        }
        this.repairCount = repairCount;
    }

    public static SocSequence ofSoc(double... socBegin) {
        return new SocSequence(socBegin, null);
    }

    public double[] getSocBegin() {
        return socBegin.clone();
    }

    public double[] getTargetMw() {
        return targetMw.clone();
    }

    /**
     * Number of pairwise clamps applied when this sequence was produced by enforcement
     */
    public int getRepairCount() {
        return repairCount;
    }

    public int length() {
        return socBegin.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SocSequence that = (SocSequence) o;
        return Arrays.equals(socBegin, that.socBegin) && Arrays.equals(targetMw, that.targetMw);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(socBegin) + Arrays.hashCode(targetMw);
    }

    @Override
    public String toString() {
        return String.format("SocSequence{soc=%s, target=%s, repairs=%d}",
                Arrays.toString(socBegin), Arrays.toString(targetMw), repairCount);
    }
}
