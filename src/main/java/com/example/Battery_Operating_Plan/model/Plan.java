package com.example.Battery_Operating_Plan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Current Operating Plan for one resource: ordered, contiguous hourly records
 */
public class Plan {

    @JsonProperty("resourceName")
    public String resourceName;

    @JsonProperty("hours")
    public List<PlanHour> hours = new ArrayList<>();

    public Plan() {}

    public Plan(String resourceName, List<PlanHour> hours) {
        this.resourceName = resourceName;
        this.hours = hours;
    }

    @JsonIgnore
    public int size() {
        return hours != null ? hours.size() : 0;
    }

    public PlanHour hour(int index) {
        return hours.get(index);
    }

    @JsonIgnore
    public LocalDateTime getStart() {
        return size() > 0 ? hours.get(0).hourEnding : null;
    }

    @JsonIgnore
    public LocalDateTime getEnd() {
        return size() > 0 ? hours.get(size() - 1).hourEnding : null;
    }

    /**
     * Deep copy: hour records are cloned so the copy can be modified freely
     */
    public Plan copy() {
        List<PlanHour> copiedHours = new ArrayList<>(size());
        if (hours != null) {
            hours.forEach(hour -> copiedHours.add(hour != null ? hour.copy() : null));
        }
        return new Plan(resourceName, copiedHours);
    }

    @Override
    public String toString() {
        return String.format("Plan{resource='%s', hours=%d, start=%s, end=%s}",
                resourceName, size(), getStart(), getEnd());
    }
}
