package com.example.Battery_Operating_Plan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Outcome of one COP validation run. Built fresh per call, never shared.
 */
public final class ValidationReport {

    private final List<ValidationFinding> errors;
    private final List<ValidationFinding> warnings;

    public ValidationReport(List<ValidationFinding> errors, List<ValidationFinding> warnings) {
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    @JsonProperty("errors")
    public List<ValidationFinding> getErrors() {
        return errors;
    }

    @JsonProperty("warnings")
    public List<ValidationFinding> getWarnings() {
        return warnings;
    }

    @JsonProperty("errorCount")
    public int getErrorCount() {
        return errors.size();
    }

    @JsonProperty("warningCount")
    public int getWarningCount() {
        return warnings.size();
    }

    @JsonProperty("summary")
    public String getSummary() {
        if (isValid()) {
            return "COP validation PASSED - ready for submission";
        }
        return String.format("COP validation FAILED - %d errors: %s",
                errors.size(), String.join(", ", getErrorTypes().stream()
                        .map(Enum::name)
                        .collect(Collectors.toList())));
    }

    public Set<FindingType> getErrorTypes() {
        return errors.stream()
                .map(ValidationFinding::getType)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public boolean hasFinding(FindingType type) {
        return errors.stream().anyMatch(f -> f.getType() == type)
                || warnings.stream().anyMatch(f -> f.getType() == type);
    }

    @Override
    public String toString() {
        return String.format("ValidationReport{valid=%s, errors=%d, warnings=%d}",
                isValid(), errors.size(), warnings.size());
    }
}
