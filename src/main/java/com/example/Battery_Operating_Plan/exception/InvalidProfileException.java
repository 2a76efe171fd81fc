package com.example.Battery_Operating_Plan.exception;

import java.util.List;

/**
 * Raised when a resource profile is not physically meaningful and no plan can be built for it
 */
public class InvalidProfileException extends RuntimeException {

    private final List<String> violations;

    public InvalidProfileException(String resourceName, List<String> violations) {
        super(String.format("Invalid resource profile '%s': %s", resourceName, String.join("; ", violations)));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
