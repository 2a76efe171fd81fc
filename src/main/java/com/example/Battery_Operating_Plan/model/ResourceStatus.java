package com.example.Battery_Operating_Plan.model;

/**
 * Resource Status codes reported per COP hour
 *
 * Each hour carries its own status; no transition rules are enforced
 * between consecutive hours (e.g. ON directly to OFF is accepted).
 */
public enum ResourceStatus {
    ON,         // Online and dispatchable
    OFF,        // Offline
    ONTEST,     // Testing
    ONREG,      // Providing Regulation
    ONRR,       // Providing Responsive Reserve
    ONECRS,     // Providing ERCOT Contingency Reserve Service
    OFFNS,      // Offline Non-Spin
    OFFQS,      // Offline Quick Start
    OUT,        // Forced outage
    STARTUP,
    SHUTDOWN,
    ONEMR       // Emergency run
}
