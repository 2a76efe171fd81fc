package com.example.Battery_Operating_Plan.model;

/**
 * ERROR blocks submission, WARNING is informational only
 */
public enum Severity {
    ERROR,
    WARNING
}
