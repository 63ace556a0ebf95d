package com.example.tamperdetector.model;

/**
 * Coarse grading of a confidence score for reviewers.
 */
public enum RiskLevel {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromConfidence(double confidence) {
        if (confidence >= 0.8) {
            return CRITICAL;
        }
        if (confidence >= 0.6) {
            return HIGH;
        }
        if (confidence >= 0.4) {
            return MEDIUM;
        }
        if (confidence >= 0.2) {
            return LOW;
        }
        return MINIMAL;
    }
}
