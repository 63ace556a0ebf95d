package com.example.tamperdetector.model;

public enum AnomalyKind {
    MISSING_METADATA("Missing Metadata"),
    EDITING_SOFTWARE("Editing Software Detected"),
    DATE_INCONSISTENCY("Date Inconsistency"),
    STRIPPED_METADATA("Stripped Metadata"),
    INVALID_METADATA("Invalid Metadata"),
    EXTRACTION_ERROR("Metadata Extraction Error");

    private final String label;

    AnomalyKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
