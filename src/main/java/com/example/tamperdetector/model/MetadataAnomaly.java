package com.example.tamperdetector.model;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Objects;

@Schema(description = "Suspicious condition found in the image metadata")
public record MetadataAnomaly(
        @Schema(description = "Anomaly category", example = "EDITING_SOFTWARE") AnomalyKind kind,
        @Schema(description = "Severity of the anomaly", example = "HIGH") Severity severity,
        @Schema(description = "Human readable explanation") String description) {

    public MetadataAnomaly {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        description = description == null ? "" : description;
    }
}
