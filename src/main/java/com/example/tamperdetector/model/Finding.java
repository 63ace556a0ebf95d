package com.example.tamperdetector.model;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a single detector run. The score is clamped into {@code [0, 1]} on construction
 * so no detector can leak an out-of-range or NaN value into the aggregation step.
 */
@Schema(description = "Result produced by one forensic technique")
public record Finding(
        @Schema(description = "Technique that produced the finding", example = "COPY_MOVE") Technique technique,
        @Schema(description = "Whether the technique considers the image suspicious") boolean triggered,
        @Schema(description = "Technique score between 0 and 1", example = "0.42") double score,
        @Schema(description = "Severity of the finding", example = "HIGH") Severity severity,
        @Schema(description = "Human readable explanation") String description,
        @ArraySchema(arraySchema = @Schema(description = "Suspicious regions, when the technique localises them"),
                schema = @Schema(implementation = BoundingBox.class))
        List<BoundingBox> regions) {

    public Finding {
        Objects.requireNonNull(technique, "technique");
        Objects.requireNonNull(severity, "severity");
        score = clamp(score);
        description = description == null ? "" : description;
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    public static Finding triggered(Technique technique, double score, Severity severity, String description) {
        return new Finding(technique, true, score, severity, description, List.of());
    }

    public static Finding clean(Technique technique, double score, String description) {
        return new Finding(technique, false, score, Severity.LOW, description, List.of());
    }

    /**
     * Substitute used when a technique could not complete. Never triggered, never scored.
     */
    public static Finding failed(Technique technique, String description) {
        return new Finding(technique, false, 0.0, Severity.INFO, description, List.of());
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
