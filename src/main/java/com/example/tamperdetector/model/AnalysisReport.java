package com.example.tamperdetector.model;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Aggregated verdict of one image analysis")
public record AnalysisReport(
        @Schema(description = "Whether the confidence score exceeded the forgery threshold")
        boolean tamperingDetected,
        @Schema(description = "Aggregated tampering confidence between 0 and 1", example = "0.52")
        double confidenceScore,
        @Schema(description = "Reviewer facing grade of the confidence score", example = "MEDIUM")
        RiskLevel riskLevel,
        @ArraySchema(arraySchema = @Schema(description = "Techniques that ran, in execution order"))
        List<Technique> techniquesUsed,
        @ArraySchema(arraySchema = @Schema(description = "One finding per pixel-level technique that ran"),
                schema = @Schema(implementation = Finding.class))
        List<Finding> findings,
        @ArraySchema(arraySchema = @Schema(description = "Metadata anomalies"),
                schema = @Schema(implementation = MetadataAnomaly.class))
        List<MetadataAnomaly> metadataIssues) {

    public AnalysisReport {
        confidenceScore = Finding.clamp(confidenceScore);
        techniquesUsed = techniquesUsed == null ? List.of() : List.copyOf(techniquesUsed);
        findings = findings == null ? List.of() : List.copyOf(findings);
        metadataIssues = metadataIssues == null ? List.of() : List.copyOf(metadataIssues);
        riskLevel = riskLevel == null ? RiskLevel.fromConfidence(confidenceScore) : riskLevel;
    }

    public List<Finding> triggeredFindings() {
        return findings.stream().filter(Finding::triggered).toList();
    }
}
