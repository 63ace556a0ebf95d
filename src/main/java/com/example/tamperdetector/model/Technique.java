package com.example.tamperdetector.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Forensic techniques known to the analysis battery. Declaration order is the order in which
 * the techniques run and appear in {@link AnalysisReport#techniquesUsed()}.
 */
@Schema(description = "Forensic technique applied to the image", enumAsRef = true)
public enum Technique {
    ERROR_LEVEL_ANALYSIS("error_level_analysis", "Error Level Analysis"),
    METADATA_ANALYSIS("metadata_analysis", "Metadata Analysis"),
    COPY_MOVE("copy_move", "Copy-Move Forgery Detection"),
    NOISE_PATTERN("noise_pattern", "Noise Pattern Analysis"),
    DOUBLE_COMPRESSION("double_compression", "Double JPEG Detection"),
    SPLICING("splicing", "Splicing Detection"),
    AI_GENERATED("ai_generated", "AI-Generated Image Detection"),
    FREQUENCY_DOMAIN("frequency_domain", "Frequency Domain Analysis");

    private final String id;
    private final String displayName;

    Technique(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * Stable snake_case identifier used in reports and log output.
     */
    @Schema(description = "Stable technique identifier", example = "error_level_analysis")
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }
}
