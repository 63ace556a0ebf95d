package com.example.tamperdetector.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Raw {@code forensics.*} settings. Threshold and technique keys are resolved and range-checked
 * by {@link ThresholdConfig#fromMap(Map)} and {@link AnalysisConfig#fromMap(Map)}.
 */
@Validated
@ConfigurationProperties(prefix = "forensics", ignoreUnknownFields = false)
public class ForensicsProperties {

    @NotNull
    private Map<String, Double> thresholds = new LinkedHashMap<>();

    @NotNull
    private Map<String, Boolean> techniques = new LinkedHashMap<>();

    @Min(0)
    @Max(64)
    private int parallelism = 0;

    public Map<String, Double> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<String, Double> thresholds) {
        this.thresholds = thresholds;
    }

    public Map<String, Boolean> getTechniques() {
        return techniques;
    }

    public void setTechniques(Map<String, Boolean> techniques) {
        this.techniques = techniques;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }
}
