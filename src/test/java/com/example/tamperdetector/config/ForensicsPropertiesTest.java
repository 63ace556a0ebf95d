package com.example.tamperdetector.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.service.TamperAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "forensics.thresholds.ela-threshold=18",
        "forensics.thresholds.forgery-confidence=0.4",
        "forensics.techniques.enable-frequency=false",
        "forensics.parallelism=2"
})
class ForensicsPropertiesTest {

    @Autowired
    private ForensicsProperties properties;

    @Autowired
    private ThresholdConfig thresholds;

    @Autowired
    private AnalysisConfig analysisConfig;

    @Autowired
    private TamperAnalysisService service;

    @Test
    void bindsOverridesOnTopOfDefaults() {
        assertThat(thresholds.elaThreshold()).isEqualTo(18);
        assertThat(thresholds.forgeryConfidence()).isEqualTo(0.4);
        assertThat(thresholds.copyMoveRatio()).isEqualTo(0.7);
        assertThat(analysisConfig.isEnabled(Technique.FREQUENCY_DOMAIN)).isFalse();
        assertThat(analysisConfig.isEnabled(Technique.METADATA_ANALYSIS)).isTrue();
        assertThat(properties.getParallelism()).isEqualTo(2);
        assertThat(service).isNotNull();
    }
}
