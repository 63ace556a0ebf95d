package com.example.tamperdetector.service.detector;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.tamperdetector.TestImages;
import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.ImageMetadata;
import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.model.Severity;
import org.junit.jupiter.api.Test;

class AiGeneratedHeuristicDetectorTest {

    private final AiGeneratedHeuristicDetector detector = new AiGeneratedHeuristicDetector();

    @Test
    void smoothNoiselessImageWithoutCameraTagsIsFlagged() {
        Finding finding = detector.analyze(DetectionContext.of(TestImages.smoothGradient(128, 128)));

        assertThat(finding.triggered()).isTrue();
        assertThat(finding.score()).isGreaterThanOrEqualTo(0.5);
        assertThat(finding.severity()).isEqualTo(Severity.HIGH);
        assertThat(finding.description())
                .contains("Unnaturally smooth textures")
                .contains("Lack of natural camera noise")
                .contains("Missing camera metadata");
    }

    @Test
    void generatorSignatureRaisesSeverityToCritical() {
        ImageMetadata metadata = ImageMetadata.builder()
                .tag(ImageMetadata.SOFTWARE, "Stable Diffusion XL")
                .build();
        RasterImage image = TestImages.flat(96, 96, 200);

        Finding finding = detector.analyze(new DetectionContext(image, metadata, ThresholdConfig.defaults()));

        assertThat(finding.triggered()).isTrue();
        assertThat(finding.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(finding.score()).isEqualTo(1.0);
        assertThat(finding.description()).contains("AI software detected: stable diffusion xl")
                .doesNotContain("Missing camera metadata");
    }

    @Test
    void noisyCameraImageIsNotFlagged() {
        RasterImage image = TestImages.gaussianNoise(128, 128, 128, 20, 9L);

        Finding finding = detector.analyze(
                new DetectionContext(image, TestImages.cameraMetadata(), ThresholdConfig.defaults()));

        assertThat(finding.triggered()).isFalse();
        assertThat(finding.description()).doesNotContain("smooth").doesNotContain("camera noise");
    }

    @Test
    void shortToolNamesMatchWholeWordsOnly() {
        assertThat(AiGeneratedHeuristicDetector.namesAiTool("Midjourney v6")).isTrue();
        assertThat(AiGeneratedHeuristicDetector.namesAiTool("DALL-E 3")).isTrue();
        assertThat(AiGeneratedHeuristicDetector.namesAiTool("custom GAN renderer")).isTrue();
        assertThat(AiGeneratedHeuristicDetector.namesAiTool("Adobe Firefly (AI)")).isTrue();
        assertThat(AiGeneratedHeuristicDetector.namesAiTool("Paint Shop Pro")).isFalse();
        assertThat(AiGeneratedHeuristicDetector.namesAiTool("Organic camera firmware")).isFalse();
    }
}
