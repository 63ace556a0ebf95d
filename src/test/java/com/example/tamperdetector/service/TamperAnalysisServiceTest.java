package com.example.tamperdetector.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.tamperdetector.TestImages;
import com.example.tamperdetector.config.AnalysisConfig;
import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.AnalysisReport;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.ImageMetadata;
import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.model.Severity;
import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.service.detector.AiGeneratedHeuristicDetector;
import com.example.tamperdetector.service.detector.CopyMoveDetector;
import com.example.tamperdetector.service.detector.DetectionContext;
import com.example.tamperdetector.service.detector.DoubleCompressionDetector;
import com.example.tamperdetector.service.detector.ErrorLevelAnalysisDetector;
import com.example.tamperdetector.service.detector.ForensicDetector;
import com.example.tamperdetector.service.detector.FrequencyDomainDetector;
import com.example.tamperdetector.service.detector.NoisePatternDetector;
import com.example.tamperdetector.service.detector.SplicingDetector;
import com.example.tamperdetector.service.loading.ImageLoadException;
import com.example.tamperdetector.service.loading.RasterImageLoader;
import com.example.tamperdetector.service.metadata.MetadataAnomalyScorer;
import com.example.tamperdetector.service.pipeline.ConfidenceAggregator;
import com.example.tamperdetector.util.ImageUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TamperAnalysisServiceTest {

    private final RasterImageLoader loader = new RasterImageLoader();
    private final List<TamperAnalysisService> services = new ArrayList<>();
    private TamperAnalysisService service;

    @BeforeEach
    void setUp() {
        service = newService(battery(), null);
    }

    @AfterEach
    void tearDown() {
        services.forEach(TamperAnalysisService::close);
    }

    @Test
    void naturalCameraImageIsNotFlagged() {
        RasterImage photo = loader.load(jpeg(TestImages.gaussianNoise(256, 256, 128, 8, 42L), 90));
        // sensor noise keeps the log spectrum near std/mean 0.09
        ThresholdConfig calibrated = ThresholdConfig.fromMap(Map.of("frequency_uniform_ratio", 0.04));

        AnalysisReport report = service.analyze(photo, TestImages.cameraMetadata(), calibrated,
                AnalysisConfig.allEnabled());

        assertThat(report.tamperingDetected()).isFalse();
        assertThat(report.confidenceScore()).isLessThan(0.35);
        assertThat(report.metadataIssues()).isEmpty();
        assertThat(report.techniquesUsed()).containsExactly(Technique.values());
        assertThat(report.findings()).hasSize(7);
        assertThat(findingFor(report, Technique.FREQUENCY_DOMAIN).triggered()).isFalse();
        assertThat(report.findings()).allSatisfy(finding -> assertThat(finding.score()).isBetween(0.0, 1.0));
    }

    @Test
    void defaultFrequencyCalibrationReadsSensorNoiseAsUniformSpectrum() {
        RasterImage photo = loader.load(jpeg(TestImages.gaussianNoise(256, 256, 128, 8, 42L), 90));

        AnalysisReport report = service.analyze(photo, TestImages.cameraMetadata());

        assertThat(report.triggeredFindings()).singleElement().satisfies(finding -> {
            assertThat(finding.technique()).isEqualTo(Technique.FREQUENCY_DOMAIN);
            assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(finding.description()).startsWith("Unusually uniform frequency distribution");
        });
        assertThat(report.confidenceScore()).isCloseTo(0.6, within(1e-12));
        assertThat(report.tamperingDetected()).isTrue();
    }

    @Test
    void blurredStrippedSyntheticImageIsFlagged() {
        AnalysisReport report = service.analyze(TestImages.smoothGradient(256, 256), ImageMetadata.empty());

        Finding ai = findingFor(report, Technique.AI_GENERATED);
        assertThat(ai.triggered()).isTrue();
        assertThat(ai.score()).isGreaterThanOrEqualTo(0.5);
        assertThat(report.confidenceScore()).isGreaterThan(0.35);
        assertThat(report.tamperingDetected()).isTrue();
        assertThat(report.metadataIssues()).hasSize(2);
    }

    @Test
    void runsEveryEnabledTechniqueInCanonicalOrder() {
        AnalysisReport report = service.analyze(TestImages.halves(128, 128, 60, 180), ImageMetadata.empty());

        assertThat(report.techniquesUsed()).containsExactly(Technique.values());
        assertThat(report.findings()).extracting(Finding::technique).containsExactly(
                Technique.ERROR_LEVEL_ANALYSIS,
                Technique.COPY_MOVE,
                Technique.NOISE_PATTERN,
                Technique.DOUBLE_COMPRESSION,
                Technique.SPLICING,
                Technique.AI_GENERATED,
                Technique.FREQUENCY_DOMAIN);
    }

    @Test
    void repeatedAnalysisIsDeterministic() {
        RasterImage image = TestImages.halfNoisy(128, 128, 15, 8L);

        AnalysisReport first = service.analyze(image, TestImages.cameraMetadata());
        AnalysisReport second = service.analyze(image, TestImages.cameraMetadata());

        assertThat(second).isEqualTo(first);
    }

    @Test
    void pooledExecutionMatchesSequentialExecution() {
        TamperAnalysisService pooled = newService(battery(), Executors.newFixedThreadPool(3));
        RasterImage image = TestImages.halfNoisy(128, 128, 15, 8L);

        AnalysisReport sequential = service.analyze(image, ImageMetadata.empty());
        AnalysisReport parallel = pooled.analyze(image, ImageMetadata.empty());

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void disabledTechniquesAreSkipped() {
        AnalysisReport report = service.analyze(TestImages.halves(128, 128, 40, 200), ImageMetadata.empty(),
                ThresholdConfig.defaults(), AnalysisConfig.only(Technique.SPLICING));

        assertThat(report.techniquesUsed()).containsExactly(Technique.SPLICING);
        assertThat(report.findings()).singleElement().extracting(Finding::technique).isEqualTo(Technique.SPLICING);
        assertThat(report.metadataIssues()).isEmpty();
    }

    @Test
    void metadataOnlyAnalysisScoresAnomalies() {
        AnalysisReport report = service.analyze(TestImages.flat(64, 64, 10), ImageMetadata.empty(),
                ThresholdConfig.defaults(), AnalysisConfig.only(Technique.METADATA_ANALYSIS));

        assertThat(report.techniquesUsed()).containsExactly(Technique.METADATA_ANALYSIS);
        assertThat(report.findings()).isEmpty();
        assertThat(report.confidenceScore()).isCloseTo(0.6, within(1e-12));
        assertThat(report.tamperingDetected()).isTrue();
    }

    @Test
    void undecodablePayloadAbortsTheAnalysis() {
        assertThatThrownBy(() -> service.analyze(new byte[] {0x42, 0x13, 0x37}, ImageMetadata.empty()))
                .isInstanceOf(ImageLoadException.class);
    }

    @Test
    void misbehavingDetectorIsDegradedToInformationalFinding() {
        TamperAnalysisService guarded = newService(List.of(new SplicingDetector(), throwing()), null);

        AnalysisReport report = guarded.analyze(TestImages.flat(64, 64, 128), TestImages.cameraMetadata());

        Finding failed = findingFor(report, Technique.NOISE_PATTERN);
        assertThat(failed.severity()).isEqualTo(Severity.INFO);
        assertThat(failed.description()).contains("boom");
        assertThat(report.confidenceScore()).isZero();
    }

    @Test
    void slowAnalysisTimesOut() {
        TamperAnalysisService slow = newService(List.of(sleeping()), null);

        assertThatThrownBy(() -> slow.analyze(TestImages.flat(16, 16, 0), ImageMetadata.empty(),
                Duration.ofMillis(100)))
                .isInstanceOf(AnalysisTimeoutException.class)
                .hasMessageContaining("PT0.1S");
    }

    @Test
    void analysisWithinTimeoutReturnsTheReport() {
        AnalysisReport report = service.analyze(TestImages.flat(64, 64, 90), TestImages.cameraMetadata(),
                Duration.ofSeconds(30));

        assertThat(report.techniquesUsed()).hasSize(Technique.values().length);
        assertThat(report.findings()).hasSize(7);
        assertThat(report.metadataIssues()).isEmpty();
    }

    @Test
    void rejectsTwoDetectorsForOneTechnique() {
        assertThatThrownBy(() -> newService(List.of(new SplicingDetector(), new SplicingDetector()), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate detector for technique 'splicing'");
    }

    private TamperAnalysisService newService(List<? extends ForensicDetector> detectors, ExecutorService pool) {
        TamperAnalysisService created = new TamperAnalysisService(detectors, new MetadataAnomalyScorer(),
                new ConfidenceAggregator(), loader, ThresholdConfig.defaults(), AnalysisConfig.allEnabled(), pool);
        services.add(created);
        return created;
    }

    // registration order differs from execution order on purpose
    private static List<ForensicDetector> battery() {
        return List.of(
                new FrequencyDomainDetector(),
                new SplicingDetector(),
                new ErrorLevelAnalysisDetector(),
                new AiGeneratedHeuristicDetector(),
                new CopyMoveDetector(),
                new DoubleCompressionDetector(),
                new NoisePatternDetector());
    }

    private static Finding findingFor(AnalysisReport report, Technique technique) {
        return report.findings().stream()
                .filter(finding -> finding.technique() == technique)
                .findFirst()
                .orElseThrow();
    }

    private static byte[] jpeg(RasterImage image, int quality) {
        Mat bgr = ImageUtils.toBgrMat(image);
        try {
            return ImageUtils.encode(bgr, ".jpg", opencv_imgcodecs.IMWRITE_JPEG_QUALITY, quality);
        } finally {
            bgr.close();
        }
    }

    private static ForensicDetector throwing() {
        return new ForensicDetector() {
            @Override
            public Technique technique() {
                return Technique.NOISE_PATTERN;
            }

            @Override
            public Finding analyze(DetectionContext context) {
                throw new IllegalStateException("boom");
            }
        };
    }

    private static ForensicDetector sleeping() {
        return new ForensicDetector() {
            @Override
            public Technique technique() {
                return Technique.FREQUENCY_DOMAIN;
            }

            @Override
            public Finding analyze(DetectionContext context) {
                try {
                    TimeUnit.SECONDS.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Finding.failed(technique(), "interrupted");
            }
        };
    }
}
