package com.example.tamperdetector.service;

import com.example.tamperdetector.config.AnalysisConfig;
import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.AnalysisReport;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.ImageMetadata;
import com.example.tamperdetector.model.MetadataAnomaly;
import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.service.detector.DetectionContext;
import com.example.tamperdetector.service.detector.ForensicDetector;
import com.example.tamperdetector.service.loading.RasterImageLoader;
import com.example.tamperdetector.service.metadata.MetadataAnomalyScorer;
import com.example.tamperdetector.service.pipeline.ConfidenceAggregator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs the enabled forensic techniques over one image and folds their findings into an
 * {@link AnalysisReport}. Detectors execute in canonical technique order, either on the
 * calling thread or on the optional detector pool; the report is identical in both modes.
 */
public class TamperAnalysisService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TamperAnalysisService.class);

    private final List<ForensicDetector> detectors;
    private final MetadataAnomalyScorer metadataScorer;
    private final ConfidenceAggregator aggregator;
    private final RasterImageLoader loader;
    private final ThresholdConfig thresholds;
    private final AnalysisConfig analysisConfig;
    private final ExecutorService detectorPool;
    private final ExecutorService analysisExecutor;

    /**
     * @param detectorPool worker pool for detectors, or {@code null} to run them sequentially;
     *                     the service takes ownership and shuts it down on {@link #close()}
     */
    public TamperAnalysisService(List<? extends ForensicDetector> detectors,
                                 MetadataAnomalyScorer metadataScorer,
                                 ConfidenceAggregator aggregator,
                                 RasterImageLoader loader,
                                 ThresholdConfig thresholds,
                                 AnalysisConfig analysisConfig,
                                 ExecutorService detectorPool) {
        this.detectors = indexByTechnique(detectors);
        this.metadataScorer = Objects.requireNonNull(metadataScorer, "metadataScorer");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.analysisConfig = Objects.requireNonNull(analysisConfig, "analysisConfig");
        this.detectorPool = detectorPool;
        this.analysisExecutor = Executors.newCachedThreadPool(daemonThreads("tamper-analysis-"));
        log.info("Tamper analysis ready with {} detectors ({} execution)", this.detectors.size(),
                detectorPool == null ? "sequential" : "pooled");
    }

    public AnalysisReport analyze(RasterImage image, ImageMetadata metadata) {
        return analyze(image, metadata, thresholds, analysisConfig);
    }

    /**
     * Decodes the payload first; a payload that cannot be decoded raises
     * {@link com.example.tamperdetector.service.loading.ImageLoadException}.
     */
    public AnalysisReport analyze(byte[] imageBytes, ImageMetadata metadata) {
        return analyze(loader.load(imageBytes), metadata);
    }

    public AnalysisReport analyze(RasterImage image, ImageMetadata metadata, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Future<AnalysisReport> task = analysisExecutor.submit(() -> analyze(image, metadata));
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException exception) {
            task.cancel(true);
            log.warn("Analysis cancelled after {}", timeout);
            throw new AnalysisTimeoutException(timeout, exception);
        } catch (InterruptedException exception) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for analysis", exception);
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Analysis failed", cause);
        }
    }

    public AnalysisReport analyze(RasterImage image, ImageMetadata metadata,
                                  ThresholdConfig thresholds, AnalysisConfig config) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(config, "config");
        ImageMetadata tags = metadata == null ? ImageMetadata.empty() : metadata;
        DetectionContext context = new DetectionContext(image, tags, thresholds);
        log.info("Analyzing {}x{} image with {} techniques", image.width(), image.height(),
                config.enabledTechniques().size());

        List<ForensicDetector> active = detectors.stream()
                .filter(detector -> config.isEnabled(detector.technique()))
                .toList();
        List<Finding> findings = detectorPool == null
                ? runSequentially(active, context)
                : runPooled(active, context);

        List<MetadataAnomaly> anomalies = config.isEnabled(Technique.METADATA_ANALYSIS)
                ? metadataScorer.score(tags)
                : List.of();

        List<Technique> techniquesUsed = new ArrayList<>();
        for (Technique technique : Technique.values()) {
            boolean ran = technique == Technique.METADATA_ANALYSIS
                    ? config.isEnabled(technique)
                    : active.stream().anyMatch(detector -> detector.technique() == technique);
            if (ran) {
                techniquesUsed.add(technique);
            }
        }

        AnalysisReport report = aggregator.aggregate(techniquesUsed, findings, anomalies, thresholds);
        log.info("Analysis complete: confidence {} ({}), tampering detected: {}",
                String.format(Locale.ROOT, "%.2f", report.confidenceScore()),
                report.riskLevel(), report.tamperingDetected());
        return report;
    }

    private List<Finding> runSequentially(List<ForensicDetector> active, DetectionContext context) {
        List<Finding> findings = new ArrayList<>(active.size());
        for (ForensicDetector detector : active) {
            findings.add(runGuarded(detector, context));
        }
        return findings;
    }

    private List<Finding> runPooled(List<ForensicDetector> active, DetectionContext context) {
        List<Future<Finding>> futures = new ArrayList<>(active.size());
        for (ForensicDetector detector : active) {
            futures.add(detectorPool.submit(() -> runGuarded(detector, context)));
        }
        List<Finding> findings = new ArrayList<>(active.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                Technique technique = active.get(i).technique();
                try {
                    findings.add(futures.get(i).get());
                } catch (ExecutionException exception) {
                    log.warn("{} failed on the detector pool", technique.displayName(), exception.getCause());
                    findings.add(Finding.failed(technique,
                            technique.displayName() + " error: " + exception.getCause().getMessage()));
                }
            }
        } catch (InterruptedException exception) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running detectors", exception);
        }
        return findings;
    }

    // detectors built on AbstractForensicDetector never throw; third-party implementations might
    private Finding runGuarded(ForensicDetector detector, DetectionContext context) {
        try {
            return detector.analyze(context);
        } catch (RuntimeException exception) {
            Technique technique = detector.technique();
            log.warn("{} threw unexpectedly", technique.displayName(), exception);
            return Finding.failed(technique, technique.displayName() + " error: " + exception.getMessage());
        }
    }

    @Override
    public void close() {
        analysisExecutor.shutdownNow();
        if (detectorPool != null) {
            detectorPool.shutdownNow();
        }
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    private static List<ForensicDetector> indexByTechnique(List<? extends ForensicDetector> detectors) {
        Objects.requireNonNull(detectors, "detectors");
        Map<Technique, ForensicDetector> byTechnique = new EnumMap<>(Technique.class);
        for (ForensicDetector detector : detectors) {
            Technique technique = detector.technique();
            if (technique == Technique.METADATA_ANALYSIS) {
                throw new IllegalArgumentException("Metadata analysis is handled by the anomaly scorer");
            }
            if (byTechnique.putIfAbsent(technique, detector) != null) {
                throw new IllegalArgumentException("Duplicate detector for technique '" + technique.id() + "'");
            }
        }
        List<ForensicDetector> ordered = new ArrayList<>(byTechnique.values());
        ordered.sort(Comparator.comparing(ForensicDetector::technique));
        return List.copyOf(ordered);
    }
}
