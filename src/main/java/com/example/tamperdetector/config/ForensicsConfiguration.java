package com.example.tamperdetector.config;

import com.example.tamperdetector.service.TamperAnalysisService;
import com.example.tamperdetector.service.detector.ForensicDetector;
import com.example.tamperdetector.service.loading.RasterImageLoader;
import com.example.tamperdetector.service.metadata.MetadataAnomalyScorer;
import com.example.tamperdetector.service.pipeline.ConfidenceAggregator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class ForensicsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ForensicsConfiguration.class);

    @Bean
    public ThresholdConfig thresholdConfig(ForensicsProperties properties) {
        ThresholdConfig thresholds = ThresholdConfig.fromMap(properties.getThresholds());
        log.info("Forensic thresholds resolved ({} overrides)", properties.getThresholds().size());
        return thresholds;
    }

    @Bean
    public AnalysisConfig analysisConfig(ForensicsProperties properties) {
        AnalysisConfig config = AnalysisConfig.fromMap(properties.getTechniques());
        log.info("Enabled forensic techniques: {}", config.enabledTechniques());
        return config;
    }

    @Bean
    public TamperAnalysisService tamperAnalysisService(List<ForensicDetector> detectors,
                                                       MetadataAnomalyScorer metadataScorer,
                                                       ConfidenceAggregator aggregator,
                                                       RasterImageLoader loader,
                                                       ThresholdConfig thresholdConfig,
                                                       AnalysisConfig analysisConfig,
                                                       ForensicsProperties properties) {
        ExecutorService detectorPool = null;
        if (properties.getParallelism() > 0) {
            CustomizableThreadFactory threads = new CustomizableThreadFactory("forensic-detector-");
            threads.setDaemon(true);
            detectorPool = Executors.newFixedThreadPool(properties.getParallelism(), threads);
        }
        return new TamperAnalysisService(detectors, metadataScorer, aggregator, loader,
                thresholdConfig, analysisConfig, detectorPool);
    }
}
