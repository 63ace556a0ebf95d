package com.example.tamperdetector.service.pipeline;

import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.AnalysisReport;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.MetadataAnomaly;
import com.example.tamperdetector.model.Technique;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fuses detector findings and metadata anomalies into a single confidence score. Every
 * triggered finding with a positive score contributes one vote, the metadata anomalies
 * contribute one more, and agreement between three or more contributors is rewarded with a
 * corroboration bonus.
 */
@Component
public class ConfidenceAggregator {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceAggregator.class);

    static final int CORROBORATION_MIN_SCORES = 3;
    static final double CORROBORATION_FACTOR = 1.2;

    public AnalysisReport aggregate(List<Technique> techniquesUsed,
                                    List<Finding> findings,
                                    List<MetadataAnomaly> anomalies,
                                    ThresholdConfig thresholds) {
        List<Double> scores = contributingScores(findings, anomalies, thresholds);
        double confidence = confidence(scores);
        boolean tampered = confidence > thresholds.forgeryConfidence();

        log.debug("Aggregated {} contributing scores {} into confidence {} (threshold {}, tampered: {})",
                scores.size(), scores, confidence, thresholds.forgeryConfidence(), tampered);

        return new AnalysisReport(tampered, confidence, null, techniquesUsed, findings, anomalies);
    }

    List<Double> contributingScores(List<Finding> findings, List<MetadataAnomaly> anomalies,
                                    ThresholdConfig thresholds) {
        List<Double> scores = new ArrayList<>();
        if (findings != null) {
            for (Finding finding : findings) {
                if (finding.triggered() && finding.score() > 0.0) {
                    scores.add(finding.score());
                }
            }
        }
        if (anomalies != null && !anomalies.isEmpty()) {
            scores.add(Math.min(1.0, anomalies.size() * thresholds.metadataAnomalyWeight()));
        }
        return scores;
    }

    static double confidence(List<Double> scores) {
        if (scores.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double score : scores) {
            sum += score;
        }
        double mean = sum / scores.size();
        if (scores.size() >= CORROBORATION_MIN_SCORES) {
            return Math.min(1.0, mean * CORROBORATION_FACTOR);
        }
        return Finding.clamp(mean);
    }
}
