package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.ImageMetadata;
import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.model.Severity;
import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.util.ImageUtils;
import com.example.tamperdetector.util.Statistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Additive heuristics for synthetic imagery: overly smooth texture, repetitive micro patterns,
 * missing sensor noise and generator signatures in the metadata.
 */
@Component
public class AiGeneratedHeuristicDetector extends AbstractForensicDetector {

    private static final Logger log = LoggerFactory.getLogger(AiGeneratedHeuristicDetector.class);

    static final double SMOOTHNESS_WEIGHT = 0.3;
    static final double TEXTURE_WEIGHT = 0.3;
    static final double SENSOR_NOISE_WEIGHT = 0.25;
    static final double AI_SOFTWARE_WEIGHT = 0.4;
    static final double MISSING_CAMERA_WEIGHT = 0.15;

    private static final int LBP_RADIUS = 3;
    private static final int LBP_POINTS = 8 * LBP_RADIUS;

    private static final List<String> AI_TOOLS = List.of(
            "midjourney", "stable diffusion", "dall-e", "dalle", "neural", "synthetic", "generated");
    // short names would otherwise match inside words like "Canon" or "paint"
    private static final Pattern AI_TOOL_WORDS = Pattern.compile("\\b(ai|gan)\\b");

    private final LocalBinaryPattern lbp = new LocalBinaryPattern(LBP_POINTS, LBP_RADIUS);

    @Override
    public Technique technique() {
        return Technique.AI_GENERATED;
    }

    @Override
    protected Finding evaluate(DetectionContext context) {
        ThresholdConfig thresholds = context.thresholds();
        RasterImage image = context.image();
        List<String> indicators = new ArrayList<>();
        double score = 0.0;

        Mat gray = ImageUtils.toGrayMat(image);
        double laplacianVariance;
        double residualDeviation;
        double[] samples;
        try {
            laplacianVariance = laplacianVariance(gray);
            residualDeviation = residualDeviation(gray);
            samples = ImageUtils.toDoubles(gray);
        } finally {
            gray.close();
        }

        if (laplacianVariance < thresholds.aiSmoothnessVariance()) {
            indicators.add("Unnaturally smooth textures");
            score += SMOOTHNESS_WEIGHT;
        }

        double uniformity = LocalBinaryPattern.uniformity(
                lbp.histogram(lbp.compute(samples, image.width(), image.height())));
        if (uniformity > thresholds.aiTextureUniformity()) {
            indicators.add("Repetitive patterns detected (AI artifact)");
            score += TEXTURE_WEIGHT;
        }

        if (residualDeviation < thresholds.aiSensorNoise()) {
            indicators.add("Lack of natural camera noise");
            score += SENSOR_NOISE_WEIGHT;
        }

        ImageMetadata metadata = context.metadata();
        Optional<String> aiSoftware = metadata.software().filter(AiGeneratedHeuristicDetector::namesAiTool);
        if (aiSoftware.isPresent()) {
            indicators.add("AI software detected: " + aiSoftware.get());
            score += AI_SOFTWARE_WEIGHT;
        } else if (!metadata.has(ImageMetadata.MAKE) && !metadata.has(ImageMetadata.MODEL)) {
            indicators.add("Missing camera metadata (common in AI images)");
            score += MISSING_CAMERA_WEIGHT;
        }

        score = Math.min(1.0, score);
        log.debug("AI heuristics: laplacian variance {}, LBP uniformity {}, residual deviation {}, score {}",
                laplacianVariance, uniformity, residualDeviation, score);

        if (score > thresholds.aiGeneratedThreshold()) {
            Severity severity = aiSoftware.isPresent() ? Severity.CRITICAL : Severity.HIGH;
            return Finding.triggered(technique(), score, severity, String.format(Locale.ROOT,
                    "Potential AI-generated image. Indicators: %s", String.join(", ", indicators)));
        }
        String description = indicators.isEmpty()
                ? "No AI generation indicators found"
                : "Weak AI generation indicators: " + String.join(", ", indicators);
        return Finding.clean(technique(), score, description);
    }

    static boolean namesAiTool(String software) {
        String normalized = software.toLowerCase(Locale.ROOT);
        for (String tool : AI_TOOLS) {
            if (normalized.contains(tool)) {
                return true;
            }
        }
        return AI_TOOL_WORDS.matcher(normalized).find();
    }

    private double laplacianVariance(Mat gray) {
        Mat laplacian = new Mat();
        try {
            opencv_imgproc.Laplacian(gray, laplacian, opencv_core.CV_64F);
            return Statistics.variance(ImageUtils.toDoubles(laplacian));
        } finally {
            laplacian.close();
        }
    }

    private double residualDeviation(Mat gray) {
        Mat samples = new Mat();
        Mat blurred = new Mat();
        Mat blurredSamples = new Mat();
        Mat residual = new Mat();
        try {
            gray.convertTo(samples, opencv_core.CV_64F);
            opencv_imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            blurred.convertTo(blurredSamples, opencv_core.CV_64F);
            opencv_core.subtract(samples, blurredSamples, residual);
            return Statistics.standardDeviation(ImageUtils.toDoubles(residual));
        } finally {
            residual.close();
            blurredSamples.close();
            blurred.close();
            samples.close();
        }
    }
}
