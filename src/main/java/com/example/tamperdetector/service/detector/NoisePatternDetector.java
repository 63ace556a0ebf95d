package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.model.Severity;
import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.util.ImageUtils;
import com.example.tamperdetector.util.Statistics;
import java.util.Locale;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares the strength of the sensor noise residual across the frame. A single camera
 * produces a roughly even residual; content pasted from another source usually does not.
 */
@Component
public class NoisePatternDetector extends AbstractForensicDetector {

    private static final Logger log = LoggerFactory.getLogger(NoisePatternDetector.class);

    static final int BLOCK_SIZE = 64;
    private static final int MEDIAN_KERNEL = 5;

    @Override
    public Technique technique() {
        return Technique.NOISE_PATTERN;
    }

    @Override
    protected Finding evaluate(DetectionContext context) throws DetectorException {
        RasterImage image = context.image();
        if (image.width() < BLOCK_SIZE || image.height() < BLOCK_SIZE) {
            throw new DetectorException(String.format(Locale.ROOT,
                    "image of %dx%d is smaller than one %dx%d noise block",
                    image.width(), image.height(), BLOCK_SIZE, BLOCK_SIZE));
        }
        double[] variances = residualBlockVariances(image);

        double mean = Statistics.mean(variances);
        double deviation = Statistics.standardDeviation(variances);
        double ratio = Statistics.safeRatio(deviation, mean);
        log.debug("Noise residual over {} blocks: mean variance {}, deviation {}", variances.length, mean, deviation);

        if (deviation > context.thresholds().noiseInconsistency() * mean) {
            return Finding.triggered(technique(), Math.min(1.0, ratio * 0.3), Severity.MEDIUM,
                    String.format(Locale.ROOT, "Inconsistent noise patterns detected. STD: %.2f, Mean: %.2f",
                            deviation, mean));
        }
        return Finding.clean(technique(), 0.0, String.format(Locale.ROOT,
                "Noise patterns appear consistent (STD: %.2f, Mean: %.2f)", deviation, mean));
    }

    private double[] residualBlockVariances(RasterImage image) {
        Mat gray = ImageUtils.toGrayMat(image);
        Mat median = new Mat();
        Mat noise = new Mat();
        try {
            opencv_imgproc.medianBlur(gray, median, MEDIAN_KERNEL);
            opencv_core.absdiff(gray, median, noise);
            return ImageUtils.tileVariances(noise, BLOCK_SIZE);
        } finally {
            noise.close();
            median.close();
            gray.close();
        }
    }
}
