package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.model.Severity;
import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.util.ImageUtils;
import com.example.tamperdetector.util.Statistics;
import java.util.Locale;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Inspects the centred log-magnitude spectrum. Natural photographs fall off smoothly from the
 * centre; resampling and synthesis leave spectra that are either too flat or too spiky.
 */
@Component
public class FrequencyDomainDetector extends AbstractForensicDetector {

    private static final Logger log = LoggerFactory.getLogger(FrequencyDomainDetector.class);

    private static final double SCORE = 0.6;

    @Override
    public Technique technique() {
        return Technique.FREQUENCY_DOMAIN;
    }

    @Override
    protected Finding evaluate(DetectionContext context) throws DetectorException {
        ThresholdConfig thresholds = context.thresholds();
        RasterImage image = context.image();
        if (image.width() < 4 || image.height() < 4) {
            throw new DetectorException(String.format(Locale.ROOT,
                    "image of %dx%d has no central frequency band", image.width(), image.height()));
        }
        double[] band = centralBand(image);
        double mean = Statistics.mean(band);
        double deviation = Statistics.standardDeviation(band);
        log.debug("Spectrum band of {} samples: mean {}, deviation {}", band.length, mean, deviation);

        if (mean <= 0.0) {
            return Finding.clean(technique(), 0.0, "Frequency spectrum carries no energy");
        }
        if (deviation < thresholds.frequencyUniformRatio() * mean) {
            return Finding.triggered(technique(), SCORE, Severity.MEDIUM,
                    "Unusually uniform frequency distribution (possible AI generation)");
        }
        if (deviation > thresholds.frequencyIrregularRatio() * mean) {
            return Finding.triggered(technique(), SCORE, Severity.HIGH,
                    "Irregular frequency patterns detected (possible manipulation)");
        }
        return Finding.clean(technique(), 0.0, String.format(Locale.ROOT,
                "Frequency distribution appears natural (STD: %.2f, Mean: %.2f)", deviation, mean));
    }

    /**
     * Log magnitudes of the quarter-to-three-quarter band of the zero-frequency-centred
     * spectrum, row-major.
     */
    private double[] centralBand(RasterImage image) {
        int width = image.width();
        int height = image.height();
        Mat gray = ImageUtils.toGrayMat(image);
        Mat samples = new Mat();
        Mat spectrum = new Mat();
        try {
            gray.convertTo(samples, opencv_core.CV_64F);
            opencv_core.dft(samples, spectrum, opencv_core.DFT_COMPLEX_OUTPUT, 0);
            int top = height / 4;
            int bottom = 3 * height / 4;
            int left = width / 4;
            int right = 3 * width / 4;
            double[] band = new double[(bottom - top) * (right - left)];
            int index = 0;
            try (DoubleIndexer indexer = spectrum.createIndexer()) {
                for (int y = top; y < bottom; y++) {
                    int sourceRow = shifted(y, height);
                    for (int x = left; x < right; x++) {
                        int sourceColumn = shifted(x, width);
                        double re = indexer.get(sourceRow, sourceColumn, 0);
                        double im = indexer.get(sourceRow, sourceColumn, 1);
                        band[index++] = 20 * Math.log(Math.hypot(re, im) + 1);
                    }
                }
            }
            return band;
        } finally {
            spectrum.close();
            samples.close();
            gray.close();
        }
    }

    // index in the unshifted spectrum that lands at position k after centring
    static int shifted(int k, int size) {
        return Math.floorMod(k - size / 2, size);
    }
}
