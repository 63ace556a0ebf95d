package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.model.Severity;
import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.util.ImageUtils;
import com.example.tamperdetector.util.Statistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Looks for the comb-shaped DCT coefficient histogram left behind when an already quantized
 * image is quantized a second time.
 */
@Component
public class DoubleCompressionDetector extends AbstractForensicDetector {

    private static final Logger log = LoggerFactory.getLogger(DoubleCompressionDetector.class);

    static final int HISTOGRAM_BINS = 100;
    static final int MIN_PEAKS = 5;
    static final double MAX_SPACING_DEVIATION = 5.0;
    private static final double SCORE = 0.7;

    @Override
    public Technique technique() {
        return Technique.DOUBLE_COMPRESSION;
    }

    @Override
    protected Finding evaluate(DetectionContext context) throws DetectorException {
        return assess(dctMagnitudes(context.image()));
    }

    /**
     * Verdict over absolute DCT coefficients of the whole frame.
     */
    Finding assess(double[] magnitudes) {
        int[] histogram = histogram(magnitudes, HISTOGRAM_BINS);
        List<Integer> peaks = localMaxima(histogram);
        double spacingDeviation = spacingDeviation(peaks);
        log.debug("DCT histogram has {} peaks with spacing deviation {}", peaks.size(), spacingDeviation);

        if (isPeriodic(peaks)) {
            return Finding.triggered(technique(), SCORE, Severity.MEDIUM, String.format(Locale.ROOT,
                    "Double JPEG compression detected. Found %d periodic peaks", peaks.size()));
        }
        return Finding.clean(technique(), 0.0, "No double JPEG compression detected");
    }

    private double[] dctMagnitudes(RasterImage image) throws DetectorException {
        // cv::dct only accepts even dimensions
        int width = image.width() & ~1;
        int height = image.height() & ~1;
        if (width < 2 || height < 2) {
            throw new DetectorException(String.format(Locale.ROOT,
                    "image of %dx%d is too small for a DCT", image.width(), image.height()));
        }
        Mat gray = ImageUtils.toGrayMat(image);
        Mat cropped = new Mat(gray, new Rect(0, 0, width, height));
        Mat samples = new Mat();
        Mat coefficients = new Mat();
        try {
            cropped.convertTo(samples, opencv_core.CV_64F);
            opencv_core.dct(samples, coefficients);
            double[] values = ImageUtils.toDoubles(coefficients);
            for (int i = 0; i < values.length; i++) {
                values[i] = Math.abs(values[i]);
            }
            return values;
        } finally {
            coefficients.close();
            samples.close();
            cropped.close();
            gray.close();
        }
    }

    /**
     * Equal-width histogram between the smallest and largest value; the last bin is closed.
     */
    static int[] histogram(double[] values, int bins) {
        int[] counts = new int[bins];
        if (values.length == 0) {
            return counts;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (min == max) {
            min -= 0.5;
            max += 0.5;
        }
        double scale = bins / (max - min);
        for (double value : values) {
            int bin = (int) ((value - min) * scale);
            counts[Math.min(bins - 1, Math.max(0, bin))]++;
        }
        return counts;
    }

    /**
     * Indexes of interior bins strictly greater than both neighbours.
     */
    static List<Integer> localMaxima(int[] histogram) {
        List<Integer> peaks = new ArrayList<>();
        for (int i = 1; i < histogram.length - 1; i++) {
            if (histogram[i] > histogram[i - 1] && histogram[i] > histogram[i + 1]) {
                peaks.add(i);
            }
        }
        return peaks;
    }

    static boolean isPeriodic(List<Integer> peaks) {
        return peaks.size() > MIN_PEAKS && spacingDeviation(peaks) < MAX_SPACING_DEVIATION;
    }

    static double spacingDeviation(List<Integer> peaks) {
        if (peaks.size() < 2) {
            return 0.0;
        }
        List<Double> spacings = new ArrayList<>(peaks.size() - 1);
        for (int i = 1; i < peaks.size(); i++) {
            spacings.add((double) (peaks.get(i) - peaks.get(i - 1)));
        }
        return Statistics.standardDeviation(spacings);
    }
}
