package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.BoundingBox;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.model.Severity;
import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.util.ImageUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Error level analysis. The image is recompressed as JPEG at a known quality entirely in
 * memory and compared with itself; regions whose compression history differs from the rest
 * of the frame react with a stronger error level.
 */
@Component
public class ErrorLevelAnalysisDetector extends AbstractForensicDetector {

    private static final Logger log = LoggerFactory.getLogger(ErrorLevelAnalysisDetector.class);

    @Override
    public Technique technique() {
        return Technique.ERROR_LEVEL_ANALYSIS;
    }

    @Override
    protected Finding evaluate(DetectionContext context) throws DetectorException {
        ThresholdConfig thresholds = context.thresholds();
        Mat original = loadOriginal(context.image());
        Mat resaved = null;
        Mat difference = new Mat();
        Mat differenceGray = new Mat();
        Mat equalized = new Mat();
        Mat mask = new Mat();
        try {
            resaved = recompress(original, thresholds.elaQuality());
            opencv_core.absdiff(original, resaved, difference);
            opencv_imgproc.cvtColor(difference, differenceGray, opencv_imgproc.COLOR_BGR2GRAY);
            int maxDifference = maxSample(differenceGray);

            opencv_imgproc.equalizeHist(differenceGray, equalized);
            opencv_imgproc.threshold(equalized, mask, thresholds.elaThreshold(), 255, opencv_imgproc.THRESH_BINARY);
            List<BoundingBox> regions = extractRegions(mask, thresholds.elaMinRegionArea());
            log.debug("ELA max difference {} with {} qualifying regions", maxDifference, regions.size());

            if (maxDifference > thresholds.elaMaxDifference() && !regions.isEmpty()) {
                double score = Math.min(1.0, maxDifference / 100.0);
                Severity severity = score >= 0.7 ? Severity.HIGH : Severity.MEDIUM;
                String description = String.format(Locale.ROOT,
                        "Detected %d regions with inconsistent compression levels. Max difference: %d",
                        regions.size(), maxDifference);
                return new Finding(technique(), true, score, severity, description, regions);
            }
            return Finding.clean(technique(), 0.0, String.format(Locale.ROOT,
                    "No significant compression anomalies detected (max difference %d)", maxDifference));
        } finally {
            original.close();
            if (resaved != null) {
                resaved.close();
            }
            difference.close();
            differenceGray.close();
            equalized.close();
            mask.close();
        }
    }

    /**
     * Decodes the original encoded stream when it is available, otherwise falls back to the
     * already decoded raster.
     */
    private Mat loadOriginal(RasterImage image) throws DetectorException {
        Optional<byte[]> encoded = image.encodedBytes();
        if (encoded.isEmpty()) {
            return ImageUtils.toBgrMat(image);
        }
        if (encoded.get().length == 0) {
            throw new DetectorException("original image stream is empty");
        }
        Mat decoded = ImageUtils.decode(encoded.get(), opencv_imgcodecs.IMREAD_COLOR);
        if (decoded == null || decoded.empty()) {
            throw new DetectorException("original image stream is unreadable or in an unsupported format");
        }
        return decoded;
    }

    private Mat recompress(Mat original, int quality) throws DetectorException {
        byte[] jpeg = ImageUtils.encode(original, ".jpg", opencv_imgcodecs.IMWRITE_JPEG_QUALITY, quality);
        Mat resaved = ImageUtils.decode(jpeg, opencv_imgcodecs.IMREAD_COLOR);
        if (resaved == null || resaved.empty()) {
            throw new DetectorException("recompressed JPEG could not be decoded");
        }
        if (resaved.cols() != original.cols() || resaved.rows() != original.rows()) {
            Mat resized = new Mat();
            opencv_imgproc.resize(resaved, resized, new Size(original.cols(), original.rows()));
            resaved.close();
            return resized;
        }
        return resaved;
    }

    private List<BoundingBox> extractRegions(Mat mask, double minArea) {
        MatVector contours = new MatVector();
        Mat hierarchy = new Mat();
        List<BoundingBox> regions = new ArrayList<>();
        try {
            opencv_imgproc.findContours(mask, contours, hierarchy,
                    opencv_imgproc.RETR_EXTERNAL, opencv_imgproc.CHAIN_APPROX_SIMPLE);
            for (long i = 0; i < contours.size(); i++) {
                Mat contour = contours.get(i);
                double area = opencv_imgproc.contourArea(contour);
                if (area >= minArea) {
                    Rect rect = opencv_imgproc.boundingRect(contour);
                    regions.add(new BoundingBox(rect.x(), rect.y(), rect.width(), rect.height()));
                }
            }
        } finally {
            hierarchy.close();
            contours.close();
        }
        return regions;
    }

    private int maxSample(Mat gray) {
        int max = 0;
        for (byte sample : ImageUtils.toBytes(gray)) {
            max = Math.max(max, sample & 0xFF);
        }
        return max;
    }
}
