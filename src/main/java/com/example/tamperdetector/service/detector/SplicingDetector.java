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
 * Measures how evenly the scene is lit. Composited content tends to carry the illumination of
 * its source, which shows up as a wide spread of block lightness.
 */
@Component
public class SplicingDetector extends AbstractForensicDetector {

    private static final Logger log = LoggerFactory.getLogger(SplicingDetector.class);

    static final int BLOCK_SIZE = 32;

    @Override
    public Technique technique() {
        return Technique.SPLICING;
    }

    @Override
    protected Finding evaluate(DetectionContext context) throws DetectorException {
        RasterImage image = context.image();
        int columns = image.width() / BLOCK_SIZE;
        int rows = image.height() / BLOCK_SIZE;
        if (columns == 0 || rows == 0) {
            throw new DetectorException(String.format(Locale.ROOT,
                    "image of %dx%d is smaller than one %dx%d lighting block",
                    image.width(), image.height(), BLOCK_SIZE, BLOCK_SIZE));
        }
        double[] blockMeans = blockLightness(image);
        double variation = Statistics.safeRatio(Statistics.standardDeviation(blockMeans), Statistics.mean(blockMeans));
        log.debug("Lighting coefficient of variation {} over {} blocks", variation, blockMeans.length);

        if (variation > context.thresholds().splicingVariation()) {
            return Finding.triggered(technique(), Math.min(1.0, variation), Severity.MEDIUM,
                    String.format(Locale.ROOT, "Lighting inconsistencies detected (CV: %.3f)", variation));
        }
        return Finding.clean(technique(), 0.0,
                String.format(Locale.ROOT, "Lighting appears consistent (CV: %.3f)", variation));
    }

    private double[] blockLightness(RasterImage image) {
        Mat bgr = ImageUtils.toBgrMat(image);
        Mat lab = new Mat();
        Mat channel = new Mat();
        try {
            opencv_imgproc.cvtColor(bgr, lab, opencv_imgproc.COLOR_BGR2Lab);
            opencv_core.extractChannel(lab, channel, 0);
            return ImageUtils.tileMeans(channel, BLOCK_SIZE);
        } finally {
            channel.close();
            lab.close();
            bgr.close();
        }
    }
}
