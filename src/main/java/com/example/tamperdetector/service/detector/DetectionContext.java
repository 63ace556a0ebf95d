package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.ImageMetadata;
import com.example.tamperdetector.model.RasterImage;
import java.util.Objects;

/**
 * Inputs shared by every detector of one analysis. All members are immutable.
 */
public record DetectionContext(RasterImage image, ImageMetadata metadata, ThresholdConfig thresholds) {

    public DetectionContext {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(thresholds, "thresholds");
    }

    public static DetectionContext of(RasterImage image) {
        return new DetectionContext(image, ImageMetadata.empty(), ThresholdConfig.defaults());
    }
}
