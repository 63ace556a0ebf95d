package com.example.tamperdetector.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Pixel rectangle around a region whose error level stands out from the rest of the frame,
 * as returned by the bounding rectangle of an external contour.
 */
@Schema(description = "Pixel rectangle enclosing a region with an anomalous error level")
public record BoundingBox(
        @Schema(description = "Left edge of the region in pixels", example = "96") int x,
        @Schema(description = "Top edge of the region in pixels", example = "64") int y,
        @Schema(description = "Region width in pixels", example = "48") int width,
        @Schema(description = "Region height in pixels", example = "40") int height) {

    public BoundingBox {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Region origin must lie inside the image");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region extent must be positive");
        }
    }
}
