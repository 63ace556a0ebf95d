package com.example.tamperdetector.service.loading;

import com.example.tamperdetector.model.RasterImage;
import com.example.tamperdetector.util.ImageUtils;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes encoded image payloads (JPEG, PNG, ...) in memory. The resulting raster is BGR and
 * keeps the original bytes for techniques that work on the compressed stream.
 */
@Component
public class RasterImageLoader {

    private static final Logger log = LoggerFactory.getLogger(RasterImageLoader.class);

    public RasterImage load(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            log.error("Rejected empty image payload");
            throw new ImageLoadException("Image payload is empty");
        }
        Mat decoded;
        try {
            decoded = ImageUtils.decode(imageBytes, opencv_imgcodecs.IMREAD_COLOR);
        } catch (RuntimeException exception) {
            log.error("Decoding {} bytes failed", imageBytes.length, exception);
            throw new ImageLoadException("Unable to decode image", exception);
        }
        try {
            if (decoded == null || decoded.empty()) {
                log.error("Payload of {} bytes is not a supported image format", imageBytes.length);
                throw new ImageLoadException("Unsupported or corrupted image format");
            }
            RasterImage image = ImageUtils.toRaster(decoded, imageBytes);
            log.debug("Decoded {}x{} image from {} bytes", image.width(), image.height(), imageBytes.length);
            return image;
        } finally {
            if (decoded != null) {
                decoded.close();
            }
        }
    }
}
