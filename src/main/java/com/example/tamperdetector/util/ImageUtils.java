package com.example.tamperdetector.util;

import com.example.tamperdetector.model.ChannelOrder;
import com.example.tamperdetector.model.RasterImage;
import java.util.Objects;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;

/**
 * Conversions between {@link RasterImage} buffers, OpenCV matrices and plain Java arrays.
 * Every returned {@link Mat} is owned by the caller.
 */
public final class ImageUtils {

    private ImageUtils() {
    }

    public static Mat toMat(RasterImage image) {
        Objects.requireNonNull(image, "image");
        int type = switch (image.channels()) {
            case 1 -> opencv_core.CV_8UC1;
            case 3 -> opencv_core.CV_8UC3;
            case 4 -> opencv_core.CV_8UC4;
            default -> throw new IllegalArgumentException("Unsupported channel count " + image.channels());
        };
        Mat mat = new Mat(image.height(), image.width(), type);
        mat.data().put(image.pixels());
        return mat;
    }

    public static Mat toBgrMat(RasterImage image) {
        Mat source = toMat(image);
        int code = switch (image.channelOrder()) {
            case BGR -> -1;
            case GRAY -> opencv_imgproc.COLOR_GRAY2BGR;
            case RGB -> opencv_imgproc.COLOR_RGB2BGR;
            case BGRA -> opencv_imgproc.COLOR_BGRA2BGR;
            case RGBA -> opencv_imgproc.COLOR_RGBA2BGR;
        };
        if (code < 0) {
            return source;
        }
        Mat converted = new Mat();
        try {
            opencv_imgproc.cvtColor(source, converted, code);
        } finally {
            source.close();
        }
        return converted;
    }

    public static Mat toGrayMat(RasterImage image) {
        Mat source = toMat(image);
        int code = switch (image.channelOrder()) {
            case GRAY -> -1;
            case BGR -> opencv_imgproc.COLOR_BGR2GRAY;
            case RGB -> opencv_imgproc.COLOR_RGB2GRAY;
            case BGRA -> opencv_imgproc.COLOR_BGRA2GRAY;
            case RGBA -> opencv_imgproc.COLOR_RGBA2GRAY;
        };
        if (code < 0) {
            return source;
        }
        Mat converted = new Mat();
        try {
            opencv_imgproc.cvtColor(source, converted, code);
        } finally {
            source.close();
        }
        return converted;
    }

    /**
     * Builds a BGR raster from a decoded 8-bit, 3-channel matrix.
     */
    public static RasterImage toRaster(Mat bgr, byte[] encoded) {
        if (bgr.channels() != 3 || bgr.depth() != opencv_core.CV_8U) {
            throw new IllegalArgumentException("Expected an 8-bit BGR matrix");
        }
        return new RasterImage(bgr.cols(), bgr.rows(), ChannelOrder.BGR, toBytes(bgr), encoded);
    }

    /**
     * Decodes an encoded image payload. The returned matrix is empty when the payload is not a
     * supported image format.
     */
    public static Mat decode(byte[] data, int flags) {
        Mat buffer = new Mat(data);
        try {
            return opencv_imgcodecs.imdecode(buffer, flags);
        } finally {
            buffer.close();
        }
    }

    public static byte[] encode(Mat image, String extension, int... params) {
        BytePointer buffer = new BytePointer();
        IntPointer encodeParams = params.length == 0 ? null : new IntPointer(params);
        try {
            boolean encoded = encodeParams == null
                    ? opencv_imgcodecs.imencode(extension, image, buffer)
                    : opencv_imgcodecs.imencode(extension, image, buffer, encodeParams);
            if (!encoded) {
                throw new IllegalStateException("Failed to encode image as " + extension);
            }
            byte[] bytes = new byte[(int) buffer.limit()];
            buffer.get(bytes);
            return bytes;
        } finally {
            if (encodeParams != null) {
                encodeParams.close();
            }
            buffer.close();
        }
    }

    public static byte[] toBytes(Mat mat) {
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] bytes = new byte[(int) (continuous.total() * continuous.channels())];
            continuous.data().get(bytes);
            return bytes;
        } finally {
            if (continuous != mat) {
                continuous.close();
            }
        }
    }

    /**
     * Copies a single-channel matrix of any depth into a row-major {@code double} array.
     */
    public static double[] toDoubles(Mat mat) {
        if (mat.channels() != 1) {
            throw new IllegalArgumentException("Expected a single-channel matrix, got " + mat.channels());
        }
        int rows = mat.rows();
        int cols = mat.cols();
        Mat converted = new Mat();
        mat.convertTo(converted, opencv_core.CV_64F);
        double[] values = new double[rows * cols];
        try (DoubleIndexer indexer = converted.createIndexer()) {
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    values[y * cols + x] = indexer.get(y, x);
                }
            }
        } finally {
            converted.close();
        }
        return values;
    }

    /**
     * Mean of every full {@code size x size} tile of a single-channel matrix, row by row.
     * Trailing pixels that do not fill a tile are ignored.
     */
    public static double[] tileMeans(Mat mat, int size) {
        return tileMoments(mat, size, false);
    }

    /**
     * Population variance of every full {@code size x size} tile, in the order of
     * {@link #tileMeans(Mat, int)}.
     */
    public static double[] tileVariances(Mat mat, int size) {
        return tileMoments(mat, size, true);
    }

    private static double[] tileMoments(Mat mat, int size, boolean variance) {
        if (mat.channels() != 1) {
            throw new IllegalArgumentException("Expected a single-channel matrix, got " + mat.channels());
        }
        int columns = mat.cols() / size;
        int rows = mat.rows() / size;
        double[] moments = new double[columns * rows];
        Mat mean = new Mat();
        Mat stddev = new Mat();
        try {
            int index = 0;
            for (int row = 0; row < rows; row++) {
                for (int column = 0; column < columns; column++) {
                    try (Rect rect = new Rect(column * size, row * size, size, size);
                         Mat tile = new Mat(mat, rect)) {
                        opencv_core.meanStdDev(tile, mean, stddev);
                    }
                    if (variance) {
                        double deviation = firstValue(stddev);
                        moments[index++] = deviation * deviation;
                    } else {
                        moments[index++] = firstValue(mean);
                    }
                }
            }
        } finally {
            stddev.close();
            mean.close();
        }
        return moments;
    }

    private static double firstValue(Mat values) {
        try (DoubleIndexer indexer = values.createIndexer()) {
            return indexer.get(0, 0);
        }
    }
}
