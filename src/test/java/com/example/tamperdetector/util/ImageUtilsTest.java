package com.example.tamperdetector.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.tamperdetector.model.ChannelOrder;
import com.example.tamperdetector.model.RasterImage;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

class ImageUtilsTest {

    @Test
    void rgbRasterIsSwappedToBgr() {
        RasterImage rgb = new RasterImage(1, 1, ChannelOrder.RGB, new byte[] {10, 20, 30});
        Mat bgr = ImageUtils.toBgrMat(rgb);
        try {
            assertThat(ImageUtils.toBytes(bgr)).containsExactly(30, 20, 10);
        } finally {
            bgr.close();
        }
    }

    @Test
    void grayConversionProducesSingleChannelSamples() {
        RasterImage bgr = new RasterImage(2, 1, ChannelOrder.BGR, new byte[] {50, 50, 50, (byte) 200, (byte) 200, (byte) 200});
        Mat gray = ImageUtils.toGrayMat(bgr);
        try {
            assertThat(gray.channels()).isEqualTo(1);
            assertThat(ImageUtils.toDoubles(gray)).containsExactly(50.0, 200.0);
        } finally {
            gray.close();
        }
    }

    @Test
    void losslessRoundTripThroughPng() {
        RasterImage image = new RasterImage(2, 2, ChannelOrder.GRAY, new byte[] {0, 64, (byte) 128, (byte) 255});
        Mat source = ImageUtils.toBgrMat(image);
        Mat decoded = null;
        try {
            byte[] png = ImageUtils.encode(source, ".png");
            decoded = ImageUtils.decode(png, opencv_imgcodecs.IMREAD_GRAYSCALE);

            assertThat(ImageUtils.toBytes(decoded)).containsExactly(0, 64, 128, 255);
        } finally {
            source.close();
            if (decoded != null) {
                decoded.close();
            }
        }
    }

    @Test
    void tileStatisticsCoverFullTilesOnly() {
        byte[] pixels = {
                1, 1, 5, 9, (byte) 200,
                1, 1, 9, 5, (byte) 200,
                0, 0, 0, 0, 0};
        Mat gray = ImageUtils.toGrayMat(new RasterImage(5, 3, ChannelOrder.GRAY, pixels));
        try {
            double[] means = ImageUtils.tileMeans(gray, 2);
            double[] variances = ImageUtils.tileVariances(gray, 2);

            assertThat(means).hasSize(2);
            assertThat(means[0]).isCloseTo(1.0, within(1e-9));
            assertThat(means[1]).isCloseTo(7.0, within(1e-9));
            assertThat(variances[0]).isCloseTo(0.0, within(1e-9));
            assertThat(variances[1]).isCloseTo(4.0, within(1e-9));
        } finally {
            gray.close();
        }
    }

    @Test
    void tileStatisticsRequireSingleChannel() {
        Mat bgr = ImageUtils.toBgrMat(new RasterImage(2, 2, ChannelOrder.GRAY, new byte[4]));
        try {
            assertThatThrownBy(() -> ImageUtils.tileMeans(bgr, 2)).isInstanceOf(IllegalArgumentException.class);
        } finally {
            bgr.close();
        }
    }
}
