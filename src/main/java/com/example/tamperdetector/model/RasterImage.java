package com.example.tamperdetector.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded 8-bit pixel buffer. Samples are interleaved row by row according to the
 * {@link ChannelOrder}. The optional encoded bytes are the stream the raster was decoded from
 * and are only consulted by error level analysis.
 */
public final class RasterImage {

    private final int width;
    private final int height;
    private final ChannelOrder channelOrder;
    private final byte[] pixels;
    private final byte[] encoded;

    public RasterImage(int width, int height, ChannelOrder channelOrder, byte[] pixels) {
        this(width, height, channelOrder, pixels, null);
    }

    public RasterImage(int width, int height, ChannelOrder channelOrder, byte[] pixels, byte[] encoded) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        this.channelOrder = Objects.requireNonNull(channelOrder, "channelOrder");
        Objects.requireNonNull(pixels, "pixels");
        long expected = (long) width * height * channelOrder.channels();
        if (pixels.length != expected) {
            throw new IllegalArgumentException(
                    "Pixel buffer holds " + pixels.length + " samples, expected " + expected);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
        this.encoded = encoded == null ? null : encoded.clone();
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channelOrder.channels();
    }

    public ChannelOrder channelOrder() {
        return channelOrder;
    }

    public byte[] pixels() {
        return pixels.clone();
    }

    public Optional<byte[]> encodedBytes() {
        return Optional.ofNullable(encoded).map(byte[]::clone);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RasterImage that)) {
            return false;
        }
        return width == that.width
                && height == that.height
                && channelOrder == that.channelOrder
                && Arrays.equals(pixels, that.pixels)
                && Arrays.equals(encoded, that.encoded);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(width, height, channelOrder);
        result = 31 * result + Arrays.hashCode(pixels);
        return 31 * result + Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return "RasterImage[" + width + "x" + height + " " + channelOrder
                + (encoded == null ? "" : ", encoded=" + encoded.length + " bytes") + "]";
    }
}
