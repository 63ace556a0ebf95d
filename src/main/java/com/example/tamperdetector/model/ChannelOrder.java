package com.example.tamperdetector.model;

/**
 * Interleaved sample order of a {@link RasterImage}. Every layout stores 8-bit samples.
 */
public enum ChannelOrder {
    GRAY(1),
    BGR(3),
    RGB(3),
    BGRA(4),
    RGBA(4);

    private final int channels;

    ChannelOrder(int channels) {
        this.channels = channels;
    }

    public int channels() {
        return channels;
    }
}
