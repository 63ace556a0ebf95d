package com.example.tamperdetector.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RasterImageTest {

    @Test
    void rejectsBufferOfWrongLength() {
        assertThatThrownBy(() -> new RasterImage(4, 4, ChannelOrder.BGR, new byte[16]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected 48");
    }

    @Test
    void pixelsAreCopiedInAndOut() {
        byte[] pixels = new byte[4];
        RasterImage image = new RasterImage(2, 2, ChannelOrder.GRAY, pixels);

        pixels[0] = 9;
        image.pixels()[1] = 9;

        assertThat(image.pixels()).containsOnly(0);
        assertThat(image.encodedBytes()).isEmpty();
    }

    @Test
    void equalityCoversPixelsAndEncodedStream() {
        RasterImage first = new RasterImage(1, 1, ChannelOrder.GRAY, new byte[] {5}, new byte[] {1, 2});
        RasterImage second = new RasterImage(1, 1, ChannelOrder.GRAY, new byte[] {5}, new byte[] {1, 2});
        RasterImage other = new RasterImage(1, 1, ChannelOrder.GRAY, new byte[] {5});

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(other);
    }
}
