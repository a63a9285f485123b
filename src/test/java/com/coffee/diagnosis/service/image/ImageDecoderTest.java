package com.coffee.diagnosis.service.image;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageDecoderTest {

    private final ImageDecoder decoder = new ImageDecoder();

    @Test
    void decodesPngIntoRgbOrder() {
        LeafImage source = LeafImageFixtures.uniform(8, 6, 200, 30, 10);

        LeafImage decoded = decoder.decode(LeafImageFixtures.png(source));

        assertThat(decoded.width()).isEqualTo(8);
        assertThat(decoded.height()).isEqualTo(6);
        assertThat(decoded.red(3, 3)).isEqualTo(200);
        assertThat(decoded.green(3, 3)).isEqualTo(30);
        assertThat(decoded.blue(3, 3)).isEqualTo(10);
    }

    @Test
    void rejectsBytesThatAreNotAnImage() {
        assertThatThrownBy(() -> decoder.decode("definitely not a picture".getBytes()))
                .isInstanceOf(DecodeFailedException.class);
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> decoder.decode(new byte[0]))
                .isInstanceOf(DecodeFailedException.class);
    }

    @Test
    void stripedPngDecodesPixelForPixel() {
        LeafImage source = LeafImageFixtures.stripedLeaf(20);

        LeafImage decoded = decoder.decode(LeafImageFixtures.png(source));

        assertThat(decoded.rgbBytes()).isEqualTo(source.rgbBytes());
    }
}
