package org.photocollage.service.collage;

import org.junit.jupiter.api.Test;
import org.photocollage.exception.APIException;
import org.springframework.http.HttpStatus;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class CollageEncoderTest {

    private final CollageEncoder encoder = new CollageEncoder();

    @Test
    void encode_producesOpaqueJpegOfCanvasSize() throws IOException {
        BufferedImage canvas = TestImages.solid(120, 120, new Color(10, 200, 30, 128), BufferedImage.TYPE_INT_ARGB);

        byte[] jpeg = encoder.encode(canvas, new Color(245, 245, 245));

        assertThat(jpeg).isNotEmpty();
        assertThat(jpeg[0]).isEqualTo((byte) 0xFF);
        assertThat(jpeg[1]).isEqualTo((byte) 0xD8);
        try (ByteArrayInputStream bais = new ByteArrayInputStream(jpeg)) {
            BufferedImage decoded = ImageIO.read(bais);
            assertThat(decoded.getWidth()).isEqualTo(120);
            assertThat(decoded.getHeight()).isEqualTo(120);
            assertThat(decoded.getColorModel().hasAlpha()).isFalse();
        }
    }

    @Test
    void flatten_transparentCanvasShowsBackground() {
        BufferedImage canvas = TestImages.solid(10, 10, new Color(0, 0, 0, 0), BufferedImage.TYPE_INT_ARGB);

        BufferedImage flattened = encoder.flatten(canvas, new Color(1, 2, 3));

        assertThat(flattened.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(flattened.getRGB(5, 5) & 0xFFFFFF).isEqualTo(0x010203);
    }

    @Test
    void flatten_opaqueCanvasKeepsItsPixels() {
        BufferedImage canvas = TestImages.solid(10, 10, Color.MAGENTA, BufferedImage.TYPE_INT_ARGB);

        BufferedImage flattened = encoder.flatten(canvas, Color.BLACK);

        assertThat(flattened.getRGB(0, 0)).isEqualTo(Color.MAGENTA.getRGB());
    }

    @Test
    void encode_isByteStable() {
        BufferedImage canvas = TestImages.solid(64, 64, Color.CYAN, BufferedImage.TYPE_INT_ARGB);

        assertThat(encoder.encode(canvas, Color.WHITE)).isEqualTo(encoder.encode(canvas, Color.WHITE));
    }

    @Test
    void encode_writerFailure_raisesEncodingError() throws IOException {
        CollageEncoder failingEncoder = spy(new CollageEncoder());
        doThrow(new IOException("stream closed")).when(failingEncoder).writeJpeg(any(BufferedImage.class));
        BufferedImage canvas = TestImages.solid(32, 32, Color.CYAN, BufferedImage.TYPE_INT_ARGB);

        assertThatThrownBy(() -> failingEncoder.encode(canvas, Color.WHITE))
                .isInstanceOf(APIException.class)
                .hasMessageContaining("stream closed")
                .extracting(e -> ((APIException) e).getStatus())
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
