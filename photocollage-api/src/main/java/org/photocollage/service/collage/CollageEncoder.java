package org.photocollage.service.collage;

import lombok.extern.slf4j.Slf4j;
import org.photocollage.exception.ApiError;
import org.photocollage.model.collage.CollageStyle;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Flattens the canvas onto its background color and writes it as JPEG.
 */
@Slf4j
@Component
public class CollageEncoder {

    public byte[] encode(BufferedImage canvas, Color background) {
        BufferedImage flattened = flatten(canvas, background);
        try {
            return writeJpeg(flattened);
        } catch (IOException | RuntimeException e) {
            log.error("JPEG encoding of {}x{} collage failed", canvas.getWidth(), canvas.getHeight(), e);
            throw ApiError.COLLAGE_ENCODING_FAILED.createException(e.getMessage());
        } finally {
            flattened.flush();
        }
    }

    BufferedImage flatten(BufferedImage canvas, Color background) {
        BufferedImage opaque = new BufferedImage(canvas.getWidth(), canvas.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = opaque.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());
            g.drawImage(canvas, 0, 0, null);
        } finally {
            g.dispose();
        }
        return opaque;
    }

    byte[] writeJpeg(BufferedImage img) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();

        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(CollageStyle.JPEG_QUALITY);
            if (param instanceof JPEGImageWriteParam jpegParam) {
                jpegParam.setOptimizeHuffmanTables(true);
            }

            writer.setOutput(ios);
            writer.write(null, new IIOImage(img, null, null), param);
            ios.flush();
            return baos.toByteArray();
        } finally {
            writer.dispose();
        }
    }
}
