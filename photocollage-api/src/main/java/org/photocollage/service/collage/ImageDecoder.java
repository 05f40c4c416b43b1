package org.photocollage.service.collage;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import lombok.extern.slf4j.Slf4j;
import org.photocollage.exception.ImageDecodeException;
import org.photocollage.model.collage.SourceImage;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Turns raw photo bytes into an upright, opaque RGB {@link SourceImage}.
 */
@Slf4j
@Component
public class ImageDecoder {

    static final int ORIENTATION_NORMAL = 1;

    public SourceImage decode(int index, byte[] data) throws ImageDecodeException {
        if (data == null || data.length == 0) {
            throw new ImageDecodeException("Image payload is empty");
        }

        BufferedImage decoded;
        try (ByteArrayInputStream bais = new ByteArrayInputStream(data)) {
            decoded = ImageIO.read(bais);
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("Image payload could not be decoded: " + e.getMessage(), e);
        }
        if (decoded == null) {
            throw new ImageDecodeException("Unsupported or corrupt image format");
        }

        BufferedImage rgb = toRgb(decoded);
        if (rgb != decoded) decoded.flush();

        int orientation = readOrientation(data);
        BufferedImage upright = applyOrientation(rgb, orientation);
        if (upright != rgb) rgb.flush();

        return new SourceImage(index, upright);
    }

    /**
     * Converts palette, grayscale and translucent images to opaque RGB. Translucent pixels are
     * composited over white.
     */
    BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        BufferedImage dst = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = dst.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    int readOrientation(byte[] data) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(data)) {
            Metadata metadata = ImageMetadataReader.readMetadata(bais);
            ExifIFD0Directory exif = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (exif != null && exif.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                int orientation = exif.getInt(ExifIFD0Directory.TAG_ORIENTATION);
                if (orientation >= 1 && orientation <= 8) {
                    return orientation;
                }
                log.debug("Ignoring out of range EXIF orientation {}", orientation);
            }
        } catch (ImageProcessingException | MetadataException | IOException e) {
            log.debug("No usable EXIF orientation: {}", e.getMessage());
        }
        return ORIENTATION_NORMAL;
    }

    /**
     * Applies an EXIF orientation (1-8) so the image displays upright. Orientations 5-8 swap width
     * and height.
     */
    BufferedImage applyOrientation(BufferedImage src, int orientation) {
        if (orientation <= ORIENTATION_NORMAL || orientation > 8) {
            return src;
        }

        int w = src.getWidth();
        int h = src.getHeight();
        boolean swapsAxes = orientation >= 5;
        int dw = swapsAxes ? h : w;
        int dh = swapsAxes ? w : h;

        int[] in = src.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[in.length];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int dx = x;
                int dy = y;
                switch (orientation) {
                    case 2 -> dx = w - 1 - x;
                    case 3 -> { dx = w - 1 - x; dy = h - 1 - y; }
                    case 4 -> dy = h - 1 - y;
                    case 5 -> { dx = y; dy = x; }
                    case 6 -> { dx = h - 1 - y; dy = x; }
                    case 7 -> { dx = h - 1 - y; dy = w - 1 - x; }
                    case 8 -> { dx = y; dy = w - 1 - x; }
                    default -> { }
                }
                out[dy * dw + dx] = in[y * w + x];
            }
        }

        BufferedImage dst = new BufferedImage(dw, dh, BufferedImage.TYPE_INT_RGB);
        dst.setRGB(0, 0, dw, dh, out, 0, dw);
        return dst;
    }
}
