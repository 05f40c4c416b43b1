package org.photocollage.service.collage;

import org.photocollage.model.collage.LayoutSlot;
import org.photocollage.model.collage.SourceImage;
import org.photocollage.model.collage.TransformedImage;
import org.photocollage.util.ImageUtils;
import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

import static org.photocollage.model.collage.CollageStyle.BORDER_COLOR;
import static org.photocollage.model.collage.CollageStyle.BORDER_WIDTH;
import static org.photocollage.model.collage.CollageStyle.SHADOW_ALPHA;
import static org.photocollage.model.collage.CollageStyle.SHADOW_BLUR;
import static org.photocollage.model.collage.CollageStyle.SHADOW_OFFSET;

/**
 * Turns one decoded photo into a tilted print: resized, framed in white, rotated and given a soft
 * drop shadow.
 */
@Component
public class ImageTransformer {

    public TransformedImage transform(SourceImage source, LayoutSlot slot, double sizeVariation) {
        int target = Math.max(1, (int) (slot.targetSize() * sizeVariation));

        BufferedImage resized = null;
        BufferedImage framed = null;
        BufferedImage rotated = null;
        try {
            resized = resize(source.image(), target);
            framed = addBorder(resized);
            rotated = rotate(framed, slot.rotationDegrees());
            return new TransformedImage(addShadow(rotated));
        } finally {
            if (resized != source.image()) ImageUtils.flush(resized);
            if (framed != rotated) ImageUtils.flush(framed);
            ImageUtils.flush(rotated);
        }
    }

    /**
     * Scales so the longer side equals {@code target}, keeping the aspect ratio.
     */
    BufferedImage resize(BufferedImage src, int target) {
        double ratio = (double) src.getWidth() / src.getHeight();
        int width;
        int height;
        if (ratio > 1) {
            width = target;
            height = Math.max(1, (int) (target / ratio));
        } else {
            height = target;
            width = Math.max(1, (int) (target * ratio));
        }

        // Halve first so large downscales keep detail instead of aliasing.
        BufferedImage current = src;
        while (current.getWidth() / 2 >= width && current.getHeight() / 2 >= height) {
            BufferedImage half = scale(current, current.getWidth() / 2, current.getHeight() / 2);
            if (current != src) current.flush();
            current = half;
        }

        BufferedImage result = scale(current, width, height);
        if (current != src) current.flush();
        return result;
    }

    private BufferedImage scale(BufferedImage src, int width, int height) {
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = dst.createGraphics();
        try {
            ImageUtils.configureGraphics(g);
            g.drawImage(src, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    /**
     * Frames the photo like a print. The result is ARGB so it can be rotated onto transparency.
     */
    BufferedImage addBorder(BufferedImage src) {
        int width = src.getWidth() + BORDER_WIDTH * 2;
        int height = src.getHeight() + BORDER_WIDTH * 2;
        BufferedImage bordered = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = bordered.createGraphics();
        try {
            g.setColor(BORDER_COLOR);
            g.fillRect(0, 0, width, height);
            g.drawImage(src, BORDER_WIDTH, BORDER_WIDTH, null);
        } finally {
            g.dispose();
        }
        return bordered;
    }

    /**
     * Rotates counter-clockwise by {@code degrees}, growing the buffer so no corner is cut off.
     */
    BufferedImage rotate(BufferedImage src, int degrees) {
        if (degrees == 0) {
            return src;
        }

        // A one pixel transparent margin lets interpolation soften the rotated edges.
        BufferedImage padded = new BufferedImage(src.getWidth() + 2, src.getHeight() + 2, BufferedImage.TYPE_INT_ARGB);
        Graphics2D pg = padded.createGraphics();
        try {
            pg.drawImage(src, 1, 1, null);
        } finally {
            pg.dispose();
        }

        double radians = Math.toRadians(degrees);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int w = padded.getWidth();
        int h = padded.getHeight();
        int rotatedWidth = (int) Math.ceil(w * cos + h * sin);
        int rotatedHeight = (int) Math.ceil(w * sin + h * cos);

        BufferedImage rotated = new BufferedImage(rotatedWidth, rotatedHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = rotated.createGraphics();
        try {
            ImageUtils.configureGraphics(g);
            AffineTransform at = new AffineTransform();
            at.translate(rotatedWidth / 2.0, rotatedHeight / 2.0);
            // Screen y grows downwards, so a negative angle turns counter-clockwise.
            at.rotate(-radians);
            at.translate(-w / 2.0, -h / 2.0);
            g.drawImage(padded, at, null);
        } finally {
            g.dispose();
            padded.flush();
        }
        return rotated;
    }

    /**
     * Places the image over a blurred, offset copy of its own silhouette.
     */
    BufferedImage addShadow(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        int width = w + SHADOW_OFFSET + SHADOW_BLUR * 2;
        int height = h + SHADOW_OFFSET + SHADOW_BLUR * 2;
        int inset = SHADOW_BLUR + SHADOW_OFFSET;

        int[] srcPixels = src.getRGB(0, 0, w, h, null, 0, w);
        int[] alpha = new int[width * height];
        for (int y = 0; y < h; y++) {
            int row = (y + inset) * width + inset;
            for (int x = 0; x < w; x++) {
                int a = srcPixels[y * w + x] >>> 24;
                alpha[row + x] = (a * SHADOW_ALPHA + 127) / 255;
            }
        }

        int[] blurred = ImageUtils.gaussianBlur(alpha, width, height, SHADOW_BLUR);
        int[] shadowPixels = new int[blurred.length];
        for (int i = 0; i < blurred.length; i++) {
            shadowPixels[i] = blurred[i] << 24;
        }

        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        result.setRGB(0, 0, width, height, shadowPixels, 0, width);

        Graphics2D g = result.createGraphics();
        try {
            g.drawImage(src, SHADOW_BLUR, SHADOW_BLUR, null);
        } finally {
            g.dispose();
        }
        return result;
    }
}
