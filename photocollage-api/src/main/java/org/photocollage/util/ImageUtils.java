package org.photocollage.util;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.regex.Pattern;

public final class ImageUtils {

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");

    private ImageUtils() {
    }

    public static void configureGraphics(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g.setRenderingHint(RenderingHints.KEY_ALPHA_INTERPOLATION, RenderingHints.VALUE_ALPHA_INTERPOLATION_QUALITY);
        g.setRenderingHint(RenderingHints.KEY_COLOR_RENDERING, RenderingHints.VALUE_COLOR_RENDER_QUALITY);
    }

    public static void flush(BufferedImage... images) {
        for (BufferedImage img : images) {
            if (img != null) img.flush();
        }
    }

    public static boolean isHexColor(String value) {
        return value != null && HEX_COLOR.matcher(value).matches();
    }

    /**
     * Parses {@code #RRGGBB} into an opaque color.
     *
     * @throws IllegalArgumentException if the value is not in that form
     */
    public static Color parseHexColor(String value) {
        if (!isHexColor(value)) {
            throw new IllegalArgumentException("Expected a color in #RRGGBB form but got: " + value);
        }
        return new Color(Integer.parseInt(value.substring(1), 16));
    }

    /**
     * Approximates a Gaussian blur of an 8-bit channel with three successive box blurs in each
     * direction. Samples outside the buffer count as zero. Integer-only, so results are identical
     * on every JVM.
     */
    public static int[] gaussianBlur(int[] channel, int width, int height, double sigma) {
        int radius = boxRadius(sigma);
        if (radius < 1) return channel.clone();

        int[] a = channel.clone();
        int[] b = new int[a.length];
        for (int pass = 0; pass < 3; pass++) {
            boxBlurHorizontal(a, b, width, height, radius);
            boxBlurVertical(b, a, width, height, radius);
        }
        return a;
    }

    static int boxRadius(double sigma) {
        double idealWidth = Math.sqrt(12.0 * sigma * sigma / 3.0 + 1.0);
        return (int) Math.round((idealWidth - 1.0) / 2.0);
    }

    private static void boxBlurHorizontal(int[] src, int[] dst, int w, int h, int r) {
        int window = 2 * r + 1;
        for (int y = 0; y < h; y++) {
            int row = y * w;
            int sum = 0;
            for (int i = 0; i <= Math.min(r, w - 1); i++) sum += src[row + i];
            for (int x = 0; x < w; x++) {
                dst[row + x] = (sum + window / 2) / window;
                int out = x - r;
                int in = x + r + 1;
                if (out >= 0) sum -= src[row + out];
                if (in < w) sum += src[row + in];
            }
        }
    }

    private static void boxBlurVertical(int[] src, int[] dst, int w, int h, int r) {
        int window = 2 * r + 1;
        for (int x = 0; x < w; x++) {
            int sum = 0;
            for (int i = 0; i <= Math.min(r, h - 1); i++) sum += src[i * w + x];
            for (int y = 0; y < h; y++) {
                dst[y * w + x] = (sum + window / 2) / window;
                int out = y - r;
                int in = y + r + 1;
                if (out >= 0) sum -= src[out * w + x];
                if (in < h) sum += src[in * w + x];
            }
        }
    }
}
