package org.photocollage.model.collage;

import java.awt.Color;

/**
 * Style constants of the scattered print look.
 */
public final class CollageStyle {

    public static final int BORDER_WIDTH = 6;
    public static final Color BORDER_COLOR = Color.WHITE;

    public static final int SHADOW_OFFSET = 6;
    public static final int SHADOW_BLUR = 12;
    public static final int SHADOW_ALPHA = 80;

    public static final double MIN_SIZE_VARIATION = 0.9;
    public static final double MAX_SIZE_VARIATION = 1.1;

    public static final float JPEG_QUALITY = 0.92f;

    private CollageStyle() {
    }
}
