package org.photocollage.model.collage;

import java.awt.image.BufferedImage;

/**
 * A framed, tilted and shadowed photo ready to be pasted. {@code image} is ARGB.
 */
public record TransformedImage(BufferedImage image) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
