package org.photocollage.model.collage;

import java.awt.image.BufferedImage;

/**
 * A decoded, orientation-corrected, opaque RGB photo.
 *
 * @param index position of the reference it was fetched from in the request
 * @param image pixels, always {@link BufferedImage#TYPE_INT_RGB}
 */
public record SourceImage(int index, BufferedImage image) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
