package org.photocollage.model.collage;

/**
 * Planned placement of one photo on the canvas.
 *
 * @param centerX         horizontal center in canvas pixels
 * @param centerY         vertical center in canvas pixels
 * @param rotationDegrees counter-clockwise tilt
 * @param targetSize      base length of the photo's longer side before size variation
 */
public record LayoutSlot(double centerX, double centerY, int rotationDegrees, int targetSize) {
}
