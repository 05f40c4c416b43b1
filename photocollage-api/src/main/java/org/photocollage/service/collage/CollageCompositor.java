package org.photocollage.service.collage;

import lombok.extern.slf4j.Slf4j;
import org.photocollage.model.collage.LayoutSlot;
import org.photocollage.model.collage.TransformedImage;
import org.photocollage.util.ImageUtils;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Pastes transformed prints onto the canvas. List order is stacking order: every image is drawn
 * over the ones before it. Callers that want a different stacking must reorder their input.
 */
@Slf4j
@Component
public class CollageCompositor {

    public BufferedImage createCanvas(int canvasSize, Color background) {
        BufferedImage canvas = new BufferedImage(canvasSize, canvasSize, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(new Color(background.getRed(), background.getGreen(), background.getBlue(), 255));
            g.fillRect(0, 0, canvasSize, canvasSize);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    /**
     * Draws {@code images[i]} centered on {@code slots[i]}. Images beyond the last slot are skipped.
     *
     * @return the same canvas, for chaining
     */
    public BufferedImage composite(BufferedImage canvas, List<TransformedImage> images, List<LayoutSlot> slots) {
        Graphics2D g = canvas.createGraphics();
        try {
            ImageUtils.configureGraphics(g);
            for (int i = 0; i < images.size(); i++) {
                if (i >= slots.size()) {
                    log.warn("No slot left for image {}, skipping {} remaining image(s)", i + 1, images.size() - i);
                    break;
                }
                TransformedImage image = images.get(i);
                LayoutSlot slot = slots.get(i);
                int pasteX = (int) slot.centerX() - image.width() / 2;
                int pasteY = (int) slot.centerY() - image.height() / 2;
                g.drawImage(image.image(), pasteX, pasteY, null);
                log.debug("Placed image {} at ({}, {}) with rotation {}", i + 1, pasteX, pasteY, slot.rotationDegrees());
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }
}
