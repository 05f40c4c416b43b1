package org.photocollage.model.collage;

import lombok.Builder;

import java.awt.Color;

/**
 * Per-render configuration. Built once per request from application defaults and request
 * overrides, then handed to every pipeline stage; nothing here is global state.
 *
 * @param canvasSize      edge length of the square output in pixels
 * @param backgroundColor opaque color the collage is flattened onto
 * @param seed            seed of the render's pseudo-random generator
 * @param columns         layout density hint from the client (2 sparse, 3 medium, 4 dense)
 */
@Builder
public record CollageConfig(int canvasSize, Color backgroundColor, long seed, int columns) {
}
