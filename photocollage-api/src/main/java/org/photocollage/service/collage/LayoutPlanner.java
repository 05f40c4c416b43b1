package org.photocollage.service.collage;

import org.photocollage.model.collage.LayoutSlot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Chooses where each photo of a collage lands. Counts of one to six use hand-tuned scattered
 * layouts; larger counts use a jittered three-column grid.
 */
@Component
public class LayoutPlanner {

    public static final int MAX_IMAGES = 20;

    static final int GRID_COLUMNS = 3;
    static final double GRID_ORIGIN = 0.22;
    static final double GRID_STEP = 0.28;
    static final int MAX_JITTER = 20;

    // Zero and +/-1 are left out so no print looks axis aligned.
    static final int[] GRID_ROTATIONS = {-5, -4, -3, -2, 2, 3, 4, 5};

    // {x fraction, y fraction, rotation} per slot, indexed by image count - 1
    private static final double[][][] SCATTERED_LAYOUTS = {
            {
                    {0.50, 0.50, -3}
            },
            {
                    {0.35, 0.45, -4},
                    {0.65, 0.55, 3}
            },
            {
                    {0.30, 0.35, -5},
                    {0.70, 0.40, 4},
                    {0.50, 0.70, -3}
            },
            {
                    {0.30, 0.30, -4},
                    {0.70, 0.35, 5},
                    {0.35, 0.70, 3},
                    {0.68, 0.68, -3}
            },
            {
                    {0.25, 0.28, -5},
                    {0.70, 0.25, 4},
                    {0.50, 0.50, -2},
                    {0.28, 0.72, 3},
                    {0.72, 0.70, -4}
            },
            {
                    {0.22, 0.25, -4},
                    {0.50, 0.22, 3},
                    {0.78, 0.28, -5},
                    {0.25, 0.70, 4},
                    {0.52, 0.72, -3},
                    {0.78, 0.68, 3}
            }
    };

    public List<LayoutSlot> plan(int imageCount, int canvasSize, long seed) {
        return plan(imageCount, canvasSize, new Random(seed));
    }

    /**
     * Plans {@code imageCount} slots. Only the grid branch (more than six images) draws from
     * {@code random}: per image an x jitter, a y jitter, then a rotation, in that order.
     */
    public List<LayoutSlot> plan(int imageCount, int canvasSize, Random random) {
        if (imageCount < 1 || imageCount > MAX_IMAGES) {
            throw new IllegalArgumentException("Image count must be between 1 and " + MAX_IMAGES + " but was " + imageCount);
        }
        if (canvasSize <= 0) {
            throw new IllegalArgumentException("Canvas size must be positive but was " + canvasSize);
        }

        int targetSize = baseSize(imageCount, canvasSize);
        List<LayoutSlot> slots = new ArrayList<>(imageCount);

        if (imageCount <= SCATTERED_LAYOUTS.length) {
            for (double[] position : SCATTERED_LAYOUTS[imageCount - 1]) {
                slots.add(new LayoutSlot(canvasSize * position[0], canvasSize * position[1], (int) position[2], targetSize));
            }
            return slots;
        }

        for (int i = 0; i < imageCount; i++) {
            int row = i / GRID_COLUMNS;
            int col = i % GRID_COLUMNS;
            int jitterX = jitter(random);
            int jitterY = jitter(random);
            int rotation = GRID_ROTATIONS[random.nextInt(GRID_ROTATIONS.length)];
            double x = canvasSize * (GRID_ORIGIN + col * GRID_STEP) + jitterX;
            double y = canvasSize * (GRID_ORIGIN + row * GRID_STEP) + jitterY;
            slots.add(new LayoutSlot(x, y, rotation, targetSize));
        }
        return slots;
    }

    static int baseSize(int imageCount, int canvasSize) {
        return (int) (canvasSize * baseSizeFraction(imageCount));
    }

    static double baseSizeFraction(int imageCount) {
        if (imageCount == 1) return 0.85;
        if (imageCount == 2) return 0.65;
        if (imageCount <= 4) return 0.55;
        if (imageCount <= 6) return 0.48;
        return 0.42;
    }

    private static int jitter(Random random) {
        return random.nextInt(2 * MAX_JITTER + 1) - MAX_JITTER;
    }
}
