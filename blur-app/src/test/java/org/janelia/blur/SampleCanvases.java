package org.janelia.blur;

import java.util.Random;

/**
 * Canvases with reproducible content for tests.
 */
public class SampleCanvases {

    private SampleCanvases() {
    }

    public static Canvas random(final int width,
                                final int height,
                                final int depth,
                                final long seed) {
        final Canvas canvas = new Canvas(width, height, depth);
        new Random(seed).nextBytes(canvas.getData());
        return canvas;
    }

    public static Canvas copy(final Canvas canvas) {
        return new Canvas(canvas.getWidth(), canvas.getHeight(), canvas.getDepth(), canvas.getData().clone());
    }
}
