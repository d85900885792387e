package org.janelia.blur.filter;

import ij.process.ImageProcessor;

import java.io.Serializable;
import java.util.Map;

/**
 * Common interface for all tile filter implementations.
 */
public interface Filter extends Serializable {

    /**
     * @return map of this filter's parameters (suitable for logging and serialization).
     */
    Map<String, String> toParametersMap();

    /**
     * Apply this filter to every pixel of the specified processor.
     *
     * @param  ip  pixels to process.
     *
     * @return filtered image (may be the same instance as ip).
     */
    ImageProcessor process(final ImageProcessor ip);

}
