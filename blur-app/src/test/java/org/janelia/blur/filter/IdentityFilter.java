package org.janelia.blur.filter;

import ij.process.ImageProcessor;

import java.util.HashMap;
import java.util.Map;

/**
 * Filter that leaves every pixel unchanged.
 */
public class IdentityFilter
        implements Filter {

    @Override
    public Map<String, String> toParametersMap() {
        return new HashMap<>();
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip) {
        return ip;
    }
}
