package org.janelia.blur.filter;

import ij.plugin.filter.Convolver;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Convolves every color channel with a {@link GaussianKernel}.
 * Pixels beyond the image edge take the value of the nearest edge pixel.
 */
public class GaussianBlur
        implements Filter {

    private final GaussianKernel kernel;

    public GaussianBlur(final GaussianKernel kernel) {
        this.kernel = kernel;
    }

    public GaussianKernel getKernel() {
        return kernel;
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("standardDeviation", String.valueOf(kernel.getStandardDeviation()));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip) {

        final float[] weights = kernel.getNormalizedWeights();
        final int dimension = kernel.getDimension();

        final Convolver convolver = new Convolver();
        convolver.setNormalize(false);

        for (int channel = 0; channel < ip.getNChannels(); channel++) {
            final FloatProcessor fp = ip.toFloat(channel, null);
            if (! convolver.convolveFloat(fp, weights, dimension, dimension)) {
                throw new IllegalStateException("convolution of channel " + channel + " was canceled");
            }
            ip.setPixels(channel, fp);
        }

        return ip;
    }

    @Override
    public String toString() {
        return "GaussianBlur" + kernel;
    }
}
