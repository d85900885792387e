package org.janelia.blur.filter;

import java.io.Serializable;

/**
 * Square Gaussian convolution kernel.
 *
 * The kernel radius ({@link #getOrigin() origin}) is three standard deviations (truncated),
 * so the {@link #getDimension() dimension} is always odd.
 */
public class GaussianKernel
        implements Serializable {

    public static final int RADIUS_FACTOR = 3;

    // largest array length the JVM reliably allocates
    private static final long MAX_WEIGHT_COUNT = Integer.MAX_VALUE - 8;

    private final double standardDeviation;
    private final int dimension;
    private final int origin;
    private final float[] weights;
    private final float kernelMax;
    private final float colorMax;

    private GaussianKernel(final double standardDeviation,
                           final int dimension,
                           final int origin,
                           final float[] weights,
                           final float kernelMax,
                           final float colorMax) {
        this.standardDeviation = standardDeviation;
        this.dimension = dimension;
        this.origin = origin;
        this.weights = weights;
        this.kernelMax = kernelMax;
        this.colorMax = colorMax;
    }

    /**
     * @return width of the kernel for the specified standard deviation, without building its weights.
     *
     * @throws IllegalArgumentException
     *   if the standard deviation is not positive or the kernel width does not fit in an int.
     */
    public static int computeDimension(final double standardDeviation)
            throws IllegalArgumentException {

        if ((! (standardDeviation > 0)) || Double.isInfinite(standardDeviation)) {
            throw new IllegalArgumentException("standard deviation must be positive, got " + standardDeviation);
        }

        final double origin = Math.floor(RADIUS_FACTOR * standardDeviation);
        if (origin > (Integer.MAX_VALUE - 1) / 2) {
            throw new IllegalArgumentException("standard deviation " + standardDeviation + " is too large");
        }

        return (2 * (int) origin) + 1;
    }

    /**
     * @throws IllegalArgumentException
     *   if the standard deviation is not positive or the kernel has too many weights to hold in one array.
     */
    public static GaussianKernel build(final double standardDeviation)
            throws IllegalArgumentException {

        final int dimension = computeDimension(standardDeviation);
        final int origin = (dimension - 1) / 2;

        final long weightCount = (long) dimension * dimension;
        if (weightCount > MAX_WEIGHT_COUNT) {
            throw new IllegalArgumentException("standard deviation " + standardDeviation + " needs a " + dimension +
                                               "x" + dimension + " kernel, which exceeds " + MAX_WEIGHT_COUNT +
                                               " weights");
        }

        final double twoSigmaSquare = 2 * standardDeviation * standardDeviation;

        final float[] weights = new float[(int) weightCount];
        float kernelMax = 0;
        float colorMax = 0;
        for (int y = 0, i = 0; y < dimension; y++) {
            final int dy = y - origin;
            for (int x = 0; x < dimension; x++, i++) {
                final int dx = x - origin;
                weights[i] = (float) Math.exp(-((dx * dx) + (dy * dy)) / twoSigmaSquare);
                kernelMax = Math.max(kernelMax, weights[i]);
                colorMax += weights[i];
            }
        }

        return new GaussianKernel(standardDeviation, dimension, origin, weights, kernelMax, colorMax);
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    public int getDimension() {
        return dimension;
    }

    public int getOrigin() {
        return origin;
    }

    /**
     * @return largest unnormalized weight (the center weight).
     */
    public float getKernelMax() {
        return kernelMax;
    }

    /**
     * @return sum of all unnormalized weights.
     */
    public float getColorMax() {
        return colorMax;
    }

    /**
     * @return row-major copy of the unnormalized weights.
     */
    public float[] getWeights() {
        return weights.clone();
    }

    /**
     * @return row-major copy of the weights scaled to sum to one.
     */
    public float[] getNormalizedWeights() {
        final float[] normalized = new float[weights.length];
        for (int i = 0; i < weights.length; i++) {
            normalized[i] = weights[i] / colorMax;
        }
        return normalized;
    }

    @Override
    public String toString() {
        return "{standardDeviation: " + standardDeviation + ", dimension: " + dimension + '}';
    }
}
