package org.janelia.blur;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

/**
 * Raster image held as a row-major byte buffer.
 *
 * Gray canvases (depth 8) store one byte per pixel.
 * RGB canvases (depth 24) store three bytes per pixel in red, green, blue order.
 * The buffer may be larger than {@link #getDataSize()} (e.g. a preallocated receive buffer),
 * only the leading {@code rowBytes * height} bytes are meaningful.
 */
public class Canvas {

    public static final int GRAY_DEPTH = 8;
    public static final int RGB_DEPTH = 24;

    private final int width;
    private final int height;
    private final int depth;
    private final byte[] data;

    public Canvas(final int width,
                  final int height,
                  final int depth) {
        this(width, height, depth, null);
    }

    /**
     * @param  data  existing pixel buffer to wrap or null to allocate a new one.
     *
     * @throws IllegalArgumentException
     *   if the dimensions or depth are invalid or the buffer is too small.
     */
    public Canvas(final int width,
                  final int height,
                  final int depth,
                  final byte[] data)
            throws IllegalArgumentException {

        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("invalid canvas dimensions " + width + "x" + height);
        }

        final long size = (long) rowBytes(width, depth) * height;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("canvas " + width + "x" + height + " at depth " + depth +
                                               " is too large");
        }

        this.width = width;
        this.height = height;
        this.depth = depth;

        if (data == null) {
            this.data = new byte[(int) size];
        } else if (data.length < size) {
            throw new IllegalArgumentException("buffer has " + data.length + " bytes but a " + width + "x" +
                                               height + " canvas at depth " + depth + " needs " + size);
        } else {
            this.data = data;
        }
    }

    /**
     * @return number of bytes in one canvas row.
     *
     * @throws IllegalArgumentException
     *   if the depth is not supported.
     */
    public static int rowBytes(final int width,
                               final int depth)
            throws IllegalArgumentException {
        return width * bytesPerPixel(depth);
    }

    public static int bytesPerPixel(final int depth)
            throws IllegalArgumentException {
        switch (depth) {
            case GRAY_DEPTH: return 1;
            case RGB_DEPTH: return 3;
            default: throw new IllegalArgumentException("unsupported depth " + depth);
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getDepth() {
        return depth;
    }

    public int getRowBytes() {
        return rowBytes(width, depth);
    }

    public int getDataSize() {
        return getRowBytes() * height;
    }

    public byte[] getData() {
        return data;
    }

    /**
     * @return packed 0xRRGGBB value of the specified pixel (gray values are replicated across channels).
     */
    public int getPixelRGB(final int x,
                           final int y) {
        final int i = (y * getRowBytes()) + (x * bytesPerPixel(depth));
        if (depth == GRAY_DEPTH) {
            final int v = data[i] & 0xff;
            return (v << 16) | (v << 8) | v;
        }
        return ((data[i] & 0xff) << 16) | ((data[i + 1] & 0xff) << 8) | (data[i + 2] & 0xff);
    }

    public void setPixelRGB(final int x,
                            final int y,
                            final int rgb) {
        final int i = (y * getRowBytes()) + (x * bytesPerPixel(depth));
        if (depth == GRAY_DEPTH) {
            data[i] = (byte) rgb;
        } else {
            data[i] = (byte) (rgb >> 16);
            data[i + 1] = (byte) (rgb >> 8);
            data[i + 2] = (byte) rgb;
        }
    }

    /**
     * Copies whole rows from another buffer with the same row layout into this canvas.
     */
    public void copyRowsFrom(final byte[] source,
                             final int sourceRow,
                             final int targetRow,
                             final int rowCount) {
        final int rowBytes = getRowBytes();
        System.arraycopy(source, sourceRow * rowBytes, data, targetRow * rowBytes, rowCount * rowBytes);
    }

    /**
     * @return a {@link ByteProcessor} (gray) or {@link ColorProcessor} (RGB) copy of this canvas.
     */
    public ImageProcessor toImageProcessor() {
        final int pixelCount = width * height;
        if (depth == GRAY_DEPTH) {
            final byte[] pixels = new byte[pixelCount];
            System.arraycopy(data, 0, pixels, 0, pixelCount);
            return new ByteProcessor(width, height, pixels);
        }
        final int[] pixels = new int[pixelCount];
        for (int p = 0, i = 0; p < pixelCount; p++, i += 3) {
            pixels[p] = ((data[i] & 0xff) << 16) | ((data[i + 1] & 0xff) << 8) | (data[i + 2] & 0xff);
        }
        return new ColorProcessor(width, height, pixels);
    }

    /**
     * @return canvas copy of the specified processor.
     *         Byte processors without a color lookup table become gray canvases,
     *         everything else is converted to RGB.
     */
    public static Canvas fromImageProcessor(final ImageProcessor ip) {

        final int width = ip.getWidth();
        final int height = ip.getHeight();

        if ((ip instanceof ByteProcessor) && (! ip.isColorLut()) && (! ip.isInvertedLut())) {
            final Canvas canvas = new Canvas(width, height, GRAY_DEPTH);
            System.arraycopy(ip.getPixels(), 0, canvas.data, 0, width * height);
            return canvas;
        }

        final ColorProcessor cp = (ip instanceof ColorProcessor) ? (ColorProcessor) ip : ip.convertToColorProcessor();
        final int[] pixels = (int[]) cp.getPixels();
        final Canvas canvas = new Canvas(width, height, RGB_DEPTH);
        for (int p = 0, i = 0; p < pixels.length; p++, i += 3) {
            canvas.data[i] = (byte) (pixels[p] >> 16);
            canvas.data[i + 1] = (byte) (pixels[p] >> 8);
            canvas.data[i + 2] = (byte) pixels[p];
        }
        return canvas;
    }

    @Override
    public String toString() {
        return "{width: " + width + ", height: " + height + ", depth: " + depth + '}';
    }

}
