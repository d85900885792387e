package org.janelia.blur;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@link Canvas} instances as image files.
 */
public class Utils {

    public static final String BMP_FORMAT = "bmp";
    public static final String JPEG_FORMAT = "jpg";
    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    public static final List<String> SUPPORTED_FORMATS =
            Arrays.asList(BMP_FORMAT, JPEG_FORMAT, "jpeg", PNG_FORMAT, TIFF_FORMAT, TIF_FORMAT);

    private Utils() {
    }

    /**
     * Opens an image file as a canvas.  Try ImageIO first, then ImageJ.
     *
     * @throws IOException
     *   if the file does not exist or cannot be decoded.
     */
    public static Canvas openCanvas(final String path)
            throws IOException {

        final File file = new File(path);
        if (! file.canRead()) {
            throw new IOException("cannot read " + file.getAbsolutePath());
        }

        final Canvas canvas;
        final BufferedImage image = ImageIO.read(file);
        if (image != null) {
            canvas = fromBufferedImage(image);
        } else {
            final ImagePlus imp = new Opener().openImage(file.getAbsolutePath());
            if (imp == null) {
                throw new IOException("failed to decode " + file.getAbsolutePath());
            }
            canvas = Canvas.fromImageProcessor(imp.getProcessor());
        }

        LOG.info("openCanvas: exit, loaded {} from {}", canvas, file.getAbsolutePath());

        return canvas;
    }

    /**
     * Saves the specified canvas using the format implied by the path's extension.
     *
     * @throws IOException
     *   if the format is not supported or the file cannot be written.
     */
    public static void saveCanvas(final Canvas canvas,
                                  final String path)
            throws IOException {

        final File file = prepareFileForWrite(path);
        final String format = getFormat(path);

        if (TIFF_FORMAT.equals(format) || TIF_FORMAT.equals(format)) {

            final FileSaver fileSaver = new FileSaver(new ImagePlus("", canvas.toImageProcessor()));
            if (! fileSaver.saveAsTiff(file.getAbsolutePath())) {
                throw new IOException("failed to save " + file.getAbsolutePath());
            }

        } else if (! ImageIO.write(toBufferedImage(canvas), format, file)) {
            throw new IOException("no ImageIO writers exist for the '" + format + "' format");
        }

        LOG.info("saveCanvas: exit, saved {}", file.getAbsolutePath());
    }

    /**
     * Ensures the parent directory of the specified path exists and that the file itself can be written.
     *
     * @return the file for the path.
     *
     * @throws IOException
     *   if the format is not supported or the file cannot be created.
     */
    public static File prepareFileForWrite(final String path)
            throws IOException {

        getFormat(path);

        final File file = new File(path).getAbsoluteFile();
        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists())) {
            if (! parentDirectory.mkdirs()) {
                // check for existence again in case another process already created the directory
                if (! parentDirectory.exists()) {
                    throw new IOException("failed to create " + parentDirectory.getAbsolutePath());
                }
            }
        }

        if (file.exists()) {
            if (! file.canWrite()) {
                throw new IOException("not allowed to write to " + file.getAbsolutePath());
            }
        } else if ((parentDirectory != null) && (! parentDirectory.canWrite())) {
            throw new IOException("not allowed to write to " + parentDirectory.getAbsolutePath());
        }

        return file;
    }

    static String getFormat(final String path)
            throws IOException {
        final int dotIndex = path.lastIndexOf('.');
        final String format = dotIndex < 0 ? "" : path.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
        if (! SUPPORTED_FORMATS.contains(format)) {
            throw new IOException("unsupported image format '" + format + "' for " + path +
                                  ", supported formats are " + SUPPORTED_FORMATS);
        }
        return format;
    }

    static Canvas fromBufferedImage(final BufferedImage image) {

        final int width = image.getWidth();
        final int height = image.getHeight();

        final Canvas canvas;
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            canvas = new Canvas(width, height, Canvas.GRAY_DEPTH,
                                (byte[]) image.getRaster().getDataElements(0, 0, width, height, null));
        } else {
            canvas = new Canvas(width, height, Canvas.RGB_DEPTH);
            final int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    canvas.setPixelRGB(x, y, rgb[(y * width) + x]);
                }
            }
        }

        return canvas;
    }

    static BufferedImage toBufferedImage(final Canvas canvas) {

        final int width = canvas.getWidth();
        final int height = canvas.getHeight();

        final BufferedImage image;
        if (canvas.getDepth() == Canvas.GRAY_DEPTH) {
            image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            final byte[] pixels = new byte[width * height];
            System.arraycopy(canvas.getData(), 0, pixels, 0, pixels.length);
            image.getRaster().setDataElements(0, 0, width, height, pixels);
        } else {
            image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    image.setRGB(x, y, canvas.getPixelRGB(x, y));
                }
            }
        }

        return image;
    }

    private static final Logger LOG = LoggerFactory.getLogger(Utils.class);
}
