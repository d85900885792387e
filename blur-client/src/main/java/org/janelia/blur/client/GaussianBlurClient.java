package org.janelia.blur.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.janelia.blur.Canvas;
import org.janelia.blur.Utils;
import org.janelia.blur.client.parameter.CollectionParameters;
import org.janelia.blur.client.parameter.CommandLineParameters;
import org.janelia.blur.filter.GaussianBlur;
import org.janelia.blur.filter.GaussianKernel;
import org.janelia.blur.pipeline.TiledConvolution;
import org.janelia.blur.tile.TilePartitioner;
import org.janelia.blur.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for applying a Gaussian blur to an image using one worker per horizontal band.
 */
public class GaussianBlurClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Path of the image to blur",
                required = true)
        public String input;

        @Parameter(
                names = "--output",
                description = "Path for the blurred image (format is derived from the extension, e.g. png, bmp, tif)",
                required = true)
        public String output;

        @Parameter(
                names = "--standardDeviation",
                description = "Standard deviation of the Gaussian kernel (must be positive)",
                required = true)
        public Double standardDeviation;

        @Parameter(
                names = "--processes",
                description = "Total number of processes including the coordinator, " +
                              "each of the remaining processes filters one band of the image " +
                              "(default is number of available processors plus one)")
        public Integer processes;

        @Parameter(
                names = "--tileLayoutFile",
                description = "If specified, write a JSON description of the tiles to this file")
        public String tileLayoutFile;

        @ParametersDelegate
        public CollectionParameters collection = new CollectionParameters();

        public int getWorkerCount() {
            final int processCount = processes == null ? Runtime.getRuntime().availableProcessors() + 1 : processes;
            return processCount - 1;
        }

        public void validate()
                throws IllegalArgumentException {
            if ((standardDeviation == null) || (! (standardDeviation > 0))) {
                throw new IllegalArgumentException("--standardDeviation must be positive");
            }
            if ((processes != null) && (processes < 2)) {
                throw new IllegalArgumentException("--processes must be at least 2 (one coordinator and one worker)");
            }
            collection.validate();
        }
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);
                parameters.validate();

                LOG.info("runClient: entry, parameters={}", parameters);

                final GaussianBlurClient client = new GaussianBlurClient(parameters);
                client.blur();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    GaussianBlurClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Reads the input image, blurs it with one tile per worker, and writes the output image.
     *
     * @throws IOException
     *   if the input cannot be read or the output cannot be written.
     *
     * @throws IllegalArgumentException
     *   if the image is too small for the requested number of workers and kernel size.
     *
     * @throws TransportException
     *   if any worker fails.
     */
    public void blur()
            throws IOException, IllegalArgumentException, TransportException, InterruptedException {

        // fail before any filtering if the output cannot be written
        Utils.prepareFileForWrite(parameters.output);

        final Canvas source = Utils.openCanvas(parameters.input);

        // check the tile sizing before allocating a kernel that may be too large for the image
        final int workerCount = parameters.getWorkerCount();
        final int kernelDimension = GaussianKernel.computeDimension(parameters.standardDeviation);
        TilePartitioner.buildLayout(source.getWidth(), source.getHeight(), source.getDepth(),
                                    workerCount, kernelDimension);

        final GaussianKernel kernel = GaussianKernel.build(parameters.standardDeviation);
        final CollectionParameters collection = parameters.collection;
        final TiledConvolution tiledConvolution = new TiledConvolution(workerCount,
                                                                       new GaussianBlur(kernel),
                                                                       kernel.getDimension(),
                                                                       collection.mode,
                                                                       collection.pollIntervalMillis,
                                                                       collection.getTimeoutMillis());

        final Canvas blurred = tiledConvolution.process(source);

        Utils.saveCanvas(blurred, parameters.output);

        if (parameters.tileLayoutFile != null) {
            final File layoutFile = new File(parameters.tileLayoutFile).getAbsoluteFile();
            Files.write(layoutFile.toPath(),
                        tiledConvolution.getLastLayout().toJson().getBytes(StandardCharsets.UTF_8));
            LOG.info("blur: saved tile layout to {}", layoutFile);
        }

        LOG.info("blur: exit, phase times {}", tiledConvolution.getLastTimer().getPhaseMilliseconds());
    }

    private static final Logger LOG = LoggerFactory.getLogger(GaussianBlurClient.class);
}
