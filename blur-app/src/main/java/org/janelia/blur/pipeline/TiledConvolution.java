package org.janelia.blur.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.blur.Canvas;
import org.janelia.blur.filter.Filter;
import org.janelia.blur.tile.Reassembler;
import org.janelia.blur.tile.TileLayout;
import org.janelia.blur.tile.TilePartitioner;
import org.janelia.blur.transport.InProcessTransport;
import org.janelia.blur.transport.TransportException;
import org.janelia.blur.util.PhaseTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates one parallel filter run over a source canvas.
 *
 * The source is split into one overlapping band per worker, each worker thread
 * filters its band independently, and the coordinator (the calling thread)
 * places the returned bands into a new output canvas as they arrive.
 * Any worker or transport failure fails the whole run.
 */
public class TiledConvolution {

    private final int workerCount;
    private final Filter filter;
    private final int kernelDimension;
    private final AsyncTileCollector.Mode collectionMode;
    private final long pollIntervalMillis;
    private final long timeoutMillis;

    private TileLayout lastLayout;
    private PhaseTimer lastTimer;

    public TiledConvolution(final int workerCount,
                            final Filter filter,
                            final int kernelDimension) {
        this(workerCount, filter, kernelDimension,
             AsyncTileCollector.Mode.WAIT_ANY, AsyncTileCollector.DEFAULT_POLL_INTERVAL_MILLIS, 0);
    }

    /**
     * @param  workerCount      number of worker ranks (and tiles).
     * @param  filter           filter each worker applies to its whole tile.
     * @param  kernelDimension  width of the filter's (odd, square) kernel, determines the tile overlap.
     * @param  timeoutMillis    maximum time to wait for all filtered tiles, 0 to wait indefinitely.
     */
    public TiledConvolution(final int workerCount,
                            final Filter filter,
                            final int kernelDimension,
                            final AsyncTileCollector.Mode collectionMode,
                            final long pollIntervalMillis,
                            final long timeoutMillis) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("at least one worker is required");
        }
        this.workerCount = workerCount;
        this.filter = filter;
        this.kernelDimension = kernelDimension;
        this.collectionMode = collectionMode;
        this.pollIntervalMillis = pollIntervalMillis;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * @return layout used by the most recent run (tile pixels are released once placed).
     */
    public TileLayout getLastLayout() {
        return lastLayout;
    }

    public PhaseTimer getLastTimer() {
        return lastTimer;
    }

    /**
     * @return filtered copy of the source.
     *
     * @throws IllegalArgumentException
     *   if the source is too small for the worker count and kernel dimension.
     *
     * @throws TransportException
     *   if any worker fails or the collection times out.
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted.
     */
    public Canvas process(final Canvas source)
            throws IllegalArgumentException, TransportException, InterruptedException {

        LOG.info("process: entry, source={}, workerCount={}, filter={}, kernelDimension={}",
                 source, workerCount, filter, kernelDimension);

        final PhaseTimer timer = new PhaseTimer();
        lastTimer = timer;

        timer.startPhase("partition");
        final TileLayout layout = TilePartitioner.partition(source, workerCount, kernelDimension);
        lastLayout = layout;

        final InProcessTransport transport = new InProcessTransport(workerCount + 1);
        final ExecutorService workerPool = Executors.newFixedThreadPool(workerCount);

        boolean completed = false;
        try {
            final List<Future<Integer>> workerResults = new ArrayList<>(workerCount);
            for (int rank = 1; rank <= workerCount; rank++) {
                workerResults.add(workerPool.submit(new TileWorker(rank, transport, filter)));
            }

            timer.startPhase("dispatch");
            new Dispatcher(transport).dispatch(layout);

            timer.startPhase("collect");
            final Canvas output = new Canvas(source.getWidth(), source.getHeight(), source.getDepth());
            final Reassembler reassembler = new Reassembler(output);
            final AsyncTileCollector collector =
                    new AsyncTileCollector(transport, collectionMode, pollIntervalMillis, timeoutMillis);
            collector.collect(layout, reassembler::place);

            if (! reassembler.isComplete()) {
                throw new IllegalStateException("tiles did not cover every row of " + source);
            }

            for (final Future<Integer> workerResult : workerResults) {
                waitForWorker(workerResult);
            }
            timer.stopPhase();

            completed = true;

            LOG.info("process: exit, filtered {} tiles in {}", layout.size(), timer);

            return output;

        } finally {
            if (! completed) {
                transport.abort(new IllegalStateException("run failed"));
            }
            workerPool.shutdownNow();
        }
    }

    private static void waitForWorker(final Future<Integer> workerResult)
            throws TransportException, InterruptedException {
        try {
            workerResult.get();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof TransportException) {
                throw (TransportException) cause;
            }
            throw new TransportException(TransportException.ERR_ABORTED, "worker failed", cause);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TiledConvolution.class);
}
