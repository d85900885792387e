package org.janelia.blur.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.janelia.blur.tile.Tile;
import org.janelia.blur.tile.TileLayout;
import org.janelia.blur.tile.TileState;
import org.janelia.blur.transport.MessageTransport;
import org.janelia.blur.transport.TileProtocol;
import org.janelia.blur.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects filtered tiles from all workers in whatever order they complete.
 *
 * One receive is posted per tile up front.  Each completed receive is copied into
 * that tile's preallocated buffer and handed to the arrival handler, one at a time on the
 * calling thread, so the handler never needs to be thread safe.
 */
public class AsyncTileCollector {

    public enum Mode {
        /** Block until the first of the outstanding receives completes. */
        WAIT_ANY,

        /** Test the outstanding receives and sleep between tests when none has completed. */
        POLL
    }

    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 10;

    private final MessageTransport transport;
    private final Mode mode;
    private final long pollIntervalMillis;
    private final long timeoutMillis;

    public AsyncTileCollector(final MessageTransport transport) {
        this(transport, Mode.WAIT_ANY, DEFAULT_POLL_INTERVAL_MILLIS, 0);
    }

    /**
     * @param  timeoutMillis  maximum time to wait for all tiles, 0 to wait indefinitely.
     */
    public AsyncTileCollector(final MessageTransport transport,
                              final Mode mode,
                              final long pollIntervalMillis,
                              final long timeoutMillis) {
        if (pollIntervalMillis < 1) {
            throw new IllegalArgumentException("poll interval must be positive");
        }
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.transport = transport;
        this.mode = mode;
        this.pollIntervalMillis = pollIntervalMillis;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Collects every tile in the layout exactly once.
     *
     * @param  layout          canonical tile list for the run.
     * @param  arrivalHandler  invoked for each tile after its filtered pixels are in place.
     *
     * @return number of collected tiles.
     *
     * @throws TransportException
     *   if a receive fails, a payload has the wrong size, or the timeout expires.
     *
     * @throws InterruptedException
     *   if the calling thread is interrupted while waiting.
     */
    public int collect(final TileLayout layout,
                       final Consumer<Tile> arrivalHandler)
            throws TransportException, InterruptedException {

        final int tileCount = layout.size();
        final int maxTileSize = layout.getMaxTileSize();

        LOG.info("collect: entry, waiting for {} tiles in {} mode, maxTileSize is {}",
                 tileCount, mode, maxTileSize);

        final byte[][] buffers = new byte[tileCount][maxTileSize];
        final List<CompletableFuture<byte[]>> pendingReceives = new ArrayList<>(tileCount);
        for (final Tile tile : layout.getTiles()) {
            pendingReceives.add(TileProtocol.receiveFilteredTileAsync(transport, tile.getId()));
        }

        final long deadline = timeoutMillis > 0 ? System.currentTimeMillis() + timeoutMillis : Long.MAX_VALUE;
        final boolean[] done = new boolean[tileCount];

        final BlockingQueue<Integer> completedIndexes = new LinkedBlockingQueue<>();
        if (mode == Mode.WAIT_ANY) {
            for (int i = 0; i < tileCount; i++) {
                final Integer index = i;
                pendingReceives.get(i).whenComplete((payload, failure) -> completedIndexes.add(index));
            }
        }

        for (int finished = 0; finished < tileCount; finished++) {

            final int index;
            if (mode == Mode.WAIT_ANY) {
                index = waitForAny(completedIndexes, deadline, layout, done);
            } else {
                index = pollForAny(pendingReceives, deadline, layout, done);
            }

            final Tile tile = layout.getTile(index + 1);
            final byte[] payload = MessageTransport.waitFor(pendingReceives.get(index));
            if (payload.length != tile.getSizeBytes()) {
                throw new TransportException(TransportException.ERR_TRUNCATE,
                                             "expected " + tile.getSizeBytes() + " bytes for tile " +
                                             tile.getId() + " but received " + payload.length);
            }

            System.arraycopy(payload, 0, buffers[index], 0, payload.length);
            tile.setPixels(buffers[index]);
            tile.advanceTo(TileState.ARRIVED);
            done[index] = true;

            LOG.debug("collect: tile {} arrived ({} of {})", tile.getId(), finished + 1, tileCount);

            arrivalHandler.accept(tile);
            buffers[index] = null;
        }

        LOG.info("collect: exit, collected {} tiles", tileCount);

        return tileCount;
    }

    private int waitForAny(final BlockingQueue<Integer> completedIndexes,
                           final long deadline,
                           final TileLayout layout,
                           final boolean[] done)
            throws TransportException, InterruptedException {
        final Integer index;
        if (deadline == Long.MAX_VALUE) {
            index = completedIndexes.take();
        } else {
            index = completedIndexes.poll(Math.max(0, deadline - System.currentTimeMillis()),
                                          TimeUnit.MILLISECONDS);
        }
        if (index == null) {
            throw buildTimeoutException(layout, done);
        }
        return index;
    }

    private int pollForAny(final List<CompletableFuture<byte[]>> pendingReceives,
                           final long deadline,
                           final TileLayout layout,
                           final boolean[] done)
            throws TransportException, InterruptedException {
        while (true) {
            for (int i = 0; i < pendingReceives.size(); i++) {
                if ((! done[i]) && pendingReceives.get(i).isDone()) {
                    return i;
                }
            }
            if (System.currentTimeMillis() >= deadline) {
                throw buildTimeoutException(layout, done);
            }
            Thread.sleep(pollIntervalMillis);
        }
    }

    private TransportException buildTimeoutException(final TileLayout layout,
                                                     final boolean[] done) {
        final List<Integer> missingTileIds = new ArrayList<>();
        for (int i = 0; i < done.length; i++) {
            if (! done[i]) {
                missingTileIds.add(layout.getTile(i + 1).getId());
            }
        }
        return new TransportException(TransportException.ERR_TIMEOUT,
                                      "gave up after " + timeoutMillis + " ms waiting for tiles " + missingTileIds);
    }

    private static final Logger LOG = LoggerFactory.getLogger(AsyncTileCollector.class);
}
