package org.janelia.blur.pipeline;

import ij.process.ImageProcessor;

import java.util.concurrent.Callable;

import org.janelia.blur.Canvas;
import org.janelia.blur.filter.Filter;
import org.janelia.blur.transport.MessageTransport;
import org.janelia.blur.transport.TileProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filters exactly one tile for one worker rank: receive, filter the whole tile
 * (overlap margins included) and send the result back to the coordinator.
 *
 * Any failure aborts the transport so that the rest of the run fails instead of waiting forever.
 */
public class TileWorker
        implements Callable<Integer> {

    private final int rank;
    private final MessageTransport transport;
    private final Filter filter;

    public TileWorker(final int rank,
                      final MessageTransport transport,
                      final Filter filter) {
        this.rank = rank;
        this.transport = transport;
        this.filter = filter;
    }

    /**
     * @return number of bytes sent back to the coordinator.
     */
    @Override
    public Integer call()
            throws Exception {

        try {
            final Canvas tile = TileProtocol.receiveTile(transport, rank);

            LOG.debug("call: rank {} received {} tile, applying {}", rank, tile, filter.toParametersMap());

            final ImageProcessor filtered = filter.process(tile.toImageProcessor());
            final Canvas result = Canvas.fromImageProcessor(filtered);
            if ((result.getWidth() != tile.getWidth()) ||
                (result.getHeight() != tile.getHeight()) ||
                (result.getDepth() != tile.getDepth())) {
                throw new IllegalStateException("filter changed tile " + tile + " into " + result);
            }

            TileProtocol.sendFilteredTile(transport, rank, result);

            LOG.debug("call: rank {} returned {} bytes", rank, result.getDataSize());

            return result.getDataSize();

        } catch (final Throwable t) {
            LOG.error("call: rank {} failed", rank, t);
            transport.abort(t);
            throw t;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileWorker.class);
}
