package org.janelia.blur.pipeline;

import org.janelia.blur.tile.Tile;
import org.janelia.blur.tile.TileLayout;
import org.janelia.blur.tile.TileState;
import org.janelia.blur.transport.MessageTransport;
import org.janelia.blur.transport.TileProtocol;
import org.janelia.blur.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ships every tile of a layout to the worker whose rank matches the tile's id.
 */
public class Dispatcher {

    private final MessageTransport transport;

    public Dispatcher(final MessageTransport transport) {
        this.transport = transport;
    }

    /**
     * Sends each tile's fields in protocol order and then releases the coordinator's copy of its pixels.
     *
     * @throws IllegalArgumentException
     *   if the layout has more tiles than the transport has worker ranks.
     *
     * @throws TransportException
     *   if any send fails.
     */
    public void dispatch(final TileLayout layout)
            throws IllegalArgumentException, TransportException {

        final int workerCount = transport.getSize() - 1;
        if (layout.size() > workerCount) {
            throw new IllegalArgumentException("layout has " + layout.size() + " tiles but only " + workerCount +
                                               " workers are available");
        }

        for (final Tile tile : layout.getTiles()) {
            if (tile.getPixels() == null) {
                throw new IllegalStateException(tile + " has no pixels to dispatch");
            }
            TileProtocol.sendTile(transport, tile);
            tile.releasePixels();
            tile.advanceTo(TileState.DISPATCHED);
            LOG.debug("dispatch: sent {} ({} bytes) to rank {}", tile, tile.getSizeBytes(), tile.getId());
        }

        LOG.info("dispatch: exit, sent {} tiles", layout.size());
    }

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);
}
