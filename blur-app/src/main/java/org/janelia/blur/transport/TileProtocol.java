package org.janelia.blur.transport;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;

import org.janelia.blur.Canvas;
import org.janelia.blur.tile.Tile;

/**
 * Message sequence used to move one tile between the coordinator and its worker.
 *
 * The coordinator sends size, width, height, depth and then the pixel payload,
 * each on its own {@link MessageTag}.  The worker replies with the filtered payload
 * on {@link MessageTag#DATA}.  Scalars are encoded as 4-byte big-endian integers.
 */
public class TileProtocol {

    public static final int COORDINATOR_RANK = 0;

    private TileProtocol() {
    }

    /**
     * Sends a tile's metadata and pixels from the coordinator to the worker whose rank is the tile's id.
     */
    public static void sendTile(final MessageTransport transport,
                                final Tile tile)
            throws TransportException {

        final int worker = tile.getId();
        sendInt(transport, worker, MessageTag.SIZE, tile.getSizeBytes());
        sendInt(transport, worker, MessageTag.WIDTH, tile.getWidth());
        sendInt(transport, worker, MessageTag.HEIGHT, tile.getHeight());
        sendInt(transport, worker, MessageTag.DEPTH, tile.getDepth());

        final byte[] pixels = tile.getPixels();
        final byte[] payload;
        if (pixels.length == tile.getSizeBytes()) {
            payload = pixels;
        } else {
            payload = new byte[tile.getSizeBytes()];
            System.arraycopy(pixels, 0, payload, 0, payload.length);
        }
        transport.send(COORDINATOR_RANK, worker, MessageTag.DATA, payload);
    }

    /**
     * Receives a tile on the worker side in the order it was sent by {@link #sendTile}.
     *
     * @return canvas holding the tile's pixels.
     *
     * @throws TransportException
     *   if the payload length does not match the announced size.
     */
    public static Canvas receiveTile(final MessageTransport transport,
                                     final int workerRank)
            throws TransportException, InterruptedException {

        final int size = receiveInt(transport, workerRank, MessageTag.SIZE);
        final int width = receiveInt(transport, workerRank, MessageTag.WIDTH);
        final int height = receiveInt(transport, workerRank, MessageTag.HEIGHT);
        final int depth = receiveInt(transport, workerRank, MessageTag.DEPTH);
        final byte[] data = transport.receive(workerRank, COORDINATOR_RANK, MessageTag.DATA);

        if (data.length != size) {
            throw new TransportException(TransportException.ERR_TRUNCATE,
                                         "rank " + workerRank + " expected " + size + " bytes but received " +
                                         data.length);
        }

        try {
            final Canvas canvas = new Canvas(width, height, depth, data);
            if (canvas.getDataSize() != size) {
                throw new IllegalArgumentException(width + "x" + height + " tile at depth " + depth +
                                                   " does not have " + size + " bytes");
            }
            return canvas;
        } catch (final IllegalArgumentException e) {
            throw new TransportException(TransportException.ERR_TRUNCATE,
                                         "rank " + workerRank + " received inconsistent tile metadata", e);
        }
    }

    public static void sendFilteredTile(final MessageTransport transport,
                                        final int workerRank,
                                        final Canvas filtered)
            throws TransportException {
        final byte[] payload = new byte[filtered.getDataSize()];
        System.arraycopy(filtered.getData(), 0, payload, 0, payload.length);
        transport.send(workerRank, COORDINATOR_RANK, MessageTag.DATA, payload);
    }

    public static CompletableFuture<byte[]> receiveFilteredTileAsync(final MessageTransport transport,
                                                                     final int tileId)
            throws TransportException {
        return transport.receiveAsync(COORDINATOR_RANK, tileId, MessageTag.DATA);
    }

    static void sendInt(final MessageTransport transport,
                        final int destination,
                        final MessageTag tag,
                        final int value)
            throws TransportException {
        transport.send(COORDINATOR_RANK, destination, tag, ByteBuffer.allocate(Integer.BYTES).putInt(value).array());
    }

    static int receiveInt(final MessageTransport transport,
                          final int workerRank,
                          final MessageTag tag)
            throws TransportException, InterruptedException {
        final byte[] bytes = transport.receive(workerRank, COORDINATOR_RANK, tag);
        if (bytes.length != Integer.BYTES) {
            throw new TransportException(TransportException.ERR_TRUNCATE,
                                         "rank " + workerRank + " expected 4 byte " + tag + " message (tag " +
                                         tag.getCode() + ") but received " + bytes.length + " bytes");
        }
        return ByteBuffer.wrap(bytes).getInt();
    }

}
