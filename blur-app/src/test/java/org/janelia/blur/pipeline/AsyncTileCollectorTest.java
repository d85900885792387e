package org.janelia.blur.pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.janelia.blur.Canvas;
import org.janelia.blur.SampleCanvases;
import org.janelia.blur.tile.Reassembler;
import org.janelia.blur.tile.Tile;
import org.janelia.blur.tile.TileLayout;
import org.janelia.blur.tile.TilePartitioner;
import org.janelia.blur.tile.TileState;
import org.janelia.blur.transport.InProcessTransport;
import org.janelia.blur.transport.MessageTag;
import org.janelia.blur.transport.TileProtocol;
import org.janelia.blur.transport.TransportException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link AsyncTileCollector} class.
 */
public class AsyncTileCollectorTest {

    @Test(timeout = 10000)
    public void testWaitAnyHandlesTilesInCompletionOrder() throws Exception {

        final Canvas source = SampleCanvases.random(11, 80, Canvas.RGB_DEPTH, 17);
        final TileLayout layout = buildDispatchedLayout(source);
        final InProcessTransport transport = new InProcessTransport(layout.size() + 1);

        // each arrival triggers the send of the next tile, so completion order is fixed
        final List<Integer> sendOrder = Arrays.asList(4, 2, 3, 1);
        final List<byte[]> payloads = new ArrayList<>();
        for (final Integer id : sendOrder) {
            payloads.add(layout.getTile(id).getPixels().clone());
        }
        sendToCoordinator(transport, sendOrder.get(0), payloads.get(0));

        final Canvas output = new Canvas(source.getWidth(), source.getHeight(), source.getDepth());
        final Reassembler reassembler = new Reassembler(output);
        final List<Integer> arrivalOrder = new ArrayList<>();

        final int collectedCount = new AsyncTileCollector(transport).collect(layout, tile -> {
            arrivalOrder.add(tile.getId());
            reassembler.place(tile);
            final int next = arrivalOrder.size();
            if (next < sendOrder.size()) {
                sendToCoordinator(transport, sendOrder.get(next), payloads.get(next));
            }
        });

        Assert.assertEquals("invalid collected count", 4, collectedCount);
        Assert.assertEquals("tiles should be handled in completion order", sendOrder, arrivalOrder);
        Assert.assertArrayEquals("invalid reassembled pixels", source.getData(), output.getData());
    }

    @Test(timeout = 10000)
    public void testPollHandlesEveryTileOnce() throws Exception {

        final Canvas source = SampleCanvases.random(11, 80, Canvas.GRAY_DEPTH, 19);
        final TileLayout layout = buildDispatchedLayout(source);
        final InProcessTransport transport = new InProcessTransport(layout.size() + 1);

        final Thread sender = startSender(transport, layout, Arrays.asList(3, 1, 4, 2));

        final Canvas output = new Canvas(source.getWidth(), source.getHeight(), source.getDepth());
        final Reassembler reassembler = new Reassembler(output);
        final List<Integer> arrivedIds = new ArrayList<>();

        final AsyncTileCollector collector =
                new AsyncTileCollector(transport, AsyncTileCollector.Mode.POLL, 1, 0);
        collector.collect(layout, tile -> {
            Assert.assertEquals("invalid state for " + tile, TileState.ARRIVED, tile.getState());
            arrivedIds.add(tile.getId());
            reassembler.place(tile);
        });
        sender.join();

        Collections.sort(arrivedIds);
        Assert.assertEquals("every tile should arrive once", Arrays.asList(1, 2, 3, 4), arrivedIds);
        Assert.assertArrayEquals("invalid reassembled pixels", source.getData(), output.getData());
    }

    @Test(timeout = 10000)
    public void testTimeoutNamesMissingTiles() throws Exception {
        for (final AsyncTileCollector.Mode mode : AsyncTileCollector.Mode.values()) {

            final TileLayout layout = buildDispatchedLayout(SampleCanvases.random(5, 80, Canvas.GRAY_DEPTH, 23));
            final InProcessTransport transport = new InProcessTransport(layout.size() + 1);
            for (final int id : new int[] { 1, 2, 4 }) {
                transport.send(id, TileProtocol.COORDINATOR_RANK, MessageTag.DATA, layout.getTile(id).getPixels());
            }

            final List<Integer> arrivedIds = new ArrayList<>();
            try {
                new AsyncTileCollector(transport, mode, 5, 200).collect(layout, tile -> arrivedIds.add(tile.getId()));
                Assert.fail(mode + " collection should time out");
            } catch (final TransportException e) {
                Assert.assertEquals("invalid status code for " + mode,
                                    TransportException.ERR_TIMEOUT, e.getStatusCode());
                Assert.assertTrue("message should name missing tile for " + mode + ": " + e.getMessage(),
                                  e.getMessage().contains("[3]"));
            }

            Assert.assertEquals("available tiles should be handled before timeout in " + mode,
                                3, arrivedIds.size());
        }
    }

    @Test(timeout = 10000)
    public void testWrongPayloadSize() throws Exception {

        final TileLayout layout = buildDispatchedLayout(SampleCanvases.random(5, 80, Canvas.GRAY_DEPTH, 29));
        final InProcessTransport transport = new InProcessTransport(layout.size() + 1);
        transport.send(1, TileProtocol.COORDINATOR_RANK, MessageTag.DATA, new byte[3]);

        try {
            new AsyncTileCollector(transport).collect(layout, tile -> {});
            Assert.fail("short payload should be rejected");
        } catch (final TransportException e) {
            Assert.assertEquals("invalid status code", TransportException.ERR_TRUNCATE, e.getStatusCode());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidPollInterval() {
        new AsyncTileCollector(new InProcessTransport(2), AsyncTileCollector.Mode.POLL, 0, 0);
    }

    private static TileLayout buildDispatchedLayout(final Canvas source) {
        final TileLayout layout = TilePartitioner.partition(source, 4, 5);
        for (final Tile tile : layout.getTiles()) {
            tile.advanceTo(TileState.DISPATCHED);
        }
        return layout;
    }

    private static void sendToCoordinator(final InProcessTransport transport,
                                          final int tileId,
                                          final byte[] payload) {
        try {
            transport.send(tileId, TileProtocol.COORDINATOR_RANK, MessageTag.DATA, payload);
        } catch (final TransportException e) {
            throw new IllegalStateException("failed to send tile " + tileId, e);
        }
    }

    /**
     * Sends each tile's unfiltered pixels back to the coordinator from a separate thread.
     */
    private static Thread startSender(final InProcessTransport transport,
                                      final TileLayout layout,
                                      final List<Integer> sendOrder) {

        final List<byte[]> payloads = new ArrayList<>();
        for (final Integer id : sendOrder) {
            payloads.add(layout.getTile(id).getPixels().clone());
        }

        final Thread sender = new Thread(() -> {
            try {
                for (int i = 0; i < sendOrder.size(); i++) {
                    Thread.sleep(20);
                    transport.send(sendOrder.get(i), TileProtocol.COORDINATOR_RANK, MessageTag.DATA, payloads.get(i));
                }
            } catch (final Exception e) {
                transport.abort(e);
            }
        });
        sender.start();
        return sender;
    }

}
