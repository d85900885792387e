package org.janelia.blur.pipeline;

import org.janelia.blur.Canvas;
import org.janelia.blur.SampleCanvases;
import org.janelia.blur.tile.Tile;
import org.janelia.blur.tile.TileLayout;
import org.janelia.blur.tile.TilePartitioner;
import org.janelia.blur.tile.TileState;
import org.janelia.blur.transport.InProcessTransport;
import org.janelia.blur.transport.TileProtocol;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Dispatcher} class.
 */
public class DispatcherTest {

    @Test
    public void testDispatchSendsEachTileToItsRank() throws Exception {

        final Canvas source = SampleCanvases.random(7, 60, Canvas.GRAY_DEPTH, 13);
        final TileLayout layout = TilePartitioner.partition(source, 3, 5);

        final byte[][] expectedPixels = new byte[layout.size()][];
        for (final Tile tile : layout.getTiles()) {
            expectedPixels[tile.getId() - 1] = tile.getPixels().clone();
        }

        final InProcessTransport transport = new InProcessTransport(4);
        new Dispatcher(transport).dispatch(layout);

        for (final Tile tile : layout.getTiles()) {
            Assert.assertEquals("invalid state for " + tile, TileState.DISPATCHED, tile.getState());
            Assert.assertNull("pixels should be released for " + tile, tile.getPixels());

            final Canvas received = TileProtocol.receiveTile(transport, tile.getId());
            Assert.assertArrayEquals("invalid pixels received by rank " + tile.getId(),
                                     expectedPixels[tile.getId() - 1], received.getData());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMoreTilesThanWorkers() throws Exception {
        final TileLayout layout = TilePartitioner.partition(SampleCanvases.random(7, 60, Canvas.GRAY_DEPTH, 13), 3, 5);
        new Dispatcher(new InProcessTransport(3)).dispatch(layout);
    }

}
