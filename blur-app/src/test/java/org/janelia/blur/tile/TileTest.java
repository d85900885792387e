package org.janelia.blur.tile;

import org.janelia.blur.Canvas;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Tile} class.
 */
public class TileTest {

    @Test
    public void testGeometry() {
        final Tile tile = new Tile(2, 22, 50, 2, 2, 50, Canvas.RGB_DEPTH);
        Assert.assertEquals("invalid height", 28, tile.getHeight());
        Assert.assertEquals("invalid size", 28 * 150, tile.getSizeBytes());
        Assert.assertEquals("invalid interior start", 24, tile.getInteriorStart());
        Assert.assertEquals("invalid interior end", 48, tile.getInteriorEnd());
        Assert.assertEquals("invalid initial state", TileState.CREATED, tile.getState());
        Assert.assertNull("pixels should not be set", tile.getPixels());
    }

    @Test
    public void testStateTransitions() {

        final Tile tile = new Tile(1, 0, 10, 0, 1, 4, Canvas.GRAY_DEPTH);

        try {
            tile.advanceTo(TileState.ARRIVED);
            Assert.fail("skipping DISPATCHED should fail");
        } catch (final IllegalStateException e) {
            Assert.assertEquals("state should be unchanged", TileState.CREATED, tile.getState());
        }

        tile.advanceTo(TileState.DISPATCHED);
        tile.advanceTo(TileState.ARRIVED);
        tile.advanceTo(TileState.PLACED);

        for (final TileState next : TileState.values()) {
            try {
                tile.advanceTo(next);
                Assert.fail("PLACED tile should not move to " + next);
            } catch (final IllegalStateException e) {
                Assert.assertEquals("state should be unchanged", TileState.PLACED, tile.getState());
            }
        }
    }

    @Test
    public void testPixelBuffers() {

        final Tile tile = new Tile(1, 0, 10, 0, 1, 4, Canvas.GRAY_DEPTH);

        final byte[] oversized = new byte[100];
        tile.setPixels(oversized);
        Assert.assertSame("oversized buffer should be kept", oversized, tile.getPixels());

        tile.releasePixels();
        Assert.assertNull("pixels should be released", tile.getPixels());

        try {
            tile.setPixels(new byte[39]);
            Assert.fail("undersized buffer should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertNull("pixels should be unchanged", tile.getPixels());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyRowRange() {
        new Tile(1, 5, 5, 0, 0, 4, Canvas.GRAY_DEPTH);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMarginsWithoutInterior() {
        new Tile(1, 0, 4, 2, 2, 4, Canvas.GRAY_DEPTH);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveId() {
        new Tile(0, 0, 4, 0, 0, 4, Canvas.GRAY_DEPTH);
    }

}
