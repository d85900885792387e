package org.janelia.blur.tile;

import java.util.Arrays;
import java.util.List;

import org.janelia.blur.Canvas;
import org.janelia.blur.SampleCanvases;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TilePartitioner} class.
 */
public class TilePartitionerTest {

    @Test
    public void testFourTileLayout() {

        final TileLayout layout = TilePartitioner.buildLayout(50, 100, Canvas.RGB_DEPTH, 4, 5);

        Assert.assertEquals("invalid number of tiles", 4, layout.size());
        Assert.assertEquals("invalid segment height", 24, layout.getSegmentHeight());
        Assert.assertEquals("invalid overlap", 2, layout.getOverlap());

        validateTile(layout.getTile(1), 1, 0, 26, 0, 2);
        validateTile(layout.getTile(2), 2, 22, 50, 2, 2);
        validateTile(layout.getTile(3), 3, 46, 74, 2, 2);
        validateTile(layout.getTile(4), 4, 70, 100, 2, 0);

        Assert.assertEquals("invalid max tile size", 150 * 30, layout.getMaxTileSize());

        for (final Tile tile : layout.getTiles()) {
            Assert.assertEquals("invalid width for " + tile, 50, tile.getWidth());
            Assert.assertEquals("invalid size for " + tile, 150 * tile.getHeight(), tile.getSizeBytes());
            Assert.assertEquals("invalid state for " + tile, TileState.CREATED, tile.getState());
        }
    }

    @Test
    public void testSingleTileCoversWholeImage() {
        final TileLayout layout = TilePartitioner.buildLayout(8, 30, Canvas.GRAY_DEPTH, 1, 9);
        Assert.assertEquals("invalid number of tiles", 1, layout.size());
        validateTile(layout.getTile(1), 1, 0, 30, 0, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSegmentTooSmallForKernel() {
        TilePartitioner.buildLayout(50, 10, Canvas.GRAY_DEPTH, 5, 5);
    }

    @Test
    public void testSegmentHeightMustExceedKernelDimension() {
        // 24 / 4 - 1 = 5 rows per segment, same as the kernel
        try {
            TilePartitioner.buildLayout(10, 24, Canvas.GRAY_DEPTH, 4, 5);
            Assert.fail("segment height equal to kernel dimension should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should mention segment height: " + e.getMessage(),
                              e.getMessage().contains("segment height 5"));
        }

        // 28 / 4 - 1 = 6 rows per segment
        final TileLayout layout = TilePartitioner.buildLayout(10, 28, Canvas.GRAY_DEPTH, 4, 5);
        Assert.assertEquals("invalid number of tiles", 4, layout.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEvenKernelDimension() {
        TilePartitioner.buildLayout(50, 100, Canvas.GRAY_DEPTH, 2, 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMoreTilesThanRows() {
        TilePartitioner.buildLayout(50, 3, Canvas.GRAY_DEPTH, 4, 1);
    }

    @Test
    public void testInteriorRowsCoverImageExactlyOnce() {

        final List<Integer> kernelDimensions = Arrays.asList(1, 3, 5, 7, 9, 15, 31);

        int validLayoutCount = 0;
        for (int height = 1; height <= 240; height++) {
            for (int tileCount = 1; tileCount <= 12; tileCount++) {
                for (final int kernelDimension : kernelDimensions) {

                    final String context = "height " + height + ", tileCount " + tileCount +
                                           ", kernelDimension " + kernelDimension;
                    final int segmentHeight = (height / tileCount) - 1;

                    if (segmentHeight <= kernelDimension) {
                        try {
                            TilePartitioner.buildLayout(4, height, Canvas.GRAY_DEPTH, tileCount, kernelDimension);
                            Assert.fail("layout should have been rejected for " + context);
                        } catch (final IllegalArgumentException e) {
                            continue;
                        }
                    }

                    final TileLayout layout =
                            TilePartitioner.buildLayout(4, height, Canvas.GRAY_DEPTH, tileCount, kernelDimension);
                    validateCoverage(layout, context);
                    validLayoutCount++;
                }
            }
        }

        Assert.assertTrue("too few valid layouts checked", validLayoutCount > 1000);
    }

    @Test
    public void testPartitionCopiesSourceRows() {

        final Canvas source = SampleCanvases.random(13, 61, Canvas.RGB_DEPTH, 42);
        final Canvas sourceCopy = SampleCanvases.copy(source);

        final TileLayout layout = TilePartitioner.partition(source, 3, 3);

        final int rowBytes = source.getRowBytes();
        for (final Tile tile : layout.getTiles()) {
            final byte[] expected = Arrays.copyOfRange(source.getData(),
                                                       tile.getRowStart() * rowBytes,
                                                       tile.getRowEnd() * rowBytes);
            Assert.assertArrayEquals("invalid pixels for " + tile, expected, tile.getPixels());
        }

        Assert.assertArrayEquals("source was modified", sourceCopy.getData(), source.getData());
    }

    private static void validateTile(final Tile tile,
                                     final int expectedId,
                                     final int expectedRowStart,
                                     final int expectedRowEnd,
                                     final int expectedBottomMargin,
                                     final int expectedTopMargin) {
        Assert.assertEquals("invalid id", expectedId, tile.getId());
        Assert.assertEquals("invalid rowStart for " + tile, expectedRowStart, tile.getRowStart());
        Assert.assertEquals("invalid rowEnd for " + tile, expectedRowEnd, tile.getRowEnd());
        Assert.assertEquals("invalid bottomMargin for " + tile, expectedBottomMargin, tile.getBottomMargin());
        Assert.assertEquals("invalid topMargin for " + tile, expectedTopMargin, tile.getTopMargin());
        Assert.assertEquals("invalid height for " + tile, expectedRowEnd - expectedRowStart, tile.getHeight());
    }

    private static void validateCoverage(final TileLayout layout,
                                         final String context) {

        final int height = layout.getImageHeight();
        final int overlap = (layout.getKernelDimension() - 1) / 2;
        final int[] coverCounts = new int[height];
        final int lastId = layout.size();

        for (final Tile tile : layout.getTiles()) {

            Assert.assertTrue("rowStart out of bounds for " + tile + " with " + context, tile.getRowStart() >= 0);
            Assert.assertTrue("rowEnd out of bounds for " + tile + " with " + context, tile.getRowEnd() <= height);
            Assert.assertTrue("tile height should exceed kernel dimension for " + tile + " with " + context,
                              tile.getHeight() > layout.getKernelDimension());

            final int expectedBottomMargin = tile.getId() == 1 ? 0 : overlap;
            final int expectedTopMargin = tile.getId() == lastId ? 0 : overlap;
            Assert.assertEquals("invalid bottomMargin for " + tile + " with " + context,
                                expectedBottomMargin, tile.getBottomMargin());
            Assert.assertEquals("invalid topMargin for " + tile + " with " + context,
                                expectedTopMargin, tile.getTopMargin());

            for (int row = tile.getInteriorStart(); row < tile.getInteriorEnd(); row++) {
                coverCounts[row]++;
            }
        }

        for (int row = 0; row < height; row++) {
            Assert.assertEquals("row " + row + " covered wrong number of times with " + context,
                                1, coverCounts[row]);
        }
    }

}
