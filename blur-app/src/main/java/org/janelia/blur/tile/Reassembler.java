package org.janelia.blur.tile;

import org.janelia.blur.Canvas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the interior rows of filtered tiles into an output canvas.
 *
 * Placement is driven solely by each tile's absolute row range,
 * so tiles can be placed in any order with an identical result.
 * Instances are not thread safe: the output canvas has exactly one writer.
 */
public class Reassembler {

    private final Canvas output;
    private final boolean[] writtenRows;
    private int writtenRowCount;
    private int placedTileCount;

    public Reassembler(final Canvas output) {
        this.output = output;
        this.writtenRows = new boolean[output.getHeight()];
        this.writtenRowCount = 0;
        this.placedTileCount = 0;
    }

    public Canvas getOutput() {
        return output;
    }

    public int getPlacedTileCount() {
        return placedTileCount;
    }

    /**
     * @return true if every output row has been written.
     */
    public boolean isComplete() {
        return writtenRowCount == writtenRows.length;
    }

    /**
     * Copies the tile's interior rows (margins excluded) to their absolute position
     * in the output canvas and then discards the tile's pixels.
     *
     * @throws IllegalArgumentException
     *   if the tile does not fit the output canvas or its interior rows were already written.
     *
     * @throws IllegalStateException
     *   if the tile has not arrived or was already placed.
     */
    public void place(final Tile tile)
            throws IllegalArgumentException, IllegalStateException {

        if (tile.getState() != TileState.ARRIVED) {
            throw new IllegalStateException(tile + " is " + tile.getState() + " and cannot be placed");
        }
        if ((tile.getWidth() != output.getWidth()) || (tile.getDepth() != output.getDepth())) {
            throw new IllegalArgumentException(tile + " has width " + tile.getWidth() + " and depth " +
                                               tile.getDepth() + " but output canvas is " + output);
        }

        final int interiorStart = tile.getInteriorStart();
        final int interiorEnd = tile.getInteriorEnd();
        if (interiorEnd > output.getHeight()) {
            throw new IllegalArgumentException(tile + " extends beyond output canvas " + output);
        }
        for (int row = interiorStart; row < interiorEnd; row++) {
            if (writtenRows[row]) {
                throw new IllegalArgumentException(tile + " overlaps previously written row " + row);
            }
        }

        output.copyRowsFrom(tile.getPixels(), tile.getBottomMargin(), interiorStart, interiorEnd - interiorStart);

        for (int row = interiorStart; row < interiorEnd; row++) {
            writtenRows[row] = true;
        }
        writtenRowCount += interiorEnd - interiorStart;
        placedTileCount++;

        tile.releasePixels();
        tile.advanceTo(TileState.PLACED);

        LOG.debug("place: wrote rows [{}, {}) from tile {}", interiorStart, interiorEnd, tile.getId());
    }

    private static final Logger LOG = LoggerFactory.getLogger(Reassembler.class);
}
