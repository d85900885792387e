package org.janelia.blur.tile;

import java.io.Serializable;

import org.janelia.blur.Canvas;

/**
 * Horizontal band of an image, including the overlap margins needed to
 * filter its interior rows with full neighborhood context.
 *
 * Row ranges are absolute source image rows with an exclusive end.
 * The {@link #getId() id} is also the rank of the worker that filters the tile.
 */
public class Tile implements Serializable {

    private final int id;
    private final int rowStart;
    private final int rowEnd;
    private final int bottomMargin;
    private final int topMargin;
    private final int width;
    private final int depth;
    private final int sizeBytes;
    private TileState state;

    private transient byte[] pixels;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private Tile() {
        this.id = 0;
        this.rowStart = 0;
        this.rowEnd = 0;
        this.bottomMargin = 0;
        this.topMargin = 0;
        this.width = 0;
        this.depth = 0;
        this.sizeBytes = 0;
    }

    public Tile(final int id,
                final int rowStart,
                final int rowEnd,
                final int bottomMargin,
                final int topMargin,
                final int width,
                final int depth)
            throws IllegalArgumentException {

        if (id < 1) {
            throw new IllegalArgumentException("tile id must be positive");
        }
        if ((rowStart < 0) || (rowEnd <= rowStart)) {
            throw new IllegalArgumentException("tile " + id + " has invalid row range [" + rowStart + ", " +
                                               rowEnd + ")");
        }
        if ((bottomMargin < 0) || (topMargin < 0) || (bottomMargin + topMargin >= rowEnd - rowStart)) {
            throw new IllegalArgumentException("tile " + id + " margins (" + bottomMargin + ", " + topMargin +
                                               ") leave no interior rows in [" + rowStart + ", " + rowEnd + ")");
        }

        this.id = id;
        this.rowStart = rowStart;
        this.rowEnd = rowEnd;
        this.bottomMargin = bottomMargin;
        this.topMargin = topMargin;
        this.width = width;
        this.depth = depth;
        this.sizeBytes = Canvas.rowBytes(width, depth) * (rowEnd - rowStart);
        this.state = TileState.CREATED;
        this.pixels = null;
    }

    public int getId() {
        return id;
    }

    public int getRowStart() {
        return rowStart;
    }

    public int getRowEnd() {
        return rowEnd;
    }

    public int getBottomMargin() {
        return bottomMargin;
    }

    public int getTopMargin() {
        return topMargin;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return rowEnd - rowStart;
    }

    public int getDepth() {
        return depth;
    }

    public int getSizeBytes() {
        return sizeBytes;
    }

    /**
     * @return first absolute row this tile is authoritative for.
     */
    public int getInteriorStart() {
        return rowStart + bottomMargin;
    }

    /**
     * @return absolute row just past the last row this tile is authoritative for.
     */
    public int getInteriorEnd() {
        return rowEnd - topMargin;
    }

    public TileState getState() {
        return state;
    }

    /**
     * @return pixels currently held for this tile or null if they have been handed off.
     */
    public byte[] getPixels() {
        return pixels;
    }

    /**
     * Replaces this tile's pixel buffer.  The buffer may be larger than {@link #getSizeBytes()}.
     *
     * @throws IllegalArgumentException
     *   if the buffer is too small.
     */
    public void setPixels(final byte[] pixels)
            throws IllegalArgumentException {
        if ((pixels != null) && (pixels.length < sizeBytes)) {
            throw new IllegalArgumentException("tile " + id + " needs " + sizeBytes + " bytes but buffer only has " +
                                               pixels.length);
        }
        this.pixels = pixels;
    }

    public void releasePixels() {
        this.pixels = null;
    }

    /**
     * @throws IllegalStateException
     *   if the tile is not in the state immediately preceding the specified state.
     */
    public void advanceTo(final TileState next)
            throws IllegalStateException {
        if (! state.canAdvanceTo(next)) {
            throw new IllegalStateException("tile " + id + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    @Override
    public String toString() {
        return "tile " + id + " [" + rowStart + ", " + rowEnd + ") margins (" + bottomMargin + ", " + topMargin + ")";
    }

}
