package org.janelia.blur.tile;

/**
 * Lifecycle of a tile within one run.  Tiles only ever move forward through these states.
 */
public enum TileState {

    /** Geometry computed and source pixels copied. */
    CREATED,

    /** Metadata and pixels sent to the tile's worker. */
    DISPATCHED,

    /** Filtered pixels received back from the worker. */
    ARRIVED,

    /** Interior rows written to the output canvas (terminal). */
    PLACED;

    public boolean canAdvanceTo(final TileState next) {
        return next.ordinal() == this.ordinal() + 1;
    }
}
