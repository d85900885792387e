package org.janelia.blur.tile;

import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.blur.json.JsonUtils;

/**
 * Canonical list of tiles for one run, indexed by {@code id - 1}.
 */
public class TileLayout implements Serializable {

    private final int imageWidth;
    private final int imageHeight;
    private final int depth;
    private final int kernelDimension;
    private final int overlap;
    private final int segmentHeight;
    private final List<Tile> tiles;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TileLayout() {
        this(0, 0, 0, 0, 0, 0, new ArrayList<>());
    }

    public TileLayout(final int imageWidth,
                      final int imageHeight,
                      final int depth,
                      final int kernelDimension,
                      final int overlap,
                      final int segmentHeight,
                      final List<Tile> tiles) {
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.depth = depth;
        this.kernelDimension = kernelDimension;
        this.overlap = overlap;
        this.segmentHeight = segmentHeight;
        this.tiles = new ArrayList<>(tiles);
    }

    public int getImageWidth() {
        return imageWidth;
    }

    public int getImageHeight() {
        return imageHeight;
    }

    public int getDepth() {
        return depth;
    }

    public int getKernelDimension() {
        return kernelDimension;
    }

    public int getOverlap() {
        return overlap;
    }

    public int getSegmentHeight() {
        return segmentHeight;
    }

    public int size() {
        return tiles.size();
    }

    public List<Tile> getTiles() {
        return Collections.unmodifiableList(tiles);
    }

    /**
     * @throws IllegalArgumentException
     *   if no tile with the specified id exists.
     */
    public Tile getTile(final int id)
            throws IllegalArgumentException {
        if ((id < 1) || (id > tiles.size())) {
            throw new IllegalArgumentException("tile id " + id + " is outside of range [1, " + tiles.size() + "]");
        }
        return tiles.get(id - 1);
    }

    /**
     * @return size in bytes of the largest tile (used to size shared receive buffers).
     */
    public int getMaxTileSize() {
        int maxTileSize = 0;
        for (final Tile tile : tiles) {
            maxTileSize = Math.max(maxTileSize, tile.getSizeBytes());
        }
        return maxTileSize;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static TileLayout fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<TileLayout> JSON_HELPER =
            new JsonUtils.Helper<>(TileLayout.class);
}
