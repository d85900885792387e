/*
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.blur.tile;

import java.util.ArrayList;
import java.util.List;

import org.janelia.blur.Canvas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an image into overlapping horizontal bands, one per worker.
 */
public class TilePartitioner {

    private TilePartitioner() {}

    /**
     * Create the {@link TileLayout} for an image without copying any pixels.
     *
     * Each tile covers {@code floor(height / tileCount) - 1} interior rows
     * and requests {@code (kernelDimension - 1) / 2} extra rows on every side
     * it shares with a neighbor.  The last tile absorbs all remaining rows
     * so that the interior ranges exactly cover {@code [0, height)}.
     *
     * @throws IllegalArgumentException
     *   if the segment height is not larger than the kernel dimension
     *   (too many workers or too large a blur radius for the image).
     */
    public static TileLayout buildLayout(final int width,
                                         final int height,
                                         final int depth,
                                         final int tileCount,
                                         final int kernelDimension)
            throws IllegalArgumentException {

        if (tileCount < 1) {
            throw new IllegalArgumentException("tile count must be positive");
        }
        if ((kernelDimension < 1) || (kernelDimension % 2 == 0)) {
            throw new IllegalArgumentException("kernel dimension " + kernelDimension + " must be positive and odd");
        }

        final int segmentHeight = (height / tileCount) - 1;
        if (segmentHeight <= kernelDimension) {
            throw new IllegalArgumentException(
                    "segment height " + segmentHeight + " for " + tileCount + " tiles of a " + height +
                    " row image must be larger than the kernel dimension " + kernelDimension);
        }

        final int overlap = (kernelDimension - 1) / 2;
        final int lastIndex = tileCount - 1;

        final List<Tile> tiles = new ArrayList<>(tileCount);
        for (int i = 0; i < tileCount; i++) {

            final int bottomMargin = i == 0 ? 0 : overlap;
            final int rowStart = (segmentHeight * i) - bottomMargin;

            final int topMargin;
            final int rowEnd;
            if (i < lastIndex) {
                topMargin = overlap;
                rowEnd = (segmentHeight * (i + 1)) + topMargin;
            } else {
                // remainder rows always go to the last tile
                topMargin = 0;
                rowEnd = height;
            }

            tiles.add(new Tile(i + 1, rowStart, rowEnd, bottomMargin, topMargin, width, depth));
        }

        final TileLayout layout =
                new TileLayout(width, height, depth, kernelDimension, overlap, segmentHeight, tiles);

        LOG.debug("buildLayout: {} tiles with segmentHeight {}, overlap {}, maxTileSize {}",
                  tileCount, segmentHeight, overlap, layout.getMaxTileSize());

        return layout;
    }

    /**
     * Create the {@link TileLayout} for a source canvas and copy each tile's rows
     * (margins included) into a freshly allocated buffer.  The source is never modified.
     *
     * @throws IllegalArgumentException
     *   if the source cannot be split into the requested number of tiles.
     */
    public static TileLayout partition(final Canvas source,
                                       final int tileCount,
                                       final int kernelDimension)
            throws IllegalArgumentException {

        final TileLayout layout = buildLayout(source.getWidth(),
                                              source.getHeight(),
                                              source.getDepth(),
                                              tileCount,
                                              kernelDimension);

        final int rowBytes = source.getRowBytes();
        for (final Tile tile : layout.getTiles()) {
            final byte[] pixels = new byte[tile.getSizeBytes()];
            System.arraycopy(source.getData(), tile.getRowStart() * rowBytes, pixels, 0, pixels.length);
            tile.setPixels(pixels);
        }

        LOG.info("partition: split {} into {}", source, layout.getTiles());

        return layout;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TilePartitioner.class);
}
