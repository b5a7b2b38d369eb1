package com.storybuilder.core.grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Grid geometry in two passes. {@link #plan(GridConfig)} fixes the cell width before any image is
 * opened; {@link #finish(List)} computes row heights and the canvas height once every tile exists.
 *
 * <p>Fixed-tile mode: cells are {@code tileWidth x tileHeight}, rows share {@code tileHeight} and
 * the canvas width follows from the column count. Dynamic-width mode: the canvas is
 * {@code maxLongestEdge} wide, the cell width is what remains after padding, and each row is as
 * tall as its tallest tile.
 *
 * <p>Sizes are computed in {@code long}. A canvas or tile whose pixel count exceeds
 * {@link #MAX_IMAGE_PIXELS} cannot back a {@code BufferedImage} and is reported, not allocated.
 */
public final class GridLayout {

    public enum Mode {
        FIXED_TILE,
        DYNAMIC_WIDTH
    }

    /** Largest pixel count an {@code int}-backed raster can hold. */
    public static final long MAX_IMAGE_PIXELS = Integer.MAX_VALUE - 8L;

    private final Mode mode;
    private final int columns;
    private final int padding;
    private final long cellWidth;
    private final int tileHeight;
    private final long canvasWidth;

    private GridLayout(Mode mode, int columns, int padding, long cellWidth, int tileHeight, long canvasWidth) {
        this.mode = mode;
        this.columns = columns;
        this.padding = padding;
        this.cellWidth = cellWidth;
        this.tileHeight = tileHeight;
        this.canvasWidth = canvasWidth;
    }

    public static GridLayout plan(GridConfig config) {
        int columns = config.columns();
        int padding = config.padding();
        if (config.isFixedTileMode()) {
            int tileWidth = config.tileWidth().orElseThrow();
            int tileHeight = config.tileHeight().orElseThrow();
            long width = padding + (long) columns * ((long) tileWidth + padding);
            return new GridLayout(Mode.FIXED_TILE, columns, padding, tileWidth, tileHeight, width);
        }
        long width = config.maxLongestEdge();
        long cellWidth = Math.floorDiv(width - ((long) columns + 1) * padding, columns);
        return new GridLayout(Mode.DYNAMIC_WIDTH, columns, padding, cellWidth, 0, width);
    }

    /**
     * @return true when a {@code width x height} image fits in a single raster
     */
    public static boolean allocatable(long width, long height) {
        return width >= 1 && height >= 1 && width <= MAX_IMAGE_PIXELS / height;
    }

    public Mode mode() {
        return mode;
    }

    public boolean isFixedTile() {
        return mode == Mode.FIXED_TILE;
    }

    /**
     * @return false when padding and columns leave no room for a one-pixel cell
     */
    public boolean fitsCanvas() {
        return cellWidth >= 1;
    }

    /**
     * Checks the sizes known before any image is opened: a placeholder tile and a one-row canvas.
     * Row heights can still push the final canvas past the limit; {@link #finish(List)} reports that.
     */
    public boolean fitsPixelLimit() {
        return allocatable(placeholderWidth(), placeholderHeight())
            && allocatable(canvasWidth, 2L * padding + placeholderHeight());
    }

    public int columns() {
        return columns;
    }

    public int padding() {
        return padding;
    }

    /**
     * Cell width, saturated to the {@code int} range; only meaningful when {@link #fitsCanvas()} holds.
     */
    public int cellWidth() {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, cellWidth));
    }

    /**
     * Tile height in fixed-tile mode; 0 in dynamic mode where heights vary per tile.
     */
    public int tileHeight() {
        return tileHeight;
    }

    public long canvasWidth() {
        return canvasWidth;
    }

    public int rowCount(int itemCount) {
        return (int) ((itemCount + (long) columns - 1) / columns);
    }

    /**
     * Size of the transparent stand-in for an image that could not be loaded.
     */
    public int placeholderWidth() {
        return cellWidth();
    }

    public int placeholderHeight() {
        return isFixedTile() ? tileHeight : cellWidth();
    }

    /**
     * Height a source of the given size takes once scaled to the cell width.
     */
    public int scaledHeight(int sourceWidth, int sourceHeight) {
        if (isFixedTile()) {
            return tileHeight;
        }
        double ratio = (double) sourceWidth / sourceHeight;
        return Math.max(1, (int) (cellWidth() / ratio));
    }

    /**
     * Second pass: row heights and canvas height from the rendered tile heights, in grid order.
     *
     * @return the canvas plan, or empty when the finished canvas would exceed {@link #MAX_IMAGE_PIXELS}
     */
    public Optional<CanvasPlan> finish(List<Integer> tileHeights) {
        List<Integer> rowHeights = new ArrayList<>();
        int rows = rowCount(tileHeights.size());
        for (int row = 0; row < rows; row++) {
            if (isFixedTile()) {
                rowHeights.add(tileHeight);
                continue;
            }
            int from = row * columns;
            int to = Math.min(from + columns, tileHeights.size());
            int max = 0;
            for (int i = from; i < to; i++) {
                max = Math.max(max, tileHeights.get(i));
            }
            rowHeights.add(max);
        }
        long height = (long) padding * (rows + 1);
        for (int rowHeight : rowHeights) {
            height += rowHeight;
        }
        if (!allocatable(canvasWidth, height)) {
            return Optional.empty();
        }
        return Optional.of(new CanvasPlan((int) canvasWidth, (int) height, cellWidth(), columns, padding, rowHeights));
    }
}
