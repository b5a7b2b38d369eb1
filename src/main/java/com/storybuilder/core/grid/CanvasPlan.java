package com.storybuilder.core.grid;

import java.util.List;

/**
 * Final canvas geometry: overall size plus the height of every row. Tiles are assigned to rows
 * strictly by position, {@code columns} per row.
 */
public record CanvasPlan(int width,
                         int height,
                         int cellWidth,
                         int columns,
                         int padding,
                         List<Integer> rowHeights) {

    public CanvasPlan {
        rowHeights = List.copyOf(rowHeights);
    }

    public int rowOf(int tileIndex) {
        return tileIndex / columns;
    }

    public int rowHeight(int row) {
        return rowHeights.get(row);
    }
}
