package com.storybuilder.core.model;

/**
 * One input image of a grid: its source path (possibly empty) and the label drawn on its tile.
 * The label carries the item's one-based input position, so it survives later reordering.
 */
public record GridItem(String path, String label) {

    public GridItem {
        path = path == null ? "" : path;
        label = label == null ? "" : label;
    }

    public boolean hasPath() {
        return !path.isBlank();
    }
}
