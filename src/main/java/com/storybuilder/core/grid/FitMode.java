package com.storybuilder.core.grid;

/**
 * How a source image is fitted into a fixed-size tile.
 */
public enum FitMode {
    /** Scale to fit inside the tile, letterboxing with transparency. */
    CONTAIN("contain"),
    /** Scale to fill the tile, cropping the overflow around the center. */
    COVER("cover");

    private final String key;

    FitMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static FitMode from(String value) {
        if (value != null && value.trim().equalsIgnoreCase(COVER.key)) {
            return COVER;
        }
        return CONTAIN;
    }
}
