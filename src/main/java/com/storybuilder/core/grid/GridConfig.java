package com.storybuilder.core.grid;

import com.storybuilder.core.fs.OutputPathResolver;

import java.awt.Color;
import java.util.Optional;

/**
 * Immutable, validated grid settings. Instances are created through {@link Builder}, which clamps
 * numeric fields to their minimums and fills defaults; {@link GridConfigParser} feeds it from JSON.
 *
 * <p>Fixed-tile mode is active only when both {@code tileWidth} and {@code tileHeight} are set.
 * Otherwise the grid uses dynamic-width mode, where the canvas is {@code maxLongestEdge} wide and
 * every tile takes the height its source aspect ratio dictates.
 */
public final class GridConfig {
    public static final int DEFAULT_COLUMNS = 3;
    public static final int DEFAULT_MAX_LONGEST_EDGE = 4096;
    public static final int DEFAULT_PADDING = 32;
    public static final String DEFAULT_BACKGROUND = "#ffffff";
    public static final String DEFAULT_TEXT_COLOR = "#000000";
    public static final String DEFAULT_OUTLINE_COLOR = "#000000";
    public static final String DEFAULT_TILE_PREFIX = "SHOT";
    public static final String DEFAULT_OUTPUT_NAME_PREFIX = "grid_overview";

    private final int columns;
    private final int maxLongestEdge;
    private final int padding;
    private final Color backgroundColor;
    private final Color textColor;
    private final Color tileOutlineColor;
    private final boolean addLabels;
    private final String tilePrefix;
    private final Integer tileWidth;
    private final Integer tileHeight;
    private final FitMode fitMode;
    private final String outputDir;
    private final String outputNamePrefix;
    private final String outputPath;
    private final int tileOutlineWidth;

    private GridConfig(Builder builder) {
        this.columns = Math.max(1, builder.columns);
        this.maxLongestEdge = Math.max(1, builder.maxLongestEdge);
        this.padding = Math.max(0, builder.padding);
        this.backgroundColor = HexColorParser.parse(builder.backgroundColor, Color.WHITE);
        this.textColor = HexColorParser.parse(builder.textColor, Color.BLACK);
        this.tileOutlineColor = HexColorParser.parse(builder.tileOutlineColor, Color.BLACK);
        this.addLabels = builder.addLabels;
        String prefix = builder.tilePrefix == null ? "" : builder.tilePrefix.trim();
        this.tilePrefix = prefix.isEmpty() ? DEFAULT_TILE_PREFIX : prefix;
        this.tileWidth = positiveOrNull(builder.tileWidth);
        this.tileHeight = positiveOrNull(builder.tileHeight);
        this.fitMode = builder.fitMode == null ? FitMode.CONTAIN : builder.fitMode;
        this.outputDir = blankToNull(builder.outputDir);
        this.outputNamePrefix = OutputPathResolver.sanitizeNamePrefix(builder.outputNamePrefix);
        this.outputPath = blankToNull(builder.outputPath);
        this.tileOutlineWidth = Math.max(0, builder.tileOutlineWidth);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GridConfig defaults() {
        return builder().build();
    }

    public int columns() {
        return columns;
    }

    public int maxLongestEdge() {
        return maxLongestEdge;
    }

    public int padding() {
        return padding;
    }

    public Color backgroundColor() {
        return backgroundColor;
    }

    public Color textColor() {
        return textColor;
    }

    public Color tileOutlineColor() {
        return tileOutlineColor;
    }

    public boolean addLabels() {
        return addLabels;
    }

    public String tilePrefix() {
        return tilePrefix;
    }

    public Optional<Integer> tileWidth() {
        return Optional.ofNullable(tileWidth);
    }

    public Optional<Integer> tileHeight() {
        return Optional.ofNullable(tileHeight);
    }

    public boolean isFixedTileMode() {
        return tileWidth != null && tileHeight != null;
    }

    public FitMode fitMode() {
        return fitMode;
    }

    public Optional<String> outputDir() {
        return Optional.ofNullable(outputDir);
    }

    public String outputNamePrefix() {
        return outputNamePrefix;
    }

    public Optional<String> outputPath() {
        return Optional.ofNullable(outputPath);
    }

    public int tileOutlineWidth() {
        return tileOutlineWidth;
    }

    /**
     * Default label for the item at the given zero-based input position.
     */
    public String defaultLabel(int index) {
        return tilePrefix + " " + (index + 1);
    }

    private static Integer positiveOrNull(Integer value) {
        return value != null && value >= 1 ? value : null;
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public static final class Builder {
        private int columns = DEFAULT_COLUMNS;
        private int maxLongestEdge = DEFAULT_MAX_LONGEST_EDGE;
        private int padding = DEFAULT_PADDING;
        private String backgroundColor = DEFAULT_BACKGROUND;
        private String textColor = DEFAULT_TEXT_COLOR;
        private String tileOutlineColor = DEFAULT_OUTLINE_COLOR;
        private boolean addLabels = true;
        private String tilePrefix = DEFAULT_TILE_PREFIX;
        private Integer tileWidth;
        private Integer tileHeight;
        private FitMode fitMode = FitMode.CONTAIN;
        private String outputDir;
        private String outputNamePrefix = DEFAULT_OUTPUT_NAME_PREFIX;
        private String outputPath;
        private int tileOutlineWidth;

        private Builder() {
        }

        public Builder columns(int columns) {
            this.columns = columns;
            return this;
        }

        public Builder maxLongestEdge(int maxLongestEdge) {
            this.maxLongestEdge = maxLongestEdge;
            return this;
        }

        public Builder padding(int padding) {
            this.padding = padding;
            return this;
        }

        public Builder backgroundColor(String backgroundColor) {
            this.backgroundColor = backgroundColor;
            return this;
        }

        public Builder textColor(String textColor) {
            this.textColor = textColor;
            return this;
        }

        public Builder tileOutlineColor(String tileOutlineColor) {
            this.tileOutlineColor = tileOutlineColor;
            return this;
        }

        public Builder addLabels(boolean addLabels) {
            this.addLabels = addLabels;
            return this;
        }

        public Builder tilePrefix(String tilePrefix) {
            this.tilePrefix = tilePrefix;
            return this;
        }

        public Builder tileWidth(Integer tileWidth) {
            this.tileWidth = tileWidth;
            return this;
        }

        public Builder tileHeight(Integer tileHeight) {
            this.tileHeight = tileHeight;
            return this;
        }

        public Builder fitMode(FitMode fitMode) {
            this.fitMode = fitMode;
            return this;
        }

        public Builder outputDir(String outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder outputNamePrefix(String outputNamePrefix) {
            this.outputNamePrefix = outputNamePrefix;
            return this;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder tileOutlineWidth(int tileOutlineWidth) {
            this.tileOutlineWidth = tileOutlineWidth;
            return this;
        }

        public GridConfig build() {
            return new GridConfig(this);
        }
    }
}
