package com.storybuilder.core.render;

import java.nio.file.Path;

/**
 * Outcome of one grid run. {@code outputPath} is set only when the image was written.
 */
public record GridResult(Status status, Path outputPath) {

    public enum Status {
        SAVED,
        NO_IMAGES,
        NO_VALID_IMAGES,
        LAYOUT_TOO_SMALL,
        CANVAS_TOO_LARGE
    }

    public static GridResult saved(Path outputPath) {
        return new GridResult(Status.SAVED, outputPath);
    }

    public static GridResult rejected(Status status) {
        return new GridResult(status, null);
    }

    public boolean isSaved() {
        return status == Status.SAVED;
    }

    /**
     * Human-readable status line returned to callers.
     */
    public String message() {
        return switch (status) {
            case SAVED -> "Grid image saved to: " + outputPath;
            case NO_IMAGES -> "No images provided.";
            case NO_VALID_IMAGES -> "No valid images to process.";
            case LAYOUT_TOO_SMALL -> "Grid settings too small for the selected padding/columns.";
            case CANVAS_TOO_LARGE -> "Grid settings too large: the canvas exceeds the maximum image size.";
        };
    }
}
