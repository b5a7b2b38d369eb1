package com.storybuilder.core.render;

import java.awt.image.BufferedImage;

/**
 * Outcome of rendering one item: either the finished tile image or the reason it could not be made.
 */
public record TileResult(BufferedImage image, String failureReason) {

    public static TileResult success(BufferedImage image) {
        return new TileResult(image, null);
    }

    public static TileResult failure(String reason) {
        return new TileResult(null, reason == null || reason.isBlank() ? "unknown error" : reason);
    }

    public boolean isSuccess() {
        return image != null;
    }

    /**
     * The tile image, or a fully transparent image of the given size when rendering failed.
     */
    public BufferedImage orPlaceholder(int width, int height) {
        if (image != null) {
            return image;
        }
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    }
}
