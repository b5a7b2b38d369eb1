package com.storybuilder.core.render;

import com.storybuilder.core.model.GridItem;

import java.awt.image.BufferedImage;

/**
 * A tile ready for compositing, tied to the item it was rendered from.
 */
public record RenderedTile(GridItem item, BufferedImage image, boolean placeholder) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
