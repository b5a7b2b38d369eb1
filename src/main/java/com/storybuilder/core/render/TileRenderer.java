package com.storybuilder.core.render;

import com.storybuilder.core.grid.FitMode;
import com.storybuilder.core.grid.GridConfig;
import com.storybuilder.core.grid.GridLayout;
import com.storybuilder.core.model.GridItem;
import com.storybuilder.logging.AppLogger;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads one item's source image and turns it into a tile: fitted to the cell, then labeled and
 * outlined. Every tile gets its own image and graphics context; nothing is shared between items.
 * A failure for one item never escapes {@link #render(GridItem)}: it becomes a transparent
 * placeholder and the reason goes to the log.
 */
public final class TileRenderer {
    private static final Logger LOGGER = AppLogger.get();

    private final GridConfig config;
    private final GridLayout layout;

    public TileRenderer(GridConfig config, GridLayout layout) {
        this.config = config;
        this.layout = layout;
    }

    public RenderedTile render(GridItem item) {
        TileResult result = renderContent(item);
        if (!result.isSuccess()) {
            LOGGER.warning("Failed to open image %s: %s".formatted(describe(item), result.failureReason()));
        }
        BufferedImage image = result.orPlaceholder(layout.placeholderWidth(), layout.placeholderHeight());
        return new RenderedTile(item, image, !result.isSuccess());
    }

    TileResult renderContent(GridItem item) {
        if (!item.hasPath()) {
            return TileResult.failure("empty path");
        }
        BufferedImage source;
        try {
            Path path = Path.of(item.path());
            if (!Files.isRegularFile(path)) {
                return TileResult.failure("file not found");
            }
            source = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException ex) {
            return TileResult.failure(ex.getMessage());
        }
        if (source == null) {
            return TileResult.failure("unsupported or corrupt image data");
        }
        try {
            BufferedImage tile = fit(source);
            decorate(tile, item);
            return TileResult.success(tile);
        } catch (RuntimeException ex) {
            return TileResult.failure(ex.toString());
        }
    }

    BufferedImage fit(BufferedImage source) {
        if (!layout.isFixedTile()) {
            int width = layout.cellWidth();
            int height = layout.scaledHeight(source.getWidth(), source.getHeight());
            if (!GridLayout.allocatable(width, height)) {
                throw new IllegalArgumentException("scaled tile %dx%d exceeds the maximum image size".formatted(width, height));
            }
            return scaleOnto(source, width, height, 0, 0, width, height);
        }
        int tileWidth = layout.cellWidth();
        int tileHeight = layout.tileHeight();
        double scaleX = (double) tileWidth / source.getWidth();
        double scaleY = (double) tileHeight / source.getHeight();
        if (config.fitMode() == FitMode.COVER) {
            double scale = Math.max(scaleX, scaleY);
            int width = Math.max(tileWidth, (int) Math.round(source.getWidth() * scale));
            int height = Math.max(tileHeight, (int) Math.round(source.getHeight() * scale));
            return scaleOnto(source, tileWidth, tileHeight,
                -(width - tileWidth) / 2, -(height - tileHeight) / 2, width, height);
        }
        double scale = Math.min(scaleX, scaleY);
        int width = clamp((int) Math.round(source.getWidth() * scale), tileWidth);
        int height = clamp((int) Math.round(source.getHeight() * scale), tileHeight);
        return scaleOnto(source, tileWidth, tileHeight,
            (tileWidth - width) / 2, (tileHeight - height) / 2, width, height);
    }

    private void decorate(BufferedImage tile, GridItem item) {
        if (!config.addLabels() && config.tileOutlineWidth() <= 0) {
            return;
        }
        Graphics2D g2d = tile.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            if (config.addLabels()) {
                TileOverlayRenderer.drawLabel(g2d, tile.getWidth(), tile.getHeight(),
                    item.label(), config.textColor(), layout.isFixedTile());
            }
            TileOverlayRenderer.drawOutline(g2d, tile.getWidth(), tile.getHeight(),
                config.tileOutlineWidth(), config.tileOutlineColor());
        } finally {
            g2d.dispose();
        }
    }

    private static BufferedImage scaleOnto(BufferedImage source,
                                           int tileWidth,
                                           int tileHeight,
                                           int x,
                                           int y,
                                           int width,
                                           int height) {
        BufferedImage tile = new BufferedImage(tileWidth, tileHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = tile.createGraphics();
        try {
            setupHighQualityRendering(g2d);
            g2d.drawImage(source, x, y, width, height, null);
        } finally {
            g2d.dispose();
        }
        return tile;
    }

    private static void setupHighQualityRendering(Graphics2D g2d) {
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
    }

    private static int clamp(int value, int max) {
        return Math.max(1, Math.min(value, max));
    }

    private static String describe(GridItem item) {
        return item.hasPath() ? item.path() : "(" + item.label() + ")";
    }
}
