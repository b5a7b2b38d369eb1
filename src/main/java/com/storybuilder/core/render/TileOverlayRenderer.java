package com.storybuilder.core.render;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;

/**
 * Draws the label and outline overlays onto a tile.
 */
final class TileOverlayRenderer {
    static final Color LABEL_BACKDROP = new Color(0, 0, 0, 80);
    static final int BACKDROP_PAD_X = 4;
    static final int BACKDROP_PAD_Y = 2;

    private TileOverlayRenderer() {
    }

    static int labelFontSize(int tileWidth, int tileHeight) {
        return Math.max(12, (int) Math.round(0.06 * Math.min(tileWidth, tileHeight)));
    }

    static int labelMargin(int fontSize) {
        return Math.max(6, (int) Math.round(0.3 * fontSize));
    }

    /**
     * Draws {@code label} anchored bottom-left. The translucent backdrop is only drawn when
     * {@code withBackdrop} is set; dynamic-width grids keep their plain text labels.
     */
    static void drawLabel(Graphics2D g2d,
                          int tileWidth,
                          int tileHeight,
                          String label,
                          Color textColor,
                          boolean withBackdrop) {
        if (label == null || label.isEmpty()) {
            return;
        }
        int fontSize = labelFontSize(tileWidth, tileHeight);
        Font font = FontRegistry.labelFont(fontSize);
        g2d.setFont(font);
        FontMetrics fm = g2d.getFontMetrics();
        int textWidth = fm.stringWidth(label);
        int textHeight = fm.getAscent() + fm.getDescent();
        int margin = labelMargin(fontSize);
        int x = margin;
        int top = Math.max(0, tileHeight - textHeight - margin);

        Color previous = g2d.getColor();
        if (withBackdrop) {
            g2d.setColor(LABEL_BACKDROP);
            g2d.fillRect(x - BACKDROP_PAD_X,
                top - BACKDROP_PAD_Y,
                textWidth + 2 * BACKDROP_PAD_X,
                textHeight + 2 * BACKDROP_PAD_Y);
        }
        g2d.setColor(textColor);
        g2d.drawString(label, x, top + fm.getAscent());
        g2d.setColor(previous);
    }

    /**
     * Draws a border {@code strokeWidth} pixels thick, inset by half the stroke from every edge.
     */
    static void drawOutline(Graphics2D g2d, int tileWidth, int tileHeight, int strokeWidth, Color color) {
        if (strokeWidth <= 0) {
            return;
        }
        int inset = strokeWidth / 2;
        int left = inset;
        int top = inset;
        int boxWidth = tileWidth - 2 * inset;
        int boxHeight = tileHeight - 2 * inset;
        if (boxWidth <= 0 || boxHeight <= 0) {
            return;
        }
        int horizontal = Math.min(strokeWidth, boxHeight);
        int vertical = Math.min(strokeWidth, boxWidth);

        Color previous = g2d.getColor();
        g2d.setColor(color);
        g2d.fillRect(left, top, boxWidth, horizontal);
        g2d.fillRect(left, top + boxHeight - horizontal, boxWidth, horizontal);
        g2d.fillRect(left, top, vertical, boxHeight);
        g2d.fillRect(left + boxWidth - vertical, top, vertical, boxHeight);
        g2d.setColor(previous);
    }
}
