package com.storybuilder.core.render;

import com.storybuilder.core.grid.CanvasPlan;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Pastes finished tiles onto the background-filled canvas, row by row, centering each tile
 * vertically within its row.
 */
public final class GridCompositor {

    private GridCompositor() {
    }

    public static BufferedImage composite(List<RenderedTile> tiles, CanvasPlan plan, Color background) {
        BufferedImage canvas = new BufferedImage(plan.width(), plan.height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = canvas.createGraphics();
        try {
            g2d.setComposite(AlphaComposite.Src);
            g2d.setColor(background);
            g2d.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());
            g2d.setComposite(AlphaComposite.SrcOver);

            int x = plan.padding();
            int y = plan.padding();
            for (int i = 0; i < tiles.size(); i++) {
                RenderedTile tile = tiles.get(i);
                int rowHeight = plan.rowHeight(plan.rowOf(i));
                int offset = (rowHeight - tile.height()) / 2;
                g2d.drawImage(tile.image(), x, y + offset, null);
                x += plan.cellWidth() + plan.padding();

                boolean rowComplete = (i + 1) % plan.columns() == 0 || i == tiles.size() - 1;
                if (rowComplete) {
                    x = plan.padding();
                    y += rowHeight + plan.padding();
                }
            }
        } finally {
            g2d.dispose();
        }
        return canvas;
    }
}
