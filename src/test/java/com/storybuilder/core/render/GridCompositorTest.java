package com.storybuilder.core.render;

import com.storybuilder.core.grid.CanvasPlan;
import com.storybuilder.core.model.GridItem;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.List;

import static com.storybuilder.support.TestImages.assertColor;
import static com.storybuilder.support.TestImages.solid;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GridCompositorTest {

    @Test
    void centersShorterTilesWithinTheirRow() {
        Color background = new Color(10, 20, 30);
        List<RenderedTile> tiles = List.of(
            new RenderedTile(new GridItem("a.png", "SHOT 1"), solid(10, 20, Color.RED), false),
            new RenderedTile(new GridItem("b.png", "SHOT 2"), solid(10, 10, Color.BLUE), false),
            new RenderedTile(new GridItem("c.png", "SHOT 3"), solid(10, 6, Color.GREEN), false));
        CanvasPlan plan = new CanvasPlan(35, 5 * 3 + 20 + 6, 10, 2, 5, List.of(20, 6));

        BufferedImage canvas = GridCompositor.composite(tiles, plan, background);

        assertEquals(35, canvas.getWidth());
        assertEquals(41, canvas.getHeight());
        assertColor(background, canvas.getRGB(2, 2), "padding");
        assertColor(Color.RED, canvas.getRGB(5, 5), "first tile top-left");
        assertColor(background, canvas.getRGB(25, 9), "above centered second tile");
        assertColor(Color.BLUE, canvas.getRGB(25, 10), "second tile offset by half the difference");
        assertColor(Color.BLUE, canvas.getRGB(29, 19), "second tile bottom-right");
        assertColor(background, canvas.getRGB(25, 20), "below centered second tile");
        assertColor(Color.GREEN, canvas.getRGB(5, 30), "second row starts after row height and padding");
    }

    @Test
    void transparentTilesLeaveBackgroundVisible() {
        List<RenderedTile> tiles = List.of(
            new RenderedTile(new GridItem("", "SHOT 1"), new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB), true));
        CanvasPlan plan = new CanvasPlan(20, 20, 10, 1, 5, List.of(10));

        BufferedImage canvas = GridCompositor.composite(tiles, plan, Color.WHITE);

        assertColor(Color.WHITE, canvas.getRGB(10, 10), "placeholder area");
    }
}
