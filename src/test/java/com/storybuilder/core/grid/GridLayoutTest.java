package com.storybuilder.core.grid;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridLayoutTest {

    @Test
    void dynamicCellWidthSplitsCanvasAfterPadding() {
        GridConfig config = GridConfig.builder().columns(3).maxLongestEdge(900).padding(30).build();

        GridLayout layout = GridLayout.plan(config);

        assertEquals(GridLayout.Mode.DYNAMIC_WIDTH, layout.mode());
        assertEquals(260, layout.cellWidth());
        assertEquals(900L, layout.canvasWidth());
        assertTrue(layout.fitsCanvas());
        assertEquals(260, layout.placeholderHeight());
    }

    @Test
    void fixedTileGeometry() {
        GridConfig config = GridConfig.builder()
            .tileWidth(200).tileHeight(150).columns(2).padding(10)
            .build();

        GridLayout layout = GridLayout.plan(config);
        CanvasPlan plan = layout.finish(List.of(150, 150, 150)).orElseThrow();

        assertEquals(GridLayout.Mode.FIXED_TILE, layout.mode());
        assertEquals(2, layout.rowCount(3));
        assertEquals(430, plan.width());
        assertEquals(330, plan.height());
        assertEquals(List.of(150, 150), plan.rowHeights());
        assertEquals(150, layout.placeholderHeight());
    }

    @Test
    void rejectsCanvasTooNarrowForPadding() {
        GridConfig config = GridConfig.builder().columns(5).maxLongestEdge(10).padding(32).build();

        assertFalse(GridLayout.plan(config).fitsCanvas());
    }

    @Test
    void cellWidthBoundary() {
        GridLayout one = GridLayout.plan(GridConfig.builder().columns(2).maxLongestEdge(32).padding(10).build());
        GridLayout zero = GridLayout.plan(GridConfig.builder().columns(2).maxLongestEdge(31).padding(10).build());

        assertEquals(1, one.cellWidth());
        assertTrue(one.fitsCanvas());
        assertEquals(0, zero.cellWidth());
        assertFalse(zero.fitsCanvas());
    }

    @Test
    void hugePaddingLeavesNoCellInsteadOfWrapping() {
        GridConfig config = GridConfig.builder().columns(3).maxLongestEdge(4096).padding(2_000_000_000).build();

        GridLayout layout = GridLayout.plan(config);

        assertFalse(layout.fitsCanvas());
        assertTrue(layout.cellWidth() < 1, "cell width " + layout.cellWidth());
    }

    @Test
    void fixedTileCanvasWiderThanIntIsOverLimit() {
        GridConfig config = GridConfig.builder()
            .tileWidth(10).tileHeight(10).columns(3).padding(1_000_000_000)
            .build();

        GridLayout layout = GridLayout.plan(config);

        assertEquals(4_000_000_030L, layout.canvasWidth());
        assertTrue(layout.fitsCanvas());
        assertFalse(layout.fitsPixelLimit());
    }

    @Test
    void finishRejectsCanvasTallerThanRasterLimit() {
        GridLayout layout = GridLayout.plan(GridConfig.builder().columns(1).maxLongestEdge(100).padding(0).build());
        List<Integer> tall = Collections.nCopies(30, 1_000_000);

        assertTrue(layout.fitsPixelLimit());
        assertTrue(layout.finish(tall).isEmpty());
        assertTrue(layout.finish(List.of(1_000_000)).isPresent());
    }

    @Test
    void allocatableGuardsPixelCount() {
        assertTrue(GridLayout.allocatable(46_340, 46_340));
        assertFalse(GridLayout.allocatable(46_341, 46_341));
        assertFalse(GridLayout.allocatable(0, 10));
        assertFalse(GridLayout.allocatable(Integer.MAX_VALUE, 2));
    }

    @Test
    void dynamicRowsTakeTallestTile() {
        GridConfig config = GridConfig.builder().columns(2).maxLongestEdge(230).padding(10).build();
        GridLayout layout = GridLayout.plan(config);

        CanvasPlan plan = layout.finish(List.of(40, 90, 60)).orElseThrow();

        assertEquals(100, plan.cellWidth());
        assertEquals(List.of(90, 60), plan.rowHeights());
        assertEquals(10 * 3 + 90 + 60, plan.height());
        assertEquals(1, plan.rowOf(2));
    }

    @Test
    void scaledHeightFollowsAspectRatio() {
        GridLayout layout = GridLayout.plan(GridConfig.builder().columns(1).maxLongestEdge(100).padding(0).build());

        assertEquals(50, layout.scaledHeight(200, 100));
        assertEquals(33, layout.scaledHeight(300, 100));
        assertEquals(1, layout.scaledHeight(10000, 1));
    }
}
