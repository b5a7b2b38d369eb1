package com.storybuilder.core.render;

import com.storybuilder.core.fs.OutputPathResolver;
import com.storybuilder.core.grid.CanvasPlan;
import com.storybuilder.core.grid.GridConfig;
import com.storybuilder.core.grid.GridConfigParser;
import com.storybuilder.core.grid.GridItemNormalizer;
import com.storybuilder.core.grid.GridLayout;
import com.storybuilder.core.grid.NaturalOrderComparator;
import com.storybuilder.core.model.GridItem;
import com.storybuilder.logging.AppLogger;
import org.json.JSONObject;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a contact-sheet PNG from a set of images.
 *
 * <p>Pipeline: settings and items are normalized, the layout is planned (rejecting grids too
 * narrow for their padding), every item is rendered into a tile, row heights are finalized, and
 * the tiles are composited and written once. Dynamic-width grids order their items by natural
 * file-name order; fixed-tile grids keep input order.
 */
public final class ImageGridRenderer {
    private static final Logger LOGGER = AppLogger.get();

    private final OutputPathResolver outputResolver;

    public ImageGridRenderer() {
        this(Clock.systemDefaultZone());
    }

    public ImageGridRenderer(Clock clock) {
        this.outputResolver = new OutputPathResolver(clock);
    }

    /**
     * Runs the grid and reports the outcome as a status line. Never throws; output failures,
     * including a canvas the JVM cannot allocate, are logged and reported in the returned text.
     *
     * @param paths    image paths, ignored when {@code settings} carries an {@code items} array
     * @param settings loosely-typed grid settings, may be {@code null}
     */
    public String createImageGrid(List<String> paths, JSONObject settings) {
        try {
            return render(paths, settings).message();
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Failed to save grid image", ex);
            return "Failed to save grid image: " + ex.getMessage();
        } catch (OutOfMemoryError ex) {
            LOGGER.log(Level.SEVERE, "Out of memory while building grid image", ex);
            return "Failed to save grid image: " + ex.getMessage();
        }
    }

    public GridResult render(List<String> paths, JSONObject settings) throws IOException {
        GridConfig config = GridConfigParser.parse(settings);
        List<GridItem> items = GridItemNormalizer.normalize(paths, settings, config);
        return render(items, config);
    }

    public GridResult render(List<GridItem> input, GridConfig config) throws IOException {
        if (input == null || input.isEmpty()) {
            LOGGER.info("Grid request without images");
            return GridResult.rejected(GridResult.Status.NO_IMAGES);
        }

        GridLayout layout = GridLayout.plan(config);
        if (!layout.fitsCanvas()) {
            LOGGER.info("Cell width %d too small for %d columns with padding %d"
                .formatted(layout.cellWidth(), config.columns(), config.padding()));
            return GridResult.rejected(GridResult.Status.LAYOUT_TOO_SMALL);
        }
        if (!layout.fitsPixelLimit()) {
            LOGGER.info("Canvas width %d with cell %dx%d exceeds the pixel limit"
                .formatted(layout.canvasWidth(), layout.placeholderWidth(), layout.placeholderHeight()));
            return GridResult.rejected(GridResult.Status.CANVAS_TOO_LARGE);
        }

        List<GridItem> items = new ArrayList<>(input);
        if (!layout.isFixedTile()) {
            NaturalOrderComparator.sortByBaseName(items);
        }

        TileRenderer renderer = new TileRenderer(config, layout);
        List<RenderedTile> tiles = new ArrayList<>(items.size());
        List<Integer> heights = new ArrayList<>(items.size());
        int loaded = 0;
        for (GridItem item : items) {
            RenderedTile tile = renderer.render(item);
            tiles.add(tile);
            heights.add(tile.height());
            if (!tile.placeholder()) {
                loaded++;
            }
        }
        if (loaded == 0) {
            LOGGER.info("None of the %d image(s) could be opened".formatted(items.size()));
            return GridResult.rejected(GridResult.Status.NO_VALID_IMAGES);
        }

        Optional<CanvasPlan> finished = layout.finish(heights);
        if (finished.isEmpty()) {
            LOGGER.info("Canvas for %d tile(s) exceeds the pixel limit".formatted(tiles.size()));
            return GridResult.rejected(GridResult.Status.CANVAS_TOO_LARGE);
        }
        CanvasPlan plan = finished.get();
        BufferedImage canvas = GridCompositor.composite(tiles, plan, config.backgroundColor());

        Path output = outputResolver.resolve(config, items);
        if (!ImageIO.write(canvas, "png", output.toFile())) {
            throw new IOException("No PNG writer available");
        }
        LOGGER.info("Grid image %dx%d with %d tile(s) written to %s"
            .formatted(plan.width(), plan.height(), tiles.size(), output));
        return GridResult.saved(output);
    }
}
