package com.storybuilder.core.grid;

import com.storybuilder.core.model.GridItem;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridItemNormalizerTest {

    @Test
    void plainPathsGetNumberedLabels() {
        List<GridItem> items = GridItemNormalizer.normalize(
            Arrays.asList("a.png", null, "c.png"), null, GridConfig.defaults());

        assertEquals(List.of(
            new GridItem("a.png", "SHOT 1"),
            new GridItem("", "SHOT 2"),
            new GridItem("c.png", "SHOT 3")), items);
    }

    @Test
    void structuredItemsOverridePaths() {
        JSONObject settings = new JSONObject("""
            {"tilePrefix": "PANEL",
             "items": [
               {"path": "one.png", "label": "Opening"},
               {"path": "two.png", "label": "   "},
               {"path": 3},
               "four.png"
             ]}
            """);
        GridConfig config = GridConfigParser.parse(settings);

        List<GridItem> items = GridItemNormalizer.normalize(List.of("ignored.png"), settings, config);

        assertEquals(List.of(
            new GridItem("one.png", "Opening"),
            new GridItem("two.png", "PANEL 2"),
            new GridItem("3", "PANEL 3"),
            new GridItem("four.png", "PANEL 4")), items);
    }

    @Test
    void emptyInputsYieldNoItems() {
        assertTrue(GridItemNormalizer.normalize(null, null, GridConfig.defaults()).isEmpty());
        assertTrue(GridItemNormalizer.normalize(List.of(), new JSONObject("{\"items\":[]}"), GridConfig.defaults()).isEmpty());
    }
}
