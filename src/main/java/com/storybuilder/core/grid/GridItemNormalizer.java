package com.storybuilder.core.grid;

import com.storybuilder.core.model.GridItem;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns either a plain path list or the structured {@code items} array of the settings into an
 * ordered list of {@link GridItem}s. The structured list wins when present. No filesystem access.
 */
public final class GridItemNormalizer {
    public static final String ITEMS_KEY = "items";

    private GridItemNormalizer() {
    }

    public static List<GridItem> normalize(List<String> paths, JSONObject settings, GridConfig config) {
        JSONArray structured = settings == null ? null : settings.optJSONArray(ITEMS_KEY);
        if (structured != null) {
            return fromRecords(structured, config);
        }
        return fromPaths(paths, config);
    }

    public static List<GridItem> fromPaths(List<String> paths, GridConfig config) {
        List<GridItem> items = new ArrayList<>();
        if (paths == null) {
            return items;
        }
        for (int i = 0; i < paths.size(); i++) {
            String path = paths.get(i);
            items.add(new GridItem(path == null ? "" : path, config.defaultLabel(i)));
        }
        return List.copyOf(items);
    }

    public static List<GridItem> fromRecords(JSONArray records, GridConfig config) {
        List<GridItem> items = new ArrayList<>();
        for (int i = 0; i < records.length(); i++) {
            Object entry = records.opt(i);
            String path;
            String label = null;
            if (entry instanceof JSONObject record) {
                path = stringValue(record.opt("path"));
                label = stringValue(record.opt("label"));
            } else {
                path = stringValue(entry);
            }
            if (label == null || label.isBlank()) {
                label = config.defaultLabel(i);
            }
            items.add(new GridItem(path, label));
        }
        return List.copyOf(items);
    }

    private static String stringValue(Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            return "";
        }
        return String.valueOf(value);
    }
}
