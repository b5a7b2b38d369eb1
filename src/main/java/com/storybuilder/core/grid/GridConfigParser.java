package com.storybuilder.core.grid;

import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Resolves a loosely-typed settings object into a {@link GridConfig}.
 * A value of the wrong type is never an error: the key is skipped and the default stays.
 */
public final class GridConfigParser {
    static final String[] COLUMN_KEYS = {"xTiles", "columns", "x"};

    private GridConfigParser() {
    }

    public static GridConfig parse(JSONObject data) {
        GridConfig.Builder builder = GridConfig.builder();
        if (data == null) {
            return builder.build();
        }

        // the first column key present decides, even if its value is unusable
        for (String key : COLUMN_KEYS) {
            if (data.has(key)) {
                optInteger(data, key).ifPresent(builder::columns);
                break;
            }
        }
        optInteger(data, "maxLongestEdge").ifPresent(builder::maxLongestEdge);
        optInteger(data, "padding").ifPresent(builder::padding);
        optColor(data, "backgroundColor").ifPresent(builder::backgroundColor);
        optColor(data, "textColor").ifPresent(builder::textColor);
        optColor(data, "tileOutlineColor").ifPresent(builder::tileOutlineColor);
        optBoolean(data, "addLabels").ifPresent(builder::addLabels);
        optString(data, "tilePrefix").ifPresent(builder::tilePrefix);
        optInteger(data, "tileWidth").ifPresent(builder::tileWidth);
        optInteger(data, "tileHeight").ifPresent(builder::tileHeight);
        optString(data, "fitMode").map(FitMode::from).ifPresent(builder::fitMode);
        optString(data, "outputDir").ifPresent(builder::outputDir);
        optString(data, "outputNamePrefix").ifPresent(builder::outputNamePrefix);
        optString(data, "outputPath").ifPresent(builder::outputPath);
        optInteger(data, "tileOutlineWidth").ifPresent(builder::tileOutlineWidth);
        return builder.build();
    }

    /**
     * Integers, decimals (truncated toward zero) and integer strings are accepted.
     * Booleans, out-of-range numbers and anything else are rejected.
     */
    static Optional<Integer> optInteger(JSONObject data, String key) {
        Object value = data.opt(key);
        if (value instanceof Boolean || value == null || JSONObject.NULL.equals(value)) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return toInt(number);
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Integer.parseInt(text.trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Optional<Boolean> optBoolean(JSONObject data, String key) {
        Object value = data.opt(key);
        if (value instanceof Boolean flag) {
            return Optional.of(flag);
        }
        return Optional.empty();
    }

    static Optional<String> optString(JSONObject data, String key) {
        Object value = data.opt(key);
        if (value instanceof String text) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    private static Optional<String> optColor(JSONObject data, String key) {
        return optString(data, key).filter(text -> !text.isEmpty());
    }

    private static Optional<Integer> toInt(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
                return Optional.empty();
            }
            return Optional.of((int) d);
        }
        try {
            BigDecimal decimal = new BigDecimal(number.toString());
            return Optional.of(decimal.toBigInteger().intValueExact());
        } catch (ArithmeticException | NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
