package com.storybuilder.core.grid;

import java.awt.Color;

/**
 * Parses {@code #rgb} / {@code #rrggbb} strings into opaque colors.
 */
public final class HexColorParser {

    private HexColorParser() {
    }

    /**
     * @param value    hex text, with or without a leading {@code #}
     * @param fallback color returned when the text is missing or malformed
     * @return the parsed color with alpha 255, or {@code fallback}
     */
    public static Color parse(String value, Color fallback) {
        if (value == null) {
            return fallback;
        }
        String text = value.trim();
        while (text.startsWith("#")) {
            text = text.substring(1);
        }
        if (text.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (int i = 0; i < 3; i++) {
                expanded.append(text.charAt(i)).append(text.charAt(i));
            }
            text = expanded.toString();
        }
        if (text.length() != 6) {
            return fallback;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return fallback;
            }
        }
        try {
            int r = Integer.parseInt(text.substring(0, 2), 16);
            int g = Integer.parseInt(text.substring(2, 4), 16);
            int b = Integer.parseInt(text.substring(4, 6), 16);
            return new Color(r, g, b, 255);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
