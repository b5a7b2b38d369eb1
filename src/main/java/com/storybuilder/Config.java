package com.storybuilder;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Process-wide settings read from system properties: an optional directory of extra label fonts
 * and the log level.
 */
public final class Config {
    public static final String FONT_DIR_PROPERTY = "storybuilder.fontDir";
    public static final String LOG_LEVEL_PROPERTY = "storybuilder.logLevel";

    private Config() {}

    public static Optional<Path> fontDirectory() {
        String override = System.getProperty(FONT_DIR_PROPERTY);
        if (override == null || override.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(override.trim()));
    }

    public static Level logLevel() {
        String value = System.getProperty(LOG_LEVEL_PROPERTY);
        if (value == null || value.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }
}
