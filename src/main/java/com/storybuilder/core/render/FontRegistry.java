package com.storybuilder.core.render;

import com.storybuilder.Config;
import com.storybuilder.logging.AppLogger;

import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registers custom font files and picks the font family used for tile labels.
 */
public final class FontRegistry {
    private static final Logger LOGGER = AppLogger.get();

    /** Preferred label families, first available wins; the logical sans-serif font is the last resort. */
    static final List<String> LABEL_FAMILIES = List.of("Arial", "DejaVu Sans");

    private static String labelFamily;

    private FontRegistry() { }

    /**
     * Label font of the given pixel size from the fallback chain.
     */
    public static Font labelFont(int size) {
        return new Font(resolveLabelFamily(), Font.PLAIN, size);
    }

    static synchronized String resolveLabelFamily() {
        if (labelFamily != null) {
            return labelFamily;
        }
        Config.fontDirectory().ifPresent(FontRegistry::registerConfiguredFonts);
        String[] names = GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames(Locale.ROOT);
        Set<String> available = new HashSet<>(Arrays.asList(names));
        labelFamily = LABEL_FAMILIES.stream()
            .filter(available::contains)
            .findFirst()
            .orElse(Font.SANS_SERIF);
        LOGGER.fine("Label font family: " + labelFamily);
        return labelFamily;
    }

    private static void registerConfiguredFonts(Path directory) {
        try {
            LOGGER.info("Registered " + registerFonts(directory) + " font file(s) from " + directory);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not register fonts from " + directory, ex);
        }
    }

    /**
     * Registers every .ttf, .otf and .ttc file in {@code directory}. Unreadable files are skipped.
     *
     * @return number of files registered
     */
    static int registerFonts(Path directory) throws IOException {
        GraphicsEnvironment environment = GraphicsEnvironment.getLocalGraphicsEnvironment();
        int registered = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.{ttf,otf,ttc,TTF,OTF,TTC}")) {
            for (Path file : files) {
                try {
                    if (environment.registerFont(Font.createFont(Font.TRUETYPE_FONT, file.toFile()))) {
                        registered++;
                    }
                } catch (IOException | FontFormatException ex) {
                    LOGGER.warning("Skipping unreadable font " + file.getFileName() + ": " + ex.getMessage());
                }
            }
        }
        return registered;
    }
}
