package com.storybuilder.core.fs;

import com.storybuilder.core.grid.GridConfig;
import com.storybuilder.core.model.GridItem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides where the grid PNG is written and creates the target directory.
 *
 * <p>An explicit {@code outputPath} is used as given (with {@code .png} appended when missing).
 * Otherwise the file lands in {@code outputDir}, else next to the first item that has a path, else
 * in the working directory, named {@code <prefix>_<yyyyMMdd_HHmmss>.png}.
 */
public final class OutputPathResolver {
    private static final Pattern UNSAFE_RUN = Pattern.compile("[^A-Za-z0-9._-]+");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String EXTENSION = ".png";

    private final Clock clock;

    public OutputPathResolver(Clock clock) {
        this.clock = clock;
    }

    public Path resolve(GridConfig config, List<GridItem> items) throws IOException {
        Optional<String> explicit = config.outputPath();
        if (explicit.isPresent()) {
            String value = explicit.get();
            if (!value.toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
                value = value + EXTENSION;
            }
            Path target = toPath(value).toAbsolutePath();
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return target;
        }

        Path baseDirectory = resolveBaseDirectory(config, items);
        Files.createDirectories(baseDirectory);
        String timestamp = TIMESTAMP_FORMAT.format(LocalDateTime.now(clock));
        return baseDirectory.resolve(config.outputNamePrefix() + "_" + timestamp + EXTENSION);
    }

    private static Path resolveBaseDirectory(GridConfig config, List<GridItem> items) throws IOException {
        if (config.outputDir().isPresent()) {
            return toPath(config.outputDir().get()).toAbsolutePath();
        }
        for (GridItem item : items) {
            if (!item.hasPath()) {
                continue;
            }
            Path parent = toPath(item.path()).toAbsolutePath().getParent();
            if (parent != null) {
                return parent;
            }
            break;
        }
        return Path.of("").toAbsolutePath();
    }

    /**
     * Replaces every run of characters outside {@code [A-Za-z0-9._-]} with an underscore and trims
     * underscores from both ends. Falls back to {@code grid_overview} when nothing is left.
     */
    public static String sanitizeNamePrefix(String prefix) {
        if (prefix == null) {
            return GridConfig.DEFAULT_OUTPUT_NAME_PREFIX;
        }
        String cleaned = UNSAFE_RUN.matcher(prefix).replaceAll("_");
        int start = 0;
        int end = cleaned.length();
        while (start < end && cleaned.charAt(start) == '_') {
            start++;
        }
        while (end > start && cleaned.charAt(end - 1) == '_') {
            end--;
        }
        cleaned = cleaned.substring(start, end);
        return cleaned.isEmpty() ? GridConfig.DEFAULT_OUTPUT_NAME_PREFIX : cleaned;
    }

    private static Path toPath(String value) throws IOException {
        try {
            return Path.of(value);
        } catch (InvalidPathException ex) {
            throw new IOException("Invalid output location: " + value, ex);
        }
    }
}
