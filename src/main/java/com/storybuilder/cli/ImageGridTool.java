package com.storybuilder.cli;

import com.storybuilder.core.render.ImageGridRenderer;
import com.storybuilder.service.CommandService;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 * <pre>
 *   ImageGridTool [--settings settings.json] image1.png image2.png ...
 *   ImageGridTool --serve
 * </pre>
 */
public final class ImageGridTool {

    private ImageGridTool() {}

    public static void main(String[] args) throws Exception {
        ImageGridRenderer renderer = new ImageGridRenderer();
        if (args.length > 0 && "--serve".equals(args[0])) {
            CommandService.withDefaultCommands(renderer).run(System.in, System.out);
            return;
        }
        Invocation invocation = parse(args);
        System.out.println(renderer.createImageGrid(invocation.paths(), invocation.settings()));
    }

    static Invocation parse(String[] args) throws IOException {
        List<String> paths = new ArrayList<>();
        JSONObject settings = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--settings".equals(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--settings requires a file argument");
                }
                settings = readSettings(Path.of(args[++i]));
            } else {
                paths.add(arg);
            }
        }
        return new Invocation(List.copyOf(paths), settings);
    }

    private static JSONObject readSettings(Path file) throws IOException {
        String content = Files.readString(file);
        try {
            return new JSONObject(content);
        } catch (JSONException ex) {
            throw new IOException("Settings file is not a JSON object: " + file, ex);
        }
    }

    record Invocation(List<String> paths, JSONObject settings) {
    }
}
