package com.storybuilder.service;

import com.storybuilder.core.render.ImageGridRenderer;
import com.storybuilder.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Line-oriented JSON command loop. Each input line is a request
 * {@code {"id": ..., "cmd": "...", "args": {...}}}; each request gets exactly one response line.
 */
public final class CommandService {
    private static final Logger LOGGER = AppLogger.get();

    public static final String PING = "ping";
    public static final String IMAGE_GRID = "imageGrid";

    private final Map<String, CommandHandler> commands;

    public CommandService(Map<String, CommandHandler> commands) {
        this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
    }

    public static CommandService withDefaultCommands(ImageGridRenderer gridRenderer) {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put(PING, args -> new JSONObject().put("message", "pong"));
        commands.put(IMAGE_GRID, args -> new JSONObject().put("message",
            gridRenderer.createImageGrid(readPaths(args.optJSONArray("paths")), args.optJSONObject("settings"))));
        return new CommandService(commands);
    }

    public void run(InputStream input, OutputStream output) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, UTF_8));
        Writer writer = new OutputStreamWriter(output, UTF_8);
        String rawLine;
        while ((rawLine = reader.readLine()) != null) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            writer.write(handleLine(line).toString());
            writer.write('\n');
            writer.flush();
        }
    }

    JSONObject handleLine(String line) {
        JSONObject command;
        try {
            command = new JSONObject(line);
        } catch (JSONException ex) {
            return CommandResponses.error(null, CommandResponses.INVALID_JSON, "Could not parse JSON: " + ex.getMessage());
        }

        Object commandId = command.opt("id");
        if (isMissing(commandId)) {
            return CommandResponses.error(null, CommandResponses.INVALID_REQUEST, "Missing field: id");
        }
        String cmd = command.optString("cmd", "");
        if (cmd.isEmpty()) {
            return CommandResponses.error(commandId, CommandResponses.INVALID_REQUEST, "Missing field: cmd");
        }
        CommandHandler handler = commands.get(cmd);
        if (handler == null) {
            return CommandResponses.error(commandId, CommandResponses.UNKNOWN_COMMAND, "Unknown command: " + cmd);
        }

        JSONObject args = command.optJSONObject("args");
        try {
            return CommandResponses.success(commandId, handler.handle(args == null ? new JSONObject() : args));
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Unexpected error in command " + cmd, ex);
            return CommandResponses.error(commandId, CommandResponses.INTERNAL_ERROR, String.valueOf(ex.getMessage()));
        }
    }

    private static boolean isMissing(Object value) {
        return value == null
            || JSONObject.NULL.equals(value)
            || (value instanceof String text && text.isEmpty());
    }

    private static List<String> readPaths(JSONArray array) {
        List<String> paths = new ArrayList<>();
        if (array == null) {
            return paths;
        }
        for (int i = 0; i < array.length(); i++) {
            Object value = array.opt(i);
            paths.add(value == null || JSONObject.NULL.equals(value) ? "" : String.valueOf(value));
        }
        return paths;
    }
}
