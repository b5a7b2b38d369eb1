package com.storybuilder.service;

import com.storybuilder.core.render.ImageGridRenderer;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.storybuilder.support.TestImages.writeSolidPng;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandServiceTest {

    @TempDir
    Path tempDir;

    private final CommandService service = CommandService.withDefaultCommands(
        new ImageGridRenderer(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC)));

    @Test
    void answersPing() {
        JSONObject response = service.handleLine("{\"id\":\"1\",\"cmd\":\"ping\"}");

        assertEquals("1", response.get("id"));
        assertTrue(response.getBoolean("ok"));
        assertEquals("pong", response.getJSONObject("data").getString("message"));
    }

    @Test
    void rejectsMalformedRequests() {
        assertError(service.handleLine("{not json"), "unknown", "invalid_json");
        assertError(service.handleLine("{\"cmd\":\"ping\"}"), "unknown", "invalid_request");
        assertError(service.handleLine("{\"id\":\"7\"}"), "7", "invalid_request");
        assertError(service.handleLine("{\"id\":\"8\",\"cmd\":\"paint\"}"), "8", "unknown_command");
    }

    @Test
    void handlerExceptionsBecomeInternalErrors() {
        CommandService failing = new CommandService(Map.of("boom", args -> {
            throw new IllegalStateException("kaput");
        }));

        JSONObject response = failing.handleLine("{\"id\":\"9\",\"cmd\":\"boom\"}");

        assertError(response, "9", "internal_error");
        assertEquals("kaput", response.getJSONObject("error").getString("message"));
    }

    @Test
    void runsImageGridCommand() throws IOException {
        Path image = writeSolidPng(tempDir.resolve("shot1.png"), 20, 20, Color.RED);
        JSONObject request = new JSONObject()
            .put("id", "grid-1")
            .put("cmd", "imageGrid")
            .put("args", new JSONObject()
                .put("paths", List.of(image.toString()))
                .put("settings", new JSONObject().put("addLabels", false).put("maxLongestEdge", 200)));

        JSONObject response = service.handleLine(request.toString());

        assertTrue(response.getBoolean("ok"));
        String message = response.getJSONObject("data").getString("message");
        assertEquals("Grid image saved to: " + tempDir.resolve("grid_overview_20240101_000000.png").toAbsolutePath(), message);
    }

    @Test
    void streamsOneResponsePerNonBlankLine() throws IOException {
        String input = "{\"id\":\"a\",\"cmd\":\"ping\"}\n\n   \n{\"id\":\"b\",\"cmd\":\"imageGrid\",\"args\":{\"paths\":[]}}\n";
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        service.run(new ByteArrayInputStream(input.getBytes(UTF_8)), output);

        String[] lines = output.toString(UTF_8).split("\n");
        assertEquals(2, lines.length);
        assertEquals("pong", new JSONObject(lines[0]).getJSONObject("data").getString("message"));
        assertEquals("No images provided.", new JSONObject(lines[1]).getJSONObject("data").getString("message"));
    }

    private static void assertError(JSONObject response, String id, String code) {
        assertEquals(id, response.get("id"));
        assertFalse(response.getBoolean("ok"));
        assertEquals(code, response.getJSONObject("error").getString("code"));
    }
}
