package com.storybuilder.service;

import org.json.JSONObject;

/**
 * Response envelopes written by {@link CommandService}.
 */
final class CommandResponses {
    static final String INVALID_JSON = "invalid_json";
    static final String INVALID_REQUEST = "invalid_request";
    static final String UNKNOWN_COMMAND = "unknown_command";
    static final String INTERNAL_ERROR = "internal_error";

    private CommandResponses() {
    }

    static JSONObject success(Object commandId, JSONObject data) {
        return new JSONObject()
            .put("id", commandId)
            .put("ok", true)
            .put("data", data == null ? new JSONObject() : data);
    }

    static JSONObject error(Object commandId, String code, String message) {
        JSONObject error = new JSONObject()
            .put("code", code)
            .put("message", message == null ? "" : message);
        return new JSONObject()
            .put("id", commandId == null ? "unknown" : commandId)
            .put("ok", false)
            .put("error", error);
    }
}
