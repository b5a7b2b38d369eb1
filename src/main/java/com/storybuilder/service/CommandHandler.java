package com.storybuilder.service;

import org.json.JSONObject;

/**
 * Handles one named command. The returned object becomes the {@code data} of a success response.
 */
@FunctionalInterface
public interface CommandHandler {

    JSONObject handle(JSONObject args) throws Exception;
}
