package com.jobrunner.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of serialized job input, as stored on results and schedules.
 */
public final class JobKwargs {

    private static final Gson gson = new GsonBuilder().serializeNulls().create();

    private JobKwargs() {
    }

    public static String toJson(Map<String, Object> kwargs) {
        return gson.toJson(kwargs);
    }

    /**
     * Parse stored input. Whole numbers come back as {@link Integer} or {@link Long}.
     *
     * @param json a JSON object, or null
     * @return the input, empty for null
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return new LinkedHashMap<>(new JSONObject(json).toMap());
        } catch (JSONException e) {
            throw new IllegalArgumentException("Stored job input is not a JSON object: " + e.getMessage(), e);
        }
    }
}
