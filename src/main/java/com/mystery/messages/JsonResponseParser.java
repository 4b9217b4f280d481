package com.mystery.messages;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for pulling JSON out of model replies (the JSON may be wrapped in prose or code fences)
 */
public final class JsonResponseParser {

    private static final Gson gson = new GsonBuilder().setLenient().create();

    private JsonResponseParser() {
    }

    /**
     * Extracts the outermost JSON object from a reply and binds it to the given schema type
     *
     * @throws IllegalArgumentException when the reply holds no object or it cannot be parsed
     */
    public static <T> T parseObject(String response, Class<T> schema) {
        String jsonStr = extractJson(response, '{', '}');
        try {
            JsonReader reader = new JsonReader(new StringReader(jsonStr));
            reader.setLenient(true);
            T value = gson.fromJson(reader, schema);
            if (value == null) {
                throw new IllegalArgumentException("Empty JSON object in reply");
            }
            return value;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed JSON in reply: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the outermost JSON object from a reply as a tree
     */
    public static JsonObject parseJsonObject(String response) {
        String jsonStr = extractJson(response, '{', '}');
        try {
            JsonElement element = JsonParser.parseReader(lenientReader(jsonStr));
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("Reply is not a JSON object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IllegalArgumentException("Malformed JSON in reply: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts a JSON array of strings; non-string elements are skipped
     */
    public static List<String> parseStringArray(String response) {
        String jsonStr = extractJson(response, '[', ']');
        try {
            JsonElement element = JsonParser.parseReader(lenientReader(jsonStr));
            if (!element.isJsonArray()) {
                throw new IllegalArgumentException("Reply is not a JSON array");
            }
            JsonArray array = element.getAsJsonArray();
            List<String> values = new ArrayList<>();
            for (JsonElement item : array) {
                if (item.isJsonPrimitive() && item.getAsJsonPrimitive().isString()) {
                    String text = item.getAsString().trim();
                    if (!text.isEmpty()) {
                        values.add(text);
                    }
                }
            }
            return values;
        } catch (JsonParseException | IllegalStateException e) {
            throw new IllegalArgumentException("Malformed JSON in reply: " + e.getMessage(), e);
        }
    }

    private static JsonReader lenientReader(String json) {
        JsonReader reader = new JsonReader(new StringReader(json));
        reader.setLenient(true);
        return reader;
    }

    private static String extractJson(String response, char open, char close) {
        if (response == null || response.trim().isEmpty()) {
            throw new IllegalArgumentException("Empty reply from the model");
        }
        int startIdx = response.indexOf(open);
        int endIdx = response.lastIndexOf(close) + 1;

        if (startIdx == -1 || endIdx <= startIdx) {
            throw new IllegalArgumentException("No JSON found in reply: " + response);
        }
        return cleanJsonString(response.substring(startIdx, endIdx));
    }

    /**
     * Removes trailing commas, the most common defect in model-written JSON
     */
    static String cleanJsonString(String json) {
        json = json.replaceAll(",\\s*}", "}");
        json = json.replaceAll(",\\s*]", "]");
        return json;
    }
}
