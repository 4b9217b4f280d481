package com.mystery.ai_engine;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.stream.JsonReader;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.concurrent.TimeUnit;

/**
 * Text generation client for local models served by Ollama
 */
public class LocalLLMClient implements TextGenerationService {
    private static final Logger logger = LoggerFactory.getLogger(LocalLLMClient.class);
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Gson gson = new GsonBuilder().setLenient().create();
    private final OkHttpClient httpClient;
    private final LocalLLMConfig config;
    private final String ollamaBaseUrl;

    public LocalLLMClient(LocalLLMConfig config) {
        this(config, getOllamaBaseUrlFromEnv());
    }

    public LocalLLMClient(LocalLLMConfig config, String ollamaBaseUrl) {
        this(config, ollamaBaseUrl, new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(120, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .callTimeout(300, TimeUnit.SECONDS)
            .build());
    }

    LocalLLMClient(LocalLLMConfig config, String ollamaBaseUrl, OkHttpClient httpClient) {
        this.config = config;
        this.ollamaBaseUrl = ollamaBaseUrl != null && !ollamaBaseUrl.isEmpty() ? ollamaBaseUrl : DEFAULT_OLLAMA_BASE_URL;
        this.httpClient = httpClient;
    }

    public static String getOllamaBaseUrlFromEnv() {
        String url = System.getenv("OLLAMA_BASE_URL");
        if (url == null || url.isEmpty()) {
            url = System.getProperty("ollama.base.url");
        }
        return url;
    }

    /**
     * Checks that Ollama answers on /api/tags. Failure is only logged.
     */
    public boolean checkAvailability() {
        Request request = new Request.Builder()
            .url(ollamaBaseUrl + "/api/tags")
            .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                logger.info("✅ Ollama model {} is ready at {}", config.getModelName(), ollamaBaseUrl);
                return true;
            }
            logger.warn("⚠️ Ollama answered /api/tags with HTTP {}", response.code());
            return false;
        } catch (IOException e) {
            logger.warn("❌ Ollama is not reachable at {}: {}", ollamaBaseUrl, e.getMessage());
            return false;
        }
    }

    @Override
    public String generate(String prompt, double temperature, int maxTokens) {
        JsonObject requestBody = new JsonObject();
        requestBody.addProperty("model", config.getModelName());
        requestBody.addProperty("prompt", prompt);
        requestBody.addProperty("stream", false);

        JsonObject options = new JsonObject();
        options.addProperty("temperature", temperature);
        options.addProperty("num_predict", Math.min(maxTokens, config.getMaxTokens()));
        requestBody.add("options", options);

        Request request = new Request.Builder()
            .url(ollamaBaseUrl + "/api/generate")
            .post(RequestBody.create(requestBody.toString(), JSON))
            .build();

        long requestStartTime = System.currentTimeMillis();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                String errorBody = response.body() != null ? response.body().string() : "no body";
                throw new GenerationException("Ollama request failed: HTTP " + response.code() + " " + response.message() + ". Body: " + errorBody);
            }
            String json = response.body().string();
            String text = extractResponseText(json);
            long requestTime = System.currentTimeMillis() - requestStartTime;
            logger.debug("📊 Ollama ({}) answered in {} s, ~{} tokens", config.getModelName(), requestTime / 1000.0, text.length() / 4);
            return text;
        } catch (java.net.SocketTimeoutException e) {
            throw new GenerationException("Timed out waiting for Ollama: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new GenerationException("Ollama request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Pulls the "response" field out of an Ollama /api/generate reply
     */
    static String extractResponseText(String json) {
        JsonObject obj = parseJsonLenient(json);
        if (obj == null || !obj.has("response") || obj.get("response").isJsonNull()) {
            throw new GenerationException("Ollama reply has no 'response' field: " + json);
        }
        String text = obj.get("response").getAsString().trim();
        if (text.isEmpty()) {
            throw new GenerationException("Ollama returned an empty response: " + json);
        }
        return text;
    }

    private static JsonObject parseJsonLenient(String json) {
        try {
            return gson.fromJson(json, JsonObject.class);
        } catch (Exception e) {
            try {
                JsonReader reader = new JsonReader(new StringReader(json));
                reader.setLenient(true);
                return gson.fromJson(reader, JsonObject.class);
            } catch (Exception e2) {
                int startIdx = json.indexOf('{');
                int endIdx = json.lastIndexOf('}');
                if (startIdx >= 0 && endIdx > startIdx) {
                    try {
                        JsonReader reader = new JsonReader(new StringReader(json.substring(startIdx, endIdx + 1)));
                        reader.setLenient(true);
                        return gson.fromJson(reader, JsonObject.class);
                    } catch (Exception e3) {
                        throw new GenerationException("Could not parse Ollama reply: " + e3.getMessage(), e3);
                    }
                }
                throw new GenerationException("Could not parse Ollama reply: " + e2.getMessage(), e2);
            }
        }
    }

    public static class LocalLLMConfig {
        private final String modelName;
        private final int maxTokens; // upper bound for num_predict

        public LocalLLMConfig(String modelName, int maxTokens) {
            this.modelName = modelName;
            this.maxTokens = maxTokens;
        }

        public String getModelName() { return modelName; }
        public int getMaxTokens() { return maxTokens; }
    }
}
