package com.mystery.gossip;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Gossip memory kept in the hosted Hyperspell memory store. Each store creates a new memory in the
 * session's collection; summaries come from the store's search endpoint.
 */
public class HyperspellMemoryClient implements GossipMemoryService {
    private static final Logger logger = LoggerFactory.getLogger(HyperspellMemoryClient.class);
    public static final String DEFAULT_BASE_URL = "https://api.hyperspell.com";
    static final String ADD_PATH = "/memories/add";
    static final String QUERY_PATH = "/memories/query";
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Gson gson = new GsonBuilder().setLenient().create();

    private final OkHttpClient httpClient;
    private final String apiKey;
    private final String baseUrl;
    private final String collectionId;
    private final Map<String, String> memoryIds = new ConcurrentHashMap<>();

    public HyperspellMemoryClient(OkHttpClient httpClient, String apiKey, String baseUrl, String collectionId) {
        this.httpClient = httpClient;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl != null && !baseUrl.isEmpty() ? baseUrl : DEFAULT_BASE_URL;
        this.collectionId = collectionId;
        logger.info("🎮 [Hyperspell] Gossip collection {}", collectionId);
    }

    /**
     * One HTTP client shared by every session's memory
     */
    public static GossipMemoryProvider provider(String apiKey, String baseUrl) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .build();
        return collectionId -> new HyperspellMemoryClient(httpClient, apiKey, baseUrl, collectionId);
    }

    @Override
    public String store(String character, List<GossipEntry> entries) {
        if (entries.isEmpty()) {
            throw new GossipMemoryException("Nothing to store for " + character);
        }
        JsonObject body = new JsonObject();
        body.addProperty("text", GossipMemoryFormat.format(character, entries));
        body.addProperty("collection", collectionId);

        JsonObject reply = post(ADD_PATH, body);
        String memoryId = resourceId(reply);
        if (memoryId == null) {
            throw new GossipMemoryException("Hyperspell returned no resource_id for " + character);
        }
        memoryIds.put(character, memoryId);
        logger.info("✅ [Hyperspell] Stored gossip memory for {} ({})", character, memoryId);
        return memoryId;
    }

    @Override
    public Optional<MemorySummary> summarize(String character) {
        String memoryId = memoryIds.get(character);
        if (memoryId == null) {
            return Optional.empty();
        }
        JsonObject body = new JsonObject();
        body.addProperty("query", character);
        JsonArray collections = new JsonArray();
        collections.add(collectionId);
        body.add("collections", collections);

        JsonObject reply = post(QUERY_PATH, body);
        return Optional.of(new MemorySummary(memoryId, findSummary(reply, memoryId)));
    }

    /**
     * Summary of the document with the given resource id, or null when the search did not return it
     */
    static String findSummary(JsonObject reply, String memoryId) {
        if (!reply.has("documents") || !reply.get("documents").isJsonArray()) {
            return null;
        }
        for (JsonElement element : reply.getAsJsonArray("documents")) {
            if (!element.isJsonObject()) {
                continue;
            }
            JsonObject document = element.getAsJsonObject();
            if (memoryId.equals(resourceId(document))) {
                JsonElement summary = document.get("summary");
                return summary != null && summary.isJsonPrimitive() ? summary.getAsString() : null;
            }
        }
        return null;
    }

    private static String resourceId(JsonObject object) {
        JsonElement id = object.get("resource_id");
        return id != null && id.isJsonPrimitive() ? id.getAsString() : null;
    }

    private JsonObject post(String path, JsonObject body) {
        Request request = new Request.Builder()
            .url(baseUrl + path)
            .header("Authorization", "Bearer " + apiKey)
            .post(RequestBody.create(body.toString(), JSON))
            .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new GossipMemoryException("Hyperspell " + path + " failed: HTTP " + response.code());
            }
            JsonObject reply = gson.fromJson(response.body().string(), JsonObject.class);
            if (reply == null) {
                throw new GossipMemoryException("Hyperspell " + path + " returned an empty body");
            }
            return reply;
        } catch (IOException | JsonParseException e) {
            throw new GossipMemoryException("Hyperspell " + path + " failed: " + e.getMessage(), e);
        }
    }
}
