package com.mystery.gossip;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mystery.case_model.RelationshipType;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class HyperspellMemoryClientTest {

    private static final List<GossipEntry> HEARD = List.of(
        new GossipEntry("Lisa", "The detective asked about the cellar.", RelationshipType.ENEMY));

    @Mock
    private OkHttpClient httpClient;

    @Mock
    private Call call;

    private HyperspellMemoryClient client;

    @BeforeEach
    public void setUp() {
        client = new HyperspellMemoryClient(httpClient, "secret", "https://memory.test", "mystery-abc");
    }

    private static Response reply(int code, String body) {
        return new Response.Builder()
            .request(new Request.Builder().url("https://memory.test/").build())
            .protocol(Protocol.HTTP_1_1)
            .code(code)
            .message(code == 200 ? "OK" : "Error")
            .body(ResponseBody.create(body, MediaType.parse("application/json")))
            .build();
    }

    private static JsonObject bodyOf(Request request) throws IOException {
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        return JsonParser.parseString(buffer.readUtf8()).getAsJsonObject();
    }

    @Test
    public void storeAddsFormattedGossipToTheCollection() throws Exception {
        when(httpClient.newCall(any())).thenReturn(call);
        when(call.execute()).thenReturn(reply(200, "{\"resource_id\": \"mem-1\"}"));

        assertEquals("mem-1", client.store("Nick", HEARD));

        ArgumentCaptor<Request> sent = ArgumentCaptor.forClass(Request.class);
        verify(httpClient).newCall(sent.capture());
        Request request = sent.getValue();
        assertEquals("https://memory.test/memories/add", request.url().toString());
        assertEquals("Bearer secret", request.header("Authorization"));
        JsonObject body = bodyOf(request);
        assertEquals("mystery-abc", body.get("collection").getAsString());
        assertEquals(GossipMemoryFormat.format("Nick", HEARD), body.get("text").getAsString());
    }

    @Test
    public void summaryComesFromTheMatchingSearchDocument() throws Exception {
        when(httpClient.newCall(any())).thenReturn(call);
        when(call.execute()).thenReturn(
            reply(200, "{\"resource_id\": \"mem-1\"}"),
            reply(200, "{\"documents\": [{\"resource_id\": \"mem-0\", \"summary\": \"old\"},"
                + " {\"resource_id\": \"mem-1\", \"summary\": \"Nick heard Lisa was questioned.\"}]}"));

        client.store("Nick", HEARD);
        Optional<MemorySummary> summary = client.summarize("Nick");

        assertTrue(summary.isPresent());
        assertEquals("mem-1", summary.get().getHandle());
        assertEquals("Nick heard Lisa was questioned.", summary.get().getSummaryText().orElseThrow());
    }

    @Test
    public void nothingStoredMeansNoSummaryAndNoCall() {
        assertTrue(client.summarize("Nick").isEmpty());
        verifyNoInteractions(httpClient);
    }

    @Test
    public void emptyGossipIsRejected() {
        assertThrows(GossipMemoryException.class, () -> client.store("Nick", List.of()));
        verifyNoInteractions(httpClient);
    }

    @Test
    public void httpErrorBecomesMemoryException() throws Exception {
        when(httpClient.newCall(any())).thenReturn(call);
        when(call.execute()).thenReturn(reply(500, "{}"));

        GossipMemoryException e = assertThrows(GossipMemoryException.class, () -> client.store("Nick", HEARD));
        assertTrue(e.getMessage().contains("HTTP 500"));
    }

    @Test
    public void networkFailureBecomesMemoryException() throws Exception {
        when(httpClient.newCall(any())).thenReturn(call);
        when(call.execute()).thenThrow(new IOException("connection refused"));

        assertThrows(GossipMemoryException.class, () -> client.store("Nick", HEARD));
    }

    @Test
    public void replyWithoutResourceIdIsRejected() throws Exception {
        when(httpClient.newCall(any())).thenReturn(call);
        when(call.execute()).thenReturn(reply(200, "{\"status\": \"queued\"}"));

        assertThrows(GossipMemoryException.class, () -> client.store("Nick", HEARD));
    }

    @Test
    public void nonTextResourceIdIsRejected() throws Exception {
        when(httpClient.newCall(any())).thenReturn(call);
        when(call.execute()).thenReturn(
            reply(200, "{\"resource_id\": {\"id\": 4}}"),
            reply(200, "{\"resource_id\": [\"mem-1\"]}"));

        assertThrows(GossipMemoryException.class, () -> client.store("Nick", HEARD));
        assertThrows(GossipMemoryException.class, () -> client.store("Nick", HEARD));
    }

    @Test
    public void findSummaryIgnoresOtherDocuments() {
        JsonObject reply = JsonParser.parseString(
            "{\"documents\": [\"junk\", {\"resource_id\": \"mem-9\", \"summary\": \"x\"}, {\"resource_id\": \"mem-2\", \"summary\": null}, {\"resource_id\": null}, {\"resource_id\": {\"x\": 1}}]}")
            .getAsJsonObject();

        assertNull(HyperspellMemoryClient.findSummary(reply, "mem-1"));
        assertNull(HyperspellMemoryClient.findSummary(reply, "mem-2"));
        assertEquals("x", HyperspellMemoryClient.findSummary(reply, "mem-9"));
        assertNull(HyperspellMemoryClient.findSummary(new JsonObject(), "mem-1"));
    }
}
