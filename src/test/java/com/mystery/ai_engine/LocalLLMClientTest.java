package com.mystery.ai_engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LocalLLMClientTest {

    @Test
    public void responseFieldIsExtracted() {
        String reply = "{\"model\":\"mistral:7b\",\"response\":\"  I was in the library. \",\"done\":true}";

        assertEquals("I was in the library.", LocalLLMClient.extractResponseText(reply));
    }

    @Test
    public void replyWrappedInNoiseIsStillRead() {
        String reply = "data: {\"response\": \"Fine.\", \"done\": true}\n";

        assertEquals("Fine.", LocalLLMClient.extractResponseText(reply));
    }

    @Test
    public void emptyOrMissingResponseFails() {
        assertThrows(GenerationException.class, () -> LocalLLMClient.extractResponseText("{\"response\": \"   \"}"));
        assertThrows(GenerationException.class, () -> LocalLLMClient.extractResponseText("{\"done\": true}"));
        assertThrows(GenerationException.class, () -> LocalLLMClient.extractResponseText("not json at all"));
    }
}
