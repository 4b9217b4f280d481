package com.mystery.ai_engine;

import com.mystery.game_state.InvestigationLog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SnippetWriterTest {

    private static final List<String> TRANSCRIPT = List.of("DETECTIVE: Where were you?", "David: Asleep, obviously.");

    @Test
    public void quotesAreStripped() {
        ScriptedTextService text = new ScriptedTextService().reply(ScriptedTextService.SNIPPET, " \"David dodged the question\" ");

        assertEquals("David dodged the question", new SnippetWriter(text).write("David", TRANSCRIPT));
        assertTrue(text.getPrompts().get(0).contains("David: Asleep, obviously."));
    }

    @Test
    public void failureGivesTheFailedMarker() {
        ScriptedTextService text = new ScriptedTextService().fail(ScriptedTextService.SNIPPET);

        assertEquals(InvestigationLog.FAILED, new SnippetWriter(text).write("David", TRANSCRIPT));
    }
}
