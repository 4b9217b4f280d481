package com.mystery.ai_engine;

import com.mystery.game_state.InvestigationLog;
import com.mystery.prompts.OrchestratorPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes the short observations that go into the investigation log
 */
public class SnippetWriter {
    private static final Logger logger = LoggerFactory.getLogger(SnippetWriter.class);

    static final double SNIPPET_TEMPERATURE = 0.7;
    static final int SNIPPET_MAX_TOKENS = 50;

    private final TextGenerationService textService;

    public SnippetWriter(TextGenerationService textService) {
        this.textService = textService;
    }

    /**
     * @return a 5-7 word observation, or {@link InvestigationLog#FAILED} when none could be generated
     */
    public String write(String suspectName, List<String> transcript) {
        try {
            String snippet = textService.generate(OrchestratorPrompts.getSnippetPrompt(suspectName, transcript),
                SNIPPET_TEMPERATURE, SNIPPET_MAX_TOKENS);
            snippet = snippet.trim().replaceAll("^[\"']+|[\"']+$", "").trim();
            return snippet.isEmpty() ? InvestigationLog.FAILED : snippet;
        } catch (GenerationException e) {
            logger.warn("⚠️ [SnippetWriter] No snippet for {}: {}", suspectName, e.getMessage());
            return InvestigationLog.FAILED;
        }
    }
}
