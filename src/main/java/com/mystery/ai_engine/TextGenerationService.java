package com.mystery.ai_engine;

/**
 * Opaque text generation capability: a prompt in, generated text out.
 * Calls are slow and may fail with {@link GenerationException}.
 */
public interface TextGenerationService {

    String generate(String prompt, double temperature, int maxTokens);
}
