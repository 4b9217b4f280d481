package com.mystery.ai_engine;

/**
 * Failure of a single text generation call (transport, HTTP status, empty or unparseable reply).
 * Every call site in the engine defines its own fallback for it.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
