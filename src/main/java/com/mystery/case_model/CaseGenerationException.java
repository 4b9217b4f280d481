package com.mystery.case_model;

/**
 * Fatal setup error: the drawn case is unparseable or structurally incomplete. No partial case is ever built.
 */
public class CaseGenerationException extends RuntimeException {

    public CaseGenerationException(String message) {
        super(message);
    }

    public CaseGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
