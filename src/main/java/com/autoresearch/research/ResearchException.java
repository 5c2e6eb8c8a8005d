package com.autoresearch.research;

/**
 * Root of the engine's unchecked exceptions. Subclasses describe component-local failures that are absorbed before
 * they reach a caller.
 */
public class ResearchException extends RuntimeException {

    public ResearchException(String message) {
        super(message);
    }

    public ResearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
