package com.autoresearch.research.llm;

import com.autoresearch.research.ResearchException;

public class GenerationException extends ResearchException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
