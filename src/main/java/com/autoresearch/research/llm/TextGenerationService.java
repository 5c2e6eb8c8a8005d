package com.autoresearch.research.llm;

/**
 * Black-box text generation. Latency and failure are the only observable properties.
 */
public interface TextGenerationService {

    /**
     * @throws GenerationException when the model fails, times out or answers with nothing
     */
    String generate(String prompt, GenerationConstraints constraints);
}
