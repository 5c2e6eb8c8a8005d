package com.autoresearch.research.service;

import com.autoresearch.research.ResearchException;

/**
 * Raised inside a run when its wall-clock deadline passes at a suspension point.
 */
public class RunTimeoutException extends ResearchException {

    public RunTimeoutException(String runId) {
        super("Run " + runId + " exceeded its wall-clock budget");
    }
}
