package com.autoresearch.research.service;

import com.autoresearch.research.ResearchException;

public class RunCancelledException extends ResearchException {

    public RunCancelledException(String runId) {
        super("Run " + runId + " was cancelled");
    }
}
