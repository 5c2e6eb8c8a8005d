package com.autoresearch.research.service;

import com.autoresearch.research.ResearchException;

public class UnknownRunException extends ResearchException {

    public UnknownRunException(String runId) {
        super("Unknown run " + runId);
    }
}
