package com.autoresearch.research.model;

public enum RunStatus {
    SUFFICIENT, PARTIAL, FAILED
}
