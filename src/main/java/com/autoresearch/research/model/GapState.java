package com.autoresearch.research.model;

public enum GapState {
    NEEDS_MORE, SUFFICIENT, BUDGET_EXHAUSTED
}
