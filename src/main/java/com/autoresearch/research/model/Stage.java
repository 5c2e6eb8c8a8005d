package com.autoresearch.research.model;

public enum Stage {
    EXPANDING, SEARCHING, VERIFYING, FINALIZING, EDITING, CITING, PUBLISHED, FAILED;

    public boolean isTerminal() {
        return this == PUBLISHED || this == FAILED;
    }
}
