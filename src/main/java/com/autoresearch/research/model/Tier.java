package com.autoresearch.research.model;

public enum Tier {
    FREE, PREMIUM;

    public boolean isPremium() {
        return this == PREMIUM;
    }
}
