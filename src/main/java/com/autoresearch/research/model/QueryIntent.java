package com.autoresearch.research.model;

public enum QueryIntent {
    DEFINITION, HOW_TO, WHY, COMPARISON, PROS_CONS, EXAMPLES, STATISTICS, HISTORY, FUTURE, LOCATION, TIME, GENERAL
}
