package com.autoresearch.api;

import com.autoresearch.research.model.Stage;

public record RunStatusResponse(
        String runId,
        Stage stage,
        boolean finished
) {
}
