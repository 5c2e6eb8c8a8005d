package com.autoresearch.stream;

import com.autoresearch.research.model.Stage;
import org.springframework.lang.Nullable;

import java.time.Instant;

public record StreamEvent(
        long id,
        Instant timestamp,
        String type,
        @Nullable Stage stage,
        String message,
        @Nullable Object data
) {
    public static final String TYPE_STAGE = "stage";
    public static final String TYPE_PROGRESS = "progress";
    public static final String TYPE_RUN_CANCEL = "run-cancel";
    public static final String TYPE_RUN_COMPLETE = "run-complete";

    public boolean isTerminal() {
        return TYPE_RUN_COMPLETE.equals(type);
    }
}
