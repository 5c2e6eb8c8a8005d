package com.autoresearch.stream;

import com.autoresearch.research.model.RunStatus;
import com.autoresearch.research.model.Stage;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
public class ResearchStreamService {

    private final ResearchStreamHub hub;

    public ResearchStreamService(ResearchStreamHub hub) {
        this.hub = hub;
    }

    public String createRun() {
        return hub.createRun();
    }

    public void emitStage(String runId, Stage stage, String message) {
        hub.emit(runId, StreamEvent.TYPE_STAGE, stage, message, Map.of());
    }

    public void emitProgress(String runId, Stage stage, String message, Map<String, Object> data) {
        hub.emit(runId, StreamEvent.TYPE_PROGRESS, stage, message, data);
    }

    public void emitRunComplete(String runId, Stage stage, RunStatus status, @Nullable String reason) {
        Map<String, Object> data = new HashMap<>();
        data.put("status", status.name());
        if (reason != null) {
            data.put("reason", reason);
        }
        hub.emit(runId, StreamEvent.TYPE_RUN_COMPLETE, stage, "Run finished with status " + status, data);
    }

    public boolean cancelRun(String runId) {
        return hub.cancelRun(runId);
    }
}
