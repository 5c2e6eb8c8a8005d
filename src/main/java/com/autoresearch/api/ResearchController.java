package com.autoresearch.api;

import com.autoresearch.research.handoff.ReportPublisher;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.ResearchResult;
import com.autoresearch.research.model.Report;
import com.autoresearch.research.model.RunHandle;
import com.autoresearch.research.model.Tier;
import com.autoresearch.research.model.UserContext;
import com.autoresearch.research.service.ResearchEngine;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

@RestController
@RequestMapping("/api/research")
public class ResearchController {

    private static final String ANONYMOUS = "anonymous";

    private final ResearchEngine researchEngine;
    private final ReportPublisher reportPublisher;

    public ResearchController(ResearchEngine researchEngine, ReportPublisher reportPublisher) {
        this.researchEngine = researchEngine;
        this.reportPublisher = reportPublisher;
    }

    @PostMapping
    public ResponseEntity<StartResearchResponse> start(@Valid @RequestBody StartResearchRequest request) {
        ResearchMode mode;
        try {
            mode = ResearchMode.fromValue(request.mode());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }
        String userId = request.userId() == null || request.userId().isBlank() ? ANONYMOUS : request.userId();
        boolean includePartial = Boolean.TRUE.equals(request.includePartial());
        RunHandle handle = researchEngine.startRun(request.query(), mode, new UserContext(userId, includePartial));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new StartResearchResponse(handle.runId(), mode, handle.createdAt()));
    }

    /**
     * 200 with the result once the run has finished, 202 with the current stage while it is still running.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<?> result(@PathVariable String runId) {
        if (!researchEngine.exists(runId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + runId);
        }
        Optional<ResearchResult> result = researchEngine.getResult(runId);
        if (result.isPresent()) {
            return ResponseEntity.ok(result.get());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new RunStatusResponse(runId, researchEngine.currentStage(runId).orElse(null), false));
    }

    @PostMapping("/{runId}/cancel")
    public CancelRunResponse cancel(@PathVariable String runId) {
        return researchEngine.cancel(runId) ? CancelRunResponse.success() : CancelRunResponse.notFound();
    }

    @GetMapping("/modes")
    public ModesResponse modes(@RequestParam(required = false) String userId) {
        String user = userId == null || userId.isBlank() ? ANONYMOUS : userId;
        Tier tier = researchEngine.tierFor(user);
        return new ModesResponse(user, tier, researchEngine.availableModes(user));
    }

    @GetMapping("/reports/{publicationId}")
    public Report report(@PathVariable String publicationId) {
        return reportPublisher.find(publicationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Report not found: " + publicationId));
    }
}
