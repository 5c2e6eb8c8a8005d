package com.autoresearch.research.service;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.cache.CacheHit;
import com.autoresearch.research.cache.CachedResultSet;
import com.autoresearch.research.cache.SimilarityCache;
import com.autoresearch.research.expansion.QueryExpansionService;
import com.autoresearch.research.gap.AbsorbOutcome;
import com.autoresearch.research.gap.GapController;
import com.autoresearch.research.gap.GapDecision;
import com.autoresearch.research.gap.WorkingSet;
import com.autoresearch.research.handoff.CitationFormatter;
import com.autoresearch.research.handoff.ReportEditor;
import com.autoresearch.research.handoff.ReportPublisher;
import com.autoresearch.research.handoff.ReportWriter;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.BudgetRemaining;
import com.autoresearch.research.model.Claim;
import com.autoresearch.research.model.FailureReason;
import com.autoresearch.research.model.FanOutResult;
import com.autoresearch.research.model.GapState;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.Report;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.ResearchResult;
import com.autoresearch.research.model.RunMetadata;
import com.autoresearch.research.model.RunStatus;
import com.autoresearch.research.model.Stage;
import com.autoresearch.research.model.WorkingSetSnapshot;
import com.autoresearch.research.search.FanOutSession;
import com.autoresearch.research.search.SearchFanOutService;
import com.autoresearch.research.verify.FactVerificationService;
import com.autoresearch.research.verify.VerificationOutcome;
import com.autoresearch.stream.ResearchStreamService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one run through its stages:
 * EXPANDING, SEARCHING (repeated while the gap controller asks for more), VERIFYING, FINALIZING,
 * EDITING (premium only), CITING and PUBLISHED, or FAILED from any of them.
 * <p>
 * The sequencer owns the working set of a run and is the only place that decides whether premium-only
 * stages are reachable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResearchSequencer {

    private static final int FIRST_ROUND_VARIANTS = 2;

    private final SimilarityCache cache;
    private final QueryExpansionService expansionService;
    private final SearchFanOutService fanOutService;
    private final GapController gapController;
    private final FactVerificationService verificationService;
    private final ReportWriter reportWriter;
    private final ReportEditor reportEditor;
    private final CitationFormatter citationFormatter;
    private final ReportPublisher reportPublisher;
    private final ResearchStreamService streamService;
    private final ResearchMetricsService metricsService;
    private final ResearchProperties properties;
    private final Clock clock;

    /**
     * A free user asking for a premium-only mode keeps that mode's source and word limits but gets no more
     * search rounds than the widest mode open to every tier.
     */
    public Budget effectiveBudget(Budget resolved) {
        if (resolved.tier().isPremium() || !properties.getModeSettings(resolved.mode()).isPremiumOnly()) {
            return resolved;
        }
        int openModeRounds = 1;
        for (ResearchMode mode : ResearchMode.values()) {
            ResearchProperties.ModeSettings settings = properties.getModeSettings(mode);
            if (!settings.isPremiumOnly()) {
                openModeRounds = Math.max(openModeRounds, settings.getMaxIterations());
            }
        }
        int cap = Math.min(resolved.maxIterations(), openModeRounds);
        return resolved.withMaxIterations(cap);
    }

    public ResearchResult run(RunState state) {
        if (state.budget().maxIterations() < properties.getModeSettings(state.mode()).getMaxIterations()) {
            state.note("Search rounds capped to " + state.budget().maxIterations() + " for tier "
                    + state.budget().tier());
        }
        try {
            Optional<CacheHit> hit = cache.lookup(state.queryText(), state.mode());
            if (hit.isPresent()) {
                return fromCache(state, hit.get());
            }
            return research(state);
        } catch (RunTimeoutException ex) {
            log.warn("Run {} timed out in stage {}.", state.runId(), state.stage());
            return failed(state, FailureReason.TIMEOUT);
        } catch (RunCancelledException ex) {
            log.info("Run {} cancelled in stage {}.", state.runId(), state.stage());
            return failed(state, FailureReason.CANCELLED);
        } catch (RuntimeException ex) {
            log.error("Run {} failed in stage {}: {}", state.runId(), state.stage(), ex.getMessage(), ex);
            state.note("Internal error: " + ex.getMessage());
            return failed(state, FailureReason.INTERNAL);
        }
    }

    private ResearchResult research(RunState state) {
        Budget budget = state.budget();

        transition(state, Stage.EXPANDING, "Expanding query");
        Query query = expansionService.expand(state.queryText());
        state.query(query);
        Map<String, Object> expansion = new LinkedHashMap<>();
        expansion.put("intent", query.intent().name());
        expansion.put("subTopics", query.subTopics().stream().map(topic -> topic.label()).toList());
        expansion.put("variants", query.variants());
        streamService.emitProgress(state.runId(), Stage.EXPANDING, "Query expanded", expansion);
        state.checkpoint(clock);

        transition(state, Stage.SEARCHING, "Searching providers");
        WorkingSet workingSet = new WorkingSet();
        FanOutSession session = new FanOutSession(state.runId(), budget.tier(), budget.resultsPerQuery(),
                state.cancelSignal());
        List<String> variants = query.variants().stream().limit(FIRST_ROUND_VARIANTS).toList();
        GapDecision decision;
        while (true) {
            searchRound(state, query, workingSet, session, variants);
            decision = gapController.evaluate(workingSet, query, budget, state.iterations(), state.deadline());
            state.publish(workingSet.snapshot());
            if (decision.state() != GapState.NEEDS_MORE) {
                break;
            }
            streamService.emitProgress(state.runId(), Stage.SEARCHING,
                    "Coverage gap on '" + decision.targetSubTopic() + "'",
                    Map.of("refinedQuery", decision.refinedQuery(), "round", state.iterations() + 1));
            variants = List.of(decision.refinedQuery());
        }

        if (workingSet.isEmpty()) {
            state.note("No provider returned usable sources");
            return failed(state, FailureReason.NO_SOURCES);
        }

        transition(state, Stage.VERIFYING, "Verifying claims");
        VerificationOutcome verification = verificationService.verify(query, workingSet.snapshot(), budget);
        state.checkpoint(clock);
        if (verification.needsExtraRound() && verification.weakestSubTopic() != null
                && state.iterations() < budget.maxIterations()) {
            String refined = gapController.refinedQuery(verification.weakestSubTopic(), query);
            state.note("Extra search round for weakly supported '" + verification.weakestSubTopic() + "'");
            transition(state, Stage.SEARCHING, "Searching again for weakly supported claims");
            searchRound(state, query, workingSet, session, List.of(refined));
            decision = gapController.evaluate(workingSet, query, budget, state.iterations(), state.deadline());
            state.publish(workingSet.snapshot());
            transition(state, Stage.VERIFYING, "Re-verifying claims");
            verification = verificationService.verify(query, workingSet.snapshot(), budget);
            state.checkpoint(clock);
        }

        RunStatus status = decision.state() == GapState.SUFFICIENT ? RunStatus.SUFFICIENT : RunStatus.PARTIAL;
        if (status == RunStatus.PARTIAL) {
            state.note("Coverage incomplete: stopped with " + decision.state());
        }
        WorkingSetSnapshot snapshot = workingSet.snapshot();
        Report report = handOff(state, query, snapshot, verification.claims());
        state.checkpoint(clock);
        if (!snapshot.isEmpty()) {
            cache.store(state.queryText(), state.mode(),
                    new CachedResultSet(query, snapshot, verification.claims(), status));
        }
        return complete(state, status, query, snapshot, verification.claims(), report, false, null,
                decision.state());
    }

    private void searchRound(RunState state, Query query, WorkingSet workingSet, FanOutSession session,
                             List<String> variants) {
        state.checkpoint(clock);
        Budget budget = state.budget();
        BudgetRemaining remaining = new BudgetRemaining(gapController.sourceRoom(workingSet, query, budget),
                state.deadline());
        FanOutResult result = fanOutService.search(variants, remaining, session);
        state.iterations(state.iterations() + 1);
        state.addProviderFailures(result.failures().size());
        AbsorbOutcome outcome = gapController.absorb(workingSet, result.records(), query, budget);
        state.publish(workingSet.snapshot());

        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("round", state.iterations());
        progress.put("providers", result.providersQueried());
        progress.put("added", outcome.added());
        progress.put("merged", outcome.merged());
        progress.put("evicted", outcome.evicted());
        progress.put("failures", result.failures().size());
        progress.put("sources", workingSet.size());
        streamService.emitProgress(state.runId(), Stage.SEARCHING,
                "Round " + state.iterations() + " gathered " + result.records().size() + " results", progress);
        log.debug("Run {} round {}: {} results, {} added, {} evicted, {} failures.", state.runId(),
                state.iterations(), result.records().size(), outcome.added(), outcome.evicted(),
                result.failures().size());
        state.checkpoint(clock);
    }

    private ResearchResult fromCache(RunState state, CacheHit hit) {
        CachedResultSet cached = hit.entry().resultSet();
        transition(state, Stage.EXPANDING, "Analyzing query");
        Query query = expansionService.analyzeOnly(state.queryText())
                .withSubTopics(cached.query().subTopics());
        state.query(query);

        transition(state, Stage.SEARCHING, hit.exact() ? "Serving cached results"
                : "Serving cached results for a " + hit.similarityPercent() + "% similar query");
        if (!hit.exact()) {
            state.note("Served from cache: " + hit.similarityPercent() + "% similar to '"
                    + hit.entry().queryText() + "'");
        } else {
            state.note("Served from cache");
        }
        state.publish(cached.workingSet());
        state.checkpoint(clock);

        Report report = handOff(state, query, cached.workingSet(), cached.claims());
        return complete(state, cached.status(), query, cached.workingSet(), cached.claims(), report, true,
                hit.similarity(), null);
    }

    private Report handOff(RunState state, Query query, WorkingSetSnapshot snapshot, List<Claim> claims) {
        Budget budget = state.budget();
        transition(state, Stage.FINALIZING, "Drafting report");
        String text = reportWriter.write(query, snapshot, claims, budget);
        state.checkpoint(clock);

        boolean edited = false;
        if (budget.premiumFeaturesEnabled()) {
            transition(state, Stage.EDITING, "Editing report");
            String revised = reportEditor.edit(text, budget);
            edited = !revised.equals(text);
            text = revised;
            state.checkpoint(clock);
        }

        transition(state, Stage.CITING, "Formatting citations");
        CitationFormatter.Citations citations = citationFormatter.format(snapshot.sources(), budget);
        Report draft = new Report(text, citations.references(), citations.style(), edited, null);
        state.checkpoint(clock);
        String publicationId = reportPublisher.publish(state.runId(), draft);
        return new Report(text, citations.references(), citations.style(), edited, publicationId);
    }

    private ResearchResult complete(RunState state, RunStatus status, Query query, WorkingSetSnapshot snapshot,
                                    List<Claim> claims, Report report, boolean fromCache,
                                    @Nullable Double similarity, @Nullable GapState gapState) {
        state.checkpoint(clock);
        ResearchResult result = new ResearchResult(state.runId(), status, null, query, snapshot, claims, report,
                metadata(state, fromCache, similarity, gapState));
        ResearchResult terminal = state.finish(result);
        if (terminal != result) {
            log.debug("Run {} already ended with {}; dropping late {} result.", state.runId(), terminal.status(),
                    status);
            return terminal;
        }
        state.stage(Stage.PUBLISHED);
        streamService.emitStage(state.runId(), Stage.PUBLISHED, "Report published");
        streamService.emitRunComplete(state.runId(), Stage.PUBLISHED, status, null);
        metricsService.recordRunCompleted(status);
        log.info("Run {} published with status {} ({} sources, {} rounds, cache={}).", state.runId(), status,
                snapshot.size(), state.iterations(), fromCache);
        return result;
    }

    /**
     * Builds the FAILED result; the last published working set is attached only when the caller allows
     * partial results. A run that already ended keeps its first result.
     */
    ResearchResult failed(RunState state, FailureReason reason) {
        Stage failedIn = state.stage();
        WorkingSetSnapshot partial = state.user().includePartial() ? state.lastSnapshot()
                : WorkingSetSnapshot.empty();
        ResearchResult result = new ResearchResult(state.runId(), RunStatus.FAILED, reason, state.query(), partial,
                List.of(), null, metadata(state, false, null, null));
        ResearchResult terminal = state.finish(result);
        if (terminal != result) {
            log.debug("Run {} already ended with {}; ignoring {}.", state.runId(), terminal.status(), reason.code());
            return terminal;
        }
        state.stage(Stage.FAILED);
        streamService.emitStage(state.runId(), Stage.FAILED,
                "Run failed" + (failedIn != null ? " during " + failedIn : "") + ": " + reason.code());
        streamService.emitRunComplete(state.runId(), Stage.FAILED, RunStatus.FAILED, reason.code());
        metricsService.recordRunCompleted(RunStatus.FAILED);
        return result;
    }

    private RunMetadata metadata(RunState state, boolean fromCache, @Nullable Double similarity,
                                 @Nullable GapState gapState) {
        Duration elapsed = Duration.between(state.startedAt(), clock.instant());
        return new RunMetadata(state.budget().tier(), state.mode(), fromCache, similarity, state.iterations(),
                elapsed, state.providerFailures(), gapState, state.notes());
    }

    private void transition(RunState state, Stage stage, String message) {
        state.checkpoint(clock);
        state.stage(stage);
        streamService.emitStage(state.runId(), stage, message);
    }
}
