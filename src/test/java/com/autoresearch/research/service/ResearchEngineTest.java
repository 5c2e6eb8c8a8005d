package com.autoresearch.research.service;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.FailureReason;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.ResearchResult;
import com.autoresearch.research.model.RunHandle;
import com.autoresearch.research.model.RunMetadata;
import com.autoresearch.research.model.RunStatus;
import com.autoresearch.research.model.Tier;
import com.autoresearch.research.model.UserContext;
import com.autoresearch.research.model.WorkingSetSnapshot;
import com.autoresearch.stream.ResearchStreamHub;
import com.autoresearch.stream.ResearchStreamService;
import com.autoresearch.stream.StreamEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResearchEngineTest {

    private ExecutorService executor;
    private ResearchProperties properties;
    private ResearchSequencer sequencer;
    private ResearchStreamHub hub;
    private ResearchStreamService streamService;
    private ResearchEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        properties = new ResearchProperties();
        properties.getTiers().setUsers(Map.of("alice", Tier.PREMIUM));
        sequencer = mock(ResearchSequencer.class);
        when(sequencer.effectiveBudget(any(Budget.class))).thenAnswer(returnsFirstArg());
        hub = new ResearchStreamHub(new ObjectMapper().findAndRegisterModules());
        streamService = new ResearchStreamService(hub);
        engine = new ResearchEngine(sequencer, new TierBudgetProvider(properties), streamService, hub, properties,
                executor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testBlankQueryRejected() {
        assertThrows(IllegalArgumentException.class, () -> engine.startRun("  ", ResearchMode.QUICK,
                UserContext.of("bob")));
    }

    @Test
    void testRunCompletesInBackground() {
        when(sequencer.run(any(RunState.class))).thenAnswer(invocation -> {
            RunState state = invocation.getArgument(0);
            return result(state, RunStatus.SUFFICIENT, null);
        });

        RunHandle handle = engine.startRun("green tea benefits", null, UserContext.of("alice"));
        Optional<ResearchResult> result = engine.awaitResult(handle.runId(), Duration.ofSeconds(5));

        assertTrue(result.isPresent());
        assertEquals(RunStatus.SUFFICIENT, result.get().status());
        assertEquals(ResearchMode.STANDARD, result.get().metadata().mode());
        assertEquals(Tier.PREMIUM, result.get().metadata().tier());
        assertTrue(engine.getResult(handle.runId()).isPresent());
        assertFalse(engine.cancel(handle.runId()));
    }

    @Test
    void testResultEmptyWhileRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(sequencer.run(any(RunState.class))).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return result(invocation.getArgument(0), RunStatus.PARTIAL, null);
        });

        RunHandle handle = engine.startRun("green tea benefits", ResearchMode.QUICK, UserContext.of("bob"));

        assertTrue(engine.getResult(handle.runId()).isEmpty());
        assertTrue(engine.exists(handle.runId()));
        release.countDown();
        assertEquals(RunStatus.PARTIAL, engine.awaitResult(handle.runId(), Duration.ofSeconds(5))
                .orElseThrow().status());
    }

    @Test
    void testCancelSignalsRunningRun() {
        when(sequencer.run(any(RunState.class))).thenAnswer(invocation -> {
            RunState state = invocation.getArgument(0);
            state.cancelSignal().get(5, TimeUnit.SECONDS);
            return result(state, RunStatus.FAILED, state.cancelReason());
        });
        RunHandle handle = engine.startRun("green tea benefits", ResearchMode.QUICK, UserContext.of("bob"));

        assertTrue(engine.cancel(handle.runId()));
        assertFalse(engine.cancel(handle.runId()));

        ResearchResult result = engine.awaitResult(handle.runId(), Duration.ofSeconds(5)).orElseThrow();
        assertEquals(FailureReason.CANCELLED, result.failureReason());
        assertTrue(hub.isCancelled(handle.runId()));
    }

    @Test
    void testOverrunningRunFailsWithTimeout() {
        properties.getModeSettings(ResearchMode.QUICK).setMaxWallTime(Duration.ofMillis(100));
        properties.setRunGrace(Duration.ofMillis(50));
        when(sequencer.run(any(RunState.class))).thenAnswer(invocation -> {
            Thread.sleep(3_000);
            return result(invocation.getArgument(0), RunStatus.SUFFICIENT, null);
        });
        when(sequencer.failed(any(RunState.class), eq(FailureReason.TIMEOUT))).thenAnswer(invocation ->
                result(invocation.getArgument(0), RunStatus.FAILED, FailureReason.TIMEOUT));

        RunHandle handle = engine.startRun("green tea benefits", ResearchMode.QUICK, UserContext.of("bob"));
        ResearchResult result = engine.awaitResult(handle.runId(), Duration.ofSeconds(2)).orElseThrow();

        assertEquals(RunStatus.FAILED, result.status());
        assertEquals(FailureReason.TIMEOUT, result.failureReason());
        verify(sequencer).failed(any(RunState.class), eq(FailureReason.TIMEOUT));
    }

    @Test
    void testUnknownRun() {
        assertThrows(UnknownRunException.class, () -> engine.getResult("missing"));
        assertThrows(UnknownRunException.class, () -> engine.streamEvents("missing"));
        assertFalse(engine.cancel("missing"));
        assertFalse(engine.exists("missing"));
    }

    @Test
    void testStreamEventsEndWithRunComplete() {
        when(sequencer.run(any(RunState.class))).thenAnswer(invocation -> {
            RunState state = invocation.getArgument(0);
            streamService.emitRunComplete(state.runId(), null, RunStatus.SUFFICIENT, null);
            return result(state, RunStatus.SUFFICIENT, null);
        });

        RunHandle handle = engine.startRun("green tea benefits", ResearchMode.QUICK, UserContext.of("bob"));
        List<StreamEvent> events = engine.streamEvents(handle.runId()).toList();

        assertEquals(1, events.size());
        assertEquals(StreamEvent.TYPE_RUN_COMPLETE, events.get(0).type());
    }

    @Test
    void testAvailableModesDependOnTier() {
        assertEquals(List.of(ResearchMode.QUICK, ResearchMode.STANDARD), engine.availableModes("bob"));
        assertEquals(3, engine.availableModes("alice").size());
        assertEquals(Tier.PREMIUM, engine.tierFor("alice"));
    }

    private static ResearchResult result(RunState state, RunStatus status, FailureReason reason) {
        RunMetadata metadata = new RunMetadata(state.budget().tier(), state.mode(), false, null, 0, Duration.ZERO,
                0, null, List.of());
        return new ResearchResult(state.runId(), status, reason, null, WorkingSetSnapshot.empty(), List.of(), null,
                metadata);
    }
}
