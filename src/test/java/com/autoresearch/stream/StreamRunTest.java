package com.autoresearch.stream;

import com.autoresearch.research.model.Stage;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StreamRunTest {

    @Test
    void testNothingQueuedUntilConsumerClaims() {
        StreamRun run = new StreamRun("run-1");
        run.addEvent(StreamEvent.TYPE_STAGE, Stage.EXPANDING, "Expanding query", null, 10);
        run.addEvent(StreamEvent.TYPE_STAGE, Stage.SEARCHING, "Searching providers", null, 10);

        assertTrue(run.consumerQueue().isEmpty());

        assertTrue(run.claimConsumer());
        assertEquals(2, run.consumerQueue().size());

        run.addEvent(StreamEvent.TYPE_PROGRESS, Stage.SEARCHING, "Round 1", Map.of(), 10);
        assertEquals(3, run.consumerQueue().size());
        assertFalse(run.claimConsumer());
    }

    @Test
    void testLateClaimIsBoundedByReplayBuffer() {
        StreamRun run = new StreamRun("run-2");
        for (int index = 0; index < 25; index++) {
            run.addEvent(StreamEvent.TYPE_PROGRESS, Stage.SEARCHING, "Round " + index, null, 10);
        }

        run.claimConsumer();

        assertEquals(10, run.consumerQueue().size());
        assertEquals(16L, run.consumerQueue().peek().id());
    }
}
