package com.autoresearch.research.handoff;

import com.autoresearch.research.llm.GenerationConstraints;
import com.autoresearch.research.llm.GenerationException;
import com.autoresearch.research.llm.ResearchPrompts;
import com.autoresearch.research.llm.TextGenerationService;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.Claim;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.WorkingSetSnapshot;
import com.autoresearch.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatcher;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmReportWriterTest {

    private final Query query = TestData.query("green tea health benefits");
    private final WorkingSetSnapshot workingSet = new WorkingSetSnapshot(List.of(
            TestData.source("brave", "https://example.com/a", "Green tea study", "Green tea benefits", 80, 0.9)),
            Map.of());
    private final List<Claim> claims = List.of(
            new Claim("benefits", "Green tea may lower blood pressure.", List.of("https://example.com/a"), 40.0));

    private TextGenerationService textGenerationService;
    private LlmReportWriter writer;

    @BeforeEach
    void setUp() {
        textGenerationService = mock(TextGenerationService.class);
        writer = new LlmReportWriter(textGenerationService);
    }

    @Test
    void testDraftIsTrimmedToWordBudget() {
        when(textGenerationService.generate(contains("Green tea study"), any(GenerationConstraints.class)))
                .thenReturn("one two three four five six seven eight nine ten");

        String draft = writer.write(query, workingSet, claims, budget(5));

        assertEquals("one two three four five", draft);
    }

    @Test
    void testRetryUsedWhenFirstDraftFails() {
        when(textGenerationService.generate(anyString(), argThat(purpose(ResearchPrompts.PURPOSE_DRAFT))))
                .thenThrow(new GenerationException("draft generation failed: timed out"));
        when(textGenerationService.generate(anyString(), argThat(purpose(ResearchPrompts.PURPOSE_DRAFT_RETRY))))
                .thenReturn("Retried draft.");

        assertEquals("Retried draft.", writer.write(query, workingSet, claims, budget(100)));
    }

    @Test
    void testFindingsSummaryWhenModelUnavailable() {
        when(textGenerationService.generate(anyString(), any(GenerationConstraints.class)))
                .thenThrow(new GenerationException("unavailable"));

        String draft = writer.write(query, workingSet, claims, budget(100));

        assertTrue(draft.startsWith("Research summary: green tea health benefits"));
        assertTrue(draft.contains("Green tea may lower blood pressure."));
        assertTrue(draft.endsWith("Based on 1 source."));
    }

    @Test
    void testEditorKeepsDraftOnFailure() {
        LlmReportEditor editor = new LlmReportEditor(textGenerationService);
        when(textGenerationService.generate(anyString(), any(GenerationConstraints.class)))
                .thenThrow(new GenerationException("edit generation failed: quota"));

        assertEquals("Original draft.", editor.edit("Original draft.", budget(100)));
    }

    @Test
    void testEditorOutputTrimmedToWordBudget() {
        LlmReportEditor editor = new LlmReportEditor(textGenerationService);
        when(textGenerationService.generate(anyString(), any(GenerationConstraints.class)))
                .thenReturn("Polished one. Polished two three four.");

        assertEquals("Polished one.", editor.edit("draft", budget(3)));
    }

    private static Budget budget(int maxWords) {
        Budget base = TestData.premiumBudget(5, 3, 2);
        return new Budget(base.tier(), base.mode(), base.maxSources(), maxWords, base.maxIterations(),
                base.maxWallTime(), base.minCorroboration(), base.resultsPerQuery(), base.premiumFeaturesEnabled());
    }

    private static ArgumentMatcher<GenerationConstraints> purpose(String purpose) {
        return constraints -> constraints != null && purpose.equals(constraints.purpose());
    }
}
