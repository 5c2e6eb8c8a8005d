package com.autoresearch.research.expansion;

import com.autoresearch.research.llm.GenerationConstraints;
import com.autoresearch.research.llm.GenerationException;
import com.autoresearch.research.llm.JsonProcessingService;
import com.autoresearch.research.llm.TextGenerationService;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.SubTopic;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.autoresearch.research.llm.ResearchPrompts.PURPOSE_SUB_TOPICS;
import static com.autoresearch.research.llm.ResearchPrompts.PURPOSE_SUB_TOPICS_RETRY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class QueryExpansionServiceTest {

    private TextGenerationService generator;
    private QueryExpansionService service;

    @BeforeEach
    void setUp() {
        generator = mock(TextGenerationService.class);
        service = new QueryExpansionService(new QueryAnalyzer(), generator,
                new JsonProcessingService(new ObjectMapper()));
    }

    @Test
    void testSubTopicsFromModel() {
        when(generator.generate(anyString(), argThat(purpose(PURPOSE_SUB_TOPICS)))).thenReturn("""
                Here you go:
                [{"label": "Efficacy", "keywords": ["vaccine", "efficacy"], "rationale": "core"},
                 {"label": "Side effects", "keywords": []},
                 {"label": "efficacy", "keywords": ["duplicate"]},
                 {"label": "  "}]
                """);

        Query query = service.expand("covid vaccine efficacy and side effects");

        assertEquals(List.of("Efficacy", "Side effects"), query.subTopics().stream().map(SubTopic::label).toList());
        assertEquals(List.of("vaccine", "efficacy"), query.subTopics().get(0).keywords());
        assertEquals(List.of("side", "effect"), query.subTopics().get(1).keywords());
        verify(generator, never()).generate(anyString(), argThat(purpose(PURPOSE_SUB_TOPICS_RETRY)));
    }

    @Test
    void testRetryWithSimplerPromptAfterFailure() {
        when(generator.generate(anyString(), argThat(purpose(PURPOSE_SUB_TOPICS))))
                .thenThrow(new GenerationException("timeout"));
        when(generator.generate(anyString(), argThat(purpose(PURPOSE_SUB_TOPICS_RETRY))))
                .thenReturn("[\"Efficacy\", \"Long term safety\"]");

        Query query = service.expand("covid vaccine efficacy");

        assertEquals(List.of("Efficacy", "Long term safety"), query.subTopics().stream().map(SubTopic::label).toList());
        assertEquals(List.of("long", "term", "safety"), query.subTopics().get(1).keywords());
    }

    @Test
    void testFallsBackToKeywordPairsWhenModelUnavailable() {
        when(generator.generate(anyString(), argThat(purpose(PURPOSE_SUB_TOPICS))))
                .thenReturn("not json at all");
        when(generator.generate(anyString(), argThat(purpose(PURPOSE_SUB_TOPICS_RETRY))))
                .thenThrow(new GenerationException("down"));

        Query query = service.expand("renewable energy storage costs policy incentives adoption rates");

        assertEquals(3, query.subTopics().size());
        assertEquals("renewable energy", query.subTopics().get(0).label());
        assertEquals(List.of("storage", "costs"), query.subTopics().get(1).keywords());
        verify(generator, times(2)).generate(anyString(), argThat(constraints -> true));
    }

    @Test
    void testFallbackForQueryWithoutKeywords() {
        Query query = new QueryAnalyzer().analyze("what is it");

        List<SubTopic> topics = service.fallbackSubTopics(query);

        assertEquals(1, topics.size());
        assertEquals("what is it", topics.get(0).label());
    }

    @Test
    void testAnalyzeOnlyMakesNoModelCall() {
        Query query = service.analyzeOnly("green tea health benefits");

        assertFalse(query.subTopics().isEmpty());
        verifyNoInteractions(generator);
    }

    private static org.mockito.ArgumentMatcher<GenerationConstraints> purpose(String purpose) {
        return constraints -> constraints != null && purpose.equals(constraints.purpose());
    }
}
