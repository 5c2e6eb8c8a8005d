package com.autoresearch.research.handoff;

import com.autoresearch.research.llm.GenerationConstraints;
import com.autoresearch.research.llm.GenerationException;
import com.autoresearch.research.llm.TextGenerationService;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.Claim;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.SourceRecord;
import com.autoresearch.research.model.WorkingSetSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.autoresearch.research.llm.ResearchPrompts.*;

@Component
@RequiredArgsConstructor
@Slf4j
public class LlmReportWriter implements ReportWriter {

    private final TextGenerationService textGenerationService;

    @Override
    public String write(Query query, WorkingSetSnapshot workingSet, List<Claim> claims, Budget budget) {
        String prompt = draftPrompt(query, workingSet, claims);
        String draft;
        try {
            draft = textGenerationService.generate(prompt,
                    GenerationConstraints.of(PURPOSE_DRAFT, DRAFT_SYSTEM_PROMPT).withMaxWords(budget.maxWords()));
        } catch (GenerationException ex) {
            log.warn("Draft generation failed for '{}': {}", query.rawText(), ex.getMessage());
            try {
                draft = textGenerationService.generate(prompt,
                        GenerationConstraints.of(PURPOSE_DRAFT_RETRY, DRAFT_RETRY_SYSTEM_PROMPT)
                                .withMaxWords(budget.maxWords()));
            } catch (GenerationException retryEx) {
                log.warn("Draft retry failed for '{}', using findings summary: {}", query.rawText(),
                        retryEx.getMessage());
                draft = templated(query, workingSet, claims);
            }
        }
        return WordLimiter.limit(draft, budget.maxWords());
    }

    private String draftPrompt(Query query, WorkingSetSnapshot workingSet, List<Claim> claims) {
        StringBuilder prompt = new StringBuilder("Question: ").append(query.rawText()).append("\n\nFindings:\n");
        for (Claim claim : claims) {
            prompt.append("- ").append(claim.subTopic()).append(" (confidence ")
                    .append(Math.round(claim.confidence())).append("): ").append(claim.statement()).append('\n');
        }
        prompt.append("\nSources:\n");
        int index = 1;
        for (SourceRecord source : workingSet.sources()) {
            prompt.append('[').append(index++).append("] ").append(source.title()).append(" - ")
                    .append(source.url()).append('\n');
        }
        return prompt.toString();
    }

    private String templated(Query query, WorkingSetSnapshot workingSet, List<Claim> claims) {
        StringBuilder text = new StringBuilder("Research summary: ").append(query.rawText()).append("\n\n");
        for (Claim claim : claims) {
            text.append(claim.subTopic()).append(". ").append(claim.statement()).append("\n\n");
        }
        text.append("Based on ").append(workingSet.size()).append(workingSet.size() == 1 ? " source." : " sources.");
        return text.toString().trim();
    }
}
