package com.autoresearch.research.handoff;

import com.autoresearch.research.llm.GenerationConstraints;
import com.autoresearch.research.llm.GenerationException;
import com.autoresearch.research.llm.TextGenerationService;
import com.autoresearch.research.model.Budget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.autoresearch.research.llm.ResearchPrompts.*;

/**
 * Optional polish pass. A failed edit keeps the draft.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmReportEditor implements ReportEditor {

    private final TextGenerationService textGenerationService;

    @Override
    public String edit(String draft, Budget budget) {
        try {
            String edited = textGenerationService.generate(draft,
                    GenerationConstraints.of(PURPOSE_EDIT, EDIT_SYSTEM_PROMPT).withMaxWords(budget.maxWords()));
            return WordLimiter.limit(edited, budget.maxWords());
        } catch (GenerationException ex) {
            log.warn("Edit pass failed, keeping draft: {}", ex.getMessage());
            return draft;
        }
    }
}
