package com.autoresearch.research.handoff;

import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.SourceRecord;

import java.util.List;

public interface CitationFormatter {

    Citations format(List<SourceRecord> sources, Budget budget);

    record Citations(String style, List<String> references) {
        public Citations {
            references = List.copyOf(references);
        }
    }
}
