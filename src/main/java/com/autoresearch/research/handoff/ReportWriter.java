package com.autoresearch.research.handoff;

import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.Claim;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.WorkingSetSnapshot;

import java.util.List;

/**
 * FINALIZING collaborator. Receives read-only copies and must stay within {@link Budget#maxWords()}.
 */
public interface ReportWriter {

    String write(Query query, WorkingSetSnapshot workingSet, List<Claim> claims, Budget budget);
}
