package com.autoresearch.research.service;

import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.Tier;

import java.util.List;

/**
 * Read-only identity and budget lookup, consulted once when a run starts.
 */
public interface BudgetProvider {

    Tier tierFor(String userId);

    Budget resolveBudget(String userId, ResearchMode mode);

    List<ResearchMode> availableModes(Tier tier);
}
