package com.autoresearch.research.handoff;

import com.autoresearch.research.model.Budget;

/**
 * EDITING collaborator, reached only when the budget enables premium features.
 */
public interface ReportEditor {

    String edit(String draft, Budget budget);
}
