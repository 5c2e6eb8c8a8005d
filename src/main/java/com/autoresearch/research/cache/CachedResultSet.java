package com.autoresearch.research.cache;

import com.autoresearch.research.model.Claim;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.RunStatus;
import com.autoresearch.research.model.WorkingSetSnapshot;

import java.util.List;

public record CachedResultSet(
        Query query,
        WorkingSetSnapshot workingSet,
        List<Claim> claims,
        RunStatus status
) {
    public CachedResultSet {
        claims = claims == null ? List.of() : List.copyOf(claims);
    }
}
