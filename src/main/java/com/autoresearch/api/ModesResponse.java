package com.autoresearch.api;

import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.Tier;

import java.util.List;

public record ModesResponse(
        String userId,
        Tier tier,
        List<ResearchMode> modes
) {
}
