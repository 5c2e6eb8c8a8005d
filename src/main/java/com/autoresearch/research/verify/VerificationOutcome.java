package com.autoresearch.research.verify;

import com.autoresearch.research.model.Claim;
import org.springframework.lang.Nullable;

import java.util.List;

public record VerificationOutcome(
        List<Claim> claims,
        @Nullable String weakestSubTopic,
        boolean needsExtraRound
) {
    public VerificationOutcome {
        claims = List.copyOf(claims);
    }
}
