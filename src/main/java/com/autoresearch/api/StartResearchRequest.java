package com.autoresearch.api;

import jakarta.validation.constraints.NotBlank;

public record StartResearchRequest(
        @NotBlank String query,
        String mode,
        String userId,
        Boolean includePartial
) {
}
