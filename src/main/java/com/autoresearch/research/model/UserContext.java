package com.autoresearch.research.model;

/**
 * Who is asking. {@code includePartial} opts in to receiving the last working set of a failed run.
 */
public record UserContext(
        String userId,
        boolean includePartial
) {
    public static UserContext of(String userId) {
        return new UserContext(userId, false);
    }
}
