package com.github.salilvnair.convintel.profile;

import lombok.Builder;

import java.time.Instant;

/**
 * Filters for operator profile search. {@code query} matches email, phone and fact values,
 * case-insensitively. {@code page} is zero based.
 */
@Builder
public record ProfileSearchCriteria(
        String query,
        EngagementLevel engagementLevel,
        Instant updatedAfter,
        int page,
        int limit
) {
}
