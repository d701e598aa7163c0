package com.github.salilvnair.convintel.context;

import lombok.Builder;

import java.util.List;

/**
 * What the calling pipeline learned about a finished session. {@code sentiment} is in {@code [-1, 1]}.
 */
@Builder
public record SessionOutcome(
        String summary,
        List<String> keyTopics,
        String outcome,
        Double sentiment,
        Long durationSeconds,
        Integer messageCount
) {
}
