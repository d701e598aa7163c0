package com.github.salilvnair.convintel.history;

import java.time.Instant;

/**
 * One past-conversation hit from semantic search; {@code score} is the collaborator's relevance in {@code [0, 1]}.
 */
public record HistorySnippet(String sessionId, String text, double score, Instant timestamp, String outcome) {
}
