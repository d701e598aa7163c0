package com.github.salilvnair.convintel.profile;

import java.time.Instant;
import java.util.List;

public record SessionSummary(String sessionId, String summary, List<String> keyTopics, String outcome, Instant timestamp) {

    public SessionSummary {
        keyTopics = keyTopics == null ? List.of() : List.copyOf(keyTopics);
    }
}
