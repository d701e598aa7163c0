package com.github.salilvnair.convintel.profile;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class BehaviorMetrics {

    int totalSessions;
    long totalMessages;
    long totalDurationSeconds;
    /** Number of sessions that reported a sentiment; the weight of {@link #averageSentiment}. */
    int sentimentSamples;
    Double averageSentiment;
    Double lastSentiment;
    @Builder.Default
    EngagementLevel engagementLevel = EngagementLevel.NEW;

    public static BehaviorMetrics initial() {
        return BehaviorMetrics.builder().build();
    }
}
