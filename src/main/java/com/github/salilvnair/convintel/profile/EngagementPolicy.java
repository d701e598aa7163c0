package com.github.salilvnair.convintel.profile;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Pure rule table from session count and average sentiment to an {@link EngagementLevel}.
 */
@Component
@RequiredArgsConstructor
public class EngagementPolicy {

    private final ConvIntelProperties properties;

    public EngagementLevel evaluate(int totalSessions, Double averageSentiment) {
        ConvIntelProperties.Engagement rules = properties.getProfile().getEngagement();
        if (totalSessions <= 1) {
            return EngagementLevel.NEW;
        }
        if (averageSentiment != null
                && averageSentiment < rules.getDisengagedBelow()
                && totalSessions >= rules.getDisengagedMinSessions()) {
            return EngagementLevel.DISENGAGED;
        }
        if (totalSessions >= rules.getEngagedMinSessions() && averageSentiment != null && averageSentiment > 0.0d) {
            return EngagementLevel.ENGAGED;
        }
        return EngagementLevel.ACTIVE;
    }
}
