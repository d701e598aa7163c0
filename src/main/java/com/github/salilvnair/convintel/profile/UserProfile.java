package com.github.salilvnair.convintel.profile;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cross-session profile of one end user inside a {@link ProfileScope}.
 * Collections are immutable; {@code sessionSummaries} is chronological, oldest first.
 */
@Value
@Builder(toBuilder = true)
public class UserProfile {

    String profileId;
    String tenantId;
    String botId;
    String email;
    String phone;
    @Builder.Default
    List<String> visitorIds = List.of();
    @Builder.Default
    Map<String, String> facts = Map.of();
    @Builder.Default
    Map<String, String> preferences = Map.of();
    @Builder.Default
    List<SessionSummary> sessionSummaries = List.of();
    @Builder.Default
    BehaviorMetrics behavior = BehaviorMetrics.initial();
    @Builder.Default
    ProfileStatus status = ProfileStatus.ACTIVE;
    String mergedInto;
    Instant createdAt;
    Instant updatedAt;
    long version;

    public ProfileScope scope() {
        return new ProfileScope(tenantId, botId);
    }

    public boolean isActive() {
        return status == ProfileStatus.ACTIVE;
    }

    public String fact(String key) {
        return facts == null ? null : facts.get(key);
    }
}
