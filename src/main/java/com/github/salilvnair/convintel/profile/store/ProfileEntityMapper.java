package com.github.salilvnair.convintel.profile.store;

import com.github.salilvnair.convintel.entity.CiUserProfile;
import com.github.salilvnair.convintel.profile.BehaviorMetrics;
import com.github.salilvnair.convintel.profile.EngagementLevel;
import com.github.salilvnair.convintel.profile.ProfileStatus;
import com.github.salilvnair.convintel.profile.UserProfile;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@UtilityClass
class ProfileEntityMapper {

    static UserProfile toDomain(CiUserProfile entity) {
        BehaviorMetrics behavior = BehaviorMetrics.builder()
                .totalSessions(entity.getTotalSessions())
                .totalMessages(entity.getTotalMessages())
                .totalDurationSeconds(entity.getTotalDurationSeconds())
                .sentimentSamples(entity.getSentimentSamples())
                .averageSentiment(entity.getAverageSentiment())
                .lastSentiment(entity.getLastSentiment())
                .engagementLevel(EngagementLevel.from(entity.getEngagementLevel(), EngagementLevel.NEW))
                .build();
        return UserProfile.builder()
                .profileId(entity.getProfileId())
                .tenantId(entity.getTenantId())
                .botId(entity.getBotId())
                .email(entity.getEmail())
                .phone(entity.getPhone())
                .visitorIds(entity.getVisitorIds() == null ? List.of() : List.copyOf(entity.getVisitorIds()))
                .facts(entity.getFacts() == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(entity.getFacts())))
                .preferences(entity.getPreferences() == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(entity.getPreferences())))
                .sessionSummaries(entity.getSessionSummaries() == null ? List.of() : List.copyOf(entity.getSessionSummaries()))
                .behavior(behavior)
                .status(entity.getStatus() == null ? ProfileStatus.ACTIVE : ProfileStatus.valueOf(entity.getStatus()))
                .mergedInto(entity.getMergedInto())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .version(entity.getVersion() == null ? 0L : entity.getVersion())
                .build();
    }

    /**
     * @param versioned {@code false} for inserts, so that the entity is persisted rather than merged
     */
    static CiUserProfile toEntity(UserProfile profile, boolean versioned) {
        BehaviorMetrics behavior = profile.getBehavior() == null ? BehaviorMetrics.initial() : profile.getBehavior();
        EngagementLevel level = behavior.getEngagementLevel() == null ? EngagementLevel.NEW : behavior.getEngagementLevel();
        return CiUserProfile.builder()
                .profileId(profile.getProfileId())
                .tenantId(profile.getTenantId())
                .botId(profile.getBotId())
                .email(profile.getEmail())
                .phone(profile.getPhone())
                .visitorIds(new LinkedHashSet<>(profile.getVisitorIds()))
                .facts(new LinkedHashMap<>(profile.getFacts()))
                .preferences(new LinkedHashMap<>(profile.getPreferences()))
                .sessionSummaries(new ArrayList<>(profile.getSessionSummaries()))
                .searchText(searchText(profile))
                .totalSessions(behavior.getTotalSessions())
                .totalMessages(behavior.getTotalMessages())
                .totalDurationSeconds(behavior.getTotalDurationSeconds())
                .sentimentSamples(behavior.getSentimentSamples())
                .averageSentiment(behavior.getAverageSentiment())
                .lastSentiment(behavior.getLastSentiment())
                .engagementLevel(level.code())
                .status(profile.getStatus().name())
                .mergedInto(profile.getMergedInto())
                .createdAt(profile.getCreatedAt())
                .updatedAt(profile.getUpdatedAt())
                .version(versioned ? profile.getVersion() : null)
                .build();
    }

    static String searchText(UserProfile profile) {
        StringBuilder text = new StringBuilder();
        if (profile.getEmail() != null) {
            text.append(profile.getEmail()).append(' ');
        }
        if (profile.getPhone() != null) {
            text.append(profile.getPhone()).append(' ');
        }
        profile.getFacts().values().forEach(value -> {
            if (value != null) {
                text.append(value).append(' ');
            }
        });
        return text.toString().trim().toLowerCase(Locale.ROOT);
    }
}
