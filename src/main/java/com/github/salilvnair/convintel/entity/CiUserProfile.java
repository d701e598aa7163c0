package com.github.salilvnair.convintel.entity;

import com.github.salilvnair.convintel.entity.converter.SessionSummaryListJsonConverter;
import com.github.salilvnair.convintel.entity.converter.StringMapJsonConverter;
import com.github.salilvnair.convintel.profile.SessionSummary;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;

@Entity
@Table(
        name = "ci_user_profile",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_ci_profile_email", columnNames = {"tenant_id", "bot_id", "email"}),
                @UniqueConstraint(name = "uk_ci_profile_phone", columnNames = {"tenant_id", "bot_id", "phone"})
        },
        indexes = {
                @Index(name = "ix_ci_profile_updated", columnList = "tenant_id, bot_id, updated_at"),
                @Index(name = "ix_ci_profile_engagement", columnList = "tenant_id, bot_id, engagement_level")
        }
)
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class CiUserProfile {

    @Id
    @Column(name = "profile_id", length = 64)
    private String profileId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "bot_id", nullable = false)
    private String botId;

    @Column(name = "email")
    private String email;

    @Column(name = "phone")
    private String phone;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "ci_profile_visitor",
            joinColumns = @JoinColumn(name = "profile_id"),
            indexes = @Index(name = "ix_ci_profile_visitor", columnList = "visitor_id")
    )
    @Column(name = "visitor_id", nullable = false)
    private Set<String> visitorIds = new LinkedHashSet<>();

    @Builder.Default
    @Convert(converter = StringMapJsonConverter.class)
    @Column(name = "facts_json", columnDefinition = "text")
    private Map<String, String> facts = new LinkedHashMap<>();

    @Builder.Default
    @Convert(converter = StringMapJsonConverter.class)
    @Column(name = "preferences_json", columnDefinition = "text")
    private Map<String, String> preferences = new LinkedHashMap<>();

    @Builder.Default
    @Convert(converter = SessionSummaryListJsonConverter.class)
    @Column(name = "session_summaries_json", columnDefinition = "text")
    private List<SessionSummary> sessionSummaries = new ArrayList<>();

    /** Lower-cased email, phone and fact values, for operator search. */
    @Column(name = "search_text", columnDefinition = "text")
    private String searchText;

    @Column(name = "total_sessions", nullable = false)
    private int totalSessions;

    @Column(name = "total_messages", nullable = false)
    private long totalMessages;

    @Column(name = "total_duration_seconds", nullable = false)
    private long totalDurationSeconds;

    @Column(name = "sentiment_samples", nullable = false)
    private int sentimentSamples;

    @Column(name = "average_sentiment")
    private Double averageSentiment;

    @Column(name = "last_sentiment")
    private Double lastSentiment;

    @Column(name = "engagement_level", nullable = false, length = 32)
    private String engagementLevel;

    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "merged_into", length = 64)
    private String mergedInto;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
