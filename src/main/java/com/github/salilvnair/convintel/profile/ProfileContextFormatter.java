package com.github.salilvnair.convintel.profile;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a profile as a prompt block: known facts, preferences, engagement, previous
 * conversations (newest first). The block never exceeds the configured cap; the oldest listed
 * conversations are dropped first, then the text is cut.
 */
@Component
@RequiredArgsConstructor
public class ProfileContextFormatter {

    private static final List<String> LEADING_FACTS = List.of("name", "company");
    private static final String SECTION_SEPARATOR = "\n\n";

    private final ConvIntelProperties properties;

    public ProfileContext format(UserProfile profile) {
        if (profile == null) {
            return ProfileContext.empty();
        }
        List<SessionSummary> recent = newestFirst(profile.getSessionSummaries(), properties.getProfile().getContextSummaries());
        ProfileContext unrendered = new ProfileContext(
                profile.getProfileId(),
                profile.getEmail(),
                profile.getPhone(),
                profile.getFacts(),
                profile.getPreferences(),
                profile.getBehavior(),
                recent,
                null
        );
        String prompt = render(unrendered, recent.size(), properties.getProfile().getContextMaxChars());
        return new ProfileContext(
                unrendered.profileId(),
                unrendered.email(),
                unrendered.phone(),
                unrendered.facts(),
                unrendered.preferences(),
                unrendered.behavior(),
                recent,
                prompt
        );
    }

    /**
     * Renders with at most {@code summaryLimit} of the context's recent summaries and at most
     * {@code maxChars} characters.
     */
    public String render(ProfileContext context, int summaryLimit, int maxChars) {
        if (context == null || maxChars <= 0) {
            return "";
        }
        List<String> fixedSections = new ArrayList<>();
        addIfPresent(fixedSections, factsSection(context.facts()));
        addIfPresent(fixedSections, listSection("Preferences:", context.preferences()));
        addIfPresent(fixedSections, engagementSection(context.behavior()));

        List<SessionSummary> summaries = context.recentSummaries();
        int listed = Math.max(0, Math.min(summaryLimit, summaries.size()));
        String text = compose(fixedSections, summaries.subList(0, listed));
        while (text.length() > maxChars && listed > 0) {
            listed--;
            text = compose(fixedSections, summaries.subList(0, listed));
        }
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    private String compose(List<String> fixedSections, List<SessionSummary> summaries) {
        List<String> sections = new ArrayList<>(fixedSections);
        addIfPresent(sections, conversationsSection(summaries));
        return String.join(SECTION_SEPARATOR, sections);
    }

    private String factsSection(Map<String, String> facts) {
        if (facts == null || facts.isEmpty()) {
            return null;
        }
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String key : LEADING_FACTS) {
            if (facts.containsKey(key)) {
                ordered.put(key, facts.get(key));
            }
        }
        ordered.putAll(facts);
        return listSection("Known facts:", ordered);
    }

    private String listSection(String title, Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        StringBuilder section = new StringBuilder(title);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                continue;
            }
            section.append("\n- ").append(entry.getKey()).append(": ").append(entry.getValue());
        }
        return section.length() == title.length() ? null : section.toString();
    }

    private String engagementSection(BehaviorMetrics behavior) {
        if (behavior == null || behavior.getEngagementLevel() == null) {
            return null;
        }
        StringBuilder section = new StringBuilder("Engagement: ")
                .append(behavior.getEngagementLevel().code())
                .append(" (")
                .append(behavior.getTotalSessions())
                .append(" previous sessions)");
        if (behavior.getLastSentiment() != null) {
            section.append("\nLast interaction sentiment: ").append(sentimentLabel(behavior.getLastSentiment()));
        }
        return section.toString();
    }

    private String conversationsSection(List<SessionSummary> summaries) {
        if (summaries.isEmpty()) {
            return null;
        }
        StringBuilder section = new StringBuilder("Previous conversations:");
        int position = 1;
        for (SessionSummary summary : summaries) {
            section.append('\n').append(position++).append(". ").append(summary.summary() == null ? "" : summary.summary());
            if (!summary.keyTopics().isEmpty()) {
                section.append(" (Topics: ").append(String.join(", ", summary.keyTopics())).append(')');
            }
            if (summary.outcome() != null && !summary.outcome().isBlank()) {
                section.append(" - ").append(summary.outcome());
            }
        }
        return section.toString();
    }

    private static String sentimentLabel(double sentiment) {
        String label = sentiment > 0.0d ? "positive" : sentiment < 0.0d ? "negative" : "neutral";
        return label + String.format(Locale.ROOT, " (%.2f)", sentiment);
    }

    private static void addIfPresent(List<String> sections, String section) {
        if (section != null && !section.isBlank()) {
            sections.add(section);
        }
    }

    static List<SessionSummary> newestFirst(List<SessionSummary> chronological, int limit) {
        if (chronological == null || chronological.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<SessionSummary> reversed = new ArrayList<>(chronological);
        Collections.reverse(reversed);
        return List.copyOf(reversed.subList(0, Math.min(limit, reversed.size())));
    }
}
