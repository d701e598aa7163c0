package com.github.salilvnair.convintel.context;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.history.HistorySnippet;
import com.github.salilvnair.convintel.history.HistorySnippetFormatter;
import com.github.salilvnair.convintel.model.ChatMessage;
import com.github.salilvnair.convintel.profile.ProfileContextFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link ContextDraft} and fits it into {@code maxChars}.
 * Reduction order: working memory (oldest first, down to the floor), history snippets (lowest
 * score first), profile (summaries, then the whole section), and finally a hard cut of the text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextBudgetTrimmer {

    private static final String SECTION_SEPARATOR = "\n\n";

    private final ConvIntelProperties properties;
    private final ProfileContextFormatter profileContextFormatter;

    Map<ContextSection, String> fit(ContextDraft draft) {
        ConvIntelProperties.Context config = properties.getContext();
        int maxChars = Math.max(0, config.getMaxChars());
        Map<ContextSection, String> sections = render(draft);
        while (length(sections) > maxChars && reduce(draft, config.getWorkingMemoryFloor())) {
            sections = render(draft);
        }
        if (length(sections) > maxChars) {
            sections = hardCut(draft, sections, maxChars);
        }
        if (!draft.getTrimmed().isEmpty()) {
            log.debug("Context trimmed sections={} chars={} budget={}", draft.getTrimmed(), length(sections), maxChars);
        }
        return sections;
    }

    static String join(Map<ContextSection, String> sections) {
        return String.join(SECTION_SEPARATOR, sections.values());
    }

    private boolean reduce(ContextDraft draft, int workingMemoryFloor) {
        return draft.dropOldestMessage(workingMemoryFloor)
                || draft.dropWeakestSnippet()
                || draft.shrinkProfile();
    }

    Map<ContextSection, String> render(ContextDraft draft) {
        Map<ContextSection, String> sections = new EnumMap<>(ContextSection.class);
        put(sections, ContextSection.INTENT, draft.getIntentText());
        put(sections, ContextSection.STAGE, draft.getStageText());
        if (!draft.isProfileDropped()) {
            put(sections, ContextSection.PROFILE, profileContextFormatter.render(
                    draft.getProfile(),
                    draft.getProfileSummaries(),
                    properties.getProfile().getContextMaxChars()
            ));
        }
        put(sections, ContextSection.HISTORY, renderSnippets(draft));
        put(sections, ContextSection.WORKING_MEMORY, renderMessages(draft.getWorkingMemory()));
        return sections;
    }

    private String renderSnippets(ContextDraft draft) {
        List<String> lines = new ArrayList<>();
        for (HistorySnippet snippet : draft.getSnippets()) {
            lines.add(HistorySnippetFormatter.format(snippet, draft.getNow()));
        }
        String text = String.join("\n\n", lines);
        int maxChars = properties.getContext().getHistoryMaxChars();
        return maxChars > 0 && text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    private static String renderMessages(List<ChatMessage> messages) {
        StringBuilder text = new StringBuilder();
        for (ChatMessage message : messages) {
            if (message == null || message.content() == null) {
                continue;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(message.isUser() ? "User: " : "Assistant: ").append(message.content().trim());
        }
        return text.toString();
    }

    private static void put(Map<ContextSection, String> sections, ContextSection section, String body) {
        if (body != null && !body.isBlank()) {
            sections.put(section, section.heading() + "\n" + body);
        }
    }

    /** Cuts the lowest-priority sections first until the joined text fits. */
    private Map<ContextSection, String> hardCut(ContextDraft draft, Map<ContextSection, String> sections, int maxChars) {
        Map<ContextSection, String> result = new EnumMap<>(sections);
        ContextSection[] order = ContextSection.values();
        for (int i = order.length - 1; i >= 0 && length(result) > maxChars; i--) {
            ContextSection section = order[i];
            String body = result.get(section);
            if (body == null) {
                continue;
            }
            int overflow = length(result) - maxChars;
            draft.markHardCut(section);
            if (overflow >= body.length()) {
                result.remove(section);
            }
            else {
                result.put(section, body.substring(0, body.length() - overflow));
            }
        }
        return result;
    }

    private static int length(Map<ContextSection, String> sections) {
        return join(sections).length();
    }
}
