package com.github.salilvnair.convintel.context;

import com.github.salilvnair.convintel.history.HistorySnippet;
import com.github.salilvnair.convintel.model.ChatMessage;
import com.github.salilvnair.convintel.profile.ProfileContext;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable, structured form of a bundle while it is being fitted into the budget.
 */
@Getter
final class ContextDraft {

    private final String intentText;
    private final String stageText;
    private final ProfileContext profile;
    private int profileSummaries;
    private boolean profileDropped;
    /** Best score first. */
    private final List<HistorySnippet> snippets;
    private final List<ChatMessage> workingMemory;
    private final Instant now;
    private final Set<ContextSection> trimmed = EnumSet.noneOf(ContextSection.class);

    ContextDraft(String intentText,
                 String stageText,
                 ProfileContext profile,
                 List<HistorySnippet> snippets,
                 List<ChatMessage> workingMemory,
                 Instant now) {
        this.intentText = intentText;
        this.stageText = stageText;
        this.profile = profile == null ? ProfileContext.empty() : profile;
        this.profileSummaries = this.profile.recentSummaries().size();
        this.profileDropped = this.profile.isEmpty();
        this.snippets = new ArrayList<>(snippets == null ? List.of() : snippets);
        this.snippets.sort(Comparator.comparingDouble(HistorySnippet::score).reversed());
        this.workingMemory = new ArrayList<>(workingMemory == null ? List.of() : workingMemory);
        this.now = now;
    }

    boolean dropOldestMessage(int floor) {
        if (workingMemory.size() <= Math.max(0, floor)) {
            return false;
        }
        workingMemory.remove(0);
        trimmed.add(ContextSection.WORKING_MEMORY);
        return true;
    }

    boolean dropWeakestSnippet() {
        if (snippets.isEmpty()) {
            return false;
        }
        snippets.remove(snippets.size() - 1);
        trimmed.add(ContextSection.HISTORY);
        return true;
    }

    boolean shrinkProfile() {
        if (profileDropped) {
            return false;
        }
        if (profileSummaries > 0) {
            profileSummaries--;
        }
        else {
            profileDropped = true;
        }
        trimmed.add(ContextSection.PROFILE);
        return true;
    }

    void markHardCut(ContextSection section) {
        trimmed.add(section);
    }
}
