package com.github.salilvnair.convintel.history;

import com.github.salilvnair.convintel.profile.ProfileScope;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Registered when the host application provides no search backend.
 */
@Slf4j
public class NoOpSemanticHistorySearch implements SemanticHistorySearch {

    @Override
    public List<HistorySnippet> search(ProfileScope scope, String profileId, String query, int topK, double minScore) {
        log.debug("No semantic history backend configured, returning no snippets");
        return List.of();
    }
}
