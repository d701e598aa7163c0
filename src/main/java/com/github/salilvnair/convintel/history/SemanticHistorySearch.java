package com.github.salilvnair.convintel.history;

import com.github.salilvnair.convintel.profile.ProfileScope;
import com.github.salilvnair.convintel.profile.SessionSummary;

import java.util.List;

/**
 * Vector search over past conversation summaries, provided by the host application.
 */
public interface SemanticHistorySearch {

    /**
     * @param profileId restricts hits to one user's conversations when not null
     * @return at most {@code topK} hits with {@code score >= minScore}, best first
     */
    List<HistorySnippet> search(ProfileScope scope, String profileId, String query, int topK, double minScore);

    default void index(ProfileScope scope, String profileId, SessionSummary summary) {
    }
}
