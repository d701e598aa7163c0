package com.github.salilvnair.convintel.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read model handed to the context assembler. {@code recentSummaries} is newest first.
 */
public record ProfileContext(
        String profileId,
        String email,
        String phone,
        Map<String, String> facts,
        Map<String, String> preferences,
        BehaviorMetrics behavior,
        List<SessionSummary> recentSummaries,
        String formattedPrompt
) {

    public ProfileContext {
        facts = facts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        preferences = preferences == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
        recentSummaries = recentSummaries == null ? List.of() : List.copyOf(recentSummaries);
        formattedPrompt = formattedPrompt == null ? "" : formattedPrompt;
    }

    public static ProfileContext empty() {
        return new ProfileContext(null, null, null, null, null, null, null, "");
    }

    public boolean isEmpty() {
        return formattedPrompt.isBlank();
    }
}
