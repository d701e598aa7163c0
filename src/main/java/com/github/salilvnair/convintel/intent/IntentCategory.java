package com.github.salilvnair.convintel.intent;

import java.util.Locale;

/**
 * Closed set of per-message intents. Declaration order is the tie-break priority:
 * earlier constants win equal scores.
 */
public enum IntentCategory {
    GREETING,
    INQUIRY,
    TECHNICAL,
    PRICING,
    COMPARISON,
    OBJECTION,
    COMMITMENT,
    SUPPORT,
    FEEDBACK,
    CLOSING;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IntentCategory from(String raw, IntentCategory fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (IntentCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return fallback;
    }
}
