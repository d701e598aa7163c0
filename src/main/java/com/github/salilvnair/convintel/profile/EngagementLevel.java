package com.github.salilvnair.convintel.profile;

import java.util.Locale;

public enum EngagementLevel {
    NEW,
    ACTIVE,
    ENGAGED,
    DISENGAGED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EngagementLevel from(String raw, EngagementLevel fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (EngagementLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return fallback;
    }
}
