package com.github.salilvnair.convintel.profile;

import java.util.Locale;

/**
 * Labels the calling pipeline may report instead of a raw score.
 */
public enum Sentiment {
    POSITIVE(1.0d),
    NEUTRAL(0.0d),
    NEGATIVE(-1.0d);

    private final double score;

    Sentiment(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    public static Sentiment from(String raw, Sentiment fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
