package com.github.salilvnair.convintel.stage;

import com.github.salilvnair.convintel.intent.IntentCategory;

import java.util.Locale;

/**
 * Funnel stages in progression order; {@link #index()} is used for forward/backward comparisons.
 */
public enum ConversationStage {
    GREETING("Be welcoming and ask how you can help."),
    DISCOVERY("Ask clarifying questions to understand their needs."),
    SOLUTION("Explain relevant features and benefits."),
    PRICING("Present pricing clearly, emphasize value."),
    OBJECTION_HANDLING("Address concerns empathetically, provide reassurance."),
    CLOSING("Guide towards clear next steps, be helpful not pushy.");

    private final String promptGuidance;

    ConversationStage(String promptGuidance) {
        this.promptGuidance = promptGuidance;
    }

    public int index() {
        return ordinal();
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String promptGuidance() {
        return promptGuidance;
    }

    public static ConversationStage from(String raw, ConversationStage fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ConversationStage stage : values()) {
            if (stage.name().equals(normalized)) {
                return stage;
            }
        }
        return fallback;
    }

    public static ConversationStage forIntent(IntentCategory intent) {
        if (intent == null) {
            return DISCOVERY;
        }
        return switch (intent) {
            case GREETING -> GREETING;
            case INQUIRY -> DISCOVERY;
            case TECHNICAL, COMPARISON, SUPPORT -> SOLUTION;
            case PRICING -> PRICING;
            case OBJECTION -> OBJECTION_HANDLING;
            case COMMITMENT, FEEDBACK, CLOSING -> CLOSING;
        };
    }
}
