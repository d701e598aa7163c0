package com.github.salilvnair.convintel.model;

import java.time.Instant;
import java.util.List;

public record ChatMessage(String role, String content, Instant timestamp) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content, Instant.now());
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ROLE_ASSISTANT, content, Instant.now());
    }

    public boolean isUser() {
        return ROLE_USER.equalsIgnoreCase(role);
    }

    public static int countUserMessages(List<ChatMessage> history) {
        if (history == null) {
            return 0;
        }
        int count = 0;
        for (ChatMessage message : history) {
            if (message != null && message.isUser()) {
                count++;
            }
        }
        return count;
    }
}
