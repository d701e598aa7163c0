package com.github.salilvnair.convintel.context;

import com.github.salilvnair.convintel.model.ChatMessage;
import com.github.salilvnair.convintel.profile.ProfileScope;
import lombok.Builder;

import java.util.List;

/**
 * One turn's input. {@code history} holds the prior messages of the session, not {@code query}.
 * Any of {@code email}, {@code phone}, {@code visitorId} identifies the user; {@code locale} is optional.
 */
@Builder
public record ContextRequest(
        ProfileScope scope,
        String query,
        String sessionId,
        List<ChatMessage> history,
        String email,
        String phone,
        String visitorId,
        String locale
) {

    public ContextRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean hasIdentity() {
        return notBlank(email) || notBlank(phone) || notBlank(visitorId);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
