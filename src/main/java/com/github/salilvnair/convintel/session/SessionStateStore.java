package com.github.salilvnair.convintel.session;

import com.github.salilvnair.convintel.profile.ProfileScope;

import java.util.Map;
import java.util.Optional;

/**
 * Opaque per-session record storage owned by the calling pipeline. Values are the plain maps
 * produced by {@link SessionTurnState#toMap()}.
 */
public interface SessionStateStore {

    Optional<Map<String, Object>> load(ProfileScope scope, String sessionId);

    void save(ProfileScope scope, String sessionId, Map<String, Object> state);

    void clear(ProfileScope scope, String sessionId);
}
