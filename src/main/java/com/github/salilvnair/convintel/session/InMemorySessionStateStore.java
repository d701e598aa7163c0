package com.github.salilvnair.convintel.session;

import com.github.salilvnair.convintel.profile.ProfileScope;
import com.github.salilvnair.convintel.util.JsonUtil;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps session records as JSON text, so callers never share map instances across turns.
 */
public class InMemorySessionStateStore implements SessionStateStore {

    private final Map<String, String> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<Map<String, Object>> load(ProfileScope scope, String sessionId) {
        String json = sessions.get(key(scope, sessionId));
        return json == null ? Optional.empty() : Optional.of(JsonUtil.toMapOrEmpty(json));
    }

    @Override
    public void save(ProfileScope scope, String sessionId, Map<String, Object> state) {
        sessions.put(key(scope, sessionId), JsonUtil.toJson(state));
    }

    @Override
    public void clear(ProfileScope scope, String sessionId) {
        sessions.remove(key(scope, sessionId));
    }

    private static String key(ProfileScope scope, String sessionId) {
        return scope.tenantId() + ":" + scope.botId() + ":" + sessionId;
    }
}
