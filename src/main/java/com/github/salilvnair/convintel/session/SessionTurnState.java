package com.github.salilvnair.convintel.session;

import com.github.salilvnair.convintel.intent.IntentTrackerState;
import com.github.salilvnair.convintel.stage.StageTrackerState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the intelligence layer keeps between turns of one session.
 */
public record SessionTurnState(IntentTrackerState intentState, StageTrackerState stageState, String profileId) {

    public static final String KEY_INTENT = "intent_tracker";
    public static final String KEY_STAGE = "stage_tracker";
    public static final String KEY_PROFILE = "profile_id";

    public SessionTurnState {
        intentState = intentState == null ? IntentTrackerState.empty() : intentState;
        stageState = stageState == null ? StageTrackerState.empty() : stageState;
    }

    public static SessionTurnState empty() {
        return new SessionTurnState(null, null, null);
    }

    public SessionTurnState withIntentState(IntentTrackerState next) {
        return new SessionTurnState(next, stageState, profileId);
    }

    public SessionTurnState withStageState(StageTrackerState next) {
        return new SessionTurnState(intentState, next, profileId);
    }

    public SessionTurnState withProfileId(String next) {
        return new SessionTurnState(intentState, stageState, next);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_INTENT, intentState.toMap());
        data.put(KEY_STAGE, stageState.toMap());
        data.put(KEY_PROFILE, profileId);
        return data;
    }

    public static SessionTurnState fromMap(Map<String, Object> data) {
        return fromMap(data, Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    @SuppressWarnings("unchecked")
    public static SessionTurnState fromMap(Map<String, Object> data, int maxIntents, int maxStages) {
        if (data == null) {
            return empty();
        }
        IntentTrackerState intents = data.get(KEY_INTENT) instanceof Map<?, ?> raw
                ? IntentTrackerState.fromMap((Map<String, Object>) raw, maxIntents)
                : IntentTrackerState.empty();
        StageTrackerState stages = data.get(KEY_STAGE) instanceof Map<?, ?> raw
                ? StageTrackerState.fromMap((Map<String, Object>) raw, maxStages)
                : StageTrackerState.empty();
        Object profileId = data.get(KEY_PROFILE);
        return new SessionTurnState(intents, stages, profileId == null ? null : String.valueOf(profileId));
    }
}
