package com.github.salilvnair.convintel.stage;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable list of committed stages for one session. Storage form:
 * {@code {"stage_history": [{"stage", "confidence", "timestamp"}], "current_stage": "..."}}.
 * {@code current_stage} is informational; the last committed entry is authoritative on read.
 */
@Slf4j
public record StageTrackerState(List<StageEvent> events) {

    public static final String KEY_HISTORY = "stage_history";
    public static final String KEY_CURRENT = "current_stage";
    public static final String KEY_STAGE = "stage";
    public static final String KEY_CONFIDENCE = "confidence";
    public static final String KEY_TIMESTAMP = "timestamp";

    private static final StageTrackerState EMPTY = new StageTrackerState(List.of());

    public StageTrackerState {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static StageTrackerState empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public ConversationStage currentStage() {
        return events.isEmpty() ? ConversationStage.GREETING : events.get(events.size() - 1).stage();
    }

    StageTrackerState append(StageEvent event, int maxEvents) {
        List<StageEvent> next = new ArrayList<>(events.size() + 1);
        next.addAll(events);
        next.add(event);
        int cap = Math.max(1, maxEvents);
        if (next.size() > cap) {
            next = next.subList(next.size() - cap, next.size());
        }
        return new StageTrackerState(next);
    }

    public Map<String, Object> toMap() {
        List<Map<String, Object>> history = new ArrayList<>(events.size());
        for (StageEvent event : events) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put(KEY_STAGE, event.stage().code());
            item.put(KEY_CONFIDENCE, event.confidence());
            item.put(KEY_TIMESTAMP, event.timestamp() == null ? null : event.timestamp().toString());
            history.add(item);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_HISTORY, history);
        data.put(KEY_CURRENT, currentStage().code());
        return data;
    }

    public static StageTrackerState fromMap(Map<String, Object> data) {
        return fromMap(data, Integer.MAX_VALUE);
    }

    /**
     * Reads the storage form keeping only the newest {@code maxEvents} entries. Confidence is clamped
     * to {@code [0, 1]}; entries without a finite confidence are skipped.
     */
    public static StageTrackerState fromMap(Map<String, Object> data, int maxEvents) {
        if (data == null || !(data.get(KEY_HISTORY) instanceof List<?> history)) {
            return empty();
        }
        List<StageEvent> events = new ArrayList<>(history.size());
        for (Object raw : history) {
            StageEvent event = readEvent(raw);
            if (event != null) {
                events.add(event);
            }
        }
        int cap = Math.max(1, maxEvents);
        if (events.size() > cap) {
            events = events.subList(events.size() - cap, events.size());
        }
        return new StageTrackerState(events);
    }

    private static StageEvent readEvent(Object raw) {
        if (!(raw instanceof Map<?, ?> item)) {
            return null;
        }
        Object rawStage = item.get(KEY_STAGE);
        ConversationStage stage = ConversationStage.from(rawStage == null ? null : String.valueOf(rawStage), null);
        if (stage == null || !(item.get(KEY_CONFIDENCE) instanceof Number confidence)
                || !Double.isFinite(confidence.doubleValue())) {
            log.debug("Skipping unreadable stage history entry {}", item);
            return null;
        }
        Instant timestamp = null;
        Object rawTimestamp = item.get(KEY_TIMESTAMP);
        if (rawTimestamp != null) {
            try {
                timestamp = Instant.parse(String.valueOf(rawTimestamp));
            } catch (DateTimeParseException e) {
                log.debug("Skipping stage history entry with bad timestamp={}", rawTimestamp);
                return null;
            }
        }
        return new StageEvent(stage, Math.max(0.0d, Math.min(1.0d, confidence.doubleValue())), timestamp);
    }
}
