package com.github.salilvnair.convintel.intent;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable intent history of one session. Updates return a new instance.
 * <p>
 * {@link #toMap()} / {@link #fromMap(Map)} is the storage contract for the caller's session record:
 * {@code {"intent_history": [{"intent", "confidence", "message", "timestamp"}]}} with ISO-8601 timestamps.
 */
@Slf4j
public record IntentTrackerState(List<IntentEvent> events) {

    public static final String KEY_HISTORY = "intent_history";
    public static final String KEY_INTENT = "intent";
    public static final String KEY_CONFIDENCE = "confidence";
    public static final String KEY_MESSAGE = "message";
    public static final String KEY_TIMESTAMP = "timestamp";

    private static final IntentTrackerState EMPTY = new IntentTrackerState(List.of());

    public IntentTrackerState {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static IntentTrackerState empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public IntentEvent latest() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    IntentTrackerState append(IntentEvent event, int maxEvents) {
        List<IntentEvent> next = new ArrayList<>(events.size() + 1);
        next.addAll(events);
        next.add(event);
        int cap = Math.max(1, maxEvents);
        if (next.size() > cap) {
            next = next.subList(next.size() - cap, next.size());
        }
        return new IntentTrackerState(next);
    }

    public Map<String, Object> toMap() {
        List<Map<String, Object>> history = new ArrayList<>(events.size());
        for (IntentEvent event : events) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put(KEY_INTENT, event.intent().code());
            item.put(KEY_CONFIDENCE, event.confidence());
            item.put(KEY_MESSAGE, event.messageExcerpt());
            item.put(KEY_TIMESTAMP, event.timestamp() == null ? null : event.timestamp().toString());
            history.add(item);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_HISTORY, history);
        return data;
    }

    public static IntentTrackerState fromMap(Map<String, Object> data) {
        return fromMap(data, Integer.MAX_VALUE);
    }

    /**
     * Reads the storage form keeping only the newest {@code maxEvents} entries. Confidence is clamped
     * to {@code [0, 1]}; entries without a finite confidence are skipped.
     */
    public static IntentTrackerState fromMap(Map<String, Object> data, int maxEvents) {
        if (data == null || !(data.get(KEY_HISTORY) instanceof List<?> history)) {
            return empty();
        }
        List<IntentEvent> events = new ArrayList<>(history.size());
        for (Object raw : history) {
            IntentEvent event = readEvent(raw);
            if (event != null) {
                events.add(event);
            }
        }
        int cap = Math.max(1, maxEvents);
        if (events.size() > cap) {
            events = events.subList(events.size() - cap, events.size());
        }
        return new IntentTrackerState(events);
    }

    private static IntentEvent readEvent(Object raw) {
        if (!(raw instanceof Map<?, ?> item)) {
            return null;
        }
        IntentCategory intent = IntentCategory.from(asString(item.get(KEY_INTENT)), null);
        if (intent == null || !(item.get(KEY_CONFIDENCE) instanceof Number confidence)
                || !Double.isFinite(confidence.doubleValue())) {
            log.debug("Skipping unreadable intent history entry {}", item);
            return null;
        }
        Instant timestamp = null;
        String rawTimestamp = asString(item.get(KEY_TIMESTAMP));
        if (rawTimestamp != null) {
            try {
                timestamp = Instant.parse(rawTimestamp);
            } catch (DateTimeParseException e) {
                log.debug("Skipping intent history entry with bad timestamp={}", rawTimestamp);
                return null;
            }
        }
        return new IntentEvent(intent, Math.max(0.0d, Math.min(1.0d, confidence.doubleValue())), asString(item.get(KEY_MESSAGE)), timestamp);
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
