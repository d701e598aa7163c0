package com.github.salilvnair.convintel.intent;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.convintel.support.TestConstants.USER_TEXT_PRICES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntentTrackerTest {

    private ConvIntelProperties properties;
    private IntentTracker tracker;

    @BeforeEach
    void setUp() {
        properties = new ConvIntelProperties();
        tracker = new IntentTracker(properties);
    }

    @Test
    void flowAndDominantIntentFollowRecencyWeighting() {
        IntentTrackerState state = IntentTrackerState.empty();
        state = tracker.addIntent(state, IntentCategory.GREETING, 0.9d, "hi");
        state = tracker.addIntent(state, IntentCategory.INQUIRY, 0.8d, "what is it");
        state = tracker.addIntent(state, IntentCategory.PRICING, 0.85d, USER_TEXT_PRICES);

        assertEquals(List.of(IntentCategory.GREETING, IntentCategory.INQUIRY, IntentCategory.PRICING), tracker.getIntentFlow(state));
        assertEquals(IntentCategory.PRICING, tracker.getDominantIntent(state));
        assertEquals(IntentCategory.COMMITMENT, tracker.predictNextIntent(state));
    }

    @Test
    void emptyHistoryHasNoDominantOrPredictedIntent() {
        assertNull(tracker.getDominantIntent(IntentTrackerState.empty()));
        assertNull(tracker.predictNextIntent(IntentTrackerState.empty()));
        assertNull(tracker.getDominantIntent(null));
        assertTrue(tracker.getIntentFlow(null).isEmpty());
    }

    @Test
    void closingHasNoPredictedFollowUp() {
        IntentTrackerState state = tracker.addIntent(IntentTrackerState.empty(), IntentCategory.CLOSING, 0.9d, "bye");

        assertEquals(IntentCategory.CLOSING, tracker.getDominantIntent(state));
        assertNull(tracker.predictNextIntent(state));
    }

    @Test
    void equalScoresResolveToEarlierCategory() {
        IntentTrackerState state = new IntentTrackerState(List.of(
                new IntentEvent(IntentCategory.PRICING, 0.5d, "a", null),
                new IntentEvent(IntentCategory.TECHNICAL, 0.45d, "b", null)
        ));

        assertEquals(IntentCategory.TECHNICAL, tracker.getDominantIntent(state));
    }

    @Test
    void addIntentClampsConfidenceAndCapsExcerpt() {
        properties.getIntent().setExcerptMaxChars(10);

        IntentTrackerState state = tracker.addIntent(IntentTrackerState.empty(), IntentCategory.SUPPORT, 1.7d, "  my integration is broken again  ");

        IntentEvent event = state.latest();
        assertEquals(1.0d, event.confidence());
        assertEquals("my integra", event.messageExcerpt());
    }

    @Test
    void addIntentReturnsNewStateAndKeepsOriginal() {
        IntentTrackerState original = IntentTrackerState.empty();

        IntentTrackerState next = tracker.addIntent(original, IntentCategory.INQUIRY, 0.5d, "what");

        assertTrue(original.isEmpty());
        assertEquals(1, next.events().size());
        assertSame(original, tracker.addIntent(original, (IntentCategory) null, 0.5d, "ignored"));
    }

    @Test
    void historyIsCappedToMostRecentEvents() {
        properties.getIntent().setMaxTrackedIntents(3);
        IntentTrackerState state = IntentTrackerState.empty();
        for (IntentCategory category : List.of(IntentCategory.GREETING, IntentCategory.INQUIRY, IntentCategory.TECHNICAL, IntentCategory.PRICING)) {
            state = tracker.addIntent(state, category, 0.6d, category.code());
        }

        assertEquals(List.of(IntentCategory.INQUIRY, IntentCategory.TECHNICAL, IntentCategory.PRICING), tracker.getIntentFlow(state));
    }

    @Test
    void mapRoundTripPreservesFlow() {
        IntentTrackerState state = tracker.addIntent(IntentTrackerState.empty(), IntentCategory.GREETING, 0.45d, "hello");
        state = tracker.addIntent(state, IntentCategory.PRICING, 0.85d, USER_TEXT_PRICES);

        IntentTrackerState restored = IntentTrackerState.fromMap(state.toMap());

        assertEquals(state, restored);
        assertEquals(tracker.getIntentFlow(state), tracker.getIntentFlow(restored));
    }

    @Test
    void fromMapSkipsUnknownAndMalformedEntries() {
        List<Object> history = new ArrayList<>();
        history.add(entry("pricing", 0.8d, "2026-01-05T10:15:30Z"));
        history.add(entry("shopping", 0.9d, "2026-01-05T10:16:30Z"));
        history.add(entry("closing", "high", "2026-01-05T10:17:30Z"));
        history.add(entry("inquiry", 0.4d, "yesterday"));
        history.add("not a map");
        Map<String, Object> data = Map.of(IntentTrackerState.KEY_HISTORY, history);

        IntentTrackerState restored = IntentTrackerState.fromMap(data);

        assertEquals(List.of(IntentCategory.PRICING), tracker.getIntentFlow(restored));
        assertTrue(IntentTrackerState.fromMap(null).isEmpty());
        assertTrue(IntentTrackerState.fromMap(Map.of()).isEmpty());
    }

    @Test
    void fromMapClampsConfidenceAndKeepsNewestEntries() {
        List<Object> history = new ArrayList<>();
        history.add(entry("pricing", 7.5d, "2026-01-05T10:15:30Z"));
        history.add(entry("technical", -2.0d, "2026-01-05T10:16:30Z"));
        history.add(entry("objection", Double.NaN, "2026-01-05T10:17:30Z"));
        history.add(entry("closing", 0.6d, "2026-01-05T10:18:30Z"));
        Map<String, Object> data = Map.of(IntentTrackerState.KEY_HISTORY, history);

        IntentTrackerState all = IntentTrackerState.fromMap(data);
        IntentTrackerState capped = IntentTrackerState.fromMap(data, 2);

        assertEquals(List.of(1.0d, 0.0d, 0.6d), all.events().stream().map(IntentEvent::confidence).toList());
        assertEquals(List.of(IntentCategory.TECHNICAL, IntentCategory.CLOSING), tracker.getIntentFlow(capped));
    }

    private static Map<String, Object> entry(String intent, Object confidence, String timestamp) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put(IntentTrackerState.KEY_INTENT, intent);
        item.put(IntentTrackerState.KEY_CONFIDENCE, confidence);
        item.put(IntentTrackerState.KEY_MESSAGE, "text");
        item.put(IntentTrackerState.KEY_TIMESTAMP, timestamp);
        return item;
    }
}
