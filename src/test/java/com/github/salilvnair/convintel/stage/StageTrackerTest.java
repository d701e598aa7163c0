package com.github.salilvnair.convintel.stage;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageTrackerTest {

    private StageTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new StageTracker(new ConvIntelProperties());
    }

    @Test
    void forwardProgressionIsCommitted() {
        StageUpdate discovery = tracker.updateStage(StageTrackerState.empty(), ConversationStage.DISCOVERY, 0.8d);
        StageUpdate pricing = tracker.updateStage(discovery.state(), ConversationStage.PRICING, 0.9d);

        assertTrue(discovery.committed());
        assertTrue(discovery.transitioned());
        assertEquals(List.of(ConversationStage.DISCOVERY, ConversationStage.PRICING), tracker.getStageProgression(pricing.state()));
        assertEquals(ConversationStage.PRICING, pricing.currentStage());
        assertTrue(tracker.isProgressing(pricing.state()));
    }

    @Test
    void emptyStateDefaultsToGreeting() {
        StageTrackerState empty = StageTrackerState.empty();

        assertEquals(ConversationStage.GREETING, tracker.currentStage(empty));
        assertEquals("Be welcoming and ask how you can help.", tracker.getPromptGuidance(empty));
        assertEquals(0, tracker.getStageDuration(empty));
        assertTrue(tracker.isProgressing(empty));
        assertFalse(tracker.isStuck(empty));
    }

    @Test
    void lowConfidenceForwardProposalIsHeldBack() {
        StageTrackerState state = tracker.updateStage(StageTrackerState.empty(), ConversationStage.DISCOVERY, 0.8d).state();

        StageUpdate weak = tracker.updateStage(state, ConversationStage.SOLUTION, 0.4d);
        StageUpdate threshold = tracker.updateStage(state, ConversationStage.SOLUTION, 0.5d);

        assertFalse(weak.committed());
        assertSame(state, weak.state());
        assertTrue(threshold.committed());
        assertEquals(ConversationStage.SOLUTION, threshold.currentStage());
    }

    @Test
    void regressionNeedsVeryHighConfidence() {
        StageTrackerState state = tracker.updateStage(StageTrackerState.empty(), ConversationStage.DISCOVERY, 0.8d).state();
        state = tracker.updateStage(state, ConversationStage.PRICING, 0.9d).state();

        StageUpdate held = tracker.updateStage(state, ConversationStage.DISCOVERY, 0.85d);
        StageUpdate boundary = tracker.updateStage(state, ConversationStage.DISCOVERY, 0.9d);
        StageUpdate regressed = tracker.updateStage(state, ConversationStage.DISCOVERY, 0.95d);

        assertFalse(held.committed());
        assertEquals(ConversationStage.PRICING, held.currentStage());
        assertFalse(boundary.committed());
        assertTrue(regressed.committed());
        assertEquals(ConversationStage.DISCOVERY, regressed.currentStage());
        assertFalse(tracker.isProgressing(regressed.state()));
    }

    @Test
    void repeatedStageIsCommittedWithoutTransition() {
        StageTrackerState state = tracker.updateStage(StageTrackerState.empty(), ConversationStage.PRICING, 0.7d).state();

        StageUpdate again = tracker.updateStage(state, ConversationStage.PRICING, 0.6d);

        assertTrue(again.committed());
        assertFalse(again.transitioned());
        assertEquals(2, tracker.getStageDuration(again.state()));
    }

    @Test
    void fiveCommitsInOneStageMeanStuck() {
        StageTrackerState state = StageTrackerState.empty();
        for (int i = 0; i < 4; i++) {
            state = tracker.updateStage(state, ConversationStage.PRICING, 0.8d).state();
        }
        assertFalse(tracker.isStuck(state));

        state = tracker.updateStage(state, ConversationStage.PRICING, 0.8d).state();

        assertTrue(tracker.isStuck(state));
        assertEquals(5, tracker.getStageDuration(state));
    }

    @Test
    void durationCountsOnlyTrailingCommits() {
        StageTrackerState state = tracker.updateStage(StageTrackerState.empty(), ConversationStage.DISCOVERY, 0.8d).state();
        state = tracker.updateStage(state, ConversationStage.DISCOVERY, 0.8d).state();
        state = tracker.updateStage(state, ConversationStage.SOLUTION, 0.8d).state();

        assertEquals(1, tracker.getStageDuration(state));
    }

    @Test
    void mapRoundTripKeepsCurrentStage() {
        StageTrackerState state = tracker.updateStage(StageTrackerState.empty(), ConversationStage.DISCOVERY, 0.8d).state();
        state = tracker.updateStage(state, ConversationStage.PRICING, 0.9d).state();

        Map<String, Object> data = state.toMap();
        StageTrackerState restored = StageTrackerState.fromMap(data);

        assertEquals("pricing", data.get(StageTrackerState.KEY_CURRENT));
        assertEquals(state, restored);
        assertEquals(ConversationStage.PRICING, tracker.currentStage(restored));
    }

    @Test
    void fromMapClampsConfidenceAndKeepsNewestEntries() {
        List<Object> history = List.of(
                Map.of(StageTrackerState.KEY_STAGE, "discovery", StageTrackerState.KEY_CONFIDENCE, 3.0d),
                Map.of(StageTrackerState.KEY_STAGE, "solution", StageTrackerState.KEY_CONFIDENCE, Double.POSITIVE_INFINITY),
                Map.of(StageTrackerState.KEY_STAGE, "pricing", StageTrackerState.KEY_CONFIDENCE, -1.0d),
                Map.of(StageTrackerState.KEY_STAGE, "closing", StageTrackerState.KEY_CONFIDENCE, 0.7d)
        );
        Map<String, Object> data = Map.of(StageTrackerState.KEY_HISTORY, history);

        StageTrackerState all = StageTrackerState.fromMap(data);
        StageTrackerState capped = StageTrackerState.fromMap(data, 2);

        assertEquals(List.of(1.0d, 0.0d, 0.7d), all.events().stream().map(StageEvent::confidence).toList());
        assertEquals(List.of(ConversationStage.PRICING, ConversationStage.CLOSING), tracker.getStageProgression(capped));
    }
}
