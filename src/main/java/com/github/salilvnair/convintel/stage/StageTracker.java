package com.github.salilvnair.convintel.stage;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless operations over {@link StageTrackerState} with regression hysteresis:
 * a proposal at or after the current stage commits at {@code forwardThreshold},
 * a proposal before it only above {@code regressionThreshold}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageTracker {

    private final ConvIntelProperties properties;

    public StageUpdate updateStage(StageTrackerState state, ConversationStage stage, double confidence) {
        StageTrackerState current = state == null ? StageTrackerState.empty() : state;
        if (stage == null) {
            return new StageUpdate(current, false, false);
        }
        ConvIntelProperties.Stage config = properties.getStage();
        ConversationStage previous = current.currentStage();
        boolean backward = stage.index() < previous.index();
        boolean commit = backward
                ? confidence > config.getRegressionThreshold()
                : confidence >= config.getForwardThreshold();
        if (!commit) {
            log.debug("Stage proposal held back stage={} confidence={} current={}", stage.code(), confidence, previous.code());
            return new StageUpdate(current, false, false);
        }
        double clamped = Math.max(0.0d, Math.min(1.0d, confidence));
        StageTrackerState next = current.append(new StageEvent(stage, clamped, Instant.now()), config.getMaxTrackedStages());
        boolean transitioned = stage != previous;
        if (transitioned) {
            log.debug("Stage transition {} -> {} confidence={}", previous.code(), stage.code(), clamped);
        }
        return new StageUpdate(next, true, transitioned);
    }

    public ConversationStage currentStage(StageTrackerState state) {
        return state == null ? ConversationStage.GREETING : state.currentStage();
    }

    public String getPromptGuidance(StageTrackerState state) {
        return currentStage(state).promptGuidance();
    }

    public List<ConversationStage> getStageProgression(StageTrackerState state) {
        if (state == null) {
            return List.of();
        }
        List<ConversationStage> progression = new ArrayList<>(state.events().size());
        for (StageEvent event : state.events()) {
            progression.add(event.stage());
        }
        return List.copyOf(progression);
    }

    /** Non-decreasing stage index over the last {@code progressWindow} commits. */
    public boolean isProgressing(StageTrackerState state) {
        List<ConversationStage> progression = getStageProgression(state);
        if (progression.size() < 2) {
            return true;
        }
        int window = Math.max(2, properties.getStage().getProgressWindow());
        List<ConversationStage> recent = progression.subList(Math.max(0, progression.size() - window), progression.size());
        for (int i = 1; i < recent.size(); i++) {
            if (recent.get(i).index() < recent.get(i - 1).index()) {
                return false;
            }
        }
        return true;
    }

    public boolean isStuck(StageTrackerState state) {
        List<ConversationStage> progression = getStageProgression(state);
        int window = Math.max(2, properties.getStage().getStuckWindow());
        if (progression.size() < window) {
            return false;
        }
        ConversationStage last = progression.get(progression.size() - 1);
        for (ConversationStage stage : progression.subList(progression.size() - window, progression.size())) {
            if (stage != last) {
                return false;
            }
        }
        return true;
    }

    /** Number of trailing commits in the current stage, 0 when nothing was committed. */
    public int getStageDuration(StageTrackerState state) {
        List<ConversationStage> progression = getStageProgression(state);
        if (progression.isEmpty()) {
            return 0;
        }
        ConversationStage last = progression.get(progression.size() - 1);
        int duration = 0;
        for (int i = progression.size() - 1; i >= 0 && progression.get(i) == last; i--) {
            duration++;
        }
        return duration;
    }
}
