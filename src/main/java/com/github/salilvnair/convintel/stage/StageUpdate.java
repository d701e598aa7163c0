package com.github.salilvnair.convintel.stage;

/**
 * @param committed    the proposal passed the commit rule and was recorded
 * @param transitioned the committed stage differs from the previous current stage
 */
public record StageUpdate(StageTrackerState state, boolean committed, boolean transitioned) {

    public ConversationStage currentStage() {
        return state.currentStage();
    }
}
