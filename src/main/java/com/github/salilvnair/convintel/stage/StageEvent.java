package com.github.salilvnair.convintel.stage;

import java.time.Instant;

public record StageEvent(ConversationStage stage, double confidence, Instant timestamp) {
}
