package com.github.salilvnair.convintel.stage;

public record StageDetection(ConversationStage stage, double confidence) {
}
