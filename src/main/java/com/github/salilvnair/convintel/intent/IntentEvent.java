package com.github.salilvnair.convintel.intent;

import java.time.Instant;

public record IntentEvent(IntentCategory intent, double confidence, String messageExcerpt, Instant timestamp) {
}
