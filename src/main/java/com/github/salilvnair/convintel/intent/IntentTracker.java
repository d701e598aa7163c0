package com.github.salilvnair.convintel.intent;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stateless operations over {@link IntentTrackerState}.
 * <p>
 * Dominant intent: for every category, sum {@code confidence * decay^age * weight} where the newest
 * event has age 0 and greeting/feedback/closing carry the reduced phatic weight. Highest sum wins,
 * ties go to the earlier category.
 */
@Component
@RequiredArgsConstructor
public class IntentTracker {

    private static final Set<IntentCategory> PHATIC = EnumSet.of(
            IntentCategory.GREETING,
            IntentCategory.FEEDBACK,
            IntentCategory.CLOSING
    );

    private static final Map<IntentCategory, IntentCategory> NEXT_INTENT = new EnumMap<>(Map.of(
            IntentCategory.GREETING, IntentCategory.INQUIRY,
            IntentCategory.INQUIRY, IntentCategory.TECHNICAL,
            IntentCategory.TECHNICAL, IntentCategory.PRICING,
            IntentCategory.PRICING, IntentCategory.COMMITMENT,
            IntentCategory.COMPARISON, IntentCategory.PRICING,
            IntentCategory.OBJECTION, IntentCategory.PRICING,
            IntentCategory.COMMITMENT, IntentCategory.CLOSING,
            IntentCategory.SUPPORT, IntentCategory.TECHNICAL,
            IntentCategory.FEEDBACK, IntentCategory.CLOSING
    ));

    private final ConvIntelProperties properties;

    public IntentTrackerState addIntent(IntentTrackerState state, IntentCategory intent, double confidence, String message) {
        IntentTrackerState current = state == null ? IntentTrackerState.empty() : state;
        if (intent == null) {
            return current;
        }
        double clamped = Math.max(0.0d, Math.min(1.0d, confidence));
        IntentEvent event = new IntentEvent(intent, clamped, excerpt(message), Instant.now());
        return current.append(event, properties.getIntent().getMaxTrackedIntents());
    }

    public IntentTrackerState addIntent(IntentTrackerState state, IntentResult result, String message) {
        if (result == null) {
            return state == null ? IntentTrackerState.empty() : state;
        }
        return addIntent(state, result.intent(), result.confidence(), message);
    }

    public List<IntentCategory> getIntentFlow(IntentTrackerState state) {
        if (state == null) {
            return List.of();
        }
        List<IntentCategory> flow = new ArrayList<>(state.events().size());
        for (IntentEvent event : state.events()) {
            flow.add(event.intent());
        }
        return List.copyOf(flow);
    }

    public IntentCategory getDominantIntent(IntentTrackerState state) {
        if (state == null || state.isEmpty()) {
            return null;
        }
        double decay = properties.getIntent().getRecencyDecay();
        double phaticWeight = properties.getIntent().getPhaticWeight();
        Map<IntentCategory, Double> scores = new EnumMap<>(IntentCategory.class);
        List<IntentEvent> events = state.events();
        for (int i = 0; i < events.size(); i++) {
            IntentEvent event = events.get(i);
            int age = events.size() - 1 - i;
            double weight = PHATIC.contains(event.intent()) ? phaticWeight : 1.0d;
            scores.merge(event.intent(), event.confidence() * Math.pow(decay, age) * weight, Double::sum);
        }
        IntentCategory dominant = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<IntentCategory, Double> entry : scores.entrySet()) {
            // EnumMap iterates in declaration order, so a strict comparison keeps the earlier category on ties
            if (entry.getValue() > best) {
                best = entry.getValue();
                dominant = entry.getKey();
            }
        }
        return dominant;
    }

    public IntentCategory predictNextIntent(IntentTrackerState state) {
        IntentCategory dominant = getDominantIntent(state);
        return dominant == null ? null : NEXT_INTENT.get(dominant);
    }

    private String excerpt(String message) {
        if (message == null) {
            return "";
        }
        int max = Math.max(0, properties.getIntent().getExcerptMaxChars());
        String trimmed = message.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max);
    }
}
