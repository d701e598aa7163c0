package com.github.salilvnair.convintel.stage;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.intent.IntentCategory;
import com.github.salilvnair.convintel.model.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Infers the funnel stage of a conversation.
 * <p>
 * The last {@code intentWindow} intents vote for the stage they map to, each vote worth
 * {@code decay^age}. Long conversations add a bias proportional to the stage index. Ties go to the
 * later stage. Without intent history the stage is guessed from the number of user messages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageDetector {

    private static final int STAGE_COUNT = ConversationStage.values().length;
    private static final int LAST_INDEX = STAGE_COUNT - 1;

    private final ConvIntelProperties properties;

    public StageDetection detect(List<ChatMessage> history,
                                 List<IntentCategory> intentHistory,
                                 Map<String, String> currentFacts) {
        try {
            boolean noHistory = history == null || history.isEmpty();
            boolean noIntents = intentHistory == null || intentHistory.isEmpty();
            if (noHistory && noIntents) {
                return new StageDetection(ConversationStage.GREETING, 1.0d);
            }
            int userMessages = ChatMessage.countUserMessages(history);
            StageDetection detection = noIntents
                    ? fromMessageCount(userMessages)
                    : fromIntents(intentHistory, userMessages);
            if (detection.stage() == ConversationStage.GREETING
                    && currentFacts != null && !currentFacts.isEmpty()
                    && userMessages > 1) {
                detection = new StageDetection(ConversationStage.DISCOVERY, detection.confidence());
            }
            return detection;
        }
        catch (Exception e) {
            log.error("Stage detection failed, defaulting to greeting", e);
            return new StageDetection(ConversationStage.GREETING, 0.0d);
        }
    }

    private StageDetection fromIntents(List<IntentCategory> intentHistory, int userMessages) {
        ConvIntelProperties.Stage config = properties.getStage();
        int window = Math.max(1, config.getIntentWindow());
        List<IntentCategory> recent = intentHistory.subList(Math.max(0, intentHistory.size() - window), intentHistory.size());

        double[] scores = new double[STAGE_COUNT];
        int[] support = new int[STAGE_COUNT];
        for (int i = 0; i < recent.size(); i++) {
            int age = recent.size() - 1 - i;
            int index = ConversationStage.forIntent(recent.get(i)).index();
            scores[index] += Math.pow(config.getRecencyDecay(), age);
            support[index]++;
        }

        int longConversation = Math.max(1, config.getLongConversationMessages());
        double lengthFactor = Math.min(userMessages / (double) longConversation, 1.0d) * config.getLengthBias();
        int best = -1;
        for (int index = 0; index < STAGE_COUNT; index++) {
            if (support[index] == 0) {
                continue;
            }
            scores[index] += lengthFactor * index / LAST_INDEX;
            if (best < 0 || scores[index] >= scores[best]) {
                best = index;
            }
        }
        double confidence = Math.min(1.0d, 0.6d + 0.2d * support[best]);
        return new StageDetection(ConversationStage.values()[best], confidence);
    }

    private StageDetection fromMessageCount(int userMessages) {
        if (userMessages <= 1) {
            return new StageDetection(ConversationStage.GREETING, 0.9d);
        }
        if (userMessages <= 2) {
            return new StageDetection(ConversationStage.GREETING, 0.7d);
        }
        if (userMessages <= 4) {
            return new StageDetection(ConversationStage.DISCOVERY, 0.6d);
        }
        if (userMessages <= 8) {
            return new StageDetection(ConversationStage.SOLUTION, 0.5d);
        }
        return new StageDetection(ConversationStage.PRICING, 0.5d);
    }
}
