package com.github.salilvnair.convintel.intent;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.model.ChatMessage;
import com.github.salilvnair.convintel.stage.ConversationStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based, per-message intent scoring.
 * <p>
 * Scores are kept in hundredths so that sums stay exact: every keyword hit adds
 * {@code keywordWeight}, every matching pattern adds {@code patternWeight}, and the
 * stage/turn context boost is only applied to categories that already scored.
 * The score is capped at 100 and reported as a confidence in {@code [0, 1]}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentClassifier {

    private static final int MAX_POINTS = 100;

    private final ConvIntelProperties properties;
    private final IntentLexiconRegistry lexiconRegistry;

    public IntentResult classify(String message, List<ChatMessage> history, ConversationStage currentStage) {
        return classify(message, history, currentStage, null);
    }

    /**
     * @param history prior turns, not including {@code message}
     */
    public IntentResult classify(String message,
                                 List<ChatMessage> history,
                                 ConversationStage currentStage,
                                 String declaredLocale) {
        String locale = properties.getIntent().getDefaultLocale();
        try {
            IntentLexicon lexicon = lexiconRegistry.resolve(declaredLocale, message);
            locale = lexicon.getLocale();
            if (message == null || message.isBlank()) {
                return IntentResult.fallback(locale);
            }
            Map<IntentCategory, CategoryScore> scores = score(lexicon, message);
            applyContextBoosts(scores, history, currentStage);
            IntentResult result = select(scores, locale);
            if (log.isDebugEnabled()) {
                log.debug("Intent classified intent={} confidence={} secondary={} locale={}",
                        result.intent().code(), result.confidence(),
                        result.secondaryIntent() == null ? null : result.secondaryIntent().code(), locale);
            }
            return result;
        }
        catch (Exception e) {
            log.error("Intent classification failed, using default intent. locale={}", locale, e);
            return IntentResult.fallback(locale);
        }
    }

    private Map<IntentCategory, CategoryScore> score(IntentLexicon lexicon, String message) {
        int keywordPoints = points(properties.getIntent().getKeywordWeight());
        int patternPoints = points(properties.getIntent().getPatternWeight());
        Map<IntentCategory, CategoryScore> scores = new EnumMap<>(IntentCategory.class);
        for (IntentCategory category : IntentCategory.values()) {
            CategoryScore score = new CategoryScore();
            for (Pattern keyword : lexicon.keywordPatterns(category)) {
                Matcher matcher = keyword.matcher(message);
                if (matcher.find()) {
                    score.points += keywordPoints;
                    score.keywords.add(matcher.group());
                }
            }
            for (Pattern pattern : lexicon.patterns(category)) {
                if (pattern.matcher(message).find()) {
                    score.points += patternPoints;
                }
            }
            scores.put(category, score);
        }
        return scores;
    }

    private void applyContextBoosts(Map<IntentCategory, CategoryScore> scores,
                                    List<ChatMessage> history,
                                    ConversationStage currentStage) {
        int boost = points(properties.getIntent().getContextBoost());
        if (ChatMessage.countUserMessages(history) == 0) {
            boostIfScored(scores, IntentCategory.GREETING, boost);
        }
        if (currentStage == ConversationStage.PRICING) {
            boostIfScored(scores, IntentCategory.PRICING, boost);
        }
        else if (currentStage == ConversationStage.CLOSING) {
            boostIfScored(scores, IntentCategory.COMMITMENT, boost);
            boostIfScored(scores, IntentCategory.OBJECTION, boost);
        }
    }

    private void boostIfScored(Map<IntentCategory, CategoryScore> scores, IntentCategory category, int boost) {
        CategoryScore score = scores.get(category);
        if (score.points > 0) {
            score.points += boost;
        }
    }

    private IntentResult select(Map<IntentCategory, CategoryScore> scores, String locale) {
        IntentCategory winner = null;
        IntentCategory runnerUp = null;
        for (IntentCategory category : IntentCategory.values()) {
            int points = capped(scores.get(category).points);
            if (winner == null || points > capped(scores.get(winner).points)) {
                runnerUp = winner;
                winner = category;
            }
            else if (runnerUp == null || points > capped(scores.get(runnerUp).points)) {
                runnerUp = category;
            }
        }
        int winnerPoints = capped(scores.get(winner).points);
        if (winnerPoints == 0) {
            return IntentResult.fallback(locale);
        }

        IntentCategory secondary = null;
        int runnerUpPoints = runnerUp == null ? 0 : capped(scores.get(runnerUp).points);
        int margin = points(properties.getIntent().getSecondaryMargin());
        if (runnerUpPoints > 0 && winnerPoints - runnerUpPoints <= margin) {
            secondary = runnerUp;
        }

        List<String> keywords = new ArrayList<>(scores.get(winner).keywords);
        int maxKeywords = Math.max(0, properties.getIntent().getMaxKeywords());
        if (keywords.size() > maxKeywords) {
            keywords = keywords.subList(0, maxKeywords);
        }
        return new IntentResult(winner, winnerPoints / (double) MAX_POINTS, secondary, keywords, locale);
    }

    private static int capped(int points) {
        return Math.min(points, MAX_POINTS);
    }

    private static int points(double weight) {
        return (int) Math.round(weight * MAX_POINTS);
    }

    private static final class CategoryScore {
        private int points;
        private final Set<String> keywords = new LinkedHashSet<>();
    }
}
