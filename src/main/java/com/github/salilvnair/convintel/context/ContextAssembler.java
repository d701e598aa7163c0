package com.github.salilvnair.convintel.context;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.history.HistorySnippet;
import com.github.salilvnair.convintel.history.SemanticHistorySearch;
import com.github.salilvnair.convintel.intent.IntentCategory;
import com.github.salilvnair.convintel.intent.IntentClassifier;
import com.github.salilvnair.convintel.intent.IntentResult;
import com.github.salilvnair.convintel.intent.IntentTracker;
import com.github.salilvnair.convintel.intent.IntentTrackerState;
import com.github.salilvnair.convintel.model.ChatMessage;
import com.github.salilvnair.convintel.profile.ProfileContext;
import com.github.salilvnair.convintel.profile.ProfileResolution;
import com.github.salilvnair.convintel.profile.ProfileScope;
import com.github.salilvnair.convintel.profile.SessionSummary;
import com.github.salilvnair.convintel.profile.UserProfileManager;
import com.github.salilvnair.convintel.session.SessionStateStore;
import com.github.salilvnair.convintel.session.SessionTurnState;
import com.github.salilvnair.convintel.stage.ConversationStage;
import com.github.salilvnair.convintel.stage.StageDetection;
import com.github.salilvnair.convintel.stage.StageDetector;
import com.github.salilvnair.convintel.stage.StageTracker;
import com.github.salilvnair.convintel.stage.StageUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the per-turn pipeline and produces the {@link ContextBundle} for the language model.
 * <p>
 * Each collaborator is called in isolation: a failure is logged and only its section is lost.
 * {@link #buildContext(ContextRequest)} never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextAssembler {

    private final IntentClassifier intentClassifier;
    private final IntentTracker intentTracker;
    private final StageDetector stageDetector;
    private final StageTracker stageTracker;
    private final UserProfileManager profileManager;
    private final SemanticHistorySearch historySearch;
    private final SessionStateStore sessionStateStore;
    private final ContextBudgetTrimmer budgetTrimmer;
    private final ConvIntelProperties properties;

    public ContextBundle buildContext(ProfileScope scope,
                                      String query,
                                      String sessionId,
                                      List<ChatMessage> history,
                                      String userEmail) {
        return buildContext(ContextRequest.builder()
                .scope(scope)
                .query(query)
                .sessionId(sessionId)
                .history(history)
                .email(userEmail)
                .build());
    }

    public ContextBundle buildContext(ContextRequest request) {
        long start = System.nanoTime();
        try {
            return assemble(request, start);
        }
        catch (Exception e) {
            log.error("Context assembly failed, returning minimal bundle sessionId={}",
                    request == null ? null : request.sessionId(), e);
            return minimalBundle(request, start);
        }
    }

    /**
     * Hands the finished session to the profile and the search index, then drops the session state.
     *
     * @return true when a linked profile received the summary and the metrics
     */
    public boolean finalizeSession(ProfileScope scope, String sessionId, SessionOutcome outcome) {
        if (scope == null || sessionId == null || outcome == null) {
            return false;
        }
        SessionTurnState state = loadState(scope, sessionId);
        String profileId = state.profileId();
        boolean stored = false;
        if (profileId != null) {
            SessionSummary summary = new SessionSummary(
                    sessionId,
                    outcome.summary(),
                    outcome.keyTopics(),
                    outcome.outcome(),
                    Instant.now()
            );
            boolean summarized = profileManager.addSessionSummary(profileId, summary).isPresent();
            boolean measured = profileManager.updateBehaviorMetrics(
                    profileId,
                    outcome.sentiment(),
                    outcome.durationSeconds(),
                    outcome.messageCount()
            ).isPresent();
            stored = summarized && measured;
            try {
                historySearch.index(scope, profileId, summary);
            }
            catch (Exception e) {
                log.warn("History indexing failed sessionId={} profileId={}: {}", sessionId, profileId, e.getMessage());
            }
        }
        else {
            log.debug("Session finalized without a linked profile sessionId={}", sessionId);
        }
        try {
            sessionStateStore.clear(scope, sessionId);
        }
        catch (Exception e) {
            log.warn("Session state clear failed sessionId={}: {}", sessionId, e.getMessage());
        }
        return stored;
    }

    private ContextBundle assemble(ContextRequest request, long start) {
        ProfileScope scope = request.scope();
        String query = request.query() == null ? "" : request.query();
        List<ChatMessage> history = request.history();
        SessionTurnState state = loadState(scope, request.sessionId());

        // intent
        ConversationStage stageBefore = stageTracker.currentStage(state.stageState());
        IntentResult intent = intentClassifier.classify(query, history, stageBefore, request.locale());
        IntentTrackerState intentState = intentTracker.addIntent(state.intentState(), intent, query);
        IntentCategory dominant = intentTracker.getDominantIntent(intentState);
        IntentCategory predicted = intentTracker.predictNextIntent(intentState);

        // profile
        String profileId = state.profileId();
        boolean newProfile = false;
        if (scope != null && request.hasIdentity()) {
            Optional<ProfileResolution> resolution = profileManager.getOrCreateProfileByVisitor(
                    scope, request.visitorId(), request.email(), request.phone(), null);
            if (resolution.isPresent()) {
                profileId = resolution.get().profile().getProfileId();
                newProfile = resolution.get().isNew();
            }
        }
        ProfileContext profileContext = profileId == null ? ProfileContext.empty() : profileManager.getProfileContext(profileId);

        // stage
        List<ChatMessage> withQuery = new ArrayList<>(history);
        withQuery.add(ChatMessage.user(query));
        StageDetection detection = stageDetector.detect(withQuery, intentTracker.getIntentFlow(intentState), profileContext.facts());
        StageUpdate stageUpdate = stageTracker.updateStage(state.stageState(), detection.stage(), detection.confidence());
        ConversationStage stage = stageUpdate.currentStage();
        boolean progressing = stageTracker.isProgressing(stageUpdate.state());
        boolean stuck = stageTracker.isStuck(stageUpdate.state());

        // history
        List<HistorySnippet> snippets = searchHistory(scope, profileId, query, request.sessionId());

        ConvIntelProperties.Context config = properties.getContext();
        ContextDraft draft = new ContextDraft(
                renderIntent(intent, dominant, predicted),
                renderStage(stage, latestConfidence(stageUpdate), stuck),
                profileContext,
                snippets,
                workingMemory(withQuery, config.getWorkingMemoryMessages()),
                Instant.now()
        );
        Map<ContextSection, String> sections = budgetTrimmer.fit(draft);

        saveState(scope, request.sessionId(), state
                .withIntentState(intentState)
                .withStageState(stageUpdate.state())
                .withProfileId(profileId));

        long buildTimeMs = elapsedMs(start);
        log.debug("Context built sessionId={} intent={} stage={} profileId={} snippets={} chars={} in {} ms",
                request.sessionId(), intent.intent().code(), stage.code(), profileId, snippets.size(),
                ContextBudgetTrimmer.join(sections).length(), buildTimeMs);
        return ContextBundle.builder()
                .promptContext(ContextBudgetTrimmer.join(sections))
                .sections(sections)
                .trimmedSections(List.copyOf(draft.getTrimmed()))
                .intent(intent)
                .dominantIntent(dominant)
                .predictedIntent(predicted)
                .stage(stage)
                .stageConfidence(latestConfidence(stageUpdate))
                .stageTransitioned(stageUpdate.transitioned())
                .progressing(progressing)
                .stuck(stuck)
                .stageGuidance(stage.promptGuidance())
                .profileId(profileId)
                .newProfile(newProfile)
                .historySnippets(List.copyOf(draft.getSnippets()))
                .buildTimeMs(buildTimeMs)
                .degraded(false)
                .build();
    }

    private SessionTurnState loadState(ProfileScope scope, String sessionId) {
        if (scope == null || sessionId == null) {
            return SessionTurnState.empty();
        }
        try {
            return sessionStateStore.load(scope, sessionId)
                    .map(data -> SessionTurnState.fromMap(
                            data,
                            properties.getIntent().getMaxTrackedIntents(),
                            properties.getStage().getMaxTrackedStages()))
                    .orElse(SessionTurnState.empty());
        }
        catch (Exception e) {
            log.warn("Session state load failed, starting fresh sessionId={}: {}", sessionId, e.getMessage());
            return SessionTurnState.empty();
        }
    }

    private void saveState(ProfileScope scope, String sessionId, SessionTurnState state) {
        if (scope == null || sessionId == null) {
            return;
        }
        try {
            sessionStateStore.save(scope, sessionId, state.toMap());
        }
        catch (Exception e) {
            log.warn("Session state save failed sessionId={}: {}", sessionId, e.getMessage());
        }
    }

    private List<HistorySnippet> searchHistory(ProfileScope scope, String profileId, String query, String sessionId) {
        if (scope == null || query.isBlank()) {
            return List.of();
        }
        ConvIntelProperties.Context config = properties.getContext();
        if (config.getHistoryTopK() <= 0) {
            return List.of();
        }
        try {
            List<HistorySnippet> hits = historySearch.search(scope, profileId, query, config.getHistoryTopK(), config.getHistoryMinScore());
            if (hits == null) {
                return List.of();
            }
            return hits.stream()
                    .filter(Objects::nonNull)
                    .filter(hit -> hit.score() >= config.getHistoryMinScore())
                    .filter(hit -> sessionId == null || !sessionId.equals(hit.sessionId()))
                    .sorted(Comparator.comparingDouble(HistorySnippet::score).reversed())
                    .limit(config.getHistoryTopK())
                    .toList();
        }
        catch (Exception e) {
            log.warn("History search failed profileId={}: {}", profileId, e.getMessage());
            return List.of();
        }
    }

    private static List<ChatMessage> workingMemory(List<ChatMessage> messages, int size) {
        int window = Math.max(0, size);
        return new ArrayList<>(messages.subList(Math.max(0, messages.size() - window), messages.size()));
    }

    private static String renderIntent(IntentResult intent, IntentCategory dominant, IntentCategory predicted) {
        StringBuilder text = new StringBuilder()
                .append("Current intent: ").append(intent.intent().code())
                .append(" (confidence ").append(decimal(intent.confidence())).append(')');
        if (intent.secondaryIntent() != null) {
            text.append("\nSecondary intent: ").append(intent.secondaryIntent().code());
        }
        if (dominant != null && dominant != intent.intent()) {
            text.append("\nDominant intent: ").append(dominant.code());
        }
        if (predicted != null) {
            text.append("\nLikely next intent: ").append(predicted.code());
        }
        return text.toString();
    }

    private static String renderStage(ConversationStage stage, double confidence, boolean stuck) {
        StringBuilder text = new StringBuilder()
                .append("Stage: ").append(stage.code())
                .append(" (confidence ").append(decimal(confidence)).append(')')
                .append("\nGuidance: ").append(stage.promptGuidance());
        if (stuck) {
            text.append("\nThe conversation has not moved past this stage for several turns; try a different approach.");
        }
        return text.toString();
    }

    private static double latestConfidence(StageUpdate update) {
        if (update.state().isEmpty()) {
            return 0.0d;
        }
        return update.state().events().get(update.state().events().size() - 1).confidence();
    }

    private ContextBundle minimalBundle(ContextRequest request, long start) {
        String locale = request == null ? null : request.locale();
        IntentResult intent = IntentResult.fallback(locale == null ? properties.getIntent().getDefaultLocale() : locale);
        List<ChatMessage> messages = new ArrayList<>(request == null ? List.of() : request.history());
        if (request != null && request.query() != null) {
            messages.add(ChatMessage.user(request.query()));
        }
        Map<ContextSection, String> sections = new EnumMap<>(ContextSection.class);
        try {
            ContextDraft draft = new ContextDraft(null, null, ProfileContext.empty(), List.of(),
                    workingMemory(messages, properties.getContext().getWorkingMemoryMessages()), Instant.now());
            sections = budgetTrimmer.fit(draft);
        }
        catch (Exception e) {
            log.error("Minimal context rendering failed", e);
        }
        return ContextBundle.builder()
                .promptContext(ContextBudgetTrimmer.join(sections))
                .sections(sections)
                .trimmedSections(List.of())
                .intent(intent)
                .stage(ConversationStage.GREETING)
                .stageConfidence(0.0d)
                .progressing(true)
                .stageGuidance(ConversationStage.GREETING.promptGuidance())
                .historySnippets(List.of())
                .buildTimeMs(elapsedMs(start))
                .degraded(true)
                .build();
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000L;
    }
}
