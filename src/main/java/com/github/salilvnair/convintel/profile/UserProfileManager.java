package com.github.salilvnair.convintel.profile;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import com.github.salilvnair.convintel.profile.store.ProfileCallGuard;
import com.github.salilvnair.convintel.profile.store.ProfileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Identity resolution and maintenance of cross-session user profiles.
 * <p>
 * Every store call goes through {@link ProfileCallGuard}; no method throws. Reads degrade to
 * empty results, failed writes are logged and reported as an empty {@link Optional} or {@code false}.
 * Mutations are expressed as functions handed to {@link ProfileStore#update}, so concurrent sessions
 * of the same user never overwrite each other's changes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserProfileManager {

    private static final Comparator<SessionSummary> CHRONOLOGICAL =
            Comparator.comparing(SessionSummary::timestamp, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ProfileStore profileStore;
    private final ProfileCallGuard callGuard;
    private final EngagementPolicy engagementPolicy;
    private final ProfileContextFormatter contextFormatter;
    private final ConvIntelProperties properties;

    // =========================
    // Resolution
    // =========================

    /**
     * Looks up by email, then phone; creates a profile only when neither resolves. A concurrent
     * creator winning the unique constraint makes this call attach to its profile.
     */
    public Optional<ProfileResolution> getOrCreateProfile(ProfileScope scope,
                                                          String email,
                                                          String phone,
                                                          Map<String, String> initialFacts) {
        String normalizedEmail = ProfileIdentity.normalizeEmail(email);
        String normalizedPhone = ProfileIdentity.normalizePhone(phone);
        if (normalizedEmail == null && normalizedPhone == null) {
            log.warn("Profile resolution skipped, no email or phone tenant={} bot={}", scope.tenantId(), scope.botId());
            return Optional.empty();
        }
        Optional<UserProfile> existing = findExisting(scope, normalizedEmail, normalizedPhone);
        if (existing.isPresent()) {
            return existing.map(profile -> new ProfileResolution(profile, false));
        }
        return create(scope, normalizedEmail, normalizedPhone, null, initialFacts);
    }

    public Optional<ProfileResolution> getOrCreateProfile(ProfileScope scope, String email, String phone) {
        return getOrCreateProfile(scope, email, phone, null);
    }

    /**
     * Browser-visitor flavour: email/phone win (and get the visitor linked), then the visitor id
     * (filling in missing email/phone), then a new profile carrying all identifiers.
     */
    public Optional<ProfileResolution> getOrCreateProfileByVisitor(ProfileScope scope,
                                                                   String visitorId,
                                                                   String email,
                                                                   String phone,
                                                                   Map<String, String> initialFacts) {
        String normalizedVisitor = ProfileIdentity.normalizeVisitorId(visitorId);
        String normalizedEmail = ProfileIdentity.normalizeEmail(email);
        String normalizedPhone = ProfileIdentity.normalizePhone(phone);
        if (normalizedVisitor == null && normalizedEmail == null && normalizedPhone == null) {
            log.warn("Profile resolution skipped, no identifier tenant={} bot={}", scope.tenantId(), scope.botId());
            return Optional.empty();
        }

        Optional<UserProfile> byContact = findExisting(scope, normalizedEmail, normalizedPhone);
        if (byContact.isPresent()) {
            UserProfile profile = byContact.get();
            if (normalizedVisitor != null && !profile.getVisitorIds().contains(normalizedVisitor)) {
                profile = linkVisitorId(profile.getProfileId(), normalizedVisitor).orElse(profile);
            }
            return Optional.of(new ProfileResolution(profile, false));
        }

        Optional<UserProfile> byVisitor = findProfileByVisitor(scope, normalizedVisitor);
        if (byVisitor.isPresent()) {
            UserProfile profile = byVisitor.get();
            boolean missingEmail = normalizedEmail != null && profile.getEmail() == null;
            boolean missingPhone = normalizedPhone != null && profile.getPhone() == null;
            if (missingEmail || missingPhone) {
                profile = updateContactInfo(profile.getProfileId(), missingEmail ? normalizedEmail : null, missingPhone ? normalizedPhone : null)
                        .orElse(profile);
            }
            return Optional.of(new ProfileResolution(profile, false));
        }

        return create(scope, normalizedEmail, normalizedPhone, normalizedVisitor, initialFacts);
    }

    public Optional<UserProfile> findProfile(ProfileScope scope, String email, String phone) {
        return findExisting(scope, ProfileIdentity.normalizeEmail(email), ProfileIdentity.normalizePhone(phone));
    }

    public Optional<UserProfile> findProfileByVisitor(ProfileScope scope, String visitorId) {
        String normalized = ProfileIdentity.normalizeVisitorId(visitorId);
        if (normalized == null) {
            return Optional.empty();
        }
        return callGuard.read("findByVisitorId", () -> profileStore.findByVisitorId(scope, normalized), Optional.empty());
    }

    /** Active profile by id; retired profiles are not returned. */
    public Optional<UserProfile> getProfile(String profileId) {
        if (profileId == null) {
            return Optional.empty();
        }
        return callGuard.read("findById", () -> profileStore.findById(profileId), Optional.<UserProfile>empty())
                .filter(UserProfile::isActive);
    }

    // =========================
    // Mutations
    // =========================

    public Optional<UserProfile> linkVisitorId(String profileId, String visitorId) {
        String normalized = ProfileIdentity.normalizeVisitorId(visitorId);
        if (normalized == null) {
            return Optional.empty();
        }
        return mutate(profileId, "linkVisitorId", current -> {
            if (current.getVisitorIds().contains(normalized)) {
                return current;
            }
            List<String> visitors = new ArrayList<>(current.getVisitorIds());
            visitors.add(normalized);
            return current.toBuilder().visitorIds(List.copyOf(visitors)).build();
        });
    }

    /** Sets the given non-null identifiers. Fails (empty result) when another profile owns one of them. */
    public Optional<UserProfile> updateContactInfo(String profileId, String email, String phone) {
        String normalizedEmail = ProfileIdentity.normalizeEmail(email);
        String normalizedPhone = ProfileIdentity.normalizePhone(phone);
        if (normalizedEmail == null && normalizedPhone == null) {
            return Optional.empty();
        }
        return mutate(profileId, "updateContactInfo", current -> {
            boolean sameEmail = normalizedEmail == null || normalizedEmail.equals(current.getEmail());
            boolean samePhone = normalizedPhone == null || normalizedPhone.equals(current.getPhone());
            if (sameEmail && samePhone) {
                return current;
            }
            return current.toBuilder()
                    .email(normalizedEmail == null ? current.getEmail() : normalizedEmail)
                    .phone(normalizedPhone == null ? current.getPhone() : normalizedPhone)
                    .build();
        });
    }

    /** Shallow merge: same keys are overwritten, other keys kept, null values ignored. */
    public Optional<UserProfile> updateProfileFacts(String profileId, Map<String, String> newFacts) {
        if (newFacts == null || newFacts.isEmpty()) {
            return getProfile(profileId);
        }
        return mutate(profileId, "updateProfileFacts", current ->
                current.toBuilder().facts(shallowMerge(current.getFacts(), newFacts)).build());
    }

    public Optional<UserProfile> updatePreferences(String profileId, Map<String, String> preferences) {
        if (preferences == null || preferences.isEmpty()) {
            return getProfile(profileId);
        }
        return mutate(profileId, "updatePreferences", current ->
                current.toBuilder().preferences(shallowMerge(current.getPreferences(), preferences)).build());
    }

    public Optional<UserProfile> addSessionSummary(String profileId,
                                                   String sessionId,
                                                   String summary,
                                                   List<String> keyTopics,
                                                   String outcome) {
        return addSessionSummary(profileId, new SessionSummary(sessionId, summary, keyTopics, outcome, Instant.now()));
    }

    /** Appends and evicts the oldest summaries (by timestamp) beyond the configured cap. */
    public Optional<UserProfile> addSessionSummary(String profileId, SessionSummary sessionSummary) {
        if (sessionSummary == null) {
            return Optional.empty();
        }
        SessionSummary stamped = sessionSummary.timestamp() == null
                ? new SessionSummary(sessionSummary.sessionId(), sessionSummary.summary(), sessionSummary.keyTopics(), sessionSummary.outcome(), Instant.now())
                : sessionSummary;
        return mutate(profileId, "addSessionSummary", current -> {
            List<SessionSummary> summaries = new ArrayList<>(current.getSessionSummaries());
            summaries.add(stamped);
            return current.toBuilder().sessionSummaries(newestChronological(summaries)).build();
        });
    }

    /**
     * Counts one finished session. Sentiment is clamped to {@code [-1, 1]} and folded into a running
     * mean over the sessions that reported one.
     */
    public Optional<UserProfile> updateBehaviorMetrics(String profileId,
                                                       Double sessionSentiment,
                                                       Long sessionDurationSeconds,
                                                       Integer messageCount) {
        return mutate(profileId, "updateBehaviorMetrics", current ->
                current.toBuilder().behavior(nextBehavior(current.getBehavior(), sessionSentiment, sessionDurationSeconds, messageCount)).build());
    }

    public Optional<UserProfile> updateBehaviorMetrics(String profileId,
                                                       Sentiment sentiment,
                                                       Long sessionDurationSeconds,
                                                       Integer messageCount) {
        return updateBehaviorMetrics(profileId, sentiment == null ? null : sentiment.score(), sessionDurationSeconds, messageCount);
    }

    BehaviorMetrics nextBehavior(BehaviorMetrics behavior,
                                 Double sessionSentiment,
                                 Long sessionDurationSeconds,
                                 Integer messageCount) {
        BehaviorMetrics current = behavior == null ? BehaviorMetrics.initial() : behavior;
        int sessions = current.getTotalSessions() + 1;
        int samples = current.getSentimentSamples();
        Double average = current.getAverageSentiment();
        Double last = current.getLastSentiment();
        if (sessionSentiment != null && !sessionSentiment.isNaN()) {
            double clamped = Math.max(-1.0d, Math.min(1.0d, sessionSentiment));
            average = average == null || samples == 0
                    ? clamped
                    : (average * samples + clamped) / (samples + 1);
            samples++;
            last = clamped;
        }
        return current.toBuilder()
                .totalSessions(sessions)
                .totalMessages(current.getTotalMessages() + Math.max(0, messageCount == null ? 0 : messageCount))
                .totalDurationSeconds(current.getTotalDurationSeconds() + Math.max(0L, sessionDurationSeconds == null ? 0L : sessionDurationSeconds))
                .sentimentSamples(samples)
                .averageSentiment(average)
                .lastSentiment(last)
                .engagementLevel(engagementPolicy.evaluate(sessions, average))
                .build();
    }

    // =========================
    // Merge
    // =========================

    /**
     * Folds {@code secondaryId} into {@code primaryId} in three steps: the primary absorbs the
     * secondary's data, the secondary is retired (only if unchanged since it was read), then the
     * primary adopts the released email/phone it does not have yet. A failure after the first step
     * leaves both profiles active with overlapping data; the secondary is never retired before its
     * data is stored on the primary.
     *
     * @return true when all steps were stored
     */
    public boolean mergeProfiles(String primaryId, String secondaryId) {
        if (primaryId == null || secondaryId == null || primaryId.equals(secondaryId)) {
            return false;
        }
        Optional<UserProfile> primary = getProfile(primaryId);
        Optional<UserProfile> secondary = getProfile(secondaryId);
        if (primary.isEmpty() || secondary.isEmpty()) {
            log.warn("Profile merge skipped, missing or retired profile primary={} secondary={}", primaryId, secondaryId);
            return false;
        }
        if (!primary.get().scope().equals(secondary.get().scope())) {
            log.warn("Profile merge rejected: {} primary={} secondary={}",
                    ConvIntelErrorCode.PROFILE_SCOPE_MISMATCH.defaultMessage(), primaryId, secondaryId);
            return false;
        }
        UserProfile snapshot = secondary.get();

        Optional<UserProfile> merged = mutate(primaryId, "mergeInto", current -> current.toBuilder()
                .facts(unionPrimaryWins(current.getFacts(), snapshot.getFacts()))
                .preferences(unionPrimaryWins(current.getPreferences(), snapshot.getPreferences()))
                .sessionSummaries(newestChronological(concat(current.getSessionSummaries(), snapshot.getSessionSummaries())))
                .behavior(mergeBehavior(current.getBehavior(), snapshot.getBehavior()))
                .visitorIds(union(current.getVisitorIds(), snapshot.getVisitorIds()))
                .build());
        if (merged.isEmpty()) {
            log.warn("Profile merge aborted, primary could not be updated primary={} secondary={}", primaryId, secondaryId);
            return false;
        }

        Instant now = Instant.now();
        Optional<UserProfile> retired = guardedUpdate(secondaryId, "mergeRetire", current -> {
            if (!current.isActive() || current.getVersion() != snapshot.getVersion()) {
                return current;
            }
            return current.toBuilder()
                    .status(ProfileStatus.RETIRED)
                    .mergedInto(primaryId)
                    .email(null)
                    .phone(null)
                    .visitorIds(List.of())
                    .updatedAt(now)
                    .build();
        });
        if (retired.isEmpty() || retired.get().isActive()) {
            log.error("Profile merge incomplete: primary={} holds the data of secondary={} but the secondary is still active",
                    primaryId, secondaryId);
            return false;
        }

        boolean adoptEmail = merged.get().getEmail() == null && snapshot.getEmail() != null;
        boolean adoptPhone = merged.get().getPhone() == null && snapshot.getPhone() != null;
        if (adoptEmail || adoptPhone) {
            Optional<UserProfile> adopted = mutate(primaryId, "mergeAdoptIdentity", current -> current.toBuilder()
                    .email(current.getEmail() != null ? current.getEmail() : snapshot.getEmail())
                    .phone(current.getPhone() != null ? current.getPhone() : snapshot.getPhone())
                    .build());
            if (adopted.isEmpty()) {
                log.error("Profile merge incomplete: primary={} did not adopt the identifiers of secondary={}", primaryId, secondaryId);
                return false;
            }
        }
        log.info("Merged profile secondary={} into primary={}", secondaryId, primaryId);
        return true;
    }

    BehaviorMetrics mergeBehavior(BehaviorMetrics primary, BehaviorMetrics secondary) {
        BehaviorMetrics a = primary == null ? BehaviorMetrics.initial() : primary;
        BehaviorMetrics b = secondary == null ? BehaviorMetrics.initial() : secondary;
        int sessions = a.getTotalSessions() + b.getTotalSessions();
        int weightA = a.getAverageSentiment() == null ? 0 : Math.max(1, a.getSentimentSamples());
        int weightB = b.getAverageSentiment() == null ? 0 : Math.max(1, b.getSentimentSamples());
        Double average = null;
        if (weightA + weightB > 0) {
            double sum = (weightA == 0 ? 0.0d : a.getAverageSentiment() * weightA)
                    + (weightB == 0 ? 0.0d : b.getAverageSentiment() * weightB);
            average = sum / (weightA + weightB);
        }
        return BehaviorMetrics.builder()
                .totalSessions(sessions)
                .totalMessages(a.getTotalMessages() + b.getTotalMessages())
                .totalDurationSeconds(a.getTotalDurationSeconds() + b.getTotalDurationSeconds())
                .sentimentSamples(weightA + weightB)
                .averageSentiment(average)
                .lastSentiment(a.getLastSentiment() != null ? a.getLastSentiment() : b.getLastSentiment())
                .engagementLevel(engagementPolicy.evaluate(sessions, average))
                .build();
    }

    // =========================
    // Read models
    // =========================

    public ProfileContext getProfileContext(String profileId) {
        try {
            return getProfile(profileId).map(contextFormatter::format).orElse(ProfileContext.empty());
        }
        catch (Exception e) {
            log.error("Profile context rendering failed profileId={}", profileId, e);
            return ProfileContext.empty();
        }
    }

    public List<UserProfile> searchProfiles(ProfileScope scope, ProfileSearchCriteria criteria) {
        ProfileSearchCriteria bounded = bounded(criteria);
        return callGuard.read("search", () -> profileStore.search(scope, bounded), List.of());
    }

    /** "Welcome back" greeting when the visitor is linked to a profile with a known name. */
    public String greetingFor(ProfileScope scope, String visitorId, String defaultGreeting) {
        String name = findProfileByVisitor(scope, visitorId)
                .map(profile -> profile.fact("name"))
                .filter(value -> !value.isBlank())
                .orElse(null);
        return name == null ? defaultGreeting : "Welcome back, " + name + "! How can I help you today?";
    }

    // =========================
    // Internals
    // =========================

    private Optional<UserProfile> findExisting(ProfileScope scope, String email, String phone) {
        if (email != null) {
            Optional<UserProfile> byEmail = callGuard.read("findByEmail", () -> profileStore.findByEmail(scope, email), Optional.empty());
            if (byEmail.isPresent()) {
                return byEmail;
            }
        }
        if (phone != null) {
            return callGuard.read("findByPhone", () -> profileStore.findByPhone(scope, phone), Optional.empty());
        }
        return Optional.empty();
    }

    private Optional<ProfileResolution> create(ProfileScope scope,
                                               String email,
                                               String phone,
                                               String visitorId,
                                               Map<String, String> initialFacts) {
        Instant now = Instant.now();
        UserProfile candidate = UserProfile.builder()
                .profileId(UUID.randomUUID().toString())
                .tenantId(scope.tenantId())
                .botId(scope.botId())
                .email(email)
                .phone(phone)
                .visitorIds(visitorId == null ? List.of() : List.of(visitorId))
                .facts(shallowMerge(Map.of(), initialFacts == null ? Map.of() : initialFacts))
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            UserProfile created = callGuard.write("insert", () -> profileStore.insert(candidate), null);
            if (created == null) {
                return Optional.empty();
            }
            log.info("Created user profile profileId={} tenant={} bot={}", created.getProfileId(), scope.tenantId(), scope.botId());
            return Optional.of(new ProfileResolution(created, true));
        }
        catch (ConvIntelException e) {
            if (!e.is(ConvIntelErrorCode.PROFILE_DUPLICATE_IDENTITY)) {
                log.warn("Profile creation failed tenant={} bot={} errorCode={}", scope.tenantId(), scope.botId(), e.getErrorCode());
                return Optional.empty();
            }
            log.info("Concurrent profile creation detected, attaching to existing tenant={} bot={}", scope.tenantId(), scope.botId());
            Optional<UserProfile> existing = findExisting(scope, email, phone);
            return existing.map(profile -> new ProfileResolution(profile, false));
        }
    }

    /**
     * Applies {@code change} to an active profile and stamps {@code updatedAt}. The change returns
     * its argument to signal a no-op.
     */
    private Optional<UserProfile> mutate(String profileId, String operation, UnaryOperator<UserProfile> change) {
        if (profileId == null) {
            return Optional.empty();
        }
        return guardedUpdate(profileId, operation, current -> {
            if (!current.isActive()) {
                return current;
            }
            UserProfile next = change.apply(current);
            if (next == current || next == null) {
                return current;
            }
            return next.toBuilder().updatedAt(Instant.now()).build();
        }).filter(UserProfile::isActive);
    }

    private Optional<UserProfile> guardedUpdate(String profileId, String operation, UnaryOperator<UserProfile> mutation) {
        try {
            return callGuard.write(operation, () -> profileStore.update(profileId, mutation), Optional.empty());
        }
        catch (ConvIntelException e) {
            log.warn("Profile {} failed profileId={} errorCode={} msg={}", operation, profileId, e.getErrorCode(), e.getMessage());
            return Optional.empty();
        }
        catch (Exception e) {
            log.error("Profile {} failed unexpectedly profileId={}", operation, profileId, e);
            return Optional.empty();
        }
    }

    private ProfileSearchCriteria bounded(ProfileSearchCriteria criteria) {
        int maxLimit = Math.max(1, properties.getProfile().getSearchMaxLimit());
        if (criteria == null) {
            return ProfileSearchCriteria.builder().page(0).limit(Math.min(20, maxLimit)).build();
        }
        int limit = criteria.limit() <= 0 ? Math.min(20, maxLimit) : Math.min(criteria.limit(), maxLimit);
        return new ProfileSearchCriteria(criteria.query(), criteria.engagementLevel(), criteria.updatedAfter(), Math.max(0, criteria.page()), limit);
    }

    private List<SessionSummary> newestChronological(List<SessionSummary> summaries) {
        List<SessionSummary> sorted = new ArrayList<>(summaries);
        sorted.sort(CHRONOLOGICAL);
        int cap = Math.max(1, properties.getProfile().getMaxSessionSummaries());
        if (sorted.size() > cap) {
            sorted = sorted.subList(sorted.size() - cap, sorted.size());
        }
        return List.copyOf(sorted);
    }

    private static Map<String, String> shallowMerge(Map<String, String> current, Map<String, String> updates) {
        Map<String, String> merged = new LinkedHashMap<>(current == null ? Map.of() : current);
        updates.forEach((key, value) -> {
            if (key != null && value != null) {
                merged.put(key, value);
            }
        });
        return Collections.unmodifiableMap(merged);
    }

    private static Map<String, String> unionPrimaryWins(Map<String, String> primary, Map<String, String> secondary) {
        Map<String, String> merged = new LinkedHashMap<>(primary == null ? Map.of() : primary);
        if (secondary != null) {
            secondary.forEach(merged::putIfAbsent);
        }
        return Collections.unmodifiableMap(merged);
    }

    private static List<SessionSummary> concat(List<SessionSummary> first, List<SessionSummary> second) {
        List<SessionSummary> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static List<String> union(List<String> first, List<String> second) {
        Set<String> all = new LinkedHashSet<>(first);
        all.addAll(second);
        all.removeIf(Objects::isNull);
        return List.copyOf(all);
    }
}
