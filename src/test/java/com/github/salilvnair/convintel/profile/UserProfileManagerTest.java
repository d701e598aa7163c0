package com.github.salilvnair.convintel.profile;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import com.github.salilvnair.convintel.profile.store.InMemoryProfileStore;
import com.github.salilvnair.convintel.profile.store.ProfileCallGuard;
import com.github.salilvnair.convintel.profile.store.ProfileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;

import static com.github.salilvnair.convintel.support.TestConstants.BOOM;
import static com.github.salilvnair.convintel.support.TestConstants.COMPANY_ACME;
import static com.github.salilvnair.convintel.support.TestConstants.EMAIL;
import static com.github.salilvnair.convintel.support.TestConstants.EMAIL_MIXED_CASE;
import static com.github.salilvnair.convintel.support.TestConstants.FACT_COMPANY;
import static com.github.salilvnair.convintel.support.TestConstants.FACT_NAME;
import static com.github.salilvnair.convintel.support.TestConstants.NAME_SARA;
import static com.github.salilvnair.convintel.support.TestConstants.OTHER_EMAIL;
import static com.github.salilvnair.convintel.support.TestConstants.OTHER_SCOPE;
import static com.github.salilvnair.convintel.support.TestConstants.PHONE;
import static com.github.salilvnair.convintel.support.TestConstants.PHONE_NORMALIZED;
import static com.github.salilvnair.convintel.support.TestConstants.SCOPE;
import static com.github.salilvnair.convintel.support.TestConstants.VISITOR_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UserProfileManagerTest {

    private static final Instant BASE = Instant.parse("2026-01-05T10:00:00Z");

    private ConvIntelProperties properties;
    private UserProfileManager manager;

    @BeforeEach
    void setUp() {
        properties = new ConvIntelProperties();
        properties.getProfile().setCallTimeoutMs(0L);
        manager = managerWith(new InMemoryProfileStore());
    }

    @Test
    void getOrCreateProfileCreatesOnceAndThenResolvesExisting() {
        ProfileResolution created = manager.getOrCreateProfile(SCOPE, EMAIL, null, Map.of(FACT_NAME, NAME_SARA)).orElseThrow();
        ProfileResolution resolved = manager.getOrCreateProfile(SCOPE, EMAIL_MIXED_CASE, null).orElseThrow();

        assertTrue(created.isNew());
        assertEquals(EMAIL, created.profile().getEmail());
        assertEquals(NAME_SARA, created.profile().fact(FACT_NAME));
        assertFalse(resolved.isNew());
        assertEquals(created.profile().getProfileId(), resolved.profile().getProfileId());
    }

    @Test
    void phoneResolvesWhenEmailIsUnknown() {
        ProfileResolution created = manager.getOrCreateProfile(SCOPE, null, PHONE).orElseThrow();

        ProfileResolution resolved = manager.getOrCreateProfile(SCOPE, "unknown@example.com", PHONE_NORMALIZED).orElseThrow();

        assertEquals(PHONE_NORMALIZED, created.profile().getPhone());
        assertFalse(resolved.isNew());
        assertEquals(created.profile().getProfileId(), resolved.profile().getProfileId());
    }

    @Test
    void resolutionWithoutIdentifiersReturnsEmpty() {
        assertTrue(manager.getOrCreateProfile(SCOPE, null, "  ").isEmpty());
        assertTrue(manager.getOrCreateProfileByVisitor(SCOPE, " ", null, null, null).isEmpty());
    }

    @Test
    void sameEmailInAnotherScopeIsAnotherProfile() {
        String first = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();
        ProfileResolution other = manager.getOrCreateProfile(OTHER_SCOPE, EMAIL, null).orElseThrow();

        assertTrue(other.isNew());
        assertNotEquals(first, other.profile().getProfileId());
    }

    @Test
    void concurrentCreatorWinningTheIdentityIsAdopted() {
        ProfileStore store = mock(ProfileStore.class);
        UserProfile existing = UserProfile.builder().profileId("winner").tenantId(SCOPE.tenantId()).botId(SCOPE.botId()).email(EMAIL).build();
        when(store.findByEmail(SCOPE, EMAIL)).thenReturn(Optional.empty(), Optional.of(existing));
        when(store.insert(any())).thenThrow(new ConvIntelException(ConvIntelErrorCode.PROFILE_DUPLICATE_IDENTITY));

        ProfileResolution resolution = managerWith(store).getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow();

        assertFalse(resolution.isNew());
        assertEquals("winner", resolution.profile().getProfileId());
    }

    @Test
    void sessionSummariesAreCappedKeepingTheNewest() {
        String profileId = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();

        for (int i = 0; i < 25; i++) {
            manager.addSessionSummary(profileId, new SessionSummary("s" + i, "summary " + i, List.of(), "undecided", BASE.plusSeconds(i)));
        }

        List<SessionSummary> summaries = manager.getProfile(profileId).orElseThrow().getSessionSummaries();
        assertEquals(20, summaries.size());
        assertEquals("s5", summaries.get(0).sessionId());
        assertEquals("s24", summaries.get(19).sessionId());
    }

    @Test
    void factsAreShallowMergedAndUpdatedAtRefreshed() {
        UserProfile created = manager.getOrCreateProfile(SCOPE, EMAIL, null, Map.of(FACT_NAME, NAME_SARA)).orElseThrow().profile();

        manager.updateProfileFacts(created.getProfileId(), Map.of(FACT_COMPANY, COMPANY_ACME));
        UserProfile updated = manager.updateProfileFacts(created.getProfileId(), Map.of(FACT_NAME, "Sarah")).orElseThrow();

        assertEquals(Map.of(FACT_NAME, "Sarah", FACT_COMPANY, COMPANY_ACME), updated.getFacts());
        assertFalse(updated.getUpdatedAt().isBefore(created.getUpdatedAt()));
        assertTrue(updated.getVersion() > created.getVersion());
    }

    @Test
    void behaviorMetricsAccumulateAndDriveEngagement() {
        String profileId = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();

        for (int i = 0; i < 5; i++) {
            manager.updateBehaviorMetrics(profileId, 0.5d, 60L, 4);
        }

        BehaviorMetrics behavior = manager.getProfile(profileId).orElseThrow().getBehavior();
        assertEquals(5, behavior.getTotalSessions());
        assertEquals(20L, behavior.getTotalMessages());
        assertEquals(300L, behavior.getTotalDurationSeconds());
        assertEquals(0.5d, behavior.getAverageSentiment(), 1e-9);
        assertEquals(EngagementLevel.ENGAGED, behavior.getEngagementLevel());
    }

    @Test
    void negativeSessionsMakeUserDisengagedAndSentimentIsClamped() {
        String profileId = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();

        manager.updateBehaviorMetrics(profileId, Sentiment.NEGATIVE, 30L, 2);
        manager.updateBehaviorMetrics(profileId, -0.8d, 30L, 2);
        BehaviorMetrics behavior = manager.updateBehaviorMetrics(profileId, -3.0d, 30L, 2).orElseThrow().getBehavior();

        assertEquals(-1.0d, behavior.getLastSentiment());
        assertEquals(-2.8d / 3, behavior.getAverageSentiment(), 1e-9);
        assertEquals(EngagementLevel.DISENGAGED, behavior.getEngagementLevel());
    }

    @Test
    void sessionWithoutSentimentCountsButDoesNotMoveAverage() {
        String profileId = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();

        manager.updateBehaviorMetrics(profileId, 1.0d, null, null);
        BehaviorMetrics behavior = manager.updateBehaviorMetrics(profileId, (Double) null, 10L, 3).orElseThrow().getBehavior();

        assertEquals(2, behavior.getTotalSessions());
        assertEquals(1, behavior.getSentimentSamples());
        assertEquals(1.0d, behavior.getAverageSentiment());
        assertEquals(EngagementLevel.ACTIVE, behavior.getEngagementLevel());
    }

    @Test
    void sameMetricsUpdateFromSameStateGivesSameEngagement() {
        BehaviorMetrics start = BehaviorMetrics.builder()
                .totalSessions(4)
                .sentimentSamples(4)
                .averageSentiment(0.2d)
                .engagementLevel(EngagementLevel.ACTIVE)
                .build();

        BehaviorMetrics first = manager.nextBehavior(start, 0.4d, 90L, 6);
        BehaviorMetrics second = manager.nextBehavior(start, 0.4d, 90L, 6);

        assertEquals(first, second);
        assertEquals(EngagementLevel.ENGAGED, first.getEngagementLevel());
    }

    @Test
    void identicalProfilesReachTheSameEngagementLevel() {
        String one = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();
        String two = manager.getOrCreateProfile(SCOPE, OTHER_EMAIL, null).orElseThrow().profile().getProfileId();
        for (int i = 0; i < 3; i++) {
            manager.updateBehaviorMetrics(one, -0.8d, 30L, 2);
            manager.updateBehaviorMetrics(two, -0.8d, 30L, 2);
        }

        EngagementLevel levelOne = manager.getProfile(one).orElseThrow().getBehavior().getEngagementLevel();
        EngagementLevel levelTwo = manager.getProfile(two).orElseThrow().getBehavior().getEngagementLevel();

        assertEquals(EngagementLevel.DISENGAGED, levelOne);
        assertEquals(levelOne, levelTwo);
    }

    @Test
    void mergeFoldsSecondaryIntoPrimaryWithPrimaryWinning() {
        UserProfile primary = manager.getOrCreateProfile(SCOPE, EMAIL, null, Map.of(FACT_NAME, NAME_SARA, FACT_COMPANY, COMPANY_ACME)).orElseThrow().profile();
        UserProfile secondary = manager.getOrCreateProfile(SCOPE, null, PHONE, Map.of(FACT_NAME, "S.", "role", "CTO")).orElseThrow().profile();
        manager.updateBehaviorMetrics(primary.getProfileId(), 1.0d, 60L, 4);
        manager.updateBehaviorMetrics(primary.getProfileId(), 1.0d, 60L, 4);
        manager.updateBehaviorMetrics(secondary.getProfileId(), -0.5d, 30L, 2);
        manager.addSessionSummary(primary.getProfileId(), new SessionSummary("p1", "primary chat", List.of(), null, BASE.plusSeconds(10)));
        manager.addSessionSummary(secondary.getProfileId(), new SessionSummary("s1", "secondary chat", List.of(), null, BASE));
        manager.linkVisitorId(secondary.getProfileId(), VISITOR_ID);

        assertTrue(manager.mergeProfiles(primary.getProfileId(), secondary.getProfileId()));

        UserProfile merged = manager.getProfile(primary.getProfileId()).orElseThrow();
        assertEquals(Map.of(FACT_NAME, NAME_SARA, FACT_COMPANY, COMPANY_ACME, "role", "CTO"), merged.getFacts());
        assertEquals(3, merged.getBehavior().getTotalSessions());
        assertEquals(10L, merged.getBehavior().getTotalMessages());
        assertEquals(0.5d, merged.getBehavior().getAverageSentiment(), 1e-9);
        assertEquals(List.of("s1", "p1"), merged.getSessionSummaries().stream().map(SessionSummary::sessionId).toList());
        assertEquals(PHONE_NORMALIZED, merged.getPhone());
        assertEquals(List.of(VISITOR_ID), merged.getVisitorIds());
        assertTrue(manager.getProfile(secondary.getProfileId()).isEmpty());
        assertEquals(primary.getProfileId(), manager.findProfile(SCOPE, null, PHONE).orElseThrow().getProfileId());
    }

    @Test
    void failedPrimaryWriteLeavesSecondaryUntouched() {
        Set<String> failing = ConcurrentHashMap.newKeySet();
        manager = managerWith(failingOn(failing));
        String primary = manager.getOrCreateProfile(SCOPE, EMAIL, null, Map.of(FACT_NAME, NAME_SARA)).orElseThrow().profile().getProfileId();
        String secondary = manager.getOrCreateProfile(SCOPE, OTHER_EMAIL, null, Map.of("role", "CTO")).orElseThrow().profile().getProfileId();
        failing.add(primary);

        assertFalse(manager.mergeProfiles(primary, secondary));

        UserProfile kept = manager.findProfile(SCOPE, OTHER_EMAIL, null).orElseThrow();
        assertEquals(secondary, kept.getProfileId());
        assertTrue(kept.isActive());
        assertEquals("CTO", kept.fact("role"));
        assertEquals(Map.of(FACT_NAME, NAME_SARA), manager.getProfile(primary).orElseThrow().getFacts());
    }

    @Test
    void failedRetireKeepsDataOnBothProfiles() {
        Set<String> failing = ConcurrentHashMap.newKeySet();
        manager = managerWith(failingOn(failing));
        String primary = manager.getOrCreateProfile(SCOPE, EMAIL, null, Map.of(FACT_NAME, NAME_SARA)).orElseThrow().profile().getProfileId();
        String secondary = manager.getOrCreateProfile(SCOPE, null, PHONE, Map.of("role", "CTO")).orElseThrow().profile().getProfileId();
        failing.add(secondary);

        assertFalse(manager.mergeProfiles(primary, secondary));

        UserProfile merged = manager.getProfile(primary).orElseThrow();
        assertEquals("CTO", merged.fact("role"));
        assertNull(merged.getPhone());
        assertEquals(secondary, manager.findProfile(SCOPE, null, PHONE).orElseThrow().getProfileId());
    }

    @Test
    void unreadableStoredProfileIsNotOverwritten() {
        ProfileStore store = mock(ProfileStore.class);
        when(store.update(any(), any()))
                .thenThrow(new ConvIntelException(ConvIntelErrorCode.PROFILE_DATA_UNREADABLE, "Unreadable string map JSON column"));
        manager = managerWith(store);

        assertTrue(manager.updateProfileFacts("p1", Map.of(FACT_NAME, NAME_SARA)).isEmpty());
        assertTrue(manager.addSessionSummary("p1", "s1", "Compared plans", List.of(), null).isEmpty());
        verify(store, times(2)).update(any(), any());
        verify(store, never()).insert(any());
    }

    @Test
    void mergeRejectsSameOrForeignOrMissingProfiles() {
        String first = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();
        String foreign = manager.getOrCreateProfile(OTHER_SCOPE, OTHER_EMAIL, null).orElseThrow().profile().getProfileId();

        assertFalse(manager.mergeProfiles(first, first));
        assertFalse(manager.mergeProfiles(first, foreign));
        assertFalse(manager.mergeProfiles(first, "missing"));
        assertTrue(manager.getProfile(foreign).isPresent());
    }

    @Test
    void mutationsOfRetiredProfilesAreIgnored() {
        String primary = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();
        String secondary = manager.getOrCreateProfile(SCOPE, OTHER_EMAIL, null).orElseThrow().profile().getProfileId();
        manager.mergeProfiles(primary, secondary);

        assertTrue(manager.updateProfileFacts(secondary, Map.of(FACT_NAME, NAME_SARA)).isEmpty());
    }

    @Test
    void visitorFlowLinksContactDetailsLater() {
        ProfileResolution anonymous = manager.getOrCreateProfileByVisitor(SCOPE, VISITOR_ID, null, null, Map.of(FACT_NAME, NAME_SARA)).orElseThrow();
        ProfileResolution identified = manager.getOrCreateProfileByVisitor(SCOPE, VISITOR_ID, EMAIL, null, null).orElseThrow();

        assertTrue(anonymous.isNew());
        assertFalse(identified.isNew());
        assertEquals(anonymous.profile().getProfileId(), identified.profile().getProfileId());
        assertEquals(EMAIL, identified.profile().getEmail());
        assertEquals(anonymous.profile().getProfileId(), manager.findProfile(SCOPE, EMAIL, null).orElseThrow().getProfileId());
        assertEquals("Welcome back, Sara! How can I help you today?", manager.greetingFor(SCOPE, VISITOR_ID, "Hi!"));
        assertEquals("Hi!", manager.greetingFor(SCOPE, "stranger", "Hi!"));
    }

    @Test
    void knownEmailGetsTheVisitorLinked() {
        String profileId = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();

        ProfileResolution resolution = manager.getOrCreateProfileByVisitor(SCOPE, VISITOR_ID, EMAIL, null, null).orElseThrow();

        assertEquals(profileId, resolution.profile().getProfileId());
        assertEquals(List.of(VISITOR_ID), resolution.profile().getVisitorIds());
        assertEquals(profileId, manager.findProfileByVisitor(SCOPE, VISITOR_ID).orElseThrow().getProfileId());
    }

    @Test
    void contactInfoCannotStealAnotherProfilesIdentity() {
        manager.getOrCreateProfile(SCOPE, EMAIL, null);
        String other = manager.getOrCreateProfile(SCOPE, OTHER_EMAIL, null).orElseThrow().profile().getProfileId();

        assertTrue(manager.updateContactInfo(other, EMAIL, null).isEmpty());
        assertEquals(OTHER_EMAIL, manager.getProfile(other).orElseThrow().getEmail());
    }

    @Test
    void searchFiltersByTextAndEngagement() {
        String acme = manager.getOrCreateProfile(SCOPE, EMAIL, null, Map.of(FACT_COMPANY, COMPANY_ACME)).orElseThrow().profile().getProfileId();
        manager.getOrCreateProfile(SCOPE, OTHER_EMAIL, null, Map.of(FACT_COMPANY, "Globex"));
        manager.updateBehaviorMetrics(acme, 0.5d, 60L, 2);
        manager.updateBehaviorMetrics(acme, 0.5d, 60L, 2);

        List<UserProfile> byText = manager.searchProfiles(SCOPE, ProfileSearchCriteria.builder().query("ACME").build());
        List<UserProfile> byLevel = manager.searchProfiles(SCOPE, ProfileSearchCriteria.builder().engagementLevel(EngagementLevel.ACTIVE).build());
        List<UserProfile> all = manager.searchProfiles(SCOPE, null);

        assertEquals(List.of(acme), byText.stream().map(UserProfile::getProfileId).toList());
        assertEquals(List.of(acme), byLevel.stream().map(UserProfile::getProfileId).toList());
        assertEquals(2, all.size());
        assertTrue(manager.searchProfiles(OTHER_SCOPE, null).isEmpty());
    }

    @Test
    void profileContextOfUnknownProfileIsEmpty() {
        assertTrue(manager.getProfileContext("missing").isEmpty());
        assertTrue(manager.getProfileContext(null).isEmpty());
        assertNull(manager.greetingFor(SCOPE, null, null));
    }

    @Test
    void concurrentMetricUpdatesAreNotLost() throws Exception {
        String profileId = manager.getOrCreateProfile(SCOPE, EMAIL, null).orElseThrow().profile().getProfileId();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(pool.submit(() -> manager.updateBehaviorMetrics(profileId, 0.0d, 1L, 1)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        }
        finally {
            pool.shutdownNow();
        }

        BehaviorMetrics behavior = manager.getProfile(profileId).orElseThrow().getBehavior();
        assertEquals(40, behavior.getTotalSessions());
        assertEquals(40L, behavior.getTotalMessages());
    }

    private static ProfileStore failingOn(Set<String> failingIds) {
        return new InMemoryProfileStore() {
            @Override
            public Optional<UserProfile> update(String profileId, UnaryOperator<UserProfile> mutation) {
                if (failingIds.contains(profileId)) {
                    throw new IllegalStateException(BOOM);
                }
                return super.update(profileId, mutation);
            }
        };
    }

    private UserProfileManager managerWith(ProfileStore store) {
        return new UserProfileManager(
                store,
                new ProfileCallGuard(properties),
                new EngagementPolicy(properties),
                new ProfileContextFormatter(properties),
                properties
        );
    }
}
