package com.github.salilvnair.convintel.profile.store;

import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import com.github.salilvnair.convintel.profile.ProfileSearchCriteria;
import com.github.salilvnair.convintel.profile.ProfileStatus;
import com.github.salilvnair.convintel.profile.UserProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.github.salilvnair.convintel.support.TestConstants.EMAIL;
import static com.github.salilvnair.convintel.support.TestConstants.OTHER_EMAIL;
import static com.github.salilvnair.convintel.support.TestConstants.OTHER_SCOPE;
import static com.github.salilvnair.convintel.support.TestConstants.PHONE_NORMALIZED;
import static com.github.salilvnair.convintel.support.TestConstants.SCOPE;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryProfileStoreTest {

    private static final Instant BASE = Instant.parse("2026-01-05T10:00:00Z");

    private InMemoryProfileStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryProfileStore();
    }

    @Test
    void duplicateEmailInSameScopeIsRejected() {
        store.insert(profile("p1", EMAIL, null, SCOPE.botId()));

        ConvIntelException error = assertThrows(ConvIntelException.class, () -> store.insert(profile("p2", EMAIL, null, SCOPE.botId())));

        assertTrue(error.is(ConvIntelErrorCode.PROFILE_DUPLICATE_IDENTITY));
        assertTrue(store.findById("p2").isEmpty());
        assertDoesNotThrow(() -> store.insert(profile("p3", EMAIL, null, OTHER_SCOPE.botId())));
    }

    @Test
    void rejectedInsertReleasesIdentitiesItClaimed() {
        store.insert(profile("p1", null, PHONE_NORMALIZED, SCOPE.botId()));

        assertThrows(ConvIntelException.class, () -> store.insert(profile("p2", OTHER_EMAIL, PHONE_NORMALIZED, SCOPE.botId())));

        assertDoesNotThrow(() -> store.insert(profile("p3", OTHER_EMAIL, null, SCOPE.botId())));
        assertEquals("p3", store.findByEmail(SCOPE, OTHER_EMAIL).orElseThrow().getProfileId());
    }

    @Test
    void updateBumpsVersionAndNoOpKeepsIt() {
        store.insert(profile("p1", EMAIL, null, SCOPE.botId()));

        UserProfile updated = store.update("p1", current -> current.toBuilder().phone(PHONE_NORMALIZED).build()).orElseThrow();
        UserProfile unchanged = store.update("p1", current -> current).orElseThrow();

        assertEquals(1L, updated.getVersion());
        assertSame(updated, unchanged);
        assertEquals("p1", store.findByPhone(SCOPE, PHONE_NORMALIZED).orElseThrow().getProfileId());
        assertTrue(store.update("missing", current -> current).isEmpty());
    }

    @Test
    void updateTakingAnOwnedIdentityFailsAndLeavesProfileUntouched() {
        store.insert(profile("p1", EMAIL, null, SCOPE.botId()));
        store.insert(profile("p2", OTHER_EMAIL, null, SCOPE.botId()));

        assertThrows(ConvIntelException.class, () -> store.update("p2", current -> current.toBuilder().email(EMAIL).build()));

        assertEquals(OTHER_EMAIL, store.findById("p2").orElseThrow().getEmail());
        assertEquals("p2", store.findByEmail(SCOPE, OTHER_EMAIL).orElseThrow().getProfileId());
    }

    @Test
    void retiredProfilesAreOnlyVisibleById() {
        store.insert(profile("p1", EMAIL, null, SCOPE.botId()));

        store.update("p1", current -> current.toBuilder().status(ProfileStatus.RETIRED).build());

        assertTrue(store.findByEmail(SCOPE, EMAIL).isEmpty());
        assertEquals(ProfileStatus.RETIRED, store.findById("p1").orElseThrow().getStatus());
        assertTrue(store.search(SCOPE, ProfileSearchCriteria.builder().limit(10).build()).isEmpty());
    }

    @Test
    void searchReturnsNewestFirstWithPaging() {
        store.insert(profile("old", "a@example.com", null, SCOPE.botId()).toBuilder().updatedAt(BASE).build());
        store.insert(profile("mid", "b@example.com", null, SCOPE.botId()).toBuilder().updatedAt(BASE.plusSeconds(60)).build());
        store.insert(profile("new", "c@example.com", null, SCOPE.botId()).toBuilder().updatedAt(BASE.plusSeconds(120)).build());

        List<UserProfile> first = store.search(SCOPE, ProfileSearchCriteria.builder().page(0).limit(2).build());
        List<UserProfile> second = store.search(SCOPE, ProfileSearchCriteria.builder().page(1).limit(2).build());
        List<UserProfile> recent = store.search(SCOPE, ProfileSearchCriteria.builder().updatedAfter(BASE).limit(10).build());

        assertEquals(List.of("new", "mid"), first.stream().map(UserProfile::getProfileId).toList());
        assertEquals(List.of("old"), second.stream().map(UserProfile::getProfileId).toList());
        assertEquals(2, recent.size());
    }

    private static UserProfile profile(String profileId, String email, String phone, String botId) {
        return UserProfile.builder()
                .profileId(profileId)
                .tenantId(SCOPE.tenantId())
                .botId(botId)
                .email(email)
                .phone(phone)
                .createdAt(BASE)
                .updatedAt(BASE)
                .build();
    }
}
