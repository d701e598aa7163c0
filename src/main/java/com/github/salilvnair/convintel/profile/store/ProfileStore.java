package com.github.salilvnair.convintel.profile.store;

import com.github.salilvnair.convintel.profile.ProfileScope;
import com.github.salilvnair.convintel.profile.ProfileSearchCriteria;
import com.github.salilvnair.convintel.profile.UserProfile;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence port for user profiles.
 * <p>
 * Lookups only return {@link com.github.salilvnair.convintel.profile.ProfileStatus#ACTIVE ACTIVE} profiles,
 * except {@link #findById(String)} which also returns retired ones.
 * All mutations go through {@link #update(String, UnaryOperator)}, which applies the mutation
 * atomically against the stored version.
 */
public interface ProfileStore {

    Optional<UserProfile> findById(String profileId);

    Optional<UserProfile> findByEmail(ProfileScope scope, String email);

    Optional<UserProfile> findByPhone(ProfileScope scope, String phone);

    Optional<UserProfile> findByVisitorId(ProfileScope scope, String visitorId);

    /**
     * @throws com.github.salilvnair.convintel.engine.exception.ConvIntelException with
     *         {@code PROFILE_DUPLICATE_IDENTITY} when the email or phone is already owned in the scope
     */
    UserProfile insert(UserProfile profile);

    /**
     * Applies {@code mutation} to the current stored profile and persists the result only if nobody
     * changed the profile in between; conflicting writes re-read and re-apply. A mutation returning
     * {@code null} or its argument is a no-op.
     *
     * @return the stored profile after the call, empty if the profile does not exist
     */
    Optional<UserProfile> update(String profileId, UnaryOperator<UserProfile> mutation);

    /** Newest {@code updatedAt} first. */
    List<UserProfile> search(ProfileScope scope, ProfileSearchCriteria criteria);

    default void ensureIndexes() {
    }
}
