package com.github.salilvnair.convintel.profile.store;

import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import com.github.salilvnair.convintel.profile.ProfileScope;
import com.github.salilvnair.convintel.profile.ProfileSearchCriteria;
import com.github.salilvnair.convintel.profile.UserProfile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local store. Profiles are updated with {@link ConcurrentHashMap#computeIfPresent}; email and phone
 * uniqueness is enforced by an identity index claimed with {@code putIfAbsent}.
 */
public class InMemoryProfileStore implements ProfileStore {

    private final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();
    private final Map<String, String> identityIndex = new ConcurrentHashMap<>();

    @Override
    public Optional<UserProfile> findById(String profileId) {
        return profileId == null ? Optional.empty() : Optional.ofNullable(profiles.get(profileId));
    }

    @Override
    public Optional<UserProfile> findByEmail(ProfileScope scope, String email) {
        return findByIdentity(identityKey(scope, "email", email));
    }

    @Override
    public Optional<UserProfile> findByPhone(ProfileScope scope, String phone) {
        return findByIdentity(identityKey(scope, "phone", phone));
    }

    @Override
    public Optional<UserProfile> findByVisitorId(ProfileScope scope, String visitorId) {
        if (visitorId == null) {
            return Optional.empty();
        }
        return profiles.values().stream()
                .filter(UserProfile::isActive)
                .filter(scope::owns)
                .filter(profile -> profile.getVisitorIds().contains(visitorId))
                .max(Comparator.comparing(UserProfile::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
    }

    @Override
    public UserProfile insert(UserProfile profile) {
        List<String> claimed = new ArrayList<>(2);
        try {
            claim(identityKeys(profile), profile.getProfileId(), claimed);
        }
        catch (ConvIntelException e) {
            claimed.forEach(identityIndex::remove);
            throw e;
        }
        profiles.put(profile.getProfileId(), profile);
        return profile;
    }

    @Override
    public Optional<UserProfile> update(String profileId, UnaryOperator<UserProfile> mutation) {
        if (profileId == null) {
            return Optional.empty();
        }
        UserProfile stored = profiles.computeIfPresent(profileId, (id, current) -> {
            UserProfile next = mutation.apply(current);
            if (next == null || next == current) {
                return current;
            }
            List<String> before = identityKeys(current);
            List<String> after = identityKeys(next);
            List<String> claimed = new ArrayList<>(2);
            List<String> newKeys = new ArrayList<>(after);
            newKeys.removeAll(before);
            try {
                claim(newKeys, id, claimed);
            }
            catch (ConvIntelException e) {
                claimed.forEach(identityIndex::remove);
                throw e;
            }
            for (String key : before) {
                if (!after.contains(key)) {
                    identityIndex.remove(key, id);
                }
            }
            return next.toBuilder().version(current.getVersion() + 1).build();
        });
        return Optional.ofNullable(stored);
    }

    @Override
    public List<UserProfile> search(ProfileScope scope, ProfileSearchCriteria criteria) {
        String query = criteria.query() == null || criteria.query().isBlank()
                ? null
                : criteria.query().trim().toLowerCase(Locale.ROOT);
        Instant updatedAfter = criteria.updatedAfter();
        return profiles.values().stream()
                .filter(UserProfile::isActive)
                .filter(scope::owns)
                .filter(profile -> criteria.engagementLevel() == null
                        || profile.getBehavior().getEngagementLevel() == criteria.engagementLevel())
                .filter(profile -> updatedAfter == null
                        || (profile.getUpdatedAt() != null && profile.getUpdatedAt().isAfter(updatedAfter)))
                .filter(profile -> query == null || ProfileEntityMapper.searchText(profile).contains(query))
                .sorted(Comparator.comparing(UserProfile::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .skip((long) criteria.page() * criteria.limit())
                .limit(criteria.limit())
                .toList();
    }

    private Optional<UserProfile> findByIdentity(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String profileId = identityIndex.get(key);
        if (profileId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(profileId)).filter(UserProfile::isActive);
    }

    private void claim(List<String> keys, String profileId, List<String> claimed) {
        for (String key : keys) {
            String owner = identityIndex.putIfAbsent(key, profileId);
            if (owner != null && !owner.equals(profileId)) {
                throw new ConvIntelException(ConvIntelErrorCode.PROFILE_DUPLICATE_IDENTITY, "Identity already owned: " + key);
            }
            if (owner == null) {
                claimed.add(key);
            }
        }
    }

    private static List<String> identityKeys(UserProfile profile) {
        ProfileScope scope = profile.scope();
        List<String> keys = new ArrayList<>(2);
        String email = identityKey(scope, "email", profile.getEmail());
        String phone = identityKey(scope, "phone", profile.getPhone());
        if (email != null) {
            keys.add(email);
        }
        if (phone != null) {
            keys.add(phone);
        }
        return keys;
    }

    private static String identityKey(ProfileScope scope, String kind, String value) {
        if (value == null) {
            return null;
        }
        return String.join("|", scope.tenantId(), scope.botId(), kind, value);
    }
}
