package com.github.salilvnair.convintel.profile.store;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import com.github.salilvnair.convintel.entity.CiUserProfile;
import com.github.salilvnair.convintel.profile.ProfileScope;
import com.github.salilvnair.convintel.profile.ProfileSearchCriteria;
import com.github.salilvnair.convintel.profile.ProfileStatus;
import com.github.salilvnair.convintel.profile.UserProfile;
import com.github.salilvnair.convintel.repo.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Spring Data JPA store. {@link #update(String, UnaryOperator)} is an optimistic compare-and-set on
 * {@code version}: the mutated row is written with the version it was read at, and a concurrent
 * writer makes Hibernate reject the update, after which the mutation is re-applied to a fresh read.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaProfileStore implements ProfileStore {

    private static final String ACTIVE = ProfileStatus.ACTIVE.name();

    private static final Map<String, String> INDEXES = Map.of(
            "uk_ci_profile_email", "CREATE UNIQUE INDEX IF NOT EXISTS uk_ci_profile_email ON ci_user_profile (tenant_id, bot_id, email)",
            "uk_ci_profile_phone", "CREATE UNIQUE INDEX IF NOT EXISTS uk_ci_profile_phone ON ci_user_profile (tenant_id, bot_id, phone)",
            "ix_ci_profile_updated", "CREATE INDEX IF NOT EXISTS ix_ci_profile_updated ON ci_user_profile (tenant_id, bot_id, updated_at)",
            "ix_ci_profile_engagement", "CREATE INDEX IF NOT EXISTS ix_ci_profile_engagement ON ci_user_profile (tenant_id, bot_id, engagement_level)",
            "ix_ci_profile_visitor", "CREATE INDEX IF NOT EXISTS ix_ci_profile_visitor ON ci_profile_visitor (visitor_id)"
    );

    private final UserProfileRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final ConvIntelProperties properties;

    @Override
    public Optional<UserProfile> findById(String profileId) {
        if (profileId == null) {
            return Optional.empty();
        }
        return repository.findById(profileId).map(ProfileEntityMapper::toDomain);
    }

    @Override
    public Optional<UserProfile> findByEmail(ProfileScope scope, String email) {
        if (email == null) {
            return Optional.empty();
        }
        return repository.findFirstByTenantIdAndBotIdAndEmailAndStatus(scope.tenantId(), scope.botId(), email, ACTIVE)
                .map(ProfileEntityMapper::toDomain);
    }

    @Override
    public Optional<UserProfile> findByPhone(ProfileScope scope, String phone) {
        if (phone == null) {
            return Optional.empty();
        }
        return repository.findFirstByTenantIdAndBotIdAndPhoneAndStatus(scope.tenantId(), scope.botId(), phone, ACTIVE)
                .map(ProfileEntityMapper::toDomain);
    }

    @Override
    public Optional<UserProfile> findByVisitorId(ProfileScope scope, String visitorId) {
        if (visitorId == null) {
            return Optional.empty();
        }
        return repository.findByVisitorId(scope.tenantId(), scope.botId(), visitorId, ACTIVE, PageRequest.of(0, 1))
                .stream()
                .findFirst()
                .map(ProfileEntityMapper::toDomain);
    }

    @Override
    public UserProfile insert(UserProfile profile) {
        try {
            CiUserProfile saved = repository.saveAndFlush(ProfileEntityMapper.toEntity(profile, false));
            return ProfileEntityMapper.toDomain(saved);
        }
        catch (DataIntegrityViolationException e) {
            throw new ConvIntelException(
                    ConvIntelErrorCode.PROFILE_DUPLICATE_IDENTITY,
                    "Profile identity already exists in tenant=" + profile.getTenantId() + " bot=" + profile.getBotId(),
                    e
            );
        }
    }

    @Override
    public Optional<UserProfile> update(String profileId, UnaryOperator<UserProfile> mutation) {
        if (profileId == null) {
            return Optional.empty();
        }
        int maxAttempts = Math.max(1, properties.getProfile().getCasMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<CiUserProfile> row = repository.findById(profileId);
            if (row.isEmpty()) {
                return Optional.empty();
            }
            UserProfile current = ProfileEntityMapper.toDomain(row.get());
            UserProfile next = mutation.apply(current);
            if (next == null || next == current) {
                return Optional.of(current);
            }
            try {
                CiUserProfile saved = repository.saveAndFlush(
                        ProfileEntityMapper.toEntity(next.toBuilder().version(current.getVersion()).build(), true)
                );
                return Optional.of(ProfileEntityMapper.toDomain(saved));
            }
            catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Profile version conflict profileId={} attempt={}", profileId, attempt);
            }
            catch (DataIntegrityViolationException e) {
                throw new ConvIntelException(
                        ConvIntelErrorCode.PROFILE_DUPLICATE_IDENTITY,
                        "Profile update collides with another identity profileId=" + profileId,
                        e
                );
            }
        }
        throw new ConvIntelException(
                ConvIntelErrorCode.PROFILE_UPDATE_CONFLICT,
                "Profile update gave up after " + maxAttempts + " conflicting attempts profileId=" + profileId
        );
    }

    @Override
    public List<UserProfile> search(ProfileScope scope, ProfileSearchCriteria criteria) {
        String query = criteria.query() == null || criteria.query().isBlank()
                ? "%"
                : "%" + criteria.query().trim().toLowerCase(Locale.ROOT) + "%";
        Instant updatedAfter = criteria.updatedAfter() == null ? Instant.EPOCH : criteria.updatedAfter();
        String engagementLevel = criteria.engagementLevel() == null ? null : criteria.engagementLevel().code();
        PageRequest page = PageRequest.of(criteria.page(), criteria.limit(), Sort.by(Sort.Direction.DESC, "updatedAt"));
        return repository.search(scope.tenantId(), scope.botId(), ACTIVE, engagementLevel, updatedAfter, query, page)
                .stream()
                .map(ProfileEntityMapper::toDomain)
                .toList();
    }

    /**
     * Unique and lookup indexes are also declared on the entity; this covers schemas managed outside
     * Hibernate. Statements use {@code IF NOT EXISTS} (PostgreSQL, SQLite, H2); a failing statement
     * is logged and the rest still run.
     */
    @Override
    public void ensureIndexes() {
        INDEXES.forEach((name, ddl) -> {
            try {
                jdbcTemplate.execute(ddl);
                log.debug("Ensured index {}", name);
            }
            catch (DataAccessException e) {
                log.warn("Could not ensure index {}: {}", name, e.getMessage());
            }
        });
    }
}
