package com.github.salilvnair.convintel.repo;

import com.github.salilvnair.convintel.entity.CiUserProfile;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserProfileRepository extends JpaRepository<CiUserProfile, String> {

    Optional<CiUserProfile> findFirstByTenantIdAndBotIdAndEmailAndStatus(String tenantId, String botId, String email, String status);

    Optional<CiUserProfile> findFirstByTenantIdAndBotIdAndPhoneAndStatus(String tenantId, String botId, String phone, String status);

    @Query("""
            select p from CiUserProfile p join p.visitorIds v
            where p.tenantId = :tenantId and p.botId = :botId and p.status = :status and v = :visitorId
            order by p.updatedAt desc
            """)
    List<CiUserProfile> findByVisitorId(@Param("tenantId") String tenantId,
                                        @Param("botId") String botId,
                                        @Param("visitorId") String visitorId,
                                        @Param("status") String status,
                                        Pageable pageable);

    @Query("""
            select p from CiUserProfile p
            where p.tenantId = :tenantId and p.botId = :botId and p.status = :status
              and (:engagementLevel is null or p.engagementLevel = :engagementLevel)
              and p.updatedAt > :updatedAfter
              and coalesce(p.searchText, '') like :query
            """)
    List<CiUserProfile> search(@Param("tenantId") String tenantId,
                               @Param("botId") String botId,
                               @Param("status") String status,
                               @Param("engagementLevel") String engagementLevel,
                               @Param("updatedAfter") Instant updatedAfter,
                               @Param("query") String query,
                               Pageable pageable);
}
