package com.yoursp.oauthconnect.repository;

import com.yoursp.oauthconnect.model.entity.Membership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MembershipRepository extends JpaRepository<Membership, Long> {

    boolean existsByUserId(UUID userId);

    boolean existsByTenantIdAndUserId(Long tenantId, UUID userId);

    Optional<Membership> findByTenantIdAndUserId(Long tenantId, UUID userId);

    /** The caller's first tenant, which onboarding steps attach providers to. */
    Optional<Membership> findFirstByUserIdOrderByCreatedAtAsc(UUID userId);
}
