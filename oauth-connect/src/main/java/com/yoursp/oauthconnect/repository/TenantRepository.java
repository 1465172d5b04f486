package com.yoursp.oauthconnect.repository;

import com.yoursp.oauthconnect.model.entity.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TenantRepository extends JpaRepository<Tenant, Long> {

    boolean existsBySlug(String slug);
}
