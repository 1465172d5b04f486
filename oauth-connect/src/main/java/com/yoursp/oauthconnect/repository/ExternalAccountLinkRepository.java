package com.yoursp.oauthconnect.repository;

import com.yoursp.oauthconnect.model.entity.ExternalAccountLink;
import com.yoursp.oauthconnect.modules.provider.Provider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExternalAccountLinkRepository extends JpaRepository<ExternalAccountLink, UUID> {

    Optional<ExternalAccountLink> findByProviderAndUid(Provider provider, String uid);
}
