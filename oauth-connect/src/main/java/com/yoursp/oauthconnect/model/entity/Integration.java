package com.yoursp.oauthconnect.model.entity;

import com.yoursp.oauthconnect.modules.provider.Provider;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * The provider resource (organization, site, workspace) a tenant is connected to.
 */
@Entity
@Table(name = "integrations",
        uniqueConstraints = @UniqueConstraint(columnNames = { "tenant_id", "provider" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Integration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", length = 20, nullable = false)
    private Provider provider;

    @Column(name = "credential_id", nullable = false)
    private Long credentialId;

    @Column(name = "resource_id", nullable = false)
    private String resourceId;

    @Column(name = "resource_name")
    private String resourceName;

    @Column(name = "resource_url", columnDefinition = "TEXT")
    private String resourceUrl;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
