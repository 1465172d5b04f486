package com.yoursp.oauthconnect.model.entity;

import com.yoursp.oauthconnect.modules.provider.Provider;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * OAuth token material for a (tenant, provider) pair.
 * Tokens are AES-256-GCM ciphertext; one row per pair, written through
 * {@code IntegrationCredentialRepository#upsert}.
 */
@Entity
@Table(name = "integration_credentials",
        uniqueConstraints = @UniqueConstraint(columnNames = { "tenant_id", "provider" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntegrationCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", length = 20, nullable = false)
    private Provider provider;

    @Column(name = "access_token", columnDefinition = "TEXT", nullable = false)
    private String accessToken;

    @Column(name = "refresh_token", columnDefinition = "TEXT")
    private String refreshToken;

    @Column(name = "token_expires_at")
    private OffsetDateTime tokenExpiresAt;

    @Column(name = "connected_by")
    private UUID connectedBy;

    /** Set when the token is a GitHub App installation token. */
    @Column(name = "installation_id")
    private Long installationId;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
