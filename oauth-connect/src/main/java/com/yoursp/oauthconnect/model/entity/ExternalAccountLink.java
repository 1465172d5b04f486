package com.yoursp.oauthconnect.model.entity;

import com.yoursp.oauthconnect.modules.provider.Provider;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Links a provider-side account to a local {@link User}.
 * {@code (provider, uid)} is unique.
 */
@Entity
@Table(name = "external_account_links",
        uniqueConstraints = @UniqueConstraint(columnNames = { "provider", "uid" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExternalAccountLink {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", length = 20, nullable = false)
    private Provider provider;

    @Column(name = "uid", nullable = false)
    private String uid;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "handle")
    private String handle;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
    }
}
