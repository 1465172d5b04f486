package com.yoursp.oauthconnect.repository;

import com.yoursp.oauthconnect.model.entity.Integration;
import com.yoursp.oauthconnect.model.entity.IntegrationCredential;
import com.yoursp.oauthconnect.model.entity.Tenant;
import com.yoursp.oauthconnect.modules.provider.Provider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the {@code ON CONFLICT} upserts against a real PostgreSQL, with the
 * tables created from {@code schema.sql}. Skipped when Docker is unavailable.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class IntegrationUpsertRepositoryTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
            .withDatabaseName("oauth_connect_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @Autowired
    private IntegrationCredentialRepository credentialRepository;
    @Autowired
    private IntegrationRepository integrationRepository;
    @Autowired
    private TenantRepository tenantRepository;
    @Autowired
    private TestEntityManager entityManager;

    private Long tenantId;

    @BeforeEach
    void createTenant() {
        tenantId = tenantRepository.save(Tenant.builder()
                .name("Acme")
                .slug("acme-" + UUID.randomUUID())
                .createdAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build()).getId();
    }

    @Test
    @DisplayName("Upserting a credential twice keeps one row and the same id, with the new token material")
    void credentialUpsertConverges() {
        UUID firstUser = UUID.randomUUID();
        UUID secondUser = UUID.randomUUID();
        OffsetDateTime expiresAt = OffsetDateTime.now(ZoneOffset.UTC).plusHours(1).truncatedTo(ChronoUnit.SECONDS);

        Long firstId = credentialRepository.upsert(tenantId, Provider.JIRA.name(),
                "cipher-1", null, null, firstUser, null);
        Long secondId = credentialRepository.upsert(tenantId, Provider.JIRA.name(),
                "cipher-2", "refresh-2", expiresAt, secondUser, null);
        entityManager.clear();

        assertNotNull(firstId);
        assertEquals(firstId, secondId);
        assertEquals(1, credentialRepository.count());

        IntegrationCredential row = credentialRepository.findByTenantIdAndProvider(tenantId, Provider.JIRA)
                .orElseThrow();
        assertEquals(firstId, row.getId());
        assertEquals("cipher-2", row.getAccessToken());
        assertEquals("refresh-2", row.getRefreshToken());
        assertEquals(expiresAt.toInstant(), row.getTokenExpiresAt().toInstant());
        assertEquals(secondUser, row.getConnectedBy());
        assertNull(row.getInstallationId());
    }

    @Test
    @DisplayName("Switching to a GitHub App installation token records the installation id on the same row")
    void installationCredentialReplacesOAuthToken() {
        Long oauthId = credentialRepository.upsert(tenantId, Provider.GITHUB.name(),
                "gho-cipher", null, null, null, null);
        Long appId = credentialRepository.upsert(tenantId, Provider.GITHUB.name(),
                "ghs-cipher", null, OffsetDateTime.now(ZoneOffset.UTC).plusHours(1), null, 4242L);
        entityManager.clear();

        assertEquals(oauthId, appId);
        IntegrationCredential row = credentialRepository.findById(appId).orElseThrow();
        assertEquals("ghs-cipher", row.getAccessToken());
        assertEquals(4242L, row.getInstallationId());
    }

    @Test
    @DisplayName("Different providers of one tenant get separate credential rows")
    void credentialRowPerProvider() {
        Long jira = credentialRepository.upsert(tenantId, Provider.JIRA.name(), "a", null, null, null, null);
        Long slack = credentialRepository.upsert(tenantId, Provider.SLACK.name(), "b", null, null, null, null);

        assertNotEquals(jira, slack);
        assertEquals(2, credentialRepository.count());
    }

    @Test
    @DisplayName("Upserting an integration twice keeps one row and the same id, pointing at the latest resource")
    void integrationUpsertConverges() {
        Long credentialId = credentialRepository.upsert(tenantId, Provider.JIRA.name(),
                "cipher", null, null, null, null);

        Long firstId = integrationRepository.upsert(tenantId, Provider.JIRA.name(), credentialId,
                "cloud-a", "acme", "https://acme.atlassian.net");
        Long secondId = integrationRepository.upsert(tenantId, Provider.JIRA.name(), credentialId,
                "cloud-b", "globex", "https://globex.atlassian.net");
        entityManager.clear();

        assertNotNull(firstId);
        assertEquals(firstId, secondId);
        assertEquals(1, integrationRepository.count());

        Integration row = integrationRepository.findByTenantIdAndProvider(tenantId, Provider.JIRA).orElseThrow();
        assertEquals(firstId, row.getId());
        assertEquals(credentialId, row.getCredentialId());
        assertEquals("cloud-b", row.getResourceId());
        assertEquals("globex", row.getResourceName());
        assertEquals("https://globex.atlassian.net", row.getResourceUrl());
    }
}
