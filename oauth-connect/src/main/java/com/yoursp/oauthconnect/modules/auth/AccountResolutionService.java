package com.yoursp.oauthconnect.modules.auth;

import com.yoursp.oauthconnect.model.entity.ExternalAccountLink;
import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.dto.ExternalIdentity;
import com.yoursp.oauthconnect.repository.ExternalAccountLinkRepository;
import com.yoursp.oauthconnect.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Maps a provider identity onto a local {@link User}.
 *
 * <h3>Strategy:</h3>
 * <ol>
 * <li>Existing link by {@code (provider, external id)}</li>
 * <li>Existing user with the same email: link it</li>
 * <li>Otherwise create the user and the link</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountResolutionService {

    static final String PLACEHOLDER_EMAIL_DOMAIN = "github.placeholder";

    private final ExternalAccountLinkRepository linkRepository;
    private final UserRepository userRepository;

    /**
     * @param provider provider that authenticated the caller
     * @param identity the provider profile
     * @param email    profile email, or the verified email fetched separately; may be null
     * @return the local user and how it was resolved
     */
    @Transactional
    public ResolvedAccount resolve(Provider provider, ExternalIdentity identity, String email) {
        // Step 1: already linked
        Optional<ExternalAccountLink> link = linkRepository.findByProviderAndUid(provider, identity.id());
        if (link.isPresent()) {
            User user = userRepository.findById(link.get().getUserId())
                    .orElseThrow(() -> new IllegalStateException(
                            provider + " link " + identity.id() + " points to a missing user"));
            log.debug("User {} already linked to {} account {}", user.getId(), provider, identity.id());
            return new ResolvedAccount(user, ResolvedAccount.Resolution.LINKED);
        }

        // Step 2: same email
        if (email != null && !email.isBlank()) {
            Optional<User> byEmail = userRepository.findByEmail(email);
            if (byEmail.isPresent()) {
                User user = byEmail.get();
                createLink(provider, identity, user);
                log.info("Linked {} account {} to existing user {} by email", provider, identity.id(), user.getId());
                return new ResolvedAccount(user, ResolvedAccount.Resolution.MATCHED_BY_EMAIL);
            }
        }

        // Step 3: new user
        String[] names = splitDisplayName(identity.displayName());
        User user = userRepository.save(User.builder()
                .username(identity.handle())
                .email(email != null && !email.isBlank() ? email : placeholderEmail(identity.handle()))
                .firstName(names[0])
                .lastName(names[1])
                .build());
        createLink(provider, identity, user);

        log.info("Registered user {} from {} account {}", user.getId(), provider, identity.id());
        return new ResolvedAccount(user, ResolvedAccount.Resolution.CREATED);
    }

    private void createLink(Provider provider, ExternalIdentity identity, User user) {
        linkRepository.save(ExternalAccountLink.builder()
                .provider(provider)
                .uid(identity.id())
                .userId(user.getId())
                .handle(identity.handle())
                .displayName(identity.displayName())
                .build());
    }

    /**
     * "Ivan" → ("Ivan", ""), "Ivan van Yanchuk" → ("Ivan", "van Yanchuk").
     * Each part is truncated to {@link User#NAME_MAX_LENGTH}.
     */
    static String[] splitDisplayName(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return new String[] { "", "" };
        }
        String[] parts = displayName.strip().split("\\s+", 2);
        String first = truncate(parts[0]);
        String last = parts.length > 1 ? truncate(parts[1]) : "";
        return new String[] { first, last };
    }

    static String placeholderEmail(String handle) {
        return handle + "@" + PLACEHOLDER_EMAIL_DOMAIN;
    }

    private static String truncate(String value) {
        return value.length() > User.NAME_MAX_LENGTH ? value.substring(0, User.NAME_MAX_LENGTH) : value;
    }
}
