package com.yoursp.oauthconnect.modules.selection;

import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.auth.SessionAuthFilter;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.service.FlashMessageService;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/connect/{provider}/selection")
@RequiredArgsConstructor
public class SelectionController {

    private final SelectionService selectionService;
    private final FlashMessageService flashMessageService;

    public record SelectionView(String provider, String flow, List<ProviderResource> candidates) {
    }

    @GetMapping
    public ResponseEntity<SelectionView> candidates(@PathVariable("provider") String providerSlug,
            @RequestAttribute(SessionAuthFilter.SESSION_HANDLE_ATTRIBUTE) String sessionHandle) {
        Provider provider = provider(providerSlug);
        PendingSelection pending = selectionService.pending(sessionHandle, provider);
        return ResponseEntity.ok(new SelectionView(
                provider.slug(), pending.flowKind().wireValue(), pending.candidates()));
    }

    @PostMapping
    public void select(@PathVariable("provider") String providerSlug,
            @RequestParam("resourceId") String resourceId,
            @RequestAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE) User caller,
            @RequestAttribute(SessionAuthFilter.SESSION_HANDLE_ATTRIBUTE) String sessionHandle,
            HttpServletResponse response) throws IOException {
        CallbackResult result = selectionService.complete(caller, sessionHandle, provider(providerSlug), resourceId);
        flashMessageService.write(response, result.messages());
        response.sendRedirect(result.redirectTo());
    }

    private static Provider provider(String slug) {
        return Provider.fromSlug(slug)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown provider: " + slug));
    }
}
