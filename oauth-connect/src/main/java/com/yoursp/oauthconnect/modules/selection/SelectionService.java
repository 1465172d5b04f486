package com.yoursp.oauthconnect.modules.selection;

import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.callback.handler.FlowHandler;
import com.yoursp.oauthconnect.modules.callback.handler.FlowHandlerRegistry;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Second half of a callback that listed several resources: the caller picks
 * one and the flow's handler finishes with it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SelectionService {

    private final PendingSelectionStore store;
    private final FlowHandlerRegistry handlers;
    private final FlowRegistry flowRegistry;

    public PendingSelection pending(String sessionHandle, Provider provider) {
        return store.find(sessionHandle, provider)
                .orElseThrow(() -> notFound(provider));
    }

    /**
     * Consumes the pending selection and completes the flow with the chosen
     * resource. The selection is only consumed once the resource id is known
     * to be one of the candidates.
     *
     * @throws PendingSelectionNotFoundException no selection, or the id is not a candidate
     */
    public CallbackResult complete(User caller, String sessionHandle, Provider provider, String resourceId) {
        PendingSelection pending = pending(sessionHandle, provider);
        if (pending.candidate(resourceId).isEmpty()) {
            throw new PendingSelectionNotFoundException(
                    "'" + resourceId + "' is not one of the pending " + provider.resourceLabel());
        }

        PendingSelection selection = store.consume(sessionHandle, provider)
                .orElseThrow(() -> notFound(provider));
        ProviderResource chosen = selection.candidate(resourceId)
                .orElseThrow(() -> notFound(provider));

        FlowHandler handler = handlers.find(selection.flowKind())
                .orElseThrow(() -> new IllegalStateException("No handler for " + selection.flowKind()));
        try {
            CallbackResult result = handler.completeSelection(caller, selection, chosen);
            log.info("User {} selected {} {} for flow {}",
                    caller.getId(), provider.displayName(), chosen.id(), selection.flowKind().wireValue());
            return result;
        } catch (RuntimeException e) {
            log.error("Completing {} selection failed: {}", provider.displayName(), e.getMessage(), e);
            return CallbackResult.error(flowRegistry.failureRedirect(selection.flowKind()),
                    "Something went wrong. Please try again.");
        }
    }

    private static PendingSelectionNotFoundException notFound(Provider provider) {
        return new PendingSelectionNotFoundException(
                "No pending " + provider.displayName() + " selection. Please start again.");
    }
}
