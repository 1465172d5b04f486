package com.yoursp.oauthconnect.modules.callback.handler;

import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackContext;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.selection.PendingSelection;

/**
 * One flow-specific callback procedure. Handlers never throw for expected
 * failures (provider errors, access errors, empty listings); they return an
 * error result with the flow's redirect.
 */
public interface FlowHandler {

    CallbackResult handle(CallbackContext context);

    /**
     * Finish a flow that stopped at the selection step because the provider
     * listed more than one resource.
     */
    default CallbackResult completeSelection(User caller, PendingSelection selection, ProviderResource chosen) {
        throw new UnsupportedOperationException("Flow has no selection step");
    }
}
