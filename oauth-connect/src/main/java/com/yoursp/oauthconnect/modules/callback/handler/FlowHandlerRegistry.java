package com.yoursp.oauthconnect.modules.callback.handler;

import com.yoursp.oauthconnect.modules.state.FlowKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flow kind → handler. Built once in {@code CallbackDispatcherConfig} and
 * shared by the callback dispatchers and the selection step.
 */
public class FlowHandlerRegistry {

    private final Map<FlowKind, FlowHandler> handlers;

    public FlowHandlerRegistry(Map<FlowKind, FlowHandler> handlers) {
        for (FlowKind kind : FlowKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new IllegalStateException("No FlowHandler registered for " + kind);
            }
        }
        this.handlers = new EnumMap<>(handlers);
    }

    public Optional<FlowHandler> find(FlowKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }
}
