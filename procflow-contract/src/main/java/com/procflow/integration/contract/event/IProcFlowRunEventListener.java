package com.procflow.integration.contract.event;

import com.procflow.integration.models.event.RunEvent;

/**
 * Receives run lifecycle events. Listeners are called synchronously on the walking thread
 * and must not block.
 */
@FunctionalInterface
public interface IProcFlowRunEventListener {

    void onEvent(RunEvent event);
}
