package com.procflow.core.engine.event.impl;

import com.procflow.integration.contract.event.IProcFlowRunEventListener;
import com.procflow.integration.models.event.RunEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to several listeners. A failing listener is logged and skipped;
 * it never interrupts the run that emitted the event.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CompositeRunEventListener listeners = CompositeRunEventListener.withLogging()
 *     .addListener(event -> metrics.record(event));
 * }</pre>
 */
@Slf4j
public class CompositeRunEventListener implements IProcFlowRunEventListener {

    private final List<IProcFlowRunEventListener> listeners = new CopyOnWriteArrayList<>();

    public static CompositeRunEventListener create() {
        return new CompositeRunEventListener();
    }

    public static CompositeRunEventListener withLogging() {
        return new CompositeRunEventListener().addListener(new LoggingRunEventListener());
    }

    public CompositeRunEventListener addListener(IProcFlowRunEventListener listener) {
        listeners.add(listener);
        return this;
    }

    public List<IProcFlowRunEventListener> getListeners() {
        return List.copyOf(listeners);
    }

    @Override
    public void onEvent(RunEvent event) {
        for (IProcFlowRunEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Run event listener failed. listener={}, type={}, runId={}",
                        listener.getClass().getSimpleName(), event.getType(), event.getRunId(), e);
            }
        }
    }
}
