package com.procflow.core.engine.support;

import com.procflow.integration.contract.event.IProcFlowRunEventListener;
import com.procflow.integration.enumerations.ProcFlowRunEventType;
import com.procflow.integration.models.event.RunEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingRunEventListener implements IProcFlowRunEventListener {

    private final List<RunEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(RunEvent event) {
        events.add(event);
    }

    public List<RunEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<ProcFlowRunEventType> types(String runId) {
        return events.stream()
                .filter(event -> runId.equals(event.getRunId()))
                .map(RunEvent::getType)
                .toList();
    }
}
