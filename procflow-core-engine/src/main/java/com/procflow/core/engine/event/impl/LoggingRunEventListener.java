package com.procflow.core.engine.event.impl;

import com.procflow.integration.contract.event.IProcFlowRunEventListener;
import com.procflow.integration.models.event.RunEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes every run event to the log. Run lifecycle events go to INFO, step events to DEBUG,
 * failures to WARN.
 */
@Slf4j
public class LoggingRunEventListener implements IProcFlowRunEventListener {

    @Override
    public void onEvent(RunEvent event) {
        switch (event.getType()) {
            case STEP_STARTED:
            case STEP_SUCCEEDED:
            case STEP_SKIPPED:
            case STEP_SUSPENDED:
                log.debug("Run event. type={}, runId={}, nodeId={}, data={}",
                        event.getType(), event.getRunId(), event.getNodeId(), event.getData());
                break;
            case STEP_FAILED:
            case RUN_FAILED:
                log.warn("Run event. type={}, runId={}, nodeId={}, data={}",
                        event.getType(), event.getRunId(), event.getNodeId(), event.getData());
                break;
            default:
                log.info("Run event. type={}, runId={}, nodeId={}, data={}",
                        event.getType(), event.getRunId(), event.getNodeId(), event.getData());
        }
    }
}
