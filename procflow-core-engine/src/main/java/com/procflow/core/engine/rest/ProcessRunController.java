package com.procflow.core.engine.rest;

import com.procflow.core.engine.IProcFlowFacade;
import com.procflow.core.engine.rest.dto.ApiResponse;
import com.procflow.core.engine.rest.dto.ResumeRunRequest;
import com.procflow.core.engine.rest.dto.RunStateDto;
import com.procflow.core.engine.rest.dto.StartRunRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST surface for workflow runs.
 *
 * <h2>API Endpoints</h2>
 * <table border="1">
 *   <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 *   <tr><td>POST</td><td>/api/v1/runs</td><td>Start a run and walk it until it stops</td></tr>
 *   <tr><td>GET</td><td>/api/v1/runs/{runId}</td><td>Run state with trace and approvals</td></tr>
 *   <tr><td>POST</td><td>/api/v1/runs/{runId}/approvals/{nodeId}</td><td>Submit a reviewer decision</td></tr>
 *   <tr><td>POST</td><td>/api/v1/runs/{runId}/cancel</td><td>Cancel a running or suspended run</td></tr>
 * </table>
 *
 * <p>Every run endpoint answers with the run as it stands after the call: COMPLETED, FAILED,
 * CANCELLED or SUSPENDED.</p>
 *
 * @see IProcFlowFacade
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
public class ProcessRunController {

    private final IProcFlowFacade facade;

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE, consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<RunStateDto>>> startRun(@Valid @RequestBody StartRunRequest request) {
        log.info("Starting run: runId={}, definitionId={}",
                request.getRunId(), request.getDefinition() == null ? null : request.getDefinition().getId());

        var started = request.getRunId() == null || request.getRunId().isBlank()
                ? facade.startRun(request.getDefinition(), request.getTriggerInput())
                : facade.startRun(request.getRunId(), request.getDefinition(), request.getTriggerInput());

        return started
                .map(state -> ResponseEntity.ok(ApiResponse.success(RunStateDto.fromState(state))))
                .onErrorResume(e -> ProcFlowApiErrors.toResponse(e, "START_RUN_FAILED", request.getRunId()));
    }

    @GetMapping(value = "/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<RunStateDto>>> getRun(@PathVariable String runId) {
        log.debug("Getting run: runId={}", runId);

        return facade.getRunState(runId)
                .map(state -> ResponseEntity.ok(ApiResponse.success(RunStateDto.fromState(state))))
                .onErrorResume(e -> ProcFlowApiErrors.toResponse(e, "GET_RUN_FAILED", runId));
    }

    /**
     * Feeds a reviewer decision into a suspended approval node. Deciding an approval that is
     * already resolved or closed leaves the run unchanged.
     */
    @PostMapping(value = "/{runId}/approvals/{nodeId}",
            produces = MediaType.APPLICATION_JSON_VALUE, consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<RunStateDto>>> resumeRun(
            @PathVariable String runId,
            @PathVariable String nodeId,
            @Valid @RequestBody ResumeRunRequest request) {

        log.info("Resuming run: runId={}, nodeId={}, decision={}", runId, nodeId, request.getDecision());

        return facade.resumeRun(runId, nodeId, request.toReviewDecision())
                .map(state -> ResponseEntity.ok(ApiResponse.success(RunStateDto.fromState(state))))
                .onErrorResume(e -> ProcFlowApiErrors.toResponse(e, "RESUME_RUN_FAILED", runId));
    }

    @PostMapping(value = "/{runId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<RunStateDto>>> cancelRun(@PathVariable String runId) {
        log.info("Cancelling run: runId={}", runId);

        return facade.cancelRun(runId)
                .map(state -> ResponseEntity.ok(ApiResponse.success(RunStateDto.fromState(state))))
                .onErrorResume(e -> ProcFlowApiErrors.toResponse(e, "CANCEL_RUN_FAILED", runId));
    }
}
