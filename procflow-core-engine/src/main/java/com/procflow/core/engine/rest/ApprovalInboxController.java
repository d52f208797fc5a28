package com.procflow.core.engine.rest;

import com.procflow.core.engine.IProcFlowFacade;
import com.procflow.core.engine.rest.dto.ApiResponse;
import com.procflow.integration.models.run.PendingApproval;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reviewer inbox: the open approvals a user may decide.
 *
 * <h2>API Endpoints</h2>
 * <table border="1">
 *   <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 *   <tr><td>GET</td><td>/api/v1/approvals?assignee={id}</td><td>Open approvals assigned or escalated to the user</td></tr>
 * </table>
 *
 * <p>Decisions are submitted through {@link ProcessRunController}.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/approvals")
@RequiredArgsConstructor
public class ApprovalInboxController {

    static final String ASSIGNEE_REQUIRED = "ASSIGNEE_REQUIRED";

    private final IProcFlowFacade facade;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<List<PendingApproval>>>> findOpenApprovals(
            @RequestParam(required = false) String assignee) {
        if (assignee == null || assignee.isBlank()) {
            return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.error("assignee is required", ASSIGNEE_REQUIRED)));
        }
        log.debug("Listing open approvals: assignee={}", assignee);

        return facade.findOpenApprovals(assignee)
                .collectList()
                .map(approvals -> ResponseEntity.ok(ApiResponse.success(approvals)))
                .onErrorResume(e -> ProcFlowApiErrors.toResponse(e, "LIST_APPROVALS_FAILED", null));
    }
}
