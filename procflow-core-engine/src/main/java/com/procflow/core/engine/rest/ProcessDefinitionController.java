package com.procflow.core.engine.rest;

import com.procflow.core.engine.IProcFlowFacade;
import com.procflow.core.engine.rest.dto.ApiResponse;
import com.procflow.integration.models.workflow.DefinitionValidationResult;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Dry-run validation of workflow definitions. An invalid definition is still a successful
 * call; the errors and warnings are in the payload.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/definitions")
@RequiredArgsConstructor
public class ProcessDefinitionController {

    private final IProcFlowFacade facade;

    @PostMapping(value = "/validate", produces = MediaType.APPLICATION_JSON_VALUE, consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<DefinitionValidationResult>>> validate(@RequestBody WorkflowDefinition definition) {
        log.debug("Validating definition: definitionId={}", definition == null ? null : definition.getId());

        return facade.validateDefinition(definition)
                .map(result -> ResponseEntity.ok(ApiResponse.success(result)))
                .onErrorResume(e -> ProcFlowApiErrors.toResponse(e, "VALIDATE_DEFINITION_FAILED", null));
    }
}
