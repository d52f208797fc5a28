package com.procflow.core.engine.rest;

import com.procflow.core.engine.rest.dto.ApiResponse;
import com.procflow.core.exception.ProcFlowEngineException;
import com.procflow.integration.exception.ProcFlowValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Maps engine failures to response envelopes.
 */
@Slf4j
final class ProcFlowApiErrors {

    static final String VALIDATION_FAILED = "VALIDATION_FAILED";

    private ProcFlowApiErrors() {}

    static <T> Mono<ResponseEntity<ApiResponse<T>>> toResponse(Throwable error, String fallbackCode, String runId) {
        if (error instanceof ProcFlowValidationException validation) {
            return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.error(validation.getMessage(), VALIDATION_FAILED, validation.getErrors())));
        }
        if (error instanceof ProcFlowEngineException engine) {
            int status = engine.getErrorInfo().getHttpStatus().getCode();
            if (status >= 500) {
                log.error("Engine error: runId={}, code={}", runId, engine.getErrorInfo().getErrorCode(), engine);
            } else {
                log.debug("Request rejected: runId={}, code={}, error={}", runId, engine.getErrorInfo().getErrorCode(), engine.getMessage());
            }
            return Mono.just(ResponseEntity.status(status)
                    .body(ApiResponse.error(engine.getMessage(), engine.getErrorInfo().getErrorCode())));
        }
        log.error("Unexpected error: runId={}, code={}", runId, fallbackCode, error);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(error.getMessage(), fallbackCode)));
    }
}
